/*
 * Copyright (C) 2023 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package com.google.cloud.pso.predictions.metrics;

import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import java.util.List;

/**
 * Computes the log loss and the squared error of a binary classification instance, to be summarized
 * with the metric keys {@code log_loss,mse}.
 *
 * <p>The expected label is read from the {@code input_label} property when present, otherwise from
 * the first comma separated field of the {@code inputs} property. The predicted class is read from
 * {@code classes} and the positive class probability from the second position of {@code scores}.
 */
public class BinaryClassificationMetricFn implements MetricFn {

  private static final long serialVersionUID = 1L;

  static final String LABEL_PROPERTY = "input_label";
  static final String INPUTS_PROPERTY = "inputs";
  static final String CLASSES_PROPERTY = "classes";
  static final String POSITIVE_SCORE_PROPERTY = "scores.1";

  @Override
  public List<Double> apply(PredictionRecord record) throws RuntimeException {
    var label = label(record);
    var predictedClass = record.doubleValue(CLASSES_PROPERTY);
    var prediction = record.doubleValue(POSITIVE_SCORE_PROPERTY);
    var logLoss =
        Math.log(1 + Math.exp(-(label * 2 - 1) * Math.log(prediction / (1 - prediction))));
    var squaredError = Math.pow(predictedClass - label, 2);
    return List.of(logLoss, squaredError);
  }

  static double label(PredictionRecord record) {
    if (record.has(LABEL_PROPERTY)) {
      return record.doubleValue(LABEL_PROPERTY);
    }
    var inputs = record.stringValue(INPUTS_PROPERTY);
    if (inputs == null) {
      throw new IllegalArgumentException(
          "The prediction record does not contain a label: " + record.getJson());
    }
    var firstField = inputs.split(",", 2)[0].trim();
    try {
      return Double.parseDouble(firstField);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          "The first field of the inputs is not a numeric label: " + inputs, ex);
    }
  }
}
