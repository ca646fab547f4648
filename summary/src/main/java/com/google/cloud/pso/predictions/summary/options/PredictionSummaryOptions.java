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
package com.google.cloud.pso.predictions.summary.options;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.Validation;

/** Defines the options to configure when summarizing batch prediction results. */
public interface PredictionSummaryOptions extends PipelineOptions {

  @Description(
      "The folder that contains the batch prediction results, as "
          + "prediction.results-NNNNN-of-NNNNN files in the JSON lines format. The summary is "
          + "written in the same folder as prediction.summary.json.")
  @Validation.Required
  String getPredictionPath();

  void setPredictionPath(String value);

  @Description(
      "Comma separated keys of the aggregated metrics in the summary output. Their order and "
          + "amount must match the values returned by the metric function. The summary has an "
          + "additional key, 'count', with the total number of instances, so the keys should not "
          + "include 'count'.")
  @Validation.Required
  String getMetricKeys();

  void setMetricKeys(String value);

  @Description(
      "Fully qualified class name of the metric function to apply on every instance, it should "
          + "implement MetricFn and have a public no-args constructor.")
  String getMetricFnClassName();

  void setMetricFnClassName(String value);

  @Description(
      "A Base64 encoded, Java serialized, metric function to apply on every instance, as "
          + "returned by MetricFns.encode. Can not be used together with metricFnClassName.")
  String getMetricFnEncoded();

  void setMetricFnEncoded(String value);

  @Description(
      "Fan-out of the intermediate combine step used when summing the metrics, 0 disables it.")
  @Default.Integer(0)
  Integer getSummaryCombineFanout();

  void setSummaryCombineFanout(Integer value);
}
