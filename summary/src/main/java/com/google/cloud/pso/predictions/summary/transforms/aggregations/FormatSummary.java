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
package com.google.cloud.pso.predictions.summary.transforms.aggregations;

import com.google.cloud.pso.predictions.common.errors.EmptySummaryException;
import java.util.LinkedHashMap;
import org.apache.beam.sdk.transforms.SerializableFunction;

/**
 * Turns the final metric sums into a {@link PredictionSummary}: each metric key maps to the sum at
 * its position divided by the count of summarized instances.
 *
 * <p>A summary of zero instances has no defined averages, in that case an {@link
 * EmptySummaryException} is thrown instead of producing NaN values. Averages that are not finite,
 * because some metric tuple held an infinite or NaN value, fail with an {@link ArithmeticException}
 * since they have no JSON number representation.
 */
public class FormatSummary implements SerializableFunction<MetricSums, PredictionSummary> {

  private static final long serialVersionUID = 1L;

  private final MetricKeys metricKeys;

  FormatSummary(MetricKeys metricKeys) {
    this.metricKeys = metricKeys;
  }

  public static FormatSummary of(MetricKeys metricKeys) {
    return new FormatSummary(metricKeys);
  }

  @Override
  public PredictionSummary apply(MetricSums metricSums) {
    if (metricSums.arity() != metricKeys.size()) {
      throw new IllegalArgumentException(
          String.format(
              "The metric sums have %d values but %d metric keys are configured: %s",
              metricSums.arity(), metricKeys.size(), metricKeys.names()));
    }
    var count = metricSums.getCount();
    if (count == 0) {
      throw new EmptySummaryException(
          "No prediction instances were summarized, the averages of "
              + metricKeys.names()
              + " are undefined.");
    }
    var averages = new LinkedHashMap<String, Double>();
    for (int i = 0; i < metricKeys.size(); i++) {
      var average = metricSums.sum(i) / count;
      if (!Double.isFinite(average)) {
        throw new ArithmeticException(
            String.format(
                "The average of metric %s is not a finite number: %s", metricKeys.get(i), average));
      }
      averages.put(metricKeys.get(i), average);
    }
    return new PredictionSummary(averages, count);
  }
}
