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
package com.google.cloud.pso.predictions.metrics.transforms;

import com.google.cloud.pso.predictions.common.errors.ConfigurationException;
import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import com.google.cloud.pso.predictions.metrics.MetricFn;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Objects;
import org.apache.beam.sdk.coders.DoubleCoder;
import org.apache.beam.sdk.coders.ListCoder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;

/**
 * Applies the configured {@link MetricFn} to every prediction record. Every produced tuple must
 * have exactly the expected number of values; otherwise the job is misconfigured and the element
 * fails with a {@link ConfigurationException}, it is never skipped or padded.
 */
public class EvaluateMetrics
    extends PTransform<PCollection<PredictionRecord>, PCollection<List<Double>>> {

  private final MetricFn metricFn;
  private final int expectedSize;

  EvaluateMetrics(MetricFn metricFn, int expectedSize) {
    this.metricFn = metricFn;
    this.expectedSize = expectedSize;
  }

  public static EvaluateMetrics create(MetricFn metricFn, int expectedSize) {
    Preconditions.checkNotNull(metricFn, "A metric function is required.");
    Preconditions.checkArgument(expectedSize > 0, "At least one metric value is expected.");
    return new EvaluateMetrics(metricFn, expectedSize);
  }

  @Override
  public PCollection<List<Double>> expand(PCollection<PredictionRecord> input) {
    return input
        .apply("EvaluateMetricFn", ParDo.of(new EvaluateMetricsDoFn(metricFn, expectedSize)))
        .setCoder(ListCoder.of(DoubleCoder.of()));
  }

  static class EvaluateMetricsDoFn extends DoFn<PredictionRecord, List<Double>> {

    private final Counter evaluatedRecords =
        Metrics.counter(EvaluateMetrics.class, "evaluated_records");
    private final MetricFn metricFn;
    private final int expectedSize;

    public EvaluateMetricsDoFn(MetricFn metricFn, int expectedSize) {
      this.metricFn = metricFn;
      this.expectedSize = expectedSize;
    }

    @ProcessElement
    public void process(ProcessContext context) {
      context.output(checkTuple(metricFn.apply(context.element()), expectedSize));
      evaluatedRecords.inc();
    }
  }

  static List<Double> checkTuple(List<Double> tuple, int expectedSize) {
    if (tuple == null) {
      throw new ConfigurationException("The metric function returned no values.");
    }
    if (tuple.size() != expectedSize) {
      throw new ConfigurationException(
          String.format(
              "The metric function returned %d values but %d metric keys are configured.",
              tuple.size(), expectedSize));
    }
    if (tuple.stream().anyMatch(Objects::isNull)) {
      throw new ConfigurationException("The metric function returned null values: " + tuple);
    }
    return List.copyOf(tuple);
  }
}
