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
package com.google.cloud.pso.predictions.summary.transforms;

import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import com.google.cloud.pso.predictions.metrics.MetricFn;
import com.google.cloud.pso.predictions.metrics.transforms.EvaluateMetrics;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.FormatSummary;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.MetricKeys;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.MetricSums;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.MetricSumsCoder;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.PredictionSummary;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.PredictionSummaryCoder;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.SumMetricsFn;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.TypeDescriptor;

/**
 * Summarizes prediction records: computes the metrics of every record, pairs each metric tuple
 * with a count of one, sums all of them globally and finally averages the sums by the total count.
 */
public class MakeSummary
    extends PTransform<PCollection<PredictionRecord>, PCollection<PredictionSummary>> {

  private final MetricFn metricFn;
  private final MetricKeys metricKeys;
  private Integer combineFanout = 0;

  MakeSummary(MetricFn metricFn, MetricKeys metricKeys) {
    this.metricFn = metricFn;
    this.metricKeys = metricKeys;
  }

  public static MakeSummary create(MetricFn metricFn, MetricKeys metricKeys) {
    return new MakeSummary(metricFn, metricKeys);
  }

  /**
   * Adds an intermediate combine step with the given fan-out, useful when the amount of records is
   * large. The summary does not change.
   */
  public MakeSummary withCombineFanout(Integer fanout) {
    this.combineFanout = fanout;
    return this;
  }

  @Override
  public PCollection<PredictionSummary> expand(PCollection<PredictionRecord> input) {
    return input
        .apply("ApplyMetricFnPerInstance", EvaluateMetrics.create(metricFn, metricKeys.size()))
        .apply(
            "PairWith1", MapElements.into(TypeDescriptor.of(MetricSums.class)).via(MetricSums::of))
        .setCoder(MetricSumsCoder.of())
        .apply("SumTuple", sumTuples())
        .apply(
            "AverageAndMakeDict",
            MapElements.into(TypeDescriptor.of(PredictionSummary.class))
                .via(FormatSummary.of(metricKeys)))
        .setCoder(PredictionSummaryCoder.of());
  }

  Combine.Globally<MetricSums, MetricSums> sumTuples() {
    var sum = Combine.globally(SumMetricsFn.of(metricKeys.size()));
    if (combineFanout != null && combineFanout > 1) {
      sum = sum.withFanout(combineFanout);
    }
    return sum;
  }
}
