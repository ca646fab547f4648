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

import com.google.common.base.Preconditions;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CoderRegistry;
import org.apache.beam.sdk.transforms.Combine;

/**
 * Sums metric tuples position by position. Since {@link MetricSums#merge(MetricSums)} is
 * associative and commutative the runner is free to split the input in any number of bundles,
 * combine them in any order and merge the partial results hierarchically. An empty input results
 * in the all zero identity, with a count of zero.
 */
public class SumMetricsFn extends Combine.CombineFn<MetricSums, MetricSums, MetricSums> {

  private final int arity;

  SumMetricsFn(int arity) {
    this.arity = arity;
  }

  public static SumMetricsFn of(int arity) {
    Preconditions.checkArgument(arity > 0, "At least one metric is needed to sum.");
    return new SumMetricsFn(arity);
  }

  @Override
  public MetricSums createAccumulator() {
    return MetricSums.identity(arity);
  }

  @Override
  public MetricSums addInput(MetricSums accumulator, MetricSums input) {
    return accumulator.merge(input);
  }

  @Override
  public MetricSums mergeAccumulators(Iterable<MetricSums> accumulators) {
    var merged = createAccumulator();
    for (var accumulator : accumulators) {
      merged = merged.merge(accumulator);
    }
    return merged;
  }

  @Override
  public MetricSums extractOutput(MetricSums accumulator) {
    return accumulator;
  }

  @Override
  public Coder<MetricSums> getAccumulatorCoder(
      CoderRegistry registry, Coder<MetricSums> inputCoder) {
    return MetricSumsCoder.of();
  }

  @Override
  public Coder<MetricSums> getDefaultOutputCoder(
      CoderRegistry registry, Coder<MetricSums> inputCoder) {
    return MetricSumsCoder.of();
  }
}
