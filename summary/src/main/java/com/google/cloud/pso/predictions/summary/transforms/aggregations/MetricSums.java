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
import java.util.Arrays;
import java.util.List;
import org.apache.beam.sdk.coders.DefaultCoder;

/**
 * Per position sums of metric tuples together with the number of tuples added. A single record
 * contributes its metric tuple and a count of one ({@link #of(List)}); partial sums computed on
 * different workers are combined with {@link #merge(MetricSums)}, which is associative and
 * commutative and has {@link #identity(int)} as its neutral element.
 *
 * <p>Instances are immutable, merging returns a new instance.
 */
@DefaultCoder(MetricSumsCoder.class)
public final class MetricSums {

  private final double[] sums;
  private final long count;

  MetricSums(double[] sums, long count) {
    this.sums = sums;
    this.count = count;
  }

  /** All zero sums with no counted tuples. */
  public static MetricSums identity(int arity) {
    Preconditions.checkArgument(arity > 0, "Metric sums need at least one metric.");
    return new MetricSums(new double[arity], 0L);
  }

  /** The contribution of one metric tuple, paired with a count of one. */
  public static MetricSums of(List<Double> metricTuple) {
    Preconditions.checkArgument(
        metricTuple != null && !metricTuple.isEmpty(), "Metric tuples can not be empty.");
    return new MetricSums(metricTuple.stream().mapToDouble(Double::doubleValue).toArray(), 1L);
  }

  public MetricSums merge(MetricSums other) {
    Preconditions.checkArgument(
        sums.length == other.sums.length,
        "Can not merge metric sums of different sizes: %s and %s",
        sums.length,
        other.sums.length);
    var merged = new double[sums.length];
    for (int i = 0; i < sums.length; i++) {
      merged[i] = sums[i] + other.sums[i];
    }
    return new MetricSums(merged, count + other.count);
  }

  public int arity() {
    return sums.length;
  }

  public long getCount() {
    return count;
  }

  public double sum(int position) {
    return sums[position];
  }

  public List<Double> getSums() {
    return Arrays.stream(sums).boxed().toList();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MetricSums other)) {
      return false;
    }
    return count == other.count && Arrays.equals(sums, other.sums);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(sums) + Long.hashCode(count);
  }

  @Override
  public String toString() {
    return "MetricSums{sums=" + Arrays.toString(sums) + ", count=" + count + "}";
  }
}
