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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.beam.sdk.coders.DefaultCoder;

/**
 * The averaged metrics of a set of prediction instances, keyed by metric name in the configured
 * order, plus the number of instances they were computed from.
 */
@DefaultCoder(PredictionSummaryCoder.class)
public class PredictionSummary {

  private final Map<String, Double> averages;
  private final long count;

  PredictionSummary(Map<String, Double> averages, long count) {
    this.averages = Collections.unmodifiableMap(new LinkedHashMap<>(averages));
    this.count = count;
  }

  public Map<String, Double> getAverages() {
    return averages;
  }

  public long getCount() {
    return count;
  }

  /**
   * The summary as a single ordered mapping: every metric average followed by the {@code count}
   * entry.
   */
  public Map<String, Object> asMap() {
    var summary = new LinkedHashMap<String, Object>(averages);
    summary.put(MetricKeys.COUNT_KEY, count);
    return summary;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PredictionSummary other)) {
      return false;
    }
    return count == other.count && averages.equals(other.averages);
  }

  @Override
  public int hashCode() {
    return Objects.hash(averages, count);
  }

  @Override
  public String toString() {
    return "PredictionSummary" + asMap();
  }
}
