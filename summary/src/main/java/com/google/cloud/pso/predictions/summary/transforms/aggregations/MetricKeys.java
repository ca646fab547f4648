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

import com.google.cloud.pso.predictions.common.errors.ConfigurationException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

/**
 * The ordered names of the metrics computed by the metric function. They define both the size of
 * every metric tuple and the order of the fields in the summary.
 */
public record MetricKeys(List<String> names) implements Serializable {

  /** Summary field holding the number of summarized instances. */
  public static final String COUNT_KEY = "count";

  public MetricKeys {
    if (names == null || names.isEmpty()) {
      throw new ConfigurationException("At least one metric key is required.");
    }
    var seen = new HashSet<String>();
    for (var name : names) {
      if (name == null || name.isBlank()) {
        throw new ConfigurationException("Metric keys can not be empty: " + names);
      }
      if (COUNT_KEY.equals(name)) {
        throw new ConfigurationException(
            "Metric keys should not include '" + COUNT_KEY + "', it is reserved: " + names);
      }
      if (!seen.add(name)) {
        throw new ConfigurationException("Metric key " + name + " is repeated: " + names);
      }
    }
    names = List.copyOf(names);
  }

  /**
   * Parses a comma separated list of metric keys, surrounding whitespace is ignored.
   *
   * @param commaSeparatedKeys the keys as provided in the job options
   * @return the validated metric keys
   * @throws ConfigurationException when the keys are empty, repeated or include {@code count}
   */
  public static MetricKeys parse(String commaSeparatedKeys) {
    if (commaSeparatedKeys == null || commaSeparatedKeys.isBlank()) {
      throw new ConfigurationException("At least one metric key is required.");
    }
    return new MetricKeys(
        Arrays.stream(commaSeparatedKeys.split(",", -1)).map(String::trim).toList());
  }

  public int size() {
    return names.size();
  }

  public String get(int position) {
    return names.get(position);
  }
}
