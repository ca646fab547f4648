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
package com.google.cloud.pso.predictions.common.formats;

import com.google.cloud.pso.predictions.common.formats.coder.PredictionRecordCoder;
import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.apache.beam.sdk.coders.DefaultCoder;

/**
 * One instance of a batch prediction result, decoded from a single JSON line. The record is an
 * immutable view over the decoded object: nested objects are exposed as maps and arrays as lists.
 *
 * <p>The typed accessors take a dotted property path, where numeric segments index into arrays, so
 * {@code scores.1} reads the second element of the {@code scores} array and {@code meta.label}
 * reads the {@code label} property of the nested {@code meta} object.
 */
@DefaultCoder(PredictionRecordCoder.class)
public class PredictionRecord {

  private final String json;
  private final Map<String, Object> fields;

  PredictionRecord(String json, Map<String, Object> fields) {
    this.json = json;
    this.fields = Collections.unmodifiableMap(fields);
  }

  /** The JSON text this record was decoded from. */
  public String getJson() {
    return json;
  }

  public Map<String, Object> getFields() {
    return fields;
  }

  public boolean has(String propertyPath) {
    return lookup(propertyPath).isPresent();
  }

  /**
   * Returns the raw value found at the provided path.
   *
   * @param propertyPath a dotted property path
   * @return the value, which may be a map, a list, a number, a string, a boolean or null
   * @throws IllegalArgumentException when the path does not exist in this record
   */
  public Object value(String propertyPath) {
    return lookup(propertyPath)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format(
                        "Property %s is not present in the prediction record (%s).",
                        propertyPath, json)))
        .value();
  }

  public Double doubleValue(String propertyPath) {
    var value = value(propertyPath);
    if (value instanceof Number number) {
      return number.doubleValue();
    } else if (value instanceof String str) {
      try {
        return Double.parseDouble(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            String.format("Property %s does not contain a numeric value: %s", propertyPath, str),
            ex);
      }
    }
    throw new IllegalArgumentException(
        String.format("Property %s does not contain a numeric value: %s", propertyPath, value));
  }

  public Long longValue(String propertyPath) {
    var value = value(propertyPath);
    if (value instanceof Number number) {
      return number.longValue();
    } else if (value instanceof String str) {
      try {
        return Long.parseLong(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            String.format("Property %s does not contain an integer value: %s", propertyPath, str),
            ex);
      }
    }
    throw new IllegalArgumentException(
        String.format("Property %s does not contain an integer value: %s", propertyPath, value));
  }

  public String stringValue(String propertyPath) {
    return Objects.toString(value(propertyPath), null);
  }

  // wraps the found value, since a JSON null is a legit value for a present property
  record Found(Object value) {}

  Optional<Found> lookup(String propertyPath) {
    Preconditions.checkArgument(
        propertyPath != null && !propertyPath.isBlank(), "A property path is required.");
    return extractDataWalker(
        new Found(fields),
        propertyPath,
        (found, propName) -> navigate(found.value(), propName),
        (found, propName) -> navigate(found.value(), propName));
  }

  @SuppressWarnings("unchecked")
  static Optional<Found> navigate(Object container, String propName) {
    if (container instanceof Map) {
      var map = (Map<String, Object>) container;
      return map.containsKey(propName)
          ? Optional.of(new Found(map.get(propName)))
          : Optional.empty();
    } else if (container instanceof List<?> list) {
      try {
        var index = Integer.parseInt(propName);
        return index >= 0 && index < list.size()
            ? Optional.of(new Found(list.get(index)))
            : Optional.empty();
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static <In, Res> Optional<Res> extractDataWalker(
      In input,
      String propertyName,
      BiFunction<In, String, Optional<In>> navigator,
      BiFunction<In, String, Optional<Res>> extractor) {
    var propertyNameParts = propertyName.split("\\.");
    var propName = propertyNameParts[0];
    if (propertyNameParts.length > 1) {
      return navigator
          .apply(input, propName)
          .flatMap(
              next ->
                  extractDataWalker(
                      next,
                      Arrays.stream(propertyNameParts).skip(1).collect(Collectors.joining(".")),
                      navigator,
                      extractor));
    }
    return extractor.apply(input, propName);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PredictionRecord other)) {
      return false;
    }
    return fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "PredictionRecord" + json;
  }
}
