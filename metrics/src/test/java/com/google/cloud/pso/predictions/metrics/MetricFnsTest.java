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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.cloud.pso.predictions.common.errors.ConfigurationException;
import com.google.cloud.pso.predictions.common.formats.JsonRecordHandler;
import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import java.util.Base64;
import java.util.List;
import org.apache.beam.sdk.util.SerializableUtils;
import org.junit.Test;

/** */
public class MetricFnsTest {

  private static final PredictionRecord RECORD =
      JsonRecordHandler.create().decode("{\"classes\": 1, \"scores\": [0.2, 0.8]}");

  public static class ScoreMetricFn implements MetricFn {

    @Override
    public List<Double> apply(PredictionRecord record) {
      return List.of(record.doubleValue("scores.1"), record.doubleValue("classes"));
    }
  }

  public static class NoDefaultConstructorMetricFn implements MetricFn {

    private final double value;

    public NoDefaultConstructorMetricFn(double value) {
      this.value = value;
    }

    @Override
    public List<Double> apply(PredictionRecord record) {
      return List.of(value);
    }
  }

  public static class FailingConstructorMetricFn implements MetricFn {

    public FailingConstructorMetricFn() {
      throw new IllegalStateException("not today");
    }

    @Override
    public List<Double> apply(PredictionRecord record) {
      return List.of();
    }
  }

  @Test
  public void testLoadFromClassName() {
    var metricFn = MetricFns.load(ScoreMetricFn.class.getName(), null);

    assertTrue(metricFn instanceof ScoreMetricFn);
    assertEquals(List.of(0.8, 1.0), metricFn.apply(RECORD));
  }

  @Test
  public void testLoadFromEncoded() {
    MetricFn lambda = record -> List.of(record.doubleValue("scores.0") * 2);
    var encoded = MetricFns.encode(lambda);

    var metricFn = MetricFns.load("", encoded);

    assertEquals(List.of(0.4), metricFn.apply(RECORD));
  }

  @Test
  public void testEncodedAndClassNameAgree() {
    var fromClass = MetricFns.fromClassName(ScoreMetricFn.class.getName());
    var fromEncoded = MetricFns.fromEncoded(MetricFns.encode(new ScoreMetricFn()));

    assertEquals(fromClass.apply(RECORD), fromEncoded.apply(RECORD));
  }

  @Test
  public void testExactlyOneSourceIsRequired() {
    assertThrows(ConfigurationException.class, () -> MetricFns.load(null, null));
    assertThrows(ConfigurationException.class, () -> MetricFns.load(" ", ""));
    assertThrows(
        ConfigurationException.class,
        () -> MetricFns.load(ScoreMetricFn.class.getName(), MetricFns.encode(new ScoreMetricFn())));
  }

  @Test
  public void testInvalidClassNames() {
    assertThrows(
        ConfigurationException.class, () -> MetricFns.fromClassName("com.example.MissingFn"));
    assertThrows(
        ConfigurationException.class, () -> MetricFns.fromClassName(String.class.getName()));
    assertThrows(
        ConfigurationException.class,
        () -> MetricFns.fromClassName(NoDefaultConstructorMetricFn.class.getName()));
    assertThrows(
        ConfigurationException.class,
        () -> MetricFns.fromClassName(FailingConstructorMetricFn.class.getName()));
  }

  @Test
  public void testInvalidEncodedFunctions() {
    assertThrows(ConfigurationException.class, () -> MetricFns.fromEncoded("not base64 at all!"));
    var notSerialized = Base64.getEncoder().encodeToString(new byte[] {1, 2, 3});
    assertThrows(ConfigurationException.class, () -> MetricFns.fromEncoded(notSerialized));
    var notAFunction =
        Base64.getEncoder().encodeToString(SerializableUtils.serializeToByteArray("metric"));
    assertThrows(ConfigurationException.class, () -> MetricFns.fromEncoded(notAFunction));
    var nullFunction =
        Base64.getEncoder().encodeToString(SerializableUtils.serializeToByteArray(null));
    var ex =
        assertThrows(ConfigurationException.class, () -> MetricFns.fromEncoded(nullFunction));
    assertEquals("The encoded metric function decodes to null.", ex.getMessage());
  }
}
