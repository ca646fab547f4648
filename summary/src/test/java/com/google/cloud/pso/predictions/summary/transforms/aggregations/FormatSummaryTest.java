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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import com.google.cloud.pso.predictions.common.errors.EmptySummaryException;
import org.apache.beam.sdk.testing.CoderProperties;
import org.apache.beam.sdk.util.CoderUtils;
import org.hamcrest.Matchers;
import org.junit.Test;

/** */
public class FormatSummaryTest {

  private final FormatSummary formatter = FormatSummary.of(MetricKeys.parse("log_loss,mse"));

  @Test
  public void testAverages() {
    var summary = formatter.apply(new MetricSums(new double[] {1.6, 1.0}, 4L));

    assertEquals(0.4, summary.getAverages().get("log_loss"), 1e-15);
    assertEquals(0.25, summary.getAverages().get("mse"), 0.0);
    assertEquals(4L, summary.getCount());
  }

  @Test
  public void testSummaryOrder() {
    var summary = formatter.apply(new MetricSums(new double[] {3.0, 6.0}, 3L));

    assertThat(summary.asMap().keySet(), contains("log_loss", "mse", "count"));
    assertThat(summary.asMap().values(), Matchers.<Object>contains(1.0, 2.0, 3L));
  }

  @Test
  public void testEmptySummaryFails() {
    var ex =
        assertThrows(EmptySummaryException.class, () -> formatter.apply(MetricSums.identity(2)));
    assertThat(ex, instanceOf(ArithmeticException.class));
  }

  @Test
  public void testNonFiniteAveragesFail() {
    var infiniteSums = new MetricSums(new double[] {Double.POSITIVE_INFINITY, 1.0}, 2L);
    var infinite = assertThrows(ArithmeticException.class, () -> formatter.apply(infiniteSums));
    assertEquals(
        "The average of metric log_loss is not a finite number: Infinity", infinite.getMessage());
    assertThrows(
        ArithmeticException.class,
        () -> formatter.apply(new MetricSums(new double[] {0.5, Double.NaN}, 2L)));
  }

  @Test
  public void testArityMismatch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> formatter.apply(new MetricSums(new double[] {1.0}, 1L)));
  }

  @Test
  public void testSummaryCoder() throws Exception {
    var summary = formatter.apply(new MetricSums(new double[] {0.3, 0.7}, 2L));

    CoderProperties.coderDecodeEncodeEqual(PredictionSummaryCoder.of(), summary);
    var decoded =
        CoderUtils.decodeFromByteArray(
            PredictionSummaryCoder.of(),
            CoderUtils.encodeToByteArray(PredictionSummaryCoder.of(), summary));
    assertThat(decoded.asMap().keySet(), contains("log_loss", "mse", "count"));
  }
}
