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
package com.google.cloud.pso.predictions.summary;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.pso.predictions.common.errors.ConfigurationException;
import com.google.cloud.pso.predictions.common.errors.EmptySummaryException;
import com.google.cloud.pso.predictions.common.errors.RecordDecodeException;
import com.google.cloud.pso.predictions.metrics.MetricFn;
import com.google.cloud.pso.predictions.metrics.MetricFns;
import com.google.cloud.pso.predictions.summary.options.PredictionSummaryOptions;
import com.google.common.base.Throwables;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Runs the whole summary job locally over prediction results stored in a temporary folder. */
public class PredictionSummaryPipelineTest {

  private static final Logger LOG = Logger.getLogger(PredictionSummaryPipelineTest.class.getName());
  private static final String BINARY_CLASSIFICATION =
      "com.google.cloud.pso.predictions.metrics.BinaryClassificationMetricFn";
  private static final double TOLERANCE = 1e-12;

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private File predictionFolder;

  @Before
  public void setUp() throws IOException {
    predictionFolder = temporaryFolder.newFolder("predictions");
  }

  private void writeShard(String name, String... lines) throws IOException {
    Files.write(
        new File(predictionFolder, name).toPath(), List.of(lines), StandardCharsets.UTF_8);
  }

  private void writeBinaryClassificationResults() throws IOException {
    writeShard(
        "prediction.results-00000-of-00002",
        "{\"inputs\": \"1,x,y,z\", \"classes\": 1, \"scores\": [0.1, 0.9]}",
        "{\"inputs\": \"0,o,m,g\", \"classes\": 0, \"scores\": [0.7, 0.3]}");
    writeShard(
        "prediction.results-00001-of-00002",
        "{\"inputs\": \"1,o,m,w\", \"classes\": 0, \"scores\": [0.6, 0.4]}",
        "{\"inputs\": \"1,b,r,b\", \"classes\": 1, \"scores\": [0.2, 0.8]}");
  }

  private PredictionSummaryOptions options(String... extraArgs) {
    var args = new ArrayList<String>();
    args.add("--predictionPath=" + predictionFolder.getAbsolutePath());
    args.add("--metricKeys=log_loss,mse");
    args.addAll(List.of(extraArgs));
    return PipelineOptionsFactory.fromArgs(args.toArray(String[]::new))
        .withValidation()
        .as(PredictionSummaryOptions.class);
  }

  private File summaryFile() {
    return new File(predictionFolder, "prediction.summary.json");
  }

  private String readSummaryText() throws IOException {
    return Files.readString(summaryFile().toPath(), StandardCharsets.UTF_8).trim();
  }

  private Map<String, Object> readSummary() throws IOException {
    return new ObjectMapper()
        .readValue(readSummaryText(), new TypeReference<LinkedHashMap<String, Object>>() {});
  }

  @Test
  public void testSummaryOfShardedResults() throws IOException {
    writeBinaryClassificationResults();

    var state =
        PredictionSummaryPipeline.create(options("--metricFnClassName=" + BINARY_CLASSIFICATION))
            .run();

    assertEquals(PipelineResult.State.DONE, state);
    var summary = readSummary();
    LOG.info("summary: " + summary);
    assertThat(summary.keySet(), contains("log_loss", "mse", "count"));
    assertEquals(0.4003674356962309, ((Number) summary.get("log_loss")).doubleValue(), TOLERANCE);
    assertEquals(0.25, ((Number) summary.get("mse")).doubleValue(), 0.0);
    assertEquals(4, summary.get("count"));
  }

  @Test
  public void testEncodedMetricFn() throws IOException {
    writeBinaryClassificationResults();
    MetricFn metricFn = record -> List.of(record.doubleValue("classes"), 0.0);

    PredictionSummaryPipeline.create(
            options("--metricFnEncoded=" + MetricFns.encode(metricFn)))
        .run();

    assertEquals("{\"log_loss\":0.5,\"mse\":0.0,\"count\":4}", readSummaryText());
  }

  @Test
  public void testRerunOverwritesTheSummary() throws IOException {
    writeBinaryClassificationResults();
    Files.writeString(summaryFile().toPath(), "{\"stale\": true}", StandardCharsets.UTF_8);
    var options = options("--metricFnClassName=" + BINARY_CLASSIFICATION);

    PredictionSummaryPipeline.create(options).run();
    var first = readSummaryText();
    PredictionSummaryPipeline.create(options).run();

    assertFalse(first.contains("stale"));
    assertEquals(first, readSummaryText());
  }

  @Test
  public void testEmptyInputFailsWithoutSummary() {
    var job =
        PredictionSummaryPipeline.create(options("--metricFnClassName=" + BINARY_CLASSIFICATION));

    var ex = assertThrows(Pipeline.PipelineExecutionException.class, () -> job.run());

    assertTrue(
        Throwables.getCausalChain(ex).stream()
            .anyMatch(cause -> cause instanceof EmptySummaryException));
    assertFalse(summaryFile().exists());
  }

  @Test
  public void testMalformedLineFailsWithoutSummary() throws IOException {
    writeShard(
        "prediction.results-00000-of-00001",
        "{\"inputs\": \"1,x,y,z\", \"classes\": 1, \"scores\": [0.1, 0.9]}",
        "{\"inputs\": \"1,x,y,z\", \"classes\": 1,");
    var job =
        PredictionSummaryPipeline.create(options("--metricFnClassName=" + BINARY_CLASSIFICATION));

    var ex = assertThrows(Pipeline.PipelineExecutionException.class, () -> job.run());

    assertTrue(
        Throwables.getCausalChain(ex).stream()
            .anyMatch(cause -> cause instanceof RecordDecodeException));
    assertFalse(summaryFile().exists());
  }

  @Test
  public void testInvalidConfigurationFailsAtStartup() throws IOException {
    writeBinaryClassificationResults();

    var reservedKey =
        PipelineOptionsFactory.fromArgs(
                "--predictionPath=" + predictionFolder.getAbsolutePath(),
                "--metricKeys=count,mse",
                "--metricFnClassName=" + BINARY_CLASSIFICATION)
            .as(PredictionSummaryOptions.class);
    assertThrows(ConfigurationException.class, () -> PredictionSummaryPipeline.create(reservedKey));

    assertThrows(
        ConfigurationException.class,
        () -> PredictionSummaryPipeline.create(options("--metricFnClassName=com.example.Missing")));
    assertThrows(ConfigurationException.class, () -> PredictionSummaryPipeline.create(options()));
    assertFalse(summaryFile().exists());
  }

  @Test
  public void testInjectedMetricFn() throws IOException {
    writeBinaryClassificationResults();
    var options =
        PipelineOptionsFactory.fromArgs(
                "--predictionPath=" + predictionFolder.getAbsolutePath(), "--metricKeys=score")
            .as(PredictionSummaryOptions.class);

    var job =
        PredictionSummaryPipeline.create(options, record -> List.of(record.doubleValue("scores.1")))
            .withLogger(org.slf4j.LoggerFactory.getLogger("summary-test"));

    assertEquals(List.of("score"), job.getMetricKeys().names());
    job.run();
    var summary = readSummary();
    assertEquals(0.6, ((Number) summary.get("score")).doubleValue(), TOLERANCE);
    assertEquals(4, summary.get("count"));
  }
}
