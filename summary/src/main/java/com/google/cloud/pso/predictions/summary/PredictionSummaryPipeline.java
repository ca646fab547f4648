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

import com.google.cloud.pso.predictions.metrics.MetricFn;
import com.google.cloud.pso.predictions.metrics.MetricFns;
import com.google.cloud.pso.predictions.summary.options.PredictionSummaryOptions;
import com.google.cloud.pso.predictions.summary.transforms.MakeSummary;
import com.google.cloud.pso.predictions.summary.transforms.PredictionPaths;
import com.google.cloud.pso.predictions.summary.transforms.ReadPredictionResults;
import com.google.cloud.pso.predictions.summary.transforms.WriteSummary;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.MetricKeys;
import com.google.common.base.Preconditions;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarizes the results of a batch prediction job. Every instance found in the {@code
 * prediction.results-NNNNN-of-NNNNN} files of the prediction folder is evaluated with the
 * configured metric function, the metrics are averaged over all the instances and written, together
 * with the amount of instances, as {@code prediction.summary.json} in the same folder.
 *
 * <p>Example, with the bundled binary classification metrics:
 *
 * <pre>
 *   --predictionPath=gs://bucket/predictions
 *   --metricFnClassName=com.google.cloud.pso.predictions.metrics.BinaryClassificationMetricFn
 *   --metricKeys=log_loss,mse
 *   --runner=DataflowRunner
 * </pre>
 *
 * The metric keys and the metric function are validated before the pipeline is created, so
 * configuration errors fail the job before any prediction result is read.
 */
public class PredictionSummaryPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(PredictionSummaryPipeline.class);

  private final PredictionSummaryOptions options;
  private final MetricKeys metricKeys;
  private final MetricFn metricFn;
  private Logger logger = LOG;

  PredictionSummaryPipeline(
      PredictionSummaryOptions options, MetricKeys metricKeys, MetricFn metricFn) {
    this.options = options;
    this.metricKeys = metricKeys;
    this.metricFn = metricFn;
  }

  /**
   * Creates the job using the metric function configured in the options.
   *
   * @param options the job options
   * @return the configured job
   * @throws com.google.cloud.pso.predictions.common.errors.ConfigurationException when the metric
   *     keys are invalid or the metric function can not be loaded
   */
  public static PredictionSummaryPipeline create(PredictionSummaryOptions options) {
    var metricKeys = MetricKeys.parse(options.getMetricKeys());
    var metricFn = MetricFns.load(options.getMetricFnClassName(), options.getMetricFnEncoded());
    return new PredictionSummaryPipeline(options, metricKeys, metricFn);
  }

  /** Creates the job using an already instantiated metric function. */
  public static PredictionSummaryPipeline create(
      PredictionSummaryOptions options, MetricFn metricFn) {
    Preconditions.checkNotNull(metricFn, "A metric function is required.");
    return new PredictionSummaryPipeline(
        options, MetricKeys.parse(options.getMetricKeys()), metricFn);
  }

  public PredictionSummaryPipeline withLogger(Logger logger) {
    this.logger = logger;
    return this;
  }

  public MetricKeys getMetricKeys() {
    return metricKeys;
  }

  public Pipeline build() {
    var predictionPath = options.getPredictionPath();
    var pipeline = Pipeline.create(options);
    pipeline
        .apply("ReadPredictionResult", ReadPredictionResults.from(predictionPath))
        .apply(
            "Summary",
            MakeSummary.create(metricFn, metricKeys)
                .withCombineFanout(options.getSummaryCombineFanout()))
        .apply("Write", WriteSummary.to(predictionPath));
    return pipeline;
  }

  /**
   * Runs the job and waits for it to finish.
   *
   * @return the final state of the job, always {@link PipelineResult.State#DONE}
   * @throws IllegalStateException when the runner reports the job finished without succeeding
   */
  public PipelineResult.State run() {
    var predictionPath = options.getPredictionPath();
    logger.info(
        "Summarizing {} with metrics {} into {}",
        PredictionPaths.resultsPattern(predictionPath),
        metricKeys.names(),
        PredictionPaths.summaryPath(predictionPath));
    var state = build().run().waitUntilFinish();
    if (state != PipelineResult.State.DONE) {
      throw new IllegalStateException(
          "The prediction summary job did not succeed, final state: " + state);
    }
    logger.info("Prediction summary written to {}", PredictionPaths.summaryPath(predictionPath));
    return state;
  }

  public static void main(String[] args) {
    PipelineOptionsFactory.register(PredictionSummaryOptions.class);
    var options =
        PipelineOptionsFactory.fromArgs(args).withValidation().as(PredictionSummaryOptions.class);
    create(options).run();
  }
}
