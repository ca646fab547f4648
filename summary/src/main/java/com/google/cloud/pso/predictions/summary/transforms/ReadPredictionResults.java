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

import com.google.cloud.pso.predictions.common.errors.RecordDecodeException;
import com.google.cloud.pso.predictions.common.formats.JsonRecordHandler;
import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import com.google.cloud.pso.predictions.common.formats.coder.PredictionRecordCoder;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the prediction results shards of a folder and decodes every line into a {@link
 * PredictionRecord}. A folder without result shards produces an empty collection. A line that is
 * not a JSON object fails its bundle, it is never dropped since that would alter the count of the
 * summary.
 */
public class ReadPredictionResults extends PTransform<PBegin, PCollection<PredictionRecord>> {

  private static final Logger LOG = LoggerFactory.getLogger(ReadPredictionResults.class);

  private final String predictionPath;

  ReadPredictionResults(String predictionPath) {
    this.predictionPath = predictionPath;
  }

  public static ReadPredictionResults from(String predictionPath) {
    return new ReadPredictionResults(predictionPath);
  }

  @Override
  public PCollection<PredictionRecord> expand(PBegin input) {
    var pattern = PredictionPaths.resultsPattern(predictionPath);
    LOG.info("Reading prediction results from {}", pattern);
    return input
        .apply(
            "ReadLines",
            TextIO.read().from(pattern).withEmptyMatchTreatment(EmptyMatchTreatment.ALLOW))
        .apply("DecodeJson", ParDo.of(new DecodePredictionRecords()))
        .setCoder(PredictionRecordCoder.of());
  }

  static class DecodePredictionRecords extends DoFn<String, PredictionRecord> {

    private final Counter decodedRecords =
        Metrics.counter(ReadPredictionResults.class, "decoded_records");
    private transient JsonRecordHandler handler;

    @Setup
    public void setup() {
      handler = JsonRecordHandler.create();
    }

    @ProcessElement
    public void processElement(ProcessContext context) {
      try {
        context.output(handler.decode(context.element()));
        decodedRecords.inc();
      } catch (RecordDecodeException ex) {
        LOG.error("Errors occurred while decoding a prediction result line.", ex);
        throw ex;
      }
    }
  }
}
