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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.pso.predictions.summary.transforms.aggregations.PredictionSummary;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PDone;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the summary as a single JSON object into the {@code prediction.summary.json} file of the
 * prediction folder, without any shard suffix. An existing summary file is replaced.
 */
public class WriteSummary extends PTransform<PCollection<PredictionSummary>, PDone> {

  private static final Logger LOG = LoggerFactory.getLogger(WriteSummary.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String predictionPath;

  WriteSummary(String predictionPath) {
    this.predictionPath = predictionPath;
  }

  public static WriteSummary to(String predictionPath) {
    return new WriteSummary(predictionPath);
  }

  @Override
  public PDone expand(PCollection<PredictionSummary> input) {
    var summaryPath = PredictionPaths.summaryPath(predictionPath);
    LOG.info("Writing prediction summary to {}", summaryPath);
    return input
        .apply("EncodeJson", MapElements.into(TypeDescriptors.strings()).via(WriteSummary::toJson))
        .apply("WriteJson", TextIO.write().to(summaryPath).withoutSharding());
  }

  public static String toJson(PredictionSummary summary) {
    try {
      return MAPPER.writeValueAsString(summary.asMap());
    } catch (JsonProcessingException ex) {
      throw new RuntimeException("Problems while trying to encode the summary " + summary, ex);
    }
  }
}
