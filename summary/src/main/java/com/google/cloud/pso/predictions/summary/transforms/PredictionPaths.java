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

/** Locations of the prediction results and of their summary inside a prediction folder. */
public class PredictionPaths {

  public static final String RESULTS_FILE_PATTERN = "prediction.results-*-of-*";
  public static final String SUMMARY_FILE_NAME = "prediction.summary.json";

  PredictionPaths() {}

  public static String resultsPattern(String predictionPath) {
    return resolve(predictionPath, RESULTS_FILE_PATTERN);
  }

  public static String summaryPath(String predictionPath) {
    return resolve(predictionPath, SUMMARY_FILE_NAME);
  }

  static String resolve(String folder, String fileName) {
    if (folder == null || folder.isBlank()) {
      throw new IllegalArgumentException("A prediction path is required.");
    }
    return folder.endsWith("/") ? folder + fileName : folder + "/" + fileName;
  }
}
