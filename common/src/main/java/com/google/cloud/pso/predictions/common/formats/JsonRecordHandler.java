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

import com.google.cloud.pso.predictions.common.errors.RecordDecodeException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Encodes and decodes {@link PredictionRecord} objects from their line delimited JSON form. */
public class JsonRecordHandler implements Serializable {

  private static final long serialVersionUID = 1L;
  private static final JsonRecordHandler INSTANCE = new JsonRecordHandler();
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  JsonRecordHandler() {}

  public static JsonRecordHandler create() {
    return INSTANCE;
  }

  /**
   * Decodes a single line into a prediction record. Anything that is not exactly one strict JSON
   * object fails, blank lines included. Unquoted names, single quoted strings and bare words are
   * not accepted.
   *
   * @param line the text of one line of a prediction results shard
   * @return the decoded record
   * @throws RecordDecodeException when the line is not a JSON object
   */
  @SuppressWarnings("unchecked")
  public PredictionRecord decode(String line) {
    Object decoded;
    try {
      decoded = MAPPER.readValue(line, Object.class);
    } catch (Exception ex) {
      throw new RecordDecodeException(line, ex);
    }
    if (!(decoded instanceof Map)) {
      throw new RecordDecodeException(
          line,
          new IllegalArgumentException("Expected a JSON object but found " + decoded));
    }
    return new PredictionRecord(line, (Map<String, Object>) decoded);
  }

  public PredictionRecord decode(byte[] encodedElement) {
    return decode(new String(encodedElement, StandardCharsets.UTF_8));
  }

  public String encode(PredictionRecord record) {
    return record.getJson();
  }
}
