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
package com.google.cloud.pso.predictions.common.errors;

/** Raised when a line of a prediction results shard is not a valid JSON object. */
public class RecordDecodeException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private static final int MAX_LINE_PREFIX = 200;

  private final String linePrefix;

  public RecordDecodeException(String line, Throwable cause) {
    super("Problems while trying to decode prediction record: " + prefix(line), cause);
    this.linePrefix = prefix(line);
  }

  public String getLinePrefix() {
    return linePrefix;
  }

  static String prefix(String line) {
    if (line == null) {
      return "<null>";
    }
    return line.length() > MAX_LINE_PREFIX ? line.substring(0, MAX_LINE_PREFIX) + "..." : line;
  }
}
