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

/**
 * Raised when a summary is requested over zero records. Averages are undefined in that case and
 * the job fails instead of writing NaN values.
 */
public class EmptySummaryException extends ArithmeticException {

  private static final long serialVersionUID = 1L;

  public EmptySummaryException(String message) {
    super(message);
  }
}
