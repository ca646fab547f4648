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
package com.google.cloud.pso.predictions.common.formats.coder;

import com.google.cloud.pso.predictions.common.formats.JsonRecordHandler;
import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CustomCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.values.TypeDescriptor;

/** Moves prediction records between stages as their original JSON text. */
public class PredictionRecordCoder extends CustomCoder<PredictionRecord> {

  private static final Coder<String> JSON_CODER = StringUtf8Coder.of();
  private static final JsonRecordHandler HANDLER = JsonRecordHandler.create();

  public static Coder<PredictionRecord> of(TypeDescriptor<PredictionRecord> ignored) {
    return of();
  }

  public static PredictionRecordCoder of() {
    return new PredictionRecordCoder();
  }

  @Override
  public void encode(PredictionRecord value, OutputStream outStream) throws IOException {
    JSON_CODER.encode(HANDLER.encode(value), outStream);
  }

  @Override
  public PredictionRecord decode(InputStream inStream) throws IOException {
    return HANDLER.decode(JSON_CODER.decode(inStream));
  }

  @Override
  public void verifyDeterministic() throws NonDeterministicException {
    JSON_CODER.verifyDeterministic();
  }
}
