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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CustomCoder;
import org.apache.beam.sdk.coders.DoubleCoder;
import org.apache.beam.sdk.coders.ListCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.coders.VarLongCoder;
import org.apache.beam.sdk.values.TypeDescriptor;

/** Coder for a {@link PredictionSummary}, keeping the order of its metrics. */
public class PredictionSummaryCoder extends CustomCoder<PredictionSummary> {

  private static final Coder<List<String>> KEYS_CODER = ListCoder.of(StringUtf8Coder.of());
  private static final Coder<List<Double>> AVERAGES_CODER = ListCoder.of(DoubleCoder.of());
  private static final Coder<Long> COUNT_CODER = VarLongCoder.of();

  public static Coder<PredictionSummary> of(TypeDescriptor<PredictionSummary> ignored) {
    return of();
  }

  public static PredictionSummaryCoder of() {
    return new PredictionSummaryCoder();
  }

  @Override
  public void encode(PredictionSummary value, OutputStream outStream) throws IOException {
    KEYS_CODER.encode(new ArrayList<>(value.getAverages().keySet()), outStream);
    AVERAGES_CODER.encode(new ArrayList<>(value.getAverages().values()), outStream);
    COUNT_CODER.encode(value.getCount(), outStream);
  }

  @Override
  public PredictionSummary decode(InputStream inStream) throws IOException {
    var keys = KEYS_CODER.decode(inStream);
    var averages = AVERAGES_CODER.decode(inStream);
    var count = COUNT_CODER.decode(inStream);
    if (keys.size() != averages.size()) {
      throw new IOException(
          String.format(
              "Corrupted summary, %d keys and %d averages were decoded.",
              keys.size(), averages.size()));
    }
    var mapped = new LinkedHashMap<String, Double>();
    for (int i = 0; i < keys.size(); i++) {
      mapped.put(keys.get(i), averages.get(i));
    }
    return new PredictionSummary(mapped, count);
  }
}
