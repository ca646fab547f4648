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
import java.util.List;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CustomCoder;
import org.apache.beam.sdk.coders.DoubleCoder;
import org.apache.beam.sdk.coders.ListCoder;
import org.apache.beam.sdk.coders.VarLongCoder;
import org.apache.beam.sdk.values.TypeDescriptor;

/** Coder for the partial metric sums exchanged between combine stages. */
public class MetricSumsCoder extends CustomCoder<MetricSums> {

  private static final Coder<List<Double>> SUMS_CODER = ListCoder.of(DoubleCoder.of());
  private static final Coder<Long> COUNT_CODER = VarLongCoder.of();

  public static Coder<MetricSums> of(TypeDescriptor<MetricSums> ignored) {
    return of();
  }

  public static MetricSumsCoder of() {
    return new MetricSumsCoder();
  }

  @Override
  public void encode(MetricSums value, OutputStream outStream) throws IOException {
    SUMS_CODER.encode(value.getSums(), outStream);
    COUNT_CODER.encode(value.getCount(), outStream);
  }

  @Override
  public MetricSums decode(InputStream inStream) throws IOException {
    var sums = SUMS_CODER.decode(inStream);
    var count = COUNT_CODER.decode(inStream);
    return new MetricSums(sums.stream().mapToDouble(Double::doubleValue).toArray(), count);
  }
}
