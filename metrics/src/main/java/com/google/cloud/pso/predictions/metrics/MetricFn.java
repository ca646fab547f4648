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
package com.google.cloud.pso.predictions.metrics;

import com.google.cloud.pso.predictions.common.formats.PredictionRecord;
import java.util.List;
import org.apache.beam.sdk.transforms.SerializableFunction;

/**
 * Computes the metrics of a single prediction instance. The returned list holds one value per
 * configured metric key, in the same order.
 *
 * <p>Implementations must be deterministic and free of side effects: runners invoke them
 * concurrently on many workers and may invoke them again for the same record after a failure.
 */
@FunctionalInterface
public interface MetricFn extends SerializableFunction<PredictionRecord, List<Double>> {

  /**
   * Computes the metrics for the given record.
   *
   * @param record The decoded prediction instance
   * @return the metric values, one per metric key
   * @throws RuntimeException If the record lacks the data the metrics need.
   */
  @Override
  List<Double> apply(PredictionRecord record) throws RuntimeException;
}
