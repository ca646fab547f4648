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

import com.google.cloud.pso.predictions.common.errors.ConfigurationException;
import java.lang.reflect.InvocationTargetException;
import java.util.Base64;
import java.util.Optional;
import org.apache.beam.sdk.util.SerializableUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the metric function of a job. A function can be provided as the name of a class
 * implementing {@link MetricFn} with a public no-args constructor, or as the Base64 encoding of a
 * Java serialized {@link MetricFn} instance (see {@link #encode(MetricFn)}).
 */
public class MetricFns {

  private static final Logger LOG = LoggerFactory.getLogger(MetricFns.class);

  MetricFns() {}

  /**
   * Loads the metric function from exactly one of the provided sources.
   *
   * @param className a fully qualified class name, may be null or blank
   * @param encoded an encoded metric function, may be null or blank
   * @return the loaded metric function
   * @throws ConfigurationException when none or both sources are provided, or when the function
   *     can not be loaded
   */
  public static MetricFn load(String className, String encoded) {
    var maybeClassName = Optional.ofNullable(className).filter(cName -> !cName.isBlank());
    var maybeEncoded = Optional.ofNullable(encoded).filter(enc -> !enc.isBlank());
    if (maybeClassName.isPresent() == maybeEncoded.isPresent()) {
      throw new ConfigurationException(
          "Exactly one of a metric function class name or an encoded metric function should be "
              + "provided.");
    }
    return maybeClassName.map(MetricFns::fromClassName).orElseGet(() -> fromEncoded(encoded));
  }

  public static MetricFn fromClassName(String className) {
    Class<?> clazz;
    try {
      clazz = Class.forName(className.trim(), true, MetricFns.class.getClassLoader());
    } catch (ClassNotFoundException ex) {
      LOG.error("Problems while loading the requested metric function class: " + className, ex);
      throw new ConfigurationException(
          "The metric function class " + className + " is unknown.", ex);
    }
    if (!MetricFn.class.isAssignableFrom(clazz)) {
      throw new ConfigurationException(
          "The class " + className + " does not implement " + MetricFn.class.getName());
    }
    try {
      return (MetricFn) clazz.getDeclaredConstructor().newInstance();
    } catch (IllegalAccessException
        | InstantiationException
        | NoSuchMethodException
        | SecurityException
        | InvocationTargetException ex) {
      LOG.error("Problems while instantiating the requested metric function: " + className, ex);
      throw new ConfigurationException(
          "The metric function class " + className + " could not be instantiated.", ex);
    }
  }

  public static MetricFn fromEncoded(String encoded) {
    Object decoded;
    try {
      decoded =
          SerializableUtils.deserializeFromByteArray(
              Base64.getDecoder().decode(encoded.trim()), "metric function");
    } catch (IllegalArgumentException ex) {
      LOG.error("Problems while decoding the provided metric function.", ex);
      throw new ConfigurationException("The encoded metric function could not be decoded.", ex);
    }
    if (decoded instanceof MetricFn metricFn) {
      return metricFn;
    }
    if (decoded == null) {
      throw new ConfigurationException("The encoded metric function decodes to null.");
    }
    throw new ConfigurationException(
        "The encoded object is not a metric function but a " + decoded.getClass().getName());
  }

  /**
   * Encodes a metric function so it can be passed to a job as a string option.
   *
   * @param metricFn the function to encode
   * @return the Base64 encoded, Java serialized function
   */
  public static String encode(MetricFn metricFn) {
    return Base64.getEncoder().encodeToString(SerializableUtils.serializeToByteArray(metricFn));
  }
}
