// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils;

import java.util.function.Function;

public class SystemPropertyUtils {

  public static String getSystemPropertyOrEnvironmentVariable(
      String propertyName, String environmentVariableName) {
    String value = System.getProperty(propertyName);
    if (value != null) {
      return value;
    }
    return System.getenv(environmentVariableName);
  }

  public static int parseSystemPropertyOrDefault(String propertyName, int defaultValue) {
    return parseOrDefault(System.getProperty(propertyName), defaultValue);
  }

  public static <T> T applySystemProperty(
      String propertyName, Function<String, T> parser, T defaultValue) {
    String value = System.getProperty(propertyName);
    return value == null ? defaultValue : parser.apply(value);
  }

  public static int parseOrDefault(String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
