// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils;

import java.util.List;
import java.util.Locale;

public class StringUtils {

  public static final String LINE_SEPARATOR = "\n";

  public static String joinLines(List<String> lines) {
    return String.join(LINE_SEPARATOR, lines);
  }

  public static String indent(int depth) {
    return "  ".repeat(depth * 2);
  }

  public static String prettyMs(double ms) {
    return String.format(Locale.ROOT, "%.1f", ms);
  }
}
