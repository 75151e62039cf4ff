// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.utils.StringUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Keeps report lines in memory instead of printing them. */
public class CollectingLineConsumer implements LineConsumer {

  private final List<String> lines = new ArrayList<>();

  @Override
  public synchronized void accept(String line) {
    lines.add(line);
  }

  public synchronized List<String> getLines() {
    return Collections.unmodifiableList(new ArrayList<>(lines));
  }

  @Override
  public synchronized String toString() {
    return StringUtils.joinLines(lines);
  }
}
