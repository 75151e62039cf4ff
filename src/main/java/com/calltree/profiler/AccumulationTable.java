// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.google.common.collect.ImmutableMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;

/**
 * Cumulative milliseconds per {@link CallPath}. This is the only profiler state shared between
 * logical threads, all access is serialized on the table.
 */
public class AccumulationTable {

  // Linked to keep the order in which paths were first recorded.
  private final Object2DoubleLinkedOpenHashMap<CallPath> times =
      new Object2DoubleLinkedOpenHashMap<>();

  public synchronized void increase(CallPath path, double durationMs) {
    times.addTo(path, durationMs);
  }

  public synchronized double get(CallPath path) {
    return times.getDouble(path);
  }

  public synchronized boolean contains(CallPath path) {
    return times.containsKey(path);
  }

  public synchronized int size() {
    return times.size();
  }

  public synchronized void clear() {
    times.clear();
  }

  /** Copy of the table, in the order paths were first recorded. */
  public synchronized ImmutableMap<CallPath, Double> snapshot() {
    ImmutableMap.Builder<CallPath, Double> builder =
        ImmutableMap.builderWithExpectedSize(times.size());
    for (Object2DoubleMap.Entry<CallPath> entry : times.object2DoubleEntrySet()) {
      builder.put(entry.getKey(), entry.getDoubleValue());
    }
    return builder.build();
  }
}
