// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.utils.timing.Timer;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Live call path and active timers of one logical thread.
 *
 * <p>Operations are synchronized only so that the global stack, which is used when there is no
 * logical thread, stays consistent.
 */
public class CallStack {

  private final Deque<String> names = new ArrayDeque<>();
  private final Deque<Timer> timers = new ArrayDeque<>();

  /** Pushes {@code name} and returns a snapshot of the resulting path. */
  public synchronized CallPath enter(String name) {
    names.addLast(name);
    return currentPath();
  }

  public synchronized String exit() {
    return names.removeLast();
  }

  /** Snapshot of the live path. The stack must not be empty. */
  public synchronized CallPath currentPath() {
    return CallPath.of(names.toArray(new String[0]));
  }

  public synchronized boolean isEmpty() {
    return names.isEmpty();
  }

  public synchronized int size() {
    return names.size();
  }

  public synchronized void pushTimer(Timer timer) {
    timers.addLast(timer);
  }

  public synchronized Timer popTimer() {
    return timers.pollLast();
  }

  public synchronized boolean hasActiveTimers() {
    return !timers.isEmpty();
  }

  @Override
  public synchronized String toString() {
    return names.toString();
  }
}
