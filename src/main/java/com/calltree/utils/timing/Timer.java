// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils.timing;

import com.calltree.errors.ProfilerInvariantError;
import java.util.function.DoubleConsumer;

/**
 * Measures durations consisting of one or more start/stop segments.
 *
 * <p>A timer created with an {@code onStopped} callback reports the duration of every segment to
 * the callback when it is stopped. Without a callback the segments only add up in {@link
 * #totalMs()}.
 *
 * <p>Starting a running timer or stopping a stopped timer throws a {@link ProfilerInvariantError}.
 * With a CPU {@link Clock} a segment must be started and stopped on the same thread.
 */
public class Timer {

  private static final long NOT_RUNNING = -1;

  private final String id;
  private final Clock clock;
  private final DoubleConsumer onStopped;

  private long startTime = NOT_RUNNING;
  private long duration = 0;

  public Timer(String id, Clock clock) {
    this(id, clock, null);
  }

  public Timer(String id, Clock clock, DoubleConsumer onStopped) {
    this.id = id;
    this.clock = clock;
    this.onStopped = onStopped;
  }

  public String getId() {
    return id;
  }

  public boolean isRunning() {
    return startTime != NOT_RUNNING;
  }

  public void start() {
    if (isRunning()) {
      throw new ProfilerInvariantError("Can't start a running timer: " + id);
    }
    startTime = clock.nanoTime();
  }

  public void stop() {
    if (!isRunning()) {
      throw new ProfilerInvariantError("Can't stop a stopped timer: " + id);
    }
    long segment = clock.nanoTime() - startTime;
    startTime = NOT_RUNNING;
    duration += segment;
    if (onStopped != null) {
      onStopped.accept(Clock.nanosToMs(segment));
    }
  }

  /** Total of all completed segments in milliseconds. */
  public double totalMs() {
    return Clock.nanosToMs(duration);
  }

  @Override
  public String toString() {
    return id + ": " + totalMs();
  }
}
