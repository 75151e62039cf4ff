// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils.timing;

import com.calltree.errors.Unreachable;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/** Source of elapsed time for {@link Timer}s. A profiler never mixes two kinds of clocks. */
public abstract class Clock {

  public enum Kind {
    CPU,
    WALL
  }

  private static final Clock WALL =
      new Clock() {
        @Override
        public long nanoTime() {
          return System.nanoTime();
        }

        @Override
        public Kind getKind() {
          return Kind.WALL;
        }
      };

  protected Clock() {}

  /**
   * CPU time consumed by the calling thread.
   *
   * @throws UnsupportedOperationException if the JVM cannot measure thread CPU time.
   */
  public static Clock cpu() {
    ThreadMXBean threadMXBean = ManagementFactory.getThreadMXBean();
    if (!threadMXBean.isCurrentThreadCpuTimeSupported()) {
      throw new UnsupportedOperationException("Thread CPU time is not supported by this JVM");
    }
    if (!threadMXBean.isThreadCpuTimeEnabled()) {
      threadMXBean.setThreadCpuTimeEnabled(true);
    }
    return new Clock() {
      @Override
      public long nanoTime() {
        return threadMXBean.getCurrentThreadCpuTime();
      }

      @Override
      public Kind getKind() {
        return Kind.CPU;
      }
    };
  }

  /** Monotonic wall clock time. */
  public static Clock wall() {
    return WALL;
  }

  public static boolean isCpuTimeSupported() {
    return ManagementFactory.getThreadMXBean().isCurrentThreadCpuTimeSupported();
  }

  /** Returns the clock of the given kind; CPU falls back to the wall clock where unsupported. */
  public static Clock of(Kind kind) {
    switch (kind) {
      case CPU:
        return isCpuTimeSupported() ? cpu() : wall();
      case WALL:
        return wall();
      default:
        throw new Unreachable("Unexpected clock kind: " + kind);
    }
  }

  public abstract long nanoTime();

  public abstract Kind getKind();

  public static double nanosToMs(long nanos) {
    return nanos / 1_000_000.0;
  }
}
