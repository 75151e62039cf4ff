// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.ProfileOptions;
import com.calltree.errors.ProfilerInvariantError;
import com.calltree.utils.ThrowingSupplier;
import com.calltree.utils.timing.Clock;
import com.calltree.utils.timing.Timer;
import java.util.function.Supplier;

class ProfilerImpl extends Profiler {

  private final Clock clock;
  private final LogicalThreadContext logicalThreads;
  private final AccumulationTable table = new AccumulationTable();

  // Used by calls that do not belong to a logical thread.
  private final CallStack globalStack = new CallStack();

  ProfilerImpl(ProfileOptions options) {
    super(options);
    this.clock = options.getClock();
    this.logicalThreads = options.getLogicalThreadContext();
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  void clear() {
    table.clear();
  }

  @Override
  <T, E extends Exception> T profile(Supplier<String> bucket, ThrowingSupplier<T, E> body)
      throws E {
    if (!isRunning()) {
      return body.get();
    }
    String name = bucket.get();
    CallStack logicalThread = logicalThreads.current();
    CallStack stack = logicalThread != null ? logicalThread : globalStack;
    CallPath path = stack.enter(name);
    Timer timer =
        new Timer(path.toString(), clock, durationMs -> table.increase(path, durationMs));
    if (logicalThread != null) {
      logicalThread.pushTimer(timer);
    }
    timer.start();
    try {
      return body.get();
    } finally {
      try {
        timer.stop();
        if (logicalThread != null) {
          verifyActiveTimer(logicalThread, timer);
        }
      } finally {
        stack.exit();
      }
    }
  }

  private static void verifyActiveTimer(CallStack logicalThread, Timer expected) {
    Timer popped = logicalThread.popTimer();
    if (popped != expected) {
      throw new ProfilerInvariantError(
          "Unexpected timer at top of stack: "
              + (popped == null ? "<none>" : popped.getId())
              + "; expected: "
              + expected.getId());
    }
  }

  @Override
  public void increase(CallPath path, double durationMs) {
    table.increase(path, durationMs);
  }

  @Override
  public ProfileReport stopWithReport() {
    synchronized (this) {
      markStopped();
      return createReport();
    }
  }

  @Override
  public void reportWithoutStopping(LineConsumer consumer) {
    createReport().report(consumer);
  }

  private ProfileReport createReport() {
    return new ProfileReport(
        ProfileTree.reconstruct(table.snapshot()), options.getMinimumReportMs(), clock.getKind());
  }

  AccumulationTable getTable() {
    return table;
  }

  CallStack getGlobalStack() {
    return globalStack;
  }
}
