// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

/**
 * Decides which logical thread of execution a profiled call belongs to.
 *
 * <p>When {@link #current()} returns {@code null} there is no current logical thread and the
 * profiler falls back to its single global call stack.
 */
public abstract class LogicalThreadContext {

  private static final LogicalThreadContext NONE =
      new LogicalThreadContext() {
        @Override
        public CallStack current() {
          return null;
        }
      };

  /** One logical thread per Java thread. */
  public static LogicalThreadContext perThread() {
    return new PerThread();
  }

  /** Logical threads are entered explicitly, see {@link Explicit#enter(CallStack)}. */
  public static Explicit explicit() {
    return new Explicit();
  }

  /** No logical threads; every call uses the global call stack. */
  public static LogicalThreadContext none() {
    return NONE;
  }

  /** Returns the call stack of the current logical thread or {@code null} if there is none. */
  public abstract CallStack current();

  private static class PerThread extends LogicalThreadContext {

    private final ThreadLocal<CallStack> stacks = ThreadLocal.withInitial(CallStack::new);

    @Override
    public CallStack current() {
      return stacks.get();
    }
  }

  /**
   * Context where a task binds its own {@link CallStack} for the duration of a scope. A task that
   * is suspended and resumed on another worker thread enters the same stack again.
   */
  public static class Explicit extends LogicalThreadContext {

    private final ThreadLocal<CallStack> entered = new ThreadLocal<>();

    private Explicit() {}

    @Override
    public CallStack current() {
      return entered.get();
    }

    public Scope enter(CallStack stack) {
      CallStack previous = entered.get();
      entered.set(stack);
      return new Scope(this, previous);
    }

    private void exit(CallStack previous) {
      if (previous == null) {
        entered.remove();
      } else {
        entered.set(previous);
      }
    }
  }

  /** Restores the previously entered logical thread on close. */
  public static class Scope implements AutoCloseable {

    private final Explicit context;
    private final CallStack previous;
    private boolean closed = false;

    private Scope(Explicit context, CallStack previous) {
      this.context = context;
      this.previous = previous;
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        context.exit(previous);
      }
    }
  }
}
