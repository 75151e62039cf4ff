// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.ProfileOptions;
import com.calltree.errors.ProfilerInvariantError;
import com.calltree.utils.ThrowingAction;
import com.calltree.utils.ThrowingBiFunction;
import com.calltree.utils.ThrowingFunction;
import com.calltree.utils.ThrowingSupplier;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Call tree profiler.
 *
 * <p>Functions are wrapped with {@code wrap(bucket, function)}. Inside a profiling session every
 * call of a wrapped function is timed and accounted to the full path of buckets that are active on
 * the calling logical thread. Outside of a session wrapped functions call straight through, and a
 * disabled profiler returns the function it is asked to wrap.
 *
 * <p>A session is {@link #start() started} and ended with {@link #stop()} or {@link #report()}.
 * Starting a running session or ending an idle one throws a {@link ProfilerInvariantError}.
 */
public abstract class Profiler {

  final ProfileOptions options;

  private volatile boolean running = false;

  Profiler(ProfileOptions options) {
    this.options = options;
  }

  public static Profiler create(ProfileOptions options) {
    return options.isEnabled() ? new ProfilerImpl(options) : empty(options);
  }

  public static Profiler empty() {
    return empty(ProfileOptions.disabled());
  }

  private static Profiler empty(ProfileOptions options) {
    return new ProfilerEmpty(options);
  }

  public abstract boolean isEnabled();

  public final boolean isRunning() {
    return running;
  }

  public final synchronized void start() {
    if (running) {
      throw new ProfilerInvariantError("Already running");
    }
    clear();
    running = true;
  }

  final synchronized void markStopped() {
    if (!running) {
      throw new ProfilerInvariantError("Not running");
    }
    running = false;
  }

  abstract void clear();

  /** Ends the session and returns the report, empty when disabled. */
  public final String stop() {
    CollectingLineConsumer consumer = new CollectingLineConsumer();
    report(consumer);
    return consumer.toString();
  }

  /** Ends the session and prints the report to the console. */
  public final void report() {
    report(options.getConsole());
  }

  /** Ends the session and prints the report to {@code consumer}. Prints nothing when disabled. */
  public final void report(LineConsumer consumer) {
    ProfileReport report = stopWithReport();
    if (isEnabled()) {
      report.report(consumer);
    }
  }

  /** Ends the session and returns the report without rendering it. */
  public abstract ProfileReport stopWithReport();

  /** Prints the report of the times recorded so far. The session keeps running. */
  public abstract void reportWithoutStopping(LineConsumer consumer);

  /** Adds {@code durationMs} to {@code path}, for work that is timed outside of a wrapper. */
  public abstract void increase(CallPath path, double durationMs);

  public final void increase(String bucket, double durationMs) {
    increase(CallPath.of(bucket), durationMs);
  }

  abstract <T, E extends Exception> T profile(
      Supplier<String> bucket, ThrowingSupplier<T, E> body) throws E;

  public final <E extends Exception> ThrowingAction<E> wrap(
      String bucket, ThrowingAction<E> action) {
    if (!isEnabled()) {
      return action;
    }
    Supplier<String> name = () -> bucket;
    return () ->
        profile(
            name,
            () -> {
              action.execute();
              return null;
            });
  }

  public final <T, E extends Exception> ThrowingSupplier<T, E> wrap(
      String bucket, ThrowingSupplier<T, E> supplier) {
    if (!isEnabled()) {
      return supplier;
    }
    Supplier<String> name = () -> bucket;
    return () -> profile(name, supplier);
  }

  public final <A, R, E extends Exception> ThrowingFunction<A, R, E> wrap(
      String bucket, ThrowingFunction<A, R, E> function) {
    return wrap(BucketName.fixed(bucket), function);
  }

  public final <A, R, E extends Exception> ThrowingFunction<A, R, E> wrap(
      BucketName<? super A> bucket, ThrowingFunction<A, R, E> function) {
    if (!isEnabled()) {
      return function;
    }
    return argument -> profile(() -> bucket.resolve(argument), () -> function.apply(argument));
  }

  public final <A, B, R, E extends Exception> ThrowingBiFunction<A, B, R, E> wrap(
      String bucket, ThrowingBiFunction<A, B, R, E> function) {
    return wrap((first, second) -> bucket, function);
  }

  public final <A, B, R, E extends Exception> ThrowingBiFunction<A, B, R, E> wrap(
      BiFunction<? super A, ? super B, String> bucket, ThrowingBiFunction<A, B, R, E> function) {
    if (!isEnabled()) {
      return function;
    }
    return (first, second) ->
        profile(() -> bucket.apply(first, second), () -> function.apply(first, second));
  }

  /** Profiles an inline block: wraps {@code action} and calls it right away. */
  public final <E extends Exception> void time(String bucket, ThrowingAction<E> action) throws E {
    wrap(bucket, action).execute();
  }

  /** Profiles an inline block: wraps {@code supplier} and calls it right away. */
  public final <T, E extends Exception> T time(String bucket, ThrowingSupplier<T, E> supplier)
      throws E {
    return wrap(bucket, supplier).get();
  }

  /**
   * Runs {@code action} in a new session and prints the report, also when {@code action} throws.
   */
  public final <E extends Exception> void run(String bucket, ThrowingAction<E> action) throws E {
    start();
    try {
      time(bucket, action);
    } finally {
      report();
    }
  }

  /**
   * Runs {@code supplier} in a new session and prints the report, also when {@code supplier}
   * throws.
   */
  public final <T, E extends Exception> T run(String bucket, ThrowingSupplier<T, E> supplier)
      throws E {
    start();
    try {
      return time(bucket, supplier);
    } finally {
      report();
    }
  }
}
