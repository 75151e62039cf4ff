// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree;

import com.calltree.profiler.BucketName;
import com.calltree.profiler.CallPath;
import com.calltree.profiler.Profiler;
import com.calltree.utils.ThrowingAction;
import com.calltree.utils.ThrowingBiFunction;
import com.calltree.utils.ThrowingFunction;
import com.calltree.utils.ThrowingSupplier;
import java.util.function.BiFunction;

/**
 * Process wide profiler, configured once from {@link ProfileOptions#fromEnvironment()}.
 *
 * <p>Profiling a method without changing its indentation:
 *
 * <pre>
 *   private final ThrowingFunction&lt;Target, Bundle, IOException&gt; build =
 *       Profile.wrap(BucketName.derived(target -&gt; "build " + target), this::doBuild);
 * </pre>
 *
 * <p>Profiling an inline block:
 *
 * <pre>
 *   Bundle bundle = Profile.time("bundle", () -&gt; createBundle());
 * </pre>
 *
 * <p>Nothing is measured outside of a session. {@link #run(String, ThrowingSupplier)} runs a
 * session around a block and prints the report when it completes.
 */
public final class Profile {

  private static final Profiler PROFILER = Profiler.create(ProfileOptions.fromEnvironment());

  private Profile() {}

  public static Profiler get() {
    return PROFILER;
  }

  public static boolean isEnabled() {
    return PROFILER.isEnabled();
  }

  public static <E extends Exception> ThrowingAction<E> wrap(
      String bucket, ThrowingAction<E> action) {
    return PROFILER.wrap(bucket, action);
  }

  public static <T, E extends Exception> ThrowingSupplier<T, E> wrap(
      String bucket, ThrowingSupplier<T, E> supplier) {
    return PROFILER.wrap(bucket, supplier);
  }

  public static <A, R, E extends Exception> ThrowingFunction<A, R, E> wrap(
      String bucket, ThrowingFunction<A, R, E> function) {
    return PROFILER.wrap(bucket, function);
  }

  public static <A, R, E extends Exception> ThrowingFunction<A, R, E> wrap(
      BucketName<? super A> bucket, ThrowingFunction<A, R, E> function) {
    return PROFILER.wrap(bucket, function);
  }

  public static <A, B, R, E extends Exception> ThrowingBiFunction<A, B, R, E> wrap(
      String bucket, ThrowingBiFunction<A, B, R, E> function) {
    return PROFILER.wrap(bucket, function);
  }

  public static <A, B, R, E extends Exception> ThrowingBiFunction<A, B, R, E> wrap(
      BiFunction<? super A, ? super B, String> bucket, ThrowingBiFunction<A, B, R, E> function) {
    return PROFILER.wrap(bucket, function);
  }

  public static <E extends Exception> void time(String bucket, ThrowingAction<E> action)
      throws E {
    PROFILER.time(bucket, action);
  }

  public static <T, E extends Exception> T time(String bucket, ThrowingSupplier<T, E> supplier)
      throws E {
    return PROFILER.time(bucket, supplier);
  }

  public static void start() {
    PROFILER.start();
  }

  public static String stop() {
    return PROFILER.stop();
  }

  public static <E extends Exception> void run(String bucket, ThrowingAction<E> action) throws E {
    PROFILER.run(bucket, action);
  }

  public static <T, E extends Exception> T run(String bucket, ThrowingSupplier<T, E> supplier)
      throws E {
    return PROFILER.run(bucket, supplier);
  }

  public static void increase(String bucket, double durationMs) {
    PROFILER.increase(bucket, durationMs);
  }

  public static void increase(CallPath path, double durationMs) {
    PROFILER.increase(path, durationMs);
  }
}
