// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.ProfileOptions;
import com.calltree.utils.ThrowingSupplier;
import com.google.common.collect.ImmutableMap;
import java.util.function.Supplier;

/**
 * Profiler used when profiling is disabled. Functions are not wrapped, nothing is recorded and
 * reports are empty. Sessions can still be started and stopped.
 */
class ProfilerEmpty extends Profiler {

  ProfilerEmpty(ProfileOptions options) {
    super(options);
  }

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  void clear() {}

  @Override
  <T, E extends Exception> T profile(Supplier<String> bucket, ThrowingSupplier<T, E> body)
      throws E {
    return body.get();
  }

  @Override
  public void increase(CallPath path, double durationMs) {}

  @Override
  public ProfileReport stopWithReport() {
    markStopped();
    return new ProfileReport(
        ProfileTree.reconstruct(ImmutableMap.of()),
        options.getMinimumReportMs(),
        options.getClockKind());
  }

  @Override
  public void reportWithoutStopping(LineConsumer consumer) {}
}
