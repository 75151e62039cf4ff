// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.errors;

/**
 * Signals misuse of the profiler instrumentation, such as starting a running timer or stopping a
 * session that was never started.
 *
 * <p>This is an {@link Error} and not an exception: once raised the recorded times can no longer be
 * trusted and the instrumentation needs to be fixed.
 */
public class ProfilerInvariantError extends Error {

  public ProfilerInvariantError(String message) {
    super(message);
  }
}
