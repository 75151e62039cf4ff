// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils;

/**
 * Similar to a {@link Runnable} but throws a single {@link Exception}.
 *
 * @param <E> the type of the {@link Exception}
 */
@FunctionalInterface
public interface ThrowingAction<E extends Exception> {
  void execute() throws E;
}
