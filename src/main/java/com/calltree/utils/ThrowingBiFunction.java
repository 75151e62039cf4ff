// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.utils;

/**
 * Similar to a {@link java.util.function.BiFunction} but throws a single {@link Exception}.
 *
 * @param <T> the type of the first argument
 * @param <U> the type of the second argument
 * @param <R> the type of the result of the function
 * @param <E> the type of the {@link Exception}
 */
@FunctionalInterface
public interface ThrowingBiFunction<T, U, R, E extends Exception> {
  R apply(T t, U u) throws E;
}
