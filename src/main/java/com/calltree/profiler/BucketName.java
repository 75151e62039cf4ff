// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import java.util.function.Function;

/**
 * Name of a profiling bucket. Either a fixed string, or derived from the arguments of each call.
 * A derived name is computed once per call, before the bucket is entered.
 *
 * @param <A> the arguments the name can be derived from
 */
public abstract class BucketName<A> {

  public static <A> BucketName<A> fixed(String name) {
    return new Fixed<>(name);
  }

  public static <A> BucketName<A> derived(Function<? super A, String> namer) {
    return new Derived<>(namer);
  }

  abstract String resolve(A arguments);

  private static class Fixed<A> extends BucketName<A> {

    private final String name;

    Fixed(String name) {
      this.name = name;
    }

    @Override
    String resolve(A arguments) {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private static class Derived<A> extends BucketName<A> {

    private final Function<? super A, String> namer;

    Derived(Function<? super A, String> namer) {
      this.namer = namer;
    }

    @Override
    String resolve(A arguments) {
      return namer.apply(arguments);
    }

    @Override
    public String toString() {
      return "<derived>";
    }
  }
}
