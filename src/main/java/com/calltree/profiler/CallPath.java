// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;

/**
 * Immutable sequence of bucket names from the profiling root to a bucket. Two paths are equal if
 * they have the same names in the same order.
 */
public final class CallPath {

  private static final String SEPARATOR = " : ";

  private final ImmutableList<String> names;
  private final int hashCode;

  private CallPath(ImmutableList<String> names) {
    assert !names.isEmpty();
    this.names = names;
    this.hashCode = names.hashCode();
  }

  public static CallPath of(String... names) {
    return of(ImmutableList.copyOf(names));
  }

  public static CallPath of(List<String> names) {
    if (names.isEmpty()) {
      throw new IllegalArgumentException("A call path has at least one bucket");
    }
    return new CallPath(ImmutableList.copyOf(names));
  }

  public CallPath append(String name) {
    return new CallPath(
        ImmutableList.<String>builderWithExpectedSize(names.size() + 1)
            .addAll(names)
            .add(name)
            .build());
  }

  public CallPath getParent() {
    return isTopLevel() ? null : new CallPath(names.subList(0, names.size() - 1));
  }

  public String getName() {
    return Iterables.getLast(names);
  }

  public int getDepth() {
    return names.size();
  }

  public boolean isTopLevel() {
    return names.size() == 1;
  }

  /** Returns true if {@code other} is exactly one bucket longer and starts with this path. */
  public boolean isParentOf(CallPath other) {
    return other.names.size() == names.size() + 1
        && other.names.subList(0, names.size()).equals(names);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CallPath)) {
      return false;
    }
    CallPath other = (CallPath) obj;
    return hashCode == other.hashCode && names.equals(other.names);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return String.join(SEPARATOR, names);
  }
}
