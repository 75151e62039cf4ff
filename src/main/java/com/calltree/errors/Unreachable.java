// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.errors;

/** Exception to signal that a code path was expected to never be reached. */
public class Unreachable extends IllegalStateException {

  public Unreachable() {}

  public Unreachable(String message) {
    super(message);
  }
}
