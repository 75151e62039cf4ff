// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class CallPathTest {

  @Test
  public void testStructuralEquality() {
    CallPath path = CallPath.of("build client", "compile js");
    assertEquals(path, CallPath.of(ImmutableList.of("build client", "compile js")));
    assertEquals(path.hashCode(), CallPath.of("build client").append("compile js").hashCode());
    assertNotEquals(path, CallPath.of("compile js", "build client"));
    assertNotEquals(path, CallPath.of("build client"));
  }

  @Test
  public void testParentAndChild() {
    CallPath parent = CallPath.of("a", "b");
    CallPath child = parent.append("c");
    assertTrue(parent.isParentOf(child));
    assertFalse(child.isParentOf(parent));
    assertFalse(CallPath.of("a").isParentOf(child));
    assertFalse(CallPath.of("x", "b").isParentOf(child));
    assertEquals(parent, child.getParent());
    assertNull(CallPath.of("a").getParent());
    assertEquals("c", child.getName());
    assertEquals(3, child.getDepth());
  }

  @Test
  public void testToString() {
    assertEquals(
        "build client : compile js : read source files",
        CallPath.of("build client", "compile js", "read source files").toString());
  }

  @Test
  public void testEmptyPathIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CallPath.of(ImmutableList.of()));
  }
}
