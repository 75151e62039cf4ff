// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class ProfileTreeTest {

  private static final CallPath A = CallPath.of("A");
  private static final CallPath A_B = CallPath.of("A", "B");
  private static final CallPath A_B_C = CallPath.of("A", "B", "C");
  private static final CallPath A_D = CallPath.of("A", "D");
  private static final CallPath B = CallPath.of("B");

  private static ProfileTree buildTree() {
    return ProfileTree.reconstruct(
        ImmutableMap.of(A_B_C, 20.0, A_B, 300.0, A_D, 50.0, A, 400.0, B, 100.0));
  }

  @Test
  public void testRootsAndChildren() {
    ProfileTree tree = buildTree();
    assertEquals(ImmutableList.of(A, B), tree.getRoots());
    assertEquals(
        ImmutableList.of(A_B, A_D, CallPath.of("A", "other A")), tree.getChildren(A));
    assertEquals(
        ImmutableList.of(A_B_C, CallPath.of("A", "B", "other B")), tree.getChildren(A_B));
    assertTrue(tree.isLeaf(B));
    assertTrue(tree.isLeaf(A_B_C));
    assertFalse(tree.isLeaf(A_B));
  }

  @Test
  public void testOtherTime() {
    ProfileTree tree = buildTree();
    assertEquals(50.0, tree.getTime(CallPath.of("A", "other A")), 0.0);
    assertEquals(280.0, tree.getTime(CallPath.of("A", "B", "other B")), 0.0);
    assertFalse(tree.contains(CallPath.of("B", "other B")));
  }

  @Test
  public void testAccountingLaw() {
    ProfileTree tree = buildTree();
    for (CallPath path : tree.getPaths()) {
      if (tree.hasChildren(path)) {
        double children = 0;
        for (CallPath child : tree.getChildren(path)) {
          children += tree.getTime(child);
        }
        assertEquals(tree.getTime(path), children, 1e-9);
      }
    }
  }

  @Test
  public void testLeavesDoNotOverlap() {
    ProfileTree tree = buildTree();
    double leaves = 0;
    for (CallPath leaf : tree.getLeaves()) {
      leaves += tree.getTime(leaf);
    }
    double roots = 0;
    for (CallPath root : tree.getRoots()) {
      roots += tree.getTime(root);
    }
    assertEquals(roots, leaves, 1e-9);
  }

  @Test
  public void testNegativeOtherTimeIsNotClamped() {
    ProfileTree tree = ProfileTree.reconstruct(ImmutableMap.of(A_B, 30.0, A, 20.0));
    assertEquals(-10.0, tree.getTime(CallPath.of("A", "other A")), 0.0);
  }

  @Test
  public void testRecordedBucketNamedLikeOtherIsReplaced() {
    CallPath recordedOther = CallPath.of("A", "other A");
    ProfileTree tree =
        ProfileTree.reconstruct(ImmutableMap.of(A_B, 10.0, recordedOther, 5.0, A, 40.0));
    assertEquals(ImmutableList.of(A_B, recordedOther), tree.getChildren(A));
    assertEquals(30.0, tree.getTime(recordedOther), 0.0);
    assertEquals(40.0, tree.getTime(A_B) + tree.getTime(recordedOther), 0.0);
  }

  @Test
  public void testPathWithoutRecordedParentIsOnlyALeaf() {
    ProfileTree tree = ProfileTree.reconstruct(ImmutableMap.of(A_B, 10.0, B, 5.0));
    assertEquals(ImmutableList.of(B), tree.getRoots());
    assertEquals(ImmutableList.of(A_B, B), tree.getLeaves());
  }

  @Test
  public void testEmptySnapshot() {
    ProfileTree tree = ProfileTree.reconstruct(ImmutableMap.of());
    assertTrue(tree.isEmpty());
    assertTrue(tree.getRoots().isEmpty());
  }
}
