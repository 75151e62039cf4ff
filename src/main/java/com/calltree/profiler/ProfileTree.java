// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Call tree reconstructed from a snapshot of the {@link AccumulationTable}.
 *
 * <p>A path is the child of another path if it is exactly one bucket longer and starts with it.
 * Every path with children gets an additional synthetic child {@code "other <name>"} holding the
 * time of the parent that is not accounted for by its children. That time is not clamped, it can
 * be negative if measurements overlap.
 */
public class ProfileTree {

  public static final String OTHER_PREFIX = "other ";

  private final Map<CallPath, Double> times;
  private final ListMultimap<CallPath, CallPath> children;
  private final List<CallPath> roots;

  private ProfileTree(
      Map<CallPath, Double> times,
      ListMultimap<CallPath, CallPath> children,
      List<CallPath> roots) {
    this.times = times;
    this.children = children;
    this.roots = roots;
  }

  public static ProfileTree reconstruct(Map<CallPath, Double> snapshot) {
    ListMultimap<CallPath, CallPath> children =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    List<CallPath> roots = new ArrayList<>();
    for (CallPath path : snapshot.keySet()) {
      if (path.isTopLevel()) {
        roots.add(path);
      } else {
        CallPath parent = path.getParent();
        if (snapshot.containsKey(parent)) {
          children.put(parent, path);
        }
      }
    }
    Map<CallPath, Double> times = new LinkedHashMap<>(snapshot);
    for (CallPath parent : ImmutableList.copyOf(children.keySet())) {
      injectOtherTime(parent, snapshot, children, times);
    }
    return new ProfileTree(
        Collections.unmodifiableMap(times), children, Collections.unmodifiableList(roots));
  }

  private static void injectOtherTime(
      CallPath parent,
      Map<CallPath, Double> snapshot,
      ListMultimap<CallPath, CallPath> children,
      Map<CallPath, Double> times) {
    CallPath other = parent.append(OTHER_PREFIX + parent.getName());
    double childTime = 0;
    for (CallPath child : children.get(parent)) {
      // A recorded bucket with the synthetic name is folded into the unaccounted time.
      if (!child.equals(other)) {
        childTime += snapshot.get(child);
      }
    }
    if (times.put(other, snapshot.get(parent) - childTime) == null) {
      children.put(parent, other);
    }
  }

  public List<CallPath> getRoots() {
    return roots;
  }

  public List<CallPath> getChildren(CallPath path) {
    return Collections.unmodifiableList(children.get(path));
  }

  public boolean hasChildren(CallPath path) {
    return children.containsKey(path);
  }

  public boolean isLeaf(CallPath path) {
    return !hasChildren(path);
  }

  public boolean contains(CallPath path) {
    return times.containsKey(path);
  }

  public double getTime(CallPath path) {
    Double time = times.get(path);
    if (time == null) {
      throw new IllegalArgumentException("Unknown call path: " + path);
    }
    return time;
  }

  /** All paths: the recorded ones in the order they were recorded, then the synthetic ones. */
  public Iterable<CallPath> getPaths() {
    return times.keySet();
  }

  public List<CallPath> getLeaves() {
    List<CallPath> leaves = new ArrayList<>();
    for (Entry<CallPath, Double> entry : times.entrySet()) {
      if (isLeaf(entry.getKey())) {
        leaves.add(entry.getKey());
      }
    }
    return leaves;
  }

  public boolean isEmpty() {
    return times.isEmpty();
  }
}
