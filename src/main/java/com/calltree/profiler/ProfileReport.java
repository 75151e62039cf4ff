// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import com.calltree.utils.StringUtils;
import com.calltree.utils.timing.Clock;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ProfileTree} as a hierarchical report followed by a leaf time report.
 *
 * <pre>
 * |
 * | A: 500.0
 * |     B: 150.0
 * |     other A: 350.0
 * | B: 100.0
 * |
 * | other A: 350.0
 * | B: 250.0
 * | Measured CPU: 600.0
 * </pre>
 *
 * Entries below the minimum report time are left out of both reports.
 */
public class ProfileReport {

  private static final String PREFIX = "| ";

  private final ProfileTree tree;
  private final int minimumReportMs;
  private final Clock.Kind clockKind;

  public ProfileReport(ProfileTree tree, int minimumReportMs, Clock.Kind clockKind) {
    this.tree = tree;
    this.minimumReportMs = minimumReportMs;
    this.clockKind = clockKind;
  }

  public ProfileTree getTree() {
    return tree;
  }

  public void report(LineConsumer consumer) {
    print(consumer, 0, "");
    reportHierarchy(consumer);
    print(consumer, 0, "");
    reportLeafTotals(consumer);
  }

  public void reportHierarchy(LineConsumer consumer) {
    for (CallPath root : tree.getRoots()) {
      reportOn(consumer, 0, root);
    }
  }

  // A parent below the minimum is not printed, but its children are still considered.
  private void reportOn(LineConsumer consumer, int depth, CallPath path) {
    double time = tree.getTime(path);
    if (isReported(time)) {
      print(consumer, depth, path.getName() + ": " + StringUtils.prettyMs(time));
    }
    for (CallPath child : tree.getChildren(path)) {
      reportOn(consumer, depth + 1, child);
    }
  }

  /** Prints the leaf totals and returns the measured time, the sum of the printed totals. */
  public double reportLeafTotals(LineConsumer consumer) {
    double measured = 0;
    for (LeafTotal total : computeLeafTotals()) {
      if (!isReported(total.getTimeMs())) {
        continue;
      }
      print(consumer, 0, total.getName() + ": " + StringUtils.prettyMs(total.getTimeMs()));
      measured += total.getTimeMs();
    }
    print(consumer, 0, getMeasuredLabel() + ": " + StringUtils.prettyMs(measured));
    return measured;
  }

  /**
   * Total time per leaf bucket name over all leaves with that name, largest first. Leaves do not
   * overlap, so the totals add up to the profiled time.
   */
  public List<LeafTotal> computeLeafTotals() {
    Map<String, Double> totals = new LinkedHashMap<>();
    for (CallPath leaf : tree.getLeaves()) {
      totals.merge(leaf.getName(), tree.getTime(leaf), Double::sum);
    }
    List<LeafTotal> result = new ArrayList<>(totals.size());
    totals.forEach((name, time) -> result.add(new LeafTotal(name, time)));
    result.sort(Comparator.comparingDouble(LeafTotal::getTimeMs).reversed());
    return result;
  }

  private boolean isReported(double time) {
    return time >= minimumReportMs;
  }

  private String getMeasuredLabel() {
    return clockKind == Clock.Kind.CPU ? "Measured CPU" : "Measured time";
  }

  private static void print(LineConsumer consumer, int depth, String text) {
    consumer.accept(PREFIX + StringUtils.indent(depth) + text);
  }

  /** Serializes the complete tree and the leaf totals, without applying the minimum time. */
  public String toJson() {
    JsonReport json = new JsonReport();
    json.clock = clockKind.name().toLowerCase(Locale.ROOT);
    json.minimumReportMs = minimumReportMs;
    for (CallPath root : tree.getRoots()) {
      json.buckets.add(toJsonBucket(root));
    }
    for (LeafTotal total : computeLeafTotals()) {
      json.leafTotals.add(new JsonBucket(total.getName(), total.getTimeMs()));
      json.measuredMs += total.getTimeMs();
    }
    return new GsonBuilder()
        .excludeFieldsWithoutExposeAnnotation()
        .setPrettyPrinting()
        .create()
        .toJson(json);
  }

  private JsonBucket toJsonBucket(CallPath path) {
    JsonBucket bucket = new JsonBucket(path.getName(), tree.getTime(path));
    if (tree.hasChildren(path)) {
      bucket.children = new ArrayList<>();
      for (CallPath child : tree.getChildren(path)) {
        bucket.children.add(toJsonBucket(child));
      }
    }
    return bucket;
  }

  public static class LeafTotal {

    private final String name;
    private final double timeMs;

    LeafTotal(String name, double timeMs) {
      this.name = name;
      this.timeMs = timeMs;
    }

    public String getName() {
      return name;
    }

    public double getTimeMs() {
      return timeMs;
    }

    @Override
    public String toString() {
      return name + ": " + StringUtils.prettyMs(timeMs);
    }
  }

  private static class JsonReport {

    @Expose
    @SerializedName("clock")
    private String clock;

    @Expose
    @SerializedName("minimumReportMs")
    private int minimumReportMs;

    @Expose
    @SerializedName("buckets")
    private final List<JsonBucket> buckets = new ArrayList<>();

    @Expose
    @SerializedName("leafTotals")
    private final List<JsonBucket> leafTotals = new ArrayList<>();

    @Expose
    @SerializedName("measuredMs")
    private double measuredMs;
  }

  private static class JsonBucket {

    @Expose
    @SerializedName("name")
    private final String name;

    @Expose
    @SerializedName("timeMs")
    private final double timeMs;

    // Absent for leaves.
    @Expose
    @SerializedName("children")
    private List<JsonBucket> children;

    JsonBucket(String name, double timeMs) {
      this.name = name;
      this.timeMs = timeMs;
    }
  }
}
