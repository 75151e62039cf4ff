// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;

public class AccumulationTableTest {

  @Test
  public void testIncreaseCreatesAndAdds() {
    AccumulationTable table = new AccumulationTable();
    CallPath path = CallPath.of("a", "b");
    assertFalse(table.contains(path));
    table.increase(path, 1.5);
    table.increase(CallPath.of("a", "b"), 2.0);
    assertTrue(table.contains(path));
    assertEquals(3.5, table.get(path), 0.0);
    assertEquals(1, table.size());
  }

  @Test
  public void testSnapshotKeepsFirstRecordedOrder() {
    AccumulationTable table = new AccumulationTable();
    table.increase(CallPath.of("b"), 1);
    table.increase(CallPath.of("a"), 1);
    table.increase(CallPath.of("b"), 1);
    assertEquals(
        ImmutableList.of(CallPath.of("b"), CallPath.of("a")),
        ImmutableList.copyOf(table.snapshot().keySet()));
    table.clear();
    assertTrue(table.snapshot().isEmpty());
  }

  @Test
  public void testConcurrentIncreasesAreNotLost() throws Exception {
    AccumulationTable table = new AccumulationTable();
    CallPath shared = CallPath.of("worker", "step");
    int threads = 8;
    int increments = 10_000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  ready.await();
                  for (int j = 0; j < increments; j++) {
                    table.increase(shared, 1.0);
                  }
                  return null;
                }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }
    assertEquals(threads * increments, table.get(shared), 0.0);
  }
}
