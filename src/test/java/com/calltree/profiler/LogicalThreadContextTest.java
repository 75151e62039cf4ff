// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree.profiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;

public class LogicalThreadContextTest extends ProfilerTestBase {

  @Test
  public void testPerThreadStacks() throws Exception {
    LogicalThreadContext context = LogicalThreadContext.perThread();
    CallStack main = context.current();
    assertSame(main, context.current());
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      assertNotSame(main, executor.submit(context::current).get());
    } finally {
      executor.shutdown();
    }
  }

  @Test
  public void testNone() {
    assertNull(LogicalThreadContext.none().current());
  }

  @Test
  public void testExplicitScopesNest() {
    LogicalThreadContext.Explicit context = LogicalThreadContext.explicit();
    assertNull(context.current());
    CallStack outer = new CallStack();
    CallStack inner = new CallStack();
    try (LogicalThreadContext.Scope outerScope = context.enter(outer)) {
      assertSame(outer, context.current());
      try (LogicalThreadContext.Scope innerScope = context.enter(inner)) {
        assertSame(inner, context.current());
      }
      assertSame(outer, context.current());
    }
    assertNull(context.current());
  }

  @Test
  public void testExplicitTaskResumedOnAnotherThread() throws Exception {
    LogicalThreadContext.Explicit context = LogicalThreadContext.explicit();
    Profiler profiler = createProfiler(0, context);
    CallStack task = new CallStack();
    ExecutorService first = Executors.newSingleThreadExecutor();
    ExecutorService second = Executors.newSingleThreadExecutor();
    profiler.start();
    try {
      first
          .submit(
              () -> {
                try (LogicalThreadContext.Scope scope = context.enter(task)) {
                  task.enter("request");
                }
              })
          .get();
      second
          .submit(
              () -> {
                try (LogicalThreadContext.Scope scope = context.enter(task)) {
                  spend(profiler, "handle").apply(7);
                  task.exit();
                }
              })
          .get();
    } finally {
      first.shutdown();
      second.shutdown();
    }
    assertEquals(7.0, getTable(profiler).get(CallPath.of("request", "handle")), 0.0);
    assertTrue(task.isEmpty());
    profiler.stop();
  }

  @Test
  public void testConcurrentThreadsKeepSeparatePaths() throws Exception {
    Profiler profiler = createProfiler(0, LogicalThreadContext.perThread());
    int threads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(threads);
    profiler.start();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String task = "task " + (i % 2);
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  ready.await();
                  for (int j = 0; j < 100; j++) {
                    profiler.time(task, () -> spend(profiler, "step").apply(1));
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
    ProfileTree tree = profiler.stopWithReport().getTree();
    assertEquals(
        ImmutableSet.of(CallPath.of("task 0"), CallPath.of("task 1")),
        ImmutableSet.copyOf(tree.getRoots()));
    for (CallPath root : tree.getRoots()) {
      for (CallPath child : tree.getChildren(root)) {
        assertFalse(tree.hasChildren(child));
        assertTrue(
            child.getName().equals("step") || child.getName().equals("other " + root.getName()));
      }
    }
  }
}
