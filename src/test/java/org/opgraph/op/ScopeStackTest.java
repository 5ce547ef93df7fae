/* Copyright 2019 The TensorFlow Authors. All Rights Reserved.

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
==============================================================================*/

package org.opgraph.op;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.Graph;
import org.opgraph.op.core.Constant;

/** Unit tests for {@link ScopeStack}. */
@RunWith(JUnit4.class)
public class ScopeStackTest {

  @Test
  public void pushAndPopRestoreTheEnclosingScope() {
    try (Graph g = new Graph()) {
      ScopeStack stack = new ScopeStack(g);
      Scope root = stack.current();
      assertEquals(0, stack.depth());

      try (ScopeStack.Frame outer = stack.push(ScopeOverrides.create().nameScope("outer"))) {
        assertEquals("outer", stack.current().nameScope());
        assertSame(outer.scope(), stack.current());
        try (ScopeStack.Frame inner = stack.push(ScopeOverrides.create().nameScope("inner"))) {
          assertEquals(2, stack.depth());
          assertEquals("outer/inner/Const", Constant.create(stack.current(), 1).op().name());
        }
        assertSame(outer.scope(), stack.current());
      }
      assertSame(root, stack.current());
      assertEquals(0, stack.depth());
    }
  }

  @Test
  public void callWithPopsOnExceptions() {
    try (Graph g = new Graph()) {
      ScopeStack stack = new ScopeStack(g);
      Scope root = stack.current();
      try {
        stack.callWith(
            ScopeOverrides.create().nameScope("failing"),
            scope -> {
              Constant.create(scope, 1);
              throw new IllegalStateException("boom");
            });
        fail("the exception was swallowed");
      } catch (IllegalStateException e) {
        assertEquals("boom", e.getMessage());
      }
      assertSame(root, stack.current());
      assertEquals(0, stack.depth());

      String name =
          stack.callWith(
              ScopeOverrides.create().nameScope("ok"),
              scope -> Constant.create(scope, 1).op().name());
      assertEquals("ok/Const", name);
    }
  }

  @Test
  public void invalidOverridesPushNothing() {
    try (Graph g = new Graph()) {
      ScopeStack stack = new ScopeStack(g);
      try {
        stack.push(ScopeOverrides.create().nameScope("_invalid"));
        fail("pushed an invalid name scope");
      } catch (IllegalArgumentException e) {
        // expected
      }
      assertEquals(0, stack.depth());
    }
  }

  @Test
  public void framesCloseInReverseOrder() {
    try (Graph g = new Graph()) {
      ScopeStack stack = new ScopeStack(g);
      ScopeStack.Frame outer = stack.push(ScopeOverrides.create().nameScope("outer"));
      ScopeStack.Frame inner = stack.push(ScopeOverrides.create().nameScope("inner"));
      try {
        outer.close();
        fail("closed a frame below an open one");
      } catch (IllegalStateException e) {
        // expected
      }
      inner.close();
      inner.close();
      assertEquals(1, stack.depth());
      outer.close();
      assertEquals(0, stack.depth());
    }
  }

  @Test
  public void eachThreadHasItsOwnStack() throws Exception {
    final int numThreads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(numThreads);
    try (Graph g = new Graph()) {
      final Scope root = new Scope(g);
      final CyclicBarrier barrier = new CyclicBarrier(numThreads);
      List<Future<String>> results = new ArrayList<>();
      for (int t = 0; t < numThreads; ++t) {
        final String scopeName = "worker" + t;
        results.add(
            executor.submit(
                new Callable<String>() {
                  @Override
                  public String call() throws Exception {
                    ScopeStack stack = new ScopeStack(root);
                    try (ScopeStack.Frame frame =
                        stack.push(ScopeOverrides.create().nameScope(scopeName))) {
                      // Every thread has entered its scope before any builds.
                      barrier.await();
                      return Constant.create(stack.current(), 1).op().name();
                    }
                  }
                }));
      }
      for (int t = 0; t < numThreads; ++t) {
        assertEquals("worker" + t + "/Const", results.get(t).get());
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
