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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.GraphMismatchException;
import org.opgraph.IllegalNameException;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.op.core.Constant;
import org.opgraph.op.core.Identity;
import org.opgraph.op.core.NoOp;
import org.opgraph.op.core.Variable;
import org.opgraph.op.core.Zeros;

/** Unit tests for {@link org.opgraph.op.Scope}. */
@RunWith(JUnit4.class)
public class ScopeTest {

  @Test
  public void basicNames() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      assertEquals("add", root.makeOpName("add"));
      assertEquals("mul", root.makeOpName("mul"));
      assertEquals("child/add", root.withSubScope("child").makeOpName("add"));
      assertEquals("W", root.withName("W").makeOpName("add"));
    }
  }

  @Test
  public void basic() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant c1 = Constant.create(s, 42);
      assertEquals("Const", c1.op().name());
      Constant c2 = Constant.create(s, 7);
      assertEquals("Const_1", c2.op().name());
      Constant c3 = Constant.create(s.withName("four"), 4);
      assertEquals("four", c3.op().name());
      Constant c4 = Constant.create(s.withName("four"), 4);
      assertEquals("four_1", c4.op().name());
    }
  }

  @Test
  public void hierarchicalNames() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      Scope child = root.withSubScope("child");
      assertEquals("child", child.nameScope());
      assertEquals("child/add", NoOp.create(child.withName("add")).op().name());
      assertEquals("child/add_1", NoOp.create(child.withName("add")).op().name());

      // Scopes entered twice share their prefix; the operations in them stay unique.
      Scope again = root.withSubScope("child");
      assertEquals("child", again.nameScope());
      assertEquals("child/add_2", NoOp.create(again.withName("add")).op().name());

      Scope c_c = root.withSubScope("c").withSubScope("c");
      assertEquals("c/c/add", c_c.makeOpName("add"));
    }
  }

  @Test
  public void scopeNamesAvoidOperationNames() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      NoOp.create(root.withName("child"));
      Scope child = root.withSubScope("child");
      assertEquals("child_1", child.nameScope());
      assertEquals("child_1/p", NoOp.create(child.withName("p")).op().name());
    }
  }

  @Test
  public void nestedScopesAndReset() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      assertEquals("C", Constant.create(root.withName("C"), 1).op().name());

      Scope nested = root.withSubScope("Nested");
      assertEquals("Nested/C", Constant.create(nested.withName("C"), 1).op().name());

      Scope inner = nested.withSubScope("Inner");
      assertEquals("Nested/Inner/C", Constant.create(inner.withName("C"), 1).op().name());

      Scope reset = inner.with(ScopeOverrides.create().nameScope(""));
      assertEquals("", reset.nameScope());
      assertEquals("C_1", Constant.create(reset.withName("C"), 1).op().name());
    }
  }

  @Test
  public void nameScopeGrammar() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      Scope child = root.withSubScope("child");

      // Nested name scopes may start with characters root scopes cannot.
      for (String name : new String[] {"_x", "-x"}) {
        try {
          root.with(ScopeOverrides.create().nameScope(name));
          fail("accepted the root name scope '" + name + "'");
        } catch (IllegalNameException e) {
          // expected
        }
        assertEquals("child/" + name, child.with(ScopeOverrides.create().nameScope(name))
            .nameScope());
      }
      try {
        child.with(ScopeOverrides.create().nameScope("a b"));
        fail("accepted a name scope with a space");
      } catch (IllegalNameException e) {
        // expected
      }

      // One trailing slash is dropped, and slashes nest scopes.
      assertEquals("a", root.with(ScopeOverrides.create().nameScope("a/")).nameScope());
      assertEquals("a/b", root.with(ScopeOverrides.create().nameScope("a/b")).nameScope());
    }
  }

  @Test
  public void validateNames() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);

      final String[] invalid_names = {
        "_", "-", "-x", // Names are constrained to start with [A-Za-z0-9.]
        null, "", "a$", // Invalid characters
        "a/b", // slashes not allowed
      };

      for (String name : invalid_names) {
        try {
          root.withName(name);
          fail("failed to catch invalid op name.");
        } catch (IllegalArgumentException ex) {
          // expected
        }
        // Subscopes follow the same rules
        try {
          root.withSubScope(name);
          fail("failed to catch invalid scope name: " + name);
        } catch (IllegalArgumentException ex) {
          // expected
        }
      }

      // Unusual but valid names.
      final String[] valid_names = {".", "..", "._-.", "a--."};

      for (String name : valid_names) {
        root.withName(name);
        root.withSubScope(name);
      }
    }
  }

  @Test
  public void hierarchy() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      Scope child = root.withSubScope("child");
      assertEquals("child/Const", Constant.create(child, 42).op().name());
      assertEquals("child/four", Constant.create(child.withName("four"), 4).op().name());
    }
  }

  @Test
  public void composite() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant dims = Constant.create(s.withName("dims"), new int[] {2, 2});

      // Create a composite op with a customized name
      Zeros z1 = Zeros.create(s.withName("example"), dims, DataType.FLOAT);
      assertEquals("example/Fill", z1.asOutput().op().name());
      assertNotNull(g.operation("example/Zero"));

      // Same composite op with a default name
      Zeros z2 = Zeros.create(s, dims, DataType.FLOAT);
      assertEquals("Zeros/Fill", z2.asOutput().op().name());
      assertNotNull(g.operation("Zeros/Zero"));
    }
  }

  @Test
  public void nameScope() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      assertNotNull(s.nameScope());
      assertTrue(s.nameScope().isEmpty());

      Scope sub1 = s.withSubScope("sub1");
      assertEquals("sub1", sub1.nameScope());

      Scope sub2 = sub1.withSubScope("sub2");
      assertEquals("sub1/sub2", sub2.nameScope());

      // Scopes are immutable.
      assertTrue(s.nameScope().isEmpty());
      assertEquals("sub1", sub1.nameScope());
    }
  }

  @Test
  public void deviceResetIsSticky() {
    try (Graph g = new Graph()) {
      Scope gpu = new Scope(g).withDevice("/gpu:0");
      assertEquals("/device:GPU:0", NoOp.create(gpu).op().device());

      Scope reset = gpu.withDevice(null);
      assertEquals("", NoOp.create(reset).op().device());
      assertEquals("", NoOp.create(reset.withDevice("/cpu:0")).op().device());
      assertEquals(
          "", NoOp.create(reset.withSubScope("deeper").withDevice("/gpu:1")).op().device());

      // The enclosing scope is not affected.
      assertEquals("/device:GPU:0", NoOp.create(gpu.withSubScope("other")).op().device());
    }
  }

  @Test
  public void nestedDevicesMergeFieldByField() {
    try (Graph g = new Graph()) {
      Scope gpu = new Scope(g).withDevice("/gpu:0");
      assertEquals("/task:1/device:GPU:0", NoOp.create(gpu.withDevice("/task:1")).op().device());
      assertEquals("/device:CPU:0", NoOp.create(gpu.withDevice("/cpu:0")).op().device());
      assertEquals("/device:GPU:0", NoOp.create(gpu.withDevice("")).op().device());
    }
  }

  @Test
  public void deviceFunctionsSeeTheOperation() {
    try (Graph g = new Graph()) {
      Scope ps = new Scope(g).withDevice("/job:ps");
      Scope placed =
          ps.withDeviceFunction(spec -> spec.type().equals("Const") ? "/gpu:0" : "");
      assertEquals("/job:ps/device:GPU:0", Constant.create(placed, 1).op().device());
      assertEquals("/job:ps", NoOp.create(placed).op().device());
    }
  }

  @Test
  public void colocationOverridesDevice() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      Constant a = Constant.create(root.withDevice("/cpu:0").withName("a"), 1.0);
      Constant b = Constant.create(root.withDevice("/gpu:0").withName("b"), 1.0);

      Scope withA = root.withColocation(Collections.singleton(a.op())).withDevice("/gpu:1");
      Constant c = Constant.create(withA.withName("c"), 2.0);
      assertEquals(a.op().device(), c.op().device());

      // Colocation constraints accumulate.
      Scope withBoth = withA.withColocation(Collections.singleton(b.op()));
      assertEquals(new HashSet<>(Arrays.asList(a.op(), b.op())), withBoth.colocationOps());
      assertEquals(withA.colocationOps(), withA.withColocation(Collections.<Operation>emptySet())
          .colocationOps());
    }
  }

  @Test
  public void controlDependenciesUnionClearAndPrune() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      NoOp a = NoOp.create(root.withName("a"));
      NoOp b = NoOp.create(root.withName("b"));
      NoOp c = NoOp.create(root.withName("c"));

      Scope s1 = root.withControlDependencies(Collections.singleton(a.op()));
      Scope s2 = s1.withControlDependencies(Arrays.asList(b.op(), c.op()));
      NoOp d = NoOp.create(s2.withName("d"));
      assertEquals(new HashSet<>(Arrays.asList(a.op(), b.op(), c.op())), d.op().controlInputs());

      Scope cleared = s2.withControlDependencies(Collections.<Operation>emptyList());
      assertTrue(cleared.controlDependencies().isEmpty());
      Scope reopened = cleared.withControlDependencies(Collections.singleton(d.op()));
      NoOp e = NoOp.create(reopened.withName("e"));
      assertEquals(Collections.singleton(d.op()), e.op().controlInputs());

      // A dependency reached through an input's control edges is not repeated.
      Constant x = Constant.create(s1.withName("x"), 1);
      Identity y = Identity.create(s1.withName("y"), x);
      assertEquals(Collections.singleton(a.op()), x.op().controlInputs());
      assertEquals(0, y.op().numControlInputs());
    }
  }

  @Test
  public void attributesSetRemoveAndClear() {
    try (Graph g = new Graph()) {
      Scope root = new Scope(g);
      Map<String, AttributeOverride> overrides = new LinkedHashMap<>();
      overrides.put("_a", AttributeOverride.set("1"));
      overrides.put("_b", AttributeOverride.set("2"));
      Scope s1 = root.withAttributes(overrides);
      assertEquals(2, s1.attributes().size());

      Scope s2 = s1.withAttributes(Collections.singletonMap("_a", AttributeOverride.remove()));
      assertEquals(Collections.singletonMap("_b", "2"), s2.attributes());
      Operation op = NoOp.create(s2).op();
      assertFalse(op.hasAttr("_a"));
      assertEquals("2", op.attrString("_b"));

      Scope s3 = s2.withAttributes(Collections.singletonMap("_b", AttributeOverride.set("3")));
      assertEquals("3", NoOp.create(s3).op().attrString("_b"));

      assertTrue(
          s2.withAttributes(Collections.<String, AttributeOverride>emptyMap())
              .attributes()
              .isEmpty());
      assertEquals(2, s1.attributes().size());
    }
  }

  @Test
  public void containerIsReplaced() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g).withContainer("a").withContainer("b");
      assertEquals("b", s.container());
      assertEquals("b", Variable.create(s, Shape.make(1), DataType.FLOAT).container());
      assertEquals("b", s.withSubScope("child").container());
    }
  }

  @Test
  public void referencesMustBelongToTheGraph() {
    try (Graph g1 = new Graph();
        Graph g2 = new Graph()) {
      Scope s1 = new Scope(g1);
      Scope s2 = new Scope(g2);
      Operation local = NoOp.create(s1).op();
      Operation foreign = NoOp.create(s2).op();
      Output foreignOutput = Constant.create(s2, 1).asOutput();
      Output localOutput = Constant.create(s1, 1).asOutput();

      try {
        s1.withControlDependencies(Collections.singleton(foreign));
        fail("added a control dependency from another graph");
      } catch (GraphMismatchException e) {
        // expected
      }
      try {
        s1.withColocation(Collections.singleton(foreign));
        fail("colocated with an operation from another graph");
      } catch (GraphMismatchException e) {
        // expected
      }
      try {
        s1.withControlDependencies(Collections.singleton(local)).withGraph(g2);
        fail("moved control dependencies to another graph");
      } catch (GraphMismatchException e) {
        // expected
      }
      try {
        s1.with(ScopeOverrides.create().values(foreignOutput));
        fail("accepted values from another graph");
      } catch (GraphMismatchException e) {
        // expected
      }
      try {
        s1.withValues("v", localOutput, foreignOutput);
        fail("accepted values from two graphs");
      } catch (GraphMismatchException e) {
        // expected
      }
    }
  }

  @Test
  public void valuesSelectTheGraph() {
    try (Graph g1 = new Graph();
        Graph g2 = new Graph()) {
      Output value = Constant.create(new Scope(g2), 1).asOutput();
      Scope s = new Scope(g1).withValues("v", value);
      assertSame(g2, s.graph());
      assertEquals("v", s.nameScope());
      assertEquals("v/Identity", Identity.create(s, value).op().name());
    }
  }

  @Test
  public void withNameNamesTheNextSubScope() {
    try (Graph g = new Graph()) {
      Scope named = new Scope(g).withName("custom");
      assertEquals("custom", named.withSubScope("Default").nameScope());
      // A name scope change forgets the name.
      Scope moved = named.with(ScopeOverrides.create().nameScope("elsewhere"));
      assertEquals("elsewhere/Const", moved.makeOpName("Const"));
    }
  }
}
