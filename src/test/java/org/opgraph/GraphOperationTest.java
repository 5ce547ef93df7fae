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

package org.opgraph;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.op.Scope;

/** Unit tests for {@link org.opgraph.GraphOperation}. */
@RunWith(JUnit4.class)
public class GraphOperationTest {

  @Test
  public void operationEquality() {
    GraphOperation op1;
    try (Graph g = new Graph()) {
      op1 = TestUtil.constantOp(g, "op1", 1);
      GraphOperation op2 = TestUtil.constantOp(g, "op2", 2);
      GraphOperation op3 = g.operation("op1");
      assertEquals(op1, op1);
      assertNotEquals(op1, op2);
      assertEquals(op1, op3);
      assertEquals(op1.hashCode(), op3.hashCode());
      assertNotEquals(op2, op3);
    }
    try (Graph g = new Graph()) {
      GraphOperation op2 = TestUtil.constantOp(g, "op1", 1);
      assertNotEquals(op1, op2);
    }
  }

  @Test
  public void operationCollection() {
    try (Graph g = new Graph()) {
      GraphOperation op1 = TestUtil.constantOp(g, "op1", 1);
      GraphOperation op2 = TestUtil.constantOp(g, "op2", 2);
      GraphOperation op3 = g.operation("op1");
      Set<Operation> ops = new HashSet<>();
      ops.addAll(Arrays.asList(op1, op2, op3));
      assertEquals(2, ops.size());
      assertTrue(ops.contains(op1));
      assertTrue(ops.contains(op2));
      assertTrue(ops.contains(op3));
    }
  }

  @Test
  public void outputsAndConsumers() {
    try (Graph g = new Graph()) {
      Output a = TestUtil.constant(g, "a", new int[] {1, 2});
      Output b = TestUtil.identity(g, "b", a);
      Output c = TestUtil.identity(g, "c", a);

      assertEquals("a:0", a.name());
      assertEquals(0, a.index());
      assertSame(g, a.graph());
      assertEquals(DataType.INT32, b.dataType());
      assertEquals(Shape.make(2), b.shape());
      assertEquals("<Const 'a:0' shape=[2] dtype=INT32>", a.toString());

      assertEquals(1, b.op().numInputs());
      assertEquals(a, b.op().input(0));
      assertEquals(Arrays.asList(a), c.op().inputs());
      assertEquals(
          Arrays.asList(new OperationInput(b.op(), 0), new OperationInput(c.op(), 0)),
          a.consumers());
      assertEquals(DataType.INT32, a.consumers().get(0).dataType());
      assertTrue(b.consumers().isEmpty());
    }
  }

  @Test
  public void outputListAndBounds() {
    try (Graph g = new Graph()) {
      GraphOperation a = TestUtil.constantOp(g, "a", 1);
      assertArrayEquals(new Output[] {a.output(0)}, a.outputList(0, 1));
      try {
        a.output(1);
        fail("read an output the operation does not have");
      } catch (IndexOutOfBoundsException e) {
        // expected
      }
    }
  }

  @Test
  public void controlEdges() {
    try (Graph g = new Graph()) {
      GraphOperation a = TestUtil.constantOp(g, "a", 1);
      GraphOperation b = g.opBuilder("NoOp", "b").addControlInput(a).build();
      assertEquals(0, a.numControlInputs());
      assertEquals(1, a.numControlOutputs());
      assertTrue(a.controlOutputs().contains(b));
      assertEquals(1, b.numControlInputs());
      assertTrue(b.controlInputs().contains(a));
      assertEquals(0, b.numOutputs());
    }
  }

  @Test
  public void attributes() {
    try (Graph g = new Graph()) {
      GraphOperation a = TestUtil.constantOp(g, "a", 1);
      assertTrue(a.hasAttr("dtype"));
      assertFalse(a.hasAttr("shape"));
      assertEquals(DataType.INT32, a.attrType("dtype"));
      assertEquals(Tensors.create(1), a.attrTensor("value"));
      try {
        a.attrLong("dtype");
        fail("read a type attribute as a long");
      } catch (IllegalArgumentException e) {
        // expected
      }
      try {
        a.attrString("missing");
        fail("read a missing attribute");
      } catch (IllegalArgumentException e) {
        // expected
      }
      assertEquals("<Const 'a'>", a.toString());
      assertEquals("", a.device());
    }
  }

  @Test
  public void toOutputChecksTheType() {
    try (Graph g = new Graph()) {
      Output a = TestUtil.constant(g, "a", 1);
      Scope scope = new Scope(g);
      assertSame(a, a.toOutput(scope, null));
      assertSame(a, a.toOutput(scope, DataType.INT32));
      try {
        a.toOutput(scope, DataType.FLOAT);
        fail("converted an INT32 output to FLOAT");
      } catch (InvalidDataTypeException e) {
        // expected
      }
    }
  }
}
