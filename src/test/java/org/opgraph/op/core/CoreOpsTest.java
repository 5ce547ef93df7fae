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

package org.opgraph.op.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.TestUtil;
import org.opgraph.op.Scope;

@RunWith(JUnit4.class)
public class CoreOpsTest {

  @Test
  public void placeholdersAndVariables() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Placeholder x = Placeholder.create(s, DataType.FLOAT, Shape.make(-1, 3));
      assertEquals("Placeholder", x.op().name());
      assertEquals(Shape.make(-1, 3), x.output().shape());
      assertEquals(Shape.unknown(), Placeholder.create(s, DataType.INT32).output().shape());

      Variable v = Variable.create(s, Shape.make(3), DataType.DOUBLE);
      assertEquals("Variable", v.op().name());
      assertEquals("VariableV2", v.op().type());
      assertEquals("", v.container());
      assertEquals(Shape.make(3), v.asOutput().shape());

      Variable shared =
          Variable.create(s.withContainer("state"), Shape.scalar(), DataType.INT64, "counter");
      assertEquals("state", shared.container());
      assertEquals("counter", shared.op().attrString("shared_name"));
    }
  }

  @Test
  public void identityAndNoOp() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant c = Constant.create(s, new int[] {1, 2});
      Identity id = Identity.create(s, c);
      assertEquals(DataType.INT32, id.asOutput().dataType());
      assertEquals(Shape.make(2), id.asOutput().shape());

      NoOp init = NoOp.create(s.withControlDependencies(Collections.singletonList(id.op())));
      assertEquals("NoOp", init.op().name());
      assertEquals(0, init.op().numOutputs());
      assertEquals(Collections.singleton(id.op()), init.op().controlInputs());
    }
  }

  @Test
  public void gatherAndSegmentSum() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output params = TestUtil.placeholder(g, "params", DataType.FLOAT, Shape.make(10, 4));
      Output indices = TestUtil.placeholder(g, "indices", DataType.INT64, Shape.make(3));

      Gather rows = Gather.create(s, params, indices);
      assertEquals(Shape.make(3, 4), rows.asOutput().shape());

      UnsortedSegmentSum known =
          UnsortedSegmentSum.create(s, rows, indices, Constant.create(s, 7L));
      assertEquals(Shape.make(7, 4), known.asOutput().shape());

      Output n = TestUtil.placeholder(g, "n", DataType.INT64, Shape.scalar());
      UnsortedSegmentSum unknown = UnsortedSegmentSum.create(s, rows, indices, n);
      assertEquals(Shape.make(-1, 4), unknown.asOutput().shape());
    }
  }

  @Test
  public void rangeRejectsZeroDelta() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      try {
        Range.create(s, Constant.create(s, 0), Constant.create(s, 5), Constant.create(s, 0));
        fail();
      } catch (IllegalArgumentException e) {
        assertThat(e).hasMessageThat().contains("non-zero delta");
      }
      assertNull(g.operation("Range"));
    }
  }

  @Test
  public void concatAndStackValidateTheirAxis() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant a = Constant.create(s, new int[] {1, 2});
      Constant b = Constant.create(s, new int[] {3});
      Concat concat = Concat.create(s, Arrays.asList(a, b), Constant.create(s, -1));
      assertEquals(Shape.make(3), concat.asOutput().shape());
      try {
        Concat.create(s, Arrays.asList(a, b), Constant.create(s, 1));
        fail();
      } catch (IllegalArgumentException expected) {
        // expected
      }
      Stack stack = Stack.create(s, Arrays.asList(a, a), 1);
      assertEquals(Shape.make(2, 2), stack.asOutput().shape());
      try {
        Stack.create(s, Arrays.asList(a, a), 2);
        fail();
      } catch (IllegalArgumentException expected) {
        // expected
      }
    }
  }

  @Test
  public void castAndShapeOps() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output x = TestUtil.placeholder(g, "x", DataType.FLOAT, Shape.make(2, -1));
      assertEquals(DataType.INT64, Cast.create(s, x, DataType.INT64).asOutput().dataType());
      assertEquals(Shape.make(2, -1), Cast.create(s, x, DataType.DOUBLE).asOutput().shape());
      assertEquals(Shape.make(2), org.opgraph.op.core.Shape.create(s, x).asOutput().shape());
      Output shape64 = org.opgraph.op.core.Shape.create(s, x, DataType.INT64).asOutput();
      assertEquals(DataType.INT64, shape64.dataType());
      assertEquals(Shape.scalar(), Size.create(s, x).asOutput().shape());
      assertEquals(Shape.scalar(), Rank.create(s, x).asOutput().shape());
    }
  }
}
