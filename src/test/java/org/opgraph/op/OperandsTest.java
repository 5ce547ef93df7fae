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

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.TestUtil;
import org.opgraph.op.core.Constant;
import org.opgraph.op.linalg.Qr;

/** Unit tests for {@link org.opgraph.op.Operands}. */
@RunWith(JUnit4.class)
public class OperandsTest {

  @Test
  public void createOutputArrayFromOperandList() {
    try (Graph g = new Graph()) {
      Output matrix = TestUtil.placeholder(g, "matrix", DataType.FLOAT, Shape.make(2, 2));
      Qr qr = Qr.create(new Scope(g), matrix);
      List<Output> list = Arrays.asList(qr.q(), qr.r());
      Output[] array = Operands.asOutputs(list);
      assertEquals(list.size(), array.length);
      assertSame(array[0], list.get(0));
      assertSame(array[1], list.get(1));
    }
  }

  @Test
  public void producersAreDistinctAndOrdered() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant c = Constant.create(s, 1);
      Output matrix = TestUtil.placeholder(g, "matrix", DataType.FLOAT, Shape.make(2, 2));
      Qr qr = Qr.create(s, matrix);
      List<Operand> operands = Arrays.<Operand>asList(c, qr.q(), qr.r(), c);
      Set<Operation> producers = Operands.producers(operands);
      assertEquals(Arrays.asList(c.op(), qr.op()), Arrays.asList(producers.toArray()));
    }
  }
}
