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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.TestUtil;

/** Unit tests for {@link OperationHelper}. */
@RunWith(JUnit4.class)
public class OperationHelperTest {

  @Test
  public void buildOperationAndCollectOutputs() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output matrix = TestUtil.placeholder(g, "matrix", DataType.FLOAT, Shape.make(3, 2));

      OperationHelper qr = OperationHelper.create(s, "Qr");
      qr.builder().addInput(matrix).setAttr("full_matrices", false);

      Output q = qr.nextOutput();
      Output r = qr.nextOutput();
      assertEquals("Qr", q.op().name());
      assertSame(qr.operation(), qr.operation());
      assertArrayEquals(new long[] {3, 2}, q.shape().toArray());
      assertArrayEquals(new long[] {2, 2}, r.shape().toArray());
      try {
        qr.nextOutput();
        fail("collected an output Qr does not have");
      } catch (IndexOutOfBoundsException e) {
        // expected
      }
      try {
        qr.builder();
        fail("configured an operation already built");
      } catch (IllegalStateException e) {
        // expected
      }
    }
  }

  @Test
  public void buildOperationAndCollectOutputList() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output matrix = TestUtil.placeholder(g, "matrix", DataType.DOUBLE, Shape.make(3, 2));

      OperationHelper svd = OperationHelper.create(s.withName("decomposition"), "Svd");
      svd.builder().addInput(matrix);

      List<Output> outputs = svd.nextOutputList(3);
      assertEquals(3, outputs.size());
      assertEquals("decomposition", outputs.get(0).op().name());
      assertArrayEquals(new long[] {2}, outputs.get(0).shape().toArray());
      assertArrayEquals(new long[] {3, 2}, outputs.get(1).shape().toArray());
      assertArrayEquals(new long[] {2, 2}, outputs.get(2).shape().toArray());
    }
  }

  @Test
  public void defaultNameDiffersFromType() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      OperationHelper variable = OperationHelper.create(s, "VariableV2", "Variable");
      variable.builder().setAttr("dtype", DataType.FLOAT).setAttr("shape", Shape.scalar());
      assertEquals("Variable", variable.operation().name());
      assertEquals("VariableV2", variable.operation().type());
    }
  }
}
