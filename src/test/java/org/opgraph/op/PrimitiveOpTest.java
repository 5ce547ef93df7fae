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
import static org.junit.Assert.assertNotEquals;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.TestUtil;
import org.opgraph.op.core.Identity;
import org.opgraph.op.linalg.Qr;

@RunWith(JUnit4.class)
public class PrimitiveOpTest {

  @Test
  public void wrappersOfTheSameOperationAreEqual() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output matrix = TestUtil.placeholder(g, "matrix", DataType.FLOAT, Shape.make(3, 3));
      Qr qr = Qr.create(s, matrix);
      Qr other = Qr.create(s, matrix);
      PrimitiveOp rewrapped = new PrimitiveOp(qr.op()) {};

      assertEquals(qr, rewrapped);
      assertEquals(rewrapped, qr);
      assertEquals(qr.hashCode(), rewrapped.hashCode());
      assertNotEquals(qr, other);

      Set<Op> ops = new HashSet<>(Arrays.<Op>asList(qr, other, rewrapped));
      assertEquals(2, ops.size());
    }
  }

  @Test
  public void describesTheWrappedOperation() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Identity id = Identity.create(s.withName("copy"), TestUtil.constant(g, "c", 1));
      assertEquals("<Identity 'copy'>", id.toString());
      assertEquals("copy", id.op().name());
    }
  }
}
