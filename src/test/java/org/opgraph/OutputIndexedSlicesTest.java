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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.op.Scope;
import org.opgraph.op.core.Constant;

/** Unit tests for {@link OutputIndexedSlices}. */
@RunWith(JUnit4.class)
public class OutputIndexedSlicesTest {

  @Test
  public void delegatesToValues() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output values = Constant.create(s.withName("values"), new float[][] {{1, 2}, {3, 4}})
          .asOutput();
      Output indices = Constant.create(s.withName("indices"), new int[] {0, 2}).asOutput();
      OutputIndexedSlices slices = OutputIndexedSlices.create(indices, values, null);

      assertEquals("values:0", slices.name());
      assertEquals(DataType.FLOAT, slices.dataType());
      assertEquals(values.op(), slices.op());
      assertEquals(g, slices.graph());
      assertEquals("", slices.device());
      assertNull(slices.denseShape());
      assertEquals(
          "<IndexedSlices values='values:0' indices='indices:0' denseShape=?>",
          slices.toString());
      assertEquals(slices, OutputIndexedSlices.create(indices, values, null));
      assertNotEquals(slices, OutputIndexedSlices.create(indices, indices, null));
    }
  }

  @Test
  public void convertsToASegmentSum() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output values = Constant.create(s.withName("values"), new float[][] {{1, 2}, {3, 4}})
          .asOutput();
      Output indices = Constant.create(s.withName("indices"), new int[] {0, 2}).asOutput();
      Output denseShape = Constant.create(s.withName("dense_shape"), new int[] {3, 2}).asOutput();
      OutputIndexedSlices slices = OutputIndexedSlices.create(indices, values, denseShape);

      Output dense = slices.toOutput(s, DataType.FLOAT);
      assertEquals("UnsortedSegmentSum", dense.op().type());
      assertEquals("IndexedSlicesToOutput/UnsortedSegmentSum", dense.op().name());
      assertEquals(values, dense.op().input(0));
      assertEquals(indices, dense.op().input(1));
      assertEquals("Gather", dense.op().input(2).op().type());
      assertNotNull(g.operation("IndexedSlicesToOutput/Zero"));
      assertEquals(DataType.FLOAT, dense.dataType());
      assertArrayEquals(new long[] {-1, 2}, dense.shape().toArray());

      // A second conversion gets its own name scope.
      Output again = slices.toOutput(s, null);
      assertEquals("IndexedSlicesToOutput/UnsortedSegmentSum_1", again.op().name());
    }
  }

  @Test
  public void conversionNeedsTheDenseShapeAndType() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output values = Constant.create(s, new float[] {1, 2}).asOutput();
      Output indices = Constant.create(s, new int[] {0, 2}).asOutput();
      try {
        OutputIndexedSlices.create(indices, values, null).toOutput(s, null);
        fail("converted slices with an unknown dense shape");
      } catch (InvalidDataTypeException e) {
        // expected
      }
      Output denseShape = Constant.create(s, new int[] {3}).asOutput();
      try {
        OutputIndexedSlices.create(indices, values, denseShape).toOutput(s, DataType.DOUBLE);
        fail("converted FLOAT slices to DOUBLE");
      } catch (InvalidDataTypeException e) {
        // expected
      }
    }
  }

  @Test
  public void partsMustShareAGraph() {
    try (Graph g1 = new Graph();
        Graph g2 = new Graph()) {
      Output values = Constant.create(new Scope(g1), new float[] {1, 2}).asOutput();
      Output indices = Constant.create(new Scope(g2), new int[] {0, 2}).asOutput();
      try {
        OutputIndexedSlices.create(indices, values, null);
        fail("created slices from two graphs");
      } catch (GraphMismatchException e) {
        // expected
      }
    }
  }
}
