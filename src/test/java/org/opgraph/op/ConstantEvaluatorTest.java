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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.opgraph.DataType;
import org.opgraph.Graph;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.Tensor;
import org.opgraph.TestUtil;
import org.opgraph.op.core.Cast;
import org.opgraph.op.core.Concat;
import org.opgraph.op.core.Constant;
import org.opgraph.op.core.Fill;
import org.opgraph.op.core.Identity;
import org.opgraph.op.core.Range;
import org.opgraph.op.core.Rank;
import org.opgraph.op.core.Size;
import org.opgraph.op.core.Stack;
import org.opgraph.op.core.Zeros;

@RunWith(JUnit4.class)
public class ConstantEvaluatorTest {

  @Test
  public void constantsAreKnownAndNoLongerFeedable() {
    try (Graph g = new Graph()) {
      Output c = Constant.create(new Scope(g), new int[] {1, 2}).asOutput();
      assertTrue(g.isFeedable(c));
      Tensor value = ConstantEvaluator.constantValue(c);
      assertEquals(Tensor.create(new int[] {1, 2}), value);
      assertFalse(g.isFeedable(c));
    }
  }

  @Test
  public void placeholdersAreUnknownAndStayFeedable() {
    try (Graph g = new Graph()) {
      Output p = TestUtil.placeholder(g, "p", DataType.INT32, Shape.make(2));
      assertNull(ConstantEvaluator.constantValue(p));
      assertTrue(g.isFeedable(p));
    }
  }

  @Test
  public void identityForwardsItsInput() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output i = Identity.create(s, Constant.create(s, 7L)).asOutput();
      assertEquals(7L, ConstantEvaluator.constantValue(i).longValue());
    }
  }

  @Test
  public void shapeSizeAndRankOfStaticallyKnownShapes() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output p = TestUtil.placeholder(g, "p", DataType.FLOAT, Shape.make(2, 3));

      Tensor shape = ConstantEvaluator.constantValue(
          org.opgraph.op.core.Shape.create(s, p).asOutput());
      assertEquals(DataType.INT32, shape.dataType());
      assertArrayEquals(new long[] {2, 3}, shape.longValues());

      Tensor shape64 = ConstantEvaluator.constantValue(
          org.opgraph.op.core.Shape.create(s, p, DataType.INT64).asOutput());
      assertEquals(DataType.INT64, shape64.dataType());

      assertEquals(6, ConstantEvaluator.constantValue(Size.create(s, p).asOutput()).intValue());
      assertEquals(2, ConstantEvaluator.constantValue(Rank.create(s, p).asOutput()).intValue());
    }
  }

  @Test
  public void partiallyKnownShapesHaveNoValue() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output p = TestUtil.placeholder(g, "p", DataType.FLOAT, Shape.make(-1, 3));
      assertNull(ConstantEvaluator.constantValue(
          org.opgraph.op.core.Shape.create(s, p).asOutput()));
      assertNull(ConstantEvaluator.constantValue(Size.create(s, p).asOutput()));
      assertEquals(2, ConstantEvaluator.constantValue(Rank.create(s, p).asOutput()).intValue());
    }
  }

  @Test
  public void integerAndFloatingRanges() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output ints =
          Range.create(s, Constant.create(s, 1), Constant.create(s, 8), Constant.create(s, 3))
              .asOutput();
      assertArrayEquals(new long[] {1, 4, 7}, ConstantEvaluator.constantValue(ints).longValues());

      Output floats =
          Range.create(
                  s, Constant.create(s, 0f), Constant.create(s, 1f), Constant.create(s, 0.25f))
              .asOutput();
      Tensor value = ConstantEvaluator.constantValue(floats);
      assertEquals(DataType.FLOAT, value.dataType());
      assertArrayEquals(new double[] {0, 0.25, 0.5, 0.75}, value.doubleValues(), 0);
    }
  }

  @Test
  public void castConvertsNumbersButNotStrings() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output cast = Cast.create(s, Constant.create(s, new float[] {1.7f, -2.5f}), DataType.INT32)
          .asOutput();
      Tensor value = ConstantEvaluator.constantValue(cast);
      assertEquals(DataType.INT32, value.dataType());
      assertArrayEquals(new long[] {1, -2}, value.longValues());

      Output text = Cast.create(s, Constant.create(s, "1"), DataType.INT32).asOutput();
      assertNull(ConstantEvaluator.constantValue(text));

      Output bools =
          Cast.create(s, Constant.create(s, new double[] {0.5, 0.0, -0.25}), DataType.BOOL)
              .asOutput();
      assertArrayEquals(
          new long[] {1, 0, 1}, ConstantEvaluator.constantValue(bools).longValues());
    }
  }

  @Test
  public void concatAlongPositiveAndNegativeAxes() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Constant a = Constant.create(s, new int[][] {{1, 2}});
      Constant b = Constant.create(s, new int[][] {{3, 4}});

      Tensor rows =
          ConstantEvaluator.constantValue(
              Concat.create(s, Arrays.asList(a, b), Constant.create(s, 0)).asOutput());
      assertArrayEquals(new long[] {2, 2}, rows.shape());
      assertArrayEquals(new long[] {1, 2, 3, 4}, rows.longValues());

      Tensor columns =
          ConstantEvaluator.constantValue(
              Concat.create(s, Arrays.asList(a, b), Constant.create(s, 1)).asOutput());
      assertArrayEquals(new long[] {1, 4}, columns.shape());
      assertArrayEquals(new long[] {1, 2, 3, 4}, columns.longValues());

      Tensor last =
          ConstantEvaluator.constantValue(
              Concat.create(s, Arrays.asList(a, b), Constant.create(s, -1)).asOutput());
      assertEquals(columns, last);
    }
  }

  @Test
  public void concatWithUnknownInputHasNoValue() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output p = TestUtil.placeholder(g, "p", DataType.INT32, Shape.make(2));
      Output concat =
          Concat.create(s, Arrays.asList(Constant.create(s, new int[] {1}), p),
                  Constant.create(s, 0))
              .asOutput();
      assertNull(ConstantEvaluator.constantValue(concat));
    }
  }

  @Test
  public void stackScalarsAndVectors() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Tensor scalars =
          ConstantEvaluator.constantValue(
              Stack.create(s, Arrays.asList(Constant.create(s, 5L), Constant.create(s, 6L)))
                  .asOutput());
      assertArrayEquals(new long[] {2}, scalars.shape());
      assertArrayEquals(new long[] {5, 6}, scalars.longValues());

      Tensor vectors =
          ConstantEvaluator.constantValue(
              Stack.create(
                      s,
                      Arrays.asList(
                          Constant.create(s, new int[] {1, 2}),
                          Constant.create(s, new int[] {3, 4})),
                      1)
                  .asOutput());
      assertArrayEquals(new long[] {2, 2}, vectors.shape());
      assertArrayEquals(new long[] {1, 3, 2, 4}, vectors.longValues());
    }
  }

  @Test
  public void fillAndZeros() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Tensor filled =
          ConstantEvaluator.constantValue(
              Fill.create(s, Constant.create(s, new int[] {2, 2}), Constant.create(s, 9))
                  .asOutput());
      assertArrayEquals(new long[] {2, 2}, filled.shape());
      assertArrayEquals(new long[] {9, 9, 9, 9}, filled.longValues());

      Tensor zeros =
          ConstantEvaluator.constantValue(
              Zeros.create(s, Constant.create(s, new long[] {3}), DataType.FLOAT).asOutput());
      assertEquals(DataType.FLOAT, zeros.dataType());
      assertArrayEquals(new double[] {0, 0, 0}, zeros.doubleValues(), 0);
    }
  }

  @Test
  public void shapeOfShapeOperationIsItsInputShape() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output p = TestUtil.placeholder(g, "p", DataType.FLOAT, Shape.make(-1, 3));
      Shape shape =
          ConstantEvaluator.constantValueAsShape(
              org.opgraph.op.core.Shape.create(s, p).asOutput());
      assertEquals(Shape.make(-1, 3), shape);
    }
  }

  @Test
  public void shapeOfPackedAndConcatenatedSizes() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output unknownSize = TestUtil.placeholder(g, "n", DataType.INT32, Shape.scalar());
      Output packed =
          Stack.create(s, Arrays.asList(Constant.create(s, 2), unknownSize)).asOutput();
      assertEquals(Shape.make(2, -1), ConstantEvaluator.constantValueAsShape(packed));

      Output concat =
          Concat.create(s, Arrays.asList(packed, Constant.create(s, new int[] {3})),
                  Constant.create(s, 0))
              .asOutput();
      assertEquals(Shape.make(2, -1, 3), ConstantEvaluator.constantValueAsShape(concat));
    }
  }

  @Test
  public void shapeOfEmptyVectorIsScalar() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output empty =
          Constant.create(s, Tensor.ofLongs(DataType.INT64, new long[] {0}, new long[0]))
              .asOutput();
      assertEquals(Shape.scalar(), ConstantEvaluator.constantValueAsShape(empty));
    }
  }

  @Test
  public void shapeOfUnknownOrPartialValues() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Shape fromScalar = ConstantEvaluator.constantValueAsShape(Constant.create(s, 3).asOutput());
      assertEquals(-1, fromScalar.numDimensions());

      Output dims = TestUtil.placeholder(g, "dims", DataType.INT32, Shape.make(3));
      assertEquals(Shape.unknown(3), ConstantEvaluator.constantValueAsShape(dims));

      Shape partial =
          ConstantEvaluator.constantValueAsShape(
              Constant.create(s, new int[] {-1, 4}).asOutput());
      assertNotNull(partial);
      assertEquals(Shape.make(-1, 4), partial);
    }
  }

  @Test
  public void rangesTooLongToFoldAreUnknown() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output range =
          Range.create(
                  s, Constant.create(s, 0L), Constant.create(s, 3_000_000_000L),
                  Constant.create(s, 1L))
              .asOutput();
      assertEquals(Shape.make(3_000_000_000L), range.shape());
      assertNull(ConstantEvaluator.constantValue(range));
      assertTrue(g.isFeedable(range));
    }
  }

  @Test
  public void fillsTooLargeToFoldAreUnknown() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output fill =
          Fill.create(s, Constant.create(s, new long[] {65536, 65537}), Constant.create(s, 7))
              .asOutput();
      assertEquals(Shape.make(65536, 65537), fill.shape());
      assertNull(ConstantEvaluator.constantValue(fill));
    }
  }

  @Test
  public void sizesBeyondTheOutputTypeAreUnknown() {
    try (Graph g = new Graph()) {
      Scope s = new Scope(g);
      Output p = TestUtil.placeholder(g, "p", DataType.FLOAT, Shape.make(65536, 65537));
      assertNull(ConstantEvaluator.constantValue(Size.create(s, p).asOutput()));
      Tensor size = ConstantEvaluator.constantValue(Size.create(s, p, DataType.INT64).asOutput());
      assertEquals(65536L * 65537L, size.longValue());
    }
  }
}
