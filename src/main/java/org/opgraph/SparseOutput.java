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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.op.ConstantEvaluator;
import org.opgraph.op.Scope;
import org.opgraph.op.core.Constant;
import org.opgraph.op.core.SparseToDense;

/**
 * A sparse tensor in coordinate format.
 *
 * <p>Three tensors describe a sparse tensor of rank {@code R} with {@code N} non-default entries:
 *
 * <ul>
 *   <li>{@code indices}, an {@code INT64} matrix of shape {@code [N, R]} holding the coordinates of
 *       the entries,
 *   <li>{@code values}, a vector of shape {@code [N]} holding the entries,
 *   <li>{@code denseShape}, an {@code INT64} vector of shape {@code [R]}.
 * </ul>
 *
 * <p>For example, {@code indices=[[0, 0], [1, 2]]}, {@code values=[1, 2]} and {@code
 * denseShape=[3, 4]} represent {@code [[1, 0, 0, 0], [0, 0, 2, 0], [0, 0, 0, 0]]}.
 */
public final class SparseOutput implements OutputLike {

  /**
   * Creates a sparse tensor, checking the types and the static shapes of its parts.
   *
   * @throws InvalidDataTypeException if {@code indices} or {@code denseShape} are not {@code INT64}
   *     tensors, if a part has the wrong rank or if the sizes of the parts do not match
   * @throws GraphMismatchException if the tensors belong to different graphs
   */
  public static SparseOutput create(Output indices, Output values, Output denseShape) {
    OutputIndexedSlices.checkSameGraph(values, indices);
    OutputIndexedSlices.checkSameGraph(values, denseShape);
    if (indices.dataType() != DataType.INT64) {
      throw new InvalidDataTypeException(
          String.format(
              "Indices '%s' of a sparse tensor must be INT64, not %s",
              indices.name(), indices.dataType()));
    }
    if (denseShape.dataType() != DataType.INT64) {
      throw new InvalidDataTypeException(
          String.format(
              "Dense shape '%s' of a sparse tensor must be INT64, not %s",
              denseShape.name(), denseShape.dataType()));
    }
    Shape indicesShape = withRank(indices, 2, "Indices");
    Shape valuesShape = withRank(values, 1, "Values");
    Shape denseShapeShape = withRank(denseShape, 1, "Dense shape");
    if (!compatible(indicesShape.size(0), valuesShape.size(0))) {
      throw new InvalidDataTypeException(
          String.format(
              "Sparse tensor has %d indices but %d values",
              indicesShape.size(0), valuesShape.size(0)));
    }
    if (!compatible(indicesShape.size(1), denseShapeShape.size(0))) {
      throw new InvalidDataTypeException(
          String.format(
              "Sparse tensor indices have rank %d but its dense shape has rank %d",
              indicesShape.size(1), denseShapeShape.size(0)));
    }
    return new SparseOutput(indices, values, denseShape);
  }

  public Output indices() {
    return indices;
  }

  public Output values() {
    return values;
  }

  public Output denseShape() {
    return denseShape;
  }

  /** Returns the static shape of the dense tensor, as far as the graph structure reveals it. */
  public Shape shape() {
    return ConstantEvaluator.constantValueAsShape(denseShape);
  }

  @Override
  public Graph graph() {
    return values.graph();
  }

  @Override
  public String name() {
    return values.name();
  }

  @Override
  public DataType dataType() {
    return values.dataType();
  }

  @Override
  public String device() {
    return values.device();
  }

  @Override
  public Operation op() {
    return values.op();
  }

  /**
   * Adds operations building the dense tensor, with zeros (empty strings for {@code STRING}
   * values) as default entries, in the name scope {@code SparseToOutput} of {@code scope}.
   *
   * @throws InvalidDataTypeException if {@code dataType} is not the type of the values
   */
  @Override
  public Output toOutput(Scope scope, @Nullable DataType dataType) {
    if (dataType != null && dataType != dataType()) {
      throw new InvalidDataTypeException(
          String.format(
              "Output conversion requested data type '%s' for '%s' with data type '%s'",
              dataType, name(), dataType()));
    }
    Scope s = scope.withValues("SparseToOutput", indices, values, denseShape);
    Tensor zero =
        dataType() == DataType.STRING ? Tensors.create("") : Tensors.scalar(dataType(), 0);
    Constant defaultValue = Constant.create(s.withName("DefaultValue"), zero);
    return SparseToDense.create(s, indices, denseShape, values, defaultValue).asOutput();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SparseOutput)) {
      return false;
    }
    SparseOutput that = (SparseOutput) o;
    return indices.equals(that.indices)
        && values.equals(that.values)
        && denseShape.equals(that.denseShape);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indices, values, denseShape);
  }

  @Override
  public String toString() {
    return String.format(
        "<SparseOutput values='%s' indices='%s' denseShape='%s'>",
        values.name(), indices.name(), denseShape.name());
  }

  private SparseOutput(Output indices, Output values, Output denseShape) {
    this.indices = indices;
    this.values = values;
    this.denseShape = denseShape;
  }

  private static Shape withRank(Output output, int rank, String role) {
    Shape shape = output.shape();
    if (shape.numDimensions() >= 0 && shape.numDimensions() != rank) {
      throw new InvalidDataTypeException(
          String.format(
              "%s '%s' of a sparse tensor must have rank %d, got shape %s",
              role, output.name(), rank, shape));
    }
    return shape.numDimensions() < 0 ? Shape.unknown(rank) : shape;
  }

  private static boolean compatible(long a, long b) {
    return a < 0 || b < 0 || a == b;
  }

  private final Output indices;
  private final Output values;
  private final Output denseShape;
}
