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
import org.opgraph.op.Scope;
import org.opgraph.op.core.Constant;
import org.opgraph.op.core.Gather;
import org.opgraph.op.core.UnsortedSegmentSum;

/**
 * A sparse representation of a tensor by a subset of its rows.
 *
 * <p>The represented dense tensor {@code dense} satisfies {@code dense[indices[i], ...] =
 * values[i, ...]} for every row {@code i} of {@code values}, all other rows being zero. Repeated
 * indices sum up. This is typically the gradient of a gather, whose few rows are much cheaper to
 * carry than the dense tensor.
 *
 * <p>The shape of the dense tensor, {@code denseShape}, is optional; without it the value cannot be
 * converted to an {@link Output}.
 */
public final class OutputIndexedSlices implements OutputLike {

  /**
   * Creates indexed slices.
   *
   * @param indices 1-D integer tensor of row indices
   * @param values tensor whose first dimension matches the length of {@code indices}
   * @param denseShape 1-D integer tensor, the shape of the dense tensor, or null if unknown
   * @throws GraphMismatchException if the tensors belong to different graphs
   */
  public static OutputIndexedSlices create(
      Output indices, Output values, @Nullable Output denseShape) {
    checkSameGraph(values, indices);
    if (denseShape != null) {
      checkSameGraph(values, denseShape);
    }
    return new OutputIndexedSlices(indices, values, denseShape);
  }

  public Output indices() {
    return indices;
  }

  public Output values() {
    return values;
  }

  /** Returns the shape of the dense tensor, or null if it is unknown. */
  public @Nullable Output denseShape() {
    return denseShape;
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
   * Adds operations summing the slices into the dense tensor, in the name scope {@code
   * IndexedSlicesToOutput} of {@code scope}.
   *
   * @throws InvalidDataTypeException if {@code dataType} is not the type of the values, or the
   *     dense shape is unknown
   */
  @Override
  public Output toOutput(Scope scope, @Nullable DataType dataType) {
    if (dataType != null && dataType != dataType()) {
      throw new InvalidDataTypeException(
          String.format(
              "Output conversion requested data type '%s' for '%s' with data type '%s'",
              dataType, name(), dataType()));
    }
    if (denseShape == null) {
      throw new InvalidDataTypeException(
          String.format(
              "Output conversion requested for indexed slices '%s' with an unknown dense shape",
              name()));
    }
    Scope s = scope.withValues("IndexedSlicesToOutput", values, indices, denseShape);
    Gather numRows = Gather.create(s, denseShape, Constant.create(s.withName("Zero"), 0));
    return UnsortedSegmentSum.create(s, values, indices, numRows).asOutput();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof OutputIndexedSlices)) {
      return false;
    }
    OutputIndexedSlices that = (OutputIndexedSlices) o;
    return indices.equals(that.indices)
        && values.equals(that.values)
        && Objects.equals(denseShape, that.denseShape);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indices, values, denseShape);
  }

  @Override
  public String toString() {
    return String.format(
        "<IndexedSlices values='%s' indices='%s' denseShape=%s>",
        values.name(), indices.name(), denseShape == null ? "?" : "'" + denseShape.name() + "'");
  }

  private OutputIndexedSlices(Output indices, Output values, @Nullable Output denseShape) {
    this.indices = indices;
    this.values = values;
    this.denseShape = denseShape;
  }

  static void checkSameGraph(Output a, Output b) {
    if (a.graph() != b.graph()) {
      throw new GraphMismatchException(
          String.format("'%s' and '%s' must be defined in the same graph", a.name(), b.name()));
    }
  }

  private final Output indices;
  private final Output values;
  private final @Nullable Output denseShape;
}
