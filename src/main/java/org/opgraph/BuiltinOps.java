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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Definitions of the operation types every graph accepts. */
final class BuiltinOps {

  static void registerAll(OpRegistry registry) {
    registry.register(OpDef.create("Const", BuiltinOps::constShape));
    registry.register(OpDef.create("Placeholder", BuiltinOps::placeholderShape));
    registry.register(OpDef.create("Identity", BuiltinOps::identityShape));
    registry.register(OpDef.create("NoOp", c -> Collections.<OutputSpec>emptyList()));
    registry.register(OpDef.create("Shape", BuiltinOps::shapeShape));
    registry.register(OpDef.create("Size", c -> scalarOf(c.attrType("out_type", DataType.INT32))));
    registry.register(OpDef.create("Rank", c -> scalarOf(DataType.INT32)));
    registry.register(OpDef.create("Range", BuiltinOps::rangeShape));
    registry.register(OpDef.create("Cast", BuiltinOps::castShape));
    registry.register(OpDef.create("Concat", c -> concatShape(c, 1, c.numInputs(), 0)));
    registry.register(
        OpDef.create("ConcatV2", c -> concatShape(c, 0, c.numInputs() - 1, c.numInputs() - 1)));
    registry.register(OpDef.create("Pack", BuiltinOps::packShape));
    registry.register(OpDef.create("Fill", BuiltinOps::fillShape));
    registry.register(OpDef.create("Gather", BuiltinOps::gatherShape));
    registry.register(OpDef.create("UnsortedSegmentSum", BuiltinOps::unsortedSegmentSumShape));
    registry.register(OpDef.create("SparseToDense", BuiltinOps::sparseToDenseShape));
    registry.register(OpDef.create("VariableV2", BuiltinOps::variableShape).withContainer());

    registry.register(OpDef.create("Cholesky", c -> single(c, squareMatrices(c, 0))));
    registry.register(OpDef.create("MatrixInverse", c -> single(c, squareMatrices(c, 0))));
    registry.register(
        OpDef.create("MatrixDeterminant", c -> single(c, batchOf(squareMatrices(c, 0), 2))));
    registry.register(OpDef.create("LogMatrixDeterminant", BuiltinOps::logDeterminantShape));
    registry.register(OpDef.create("MatrixSolve", c -> single(c, solveShape(c))));
    registry.register(OpDef.create("MatrixTriangularSolve", c -> single(c, solveShape(c))));
    registry.register(OpDef.create("MatrixSolveLs", BuiltinOps::solveLsShape));
    registry.register(OpDef.create("Qr", BuiltinOps::qrShape));
    registry.register(OpDef.create("SelfAdjointEigV2", BuiltinOps::selfAdjointEigShape));
    registry.register(OpDef.create("Svd", BuiltinOps::svdShape));
  }

  private static List<OutputSpec> constShape(InferenceContext c) {
    Tensor value = c.attrTensor("value");
    DataType dtype = c.attrType("dtype", value.dataType());
    if (dtype != value.dataType()) {
      throw new InvalidDataTypeException(
          String.format(
              "Const '%s' has dtype %s but a %s value", c.name(), dtype, value.dataType()));
    }
    return Collections.singletonList(OutputSpec.of(dtype, value.staticShape()));
  }

  private static List<OutputSpec> placeholderShape(InferenceContext c) {
    return Collections.singletonList(
        OutputSpec.of(c.attrType("dtype"), c.attrShape("shape", Shape.unknown())));
  }

  private static List<OutputSpec> identityShape(InferenceContext c) {
    c.checkNumInputs(1);
    return Collections.singletonList(OutputSpec.of(c.inputType(0), c.inputShape(0)));
  }

  private static List<OutputSpec> shapeShape(InferenceContext c) {
    c.checkNumInputs(1);
    DataType outType = c.attrType("out_type", DataType.INT32);
    int rank = c.inputShape(0).numDimensions();
    Shape shape = rank < 0 ? Shape.unknown(1) : Shape.make(rank);
    return Collections.singletonList(OutputSpec.of(outType, shape));
  }

  private static List<OutputSpec> rangeShape(InferenceContext c) {
    c.checkNumInputs(3);
    DataType dtype = c.inputType(0);
    for (int i = 0; i < 3; ++i) {
      checkScalar(c, i);
      if (c.inputType(i) != dtype) {
        throw new InvalidDataTypeException(
            String.format("Range '%s' inputs must all be of type %s", c.name(), dtype));
      }
    }
    long size = -1;
    Tensor start = c.constantInput(0);
    Tensor limit = c.constantInput(1);
    Tensor delta = c.constantInput(2);
    if (start != null && limit != null && delta != null) {
      size = rangeSize(start.doubleValues()[0], limit.doubleValues()[0], delta.doubleValues()[0]);
    }
    return Collections.singletonList(OutputSpec.of(dtype, Shape.make(size)));
  }

  /** Number of elements of {@code [start, limit)} with a step of {@code delta}. */
  static long rangeSize(double start, double limit, double delta) {
    if (delta == 0) {
      throw new IllegalArgumentException("Range requires a non-zero delta");
    }
    if ((delta > 0 && start > limit) || (delta < 0 && start < limit)) {
      throw new IllegalArgumentException(
          String.format("Range start %s cannot reach limit %s by %s", start, limit, delta));
    }
    return (long) Math.ceil(Math.abs((limit - start) / delta));
  }

  private static List<OutputSpec> castShape(InferenceContext c) {
    c.checkNumInputs(1);
    return Collections.singletonList(OutputSpec.of(c.attrType("DstT"), c.inputShape(0)));
  }

  private static List<OutputSpec> concatShape(
      InferenceContext c, int valuesFrom, int valuesTo, int axisIdx) {
    if (valuesTo - valuesFrom < 1) {
      throw new IllegalArgumentException(c.type() + " '" + c.name() + "' needs values to concat");
    }
    checkScalar(c, axisIdx);
    List<Output> values = c.inputs(valuesFrom, valuesTo);
    DataType dtype = checkSameType(c, values);
    int rank = -1;
    for (Output value : values) {
      int r = value.shape().numDimensions();
      if (r >= 0 && rank >= 0 && r != rank) {
        throw new IllegalArgumentException(
            String.format(
                "%s '%s' inputs have different ranks %d and %d", c.type(), c.name(), rank, r));
      }
      rank = Math.max(rank, r);
    }
    Tensor axisValue = c.constantInput(axisIdx);
    if (rank < 0 || axisValue == null) {
      return Collections.singletonList(
          OutputSpec.of(dtype, rank < 0 ? Shape.unknown() : Shape.unknown(rank)));
    }
    int axis = normalizeAxis(c, (int) axisValue.longValues()[0], rank);
    long[] dims = null;
    long axisSize = 0;
    for (Output value : values) {
      Shape s = value.shape();
      if (s.numDimensions() < 0) {
        axisSize = -1;
        continue;
      }
      long[] d = s.toArray();
      axisSize = axisSize < 0 || d[axis] < 0 ? -1 : axisSize + d[axis];
      d[axis] = -1;
      dims = dims == null ? d : mergeDims(c, dims, d);
    }
    dims[axis] = axisSize;
    return Collections.singletonList(OutputSpec.of(dtype, Shape.fromDimensions(dims)));
  }

  private static List<OutputSpec> packShape(InferenceContext c) {
    if (c.numInputs() < 1) {
      throw new IllegalArgumentException("Pack '" + c.name() + "' needs values to pack");
    }
    List<Output> values = c.inputs(0, c.numInputs());
    DataType dtype = checkSameType(c, values);
    Shape merged = Shape.unknown();
    for (Output value : values) {
      merged = merged.mergeWith(value.shape());
    }
    if (merged.numDimensions() < 0) {
      return Collections.singletonList(OutputSpec.of(dtype, Shape.unknown()));
    }
    int rank = merged.numDimensions();
    int axis = normalizeAxis(c, (int) c.attrLong("axis", 0), rank + 1);
    long[] dims = new long[rank + 1];
    long[] in = merged.toArray();
    for (int i = 0, j = 0; i < dims.length; ++i) {
      dims[i] = i == axis ? values.size() : in[j++];
    }
    return Collections.singletonList(OutputSpec.of(dtype, Shape.fromDimensions(dims)));
  }

  private static List<OutputSpec> fillShape(InferenceContext c) {
    c.checkNumInputs(2);
    checkIndexType(c, 0);
    checkScalar(c, 1);
    Tensor dims = c.constantInput(0);
    Shape shape;
    if (dims != null) {
      shape = Shape.fromDimensions(dims.longValues());
    } else {
      Shape dimsShape = c.inputShape(0).withRank(1);
      shape = dimsShape.size(0) < 0 ? Shape.unknown() : Shape.unknown((int) dimsShape.size(0));
    }
    return Collections.singletonList(OutputSpec.of(c.inputType(1), shape));
  }

  private static List<OutputSpec> gatherShape(InferenceContext c) {
    c.checkNumInputs(2);
    checkIndexType(c, 1);
    Shape params = c.inputShape(0);
    Shape shape;
    if (params.numDimensions() < 0) {
      shape = Shape.unknown();
    } else if (params.numDimensions() == 0) {
      throw new IllegalArgumentException("Gather '" + c.name() + "' params must be at least 1-D");
    } else {
      shape = c.inputShape(1).concatenate(dropFirst(params, 1));
    }
    return Collections.singletonList(OutputSpec.of(c.inputType(0), shape));
  }

  private static List<OutputSpec> unsortedSegmentSumShape(InferenceContext c) {
    c.checkNumInputs(3);
    checkIndexType(c, 1);
    checkIndexType(c, 2);
    checkScalar(c, 2);
    Shape data = c.inputShape(0);
    Shape ids = c.inputShape(1);
    if (data.numDimensions() < 0 || ids.numDimensions() < 0) {
      return Collections.singletonList(OutputSpec.of(c.inputType(0), Shape.unknown()));
    }
    if (ids.numDimensions() > data.numDimensions()) {
      throw new IllegalArgumentException(
          String.format(
              "UnsortedSegmentSum '%s' segment ids of shape %s do not prefix data of shape %s",
              c.name(), ids, data));
    }
    Tensor numSegments = c.constantInput(2);
    Shape head = Shape.make(numSegments == null ? -1 : numSegments.longValues()[0]);
    return Collections.singletonList(
        OutputSpec.of(c.inputType(0), head.concatenate(dropFirst(data, ids.numDimensions()))));
  }

  private static List<OutputSpec> sparseToDenseShape(InferenceContext c) {
    c.checkNumInputs(4);
    checkIndexType(c, 0);
    checkIndexType(c, 1);
    checkScalar(c, 3);
    if (c.inputType(2) != c.inputType(3)) {
      throw new InvalidDataTypeException(
          String.format(
              "SparseToDense '%s' default value must be a %s", c.name(), c.inputType(2)));
    }
    Tensor outputShape = c.constantInput(1);
    Shape shape;
    if (outputShape != null) {
      shape = Shape.fromDimensions(outputShape.longValues());
    } else {
      Shape s = c.inputShape(1).withRank(1);
      shape = s.size(0) < 0 ? Shape.unknown() : Shape.unknown((int) s.size(0));
    }
    return Collections.singletonList(OutputSpec.of(c.inputType(2), shape));
  }

  private static List<OutputSpec> variableShape(InferenceContext c) {
    return Collections.singletonList(
        OutputSpec.of(c.attrType("dtype"), c.attrShape("shape", Shape.unknown())));
  }

  private static List<OutputSpec> logDeterminantShape(InferenceContext c) {
    Shape batch = batchOf(squareMatrices(c, 0), 2);
    DataType dtype = c.inputType(0);
    return Arrays.asList(OutputSpec.of(dtype, batch), OutputSpec.of(dtype, batch));
  }

  private static Shape solveShape(InferenceContext c) {
    c.checkNumInputs(2);
    Shape matrix = squareMatrices(c, 0);
    Shape rhs = matrices(c, 1);
    checkSameType(c, c.inputs(0, 2));
    Shape batch = mergeBatch(c, matrix, rhs);
    long m = mergeDim(c, dim(matrix, -2), dim(rhs, -2));
    return batch.concatenate(Shape.make(m, dim(rhs, -1)));
  }

  private static List<OutputSpec> solveLsShape(InferenceContext c) {
    c.checkNumInputs(3);
    Shape matrix = matrices(c, 0);
    Shape rhs = matrices(c, 1);
    checkSameType(c, c.inputs(0, 2));
    if (c.inputType(2) != DataType.DOUBLE) {
      throw new InvalidDataTypeException(
          String.format("MatrixSolveLs '%s' l2 regularizer must be a DOUBLE", c.name()));
    }
    checkScalar(c, 2);
    Shape batch = mergeBatch(c, matrix, rhs);
    mergeDim(c, dim(matrix, -2), dim(rhs, -2));
    return single(c, batch.concatenate(Shape.make(dim(matrix, -1), dim(rhs, -1))));
  }

  private static List<OutputSpec> qrShape(InferenceContext c) {
    Shape input = matrices(c, 0);
    Shape batch = batchOf(input, 2);
    long m = dim(input, -2);
    long n = dim(input, -1);
    long p = m < 0 || n < 0 ? -1 : Math.min(m, n);
    boolean full = c.attrBool("full_matrices", false);
    DataType dtype = c.inputType(0);
    return Arrays.asList(
        OutputSpec.of(dtype, batch.concatenate(Shape.make(m, full ? m : p))),
        OutputSpec.of(dtype, batch.concatenate(Shape.make(full ? m : p, n))));
  }

  private static List<OutputSpec> selfAdjointEigShape(InferenceContext c) {
    Shape input = squareMatrices(c, 0);
    Shape batch = batchOf(input, 2);
    long n = dim(input, -1);
    DataType dtype = c.inputType(0);
    Shape v = c.attrBool("compute_v", true) ? batch.concatenate(Shape.make(n, n)) : Shape.make(0);
    return Arrays.asList(
        OutputSpec.of(dtype, batch.concatenate(Shape.make(n))), OutputSpec.of(dtype, v));
  }

  private static List<OutputSpec> svdShape(InferenceContext c) {
    Shape input = matrices(c, 0);
    Shape batch = batchOf(input, 2);
    long m = dim(input, -2);
    long n = dim(input, -1);
    long p = m < 0 || n < 0 ? -1 : Math.min(m, n);
    DataType dtype = c.inputType(0);
    Shape u = Shape.make(0);
    Shape v = Shape.make(0);
    if (c.attrBool("compute_uv", true)) {
      boolean full = c.attrBool("full_matrices", false);
      u = batch.concatenate(Shape.make(m, full ? m : p));
      v = batch.concatenate(Shape.make(n, full ? n : p));
    }
    return Arrays.asList(
        OutputSpec.of(dtype, batch.concatenate(Shape.make(p))),
        OutputSpec.of(dtype, u),
        OutputSpec.of(dtype, v));
  }

  /** Checks that input {@code idx} is a batch of FLOAT or DOUBLE matrices and returns its shape. */
  private static Shape matrices(InferenceContext c, int idx) {
    DataType dtype = c.inputType(idx);
    if (dtype != DataType.FLOAT && dtype != DataType.DOUBLE) {
      throw new InvalidDataTypeException(
          String.format(
              "%s '%s' supports FLOAT and DOUBLE inputs, got %s", c.type(), c.name(), dtype));
    }
    Shape shape = c.inputShape(idx);
    if (shape.numDimensions() >= 0 && shape.numDimensions() < 2) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' input %d must have rank at least 2, got shape %s",
              c.type(), c.name(), idx, shape));
    }
    return shape;
  }

  private static Shape squareMatrices(InferenceContext c, int idx) {
    Shape shape = matrices(c, idx);
    long rows = dim(shape, -2);
    long cols = dim(shape, -1);
    if (rows >= 0 && cols >= 0 && rows != cols) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' input %d must be square matrices, got shape %s",
              c.type(), c.name(), idx, shape));
    }
    if (shape.numDimensions() < 0) {
      return shape;
    }
    long[] dims = shape.toArray();
    long size = Math.max(rows, cols);
    dims[dims.length - 2] = size;
    dims[dims.length - 1] = size;
    return Shape.fromDimensions(dims);
  }

  /** Size of dimension {@code fromEnd} counted from the end, -1 when unknown. */
  private static long dim(Shape shape, int fromEnd) {
    int rank = shape.numDimensions();
    return rank < 0 ? -1 : shape.size(rank + fromEnd);
  }

  private static Shape batchOf(Shape shape, int innerDims) {
    int rank = shape.numDimensions();
    if (rank < 0) {
      return Shape.unknown();
    }
    return Shape.fromDimensions(Arrays.copyOf(shape.toArray(), rank - innerDims));
  }

  private static Shape mergeBatch(InferenceContext c, Shape a, Shape b) {
    try {
      return batchOf(a, 2).mergeWith(batchOf(b, 2));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("%s '%s' inputs have different batch shapes", c.type(), c.name()), e);
    }
  }

  private static long mergeDim(InferenceContext c, long a, long b) {
    if (a >= 0 && b >= 0 && a != b) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' inputs have incompatible dimensions %d and %d", c.type(), c.name(), a, b));
    }
    return a >= 0 ? a : b;
  }

  private static long[] mergeDims(InferenceContext c, long[] a, long[] b) {
    for (int i = 0; i < a.length; ++i) {
      a[i] = mergeDim(c, a[i], b[i]);
    }
    return a;
  }

  private static Shape dropFirst(Shape shape, int n) {
    long[] dims = shape.toArray();
    return Shape.fromDimensions(Arrays.copyOfRange(dims, n, dims.length));
  }

  private static List<OutputSpec> single(InferenceContext c, Shape shape) {
    return Collections.singletonList(OutputSpec.of(c.inputType(0), shape));
  }

  private static List<OutputSpec> scalarOf(DataType dtype) {
    return Collections.singletonList(OutputSpec.of(dtype, Shape.scalar()));
  }

  private static DataType checkSameType(InferenceContext c, List<Output> values) {
    DataType dtype = values.get(0).dataType();
    for (Output value : values) {
      if (value.dataType() != dtype) {
        throw new InvalidDataTypeException(
            String.format(
                "%s '%s' inputs must share one type, got %s and %s",
                c.type(), c.name(), dtype, value.dataType()));
      }
    }
    return dtype;
  }

  private static void checkIndexType(InferenceContext c, int idx) {
    DataType dtype = c.inputType(idx);
    if (dtype != DataType.INT32 && dtype != DataType.INT64) {
      throw new InvalidDataTypeException(
          String.format(
              "%s '%s' input %d must be INT32 or INT64, got %s", c.type(), c.name(), idx, dtype));
    }
  }

  private static void checkScalar(InferenceContext c, int idx) {
    Shape shape = c.inputShape(idx);
    if (shape.numDimensions() > 0) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' input %d must be a scalar, got shape %s", c.type(), c.name(), idx, shape));
    }
  }

  private static int normalizeAxis(InferenceContext c, int axis, int rank) {
    int normalized = axis < 0 ? axis + rank : axis;
    if (normalized < 0 || normalized >= rank) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' axis %d is out of range for rank %d", c.type(), c.name(), axis, rank));
    }
    return normalized;
  }

  private BuiltinOps() {}
}
