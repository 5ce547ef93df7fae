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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.DataType;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.Shape;
import org.opgraph.Tensor;

/**
 * Best-effort static evaluation of outputs, used to infer shapes without running the graph.
 *
 * <p>The evaluator recognizes a small set of operation types ({@code Const}, {@code Identity},
 * {@code Shape}, {@code Size}, {@code Rank}, {@code Range}, {@code Cast}, {@code Concat}, {@code
 * ConcatV2}, {@code Pack} and {@code Fill}) and recursively evaluates their inputs. Whenever a
 * value cannot be determined, or would have more than 2^24 elements, the result is {@code null},
 * never an exception.
 */
public final class ConstantEvaluator {

  /**
   * Returns the value of {@code output} if it can be computed from the structure of the graph, or
   * null.
   *
   * <p>When a value is returned, {@code output} is marked as not feedable: feeding it another value
   * would invalidate decisions made from this one.
   */
  public static @Nullable Tensor constantValue(Output output) {
    Tensor value = evaluate(output);
    if (value != null) {
      output.graph().preventFeeding(output);
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(
          String.format(
              "Constant value of '%s': %s", output.name(), value == null ? "unknown" : value));
    }
    return value;
  }

  /**
   * Returns the shape described by the 1-D integer tensor {@code output}, with as many dimensions
   * known as the graph structure allows.
   *
   * <p>Unlike {@link #constantValue(Output)} this succeeds partially: packing or concatenating
   * partially known sizes yields a shape with some unknown dimensions. If {@code output} is not a
   * vector, or its length is unknown, the shape has an unknown rank.
   */
  public static Shape constantValueAsShape(Output output) {
    Shape outputShape = output.shape();
    if (!outputShape.isCompatibleWith(Shape.unknown(1))) {
      return Shape.unknown();
    }
    outputShape = outputShape.withRank(1);
    if (outputShape.size(0) == 0) {
      return Shape.scalar();
    }
    Operation op = output.op();
    switch (op.type()) {
      case "Shape":
        return op.input(0).shape();
      case "Pack":
        {
          Shape result = Shape.scalar();
          for (Output input : op.inputs()) {
            Tensor value = constantValue(input);
            long size = -1;
            if (value != null && value.dataType().isInteger() && value.numDimensions() == 0) {
              size = Math.max(-1, value.longValues()[0]);
            }
            result = result.concatenate(Shape.make(size));
          }
          return result;
        }
      case "Concat":
        return concatenateShapes(op.inputs().subList(1, op.numInputs()));
      case "ConcatV2":
        return concatenateShapes(op.inputs().subList(0, op.numInputs() - 1));
      default:
        break;
    }
    Shape result =
        outputShape.size(0) < 0 ? Shape.unknown() : Shape.unknown((int) outputShape.size(0));
    Tensor value = constantValue(output);
    if (value != null && value.dataType().isInteger() && value.numDimensions() == 1) {
      long[] dims = value.longValues();
      for (int i = 0; i < dims.length; ++i) {
        dims[i] = Math.max(-1, dims[i]);
      }
      Shape known = Shape.fromDimensions(dims);
      if (result.isCompatibleWith(known)) {
        result = result.mergeWith(known);
      }
    }
    return result;
  }

  private static Shape concatenateShapes(List<Output> inputs) {
    Shape result = Shape.scalar();
    for (Output input : inputs) {
      result = result.concatenate(constantValueAsShape(input));
    }
    return result;
  }

  private static @Nullable Tensor evaluate(Output output) {
    Operation op = output.op();
    switch (op.type()) {
      case "Const":
        return op.attrTensor("value");
      case "Identity":
        return evaluate(op.input(0));
      case "Shape":
        {
          Shape shape = op.input(0).shape();
          if (!shape.isFullyDefined()) {
            return null;
          }
          long[] dims = shape.toArray();
          return Tensor.ofLongs(outType(op), new long[] {dims.length}, dims);
        }
      case "Size":
        {
          Shape shape = op.input(0).shape();
          if (!shape.isFullyDefined()) {
            return null;
          }
          DataType outType = outType(op);
          long limit = outType == DataType.INT32 ? Integer.MAX_VALUE : Long.MAX_VALUE;
          long n = shape.numElementsAtMost(limit);
          return n < 0 ? null : Tensor.ofLongs(outType, new long[0], new long[] {n});
        }
      case "Rank":
        {
          int rank = op.input(0).shape().numDimensions();
          if (rank < 0) {
            return null;
          }
          return Tensor.ofLongs(DataType.INT32, new long[0], new long[] {rank});
        }
      case "Range":
        return evaluateRange(op);
      case "Cast":
        {
          Tensor value = evaluate(op.input(0));
          DataType target = op.attrType("DstT");
          if (value == null
              || (value.dataType() == DataType.STRING) != (target == DataType.STRING)) {
            return null;
          }
          return value.cast(target);
        }
      case "Concat":
        return evaluateConcat(op.input(0), op.inputs().subList(1, op.numInputs()));
      case "ConcatV2":
        return evaluateConcat(
            op.input(op.numInputs() - 1), op.inputs().subList(0, op.numInputs() - 1));
      case "Pack":
        {
          List<Tensor> values = evaluateAll(op.inputs());
          if (values == null) {
            return null;
          }
          int rank = values.get(0).numDimensions();
          long axis = op.hasAttr("axis") ? op.attrLong("axis") : 0;
          int a = (int) (axis < 0 ? axis + rank + 1 : axis);
          if (a < 0 || a > rank || !sameShapes(values, -1)) {
            return null;
          }
          return pack(values, a);
        }
      case "Fill":
        {
          Tensor dims = evaluate(op.input(0));
          Tensor value = evaluate(op.input(1));
          if (dims == null || value == null) {
            return null;
          }
          Shape shape = Shape.fromDimensions(dims.longValues());
          if (shape.numElementsAtMost(MAX_FOLDED_ELEMENTS) < 0 || value.numDimensions() != 0) {
            return null;
          }
          return Tensor.fill(shape, value);
        }
      default:
        return null;
    }
  }

  private static @Nullable Tensor evaluateRange(Operation op) {
    Tensor start = evaluate(op.input(0));
    Tensor limit = evaluate(op.input(1));
    Tensor delta = evaluate(op.input(2));
    if (start == null || limit == null || delta == null) {
      return null;
    }
    DataType dtype = start.dataType();
    double first = start.doubleValues()[0];
    double last = limit.doubleValues()[0];
    double step = delta.doubleValues()[0];
    if (step == 0 || (step > 0 && first > last) || (step < 0 && first < last)) {
      return null;
    }
    double span = Math.abs((last - first) / step);
    if (Double.isNaN(span) || span > MAX_FOLDED_ELEMENTS) {
      return null;
    }
    int size = (int) Math.ceil(span);
    long[] shape = {size};
    if (dtype.isFloating()) {
      double[] values = new double[size];
      for (int i = 0; i < size; ++i) {
        values[i] = first + i * step;
      }
      return Tensor.ofDoubles(dtype, shape, values);
    }
    long[] values = new long[size];
    long from = start.longValues()[0];
    long by = delta.longValues()[0];
    for (int i = 0; i < size; ++i) {
      values[i] = from + i * by;
    }
    return Tensor.ofLongs(dtype, shape, values);
  }

  private static @Nullable Tensor evaluateConcat(Output axisInput, List<Output> inputs) {
    Tensor axis = evaluate(axisInput);
    if (axis == null) {
      return null;
    }
    List<Tensor> values = evaluateAll(inputs);
    if (values == null) {
      return null;
    }
    int rank = values.get(0).numDimensions();
    int a = (int) axis.longValues()[0];
    a = a < 0 ? a + rank : a;
    if (a < 0 || a >= rank || !sameShapes(values, a)) {
      return null;
    }
    return concat(values, a);
  }

  private static @Nullable List<Tensor> evaluateAll(List<Output> inputs) {
    List<Tensor> values = new ArrayList<>(inputs.size());
    for (Output input : inputs) {
      Tensor value = evaluate(input);
      if (value == null) {
        return null;
      }
      values.add(value);
    }
    return values;
  }

  /** Returns true if the values share one type and one shape, except in dimension {@code axis}. */
  private static boolean sameShapes(List<Tensor> values, int axis) {
    Tensor first = values.get(0);
    for (Tensor value : values) {
      if (value.dataType() != first.dataType()
          || value.numDimensions() != first.numDimensions()) {
        return false;
      }
      for (int i = 0; i < first.numDimensions(); ++i) {
        if (i != axis && value.shape()[i] != first.shape()[i]) {
          return false;
        }
      }
    }
    return true;
  }

  /** Stacks values of the same shape along a new dimension {@code a}. */
  private static @Nullable Tensor pack(List<Tensor> values, int a) {
    int rank = values.get(0).numDimensions();
    List<Tensor> expanded = new ArrayList<>(values.size());
    for (Tensor value : values) {
      long[] shape = value.shape();
      long[] newShape = new long[rank + 1];
      for (int i = 0, j = 0; i < newShape.length; ++i) {
        newShape[i] = i == a ? 1 : shape[j++];
      }
      expanded.add(reshape(value, newShape));
    }
    return concat(expanded, a);
  }

  /**
   * Joins values whose shapes differ only in dimension {@code axis}, or returns null if the result
   * would be too large to fold.
   */
  private static @Nullable Tensor concat(List<Tensor> values, int axis) {
    long total = 0;
    for (Tensor value : values) {
      total += value.numElements();
    }
    if (total > MAX_FOLDED_ELEMENTS) {
      return null;
    }
    Tensor first = values.get(0);
    long[] shape = first.shape();
    long outer = 1;
    for (int i = 0; i < axis; ++i) {
      outer *= shape[i];
    }
    long inner = 1;
    for (int i = axis + 1; i < shape.length; ++i) {
      inner *= shape[i];
    }
    shape[axis] = 0;
    for (Tensor value : values) {
      shape[axis] += value.shape()[axis];
    }
    Object[] sources = new Object[values.size()];
    for (int i = 0; i < sources.length; ++i) {
      sources[i] = elements(values.get(i));
    }
    Object result = newElements(first.dataType(), (int) total);
    int offset = 0;
    for (int o = 0; o < outer; ++o) {
      for (int i = 0; i < sources.length; ++i) {
        int block = (int) (values.get(i).shape()[axis] * inner);
        System.arraycopy(sources[i], o * block, result, offset, block);
        offset += block;
      }
    }
    return toTensor(first.dataType(), shape, result);
  }

  private static Tensor reshape(Tensor value, long[] shape) {
    return toTensor(value.dataType(), shape, elements(value));
  }

  private static DataType outType(Operation op) {
    return op.hasAttr("out_type") ? op.attrType("out_type") : DataType.INT32;
  }

  private static Object elements(Tensor value) {
    if (value.dataType() == DataType.STRING) {
      return value.stringValues();
    }
    return value.dataType().isFloating() ? value.doubleValues() : value.longValues();
  }

  private static Object newElements(DataType dtype, int n) {
    if (dtype == DataType.STRING) {
      return new String[n];
    }
    return dtype.isFloating() ? new double[n] : new long[n];
  }

  private static Tensor toTensor(DataType dtype, long[] shape, Object elements) {
    if (dtype == DataType.STRING) {
      return Tensor.ofStrings(shape, (String[]) elements);
    }
    if (dtype.isFloating()) {
      return Tensor.ofDoubles(dtype, shape, (double[]) elements);
    }
    return Tensor.ofLongs(dtype, shape, (long[]) elements);
  }

  /** Folds producing more elements than this are left unknown. */
  static final int MAX_FOLDED_ELEMENTS = 1 << 24;

  private static final Logger logger = Logger.getLogger(ConstantEvaluator.class.getName());

  private ConstantEvaluator() {}
}
