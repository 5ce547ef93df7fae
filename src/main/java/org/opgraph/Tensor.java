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

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable, statically known multi-dimensional array of elements of a limited set of types.
 *
 * <p>Tensors are never computed by this library: they hold the values of {@code Const}
 * operations, tensor-valued attributes and the results of the best-effort constant evaluator.
 * Integer and boolean elements are stored as {@code long}s, floating point elements as {@code
 * double}s and strings as {@code String}s.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class Tensor {

  /**
   * Creates a Tensor from a Java object.
   *
   * <p>{@code obj} must be a boxed scalar ({@code Integer}, {@code Long}, {@code Float}, {@code
   * Double}, {@code Boolean}, {@code Byte} or {@code String}) or a rectangular array, possibly
   * multi-dimensional, of the corresponding primitives. For example:
   *
   * <pre>{@code
   * Tensor scalar = Tensor.create(3);                          // INT32, shape []
   * Tensor matrix = Tensor.create(new float[][] {{1, 2}, {3, 4}}); // FLOAT, shape [2, 2]
   * }</pre>
   *
   * @throws IllegalArgumentException if {@code obj} is not compatible with the type system or
   *     is not rectangular
   */
  public static Tensor create(Object obj) {
    if (obj == null) {
      throw new IllegalArgumentException("cannot create a Tensor from null");
    }
    DataType dtype = dataTypeOf(obj);
    long[] shape = new long[numDimensions(obj)];
    fillShape(obj, 0, shape);
    int n = (int) Shape.fromDimensions(shape).numElements();
    Object data = allocate(dtype, n);
    int filled = flatten(obj, 0, shape, data, 0);
    if (filled != n) {
      throw new IllegalArgumentException("cannot create a Tensor from a non-rectangular array");
    }
    return new Tensor(dtype, shape, data);
  }

  /**
   * Creates an integer or boolean typed Tensor from flat values in row-major order.
   *
   * @throws IllegalArgumentException if {@code dtype} is floating point or string, or if the
   *     number of values does not match the shape
   */
  public static Tensor ofLongs(DataType dtype, long[] shape, long[] values) {
    if (!dtype.isInteger() && dtype != DataType.BOOL) {
      throw new IllegalArgumentException(dtype + " elements cannot be stored as longs");
    }
    return new Tensor(dtype, checkSize(shape, values.length), values.clone());
  }

  /**
   * Creates a floating point Tensor from flat values in row-major order.
   *
   * @throws IllegalArgumentException if {@code dtype} is not floating point, or if the number of
   *     values does not match the shape
   */
  public static Tensor ofDoubles(DataType dtype, long[] shape, double[] values) {
    if (!dtype.isFloating()) {
      throw new IllegalArgumentException(dtype + " elements cannot be stored as doubles");
    }
    return new Tensor(dtype, checkSize(shape, values.length), values.clone());
  }

  /** Creates a STRING Tensor from flat values in row-major order. */
  public static Tensor ofStrings(long[] shape, String[] values) {
    return new Tensor(DataType.STRING, checkSize(shape, values.length), values.clone());
  }

  /**
   * Creates a Tensor of {@code shape} whose elements are all equal to the scalar {@code value}.
   *
   * @throws IllegalArgumentException if {@code value} is not a scalar, or {@code shape} is not
   *     fully defined or has more than {@link #MAX_ELEMENTS} elements
   */
  public static Tensor fill(Shape shape, Tensor value) {
    if (value.numDimensions() != 0) {
      throw new IllegalArgumentException("fill value must be a scalar, got shape "
          + Arrays.toString(value.shape));
    }
    if (!shape.isFullyDefined()) {
      throw new IllegalArgumentException("cannot fill a tensor of shape " + shape);
    }
    int n = (int) shape.numElementsAtMost(MAX_ELEMENTS);
    if (n < 0) {
      throw new IllegalArgumentException(
          String.format(
              "cannot fill a tensor of shape %s, more than %d elements", shape, MAX_ELEMENTS));
    }
    Object data = allocate(value.dtype, n);
    for (int i = 0; i < n; ++i) {
      Array.set(data, i, Array.get(value.data, 0));
    }
    return new Tensor(value.dtype, shape.toArray(), data);
  }

  /** Returns the {@link DataType} of elements stored in the Tensor. */
  public DataType dataType() {
    return dtype;
  }

  /**
   * Returns the number of dimensions (sometimes referred to as <a
   * href="https://www.tensorflow.org/resources/dims_types.html#rank">rank</a>) of the Tensor.
   *
   * <p>Will be 0 for a scalar, 1 for a vector, 2 for a matrix, 3 for a 3-dimensional tensor etc.
   */
  public int numDimensions() {
    return shape.length;
  }

  /** Returns the number of elements in a flattened (1-D) view of the tensor. */
  public int numElements() {
    return Array.getLength(data);
  }

  /** Returns the shape of the Tensor, i.e., the sizes of each dimension. */
  public long[] shape() {
    return shape.clone();
  }

  /** Returns the shape of the Tensor as a fully defined {@link Shape}. */
  public Shape staticShape() {
    return Shape.fromDimensions(shape);
  }

  /**
   * Returns the value in a scalar {@code int} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent an integer scalar.
   */
  public int intValue() {
    return (int) longValue();
  }

  /**
   * Returns the value in a scalar {@code long} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent an integer scalar.
   */
  public long longValue() {
    checkScalar(dtype.isInteger());
    return ((long[]) data)[0];
  }

  /**
   * Returns the value in a scalar {@code float} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent a floating point scalar.
   */
  public float floatValue() {
    return (float) doubleValue();
  }

  /**
   * Returns the value in a scalar {@code double} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent a floating point scalar.
   */
  public double doubleValue() {
    checkScalar(dtype.isFloating());
    return ((double[]) data)[0];
  }

  /**
   * Returns the value in a scalar {@code boolean} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent a boolean scalar.
   */
  public boolean booleanValue() {
    checkScalar(dtype == DataType.BOOL);
    return ((long[]) data)[0] != 0;
  }

  /**
   * Returns the value in a scalar {@code String} tensor.
   *
   * @throws IllegalArgumentException if the Tensor does not represent a string scalar.
   */
  public String stringValue() {
    checkScalar(dtype == DataType.STRING);
    return ((String[]) data)[0];
  }

  /**
   * Returns a copy of the elements of an integer or boolean tensor, flattened in row-major order.
   *
   * @throws IllegalArgumentException if the elements are not stored as longs
   */
  public long[] longValues() {
    if (!(data instanceof long[])) {
      throw new IllegalArgumentException(dtype + " tensor elements are not integers");
    }
    return ((long[]) data).clone();
  }

  /**
   * Returns a copy of the elements of a numeric tensor as doubles, flattened in row-major order.
   *
   * @throws IllegalArgumentException if the tensor is not numeric
   */
  public double[] doubleValues() {
    if (data instanceof double[]) {
      return ((double[]) data).clone();
    }
    if (!dtype.isNumeric()) {
      throw new IllegalArgumentException(dtype + " tensor elements are not numeric");
    }
    long[] values = (long[]) data;
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      result[i] = values[i];
    }
    return result;
  }

  /** Returns a copy of the elements of a STRING tensor, flattened in row-major order. */
  public String[] stringValues() {
    if (dtype != DataType.STRING) {
      throw new IllegalArgumentException(dtype + " tensor elements are not strings");
    }
    return ((String[]) data).clone();
  }

  /**
   * Converts the elements of this tensor to {@code target}, following C conversion rules
   * (truncation towards zero, wrap-around of integers).
   *
   * @throws IllegalArgumentException if either type is STRING and the types differ
   */
  public Tensor cast(DataType target) {
    if (target == dtype) {
      return this;
    }
    if (target == DataType.STRING || dtype == DataType.STRING) {
      throw new IllegalArgumentException("cannot cast " + dtype + " to " + target);
    }
    int n = numElements();
    if (target.isFloating()) {
      double[] values = doubleValues();
      if (target == DataType.FLOAT) {
        for (int i = 0; i < n; ++i) {
          values[i] = (float) values[i];
        }
      }
      return new Tensor(target, shape, values);
    }
    long[] values = new long[n];
    for (int i = 0; i < n; ++i) {
      if (data instanceof double[]) {
        double d = ((double[]) data)[i];
        // Any non-zero value is true, fractions and NaN included.
        values[i] = target == DataType.BOOL ? (d != 0 ? 1 : 0) : narrow(target, (long) d);
      } else {
        values[i] = narrow(target, ((long[]) data)[i]);
      }
    }
    return new Tensor(target, shape, values);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Tensor)) {
      return false;
    }
    Tensor that = (Tensor) o;
    return dtype == that.dtype
        && Arrays.equals(shape, that.shape)
        && Objects.deepEquals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dtype, Arrays.hashCode(shape), Arrays.deepHashCode(new Object[] {data}));
  }

  /** Returns a string describing the type and shape of the Tensor. */
  @Override
  public String toString() {
    return String.format("%s tensor with shape %s", dtype.toString(), Arrays.toString(shape));
  }

  private Tensor(DataType dtype, long[] shape, Object data) {
    this.dtype = dtype;
    this.shape = shape;
    this.data = data;
  }

  private void checkScalar(boolean typeMatches) {
    if (shape.length != 0) {
      throw new IllegalArgumentException(
          String.format("Tensor is not a scalar, it has shape %s", Arrays.toString(shape)));
    }
    if (!typeMatches) {
      throw new IllegalArgumentException(
          String.format("Tensor is a scalar of type %s, not the requested type", dtype));
    }
  }

  private static long narrow(DataType target, long v) {
    switch (target) {
      case INT32:
        return (int) v;
      case UINT8:
        return v & 0xFF;
      case BOOL:
        return v != 0 ? 1 : 0;
      default:
        return v;
    }
  }

  private static long[] checkSize(long[] shape, int numValues) {
    long expected = Shape.fromDimensions(shape).numElements();
    if (expected != numValues) {
      throw new IllegalArgumentException(
          String.format(
              "shape %s requires %d values, got %d", Arrays.toString(shape), expected, numValues));
    }
    return shape.clone();
  }

  private static Object allocate(DataType dtype, int n) {
    if (dtype.isFloating()) {
      return new double[n];
    }
    if (dtype == DataType.STRING) {
      return new String[n];
    }
    return new long[n];
  }

  private static DataType dataTypeOf(Object o) {
    Class<?> c = o.getClass();
    while (c.isArray()) {
      c = c.getComponentType();
    }
    if (c == int.class) {
      return DataType.INT32;
    } else if (c == long.class) {
      return DataType.INT64;
    } else if (c == float.class) {
      return DataType.FLOAT;
    } else if (c == double.class) {
      return DataType.DOUBLE;
    } else if (c == boolean.class) {
      return DataType.BOOL;
    } else if (c == byte.class) {
      return DataType.UINT8;
    }
    return DataType.fromClass(c);
  }

  private static int numDimensions(Object o) {
    int n = 0;
    Class<?> c = o.getClass();
    while (c.isArray()) {
      c = c.getComponentType();
      ++n;
    }
    return n;
  }

  private static void fillShape(Object o, int dim, long[] shape) {
    if (shape == null || dim == shape.length) {
      return;
    }
    final int len = Array.getLength(o);
    if (len == 0) {
      throw new IllegalArgumentException("cannot create Tensors with a 0 dimension");
    }
    shape[dim] = len;
    fillShape(Array.get(o, 0), dim + 1, shape);
  }

  private static int flatten(Object o, int dim, long[] shape, Object dst, int offset) {
    if (dim == shape.length) {
      Array.set(dst, offset, element(o));
      return offset + 1;
    }
    int len = Array.getLength(o);
    if (len != shape[dim]) {
      throw new IllegalArgumentException("cannot create a Tensor from a non-rectangular array");
    }
    for (int i = 0; i < len; ++i) {
      offset = flatten(Array.get(o, i), dim + 1, shape, dst, offset);
    }
    return offset;
  }

  private static Object element(Object o) {
    if (o instanceof Boolean) {
      return ((Boolean) o) ? 1L : 0L;
    }
    if (o instanceof Byte) {
      return ((Byte) o).longValue() & 0xFF;
    }
    if (o instanceof Float || o instanceof Double) {
      return ((Number) o).doubleValue();
    }
    if (o instanceof Number) {
      return ((Number) o).longValue();
    }
    return o;
  }

  /** Largest number of elements a Tensor can hold. */
  public static final int MAX_ELEMENTS = Integer.MAX_VALUE - 8;

  private final DataType dtype;
  private final long[] shape;
  private final Object data;
}
