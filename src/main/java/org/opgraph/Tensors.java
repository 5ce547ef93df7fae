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

/** Type-safe factory methods for creating {@link Tensor} objects. */
public final class Tensors {
  private Tensors() {}

  /**
   * Creates a scalar String tensor.
   *
   * @param data The string to put into the new scalar tensor.
   */
  public static Tensor create(String data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor containing a single {@code float} element.
   *
   * @param data The value to put into the new scalar.
   */
  public static Tensor create(float data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-1 tensor of {@code float} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(float[] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-2 tensor of {@code float} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(float[][] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor containing a single {@code double} element.
   *
   * @param data The value to put into the new scalar.
   */
  public static Tensor create(double data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-1 tensor of {@code double} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(double[] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-2 tensor of {@code double} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(double[][] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor containing a single {@code int} element.
   *
   * @param data The value to put into the new scalar.
   */
  public static Tensor create(int data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-1 tensor of {@code int} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(int[] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-2 tensor of {@code int} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(int[][] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor containing a single {@code long} element.
   *
   * @param data The value to put into the new scalar.
   */
  public static Tensor create(long data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-1 tensor of {@code long} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(long[] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-2 tensor of {@code long} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(long[][] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor containing a single {@code boolean} element.
   *
   * @param data The value to put into the new scalar.
   */
  public static Tensor create(boolean data) {
    return Tensor.create(data);
  }

  /**
   * Creates a rank-1 tensor of {@code boolean} elements.
   *
   * @param data An array containing the values to put into the new tensor. The dimensions of the
   *     new tensor will match those of the array.
   */
  public static Tensor create(boolean[] data) {
    return Tensor.create(data);
  }

  /**
   * Creates a scalar tensor of the given numeric type holding {@code value}.
   *
   * @throws IllegalArgumentException if {@code dtype} is not numeric
   */
  public static Tensor scalar(DataType dtype, double value) {
    if (dtype.isFloating()) {
      return Tensor.ofDoubles(dtype, new long[0], new double[] {value}).cast(dtype);
    }
    if (dtype.isInteger() || dtype == DataType.BOOL) {
      return Tensor.ofLongs(DataType.INT64, new long[0], new long[] {(long) value}).cast(dtype);
    }
    throw new IllegalArgumentException("cannot create a " + dtype + " scalar from a number");
  }
}
