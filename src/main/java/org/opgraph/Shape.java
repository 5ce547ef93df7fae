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

/** The possibly partially known shape of a tensor produced by an operation. */
public final class Shape {

  /** Create a Shape representing an unknown number of dimensions. */
  public static Shape unknown() {
    return new Shape(null);
  }

  /** Create a Shape representing a known number of dimensions, all of unknown size. */
  public static Shape unknown(int numDimensions) {
    long[] shape = new long[numDimensions];
    Arrays.fill(shape, -1L);
    return new Shape(shape);
  }

  /** Create a Shape representing a scalar value. */
  public static Shape scalar() {
    return new Shape(new long[0]);
  }

  /**
   * Create a Shape representing an N-dimensional value.
   *
   * <p>Creates a Shape representing an N-dimensional value (N being at least 1), with the provided
   * size for each dimension. A -1 indicates that the size of the corresponding dimension is
   * unknown. For example:
   *
   * <pre>{@code
   * // A 2-element vector.
   * Shape vector = Shape.make(2);
   *
   * // A 2x3 matrix.
   * Shape matrix = Shape.make(2, 3);
   *
   * // A matrix with 4 columns but an unknown number of rows.
   * Shape batch = Shape.make(-1, 4);
   * }</pre>
   */
  public static Shape make(long firstDimensionSize, long... otherDimensionSizes) {
    long[] shape = new long[otherDimensionSizes.length + 1];
    shape[0] = firstDimensionSize;
    System.arraycopy(otherDimensionSizes, 0, shape, 1, otherDimensionSizes.length);
    return new Shape(shape);
  }

  /**
   * Create a Shape from an array of dimension sizes, -1 marking an unknown size.
   *
   * @param dimensions sizes of each dimension, or null for an unknown number of dimensions
   */
  public static Shape fromDimensions(long[] dimensions) {
    return new Shape(dimensions == null ? null : dimensions.clone());
  }

  /**
   * Number of dimensions represented by this shape.
   *
   * @return -1 if the number of dimensions is unknown, 0 if the shape represents a scalar, 1 for a
   *     vector, 2 for a matrix etc.
   */
  public int numDimensions() {
    return shape == null ? -1 : shape.length;
  }

  /**
   * The size of the i-th dimension.
   *
   * @return The size of the requested dimension or -1 if it is unknown.
   */
  public long size(int i) {
    return shape[i];
  }

  /** Returns true if the rank and every dimension size are known. */
  public boolean isFullyDefined() {
    if (shape == null) {
      return false;
    }
    for (long d : shape) {
      if (d < 0) {
        return false;
      }
    }
    return true;
  }

  /** Number of elements of a tensor with this shape, or -1 if the shape is not fully defined. */
  public long numElements() {
    if (!isFullyDefined()) {
      return -1;
    }
    long n = 1;
    for (long d : shape) {
      n *= d;
    }
    return n;
  }

  /**
   * Returns the number of elements of a tensor of this shape, or -1 if the shape is not fully
   * defined or the number exceeds {@code limit}.
   */
  public long numElementsAtMost(long limit) {
    if (!isFullyDefined()) {
      return -1;
    }
    for (long d : shape) {
      if (d == 0) {
        return 0;
      }
    }
    long n = 1;
    for (long d : shape) {
      if (d > limit / n) {
        return -1;
      }
      n *= d;
    }
    return n;
  }

  /**
   * Returns true if some tensor could have both this shape and {@code other}.
   *
   * <p>Unknown ranks are compatible with everything, and an unknown dimension is compatible with
   * any size.
   */
  public boolean isCompatibleWith(Shape other) {
    if (shape == null || other.shape == null) {
      return true;
    }
    if (shape.length != other.shape.length) {
      return false;
    }
    for (int i = 0; i < shape.length; ++i) {
      if (shape[i] >= 0 && other.shape[i] >= 0 && shape[i] != other.shape[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Combines the information of this shape and {@code other}.
   *
   * @throws IllegalArgumentException if the two shapes are not compatible
   */
  public Shape mergeWith(Shape other) {
    if (!isCompatibleWith(other)) {
      throw new IllegalArgumentException(
          String.format("Shapes %s and %s are not compatible", this, other));
    }
    if (shape == null) {
      return other;
    }
    if (other.shape == null) {
      return this;
    }
    long[] merged = new long[shape.length];
    for (int i = 0; i < shape.length; ++i) {
      merged[i] = shape[i] >= 0 ? shape[i] : other.shape[i];
    }
    return new Shape(merged);
  }

  /**
   * Returns this shape with its rank constrained to {@code numDimensions}.
   *
   * @throws IllegalArgumentException if this shape has a different known rank
   */
  public Shape withRank(int numDimensions) {
    return mergeWith(unknown(numDimensions));
  }

  /** Appends the dimensions of {@code other}; the result has unknown rank if either does. */
  public Shape concatenate(Shape other) {
    if (shape == null || other.shape == null) {
      return unknown();
    }
    long[] result = new long[shape.length + other.shape.length];
    System.arraycopy(shape, 0, result, 0, shape.length);
    System.arraycopy(other.shape, 0, result, shape.length, other.shape.length);
    return new Shape(result);
  }

  /** Returns a copy of the dimension sizes, or null if the number of dimensions is unknown. */
  public long[] toArray() {
    return shape == null ? null : shape.clone();
  }

  /**
   * Shapes are equal only when both are fully known and have the same sizes; two shapes with
   * unknown parts may describe different tensors.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Shape)) {
      return false;
    }
    Shape other = (Shape) obj;
    if (!isFullyDefined() || !other.isFullyDefined()) {
      return false;
    }
    return Arrays.equals(shape, other.shape);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(shape);
  }

  /** Succint description of the shape meant for debugging. */
  @Override
  public String toString() {
    if (shape == null) {
      return "<unknown>";
    }
    return Arrays.toString(shape).replace("-1", "?");
  }

  // Package-private constructor.
  Shape(long[] shape) {
    this.shape = shape;
  }

  // Package-private accessor.
  // The idea is that the public API does not expose the internal array.
  long[] asArray() {
    return shape;
  }

  private final long[] shape;
}
