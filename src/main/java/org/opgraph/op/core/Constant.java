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

package org.opgraph.op.core;

import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.Tensor;
import org.opgraph.Tensors;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/** An operator producing a constant value. */
public final class Constant extends PrimitiveOp implements Operand {

  /**
   * Creates a constant containing a single {@code int} element.
   *
   * @param scope is a scope used to add the underlying operation.
   * @param data The value to put into the new constant.
   * @return an integer constant
   */
  public static Constant create(Scope scope, int data) {
    return create(scope, Tensors.create(data));
  }

  /**
   * Creates a rank-1 constant of {@code int} elements.
   *
   * @param scope is a scope used to add the underlying operation.
   * @param data An array containing the values to put into the new constant. The dimensions of the
   *     new constant will match those of the array.
   */
  public static Constant create(Scope scope, int[] data) {
    return create(scope, Tensors.create(data));
  }

  /**
   * Creates a rank-2 constant of {@code int} elements.
   *
   * @param scope is a scope used to add the underlying operation.
   * @param data An array containing the values to put into the new constant. The dimensions of the
   *     new constant will match those of the array.
   */
  public static Constant create(Scope scope, int[][] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a constant containing a single {@code long} element. */
  public static Constant create(Scope scope, long data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-1 constant of {@code long} elements. */
  public static Constant create(Scope scope, long[] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-2 constant of {@code long} elements. */
  public static Constant create(Scope scope, long[][] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a constant containing a single {@code float} element. */
  public static Constant create(Scope scope, float data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-1 constant of {@code float} elements. */
  public static Constant create(Scope scope, float[] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-2 constant of {@code float} elements. */
  public static Constant create(Scope scope, float[][] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a constant containing a single {@code double} element. */
  public static Constant create(Scope scope, double data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-1 constant of {@code double} elements. */
  public static Constant create(Scope scope, double[] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a rank-2 constant of {@code double} elements. */
  public static Constant create(Scope scope, double[][] data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a constant containing a single {@code boolean} element. */
  public static Constant create(Scope scope, boolean data) {
    return create(scope, Tensors.create(data));
  }

  /** Creates a {@code String} constant. */
  public static Constant create(Scope scope, String data) {
    return create(scope, Tensors.create(data));
  }

  /**
   * Create a constant holding {@code value}.
   *
   * @param scope is a scope used to add the underlying operation.
   * @param value the value of the constant, of any type and shape
   * @return a constant of the type and shape of {@code value}
   */
  public static Constant create(Scope scope, Tensor value) {
    return new Constant(
        scope
            .opBuilder("Const", "Const")
            .setAttr("value", value)
            .setAttr("dtype", value.dataType())
            .build());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Constant(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
