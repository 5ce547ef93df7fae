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

import org.opgraph.DataType;
import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.Tensors;
import org.opgraph.op.Op;
import org.opgraph.op.Scope;

/**
 * An operator creating a constant initialized with zeros of the shape given by `dims`.
 *
 * <p>For example, the following expression
 *
 * <pre>{@code Zeros.create(scope, Constant.create(scope, new long[] {2, 2}), DataType.FLOAT)}</pre>
 *
 * is the equivalent of
 *
 * <pre>{@code
 * Fill.create(scope, Constant.create(scope, new long[] {2, 2}), Constant.create(scope, 0.0f))
 * }</pre>
 */
public final class Zeros implements Op, Operand {

  /**
   * Creates a zeroed tensor given its type and shape.
   *
   * @param scope is a scope used to add the underlying operation
   * @param dims a 1-D operand that represents the shape of the output tensor
   * @param type the output tensor datatype
   * @return a constant tensor initialized with zeros
   * @throws IllegalArgumentException if the tensor type cannot be initialized with zeros.
   */
  public static Zeros create(Scope scope, Operand dims, DataType type) {
    Scope childScope = scope.withSubScope("Zeros"); // An op name set on scope prevails on "Zeros"
    if (!type.isNumeric() && type != DataType.BOOL) {
      throw new IllegalArgumentException(type + " tensors cannot be initialized with zeros");
    }
    Constant zero = Constant.create(childScope.withName("Zero"), Tensors.scalar(type, 0));
    return new Zeros(Fill.create(childScope, dims, zero));
  }

  /** Returns the {@code Fill} operation producing the zeros. */
  @Override
  public Operation op() {
    return fill.op();
  }

  @Override
  public Output asOutput() {
    return fill.asOutput();
  }

  private final Fill fill;

  private Zeros(Fill fill) {
    this.fill = fill;
  }
}
