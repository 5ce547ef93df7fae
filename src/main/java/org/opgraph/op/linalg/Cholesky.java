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

package org.opgraph.op.linalg;

import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Computes the Cholesky decomposition of one or more square matrices.
 *
 * <p>The input is a tensor of shape {@code [..., M, M]} whose inner-most 2 dimensions form square
 * matrices. The input has to be symmetric and positive definite. Only the lower-triangular part of
 * the input will be used for this operation. The upper-triangular part will not be read.
 *
 * <p>The output is a tensor of the same shape as the input containing the Cholesky decompositions
 * for all input submatrices {@code [..., :, :]}.
 */
public final class Cholesky extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new Cholesky operation.
   *
   * @param scope current scope
   * @param input Shape is {@code [..., M, M]}, of type FLOAT or DOUBLE.
   * @return a new instance of Cholesky
   * @throws org.opgraph.InvalidDataTypeException if {@code input} is of another type
   */
  public static Cholesky create(Scope scope, Operand input) {
    OperationHelper helper = OperationHelper.create(scope, "Cholesky");
    helper.builder().addInput(input.asOutput()).setAttr("T", input.asOutput().dataType());
    return new Cholesky(helper.operation());
  }

  /** Shape is {@code [..., M, M]}. */
  public Output output() {
    return output;
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Cholesky(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
