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
 * Solves systems of linear equations.
 *
 * <p>{@code matrix} is a tensor of shape {@code [..., M, M]} whose inner-most 2 dimensions form
 * square matrices. {@code rhs} is a tensor of shape {@code [..., M, K]}. The output is a tensor of
 * shape {@code [..., M, K]}. If {@code adjoint} is false then each output matrix satisfies {@code
 * matrix[..., :, :] * output[..., :, :] = rhs[..., :, :]}. If it is true then each output matrix
 * satisfies {@code adjoint(matrix[..., :, :]) * output[..., :, :] = rhs[..., :, :]}.
 */
public final class MatrixSolve extends PrimitiveOp implements Operand {

  /** Optional attributes for {@link MatrixSolve} */
  public static class Options {

    /**
     * @param adjoint Boolean indicating whether to solve with {@code matrix} or its (block-wise)
     *     adjoint.
     */
    public Options adjoint(Boolean adjoint) {
      this.adjoint = adjoint;
      return this;
    }

    private Boolean adjoint;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new MatrixSolve operation.
   *
   * @param scope current scope
   * @param matrix Shape is {@code [..., M, M]}.
   * @param rhs Shape is {@code [..., M, K]}.
   * @param options carries optional attributes values
   * @return a new instance of MatrixSolve
   */
  public static MatrixSolve create(Scope scope, Operand matrix, Operand rhs, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "MatrixSolve");
    boolean adjoint = false;
    for (Options opts : options) {
      if (opts.adjoint != null) {
        adjoint = opts.adjoint;
      }
    }
    helper
        .builder()
        .addInput(matrix.asOutput())
        .addInput(rhs.asOutput())
        .setAttr("T", matrix.asOutput().dataType())
        .setAttr("adjoint", adjoint);
    return new MatrixSolve(helper.operation());
  }

  public static Options adjoint(Boolean adjoint) {
    return new Options().adjoint(adjoint);
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private MatrixSolve(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
