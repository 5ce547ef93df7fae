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
 * Solves systems of linear equations with upper or lower triangular matrices by backsubstitution.
 *
 * <p>{@code matrix} is a tensor of shape {@code [..., M, M]} whose inner-most 2 dimensions form
 * square matrices. If {@code lower} is true then the strictly upper triangular part of each
 * inner-most matrix is assumed to be zero and not accessed. If {@code lower} is false then the
 * strictly lower triangular part of each inner-most matrix is assumed to be zero and not accessed.
 * {@code rhs} is a tensor of shape {@code [..., M, K]}.
 *
 * <p>The output is a tensor of shape {@code [..., M, K]}.
 */
public final class MatrixTriangularSolve extends PrimitiveOp implements Operand {

  /** Optional attributes for {@link MatrixTriangularSolve} */
  public static class Options {

    /**
     * @param lower Boolean indicating whether the inner-most matrices in {@code matrix} are lower
     *     or upper triangular. Defaults to true.
     */
    public Options lower(Boolean lower) {
      this.lower = lower;
      return this;
    }

    /**
     * @param adjoint Boolean indicating whether to solve with {@code matrix} or its (block-wise)
     *     adjoint.
     */
    public Options adjoint(Boolean adjoint) {
      this.adjoint = adjoint;
      return this;
    }

    private Boolean lower;
    private Boolean adjoint;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new MatrixTriangularSolve operation.
   *
   * @param scope current scope
   * @param matrix Shape is {@code [..., M, M]}.
   * @param rhs Shape is {@code [..., M, K]}.
   * @param options carries optional attributes values
   * @return a new instance of MatrixTriangularSolve
   */
  public static MatrixTriangularSolve create(
      Scope scope, Operand matrix, Operand rhs, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "MatrixTriangularSolve");
    boolean lower = true;
    boolean adjoint = false;
    for (Options opts : options) {
      if (opts.lower != null) {
        lower = opts.lower;
      }
      if (opts.adjoint != null) {
        adjoint = opts.adjoint;
      }
    }
    helper
        .builder()
        .addInput(matrix.asOutput())
        .addInput(rhs.asOutput())
        .setAttr("T", matrix.asOutput().dataType())
        .setAttr("lower", lower)
        .setAttr("adjoint", adjoint);
    return new MatrixTriangularSolve(helper.operation());
  }

  public static Options lower(Boolean lower) {
    return new Options().lower(lower);
  }

  public static Options adjoint(Boolean adjoint) {
    return new Options().adjoint(adjoint);
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private MatrixTriangularSolve(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
