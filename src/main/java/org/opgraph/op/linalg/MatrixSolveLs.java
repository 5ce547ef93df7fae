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
import org.opgraph.op.core.Constant;

/**
 * Solves one or more linear least-squares problems.
 *
 * <p>{@code matrix} is a tensor of shape {@code [..., M, N]} whose inner-most 2 dimensions form
 * real or complex matrices of size {@code [M, N]}. {@code rhs} is a tensor of the same type as
 * {@code matrix} and shape {@code [..., M, K]}. The output is a tensor of shape {@code [..., N, K]}
 * where each output matrix solves each of the equations {@code matrix[..., :, :] * output[..., :,
 * :] = rhs[..., :, :]} in the least squares sense, regularized by {@code l2Regularizer}.
 */
public final class MatrixSolveLs extends PrimitiveOp implements Operand {

  /** Optional attributes for {@link MatrixSolveLs} */
  public static class Options {

    /**
     * @param fast If true, solves the normal equations through a Cholesky decomposition, which is
     *     faster but less numerically stable. Defaults to true.
     */
    public Options fast(Boolean fast) {
      this.fast = fast;
      return this;
    }

    private Boolean fast;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new MatrixSolveLs operation.
   *
   * @param scope current scope
   * @param matrix Shape is {@code [..., M, N]}.
   * @param rhs Shape is {@code [..., M, K]}.
   * @param l2Regularizer Scalar tensor of type DOUBLE.
   * @param options carries optional attributes values
   * @return a new instance of MatrixSolveLs
   */
  public static MatrixSolveLs create(
      Scope scope, Operand matrix, Operand rhs, Operand l2Regularizer, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "MatrixSolveLs");
    boolean fast = true;
    for (Options opts : options) {
      if (opts.fast != null) {
        fast = opts.fast;
      }
    }
    helper
        .builder()
        .addInput(matrix.asOutput())
        .addInput(rhs.asOutput())
        .addInput(l2Regularizer.asOutput())
        .setAttr("T", matrix.asOutput().dataType())
        .setAttr("fast", fast);
    return new MatrixSolveLs(helper.operation());
  }

  /**
   * Like {@link #create(Scope, Operand, Operand, Operand, Options...)}, with a constant
   * regularizer added to {@code scope}.
   */
  public static MatrixSolveLs create(
      Scope scope, Operand matrix, Operand rhs, double l2Regularizer, Options... options) {
    Constant regularizer = Constant.create(scope.withName("L2Regularizer"), l2Regularizer);
    return create(scope, matrix, rhs, regularizer, options);
  }

  public static Options fast(Boolean fast) {
    return new Options().fast(fast);
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private MatrixSolveLs(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
