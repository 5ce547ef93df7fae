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
 * Computes the inverse of one or more square invertible matrices or their adjoints (conjugate
 * transposes).
 *
 * <p>The input is a tensor of shape {@code [..., M, M]} whose inner-most 2 dimensions form square
 * matrices. The output is a tensor of the same shape as the input containing the inverse for all
 * input submatrices {@code [..., :, :]}.
 */
public final class MatrixInverse extends PrimitiveOp implements Operand {

  /** Optional attributes for {@link MatrixInverse} */
  public static class Options {

    /** @param adjoint If true, computes the inverse of the adjoint of the input. */
    public Options adjoint(Boolean adjoint) {
      this.adjoint = adjoint;
      return this;
    }

    private Boolean adjoint;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new MatrixInverse operation.
   *
   * @param scope current scope
   * @param input Shape is {@code [..., M, M]}.
   * @param options carries optional attributes values
   * @return a new instance of MatrixInverse
   */
  public static MatrixInverse create(Scope scope, Operand input, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "MatrixInverse");
    boolean adjoint = false;
    for (Options opts : options) {
      if (opts.adjoint != null) {
        adjoint = opts.adjoint;
      }
    }
    helper
        .builder()
        .addInput(input.asOutput())
        .setAttr("T", input.asOutput().dataType())
        .setAttr("adjoint", adjoint);
    return new MatrixInverse(helper.operation());
  }

  /** @param adjoint If true, computes the inverse of the adjoint of the input. */
  public static Options adjoint(Boolean adjoint) {
    return new Options().adjoint(adjoint);
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private MatrixInverse(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
