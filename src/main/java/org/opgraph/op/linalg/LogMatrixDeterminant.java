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
import org.opgraph.Output;
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Computes the sign and the log of the absolute value of the determinant of one or more square
 * matrices.
 *
 * <p>The input is a tensor of shape {@code [N, M, M]} whose inner-most 2 dimensions form square
 * matrices. The outputs are two tensors containing the signs and absolute values of the log
 * determinants for all N input submatrices {@code [..., :, :]} such that the determinant equals
 * {@code sign * exp(logAbsDeterminant)}.
 */
public final class LogMatrixDeterminant extends PrimitiveOp {

  public static LogMatrixDeterminant create(Scope scope, Operand input) {
    OperationHelper helper = OperationHelper.create(scope, "LogMatrixDeterminant");
    helper.builder().addInput(input.asOutput()).setAttr("T", input.asOutput().dataType());
    return new LogMatrixDeterminant(helper);
  }

  /** The signs of the log determinants of the inputs. Shape is {@code [N]}. */
  public Output sign() {
    return sign;
  }

  /** The logs of the absolute values of the determinants of the N input matrices. */
  public Output logAbsDeterminant() {
    return logAbsDeterminant;
  }

  private LogMatrixDeterminant(OperationHelper helper) {
    super(helper.operation());
    sign = helper.nextOutput();
    logAbsDeterminant = helper.nextOutput();
  }

  private final Output sign;
  private final Output logAbsDeterminant;
}
