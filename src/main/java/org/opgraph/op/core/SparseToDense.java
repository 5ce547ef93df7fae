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
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Converts a sparse representation into a dense tensor.
 *
 * <p>The dense tensor has shape {@code outputShape}. Entry {@code sparseIndices[i]} is set to
 * {@code sparseValues[i]}, all other entries to {@code defaultValue}.
 */
public final class SparseToDense extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new SparseToDense operation.
   *
   * @param scope current scope
   * @param sparseIndices 0-D, 1-D, or 2-D. {@code sparseIndices[i]} contains the complete index
   *     where {@code sparseValues[i]} will be placed.
   * @param outputShape 1-D. Shape of the dense output tensor.
   * @param sparseValues 1-D. Values corresponding to each row of {@code sparseIndices}.
   * @param defaultValue Scalar value to set for indices not specified in {@code sparseIndices}.
   * @return a new instance of SparseToDense
   */
  public static SparseToDense create(
      Scope scope,
      Operand sparseIndices,
      Operand outputShape,
      Operand sparseValues,
      Operand defaultValue) {
    OperationHelper helper = OperationHelper.create(scope, "SparseToDense");
    helper
        .builder()
        .addInput(sparseIndices.asOutput())
        .addInput(outputShape.asOutput())
        .addInput(sparseValues.asOutput())
        .addInput(defaultValue.asOutput())
        .setAttr("validate_indices", true);
    return new SparseToDense(helper.operation());
  }

  @Override
  public Output asOutput() {
    return dense;
  }

  private SparseToDense(Operation operation) {
    super(operation);
    dense = operation.output(0);
  }

  private final Output dense;
}
