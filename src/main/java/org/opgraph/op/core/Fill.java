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
 * Creates a tensor filled with a scalar value.
 *
 * <p>This operation creates a tensor of shape {@code dims} and fills it with {@code value}. For
 * example, filling {@code [2, 3]} with {@code 9} produces {@code [[9, 9, 9], [9, 9, 9]]}.
 */
public final class Fill extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new Fill operation.
   *
   * @param scope current scope
   * @param dims 1-D. Represents the shape of the output tensor.
   * @param value 0-D (scalar). Value to fill the returned tensor.
   * @return a new instance of Fill
   */
  public static Fill create(Scope scope, Operand dims, Operand value) {
    OperationHelper helper = OperationHelper.create(scope, "Fill");
    helper.builder().addInput(dims.asOutput()).addInput(value.asOutput());
    return new Fill(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Fill(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
