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
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Returns the shape of a tensor.
 *
 * <p>This operation returns a 1-D integer tensor representing the shape of {@code input}.
 */
public final class Shape extends PrimitiveOp implements Operand {

  /** Creates a Shape operation producing an {@link DataType#INT32} vector. */
  public static Shape create(Scope scope, Operand input) {
    return create(scope, input, DataType.INT32);
  }

  /**
   * Factory method to create a class wrapping a new Shape operation.
   *
   * @param scope current scope
   * @param input the tensor whose shape is returned
   * @param outType {@link DataType#INT32} or {@link DataType#INT64}
   * @return a new instance of Shape
   */
  public static Shape create(Scope scope, Operand input, DataType outType) {
    OperationHelper helper = OperationHelper.create(scope, "Shape");
    helper.builder().addInput(input.asOutput()).setAttr("out_type", outType);
    return new Shape(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Shape(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
