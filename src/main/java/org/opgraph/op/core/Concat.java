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
import org.opgraph.op.Operands;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/** Concatenates tensors along one dimension. */
public final class Concat extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new ConcatV2 operation.
   *
   * @param scope current scope
   * @param values List of {@code N} tensors to concatenate. Their ranks and types must match, and
   *     their sizes must match in all dimensions except {@code axis}.
   * @param axis 0-D. The dimension along which to concatenate. Must be in the range [-rank(values),
   *     rank(values)).
   * @return a new instance of Concat
   */
  public static Concat create(Scope scope, Iterable<? extends Operand> values, Operand axis) {
    Output[] inputs = Operands.asOutputs(values);
    OperationHelper helper = OperationHelper.create(scope, "ConcatV2");
    helper
        .builder()
        .addInputList(inputs)
        .addInput(axis.asOutput())
        .setAttr("N", inputs.length)
        .setAttr("Tidx", axis.asOutput().dataType());
    return new Concat(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Concat(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
