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

/** Return a tensor with the same shape and contents as the input tensor or value. */
public final class Identity extends PrimitiveOp implements Operand {

  public static Identity create(Scope scope, Operand input) {
    OperationHelper helper = OperationHelper.create(scope, "Identity");
    helper.builder().addInput(input.asOutput()).setAttr("T", input.asOutput().dataType());
    return new Identity(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Identity(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
