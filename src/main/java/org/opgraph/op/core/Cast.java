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

/** Cast x of type SrcT to y of DstT. */
public final class Cast extends PrimitiveOp implements Operand {

  public static Cast create(Scope scope, Operand x, DataType dstT) {
    OperationHelper helper = OperationHelper.create(scope, "Cast");
    helper
        .builder()
        .addInput(x.asOutput())
        .setAttr("SrcT", x.asOutput().dataType())
        .setAttr("DstT", dstT);
    return new Cast(helper.operation());
  }

  @Override
  public Output asOutput() {
    return y;
  }

  private Cast(Operation operation) {
    super(operation);
    y = operation.output(0);
  }

  private final Output y;
}
