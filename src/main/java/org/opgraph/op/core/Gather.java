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
 * Gather slices from {@code params} according to {@code indices}.
 *
 * <p>{@code indices} must be an integer tensor of any dimension. The output has shape {@code
 * indices.shape + params.shape[1:]}; a scalar index selects one row of {@code params}.
 */
public final class Gather extends PrimitiveOp implements Operand {

  public static Gather create(Scope scope, Operand params, Operand indices) {
    OperationHelper helper = OperationHelper.create(scope, "Gather");
    helper
        .builder()
        .addInput(params.asOutput())
        .addInput(indices.asOutput())
        .setAttr("Tparams", params.asOutput().dataType())
        .setAttr("Tindices", indices.asOutput().dataType());
    return new Gather(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Gather(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
