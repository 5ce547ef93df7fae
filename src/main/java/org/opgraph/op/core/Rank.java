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
 * Returns the rank of a tensor, as an {@code INT32} scalar.
 *
 * <p>The rank of a tensor is the number of indices required to uniquely select each element of
 * the tensor: 0 for a scalar, 2 for a matrix.
 */
public final class Rank extends PrimitiveOp implements Operand {

  public static Rank create(Scope scope, Operand input) {
    OperationHelper helper = OperationHelper.create(scope, "Rank");
    helper.builder().addInput(input.asOutput());
    return new Rank(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Rank(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
