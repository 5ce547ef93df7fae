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
 * Creates a sequence of numbers.
 *
 * <p>This operation creates a sequence of numbers that begins at {@code start} and extends by
 * increments of {@code delta} up to but not including {@code limit}. For example, {@code start = 3,
 * limit = 18, delta = 3} produces {@code [3, 6, 9, 12, 15]}.
 */
public final class Range extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new Range operation.
   *
   * @param scope current scope
   * @param start 0-D (scalar). First entry in the sequence.
   * @param limit 0-D (scalar). Upper limit of sequence, exclusive.
   * @param delta 0-D (scalar). Optional. Default is 1. Number that increments {@code start}.
   * @return a new instance of Range
   */
  public static Range create(Scope scope, Operand start, Operand limit, Operand delta) {
    OperationHelper helper = OperationHelper.create(scope, "Range");
    helper
        .builder()
        .addInput(start.asOutput())
        .addInput(limit.asOutput())
        .addInput(delta.asOutput())
        .setAttr("Tidx", start.asOutput().dataType());
    return new Range(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Range(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
