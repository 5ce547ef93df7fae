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

/**
 * Packs a list of {@code N} rank-{@code R} tensors into one rank-{@code (R+1)} tensor.
 *
 * <p>Given a list of tensors of shape {@code (A, B, C)}, the output has shape {@code (N, A, B, C)}
 * when packing along {@code axis == 0} and {@code (A, N, B, C)} along {@code axis == 1}.
 *
 * <p>For example:
 *
 * <pre>{@code
 * # 'x' is [1, 4]
 * # 'y' is [2, 5]
 * # 'z' is [3, 6]
 * pack([x, y, z]) => [[1, 4], [2, 5], [3, 6]]  # Pack along first dim.
 * pack([x, y, z], axis=1) => [[1, 2, 3], [4, 5, 6]]
 * }</pre>
 */
public final class Stack extends PrimitiveOp implements Operand {

  /** Packs {@code values} along a new first dimension. */
  public static Stack create(Scope scope, Iterable<? extends Operand> values) {
    return create(scope, values, 0);
  }

  /**
   * Factory method to create a class wrapping a new Pack operation.
   *
   * @param scope current scope
   * @param values Must be of same shape and type.
   * @param axis Dimension along which to pack. Negative values wrap around, so the valid range is
   *     {@code [-(R+1), R+1)}.
   * @return a new instance of Stack
   */
  public static Stack create(Scope scope, Iterable<? extends Operand> values, long axis) {
    Output[] inputs = Operands.asOutputs(values);
    OperationHelper helper = OperationHelper.create(scope, "Pack");
    helper.builder().addInputList(inputs).setAttr("N", inputs.length).setAttr("axis", axis);
    return new Stack(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Stack(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
