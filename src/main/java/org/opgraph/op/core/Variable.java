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
import org.opgraph.Shape;
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Holds state in the form of a tensor that persists across steps.
 *
 * <p>The state lives in the container of the scope the variable is created in. Variables sharing a
 * container and a non-empty shared name share their state.
 */
public final class Variable extends PrimitiveOp implements Operand {

  /** Creates a variable whose state is private to it. */
  public static Variable create(Scope scope, Shape shape, DataType dtype) {
    return create(scope, shape, dtype, "");
  }

  /**
   * Factory method to create a class wrapping a new VariableV2 operation.
   *
   * @param scope current scope
   * @param shape The shape of the variable tensor.
   * @param dtype The type of elements in the variable tensor.
   * @param sharedName If non-empty, this variable is named in the given bucket with this
   *     shared_name. Otherwise, the node name is used instead.
   * @return a new instance of Variable
   */
  public static Variable create(Scope scope, Shape shape, DataType dtype, String sharedName) {
    OperationHelper helper = OperationHelper.create(scope, "VariableV2", "Variable");
    helper
        .builder()
        .setAttr("shape", shape)
        .setAttr("dtype", dtype)
        .setAttr("shared_name", sharedName);
    return new Variable(helper.operation());
  }

  /** Returns the name of the container holding the state of this variable, empty by default. */
  public String container() {
    return operation.hasAttr("container") ? operation.attrString("container") : "";
  }

  @Override
  public Output asOutput() {
    return ref;
  }

  private Variable(Operation operation) {
    super(operation);
    ref = operation.output(0);
  }

  private final Output ref;
}
