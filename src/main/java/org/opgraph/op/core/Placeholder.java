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
 * A placeholder op for a value that will be fed into the computation.
 *
 * <p>Its value must be fed when the graph is run. The shape, if given, constrains the fed value.
 */
public final class Placeholder extends PrimitiveOp implements Operand {

  /** Creates a placeholder of any shape. */
  public static Placeholder create(Scope scope, DataType dtype) {
    return create(scope, dtype, Shape.unknown());
  }

  /**
   * Factory method to create a class wrapping a new Placeholder operation.
   *
   * @param scope current scope
   * @param dtype The type of elements in the tensor.
   * @param shape The (possibly partial) shape of the tensor.
   * @return a new instance of Placeholder
   */
  public static Placeholder create(Scope scope, DataType dtype, Shape shape) {
    OperationHelper helper = OperationHelper.create(scope, "Placeholder");
    helper.builder().setAttr("dtype", dtype).setAttr("shape", shape);
    return new Placeholder(helper.operation());
  }

  public Output output() {
    return output;
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private Placeholder(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
