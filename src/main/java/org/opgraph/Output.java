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

package org.opgraph;

import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.op.Scope;

/**
 * A symbolic handle to a tensor produced by an {@link Operation}.
 *
 * <p>An {@code Output} does not hold a value: it names the {@code index}-th result slot of an
 * operation. Two outputs are equal when they refer to the same operation and index.
 *
 * <p>By implementing the {@link Operand} interface, instances of this class also act as operands to
 * {@link org.opgraph.op.Op Op} instances.
 */
public final class Output implements Operand, OutputLike {

  /** Returns the Operation that will produce the tensor referred to by this Output. */
  @Override
  public Operation op() {
    return operation;
  }

  /** Returns the index into the outputs of the Operation. */
  public int index() {
    return index;
  }

  @Override
  public Graph graph() {
    return operation.graph();
  }

  /** Returns the name of this output, {@code <op name>:<index>}. */
  @Override
  public String name() {
    return operation.name() + ":" + index;
  }

  /** Returns the (possibly partially known) shape of the tensor referred to by this Output. */
  public Shape shape() {
    return operation.outputShape(index);
  }

  /** Returns the DataType of the tensor referred to by this Output. */
  @Override
  public DataType dataType() {
    return operation.outputType(index);
  }

  @Override
  public String device() {
    return operation.device();
  }

  /** Returns the inputs of other operations currently consuming this output. */
  public List<OperationInput> consumers() {
    return operation.consumers(index);
  }

  @Override
  public Output asOutput() {
    return this;
  }

  /** Returns this output; no operation is added. */
  @Override
  public Output toOutput(Scope scope, @Nullable DataType dataType) {
    if (dataType != null && dataType != dataType()) {
      throw new InvalidDataTypeException(
          String.format(
              "Output conversion requested data type '%s' for '%s' with data type '%s'",
              dataType, name(), dataType()));
    }
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(operation, index);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (o instanceof Output) {
      Output that = (Output) o;
      return index == that.index && operation.equals(that.operation);
    }
    return false;
  }

  @Override
  public String toString() {
    return String.format(
        "<%s '%s:%d' shape=%s dtype=%s>",
        operation.type(), operation.name(), index, shape().toString(), dataType());
  }

  /** Handle to the idx-th output of the Operation {@code op}. */
  Output(GraphOperation op, int idx) {
    operation = op;
    index = idx;
  }

  GraphOperation graphOperation() {
    return operation;
  }

  private final GraphOperation operation;
  private final int index;
}
