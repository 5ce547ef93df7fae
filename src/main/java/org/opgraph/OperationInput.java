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

import java.util.Objects;

/**
 * One input slot of an {@link Operation}.
 *
 * <p>Inputs of operations are {@link Output}s of other operations; an {@code OperationInput} is the
 * other end of such an edge and is mainly useful to list the consumers of an output.
 */
public final class OperationInput {

  /** Returns the operation this input belongs to. */
  public Operation op() {
    return operation;
  }

  /** Returns the index of this input among the inputs of {@link #op()}. */
  public int index() {
    return index;
  }

  /** Returns the data type of the tensor flowing into this input. */
  public DataType dataType() {
    return operation.input(index).dataType();
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
    if (o instanceof OperationInput) {
      OperationInput that = (OperationInput) o;
      return index == that.index && operation.equals(that.operation);
    }
    return false;
  }

  @Override
  public String toString() {
    return String.format("<input '%s:%d' dtype=%s>", operation.name(), index, dataType());
  }

  OperationInput(Operation operation, int index) {
    this.operation = operation;
    this.index = index;
  }

  private final Operation operation;
  private final int index;
}
