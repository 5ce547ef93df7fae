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

package org.opgraph.op;

import org.opgraph.Operation;

/**
 * Base class of the wrappers adding exactly one operation to the graph.
 *
 * <p>Two primitive wrappers are equal when they wrap the same operation, even if their classes
 * differ.
 */
public abstract class PrimitiveOp implements Op {

  @Override
  public Operation op() {
    return operation;
  }

  @Override
  public final boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    return obj instanceof PrimitiveOp && operation.equals(((PrimitiveOp) obj).operation);
  }

  @Override
  public final int hashCode() {
    return operation.hashCode();
  }

  /** Returns the type and name of the wrapped operation, for example {@code <Qr 'Qr_1'>}. */
  @Override
  public final String toString() {
    return String.format("<%s '%s'>", operation.type(), operation.name());
  }

  protected final Operation operation;

  protected PrimitiveOp(Operation operation) {
    this.operation = operation;
  }
}
