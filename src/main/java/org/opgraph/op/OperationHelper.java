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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.opgraph.Operation;
import org.opgraph.OperationBuilder;
import org.opgraph.Output;

/**
 * Builds the single operation of a wrapper and hands out its outputs in order.
 *
 * <p>A wrapper configures the operation through {@link #builder()}, then reads its outputs with
 * {@link #nextOutput()} and {@link #nextOutputList(int)}; the first read builds the operation:
 *
 * <pre>{@code
 * OperationHelper qr = OperationHelper.create(scope, "Qr");
 * qr.builder().addInput(matrix.asOutput()).setAttr("full_matrices", false);
 * Output q = qr.nextOutput();
 * Output r = qr.nextOutput();
 * }</pre>
 *
 * <p>A helper serves one wrapper and is not thread-safe.
 */
public final class OperationHelper {

  /**
   * Creates a helper for an operation of type {@code opType}, named after its type unless {@code
   * scope} carries a name set with {@link Scope#withName(String)}.
   */
  public static OperationHelper create(Scope scope, String opType) {
    return create(scope, opType, opType);
  }

  /** Creates a helper for an operation of type {@code opType} named {@code defaultName}. */
  public static OperationHelper create(Scope scope, String opType, String defaultName) {
    return new OperationHelper(scope.opBuilder(opType, defaultName));
  }

  /**
   * Returns the builder of the operation, to add its inputs and attributes.
   *
   * @throws IllegalStateException if the operation has already been built
   */
  public OperationBuilder builder() {
    if (operation != null) {
      throw new IllegalStateException(
          "operation '" + operation.name() + "' has already been built");
    }
    return builder;
  }

  /** Returns the operation, building it on the first call. */
  public Operation operation() {
    if (operation == null) {
      operation = builder.build();
    }
    return operation;
  }

  /**
   * Returns the output following the last one handed out.
   *
   * @throws IndexOutOfBoundsException if all outputs have been handed out
   */
  public Output nextOutput() {
    return operation().output(nextIndex++);
  }

  /** Returns the {@code count} outputs following the last one handed out. */
  public List<Output> nextOutputList(int count) {
    List<Output> outputs = new ArrayList<>(count);
    for (int i = 0; i < count; ++i) {
      outputs.add(nextOutput());
    }
    return Collections.unmodifiableList(outputs);
  }

  private final OperationBuilder builder;
  private Operation operation;
  private int nextIndex;

  private OperationHelper(OperationBuilder builder) {
    this.builder = builder;
  }
}
