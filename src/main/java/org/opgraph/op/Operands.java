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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;

/** Conversions between operand collections and the types taken by operation builders. */
public final class Operands {

  /**
   * Returns the outputs of {@code inputs}, in iteration order, as an array suitable for {@link
   * org.opgraph.OperationBuilder#addInputList(Output[])}.
   */
  public static Output[] asOutputs(Iterable<? extends Operand> inputs) {
    List<Output> outputs = new ArrayList<>();
    inputs.forEach(input -> outputs.add(input.asOutput()));
    return outputs.toArray(new Output[0]);
  }

  /**
   * Returns the operations producing {@code operands}, in order and without duplicates, for use as
   * control dependencies.
   */
  public static Set<Operation> producers(Iterable<? extends Operand> operands) {
    Set<Operation> ops = new LinkedHashSet<>();
    for (Operand operand : operands) {
      ops.add(operand.asOutput().op());
    }
    return ops;
  }

  // Disabled constructor
  private Operands() {}
}
