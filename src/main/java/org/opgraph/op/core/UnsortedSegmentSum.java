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
 * Computes the sum along segments of a tensor.
 *
 * <p>Computes a tensor such that {@code output[i] = sum(data[j...])} over all {@code j} where
 * {@code segmentIds[j...] == i}. Unlike a sorted segment sum, the ids need not be sorted nor cover
 * all values in the full range. Segments without ids are zero. The output has {@code numSegments}
 * rows.
 */
public final class UnsortedSegmentSum extends PrimitiveOp implements Operand {

  /**
   * Factory method to create a class wrapping a new UnsortedSegmentSum operation.
   *
   * @param scope current scope
   * @param data the values to sum
   * @param segmentIds a tensor whose shape is a prefix of {@code data.shape}
   * @param numSegments 0-D. The number of rows of the output
   * @return a new instance of UnsortedSegmentSum
   */
  public static UnsortedSegmentSum create(
      Scope scope, Operand data, Operand segmentIds, Operand numSegments) {
    OperationHelper helper = OperationHelper.create(scope, "UnsortedSegmentSum");
    helper
        .builder()
        .addInput(data.asOutput())
        .addInput(segmentIds.asOutput())
        .addInput(numSegments.asOutput());
    return new UnsortedSegmentSum(helper.operation());
  }

  @Override
  public Output asOutput() {
    return output;
  }

  private UnsortedSegmentSum(Operation operation) {
    super(operation);
    output = operation.output(0);
  }

  private final Output output;
}
