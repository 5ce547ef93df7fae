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

/**
 * Interface implemented by operands of an operation.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * // The output of a "Placeholder" operation can be used as an operand to "Cholesky"
 * Placeholder x = Placeholder.create(scope, DataType.DOUBLE, Shape.make(3, 3));
 * Cholesky l = Cholesky.create(scope, x);
 *
 * // The first output "q" of the "Qr" operation can be used as an operand to "MatrixInverse"
 * Output q = Qr.create(scope, x).q();
 * MatrixInverse.create(scope, q);
 * }</pre>
 */
public interface Operand {

  /**
   * Returns the symbolic handle of a tensor.
   *
   * <p>Inputs to operations are outputs of another operation. This method is used to obtain a
   * symbolic handle that represents the computation of the input.
   *
   * @see OperationBuilder#addInput(Output)
   */
  Output asOutput();
}
