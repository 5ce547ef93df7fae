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
 * Common type of the operation wrappers, so that the result of any {@code create} factory can be
 * kept in the same collection or used as a control dependency.
 *
 * <pre>{@code
 * Op qr = Qr.create(scope, matrix);
 * Op zeros = Zeros.create(scope, dims, DataType.FLOAT);
 * Scope after = scope.withControlDependencies(Arrays.asList(qr.op(), zeros.op()));
 * }</pre>
 */
public interface Op {

  /**
   * Returns the operation added by this wrapper, or the one producing its result when the wrapper
   * adds several operations.
   */
  Operation op();
}
