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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.op.Scope;

/**
 * Common view of the symbolic values produced by operations: a dense {@link Output}, a row-sparse
 * {@link OutputIndexedSlices} or a coordinate-sparse {@link SparseOutput}.
 */
public interface OutputLike {

  /** Returns the graph the underlying operations belong to. */
  Graph graph();

  /** Returns a name describing this value. */
  String name();

  /** Returns the type of the elements of this value. */
  DataType dataType();

  /** Returns the device this value is placed on, or an empty string. */
  String device();

  /** Returns the operation producing this value (its values tensor for sparse variants). */
  Operation op();

  /**
   * Returns a dense {@link Output} equal to this value, adding the required operations to {@code
   * scope} if a conversion is needed.
   *
   * @param scope scope used to add conversion operations
   * @param dataType requested element type, or null to accept {@link #dataType()}
   * @throws InvalidDataTypeException if {@code dataType} differs from {@link #dataType()} or the
   *     dense shape needed for the conversion is unavailable
   */
  Output toOutput(Scope scope, @Nullable DataType dataType);
}
