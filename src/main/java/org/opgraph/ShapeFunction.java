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

/**
 * Computes the data types and static shapes of the outputs of an operation from its inputs and
 * attributes.
 *
 * <p>Shape functions run before the operation is added to its graph. They reject invalid operations
 * by throwing, typically an {@link IllegalArgumentException} or an {@link
 * InvalidDataTypeException}.
 */
@FunctionalInterface
public interface ShapeFunction {

  /** Returns one {@link OutputSpec} per output of the operation. */
  List<OutputSpec> infer(InferenceContext context);
}
