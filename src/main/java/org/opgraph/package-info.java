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

/**
 * Defines classes to build symbolic computation graphs.
 *
 * <p>A {@link org.opgraph.Graph} owns operations, each created by an {@link
 * org.opgraph.OperationBuilder} from an op type registered in the {@link org.opgraph.OpRegistry}.
 * The static type and shape of every output are inferred when the operation is built.
 *
 * <p>Besides dense {@link org.opgraph.Output}s, the package provides two sparse values: {@link
 * org.opgraph.OutputIndexedSlices} and {@link org.opgraph.SparseOutput}. Both convert to a dense
 * output on request.
 */
package org.opgraph;
