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
 * Scoped construction of operations.
 *
 * <p>A {@link org.opgraph.op.Scope} carries the name scope, device placement, colocation
 * constraints, control dependencies, attributes and resource container applied to new operations.
 * {@link org.opgraph.op.ScopeStack} keeps the current scope of a construction thread.
 */
package org.opgraph.op;
