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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The defaults a scope applies to every operation built in it.
 *
 * <p>{@link org.opgraph.op.Scope} is the main implementation; {@link #DEFAULT} applies nothing.
 */
public interface OperationContext {

  /** A context with no device, control dependency, colocation, attribute or container. */
  OperationContext DEFAULT =
      new OperationContext() {
        @Override
        public @Nullable String deviceFor(OpSpecification spec) {
          return "";
        }

        @Override
        public Set<Operation> controlDependencies() {
          return Collections.emptySet();
        }

        @Override
        public Set<Operation> colocationOps() {
          return Collections.emptySet();
        }

        @Override
        public Map<String, String> attributes() {
          return Collections.emptyMap();
        }

        @Override
        public String container() {
          return "";
        }
      };

  /**
   * Returns the device of the operation described by {@code spec}, an empty string if it has no
   * device constraint, or null if placement has been reset.
   */
  @Nullable
  String deviceFor(OpSpecification spec);

  /** Operations every new operation must wait for. */
  Set<Operation> controlDependencies();

  /** Operations every new operation must be placed with. */
  Set<Operation> colocationOps();

  /** String attributes set on every new operation. */
  Map<String, String> attributes();

  /** Resource container of new stateful operations, empty for the default container. */
  String container();
}
