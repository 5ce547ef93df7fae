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

/**
 * Decides where a new operation is placed.
 *
 * <p>A device function returns a device specification string such as {@code "/device:GPU:0"} (see
 * {@link DeviceSpec}), an empty string to leave placement unconstrained, or {@code null} to reset
 * placement: once a scope's device function yields {@code null} for an operation, every scope
 * nested in it places that operation nowhere, whatever devices the nested scopes request.
 *
 * <p>The function sees the name requested for the operation, with its full name scope, before it
 * is made unique: two operations requested as {@code "layer/w"} are both presented as {@code
 * "layer/w"}, although the second one is registered as {@code "layer/w_1"}.
 */
public interface DeviceFunction {

  /** Leaves placement to the enclosing scopes. */
  DeviceFunction UNCONSTRAINED = spec -> "";

  /** Clears the device of all operations, in this scope and all scopes nested in it. */
  DeviceFunction RESET = spec -> null;

  /**
   * Returns the device for the operation described by {@code spec}.
   *
   * @return a device specification, an empty string for no constraint, or null to reset
   */
  @Nullable
  String device(OpSpecification spec);

  /**
   * Returns a function placing every operation on {@code device}.
   *
   * @param device a device specification, or null for {@link #RESET}
   */
  static DeviceFunction of(@Nullable String device) {
    if (device == null) {
      return RESET;
    }
    return spec -> device;
  }
}
