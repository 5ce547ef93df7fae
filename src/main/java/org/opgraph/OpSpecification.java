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

import java.util.Objects;

/**
 * What a {@link DeviceFunction} knows about an operation being placed: its requested name and its
 * type.
 */
public final class OpSpecification {

  public OpSpecification(String name, String type) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
  }

  /** Fully qualified name requested for the operation, before it is made unique. */
  public String name() {
    return name;
  }

  /** Type of the operation. */
  public String type() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof OpSpecification)) {
      return false;
    }
    OpSpecification that = (OpSpecification) o;
    return name.equals(that.name) && type.equals(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return String.format("<%s '%s'>", type, name);
  }

  private final String name;
  private final String type;
}
