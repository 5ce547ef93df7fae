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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The change a scope makes to one string attribute inherited from its parent: set it to a value,
 * or remove it.
 */
public final class AttributeOverride {

  /** Sets the attribute to {@code value}. */
  public static AttributeOverride set(String value) {
    return new AttributeOverride(Objects.requireNonNull(value, "value"));
  }

  /** Removes the attribute, whether the parent scope sets it or not. */
  public static AttributeOverride remove() {
    return REMOVE;
  }

  public boolean isRemove() {
    return value == null;
  }

  /**
   * Returns the value set by this override.
   *
   * @throws IllegalStateException if this override removes the attribute
   */
  public String value() {
    if (value == null) {
      throw new IllegalStateException("attribute override removes the attribute");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof AttributeOverride)) {
      return false;
    }
    return Objects.equals(value, ((AttributeOverride) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return value == null ? "remove()" : "set(" + value + ")";
  }

  private static final AttributeOverride REMOVE = new AttributeOverride(null);

  private AttributeOverride(@Nullable String value) {
    this.value = value;
  }

  private final @Nullable String value;
}
