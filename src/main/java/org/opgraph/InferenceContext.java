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
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a {@link ShapeFunction} knows about the operation being built: its name, type, inputs (input
 * lists flattened in the order they were added) and attributes.
 */
public final class InferenceContext {

  InferenceContext(String name, String type, List<Output> inputs, Map<String, Object> attrs) {
    this.name = name;
    this.type = type;
    this.inputs = Collections.unmodifiableList(inputs);
    this.attrs = attrs;
  }

  public String name() {
    return name;
  }

  public String type() {
    return type;
  }

  public int numInputs() {
    return inputs.size();
  }

  public Output input(int idx) {
    return inputs.get(idx);
  }

  /** Returns the inputs {@code from} (inclusive) to {@code to} (exclusive). */
  public List<Output> inputs(int from, int to) {
    return inputs.subList(from, to);
  }

  public Shape inputShape(int idx) {
    return inputs.get(idx).shape();
  }

  public DataType inputType(int idx) {
    return inputs.get(idx).dataType();
  }

  /**
   * Checks the number of inputs.
   *
   * @throws IllegalArgumentException if there are not exactly {@code expected} inputs
   */
  public void checkNumInputs(int expected) {
    if (inputs.size() != expected) {
      throw new IllegalArgumentException(
          String.format(
              "%s '%s' expects %d inputs, got %d", type, name, expected, inputs.size()));
    }
  }

  /**
   * Returns the value of a required type attribute.
   *
   * @throws IllegalArgumentException if the attribute is not set
   */
  public DataType attrType(String attr) {
    return required(attr, DataType.class);
  }

  public DataType attrType(String attr, DataType defaultValue) {
    DataType value = optional(attr, DataType.class);
    return value == null ? defaultValue : value;
  }

  public long attrLong(String attr, long defaultValue) {
    Long value = optional(attr, Long.class);
    return value == null ? defaultValue : value;
  }

  public boolean attrBool(String attr, boolean defaultValue) {
    Boolean value = optional(attr, Boolean.class);
    return value == null ? defaultValue : value;
  }

  public Shape attrShape(String attr, Shape defaultValue) {
    Shape value = optional(attr, Shape.class);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns the value of a required tensor attribute.
   *
   * @throws IllegalArgumentException if the attribute is not set
   */
  public Tensor attrTensor(String attr) {
    return required(attr, Tensor.class);
  }

  /**
   * Returns the value of input {@code idx} if it is produced by a {@code Const} operation, null
   * otherwise. Unlike {@link org.opgraph.op.ConstantEvaluator} this does not look through other
   * operations.
   */
  public @Nullable Tensor constantInput(int idx) {
    Output input = inputs.get(idx);
    if (!input.op().type().equals("Const")) {
      return null;
    }
    return input.op().attrTensor("value");
  }

  private <T> T required(String attr, Class<T> kind) {
    T value = optional(attr, kind);
    if (value == null) {
      throw new IllegalArgumentException(
          String.format("%s '%s' requires attribute '%s'", type, name, attr));
    }
    return value;
  }

  private <T> @Nullable T optional(String attr, Class<T> kind) {
    Object value = attrs.get(attr);
    if (value == null) {
      return null;
    }
    if (!kind.isInstance(value)) {
      throw new IllegalArgumentException(
          String.format(
              "Attribute '%s' of %s '%s' must be a %s", attr, type, name, kind.getSimpleName()));
    }
    return kind.cast(value);
  }

  private final String name;
  private final String type;
  private final List<Output> inputs;
  private final Map<String, Object> attrs;
}
