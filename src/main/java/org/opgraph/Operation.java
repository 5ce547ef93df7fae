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
import java.util.Set;

/**
 * Performs computation on Tensors.
 *
 * <p>An Operation takes zero or more {@link Output}s (produced by other Operations) as input, and
 * produces zero or more {@link Output}s. Operations are immutable once built; only the sets of
 * their consumers and control outputs grow as the graph grows.
 */
public interface Operation {

  /** Returns the graph owning this operation. */
  Graph graph();

  /** Returns the full name of the Operation. */
  String name();

  /**
   * Returns the type of the operation, i.e., the name of the computation performed by the
   * operation.
   */
  String type();

  /** Returns the device this operation is placed on, or an empty string if it has none. */
  String device();

  /** Returns the operations this operation is guaranteed to be placed with. */
  Set<Operation> colocationOps();

  /** Returns the number of tensors fed as input to this operation. */
  int numInputs();

  /** Returns the output feeding the {@code idx}-th input of this operation. */
  Output input(int idx);

  /** Returns all the inputs of this operation, in order. */
  List<Output> inputs();

  /** Returns the number of tensors produced by this operation. */
  int numOutputs();

  /**
   * Returns symbolic handles to a list of tensors produced by this operation.
   *
   * @param idx index of the first tensor of the list
   * @param length number of tensors in the list
   * @return array of {@code Output}
   */
  Output[] outputList(int idx, int length);

  /**
   * Returns a symbolic handle to one of the tensors produced by this operation.
   *
   * @param idx The index of the output among the outputs produced by this operation.
   * @throws IndexOutOfBoundsException if there is no such output
   */
  Output output(int idx);

  /** Returns the number of operations that must finish before this one starts. */
  int numControlInputs();

  /** Returns the operations that must finish before this one starts. */
  Set<Operation> controlInputs();

  /** Returns the current number of operations that start only after this one finishes. */
  int numControlOutputs();

  /**
   * Returns the operations currently known to start only after this one finishes.
   *
   * <p>Building further operations can add to this set.
   */
  Set<Operation> controlOutputs();

  /** Returns true if this operation carries an attribute named {@code name}. */
  boolean hasAttr(String name);

  /**
   * Returns the value of a string-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  String attrString(String name);

  /**
   * Returns the value of a string-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  String[] attrStringList(String name);

  /**
   * Returns the value of an integer-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  long attrLong(String name);

  /**
   * Returns the value of an integer-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  long[] attrLongList(String name);

  /**
   * Returns the value of a float-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  float attrFloat(String name);

  /**
   * Returns the value of a float-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  float[] attrFloatList(String name);

  /**
   * Returns the value of a boolean-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  boolean attrBool(String name);

  /**
   * Returns the value of a boolean-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  boolean[] attrBoolList(String name);

  /**
   * Returns the value of a type-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  DataType attrType(String name);

  /**
   * Returns the value of a type-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  DataType[] attrTypeList(String name);

  /**
   * Returns the value of a tensor-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  Tensor attrTensor(String name);

  /**
   * Returns the value of a tensor-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  Tensor[] attrTensorList(String name);

  /**
   * Returns the value of a shape-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  Shape attrShape(String name);

  /**
   * Returns the value of a shape-list-valued attribute.
   *
   * @throws IllegalArgumentException if there is no such attribute or it has another type
   */
  Shape[] attrShapeList(String name);
}
