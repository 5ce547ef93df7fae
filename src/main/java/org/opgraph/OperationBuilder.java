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
 * A builder for {@link Operation}s.
 *
 * <p>For example, the following uses the builder to create an operation that produces the constant
 * "3" as its output:
 *
 * <pre>{@code
 * // g is a Graph instance.
 * Tensor c1 = Tensors.create(3.0f);
 * g.opBuilder("Const", "MyConst")
 *     .setAttr("dtype", c1.dataType())
 *     .setAttr("value", c1)
 *     .build();
 * }</pre>
 *
 * <p>A builder is single use: once {@link #build()} has returned, every method fails with an
 * {@link OpBuilderUsedException}.
 */
public interface OperationBuilder {

  /**
   * Build the {@link Operation}.
   *
   * <p>The operation is added as a node to the graph, under a name no other node uses. The
   * OperationBuilder is not usable after build() returns.
   *
   * @throws OpBuilderUsedException if called more than once
   * @throws GraphMismatchException if an input or control input belongs to another graph
   */
  Operation build();

  /**
   * Add the output of another operation as the next input of the operation being built.
   *
   * @param input {@link Output} supposed to be the input of the operation being built.
   * @return the OperationBuilder instance for chaining.
   */
  OperationBuilder addInput(Output input);

  /** Adds each of {@code inputs}, in order, as a separate input. */
  OperationBuilder addInputs(List<Output> inputs);

  /**
   * Add the outputs of other operations as a variadic input group of the operation being built.
   *
   * @param inputs list of {@link Output} supposed to be the inputs of the operation being built.
   * @return the OperationBuilder instance for chaining.
   */
  OperationBuilder addInputList(Output[] inputs);

  /**
   * Ensure that the operation does not execute before the control operation does.
   *
   * <p>A control input is an Operation that must be executed before running the operation
   * currently being built.
   *
   * <p>For example, an Assert operation may be added as a control input for this operation. The
   * Assert now behaves as a pre-condition that will always verify itself before running the
   * operation.
   *
   * @param control operation that must be executed before running this operation.
   * @return the OperationBuilder instance for chaining.
   */
  OperationBuilder addControlInput(Operation control);

  /**
   * Set the device requested for computing the operation being built.
   *
   * @param device the requested device, as a string
   * @return the OperationBuilder instance for chaining.
   */
  OperationBuilder setDevice(String device);

  OperationBuilder setAttr(String name, String value);

  OperationBuilder setAttr(String name, String[] value);

  OperationBuilder setAttr(String name, long value);

  OperationBuilder setAttr(String name, long[] value);

  OperationBuilder setAttr(String name, float value);

  OperationBuilder setAttr(String name, float[] value);

  OperationBuilder setAttr(String name, boolean value);

  OperationBuilder setAttr(String name, boolean[] value);

  OperationBuilder setAttr(String name, DataType value);

  OperationBuilder setAttr(String name, DataType[] value);

  OperationBuilder setAttr(String name, Tensor value);

  OperationBuilder setAttr(String name, Tensor[] value);

  OperationBuilder setAttr(String name, Shape value);

  OperationBuilder setAttr(String name, Shape[] value);
}
