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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Implementation for an {@link Operation} added as a node to a {@link Graph}.
 *
 * <p>A GraphOperation is a lightweight reference, the pair of its graph and the index of its node
 * record in that graph. It holds no state of its own, so creating, copying and comparing instances
 * is cheap. If {@link Graph#close()} has been invoked, then methods on the GraphOperation instance
 * fail with an {@code IllegalStateException}.
 *
 * <p>GraphOperation instances are immutable and thread-safe.
 */
public final class GraphOperation implements Operation {

  GraphOperation(Graph g, int id) {
    this.graph = g;
    this.id = id;
  }

  @Override
  public Graph graph() {
    return graph;
  }

  @Override
  public String name() {
    return node().name;
  }

  @Override
  public String type() {
    return node().type;
  }

  @Override
  public String device() {
    return node().device;
  }

  @Override
  public Set<Operation> colocationOps() {
    Graph.Node n = node();
    Object value = n.attrs.get(COLOCATION_ATTR);
    if (value == null) {
      return Collections.emptySet();
    }
    Set<Operation> ops = new LinkedHashSet<>();
    for (String entry : (String[]) value) {
      if (entry.startsWith(COLOCATION_PREFIX)) {
        GraphOperation op = graph.operation(entry.substring(COLOCATION_PREFIX.length()));
        if (op != null) {
          ops.add(op);
        }
      }
    }
    return Collections.unmodifiableSet(ops);
  }

  @Override
  public int numInputs() {
    return node().inputs.length;
  }

  @Override
  public Output input(int idx) {
    return node().inputs[idx];
  }

  @Override
  public List<Output> inputs() {
    return Collections.unmodifiableList(Arrays.asList(node().inputs));
  }

  @Override
  public int numOutputs() {
    return node().outputs.length;
  }

  @Override
  public Output[] outputList(int idx, int length) {
    Output[] outputs = new Output[length];
    for (int i = 0; i < length; ++i) {
      outputs[i] = output(idx + i);
    }
    return outputs;
  }

  @Override
  public Output output(int idx) {
    if (idx < 0 || idx >= numOutputs()) {
      throw new IndexOutOfBoundsException(
          String.format("'%s' has %d outputs, no output %d", name(), numOutputs(), idx));
    }
    return new Output(this, idx);
  }

  @Override
  public int numControlInputs() {
    return node().controlInputs.length;
  }

  @Override
  public Set<Operation> controlInputs() {
    return toOperations(node().controlInputs);
  }

  @Override
  public int numControlOutputs() {
    return graph.controlOutputIds(id).length;
  }

  @Override
  public Set<Operation> controlOutputs() {
    return toOperations(graph.controlOutputIds(id));
  }

  @Override
  public boolean hasAttr(String name) {
    return node().attrs.containsKey(name);
  }

  @Override
  public String attrString(String name) {
    return attr(name, String.class);
  }

  @Override
  public String[] attrStringList(String name) {
    return attr(name, String[].class).clone();
  }

  @Override
  public long attrLong(String name) {
    return attr(name, Long.class);
  }

  @Override
  public long[] attrLongList(String name) {
    return attr(name, long[].class).clone();
  }

  @Override
  public float attrFloat(String name) {
    return attr(name, Float.class);
  }

  @Override
  public float[] attrFloatList(String name) {
    return attr(name, float[].class).clone();
  }

  @Override
  public boolean attrBool(String name) {
    return attr(name, Boolean.class);
  }

  @Override
  public boolean[] attrBoolList(String name) {
    return attr(name, boolean[].class).clone();
  }

  @Override
  public DataType attrType(String name) {
    return attr(name, DataType.class);
  }

  @Override
  public DataType[] attrTypeList(String name) {
    return attr(name, DataType[].class).clone();
  }

  @Override
  public Tensor attrTensor(String name) {
    return attr(name, Tensor.class);
  }

  @Override
  public Tensor[] attrTensorList(String name) {
    return attr(name, Tensor[].class).clone();
  }

  @Override
  public Shape attrShape(String name) {
    return attr(name, Shape.class);
  }

  @Override
  public Shape[] attrShapeList(String name) {
    return attr(name, Shape[].class).clone();
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(graph) + id;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof GraphOperation)) {
      return false;
    }
    GraphOperation that = (GraphOperation) o;
    return graph == that.graph && id == that.id;
  }

  @Override
  public String toString() {
    return String.format("<%s '%s'>", type(), name());
  }

  int id() {
    return id;
  }

  Shape outputShape(int idx) {
    return node().outputs[idx].shape();
  }

  DataType outputType(int idx) {
    return node().outputs[idx].dataType();
  }

  List<OperationInput> consumers(int outputIdx) {
    List<OperationInput> result = new ArrayList<>();
    for (int[] consumer : graph.consumerIds(id, outputIdx)) {
      result.add(new OperationInput(new GraphOperation(graph, consumer[0]), consumer[1]));
    }
    return Collections.unmodifiableList(result);
  }

  private Graph.Node node() {
    return graph.node(id);
  }

  private Set<Operation> toOperations(int[] ids) {
    Set<Operation> ops = new LinkedHashSet<>();
    for (int i : ids) {
      ops.add(new GraphOperation(graph, i));
    }
    return Collections.unmodifiableSet(ops);
  }

  private <T> T attr(String name, Class<T> type) {
    Object value = node().attrs.get(name);
    if (value == null) {
      throw new IllegalArgumentException(
          String.format("Operation '%s' has no attribute named '%s'", name(), name));
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          String.format(
              "Attribute '%s' of operation '%s' is not of type %s",
              name, name(), type.getSimpleName()));
    }
    return type.cast(value);
  }

  /** Attribute listing the colocation group of an operation, as {@code loc:@<name>} entries. */
  static final String COLOCATION_ATTR = "_class";

  static final String COLOCATION_PREFIX = "loc:@";

  private final Graph graph;
  private final int id;
}
