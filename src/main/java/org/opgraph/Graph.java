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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A data flow graph representing a computation.
 *
 * <p>A Graph owns a dense table of node records. Operations are handed out as cheap {@link
 * GraphOperation} references holding only the index of their record, and every node name is
 * unique within the graph.
 *
 * <p>Instances of a Graph are thread-safe. Looking up a unique name and registering the node using
 * it happen in one critical section, so concurrent builders never pick the same name.
 */
public final class Graph implements AutoCloseable {

  /** Create an empty Graph. */
  public Graph() {}

  /**
   * Release resources associated with the Graph.
   *
   * <p>Blocks until there are no active builds in progress. After {@code close()} returns, the
   * graph and the operations it contains can no longer be used.
   */
  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
    }
  }

  /**
   * Returns the operation (node in the Graph) with the provided name.
   *
   * <p>Or {@code null} if no such operation exists in the Graph.
   */
  public @Nullable GraphOperation operation(String name) {
    synchronized (lock) {
      checkOpen();
      Integer id = names.get(name);
      return id == null ? null : new GraphOperation(this, id);
    }
  }

  /**
   * Iterator over all the {@link Operation}s in the graph, in the order they were added.
   *
   * <p>The iterator works on a snapshot: operations added after this call are not returned.
   */
  public Iterator<Operation> operations() {
    List<Operation> ops = new ArrayList<>();
    synchronized (lock) {
      checkOpen();
      for (int i = 0; i < nodes.size(); ++i) {
        ops.add(new GraphOperation(this, i));
      }
    }
    return Collections.unmodifiableList(ops).iterator();
  }

  /** Returns the number of operations currently in the graph. */
  public int numOperations() {
    synchronized (lock) {
      checkOpen();
      return nodes.size();
    }
  }

  /**
   * Returns a builder to add {@link Operation}s to the Graph, with no scope defaults applied.
   *
   * @param type of the Operation (i.e., identifies the computation to be performed)
   * @param name to refer to the created Operation in the graph.
   * @return an {@link OperationBuilder}, which will add the Operation to the graph when {@link
   *     OperationBuilder#build()} is invoked.
   * @throws IllegalNameException if {@code name} is not a valid operation name
   */
  public GraphOperationBuilder opBuilder(String type, String name) {
    return opBuilder(type, name, OperationContext.DEFAULT);
  }

  /**
   * Returns a builder to add {@link Operation}s to the Graph, seeded with the device function,
   * control dependencies, colocation constraints, attributes and container of {@code context}.
   *
   * @throws IllegalNameException if {@code name} is not a valid operation name
   */
  public GraphOperationBuilder opBuilder(String type, String name, OperationContext context) {
    checkOpen();
    return new GraphOperationBuilder(this, type, name, context);
  }

  /**
   * Returns a name based on {@code name} that no operation of this graph uses yet.
   *
   * <p>If no operation is named {@code name}, it is returned unchanged. Otherwise {@code
   * name_<i>} is returned, where {@code i} is the smallest positive integer for which no operation
   * exists. The name is not reserved: callers that register an operation under it must hold the
   * graph's lock, as {@link GraphOperationBuilder#build()} does.
   */
  public String uniqueName(String name) {
    synchronized (lock) {
      checkOpen();
      if (!names.containsKey(name)) {
        return name;
      }
      for (int i = 1; ; ++i) {
        String candidate = name + "_" + i;
        if (!names.containsKey(candidate)) {
          return candidate;
        }
      }
    }
  }

  /**
   * Marks {@code output} as not feedable, because some construction decision depends on its value
   * being the one computed by the graph.
   */
  public void preventFeeding(Output output) {
    checkSameGraph(output);
    synchronized (lock) {
      unfeedable.add(output);
    }
  }

  /** Returns false if {@link #preventFeeding(Output)} has been called for {@code output}. */
  public boolean isFeedable(Output output) {
    checkSameGraph(output);
    synchronized (lock) {
      return !unfeedable.contains(output);
    }
  }

  @Override
  public String toString() {
    synchronized (lock) {
      return String.format("<Graph with %d operations%s>", nodes.size(), closed ? ", closed" : "");
    }
  }

  Object lock() {
    return lock;
  }

  Node node(int id) {
    synchronized (lock) {
      checkOpen();
      return nodes.get(id);
    }
  }

  int[] controlOutputIds(int id) {
    synchronized (lock) {
      checkOpen();
      List<Integer> outputs = nodes.get(id).controlOutputs;
      int[] result = new int[outputs.size()];
      for (int i = 0; i < result.length; ++i) {
        result[i] = outputs.get(i);
      }
      return result;
    }
  }

  List<int[]> consumerIds(int id, int outputIdx) {
    synchronized (lock) {
      checkOpen();
      return new ArrayList<>(nodes.get(id).consumers.get(outputIdx));
    }
  }

  /**
   * Appends a node record. The caller holds {@link #lock()} and has resolved a unique {@code
   * name} within the same critical section.
   */
  GraphOperation add(
      String name,
      String type,
      String device,
      Output[] inputs,
      int[] controlInputs,
      Map<String, Object> attrs,
      List<OutputSpec> outputs) {
    synchronized (lock) {
      checkOpen();
      if (names.containsKey(name)) {
        throw new IllegalStateException("Operation name '" + name + "' is already in use");
      }
      int id = nodes.size();
      Node node = new Node(name, type, device, inputs, controlInputs, attrs, outputs);
      nodes.add(node);
      names.put(name, id);
      for (int i = 0; i < inputs.length; ++i) {
        GraphOperation producer = inputs[i].graphOperation();
        nodes.get(producer.id()).consumers.get(inputs[i].index()).add(new int[] {id, i});
      }
      for (int control : controlInputs) {
        nodes.get(control).controlOutputs.add(id);
      }
      logger.fine(String.format("Added operation '%s' of type %s", name, type));
      return new GraphOperation(this, id);
    }
  }

  void checkOpen() {
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("close() has been called on the Graph");
      }
    }
  }

  private void checkSameGraph(Output output) {
    if (output.graph() != this) {
      throw new GraphMismatchException(
          String.format("'%s' is not defined in this graph", output.name()));
    }
  }

  /** The record of one node; everything but its consumers and control outputs is fixed. */
  static final class Node {
    final String name;
    final String type;
    final String device;
    final Output[] inputs;
    final int[] controlInputs;
    final Map<String, Object> attrs;
    final OutputSpec[] outputs;

    // Guarded by the graph's lock.
    final List<Integer> controlOutputs = new ArrayList<>();
    final List<List<int[]>> consumers = new ArrayList<>();

    Node(
        String name,
        String type,
        String device,
        Output[] inputs,
        int[] controlInputs,
        Map<String, Object> attrs,
        List<OutputSpec> outputs) {
      this.name = name;
      this.type = type;
      this.device = device;
      this.inputs = inputs;
      this.controlInputs = controlInputs;
      this.attrs = Collections.unmodifiableMap(new HashMap<>(attrs));
      this.outputs = outputs.toArray(new OutputSpec[0]);
      for (int i = 0; i < this.outputs.length; ++i) {
        consumers.add(new ArrayList<int[]>());
      }
    }
  }

  private static final Logger logger = Logger.getLogger(Graph.class.getName());

  private final Object lock = new Object();
  private final List<Node> nodes = new ArrayList<>();
  private final Map<String, Integer> names = new HashMap<>();
  private final Set<Output> unfeedable = new HashSet<>();
  private boolean closed = false;
}
