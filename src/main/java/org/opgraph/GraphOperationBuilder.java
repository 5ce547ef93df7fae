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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.op.NameScopes;

/**
 * An {@link OperationBuilder} for adding {@link GraphOperation}s to a {@link Graph}.
 *
 * <p>The builder collects inputs, attributes and a device. {@link #build()} then combines them with
 * the defaults of the {@link OperationContext} the builder was created with, and registers the
 * operation under a name no other operation of the graph uses.
 */
public final class GraphOperationBuilder implements OperationBuilder {

  GraphOperationBuilder(Graph graph, String type, String name, OperationContext context) {
    NameScopes.checkOpName(name);
    this.graph = graph;
    this.type = type;
    this.name = name;
    this.context = context;
  }

  /**
   * Add the {@link GraphOperation} being built to the {@link Graph}.
   *
   * <p>The operation waits for the control dependencies of the context, minus those it already
   * depends on through its inputs, and for the control inputs added to this builder.
   *
   * <p>The device function and the shape function run before the graph is locked. Only the choice
   * of a unique name, the pruning of control dependencies and the insertion hold the lock, so
   * these functions may build operations in the same graph from other threads.
   *
   * @throws OpBuilderUsedException if this builder was already used
   * @throws GraphMismatchException if the context refers to operations of another graph
   * @throws IllegalArgumentException if the operation type is unknown or the inputs or attributes
   *     do not suit it
   */
  @Override
  public GraphOperation build() {
    checkNotBuilt();
    graph.checkOpen();
    OpDef def = OpRegistry.global().lookup(type);
    Set<Operation> contextDeps = new LinkedHashSet<>(context.controlDependencies());
    Set<Operation> colocation = context.colocationOps();
    checkGraph(contextDeps, "control dependency");
    checkGraph(colocation, "colocation constraint");

    String device = resolveDevice();
    Map<String, Object> attrs = new LinkedHashMap<>();
    if (!colocation.isEmpty()) {
      device = applyColocation(colocation, device, attrs);
    }
    attrs.putAll(context.attributes());
    attrs.putAll(this.attrs);
    if (def.acceptsContainer() && !context.container().isEmpty()) {
      attrs.putIfAbsent("container", context.container());
    }
    List<OutputSpec> outputs =
        def.shapeFunction().infer(new InferenceContext(name, type, inputs, attrs));

    synchronized (graph.lock()) {
      checkNotBuilt();
      String uniqueName = graph.uniqueName(name);
      pruneControlDependencies(contextDeps);
      Set<Operation> controls = new LinkedHashSet<>(contextDeps);
      controls.addAll(controlInputs);
      int[] controlIds = new int[controls.size()];
      int i = 0;
      for (Operation control : controls) {
        controlIds[i++] = ((GraphOperation) control).id();
      }
      GraphOperation op =
          graph.add(
              uniqueName,
              type,
              device,
              inputs.toArray(new Output[0]),
              controlIds,
              attrs,
              outputs);
      built = true;
      return op;
    }
  }

  @Override
  public GraphOperationBuilder addInput(Output input) {
    checkNotBuilt();
    checkGraph(input.op(), "input");
    inputs.add(input);
    return this;
  }

  @Override
  public GraphOperationBuilder addInputs(List<Output> inputs) {
    for (Output input : inputs) {
      addInput(input);
    }
    return this;
  }

  @Override
  public GraphOperationBuilder addInputList(Output[] inputs) {
    checkNotBuilt();
    for (Output input : inputs) {
      checkGraph(input.op(), "input");
    }
    for (Output input : inputs) {
      this.inputs.add(input);
    }
    return this;
  }

  @Override
  public GraphOperationBuilder addControlInput(Operation control) {
    checkNotBuilt();
    checkGraph(control, "control input");
    controlInputs.add(control);
    return this;
  }

  @Override
  public GraphOperationBuilder setDevice(String device) {
    checkNotBuilt();
    this.device = device;
    return this;
  }

  @Override
  public GraphOperationBuilder setAttr(String name, String value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, String[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, long value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, long[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, float value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, float[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, boolean value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, boolean[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, DataType value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, DataType[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, Tensor value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, Tensor[] value) {
    return attr(name, value.clone());
  }

  @Override
  public GraphOperationBuilder setAttr(String name, Shape value) {
    return attr(name, value);
  }

  @Override
  public GraphOperationBuilder setAttr(String name, Shape[] value) {
    return attr(name, value.clone());
  }

  private GraphOperationBuilder attr(String name, Object value) {
    checkNotBuilt();
    attrs.put(name, value);
    return this;
  }

  private String resolveDevice() {
    @Nullable String resolved = device;
    if (resolved == null) {
      resolved = context.deviceFor(new OpSpecification(name, type));
    }
    if (resolved == null || resolved.isEmpty()) {
      return "";
    }
    return DeviceSpec.parse(resolved).toString();
  }

  /**
   * Records the colocation group in the {@code _class} attribute and returns the device of the
   * group, which replaces {@code device}.
   */
  private String applyColocation(
      Set<Operation> colocation, String device, Map<String, Object> attrs) {
    Set<String> group = new TreeSet<>();
    for (Operation op : colocation) {
      group.add(GraphOperation.COLOCATION_PREFIX + op.name());
      for (Operation member : op.colocationOps()) {
        group.add(GraphOperation.COLOCATION_PREFIX + member.name());
      }
    }
    attrs.put(GraphOperation.COLOCATION_ATTR, group.toArray(new String[0]));
    String firstName = group.iterator().next();
    Operation first =
        graph.operation(firstName.substring(GraphOperation.COLOCATION_PREFIX.length()));
    String colocatedDevice = first == null ? "" : first.device();
    if (!device.isEmpty() && !device.equals(colocatedDevice)) {
      logger.warning(
          String.format(
              "Operation '%s' is colocated with '%s': ignoring its device '%s' for '%s'",
              name, firstName, device, colocatedDevice));
    }
    return colocatedDevice;
  }

  /**
   * Removes from {@code deps} every operation the new operation already waits for through its
   * inputs, directly or transitively through their inputs and control inputs.
   */
  private void pruneControlDependencies(Set<Operation> deps) {
    if (deps.isEmpty()) {
      return;
    }
    Set<Operation> visited = new HashSet<>();
    Deque<Operation> pending = new ArrayDeque<>();
    for (Output input : inputs) {
      pending.push(input.op());
    }
    while (!pending.isEmpty() && !deps.isEmpty()) {
      Operation op = pending.pop();
      if (!visited.add(op)) {
        continue;
      }
      deps.remove(op);
      for (Output input : op.inputs()) {
        pending.push(input.op());
      }
      for (Operation control : op.controlInputs()) {
        pending.push(control);
      }
    }
  }

  private void checkGraph(Set<Operation> ops, String role) {
    for (Operation op : ops) {
      checkGraph(op, role);
    }
  }

  private void checkGraph(Operation op, String role) {
    if (op.graph() != graph || !(op instanceof GraphOperation)) {
      throw new GraphMismatchException(
          String.format(
              "%s '%s' of operation '%s' is not defined in the graph of the operation",
              role, op.name(), name));
    }
  }

  private void checkNotBuilt() {
    if (built) {
      throw new OpBuilderUsedException(
          "Operation '" + name + "' has already been built with this builder");
    }
  }

  private static final Logger logger = Logger.getLogger(GraphOperationBuilder.class.getName());

  private final Graph graph;
  private final String type;
  private final String name;
  private final OperationContext context;
  private final List<Output> inputs = new ArrayList<>();
  private final Set<Operation> controlInputs = new LinkedHashSet<>();
  private final Map<String, Object> attrs = new LinkedHashMap<>();
  private @Nullable String device = null;
  private boolean built = false;
}
