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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.DeviceFunction;
import org.opgraph.DeviceSpec;
import org.opgraph.Graph;
import org.opgraph.GraphMismatchException;
import org.opgraph.GraphOperationBuilder;
import org.opgraph.OpSpecification;
import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.OperationContext;
import org.opgraph.Output;

/**
 * Manages groups of related properties when creating operations, such as a common name prefix.
 *
 * <p>A {@code Scope} is a container for common properties applied to operations. Normal user code
 * initializes a {@code Scope} and provides it to operation building classes. For example:
 *
 * <pre>{@code
 * Scope scope = new Scope(graph);
 * Constant c = Constant.create(scope, 42);
 * }</pre>
 *
 * <p>An operation building class acquires a Scope, and uses it to create a builder seeded with the
 * properties of the scope. For example:
 *
 * <pre>{@code
 * // An operator class that adds a constant.
 * public class Constant {
 *   public static Constant create(Scope scope, ...) {
 *      scope.opBuilder("Const", "Const")
 *        .setAttr(...)
 *        .build()
 *      ...
 *   }
 * }
 * }</pre>
 *
 * <p><b>Scope hierarchy:</b>
 *
 * <p>A {@code Scope} provides various {@code with()} methods that create a new scope. The new scope
 * typically has one property changed while other properties are inherited from the parent scope.
 * {@link #with(ScopeOverrides)} changes several properties at once.
 *
 * <p>An example using {@code Constant} implemented as before:
 *
 * <pre>{@code
 * Scope root = new Scope(graph);
 *
 * // The linear subscope will generate names like linear/...
 * Scope linear = root.withSubScope("linear");
 *
 * // This op name will be "linear/W"
 * Constant.create(linear.withName("W"), ...);
 *
 * // This op will be "linear/Const", using the default
 * // name provided by Constant
 * Constant.create(linear, ...);
 *
 * // This op will be "linear/Const_1", using the default
 * // name provided by Constant and made unique within
 * // the graph
 * Constant.create(linear, ...);
 * }</pre>
 *
 * <p>Scope objects are immutable and thread-safe. Names are made unique by the graph when
 * operations are built, so scopes shared between threads never produce clashing names.
 */
public final class Scope implements OperationContext {

  /**
   * Create a new top-level scope.
   *
   * @param graph The graph operations are added to.
   */
  public Scope(Graph graph) {
    this(
        graph,
        "",
        DeviceFunction.UNCONSTRAINED,
        Collections.<Operation>emptySet(),
        Collections.<Operation>emptySet(),
        Collections.<String, String>emptyMap(),
        "",
        null);
  }

  /** Returns the graph used by this scope. */
  public Graph graph() {
    return graph;
  }

  /** Returns the name scope of this scope, empty at the root. */
  public String nameScope() {
    return nameScope;
  }

  /** Returns the function placing the operations of this scope. */
  public DeviceFunction deviceFunction() {
    return deviceFunction;
  }

  /**
   * Returns a new scope with the properties of this scope changed by {@code overrides}.
   *
   * <p>Each property combines independently with the one of this scope:
   *
   * <ul>
   *   <li><b>graph</b>: replaced if set.
   *   <li><b>name scope</b>: the empty string returns to the root. Any other value is checked by
   *       {@link NameScopes#checkNameScope(String, String)}, loses one trailing slash and is
   *       appended to the current name scope. If an operation already uses the resulting name,
   *       a numeric suffix makes it unique, as for operation names.
   *   <li><b>device</b>: both device functions are applied to each new operation. If either
   *       returns null, the operation gets no device, and this holds for every scope nested in the
   *       result. Otherwise the fields of the two device specifications are merged, the nested one
   *       winning.
   *   <li><b>colocation</b>: the new operations are added to the colocation set. Colocation takes
   *       precedence over device placement.
   *   <li><b>control dependencies</b>: an empty set clears them, any other set is added.
   *   <li><b>attributes</b>: an empty map clears them. Otherwise each override sets or removes
   *       one attribute.
   *   <li><b>container</b>: replaced if set.
   * </ul>
   *
   * @throws org.opgraph.IllegalNameException if the name scope is invalid
   * @throws GraphMismatchException if a colocation operation, control dependency or value is not
   *     defined in the graph of the new scope
   */
  public Scope with(ScopeOverrides overrides) {
    Graph newGraph = overrides.graph() != null ? overrides.graph() : graph;
    Set<Operation> newColocation = colocationOps;
    if (overrides.colocationOps() != null && !overrides.colocationOps().isEmpty()) {
      newColocation = union(colocationOps, overrides.colocationOps());
    }
    Set<Operation> newControlDependencies = controlDependencies;
    if (overrides.controlDependencies() != null) {
      newControlDependencies =
          overrides.controlDependencies().isEmpty()
              ? Collections.<Operation>emptySet()
              : union(controlDependencies, overrides.controlDependencies());
    }
    checkGraph(newGraph, newColocation, "colocation operation");
    checkGraph(newGraph, newControlDependencies, "control dependency");
    for (Output value : overrides.values()) {
      if (value.graph() != newGraph) {
        throw new GraphMismatchException(
            String.format("'%s' is not defined in the graph of the scope", value.name()));
      }
    }
    String newNameScope = mergeNameScope(overrides.nameScope(), newGraph);
    DeviceFunction newDevice = deviceFunction;
    if (overrides.deviceFunction() != null) {
      newDevice = compose(deviceFunction, overrides.deviceFunction());
    }
    return new Scope(
        newGraph,
        newNameScope,
        newDevice,
        newColocation,
        newControlDependencies,
        mergeAttributes(overrides.attributes()),
        overrides.container() != null ? overrides.container() : container,
        overrides.nameScope() != null ? null : opName);
  }

  /**
   * Returns a new scope where added operations will have the provided name prefix.
   *
   * <p>Ops created with this scope will have {@code name/childScopeName/} as the prefix. The actual
   * prefix is unique in the graph. All other properties are inherited from the current scope.
   *
   * <p>The child scope name must match the regular expression {@code [A-Za-z0-9.][A-Za-z0-9_.\-]*}.
   * If this scope was returned by {@link #withName(String)}, that name is used instead.
   *
   * @param childScopeName name for the new child scope
   * @return a new subscope
   * @throws org.opgraph.IllegalNameException if the name is invalid
   */
  public Scope withSubScope(String childScopeName) {
    NameScopes.checkComponentName(childScopeName);
    String actualName = opName != null ? opName : childScopeName;
    return with(ScopeOverrides.create().nameScope(actualName));
  }

  /**
   * Return a new scope that uses the provided name for an op.
   *
   * <p>Operations created within this scope will have a name of the form {@code
   * name/opName[_suffix]}. This lets you name a specific operator more meaningfully.
   *
   * <p>Names must match the regular expression {@code [A-Za-z0-9.][A-Za-z0-9_.\-]*}
   *
   * @param opName name for an operator in the returned scope
   * @return a new Scope that uses opName for operations.
   * @throws org.opgraph.IllegalNameException if the name is invalid
   */
  public Scope withName(String opName) {
    NameScopes.checkComponentName(opName);
    return new Scope(
        graph,
        nameScope,
        deviceFunction,
        colocationOps,
        controlDependencies,
        attributes,
        container,
        opName);
  }

  /** Returns a new scope placing operations on {@code device}, or nowhere if it is null. */
  public Scope withDevice(@Nullable String device) {
    return with(ScopeOverrides.create().device(device));
  }

  /** Returns a new scope whose placement also follows {@code function}. */
  public Scope withDeviceFunction(DeviceFunction function) {
    return with(ScopeOverrides.create().deviceFunction(function));
  }

  /** Returns a new scope colocating operations with {@code ops}. */
  public Scope withColocation(Collection<? extends Operation> ops) {
    return with(ScopeOverrides.create().colocateWith(ops));
  }

  /**
   * Returns a new scope where added operations will have the provided control dependencies.
   *
   * <p>Ops created with this scope will have a control edge from each of the provided controls,
   * unless they already depend on it through their inputs. The controls are added to those of
   * this scope; an empty collection clears them.
   *
   * @param controls control dependencies for ops created with the returned scope
   * @return a new scope with the provided control dependencies
   */
  public Scope withControlDependencies(Collection<? extends Operation> controls) {
    return with(ScopeOverrides.create().controlDependencies(controls));
  }

  /** Returns a new scope with its attributes changed by {@code attributes}. */
  public Scope withAttributes(Map<String, AttributeOverride> attributes) {
    return with(ScopeOverrides.create().attributes(attributes));
  }

  /** Returns a new scope keeping the state of stateful operations in {@code container}. */
  public Scope withContainer(String container) {
    return with(ScopeOverrides.create().container(container));
  }

  /** Returns a new scope adding operations to {@code graph}. */
  public Scope withGraph(Graph graph) {
    return with(ScopeOverrides.create().graph(graph));
  }

  /**
   * Returns a new scope for operations computed from {@code values}, in the graph of the values and
   * the name scope {@code nameScope}.
   *
   * @throws GraphMismatchException if the values belong to different graphs
   * @throws org.opgraph.IllegalNameException if the name scope is invalid
   */
  public Scope withValues(String nameScope, Operand... values) {
    Graph valuesGraph = null;
    for (Operand value : values) {
      Output output = value.asOutput();
      if (valuesGraph == null) {
        valuesGraph = output.graph();
      } else if (output.graph() != valuesGraph) {
        throw new GraphMismatchException(
            String.format(
                "'%s' is not defined in the same graph as the other values", output.name()));
      }
    }
    ScopeOverrides overrides = ScopeOverrides.create().nameScope(nameScope).values(values);
    if (valuesGraph != null) {
      overrides.graph(valuesGraph);
    }
    return with(overrides);
  }

  /**
   * Create a name for an operator, using a provided default if necessary.
   *
   * <p>This is normally called only by operator building classes.
   *
   * <p>This method prefixes the name with the name scope of this instance. The name is made unique
   * when the operator is built. Typical operator building code might look like
   *
   * <pre>{@code
   * scope.graph().opBuilder("Const", scope.makeOpName("Const"), scope)...
   * }</pre>
   *
   * <p><b>Note:</b> if you provide a composite operator building class (i.e, a class that creates a
   * set of related operations by calling other operator building code), the provided name will act
   * as a subscope to all underlying operators.
   *
   * @param defaultName name for the underlying operator.
   * @return name for the operator.
   * @throws org.opgraph.IllegalNameException if the default name is invalid.
   */
  public String makeOpName(String defaultName) {
    String actualName = opName != null ? opName : defaultName;
    NameScopes.checkComponentName(actualName);
    return nameScope.isEmpty() ? actualName : nameScope + "/" + actualName;
  }

  /**
   * Returns a builder for an operation of {@code type}, named after {@code defaultName} and seeded
   * with the properties of this scope.
   */
  public GraphOperationBuilder opBuilder(String type, String defaultName) {
    return graph.opBuilder(type, makeOpName(defaultName), this);
  }

  @Override
  public @Nullable String deviceFor(OpSpecification spec) {
    return deviceFunction.device(spec);
  }

  @Override
  public Set<Operation> controlDependencies() {
    return controlDependencies;
  }

  @Override
  public Set<Operation> colocationOps() {
    return colocationOps;
  }

  @Override
  public Map<String, String> attributes() {
    return attributes;
  }

  @Override
  public String container() {
    return container;
  }

  @Override
  public String toString() {
    return String.format(
        "Scope(nameScope='%s', controlDependencies=%d, colocationOps=%d, container='%s')",
        nameScope, controlDependencies.size(), colocationOps.size(), container);
  }

  private Scope(
      Graph graph,
      String nameScope,
      DeviceFunction deviceFunction,
      Set<Operation> colocationOps,
      Set<Operation> controlDependencies,
      Map<String, String> attributes,
      String container,
      @Nullable String opName) {
    this.graph = graph;
    this.nameScope = nameScope;
    this.deviceFunction = deviceFunction;
    this.colocationOps = colocationOps;
    this.controlDependencies = controlDependencies;
    this.attributes = attributes;
    this.container = container;
    this.opName = opName;
  }

  private String mergeNameScope(@Nullable String override, Graph newGraph) {
    if (override == null) {
      return nameScope;
    }
    NameScopes.checkNameScope(override, nameScope);
    if (override.isEmpty()) {
      return "";
    }
    String name = override.endsWith("/") ? override.substring(0, override.length() - 1) : override;
    return newGraph.uniqueName(nameScope.isEmpty() ? name : nameScope + "/" + name);
  }

  private Map<String, String> mergeAttributes(@Nullable Map<String, AttributeOverride> overrides) {
    if (overrides == null) {
      return attributes;
    }
    if (overrides.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, String> merged = new LinkedHashMap<>(attributes);
    for (Map.Entry<String, AttributeOverride> entry : overrides.entrySet()) {
      if (entry.getValue().isRemove()) {
        merged.remove(entry.getKey());
      } else {
        merged.put(entry.getKey(), entry.getValue().value());
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  private static DeviceFunction compose(DeviceFunction outer, DeviceFunction inner) {
    return spec -> {
      String outerDevice = outer.device(spec);
      if (outerDevice == null) {
        return null;
      }
      String innerDevice = inner.device(spec);
      if (innerDevice == null) {
        return null;
      }
      if (innerDevice.isEmpty()) {
        return outerDevice;
      }
      return DeviceSpec.merge(DeviceSpec.parse(outerDevice), DeviceSpec.parse(innerDevice))
          .toString();
    };
  }

  private static Set<Operation> union(Set<Operation> a, Set<Operation> b) {
    Set<Operation> result = new LinkedHashSet<>(a);
    result.addAll(b);
    return Collections.unmodifiableSet(result);
  }

  private static void checkGraph(Graph graph, Set<Operation> ops, String role) {
    for (Operation op : ops) {
      if (op.graph() != graph) {
        throw new GraphMismatchException(
            String.format("%s '%s' is not defined in the graph of the scope", role, op.name()));
      }
    }
  }

  private final Graph graph;
  private final String nameScope;
  private final DeviceFunction deviceFunction;
  private final Set<Operation> colocationOps;
  private final Set<Operation> controlDependencies;
  private final Map<String, String> attributes;
  private final String container;

  // If non-null, used instead of the default names given to makeOpName and withSubScope.
  private final @Nullable String opName;
}
