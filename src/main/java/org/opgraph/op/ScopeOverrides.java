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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.opgraph.DeviceFunction;
import org.opgraph.Graph;
import org.opgraph.Operand;
import org.opgraph.Operation;
import org.opgraph.Output;

/**
 * The properties a nested {@link Scope} changes relative to its parent.
 *
 * <p>Every property is absent until set, and absent properties are inherited unchanged. See {@link
 * Scope#with(ScopeOverrides)} for how each property combines with the parent's.
 *
 * <pre>{@code
 * Scope gpu = scope.with(
 *     ScopeOverrides.create().nameScope("tower").device("/GPU:0").container("shared"));
 * }</pre>
 *
 * <p>Instances are mutable and not thread-safe; {@link Scope} copies what it needs.
 */
public final class ScopeOverrides {

  public static ScopeOverrides create() {
    return new ScopeOverrides();
  }

  /** Builds operations in {@code graph}. */
  public ScopeOverrides graph(Graph graph) {
    this.graph = graph;
    return this;
  }

  /**
   * Enters {@code nameScope}, relative to the parent's name scope. An empty string returns to the
   * root name scope.
   */
  public ScopeOverrides nameScope(String nameScope) {
    this.nameScope = nameScope;
    return this;
  }

  /**
   * Places operations on {@code device}, or resets placement if {@code device} is null.
   *
   * @see DeviceFunction#of(String)
   */
  public ScopeOverrides device(@Nullable String device) {
    this.deviceFunction = DeviceFunction.of(device);
    return this;
  }

  /** Places operations where {@code function} decides, combined with the parent's placement. */
  public ScopeOverrides deviceFunction(DeviceFunction function) {
    this.deviceFunction = function;
    return this;
  }

  /** Places operations on the same device as each of {@code ops}. */
  public ScopeOverrides colocateWith(Collection<? extends Operation> ops) {
    this.colocationOps = new LinkedHashSet<>(ops);
    return this;
  }

  /**
   * Makes operations wait for {@code ops}. An empty collection clears the dependencies inherited
   * from the parent.
   */
  public ScopeOverrides controlDependencies(Collection<? extends Operation> ops) {
    this.controlDependencies = new LinkedHashSet<>(ops);
    return this;
  }

  /**
   * Changes the attributes set on operations. An empty map clears all inherited attributes.
   */
  public ScopeOverrides attributes(Map<String, AttributeOverride> attributes) {
    this.attributes = new LinkedHashMap<>(attributes);
    return this;
  }

  /** Puts the state of stateful operations in {@code container}. */
  public ScopeOverrides container(String container) {
    this.container = container;
    return this;
  }

  /**
   * Declares outputs the scope will consume. They must all belong to the graph of the resulting
   * scope.
   */
  public ScopeOverrides values(Operand... values) {
    for (Operand value : values) {
      this.values.add(value.asOutput());
    }
    return this;
  }

  @Nullable
  Graph graph() {
    return graph;
  }

  @Nullable
  String nameScope() {
    return nameScope;
  }

  @Nullable
  DeviceFunction deviceFunction() {
    return deviceFunction;
  }

  @Nullable
  Set<Operation> colocationOps() {
    return colocationOps;
  }

  @Nullable
  Set<Operation> controlDependencies() {
    return controlDependencies;
  }

  @Nullable
  Map<String, AttributeOverride> attributes() {
    return attributes;
  }

  @Nullable
  String container() {
    return container;
  }

  List<Output> values() {
    return Collections.unmodifiableList(values);
  }

  private ScopeOverrides() {}

  private @Nullable Graph graph;
  private @Nullable String nameScope;
  private @Nullable DeviceFunction deviceFunction;
  private @Nullable Set<Operation> colocationOps;
  private @Nullable Set<Operation> controlDependencies;
  private @Nullable Map<String, AttributeOverride> attributes;
  private @Nullable String container;
  private final List<Output> values = new ArrayList<>();
}
