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
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * The set of operation types that can be added to a {@link Graph}.
 *
 * <p>The registry returned by {@link #global()} is preloaded with the core and linear algebra
 * operations and is shared by all graphs. It is thread-safe.
 */
public final class OpRegistry {

  /** Returns the registry used by every {@link Graph}. */
  public static OpRegistry global() {
    return GLOBAL;
  }

  /**
   * Adds an operation type.
   *
   * @throws IllegalArgumentException if a type of the same name is already registered
   */
  public void register(OpDef def) {
    OpDef previous = defs.putIfAbsent(def.type(), def);
    if (previous != null) {
      throw new IllegalArgumentException(
          "Operation type '" + def.type() + "' is already registered");
    }
    logger.fine("Registered operation type " + def.type());
  }

  /** Returns true if operations of {@code type} can be built. */
  public boolean isRegistered(String type) {
    return defs.containsKey(type);
  }

  /**
   * Returns the definition of {@code type}.
   *
   * @throws IllegalArgumentException if {@code type} is not registered
   */
  public OpDef lookup(String type) {
    OpDef def = defs.get(type);
    if (def == null) {
      throw new IllegalArgumentException("Op type not registered '" + type + "'");
    }
    return def;
  }

  /** Returns the registered type names, sorted. */
  public List<String> types() {
    List<String> types = new ArrayList<>(defs.keySet());
    Collections.sort(types);
    return types;
  }

  OpRegistry() {}

  private static final Logger logger = Logger.getLogger(OpRegistry.class.getName());

  private static final OpRegistry GLOBAL = new OpRegistry();

  static {
    BuiltinOps.registerAll(GLOBAL);
  }

  private final ConcurrentMap<String, OpDef> defs = new ConcurrentHashMap<>();
}
