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

import java.util.Objects;

/** Registration of an operation type: its name and how to infer its outputs. */
public final class OpDef {

  /** Returns the definition of a type whose outputs are computed by {@code shapeFunction}. */
  public static OpDef create(String type, ShapeFunction shapeFunction) {
    return new OpDef(type, shapeFunction, false);
  }

  /**
   * Returns a copy of this definition accepting a {@code container} attribute. Operations of such
   * types receive the container of the scope they are built in.
   */
  public OpDef withContainer() {
    return new OpDef(type, shapeFunction, true);
  }

  public String type() {
    return type;
  }

  public ShapeFunction shapeFunction() {
    return shapeFunction;
  }

  public boolean acceptsContainer() {
    return acceptsContainer;
  }

  @Override
  public String toString() {
    return "OpDef<" + type + ">";
  }

  private OpDef(String type, ShapeFunction shapeFunction, boolean acceptsContainer) {
    this.type = Objects.requireNonNull(type);
    this.shapeFunction = Objects.requireNonNull(shapeFunction);
    this.acceptsContainer = acceptsContainer;
  }

  private final String type;
  private final ShapeFunction shapeFunction;
  private final boolean acceptsContainer;
}
