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

/** The statically inferred data type and (possibly partial) shape of one operation output. */
public final class OutputSpec {

  public static OutputSpec of(DataType dataType, Shape shape) {
    return new OutputSpec(dataType, shape);
  }

  public DataType dataType() {
    return dataType;
  }

  public Shape shape() {
    return shape;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof OutputSpec)) {
      return false;
    }
    OutputSpec that = (OutputSpec) o;
    return dataType == that.dataType && Objects.equals(shape, that.shape);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataType, shape);
  }

  @Override
  public String toString() {
    return String.format("<%s %s>", dataType, shape);
  }

  private OutputSpec(DataType dataType, Shape shape) {
    this.dataType = Objects.requireNonNull(dataType, "dataType");
    this.shape = Objects.requireNonNull(shape, "shape");
  }

  private final DataType dataType;
  private final Shape shape;
}
