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

/**
 * Thrown when operations or outputs from different {@link Graph}s are combined, or when they do not
 * belong to an explicitly requested graph.
 */
public final class GraphMismatchException extends IllegalArgumentException {

  public GraphMismatchException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
