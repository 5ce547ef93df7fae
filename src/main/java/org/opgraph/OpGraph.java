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

/** Static utility methods describing the library. */
public final class OpGraph {

  /** Returns the version of the library. */
  public static String version() {
    return VERSION;
  }

  /** Returns the names of all operation types that graphs accept. */
  public static List<String> registeredOps() {
    return OpRegistry.global().types();
  }

  private OpGraph() {}

  private static final String VERSION = "0.1.0";
}
