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

package org.opgraph.op.core;

import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Does nothing. Only useful as a placeholder for control edges, for instance to group the control
 * dependencies of a scope into a single operation.
 */
public final class NoOp extends PrimitiveOp {

  public static NoOp create(Scope scope) {
    return new NoOp(OperationHelper.create(scope, "NoOp"));
  }

  private NoOp(OperationHelper helper) {
    super(helper.operation());
  }
}
