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

package org.opgraph.op.linalg;

import org.opgraph.Operand;
import org.opgraph.Output;
import org.opgraph.op.OperationHelper;
import org.opgraph.op.PrimitiveOp;
import org.opgraph.op.Scope;

/**
 * Computes the eigen decomposition of one or more square self-adjoint matrices.
 *
 * <p>Computes the eigenvalues and (optionally) eigenvectors of each inner matrix in {@code input}
 * such that {@code input[..., :, :] = v[..., :, :] * diag(e[..., :])}. The eigenvalues are sorted
 * in non-decreasing order.
 */
public final class SelfAdjointEig extends PrimitiveOp {

  /** Optional attributes for {@link SelfAdjointEig} */
  public static class Options {

    /**
     * @param computeV If true then eigenvectors will be computed and returned in {@code v}.
     *     Otherwise, only the eigenvalues will be computed.
     */
    public Options computeV(Boolean computeV) {
      this.computeV = computeV;
      return this;
    }

    private Boolean computeV;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new SelfAdjointEigV2 operation.
   *
   * @param scope current scope
   * @param input {@code Tensor} input of shape {@code [N, N]}.
   * @param options carries optional attributes values
   * @return a new instance of SelfAdjointEig
   */
  public static SelfAdjointEig create(Scope scope, Operand input, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "SelfAdjointEigV2");
    boolean computeV = true;
    for (Options opts : options) {
      if (opts.computeV != null) {
        computeV = opts.computeV;
      }
    }
    helper
        .builder()
        .addInput(input.asOutput())
        .setAttr("T", input.asOutput().dataType())
        .setAttr("compute_v", computeV);
    return new SelfAdjointEig(helper);
  }

  public static Options computeV(Boolean computeV) {
    return new Options().computeV(computeV);
  }

  /** Eigenvalues. Shape is {@code [N]}. */
  public Output e() {
    return e;
  }

  /** Eigenvectors. Shape is {@code [N, N]}, or {@code [0]} when they are not computed. */
  public Output v() {
    return v;
  }

  private SelfAdjointEig(OperationHelper helper) {
    super(helper.operation());
    e = helper.nextOutput();
    v = helper.nextOutput();
  }

  private final Output e;
  private final Output v;
}
