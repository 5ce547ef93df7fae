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
 * Computes the QR decompositions of one or more matrices.
 *
 * <p>Computes the QR decomposition of each inner matrix in {@code input} such that {@code
 * input[..., :, :] = q[..., :, :] * r[..., :, :]}.
 */
public final class Qr extends PrimitiveOp {

  /** Optional attributes for {@link Qr} */
  public static class Options {

    /**
     * @param fullMatrices If true, compute full-sized {@code q} and {@code r}. If false (the
     *     default), compute only the leading {@code P} columns of {@code q}.
     */
    public Options fullMatrices(Boolean fullMatrices) {
      this.fullMatrices = fullMatrices;
      return this;
    }

    private Boolean fullMatrices;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new Qr operation.
   *
   * @param scope current scope
   * @param input A tensor of shape {@code [..., M, N]} whose inner-most 2 dimensions form matrices
   *     of size {@code [M, N]}. Let {@code P} be the minimum of {@code M} and {@code N}.
   * @param options carries optional attributes values
   * @return a new instance of Qr
   */
  public static Qr create(Scope scope, Operand input, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "Qr");
    boolean fullMatrices = false;
    for (Options opts : options) {
      if (opts.fullMatrices != null) {
        fullMatrices = opts.fullMatrices;
      }
    }
    helper
        .builder()
        .addInput(input.asOutput())
        .setAttr("T", input.asOutput().dataType())
        .setAttr("full_matrices", fullMatrices);
    return new Qr(helper);
  }

  public static Options fullMatrices(Boolean fullMatrices) {
    return new Options().fullMatrices(fullMatrices);
  }

  /**
   * Orthonormal basis for range of {@code input}. If {@code fullMatrices} is false then shape is
   * {@code [..., M, P]}; if true then shape is {@code [..., M, M]}.
   */
  public Output q() {
    return q;
  }

  /**
   * Triangular factor. If {@code fullMatrices} is false then shape is {@code [..., P, N]}. If true
   * then shape is {@code [..., M, N]}.
   */
  public Output r() {
    return r;
  }

  private Qr(OperationHelper helper) {
    super(helper.operation());
    q = helper.nextOutput();
    r = helper.nextOutput();
  }

  private final Output q;
  private final Output r;
}
