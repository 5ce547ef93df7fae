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
 * Computes the singular value decompositions of one or more matrices.
 *
 * <p>Computes the SVD of each inner matrix in {@code input} such that {@code input[..., :, :] =
 * u[..., :, :] * diag(s[..., :, :]) * transpose(v[..., :, :])}.
 */
public final class Svd extends PrimitiveOp {

  /** Optional attributes for {@link Svd} */
  public static class Options {

    /**
     * @param computeUv If true, left and right singular vectors will be computed and returned in
     *     {@code u} and {@code v}, respectively. If false, {@code u} and {@code v} are not set and
     *     should never be referenced.
     */
    public Options computeUv(Boolean computeUv) {
      this.computeUv = computeUv;
      return this;
    }

    /**
     * @param fullMatrices If true, compute full-sized {@code u} and {@code v}. If false (the
     *     default), compute only the leading {@code P} singular vectors. Ignored if {@code
     *     computeUv} is false.
     */
    public Options fullMatrices(Boolean fullMatrices) {
      this.fullMatrices = fullMatrices;
      return this;
    }

    private Boolean computeUv;
    private Boolean fullMatrices;

    private Options() {}
  }

  /**
   * Factory method to create a class wrapping a new Svd operation.
   *
   * @param scope current scope
   * @param input A tensor of shape {@code [..., M, N]} whose inner-most 2 dimensions form matrices
   *     of size {@code [M, N]}. Let {@code P} be the minimum of {@code M} and {@code N}.
   * @param options carries optional attributes values
   * @return a new instance of Svd
   */
  public static Svd create(Scope scope, Operand input, Options... options) {
    OperationHelper helper = OperationHelper.create(scope, "Svd");
    boolean computeUv = true;
    boolean fullMatrices = false;
    for (Options opts : options) {
      if (opts.computeUv != null) {
        computeUv = opts.computeUv;
      }
      if (opts.fullMatrices != null) {
        fullMatrices = opts.fullMatrices;
      }
    }
    helper
        .builder()
        .addInput(input.asOutput())
        .setAttr("T", input.asOutput().dataType())
        .setAttr("compute_uv", computeUv)
        .setAttr("full_matrices", fullMatrices);
    return new Svd(helper);
  }

  public static Options computeUv(Boolean computeUv) {
    return new Options().computeUv(computeUv);
  }

  public static Options fullMatrices(Boolean fullMatrices) {
    return new Options().fullMatrices(fullMatrices);
  }

  /** Singular values. Shape is {@code [..., P]}. */
  public Output s() {
    return s;
  }

  /**
   * Left singular vectors. If {@code fullMatrices} is false then shape is {@code [..., M, P]}; if
   * true then shape is {@code [..., M, M]}. Undefined if {@code computeUv} is false.
   */
  public Output u() {
    return u;
  }

  /**
   * Right singular vectors. If {@code fullMatrices} is false then shape is {@code [..., N, P]}. If
   * true then shape is {@code [..., N, N]}. Undefined if {@code computeUv} is false.
   */
  public Output v() {
    return v;
  }

  private Svd(OperationHelper helper) {
    super(helper.operation());
    s = helper.nextOutput();
    u = helper.nextOutput();
    v = helper.nextOutput();
  }

  private final Output s;
  private final Output u;
  private final Output v;
}
