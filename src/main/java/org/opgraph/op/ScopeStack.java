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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;
import java.util.logging.Logger;
import org.opgraph.Graph;

/**
 * A stack of nested {@link Scope}s, for code that enters and leaves scopes as blocks rather than
 * passing scopes around.
 *
 * <p>Entering a block pushes the current scope combined with some overrides, and leaving it
 * restores the enclosing scope. The returned {@link Frame} pops itself when closed, so a
 * try-with-resources statement restores the enclosing scope however the block exits:
 *
 * <pre>{@code
 * ScopeStack scopes = new ScopeStack(graph);
 * try (ScopeStack.Frame layer = scopes.push(ScopeOverrides.create().nameScope("layer"))) {
 *   Constant.create(scopes.current(), 1.0f); // named "layer/Const"
 * }
 * Constant.create(scopes.current(), 1.0f); // named "Const"
 * }</pre>
 *
 * <p>A ScopeStack belongs to one call stack and is <b>not</b> thread-safe. Threads building
 * operations concurrently use a stack each, and see each other's scopes only if they share them
 * explicitly.
 */
public final class ScopeStack {

  /** Creates a stack whose bottom is a root scope of {@code graph}. */
  public ScopeStack(Graph graph) {
    this(new Scope(graph));
  }

  /** Creates a stack whose bottom is {@code root}. */
  public ScopeStack(Scope root) {
    frames.push(new Frame(root));
  }

  /** Returns the innermost scope. */
  public Scope current() {
    return frames.peek().scope;
  }

  /** Returns the number of frames pushed and not yet closed. */
  public int depth() {
    return frames.size() - 1;
  }

  /**
   * Pushes the current scope changed by {@code overrides}.
   *
   * @return the frame to close when leaving the scope
   * @throws org.opgraph.IllegalNameException if the name scope is invalid
   * @throws org.opgraph.GraphMismatchException if the overrides refer to another graph
   */
  public Frame push(ScopeOverrides overrides) {
    return push(current().with(overrides));
  }

  /** Pushes {@code scope}, which replaces the current scope until the frame is closed. */
  public Frame push(Scope scope) {
    Frame frame = new Frame(scope);
    frames.push(frame);
    logger.fine(String.format("Entered %s at depth %d", scope, depth()));
    return frame;
  }

  /**
   * Runs {@code block} with the current scope changed by {@code overrides}, and returns its result.
   * The enclosing scope is restored when {@code block} returns or throws.
   */
  public <T> T callWith(ScopeOverrides overrides, Function<Scope, T> block) {
    try (Frame frame = push(overrides)) {
      return block.apply(frame.scope());
    }
  }

  /** A scope pushed on a {@link ScopeStack}. */
  public final class Frame implements AutoCloseable {

    public Scope scope() {
      return scope;
    }

    /**
     * Pops this frame, restoring the scope that was current when it was pushed. Closing a frame
     * twice has no effect.
     *
     * @throws IllegalStateException if a frame pushed after this one is still open
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (frames.peek() != this) {
        throw new IllegalStateException(
            "Scope frames must be closed in the reverse order they were pushed");
      }
      frames.pop();
      closed = true;
      logger.fine(String.format("Left %s, back to depth %d", scope, depth()));
    }

    private Frame(Scope scope) {
      this.scope = scope;
    }

    private final Scope scope;
    private boolean closed = false;
  }

  private static final Logger logger = Logger.getLogger(ScopeStack.class.getName());

  private final Deque<Frame> frames = new ArrayDeque<>();
}
