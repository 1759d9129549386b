/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.jsdispose.runtime;

import com.google.common.base.Preconditions;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Java model of the helper functions that rewritten code calls. Each method corresponds to one
 * runtime helper:
 *
 * <ul>
 *   <li>{@code $jscomp.using(stack, value)} is {@link #using}
 *   <li>{@code $jscomp.usingAsync(stack, value)} is {@link #usingAsync}
 *   <li>{@code $jscomp.dispose(stack, hasError, error)} is {@link #dispose}
 *   <li>{@code $jscomp.disposeAsync(stack, hasError, error)} is {@link #disposeAsync}
 *   <li>{@code $jscomp.asyncUnwind(stack, hasError, error)} is {@link #asyncUnwind}
 * </ul>
 *
 * <p>All methods are stateless; the state of a scope instance lives in its {@link DisposalStack}
 * and the pending error passed to the unwind.
 */
public final class DisposalRuntime {
  private static final Logger logger = Logger.getLogger(DisposalRuntime.class.getName());

  private DisposalRuntime() {}

  /**
   * Registers {@code value} for synchronous disposal and returns it. A null value is skipped.
   *
   * @throws DisposalInitializationException if the value is not {@link Disposable}. Entries
   *     registered before stay on the stack.
   */
  public static <T> @Nullable T using(DisposalStack stack, @Nullable T value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof Disposable)) {
      throw new DisposalInitializationException(
          "Object not disposable: " + value.getClass().getName());
    }
    stack.push(value, DisposalStack.Hint.SYNC);
    return value;
  }

  /**
   * Registers {@code value} for awaited disposal and returns it. The asynchronous capability is
   * preferred; a value that is only {@link Disposable} is disposed synchronously during the
   * awaited unwind. A null value is skipped.
   */
  public static <T> @Nullable T usingAsync(DisposalStack stack, @Nullable T value) {
    if (value == null) {
      return null;
    }
    if (value instanceof AsyncDisposable) {
      stack.push(value, DisposalStack.Hint.ASYNC);
    } else if (value instanceof Disposable) {
      stack.push(value, DisposalStack.Hint.SYNC);
    } else {
      throw new DisposalInitializationException(
          "Object not async disposable: " + value.getClass().getName());
    }
    return value;
  }

  /**
   * Disposes every entry of {@code stack} in reverse registration order. Every entry gets an
   * attempt even when earlier ones fail, whether they throw an exception or an {@link Error}.
   *
   * @param hasError whether the guarded body completed by throwing {@code error}
   */
  public static void dispose(DisposalStack stack, boolean hasError, @Nullable Throwable error) {
    Preconditions.checkState(
        !stack.hasAsyncEntries(), "Stack holds entries that must be awaited: %s", stack);
    PendingError pending = new PendingError(hasError, error);
    for (DisposalStack.Entry entry : stack.beginUnwind()) {
      try {
        entry.disposeSync();
      } catch (Throwable t) {
        if (t instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        if (pending.hasError()) {
          logger.log(Level.FINE, "Suppressing disposal failure", t);
        }
        pending.record(t);
      }
    }
    pending.rethrowIfAny();
  }

  /**
   * Disposes every entry of {@code stack} in reverse registration order, waiting for each
   * asynchronous disposal before starting the next one. The returned future fails with the same
   * error {@link #dispose} would throw.
   */
  public static CompletableFuture<Void> disposeAsync(
      DisposalStack stack, boolean hasError, @Nullable Throwable error) {
    return drain(asyncUnwind(stack, hasError, error));
  }

  /** Starts a step-wise unwind of {@code stack}. */
  public static AsyncUnwind asyncUnwind(
      DisposalStack stack, boolean hasError, @Nullable Throwable error) {
    return new AsyncUnwind(stack, new PendingError(hasError, error));
  }

  private static CompletableFuture<Void> drain(AsyncUnwind unwind) {
    if (!unwind.hasNext()) {
      try {
        unwind.complete();
        return CompletableFuture.completedFuture(null);
      } catch (RuntimeException | Error e) {
        return CompletableFuture.failedFuture(e);
      }
    }
    return unwind.disposeNext().thenCompose(unused -> drain(unwind));
  }
}
