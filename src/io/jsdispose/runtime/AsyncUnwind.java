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

import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A step-wise unwind of a disposal stack, used where the caller itself suspends between two
 * disposals (a lowered async function awaits each {@link #disposeNext()} as a separate step).
 *
 * <p>Usage follows the shape of the lowered program:
 *
 * <pre>
 *   AsyncUnwind unwind = DisposalRuntime.asyncUnwind(stack, hasError, error);
 *   while (unwind.hasNext()) {
 *     await(unwind.disposeNext());
 *   }
 *   unwind.complete();
 * </pre>
 */
public final class AsyncUnwind {
  private static final Logger logger = Logger.getLogger(AsyncUnwind.class.getName());

  private final Iterator<DisposalStack.Entry> remaining;
  private final PendingError pendingError;
  private boolean inFlight = false;
  private boolean completed = false;

  AsyncUnwind(DisposalStack stack, PendingError pendingError) {
    this.remaining = stack.beginUnwind().iterator();
    this.pendingError = pendingError;
  }

  public boolean hasNext() {
    return !completed && remaining.hasNext();
  }

  /**
   * Starts the disposal of the most recently registered entry that was not disposed yet. The
   * returned stage never completes exceptionally: failures are recorded in the pending error.
   */
  public CompletableFuture<Void> disposeNext() {
    checkState(hasNext(), "No entry left to dispose");
    checkState(!inFlight, "The previous disposal has not completed yet");
    DisposalStack.Entry entry = remaining.next();
    if (entry.getHint() == DisposalStack.Hint.SYNC) {
      try {
        entry.disposeSync();
      } catch (Throwable t) {
        if (t instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        record(t);
      }
      return CompletableFuture.completedFuture(null);
    }

    CompletionStage<?> stage;
    try {
      stage = entry.disposeAsync();
    } catch (Throwable t) {
      record(t);
      return CompletableFuture.completedFuture(null);
    }
    inFlight = true;
    return stage
        .<Void>handle(
            (unused, t) -> {
              inFlight = false;
              if (t != null) {
                record(unwrap(t));
              }
              return null;
            })
        .toCompletableFuture();
  }

  /** Ends the unwind, throwing the primary error or the aggregate of all recorded errors. */
  public void complete() {
    checkState(!completed, "The unwind was already completed");
    checkState(!remaining.hasNext() && !inFlight, "Entries are still pending disposal");
    completed = true;
    pendingError.rethrowIfAny();
  }

  public PendingError getPendingError() {
    return pendingError;
  }

  private void record(Throwable t) {
    if (pendingError.hasError()) {
      logger.log(Level.FINE, "Suppressing disposal failure", t);
    }
    pendingError.record(t);
  }

  private static Throwable unwrap(Throwable t) {
    if (t instanceof CompletionException && t.getCause() != null) {
      return t.getCause();
    }
    return t;
  }
}
