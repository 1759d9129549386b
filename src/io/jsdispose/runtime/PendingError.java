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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The error state of one scope instance while it unwinds: at most one primary error plus the
 * ordered list of errors suppressed after it.
 */
public final class PendingError {
  private boolean hasError;
  private @Nullable Throwable primary;
  private final ImmutableList.Builder<Throwable> suppressed = ImmutableList.builder();
  private int suppressedCount = 0;

  /**
   * @param hasError whether the guarded body completed by throwing
   * @param error the thrown value, required when {@code hasError} is set
   */
  PendingError(boolean hasError, @Nullable Throwable error) {
    if (hasError) {
      if (error == null) {
        throw new IllegalArgumentException("A pending error requires a thrown value");
      }
      this.hasError = true;
      this.primary = error;
    }
  }

  /** Records a disposal failure: primary when none is pending, suppressed otherwise. */
  void record(Throwable t) {
    if (!hasError) {
      hasError = true;
      primary = t;
    } else {
      suppressed.add(t);
      suppressedCount++;
    }
  }

  public boolean hasError() {
    return hasError;
  }

  public @Nullable Throwable getPrimary() {
    return primary;
  }

  public ImmutableList<Throwable> getSuppressed() {
    return suppressed.build();
  }

  /**
   * Returns the throwable that ends the unwind, or null when the scope completed normally. An
   * unchecked primary without suppressed errors is returned as it is.
   */
  @Nullable Throwable toFinalError() {
    if (!hasError) {
      return null;
    }
    Throwable p = primary;
    if (suppressedCount > 0) {
      return new AggregateDisposalException(p, getSuppressed());
    }
    if (p instanceof RuntimeException || p instanceof Error) {
      return p;
    }
    return new DisposalException(p);
  }

  /** Throws the final error of the unwind, if there is one. */
  void rethrowIfAny() {
    Throwable e = toFinalError();
    if (e instanceof Error) {
      throw (Error) e;
    } else if (e != null) {
      throw (RuntimeException) e;
    }
  }
}
