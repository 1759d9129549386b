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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * The final error of an unwind in which at least one disposal failed after a primary error was
 * already pending. The primary is also the {@linkplain #getCause() cause}; the suppressed errors
 * are kept in the order the failing disposals ran.
 */
public final class AggregateDisposalException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Throwable primary;
  @SuppressWarnings("serial")
  private final ImmutableList<Throwable> suppressedErrors;

  public AggregateDisposalException(Throwable primary, ImmutableList<Throwable> suppressedErrors) {
    super(
        "An error was suppressed during disposal ("
            + suppressedErrors.size()
            + " suppressed): "
            + primary,
        checkNotNull(primary));
    this.primary = primary;
    this.suppressedErrors = suppressedErrors;
  }

  /** The body error, or the first disposal failure when the body completed normally. */
  public Throwable getPrimary() {
    return primary;
  }

  public ImmutableList<Throwable> getSuppressedErrors() {
    return suppressedErrors;
  }
}
