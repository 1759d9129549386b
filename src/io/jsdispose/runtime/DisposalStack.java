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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * The per scope instance list of registered resources. Entries are kept in registration order and
 * unwound in reverse.
 *
 * <p>A stack belongs to exactly one scope instance and is not safe for use from several threads.
 */
public final class DisposalStack {

  /** How the disposal capability of an entry is invoked. */
  public enum Hint {
    SYNC,
    ASYNC
  }

  /** A registered resource together with the disposal capability resolved at registration. */
  public static final class Entry {
    private final Object resource;
    private final Hint hint;

    private Entry(Object resource, Hint hint) {
      this.resource = resource;
      this.hint = hint;
    }

    public Object getResource() {
      return resource;
    }

    public Hint getHint() {
      return hint;
    }

    /** Runs a synchronous disposal. */
    void disposeSync() throws Exception {
      checkState(hint == Hint.SYNC, "Entry requires an awaited disposal: %s", resource);
      ((Disposable) resource).dispose();
    }

    /** Starts an asynchronous disposal. */
    CompletionStage<?> disposeAsync() {
      checkState(hint == Hint.ASYNC, "Entry is disposed synchronously: %s", resource);
      return checkNotNull(
          ((AsyncDisposable) resource).disposeAsync(),
          "disposeAsync() returned null for %s",
          resource);
    }

    @Override
    public String toString() {
      return hint + ":" + resource;
    }
  }

  private final List<Entry> entries = new ArrayList<>();
  private boolean unwound = false;

  void push(Object resource, Hint hint) {
    checkState(!unwound, "Cannot register a resource after the scope was unwound");
    entries.add(new Entry(checkNotNull(resource), hint));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public boolean hasAsyncEntries() {
    for (Entry entry : entries) {
      if (entry.getHint() == Hint.ASYNC) {
        return true;
      }
    }
    return false;
  }

  /** The entries in registration order. */
  public ImmutableList<Entry> getEntries() {
    return ImmutableList.copyOf(entries);
  }

  /** Marks the stack as unwound and returns its entries in disposal (reverse) order. */
  List<Entry> beginUnwind() {
    checkState(!unwound, "A scope instance is unwound exactly once");
    unwound = true;
    return Lists.reverse(ImmutableList.copyOf(entries));
  }

  public boolean isUnwound() {
    return unwound;
  }

  @Override
  public String toString() {
    return "DisposalStack" + entries;
  }
}
