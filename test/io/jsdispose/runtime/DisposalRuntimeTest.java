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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DisposalRuntime}. */
@RunWith(JUnit4.class)
public final class DisposalRuntimeTest {

  private final List<String> log = new ArrayList<>();

  /** A resource that logs its disposal and optionally fails it. */
  private Disposable resource(String name) {
    return () -> log.add(name);
  }

  private Disposable failing(String name, Exception failure) {
    return () -> {
      log.add(name);
      throw failure;
    };
  }

  @Test
  public void testSingleResourceIsDisposedOnce() {
    DisposalStack stack = new DisposalStack();
    Disposable r = resource("r");

    assertThat(DisposalRuntime.using(stack, r)).isSameInstanceAs(r);
    DisposalRuntime.dispose(stack, false, null);

    assertThat(log).containsExactly("r");
    assertThat(stack.isUnwound()).isTrue();
  }

  @Test
  public void testDisposalRunsInReverseOrderAndKeepsBodyError() {
    DisposalStack stack = new DisposalStack();
    DisposalRuntime.using(stack, resource("d1"));
    DisposalRuntime.using(stack, resource("d2"));
    IllegalStateException bodyError = new IllegalStateException("body");

    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class, () -> DisposalRuntime.dispose(stack, true, bodyError));

    assertThat(thrown).isSameInstanceAs(bodyError);
    assertThat(log).containsExactly("d2", "d1").inOrder();
  }

  @Test
  public void testDisposalFailureBecomesPrimaryWhenBodySucceeded() {
    DisposalStack stack = new DisposalStack();
    IllegalArgumentException failure = new IllegalArgumentException("dispose");
    DisposalRuntime.using(stack, failing("r", failure));

    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class, () -> DisposalRuntime.dispose(stack, false, null));

    assertThat(thrown).isSameInstanceAs(failure);
  }

  @Test
  public void testCheckedDisposalFailureIsWrapped() {
    DisposalStack stack = new DisposalStack();
    IOException failure = new IOException("close");
    DisposalRuntime.using(stack, failing("r", failure));

    DisposalException thrown =
        assertThrows(DisposalException.class, () -> DisposalRuntime.dispose(stack, false, null));

    assertThat(thrown).hasCauseThat().isSameInstanceAs(failure);
  }

  @Test
  public void testLaterFailuresAreSuppressedInDisposalOrder() {
    DisposalStack stack = new DisposalStack();
    RuntimeException first = new RuntimeException("first registered");
    RuntimeException second = new RuntimeException("second registered");
    DisposalRuntime.using(stack, failing("a", first));
    DisposalRuntime.using(stack, resource("b"));
    DisposalRuntime.using(stack, failing("c", second));
    IllegalStateException bodyError = new IllegalStateException("body");

    AggregateDisposalException thrown =
        assertThrows(
            AggregateDisposalException.class,
            () -> DisposalRuntime.dispose(stack, true, bodyError));

    assertThat(log).containsExactly("c", "b", "a").inOrder();
    assertThat(thrown.getPrimary()).isSameInstanceAs(bodyError);
    assertThat(thrown).hasCauseThat().isSameInstanceAs(bodyError);
    assertThat(thrown.getSuppressedErrors()).containsExactly(second, first).inOrder();
  }

  @Test
  public void testFirstDisposalFailureIsPrimaryForLaterOnes() {
    DisposalStack stack = new DisposalStack();
    RuntimeException inner = new RuntimeException("inner");
    RuntimeException outer = new RuntimeException("outer");
    DisposalRuntime.using(stack, failing("outer", outer));
    DisposalRuntime.using(stack, failing("inner", inner));

    AggregateDisposalException thrown =
        assertThrows(
            AggregateDisposalException.class, () -> DisposalRuntime.dispose(stack, false, null));

    assertThat(thrown.getPrimary()).isSameInstanceAs(inner);
    assertThat(thrown.getSuppressedErrors()).containsExactly(outer);
  }

  @Test
  public void testErrorFromOneDisposalDoesNotSkipTheRest() {
    DisposalStack stack = new DisposalStack();
    AssertionError failure = new AssertionError("d2");
    DisposalRuntime.using(stack, resource("d1"));
    DisposalRuntime.using(
        stack,
        (Disposable)
            () -> {
              log.add("d2");
              throw failure;
            });

    AssertionError thrown =
        assertThrows(AssertionError.class, () -> DisposalRuntime.dispose(stack, false, null));

    assertThat(thrown).isSameInstanceAs(failure);
    assertThat(log).containsExactly("d2", "d1").inOrder();
  }

  @Test
  public void testInterruptedDisposalRestoresInterruptFlag() {
    DisposalStack stack = new DisposalStack();
    InterruptedException failure = new InterruptedException("close");
    DisposalRuntime.using(stack, resource("outer"));
    DisposalRuntime.using(stack, failing("inner", failure));

    try {
      DisposalException thrown =
          assertThrows(DisposalException.class, () -> DisposalRuntime.dispose(stack, false, null));

      assertThat(thrown).hasCauseThat().isSameInstanceAs(failure);
      assertThat(log).containsExactly("inner", "outer").inOrder();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      // Clear the flag so later tests on this thread are unaffected.
      boolean unused = Thread.interrupted();
    }
  }

  @Test
  public void testNullIsSkipped() {
    DisposalStack stack = new DisposalStack();

    assertThat(DisposalRuntime.<Disposable>using(stack, null)).isNull();
    assertThat(DisposalRuntime.<Disposable>usingAsync(stack, null)).isNull();
    assertThat(stack.isEmpty()).isTrue();
  }

  @Test
  public void testNonDisposableValueFailsRegistrationAndEarlierEntriesStillUnwind() {
    DisposalStack stack = new DisposalStack();
    DisposalRuntime.using(stack, resource("first"));

    DisposalInitializationException failure =
        assertThrows(
            DisposalInitializationException.class,
            () -> DisposalRuntime.using(stack, "not a resource"));
    assertThat(failure).hasMessageThat().contains("java.lang.String");
    assertThat(stack.size()).isEqualTo(1);

    // The guarded region catches the registration failure and unwinds as usual.
    DisposalInitializationException thrown =
        assertThrows(
            DisposalInitializationException.class,
            () -> DisposalRuntime.dispose(stack, true, failure));
    assertThat(thrown).isSameInstanceAs(failure);
    assertThat(log).containsExactly("first");
  }

  @Test
  public void testEachLoopIterationUnwindsItsOwnStack() {
    List<DisposalStack> stacks = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      DisposalStack stack = new DisposalStack();
      stacks.add(stack);
      DisposalRuntime.using(stack, resource("iteration " + i));
      DisposalRuntime.dispose(stack, false, null);
      assertThat(log).hasSize(i + 1);
    }

    assertThat(log).containsExactly("iteration 0", "iteration 1", "iteration 2").inOrder();
    for (DisposalStack stack : stacks) {
      assertThat(stack.size()).isEqualTo(1);
      assertThat(stack.isUnwound()).isTrue();
    }
  }

  @Test
  public void testStackIsUnwoundExactlyOnce() {
    DisposalStack stack = new DisposalStack();
    DisposalRuntime.using(stack, resource("r"));
    DisposalRuntime.dispose(stack, false, null);

    assertThrows(IllegalStateException.class, () -> DisposalRuntime.dispose(stack, false, null));
    assertThrows(
        IllegalStateException.class, () -> DisposalRuntime.using(stack, resource("late")));
    assertThat(log).containsExactly("r");
  }

  @Test
  public void testPendingErrorRequiresAThrownValue() {
    DisposalStack stack = new DisposalStack();

    assertThrows(IllegalArgumentException.class, () -> DisposalRuntime.dispose(stack, true, null));
  }

  @Test
  public void testSyncUnwindRejectsAsyncEntries() {
    DisposalStack stack = new DisposalStack();
    AsyncDisposable r = () -> CompletableFuture.completedFuture(null);
    DisposalRuntime.usingAsync(stack, r);

    assertThrows(IllegalStateException.class, () -> DisposalRuntime.dispose(stack, false, null));
  }

  @Test
  public void testUsingAsyncPrefersAsyncCapability() {
    DisposalStack stack = new DisposalStack();
    DisposalRuntime.usingAsync(stack, new BothCapabilities());
    DisposalRuntime.usingAsync(stack, resource("sync only"));

    assertThat(stack.getEntries().get(0).getHint()).isEqualTo(DisposalStack.Hint.ASYNC);
    assertThat(stack.getEntries().get(1).getHint()).isEqualTo(DisposalStack.Hint.SYNC);
  }

  @Test
  public void testUsingAsyncRejectsValuesWithoutCapability() {
    DisposalStack stack = new DisposalStack();

    assertThrows(
        DisposalInitializationException.class, () -> DisposalRuntime.usingAsync(stack, 42));
  }

  @Test
  public void testDisposeAsyncWaitsForEachDisposal() {
    DisposalStack stack = new DisposalStack();
    CompletableFuture<Void> first = new CompletableFuture<>();
    DisposalRuntime.usingAsync(stack, resource("sync"));
    DisposalRuntime.usingAsync(
        stack,
        (AsyncDisposable)
            () -> {
              log.add("async");
              return first;
            });

    CompletableFuture<Void> done = DisposalRuntime.disposeAsync(stack, false, null);

    assertThat(log).containsExactly("async");
    assertThat(done.isDone()).isFalse();
    first.complete(null);
    assertThat(log).containsExactly("async", "sync").inOrder();
    assertThat(done.isDone()).isTrue();
    assertThat(done.isCompletedExceptionally()).isFalse();
  }

  @Test
  public void testDisposeAsyncFailsWithAggregate() throws Exception {
    DisposalStack stack = new DisposalStack();
    RuntimeException asyncFailure = new RuntimeException("async");
    DisposalRuntime.usingAsync(
        stack, (AsyncDisposable) () -> CompletableFuture.failedFuture(asyncFailure));
    IllegalStateException bodyError = new IllegalStateException("body");

    CompletableFuture<Void> done = DisposalRuntime.disposeAsync(stack, true, bodyError);

    ExecutionException thrown = assertThrows(ExecutionException.class, done::get);
    assertThat(thrown).hasCauseThat().isInstanceOf(AggregateDisposalException.class);
    AggregateDisposalException aggregate = (AggregateDisposalException) thrown.getCause();
    assertThat(aggregate.getPrimary()).isSameInstanceAs(bodyError);
    assertThat(aggregate.getSuppressedErrors()).containsExactly(asyncFailure);
  }

  private static final class BothCapabilities implements Disposable, AsyncDisposable {
    @Override
    public void dispose() {}

    @Override
    public CompletionStage<?> disposeAsync() {
      return CompletableFuture.completedFuture(null);
    }
  }
}
