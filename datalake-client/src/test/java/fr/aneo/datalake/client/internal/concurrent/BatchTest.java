/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package fr.aneo.datalake.client.internal.concurrent;

import fr.aneo.datalake.client.concurrent.CancellationSignal;
import org.jmock.lib.concurrent.DeterministicScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static java.time.Duration.ofSeconds;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchTest {

  private DeterministicScheduler scheduler;
  private AtomicInteger inFlight;
  private AtomicInteger maxInFlight;
  private List<Integer> started;

  @BeforeEach
  void setUp() {
    scheduler = new DeterministicScheduler();
    inFlight = new AtomicInteger();
    maxInFlight = new AtomicInteger();
    started = Collections.synchronizedList(new ArrayList<>());
  }

  @Test
  @DisplayName("run never exceeds the concurrency limit and runs every operation")
  void run_never_exceeds_the_concurrency_limit() {
    // Given
    var batch = new Batch(3);
    for (int i = 0; i < 10; i++) batch.addOperation(scheduled(i, null));

    // When
    var result = batch.run().toCompletableFuture();

    // Then
    assertThat(inFlight.get()).isEqualTo(3);
    assertThat(result).isNotDone();

    scheduler.runUntilIdle();

    assertThat(result).isCompleted();
    assertThat(started).hasSize(10);
    assertThat(maxInFlight.get()).isEqualTo(3);
  }

  @Test
  @DisplayName("run starts operations in the order they were added")
  void run_starts_operations_in_fifo_order() {
    // Given
    var batch = new Batch(2);
    for (int i = 0; i < 6; i++) batch.addOperation(scheduled(i, null));

    // When
    batch.run();
    scheduler.runUntilIdle();

    // Then
    assertThat(started).containsExactly(0, 1, 2, 3, 4, 5);
  }

  @Test
  @DisplayName("run fails with the first failure and never starts the remaining operations")
  void run_fails_fast_and_drops_unstarted_operations() {
    // Given
    var failure = new IllegalStateException("boom");
    var batch = new Batch(2);
    batch.addOperation(scheduled(0, null));
    batch.addOperation(scheduled(1, failure));
    for (int i = 2; i < 8; i++) batch.addOperation(scheduled(i, null));

    // When
    var result = batch.run().toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThat(result).failsWithin(ofSeconds(1))
                      .withThrowableOfType(ExecutionException.class)
                      .withCause(failure);
    assertThat(started).doesNotContain(4, 5, 6, 7);
  }

  @Test
  @DisplayName("run turns an operation throwing synchronously into a failure")
  void run_turns_synchronous_throw_into_failure() {
    // Given
    var batch = new Batch(1);
    batch.addOperation(() -> {
      throw new IllegalArgumentException("invalid");
    });

    // When
    var result = batch.run().toCompletableFuture();

    // Then
    assertThat(result).isCompletedExceptionally();
    assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("run completes immediately when the batch is empty")
  void run_completes_immediately_when_empty() {
    // Given
    var batch = new Batch(4);

    // When
    var result = batch.run().toCompletableFuture();

    // Then
    assertThat(result).isCompleted();
  }

  @Test
  @DisplayName("run handles operations completing synchronously without recursion")
  void run_handles_synchronous_operations() {
    // Given
    var count = new AtomicInteger();
    var batch = new Batch(2);
    for (int i = 0; i < 10_000; i++) {
      batch.addOperation(() -> {
        count.incrementAndGet();
        return completedFuture(null);
      });
    }

    // When
    var result = batch.run().toCompletableFuture();

    // Then
    assertThat(result).isCompleted();
    assertThat(count.get()).isEqualTo(10_000);
  }

  @Test
  @DisplayName("run stops starting operations once cancelled")
  void run_stops_starting_operations_once_cancelled() {
    // Given
    var signal = new CancellationSignal();
    var batch = new Batch(1);
    for (int i = 0; i < 5; i++) batch.addOperation(scheduled(i, null));

    // When
    var result = batch.run(signal).toCompletableFuture();
    scheduler.runNextPendingCommand();
    signal.cancel();
    scheduler.runUntilIdle();

    // Then
    assertThat(result).failsWithin(ofSeconds(1))
                      .withThrowableOfType(ExecutionException.class)
                      .withCauseInstanceOf(CancellationException.class);
    assertThat(started).hasSizeLessThan(5);
  }

  @Test
  @DisplayName("addOperation fails once the batch is running")
  void addOperation_fails_once_running() {
    // Given
    var batch = new Batch(1);
    batch.addOperation(scheduled(0, null));
    batch.run();

    // When / Then
    assertThatThrownBy(() -> batch.addOperation(scheduled(1, null))).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(batch::run).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("constructor rejects a non positive concurrency")
  void constructor_rejects_non_positive_concurrency() {
    assertThatThrownBy(() -> new Batch(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("run pulls operations from an iterator only when a slot is free")
  void run_pulls_operations_lazily_from_iterator() {
    // Given
    var pulled = new AtomicInteger();
    Iterator<Supplier<CompletionStage<?>>> operations = new Iterator<>() {
      @Override
      public boolean hasNext() {
        return pulled.get() < 7;
      }

      @Override
      public Supplier<CompletionStage<?>> next() {
        return scheduled(pulled.getAndIncrement(), null);
      }
    };
    var batch = new Batch(2);

    // When
    var result = batch.run(operations, CancellationSignal.none()).toCompletableFuture();

    // Then
    assertThat(pulled.get()).isEqualTo(2);
    scheduler.runNextPendingCommand();
    assertThat(pulled.get()).isEqualTo(3);

    scheduler.runUntilIdle();
    assertThat(result).isCompleted();
    assertThat(started).containsExactly(0, 1, 2, 3, 4, 5, 6);
    assertThat(maxInFlight.get()).isEqualTo(2);
  }

  @Test
  @DisplayName("run fails when the operation iterator throws and starts nothing more")
  void run_fails_when_iterator_throws() {
    // Given
    var failure = new IllegalStateException("source broken");
    var operations = List.<Supplier<CompletionStage<?>>>of(scheduled(0, null), scheduled(1, null)).iterator();
    Iterator<Supplier<CompletionStage<?>>> failing = new Iterator<>() {
      @Override
      public boolean hasNext() {
        if (!operations.hasNext()) throw failure;
        return true;
      }

      @Override
      public Supplier<CompletionStage<?>> next() {
        return operations.next();
      }
    };
    var batch = new Batch(1);

    // When
    var result = batch.run(failing, CancellationSignal.none()).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThat(result).failsWithin(ofSeconds(1))
                      .withThrowableOfType(ExecutionException.class)
                      .withCause(failure);
    assertThat(started).containsExactly(0, 1);
  }

  @Test
  @DisplayName("settled waits for the operations still running after a failure")
  void settled_waits_for_running_operations_after_failure() {
    // Given
    var failure = new IllegalStateException("boom");
    var batch = new Batch(3);
    batch.addOperation(scheduled(0, failure));
    batch.addOperation(scheduled(1, null));
    batch.addOperation(scheduled(2, null));

    // When
    var result = batch.run().toCompletableFuture();
    var settled = batch.settled().toCompletableFuture();
    scheduler.runNextPendingCommand();

    // Then
    assertThat(result).isCompletedExceptionally();
    assertThat(settled).isNotDone();
    assertThat(inFlight.get()).isEqualTo(2);

    scheduler.runUntilIdle();
    assertThat(settled).isCompleted();
  }

  @Test
  @DisplayName("settled completes with the batch when nothing is running")
  void settled_completes_with_successful_batch() {
    // Given
    var batch = new Batch(2);
    for (int i = 0; i < 4; i++) batch.addOperation(scheduled(i, null));

    // When
    var result = batch.run().toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThat(result).isCompleted();
    assertThat(batch.settled().toCompletableFuture()).isCompleted();
  }

  @Test
  @DisplayName("run with an iterator is rejected when operations were queued")
  void run_with_iterator_rejects_queued_operations() {
    // Given
    var batch = new Batch(1);
    batch.addOperation(scheduled(0, null));

    // When / Then
    assertThatThrownBy(() -> batch.run(List.<Supplier<CompletionStage<?>>>of().iterator(), CancellationSignal.none()))
      .isInstanceOf(IllegalStateException.class);
  }

  private Supplier<CompletionStage<?>> scheduled(int index, RuntimeException failure) {
    return () -> {
      started.add(index);
      maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
      var future = new CompletableFuture<Void>();
      scheduler.execute(() -> {
        inFlight.decrementAndGet();
        if (failure == null) future.complete(null);
        else future.completeExceptionally(failure);
      });
      return future;
    };
  }
}
