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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs independent asynchronous operations with at most N of them in flight.
 * <p>
 * Operations are either queued with {@link #addOperation(Supplier)} and started once
 * {@link #run()} is called, or pulled lazily from an iterator given to
 * {@link #run(Iterator, CancellationSignal)}. They are started in order; completion order is
 * unspecified. The stage returned by {@code run} completes when every operation has completed
 * successfully, or exceptionally as soon as one operation fails:
 * <ul>
 *   <li>operations not yet started are dropped and never start;</li>
 *   <li>operations already running are allowed to finish, their outcome is ignored.</li>
 * </ul>
 * {@link #settled()} completes once the outcome is known and no operation is running anymore.
 * <p>
 * Dispatch is driven by completions: each completed operation frees a slot and starts the next
 * one. Operations completing synchronously on the dispatching thread do not recurse; the
 * dispatch loop picks up the freed slots instead. The operation source is only used by one
 * thread at a time, and only when a slot is free.
 * </p>
 * <p>
 * A {@code Batch} is single-use.
 * </p>
 */
public final class Batch {
  private static final Logger logger = LoggerFactory.getLogger(Batch.class);

  private final int concurrency;
  private final Object lock = new Object();
  private final List<Supplier<? extends CompletionStage<?>>> queued = new ArrayList<>();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final CompletableFuture<Void> settled = new CompletableFuture<>();
  private final AtomicBoolean dispatching = new AtomicBoolean(false);
  private final AtomicBoolean dispatchRequested = new AtomicBoolean(false);

  private Iterator<? extends Supplier<? extends CompletionStage<?>>> source;
  private CancellationSignal cancellation = CancellationSignal.none();
  private boolean started;
  private boolean exhausted;
  private int inFlight;

  /**
   * @param concurrency maximum number of operations in flight at the same time; must be &gt; 0
   * @throws IllegalArgumentException if {@code concurrency} is not positive
   */
  public Batch(int concurrency) {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0, got: " + concurrency);
    }
    this.concurrency = concurrency;
  }

  /**
   * Queues an operation. The supplier is invoked when a slot is available, not before.
   *
   * @param operation supplier starting the operation and returning its completion stage
   * @throws IllegalStateException if the batch is already running
   */
  public void addOperation(Supplier<? extends CompletionStage<?>> operation) {
    requireNonNull(operation, "operation must not be null");
    synchronized (lock) {
      if (started) throw new IllegalStateException("Operations cannot be added once the batch is running");
      queued.add(operation);
    }
  }

  /**
   * @return the number of queued operations
   */
  public int size() {
    synchronized (lock) {
      return queued.size();
    }
  }

  public CompletionStage<Void> run() {
    return run(CancellationSignal.none());
  }

  /**
   * Starts dispatching the queued operations.
   * <p>
   * The cancellation signal is checked before each operation is started. Once it is observed,
   * no further operation starts and the returned stage fails with a {@link CancellationException}.
   *
   * @param cancellation signal checked before each start
   * @return a stage completing when all operations succeeded, or with the first failure
   * @throws IllegalStateException if the batch was already started
   */
  public CompletionStage<Void> run(CancellationSignal cancellation) {
    synchronized (lock) {
      prepare(queued.iterator(), cancellation);
    }
    return launch();
  }

  /**
   * Starts dispatching the operations produced by {@code operations}.
   * <p>
   * The iterator is advanced only when a slot is free, so an iterator producing its operations
   * on demand holds at most as many of them as there are free slots. An exception thrown by the
   * iterator fails the batch like a failed operation.
   *
   * @param operations   source of the operations, consumed once
   * @param cancellation signal checked before each start
   * @return a stage completing when all operations succeeded, or with the first failure
   * @throws IllegalStateException if the batch was already started or operations were queued
   */
  public CompletionStage<Void> run(Iterator<? extends Supplier<? extends CompletionStage<?>>> operations, CancellationSignal cancellation) {
    requireNonNull(operations, "operations must not be null");
    synchronized (lock) {
      if (!queued.isEmpty()) throw new IllegalStateException("Batch already has queued operations");
      prepare(operations, cancellation);
    }
    return launch();
  }

  /**
   * @return a stage completing, never exceptionally, once the stage returned by {@code run}
   * completed and no operation is in flight
   */
  public CompletionStage<Void> settled() {
    return settled;
  }

  private void prepare(Iterator<? extends Supplier<? extends CompletionStage<?>>> operations, CancellationSignal cancellation) {
    requireNonNull(cancellation, "cancellation must not be null");
    if (started) throw new IllegalStateException("Batch is already running");
    started = true;
    this.source = operations;
    this.cancellation = cancellation;
  }

  private CompletionStage<Void> launch() {
    logger.atDebug()
          .addKeyValue("queued", queued.size())
          .addKeyValue("concurrency", concurrency)
          .log("Starting batch");

    dispatch();
    return completion;
  }

  private void dispatch() {
    dispatchRequested.set(true);
    if (!dispatching.compareAndSet(false, true)) return;
    try {
      while (dispatchRequested.getAndSet(false)) {
        startAvailable();
      }
    } finally {
      dispatching.set(false);
    }
    if (dispatchRequested.get()) dispatch();
  }

  private void startAvailable() {
    while (true) {
      boolean allDone;
      synchronized (lock) {
        if (completion.isDone() || inFlight >= concurrency) return;
        allDone = exhausted && inFlight == 0;
        if (exhausted && !allDone) return;
      }
      if (allDone) {
        completion.complete(null);
        settleIfIdle();
        return;
      }

      Supplier<? extends CompletionStage<?>> operation;
      try {
        if (!source.hasNext()) {
          synchronized (lock) {
            exhausted = true;
          }
          continue;
        }
        if (cancellation.isCancelled()) {
          logger.debug("Batch cancelled, remaining operations are not started");
          fail(new CancellationException("Batch was cancelled before all operations were started"));
          return;
        }
        operation = source.next();
      } catch (RuntimeException e) {
        fail(e);
        return;
      }

      synchronized (lock) {
        inFlight++;
      }
      start(operation);
    }
  }

  private void start(Supplier<? extends CompletionStage<?>> operation) {
    CompletionStage<?> stage;
    try {
      stage = operation.get();
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }
    stage.whenComplete((ignored, throwable) -> onOperationCompleted(throwable));
  }

  private void onOperationCompleted(Throwable throwable) {
    synchronized (lock) {
      inFlight--;
    }

    if (throwable != null) {
      fail(Futures.unwrap(throwable));
    } else {
      dispatch();
    }
    settleIfIdle();
  }

  private void fail(Throwable cause) {
    if (completion.completeExceptionally(cause)) {
      logger.atDebug()
            .addKeyValue("error", cause.getClass().getSimpleName())
            .log("Batch operation failed, stopping dispatch");
    }
    settleIfIdle();
  }

  private void settleIfIdle() {
    boolean idle;
    synchronized (lock) {
      idle = completion.isDone() && inFlight == 0;
    }
    if (idle) settled.complete(null);
  }
}
