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
package fr.aneo.datalake.client.acl;

import com.google.common.base.Strings;
import fr.aneo.datalake.client.exception.DataLakeAclChangeFailedException;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.path.ChangeAccessControlRecursiveRequest;
import fr.aneo.datalake.client.path.ChangeAccessControlRecursiveResponse;
import fr.aneo.datalake.client.path.PathOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Applies an ACL change to a whole directory tree, one server-side batch at a time.
 * <p>
 * The service processes at most {@code batchSize} paths per call and returns a continuation
 * token while paths remain. Batches are strictly sequential: the next call is issued only after
 * the previous one succeeded and the progress listener, if any, returned. The operation stops
 * when the service returns no token, or when {@code maxBatches} batches were processed, in
 * which case the result carries the token to resume from.
 * </p>
 * <p>
 * A failed call, or a cancellation observed before a batch, fails the operation with a
 * {@link DataLakeAclChangeFailedException} holding the token of the last successful batch.
 * Changes applied by earlier batches are kept. An exception thrown by the progress listener
 * is not wrapped: it fails the operation as is.
 * </p>
 */
public final class AccessControlPropagator {
  private static final Logger logger = LoggerFactory.getLogger(AccessControlPropagator.class);

  private final PathOperations operations;

  public AccessControlPropagator(PathOperations operations) {
    this.operations = requireNonNull(operations, "operations must not be null");
  }

  /**
   * Starts a recursive ACL change rooted at the path bound to the operations.
   *
   * @param mode    set, modify or remove
   * @param acl     ACL in wire form, see {@link AclStrings}
   * @param options batching, resumption and progress options
   * @return a stage completing with the aggregated counters
   * @throws IllegalArgumentException if {@code batchSize} or {@code maxBatches} is set and lower than 1
   */
  public CompletionStage<AccessControlChangeResult> propagate(AccessControlChangeMode mode, String acl, AccessControlChangeOptions options) {
    requireNonNull(mode, "mode must not be null");
    requireNonNull(acl, "acl must not be null");
    requireNonNull(options, "options must not be null");
    options.batchSize().ifPresent(size -> {
      if (size < 1) throw new IllegalArgumentException("batchSize must be >= 1, got: " + size);
    });
    options.maxBatches().ifPresent(max -> {
      if (max < 1) throw new IllegalArgumentException("maxBatches must be >= 1, got: " + max);
    });

    logger.atDebug()
          .addKeyValue("mode", mode.value())
          .addKeyValue("batchSize", options.batchSize())
          .addKeyValue("maxBatches", options.maxBatches())
          .addKeyValue("resuming", options.continuationToken().isPresent())
          .log("Starting recursive access control change");

    var run = new Run(mode, acl, options);
    return nextBatch(run, new Progress(0, options.continuationToken().orElse(null), AccessControlChangeCounters.ZERO));
  }

  private CompletionStage<AccessControlChangeResult> nextBatch(Run run, Progress start) {
    var progress = start;
    // Batches answered synchronously are chained in this loop, only a pending one defers to its completion.
    while (true) {
      var cancellation = run.options().cancellation();
      if (cancellation.isCancelled()) {
        return failedFuture(new DataLakeAclChangeFailedException(
          new CancellationException("Recursive access control change was cancelled"), progress.token(), progress.aggregate()));
      }

      var request = new ChangeAccessControlRecursiveRequest(
        run.mode(),
        run.acl(),
        run.options().batchSize().isPresent() ? run.options().batchSize().getAsInt() : null,
        progress.token(),
        run.options().continueOnFailure());

      var current = progress;
      var outcome = Futures.safely(() -> operations.changeAccessControlRecursive(request, cancellation))
                           .toCompletableFuture()
                           .handle((response, throwable) -> throwable == null
                             ? onBatchCompleted(run, current, response)
                             : Step.done(failed(throwable, current)));
      if (!outcome.isDone()) {
        return outcome.thenCompose(step -> step.isFinal() ? step.result() : nextBatch(run, step.next()));
      }
      var step = outcome.join();
      if (step.isFinal()) {
        return step.result();
      }
      progress = step.next();
    }
  }

  private Step onBatchCompleted(Run run, Progress previous, ChangeAccessControlRecursiveResponse response) {
    var batchCounters = response.counters();
    var token = Strings.emptyToNull(response.continuation());
    var progress = new Progress(previous.batches() + 1, token, previous.aggregate().plus(batchCounters));

    logger.atDebug()
          .addKeyValue("batch", progress.batches())
          .addKeyValue("directories", batchCounters.changedDirectoriesCount())
          .addKeyValue("files", batchCounters.changedFilesCount())
          .addKeyValue("failures", batchCounters.failedChangesCount())
          .addKeyValue("hasMore", token != null)
          .log("Access control batch completed");

    var listener = run.options().progressListener();
    if (listener.isPresent()) {
      try {
        listener.get().onBatch(new AccessControlChanges(response.failedEntries(), batchCounters, progress.aggregate(), token));
      } catch (RuntimeException e) {
        return Step.done(failedFuture(e));
      }
    }

    if (token == null) {
      return Step.done(completedFuture(new AccessControlChangeResult(progress.aggregate(), Optional.empty())));
    }
    var maxBatches = run.options().maxBatches();
    if (maxBatches.isPresent() && progress.batches() >= maxBatches.getAsInt()) {
      return Step.done(completedFuture(new AccessControlChangeResult(progress.aggregate(), Optional.of(token))));
    }
    return Step.proceed(progress);
  }

  private static CompletionStage<AccessControlChangeResult> failed(Throwable throwable, Progress progress) {
    var cause = Futures.unwrap(throwable);
    logger.atDebug()
          .addKeyValue("batch", progress.batches() + 1)
          .addKeyValue("error", cause.getMessage())
          .log("Access control batch failed");
    return failedFuture(new DataLakeAclChangeFailedException(cause, progress.token(), progress.aggregate()));
  }

  private record Run(AccessControlChangeMode mode, String acl, AccessControlChangeOptions options) {
  }

  private record Progress(int batches, String token, AccessControlChangeCounters aggregate) {
  }

  /**
   * Either the final outcome of the operation or the progress to issue the next batch from.
   */
  private record Step(CompletionStage<AccessControlChangeResult> result, Progress next) {
    static Step done(CompletionStage<AccessControlChangeResult> result) {
      return new Step(result, null);
    }

    static Step proceed(Progress next) {
      return new Step(null, next);
    }

    boolean isFinal() {
      return result != null;
    }
  }
}
