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
package fr.aneo.datalake.client.internal.retry;

import fr.aneo.datalake.client.RetryPolicy;
import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.exception.PathOperationException;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.delayedExecutor;

/**
 * Executes a remote call with exponential backoff retry on transient failures.
 * <p>
 * A failure is transient when it is a {@link PathOperationException} carrying one of the
 * statuses 408, 429, 500, 502, 503 or 504, or caused by an {@link IOException} (connection
 * reset, timeout). Any other failure is returned immediately. No retry is attempted once the
 * cancellation signal has been triggered.
 * <p>
 * The delay before attempt {@code n + 1} is {@code initialBackoff × multiplier^(n - 1)}, capped at
 * {@code maxBackoff}.
 *
 * @see RetryPolicy
 */
public final class RetryableOperation {
  private static final Logger log = LoggerFactory.getLogger(RetryableOperation.class);
  private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

  private RetryableOperation() {
  }

  /**
   * @param operation    supplier issuing one attempt
   * @param policy       retry policy
   * @param cancellation signal of the enclosing operation
   * @param <T>          result type
   * @return the result of the first successful attempt, or the failure of the last one
   */
  public static <T> CompletionStage<T> execute(Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy, CancellationSignal cancellation) {
    requireNonNull(operation, "operation must not be null");
    requireNonNull(policy, "policy must not be null");
    requireNonNull(cancellation, "cancellation must not be null");

    return executeAttempt(operation, policy, cancellation, 1);
  }

  static boolean isRetryable(Throwable throwable) {
    if (throwable instanceof PathOperationException exception) {
      if (RETRYABLE_STATUSES.contains(exception.statusCode())) return true;
      var cause = exception.getCause();
      return exception.statusCode() == 0 && cause instanceof IOException;
    }
    return throwable instanceof IOException;
  }

  private static <T> CompletionStage<T> executeAttempt(Supplier<? extends CompletionStage<T>> operation,
                                                       RetryPolicy policy,
                                                       CancellationSignal cancellation,
                                                       int attempt) {
    return Futures.safely(operation)
                  .exceptionallyCompose(throwable -> {
                    var cause = Futures.unwrap(throwable);
                    if (!shouldRetry(cause, attempt, policy, cancellation)) {
                      return CompletableFuture.failedFuture(cause);
                    }
                    Duration backoff = calculateBackoff(policy, attempt);
                    log.warn("Path operation failed ({}), retrying after backoff. Attempt {}/{}, backoff {} ms",
                      cause.getMessage(), attempt, policy.maxAttempts(), backoff.toMillis());

                    return CompletableFuture.supplyAsync(() -> null, delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS))
                                            .thenCompose(ignored -> executeAttempt(operation, policy, cancellation, attempt + 1));
                  });
  }

  private static boolean shouldRetry(Throwable cause, int attempt, RetryPolicy policy, CancellationSignal cancellation) {
    if (cancellation.isCancelled()) return false;
    if (!isRetryable(cause)) {
      log.debug("Error is not retryable: {}. Failing after attempt {}", cause.getClass().getSimpleName(), attempt);
      return false;
    }
    if (attempt >= policy.maxAttempts()) {
      if (policy.maxAttempts() > 1) log.warn("Max retry attempts exhausted after {} attempts", policy.maxAttempts(), cause);
      return false;
    }
    return true;
  }

  static Duration calculateBackoff(RetryPolicy policy, int attempt) {
    if (attempt <= 1) return policy.initialBackoff();

    var multiplier = Math.pow(policy.backoffMultiplier(), attempt - 1);
    var backoffMillis = (long) (policy.initialBackoff().toMillis() * multiplier);
    return Duration.ofMillis(Math.min(backoffMillis, policy.maxBackoff().toMillis()));
  }
}
