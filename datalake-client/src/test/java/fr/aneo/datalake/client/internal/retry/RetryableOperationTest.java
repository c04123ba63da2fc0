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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryableOperationTest {

  private static final RetryPolicy FAST_RETRY_POLICY = new RetryPolicy(
    3,
    Duration.ofMillis(10),
    Duration.ofMillis(50),
    1.5
  );
  private Supplier<CompletionStage<Object>> operation;

  @Test
  @DisplayName("execute completes successfully on first attempt")
  void execute_completes_successfully_on_first_attempt() {
    // Given
    operation = () -> completedFuture("success");

    // When
    var result = RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("success");
  }

  @ParameterizedTest
  @ValueSource(ints = {408, 429, 500, 502, 503, 504})
  @DisplayName("execute retries on transient statuses and succeeds")
  void execute_retries_on_transient_status_and_succeeds(int status) {
    // Given
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      if (attemptCount.incrementAndGet() < 2) {
        return failedFuture(new PathOperationException("transient", status, null));
      }
      return completedFuture("success");
    };

    // When
    var result = RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("success");
    assertThat(attemptCount.get()).isEqualTo(2);
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 403, 404, 409, 412})
  @DisplayName("execute fails immediately on client errors without retry")
  void execute_fails_immediately_on_client_errors(int status) {
    // Given
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      attemptCount.incrementAndGet();
      return failedFuture(new PathOperationException("rejected", status, "SomeError"));
    };

    // When/Then
    assertThatThrownBy(() -> RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join())
      .isInstanceOf(CompletionException.class)
      .hasCauseInstanceOf(PathOperationException.class);

    assertThat(attemptCount.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("execute retries transport failures without a response")
  void execute_retries_transport_failures() {
    // Given
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      if (attemptCount.incrementAndGet() < 3) {
        return failedFuture(new PathOperationException("no response", new ConnectException("refused")));
      }
      return completedFuture("success");
    };

    // When
    var result = RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("success");
    assertThat(attemptCount.get()).isEqualTo(3);
  }

  @Test
  @DisplayName("execute fails after exhausting max attempts")
  void execute_fails_after_exhausting_max_attempts() {
    // Given
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      attemptCount.incrementAndGet();
      return failedFuture(new PathOperationException("busy", 503, "ServerBusy"));
    };

    // When/Then
    assertThatThrownBy(() -> RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join())
      .isInstanceOf(CompletionException.class)
      .hasCauseInstanceOf(PathOperationException.class);

    assertThat(attemptCount.get()).isEqualTo(3);
  }

  @Test
  @DisplayName("execute does not retry once the operation is cancelled")
  void execute_does_not_retry_when_cancelled() {
    // Given
    var signal = new CancellationSignal();
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      attemptCount.incrementAndGet();
      signal.cancel();
      return failedFuture(new PathOperationException("busy", 503, "ServerBusy"));
    };

    // When/Then
    assertThatThrownBy(() -> RetryableOperation.execute(operation, FAST_RETRY_POLICY, signal).toCompletableFuture().join())
      .hasCauseInstanceOf(PathOperationException.class);

    assertThat(attemptCount.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("execute retries a synchronous throw of a transient failure")
  void execute_retries_synchronous_throw() {
    // Given
    var attemptCount = new AtomicInteger(0);
    operation = () -> {
      if (attemptCount.incrementAndGet() < 2) throw new PathOperationException("throttled", 429, null);
      return completedFuture("success");
    };

    // When
    var result = RetryableOperation.execute(operation, FAST_RETRY_POLICY, CancellationSignal.none()).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("success");
  }

  @Test
  @DisplayName("isRetryable accepts I/O failures and rejects other exceptions")
  void is_retryable_classifies_failures() {
    assertThat(RetryableOperation.isRetryable(new HttpTimeoutException("timeout"))).isTrue();
    assertThat(RetryableOperation.isRetryable(new IOException("reset"))).isTrue();
    assertThat(RetryableOperation.isRetryable(new PathOperationException("wrapped", new IllegalStateException()))).isFalse();
    assertThat(RetryableOperation.isRetryable(new IllegalArgumentException())).isFalse();
  }

  @Test
  @DisplayName("calculateBackoff grows with the multiplier and is capped")
  void calculate_backoff_grows_and_is_capped() {
    var policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(1_000), 2.0);

    assertThat(RetryableOperation.calculateBackoff(policy, 1)).isEqualTo(Duration.ofMillis(100));
    assertThat(RetryableOperation.calculateBackoff(policy, 2)).isEqualTo(Duration.ofMillis(200));
    assertThat(RetryableOperation.calculateBackoff(policy, 3)).isEqualTo(Duration.ofMillis(400));
    assertThat(RetryableOperation.calculateBackoff(policy, 6)).isEqualTo(Duration.ofMillis(1_000));
  }
}
