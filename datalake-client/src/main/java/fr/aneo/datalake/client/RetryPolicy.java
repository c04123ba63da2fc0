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
package fr.aneo.datalake.client;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Exponential backoff applied to remote path calls failing with a transient error.
 *
 * @param maxAttempts       total number of attempts, the first one included; {@code 1} disables retries
 * @param initialBackoff    delay before the second attempt
 * @param maxBackoff        upper bound of the delay between two attempts
 * @param backoffMultiplier factor applied to the delay after each failed attempt
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double backoffMultiplier) {

  public RetryPolicy {
    requireNonNull(initialBackoff, "initialBackoff must not be null");
    requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
  }

  /**
   * @return a policy making a single attempt
   */
  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
  }
}
