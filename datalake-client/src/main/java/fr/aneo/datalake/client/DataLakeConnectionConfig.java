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

import static java.time.temporal.ChronoUnit.SECONDS;
import static java.util.Objects.requireNonNull;

/**
 * Connection configuration of the Data Lake clients.
 *
 * <p>Validation rules:</p>
 * <ul>
 *   <li>{@code endpoint} must be an absolute {@code http} or {@code https} URL.</li>
 *   <li>{@code requestTimeout}, {@code retryInitialBackoff} and {@code retryMaxBackoff} must not be negative.</li>
 *   <li>{@code retryMaxAttempts} must be at least 1.</li>
 *   <li>{@code retryBackoffMultiplier} must be at least 1.0.</li>
 *   <li>{@code retryMaxBackoff} must be greater than or equal to {@code retryInitialBackoff}.</li>
 * </ul>
 *
 * <p>Defaults, applied when the value is {@code null}:</p>
 * <ul>
 *   <li>{@code requestTimeout}: 60s</li>
 *   <li>{@code retryInitialBackoff}: 1s</li>
 *   <li>{@code retryMaxBackoff}: 30s</li>
 * </ul>
 *
 * @param endpoint               DFS endpoint of the account, for instance {@code https://account.dfs.core.windows.net}
 * @param requestTimeout         timeout of a single HTTP exchange
 * @param retryMaxAttempts       total attempts per remote call, the first one included
 * @param retryInitialBackoff    delay before the first retry
 * @param retryBackoffMultiplier factor applied to the delay for successive retries
 * @param retryMaxBackoff        upper bound of the delay between retries
 */
public record DataLakeConnectionConfig(String endpoint,
                                       Duration requestTimeout,
                                       int retryMaxAttempts,
                                       Duration retryInitialBackoff,
                                       double retryBackoffMultiplier,
                                       Duration retryMaxBackoff) {

  public DataLakeConnectionConfig {
    requireNonNull(endpoint, "endpoint must not be null");
    if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
      throw new IllegalArgumentException("endpoint must be an http or https URL, got: " + endpoint);
    }
    endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    requestTimeout = requestTimeout == null ? Duration.of(60, SECONDS) : requestTimeout;
    retryInitialBackoff = retryInitialBackoff == null ? Duration.of(1, SECONDS) : retryInitialBackoff;
    retryMaxBackoff = retryMaxBackoff == null ? Duration.of(30, SECONDS) : retryMaxBackoff;

    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    if (retryMaxAttempts < 1) {
      throw new IllegalArgumentException("retryMaxAttempts must be at least 1");
    }
    if (retryInitialBackoff.isNegative()) {
      throw new IllegalArgumentException("retryInitialBackoff must be positive");
    }
    if (retryBackoffMultiplier < 1.0) {
      throw new IllegalArgumentException("retryBackoffMultiplier must be at least 1.0");
    }
    if (retryMaxBackoff.isNegative()) {
      throw new IllegalArgumentException("retryMaxBackoff must be positive");
    }
    if (retryMaxBackoff.compareTo(retryInitialBackoff) < 0) {
      throw new IllegalArgumentException("retryMaxBackoff must be greater than retryInitialBackoff");
    }
  }

  /**
   * Convenience factory applying the default timeout and retry settings: 3 attempts, backoff
   * from 1s doubling up to 30s.
   *
   * @param endpoint the DFS endpoint URL
   * @return a configuration with default settings
   */
  public static DataLakeConnectionConfig forEndpoint(String endpoint) {
    return new DataLakeConnectionConfig(endpoint, null, 3, null, 2.0, null);
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(retryMaxAttempts, retryInitialBackoff, retryMaxBackoff, retryBackoffMultiplier);
  }
}
