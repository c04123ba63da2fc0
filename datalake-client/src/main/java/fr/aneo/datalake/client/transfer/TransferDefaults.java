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
package fr.aneo.datalake.client.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide transfer defaults.
 *
 * <h2>Configuration</h2>
 * <p>
 * Set {@code DATALAKE_CLIENT_DEFAULT_CONCURRENCY} to change the number of chunks transferred in
 * parallel when an operation does not specify it:
 * </p>
 * <pre>
 * export DATALAKE_CLIENT_DEFAULT_CONCURRENCY=8
 * </pre>
 * <p>
 * Missing, non-numeric or non-positive values fall back to {@value #DEFAULT_CONCURRENCY}.
 * </p>
 */
public final class TransferDefaults {
  private static final Logger logger = LoggerFactory.getLogger(TransferDefaults.class);

  static final String ENV_DEFAULT_CONCURRENCY = "DATALAKE_CLIENT_DEFAULT_CONCURRENCY";
  public static final int DEFAULT_CONCURRENCY = 5;

  private static volatile int concurrency;

  static {
    loadConcurrency();
  }

  private TransferDefaults() {
  }

  /**
   * Reads the default concurrency from the environment.
   * <p>
   * Called from the static initializer; tests call it again after changing the environment.
   * </p>
   */
  static void loadConcurrency() {
    var envValue = System.getenv(ENV_DEFAULT_CONCURRENCY);

    if (envValue == null || envValue.trim().isEmpty()) {
      logger.debug("Using default transfer concurrency: {}", DEFAULT_CONCURRENCY);
      concurrency = DEFAULT_CONCURRENCY;
      return;
    }
    try {
      int value = Integer.parseInt(envValue.trim());
      if (value <= 0) {
        logger.warn("Invalid transfer concurrency in {}: {} (must be positive). Using default: {}", ENV_DEFAULT_CONCURRENCY, envValue, DEFAULT_CONCURRENCY);
        concurrency = DEFAULT_CONCURRENCY;
      } else {
        logger.info("Using configured transfer concurrency: {}", value);
        concurrency = value;
      }
    } catch (NumberFormatException e) {
      logger.warn("Invalid number format for {}: {}. Using default: {}", ENV_DEFAULT_CONCURRENCY, envValue, DEFAULT_CONCURRENCY);
      concurrency = DEFAULT_CONCURRENCY;
    }
  }

  public static int concurrency() {
    return concurrency;
  }
}
