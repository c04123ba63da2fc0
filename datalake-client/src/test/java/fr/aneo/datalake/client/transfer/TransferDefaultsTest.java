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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static fr.aneo.datalake.client.transfer.TransferDefaults.ENV_DEFAULT_CONCURRENCY;
import static org.assertj.core.api.Assertions.assertThat;
import static uk.org.webcompere.systemstubs.SystemStubs.withEnvironmentVariables;

class TransferDefaultsTest {

  @AfterEach
  void tearDown() {
    TransferDefaults.loadConcurrency();
  }

  @Test
  @DisplayName("should use the configured concurrency when the variable holds a positive number")
  void should_use_configured_concurrency() throws Exception {
    withEnvironmentVariables(ENV_DEFAULT_CONCURRENCY, " 12 ")
      .execute(() -> {
        // When
        TransferDefaults.loadConcurrency();

        // Then
        assertThat(TransferDefaults.concurrency()).isEqualTo(12);
      });
  }

  @Test
  @DisplayName("should fall back to the default when the variable is blank")
  void should_fall_back_when_blank() throws Exception {
    withEnvironmentVariables(ENV_DEFAULT_CONCURRENCY, "  ")
      .execute(() -> {
        TransferDefaults.loadConcurrency();

        assertThat(TransferDefaults.concurrency()).isEqualTo(TransferDefaults.DEFAULT_CONCURRENCY);
      });
  }

  @Test
  @DisplayName("should fall back to the default when the variable is not positive")
  void should_fall_back_when_not_positive() throws Exception {
    withEnvironmentVariables(ENV_DEFAULT_CONCURRENCY, "0")
      .execute(() -> {
        TransferDefaults.loadConcurrency();

        assertThat(TransferDefaults.concurrency()).isEqualTo(TransferDefaults.DEFAULT_CONCURRENCY);
      });
  }

  @Test
  @DisplayName("should fall back to the default when the variable is not a number")
  void should_fall_back_when_not_a_number() throws Exception {
    withEnvironmentVariables(ENV_DEFAULT_CONCURRENCY, "many")
      .execute(() -> {
        TransferDefaults.loadConcurrency();

        assertThat(TransferDefaults.concurrency()).isEqualTo(TransferDefaults.DEFAULT_CONCURRENCY);
      });
  }
}
