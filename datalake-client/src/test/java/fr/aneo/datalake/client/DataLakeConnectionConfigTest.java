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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataLakeConnectionConfigTest {

  @Test
  @DisplayName("should apply defaults when built from an endpoint only")
  void should_apply_defaults_from_endpoint() {
    // When
    var config = DataLakeConnectionConfig.forEndpoint("https://account.dfs.core.windows.net/");

    // Then
    assertThat(config.endpoint()).isEqualTo("https://account.dfs.core.windows.net");
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.retryPolicy()).isEqualTo(new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0));
  }

  @Test
  @DisplayName("should keep explicit timeout and retry settings")
  void should_keep_explicit_settings() {
    // When
    var config = new DataLakeConnectionConfig("http://localhost:10000", Duration.ofSeconds(5), 1, Duration.ZERO, 1.0, Duration.ZERO);

    // Then
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.retryPolicy().maxAttempts()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reject an endpoint that is not an http URL")
  void should_reject_non_http_endpoint() {
    assertThatThrownBy(() -> DataLakeConnectionConfig.forEndpoint("ftp://account"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("http");
    assertThatThrownBy(() -> DataLakeConnectionConfig.forEndpoint(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("should reject invalid retry settings")
  void should_reject_invalid_retry_settings() {
    var endpoint = "https://account.dfs.core.windows.net";

    assertThatThrownBy(() -> new DataLakeConnectionConfig(endpoint, null, 0, null, 2.0, null))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DataLakeConnectionConfig(endpoint, null, 3, null, 0.5, null))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DataLakeConnectionConfig(endpoint, null, 3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(1)))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("retryMaxBackoff");
    assertThatThrownBy(() -> new DataLakeConnectionConfig(endpoint, Duration.ZERO, 3, null, 2.0, null))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
