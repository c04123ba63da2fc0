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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuturesTest {

  @Test
  @DisplayName("safely returns the supplied stage")
  void safely_returns_the_supplied_stage() {
    // When
    var result = Futures.safely(() -> completedFuture("A")).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("A");
  }

  @Test
  @DisplayName("safely turns a synchronous exception into a failed stage")
  void safely_turns_a_synchronous_exception_into_a_failed_stage() {
    // When
    var stage = Futures.<String>safely(() -> {
      throw new IllegalStateException("boom");
    }).toCompletableFuture();

    // Then
    assertThatThrownBy(stage::join)
      .isInstanceOf(CompletionException.class)
      .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("unwrap strips nested composition wrappers")
  void unwrap_strips_nested_composition_wrappers() {
    // Given
    var root = new IllegalArgumentException("root");
    var wrapped = new CompletionException(new ExecutionException(root));

    // When / Then
    assertThat(Futures.unwrap(wrapped)).isSameAs(root);
    assertThat(Futures.unwrap(root)).isSameAs(root);
  }
}
