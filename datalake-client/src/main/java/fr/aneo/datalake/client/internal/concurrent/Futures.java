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

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Small helpers around {@link CompletionStage} used by the transfer and ACL engines.
 */
public final class Futures {
  private Futures() {
  }

  /**
   * Invokes a stage supplier, turning a synchronous exception into a failed stage.
   * <p>
   * Remote operations are expected to report failures through the returned stage, but an
   * implementation may also throw before returning one; both paths end up in the stage.
   *
   * @param supplier the supplier to invoke
   * @param <T>      the result type
   * @return the supplied stage, or a failed stage if the supplier threw
   */
  public static <T> CompletionStage<T> safely(Supplier<? extends CompletionStage<T>> supplier) {
    try {
      return supplier.get();
    } catch (RuntimeException e) {
      return failedFuture(e);
    }
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers added by
   * {@code CompletableFuture} composition.
   *
   * @param throwable the throwable received by a completion callback
   * @return the first cause that is not a composition wrapper
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
