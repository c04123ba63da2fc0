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
package fr.aneo.datalake.client.concurrent;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Cooperative cancellation signal threaded through every remote call of an operation.
 * <p>
 * Orchestrating code checks {@link #isCancelled()} before starting a new batch or chunk, and
 * transports register a callback through {@link #onCancel(Runnable)} to abort their in-flight
 * exchange. Calls already in progress may still complete or fail according to the transport's
 * own cancellation handling.
 * </p>
 * <p>
 * A signal is single-use: once cancelled it stays cancelled. Callbacks registered after
 * cancellation run immediately on the registering thread.
 * </p>
 *
 * <pre>{@code
 * var signal = new CancellationSignal();
 * var upload = fileClient.upload(data, FileUploadOptions.defaults().withCancellation(signal));
 * // later
 * signal.cancel();
 * }</pre>
 */
public final class CancellationSignal {
  private static final CancellationSignal NONE = new CancellationSignal();

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();

  /**
   * Returns a shared signal that is never cancelled by the library.
   * <p>
   * It is used when the caller did not provide a signal. Calling {@link #cancel()} on it is
   * not supported.
   *
   * @return the shared non-cancellable signal
   */
  public static CancellationSignal none() {
    return NONE;
  }

  /**
   * Triggers cancellation and runs the registered callbacks once.
   *
   * @throws UnsupportedOperationException if called on {@link #none()}
   */
  public void cancel() {
    if (this == NONE) throw new UnsupportedOperationException("The shared signal cannot be cancelled");
    if (cancelled.compareAndSet(false, true)) {
      for (var callback : callbacks) {
        if (callbacks.remove(callback)) callback.run();
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws a {@link CancellationException} if the signal has been triggered.
   *
   * @param what short description of the operation being cancelled, used in the message
   */
  public void throwIfCancelled(String what) {
    if (isCancelled()) throw new CancellationException(what + " was cancelled");
  }

  /**
   * Registers a callback to run when the signal is triggered.
   * <p>
   * Callers holding the registration for the duration of a single exchange should remove it once
   * the exchange completed, so that long operations do not accumulate callbacks.
   *
   * @param callback the action to run; must not be {@code null}
   * @return a handle removing the callback
   */
  public Registration onCancel(Runnable callback) {
    requireNonNull(callback, "callback must not be null");
    if (this == NONE) return Registration.NOOP;

    var wrapper = new Runnable() {
      @Override
      public void run() {
        callback.run();
      }
    };
    callbacks.add(wrapper);
    if (cancelled.get() && callbacks.remove(wrapper)) {
      wrapper.run();
    }
    return () -> callbacks.remove(wrapper);
  }

  /**
   * Handle of a callback registered with {@link #onCancel(Runnable)}.
   */
  @FunctionalInterface
  public interface Registration {
    Registration NOOP = () -> {
    };

    /**
     * Removes the callback. Has no effect if it already ran.
     */
    void remove();
  }
}
