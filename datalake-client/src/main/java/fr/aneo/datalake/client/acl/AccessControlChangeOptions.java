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
package fr.aneo.datalake.client.acl;

import fr.aneo.datalake.client.concurrent.CancellationSignal;

import java.util.Optional;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Options of a recursive ACL change.
 * <p>
 * Instances are immutable; each {@code with…} method returns a modified copy.
 * <ul>
 *   <li>{@code batchSize}: maximum number of paths per batch; unset lets the service decide.</li>
 *   <li>{@code maxBatches}: stop after this many batches; unset runs to completion.</li>
 *   <li>{@code continuationToken}: resumes a previous operation.</li>
 *   <li>{@code continueOnFailure}: asks the service to keep going past per-path failures.</li>
 * </ul>
 * Bounds are checked when the operation starts, not here, so that an invalid value fails the
 * operation with {@link IllegalArgumentException} before any remote call.
 */
public final class AccessControlChangeOptions {
  private static final AccessControlChangeOptions DEFAULTS =
    new AccessControlChangeOptions(null, null, null, false, null, CancellationSignal.none());

  private final Integer batchSize;
  private final Integer maxBatches;
  private final String continuationToken;
  private final boolean continueOnFailure;
  private final AccessControlChangeListener progressListener;
  private final CancellationSignal cancellation;

  private AccessControlChangeOptions(Integer batchSize,
                                     Integer maxBatches,
                                     String continuationToken,
                                     boolean continueOnFailure,
                                     AccessControlChangeListener progressListener,
                                     CancellationSignal cancellation) {
    this.batchSize = batchSize;
    this.maxBatches = maxBatches;
    this.continuationToken = continuationToken;
    this.continueOnFailure = continueOnFailure;
    this.progressListener = progressListener;
    this.cancellation = cancellation;
  }

  public static AccessControlChangeOptions defaults() {
    return DEFAULTS;
  }

  public AccessControlChangeOptions withBatchSize(int batchSize) {
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public AccessControlChangeOptions withMaxBatches(int maxBatches) {
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public AccessControlChangeOptions withContinuationToken(String continuationToken) {
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public AccessControlChangeOptions withContinueOnFailure(boolean continueOnFailure) {
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public AccessControlChangeOptions withProgressListener(AccessControlChangeListener progressListener) {
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public AccessControlChangeOptions withCancellation(CancellationSignal cancellation) {
    requireNonNull(cancellation, "cancellation must not be null");
    return new AccessControlChangeOptions(batchSize, maxBatches, continuationToken, continueOnFailure, progressListener, cancellation);
  }

  public OptionalInt batchSize() {
    return batchSize == null ? OptionalInt.empty() : OptionalInt.of(batchSize);
  }

  public OptionalInt maxBatches() {
    return maxBatches == null ? OptionalInt.empty() : OptionalInt.of(maxBatches);
  }

  public Optional<String> continuationToken() {
    return Optional.ofNullable(continuationToken);
  }

  public boolean continueOnFailure() {
    return continueOnFailure;
  }

  public Optional<AccessControlChangeListener> progressListener() {
    return Optional.ofNullable(progressListener);
  }

  public CancellationSignal cancellation() {
    return cancellation;
  }
}
