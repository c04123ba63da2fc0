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

import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.path.AccessConditions;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Options of a parallel download. Instances are immutable.
 * <p>
 * Without {@code count}, the range extends from {@code offset} to the end of the file, whose
 * length is read from the path properties first.
 */
public final class FileReadOptions {
  private static final FileReadOptions DEFAULTS =
    new FileReadOptions(0, null, TransferLimits.DEFAULT_READ_CHUNK_SIZE, null, AccessConditions.none(), null, CancellationSignal.none());

  private final long offset;
  private final Long count;
  private final long chunkSize;
  private final Integer maxConcurrency;
  private final AccessConditions conditions;
  private final TransferProgressListener progressListener;
  private final CancellationSignal cancellation;

  private FileReadOptions(long offset,
                          Long count,
                          long chunkSize,
                          Integer maxConcurrency,
                          AccessConditions conditions,
                          TransferProgressListener progressListener,
                          CancellationSignal cancellation) {
    this.offset = offset;
    this.count = count;
    this.chunkSize = chunkSize;
    this.maxConcurrency = maxConcurrency;
    this.conditions = conditions;
    this.progressListener = progressListener;
    this.cancellation = cancellation;
  }

  public static FileReadOptions defaults() {
    return DEFAULTS;
  }

  public FileReadOptions withRange(long offset, long count) {
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withOffset(long offset) {
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withChunkSize(long chunkSize) {
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withMaxConcurrency(int maxConcurrency) {
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withConditions(AccessConditions conditions) {
    requireNonNull(conditions, "conditions must not be null");
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withProgressListener(TransferProgressListener progressListener) {
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public FileReadOptions withCancellation(CancellationSignal cancellation) {
    requireNonNull(cancellation, "cancellation must not be null");
    return new FileReadOptions(offset, count, chunkSize, maxConcurrency, conditions, progressListener, cancellation);
  }

  public long offset() {
    return offset;
  }

  public OptionalLong count() {
    return count == null ? OptionalLong.empty() : OptionalLong.of(count);
  }

  public long chunkSize() {
    return chunkSize;
  }

  public OptionalInt maxConcurrency() {
    return maxConcurrency == null ? OptionalInt.empty() : OptionalInt.of(maxConcurrency);
  }

  public AccessConditions conditions() {
    return conditions;
  }

  public Optional<TransferProgressListener> progressListener() {
    return Optional.ofNullable(progressListener);
  }

  public CancellationSignal cancellation() {
    return cancellation;
  }
}
