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
import fr.aneo.datalake.client.path.PathCreateOptions;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Options of an upload. Instances are immutable; each {@code with…} method returns a modified copy.
 * <ul>
 *   <li>{@code chunkSize}: bytes per append; unset derives it from the payload size so that the
 *   upload stays within {@link TransferLimits#MAX_BLOCK_COUNT} appends.</li>
 *   <li>{@code maxConcurrency}: appends in flight; unset uses {@link TransferDefaults#concurrency()}.</li>
 *   <li>{@code singleUploadThreshold}: payloads up to this size are sent in one append; unset uses
 *   {@link TransferLimits#MAX_SINGLE_UPLOAD_THRESHOLD}.</li>
 *   <li>{@code close}: raises a close event with the final flush.</li>
 *   <li>{@code createOptions}: metadata, permissions and conditions of the file creation. Only the
 *   lease id of the conditions is forwarded to appends and flush.</li>
 * </ul>
 * Bounds are checked when the upload starts.
 */
public final class FileUploadOptions {
  private static final FileUploadOptions DEFAULTS =
    new FileUploadOptions(null, null, null, false, PathCreateOptions.defaults(), null, CancellationSignal.none());

  private final Long chunkSize;
  private final Integer maxConcurrency;
  private final Long singleUploadThreshold;
  private final boolean close;
  private final PathCreateOptions createOptions;
  private final TransferProgressListener progressListener;
  private final CancellationSignal cancellation;

  private FileUploadOptions(Long chunkSize,
                            Integer maxConcurrency,
                            Long singleUploadThreshold,
                            boolean close,
                            PathCreateOptions createOptions,
                            TransferProgressListener progressListener,
                            CancellationSignal cancellation) {
    this.chunkSize = chunkSize;
    this.maxConcurrency = maxConcurrency;
    this.singleUploadThreshold = singleUploadThreshold;
    this.close = close;
    this.createOptions = createOptions;
    this.progressListener = progressListener;
    this.cancellation = cancellation;
  }

  public static FileUploadOptions defaults() {
    return DEFAULTS;
  }

  public FileUploadOptions withChunkSize(long chunkSize) {
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withMaxConcurrency(int maxConcurrency) {
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withSingleUploadThreshold(long singleUploadThreshold) {
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withClose(boolean close) {
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withCreateOptions(PathCreateOptions createOptions) {
    requireNonNull(createOptions, "createOptions must not be null");
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withProgressListener(TransferProgressListener progressListener) {
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public FileUploadOptions withCancellation(CancellationSignal cancellation) {
    requireNonNull(cancellation, "cancellation must not be null");
    return new FileUploadOptions(chunkSize, maxConcurrency, singleUploadThreshold, close, createOptions, progressListener, cancellation);
  }

  public OptionalLong chunkSize() {
    return chunkSize == null ? OptionalLong.empty() : OptionalLong.of(chunkSize);
  }

  public OptionalInt maxConcurrency() {
    return maxConcurrency == null ? OptionalInt.empty() : OptionalInt.of(maxConcurrency);
  }

  public OptionalLong singleUploadThreshold() {
    return singleUploadThreshold == null ? OptionalLong.empty() : OptionalLong.of(singleUploadThreshold);
  }

  public boolean close() {
    return close;
  }

  public PathCreateOptions createOptions() {
    return createOptions;
  }

  public Optional<TransferProgressListener> progressListener() {
    return Optional.ofNullable(progressListener);
  }

  public CancellationSignal cancellation() {
    return cancellation;
  }
}
