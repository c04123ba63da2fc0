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

import com.google.common.math.LongMath;
import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.exception.DataLakeException;
import fr.aneo.datalake.client.internal.concurrent.Batch;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathOperations;
import fr.aneo.datalake.client.path.PathResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.RoundingMode;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static fr.aneo.datalake.client.transfer.TransferLimits.DEFAULT_CHUNK_SIZE;
import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_BLOCK_COUNT;
import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_BUFFERED_CHUNK_SIZE;
import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_CHUNK_SIZE;
import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_FILE_SIZE;
import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_SINGLE_UPLOAD_THRESHOLD;
import static java.util.Objects.requireNonNull;

/**
 * Uploads a payload to a file as one create, a series of appends and one flush.
 * <p>
 * Payloads of unknown length are uploaded from a stream with {@link #uploadStream}; the rest of
 * this description applies to payloads of known size.
 * </p>
 * <p>
 * Depending on the payload size:
 * <ul>
 *   <li>empty: the file is only created;</li>
 *   <li>up to the single-upload threshold: create, one append of the whole payload, flush;</li>
 *   <li>larger: create, then one append per chunk with at most {@code maxConcurrency} appends
 *   in flight, then flush at the payload size.</li>
 * </ul>
 * Every option is validated before the file is created. A failed append stops the scheduling
 * of the remaining chunks and fails the upload; the file is left created and unflushed.
 * </p>
 * <p>
 * The create call receives every access condition of the options. The following appends and
 * flush only receive the lease id since each call changes the ETag of the file.
 * </p>
 */
public final class ChunkedUploader {
  private static final Logger logger = LoggerFactory.getLogger(ChunkedUploader.class);

  private final PathOperations operations;

  public ChunkedUploader(PathOperations operations) {
    this.operations = requireNonNull(operations, "operations must not be null");
  }

  /**
   * Uploads the payload, replacing the file content.
   *
   * @param data    payload to upload
   * @param options chunking, concurrency and creation options
   * @return a stage completing with the final flush response and the transfer metadata
   * @throws IllegalArgumentException if the payload is too large or an option is out of bounds
   */
  public CompletionStage<FileUploadResult> upload(SeekableData data, FileUploadOptions options) {
    requireNonNull(data, "data must not be null");
    requireNonNull(options, "options must not be null");

    long size = data.size();
    if (size > MAX_FILE_SIZE) {
      throw new IllegalArgumentException("Payload of " + size + " bytes exceeds the maximum file size of " + MAX_FILE_SIZE + " bytes");
    }
    long chunkSize = options.chunkSize().orElse(Math.max(DEFAULT_CHUNK_SIZE, LongMath.divide(size, MAX_BLOCK_COUNT, RoundingMode.CEILING)));
    if (chunkSize < 1 || chunkSize > MAX_CHUNK_SIZE) {
      throw new IllegalArgumentException("chunkSize must be in [1, " + MAX_CHUNK_SIZE + "], got: " + chunkSize);
    }
    int concurrency = options.maxConcurrency().orElse(TransferDefaults.concurrency());
    if (concurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + concurrency);
    }
    long threshold = options.singleUploadThreshold().orElse(MAX_SINGLE_UPLOAD_THRESHOLD);
    if (threshold < 1 || threshold > MAX_SINGLE_UPLOAD_THRESHOLD) {
      throw new IllegalArgumentException("singleUploadThreshold must be in [1, " + MAX_SINGLE_UPLOAD_THRESHOLD + "], got: " + threshold);
    }

    if (size == 0) {
      return create(options).thenApply(created -> new FileUploadResult(created, 0, chunkSize, 0));
    }
    if (size <= threshold) {
      return uploadInOneShot(data, size, chunkSize, options);
    }

    var plan = TransferPlan.of(size, chunkSize, concurrency);
    if (plan.chunkCount() > MAX_BLOCK_COUNT) {
      throw new IllegalArgumentException("Upload of " + size + " bytes in chunks of " + chunkSize + " bytes needs "
                                         + plan.chunkCount() + " appends, more than the maximum of " + MAX_BLOCK_COUNT);
    }
    if (Math.min(chunkSize, size) > MAX_BUFFERED_CHUNK_SIZE) {
      throw new IllegalArgumentException("chunkSize " + chunkSize + " cannot be buffered in memory, it must not exceed " + MAX_BUFFERED_CHUNK_SIZE);
    }
    return uploadInChunks(data, plan, options);
  }

  private CompletionStage<FileUploadResult> uploadInOneShot(SeekableData data, long size, long chunkSize, FileUploadOptions options) {
    var cancellation = options.cancellation();
    var followUpConditions = options.createOptions().conditions().leaseOnly();

    logger.atDebug()
          .addKeyValue("size", size)
          .log("Uploading file in a single append");

    return create(options)
      .thenCompose(created -> {
        cancellation.throwIfCancelled("Upload");
        return operations.appendData(0, data.read(0, (int) size), followUpConditions, cancellation);
      })
      .thenCompose(appended -> {
        options.progressListener().ifPresent(listener -> listener.onProgress(size));
        return flush(size, options, followUpConditions, cancellation);
      })
      .thenApply(flushed -> new FileUploadResult(flushed, size, chunkSize, 1));
  }

  private CompletionStage<FileUploadResult> uploadInChunks(SeekableData data, TransferPlan plan, FileUploadOptions options) {
    var cancellation = options.cancellation();
    var followUpConditions = options.createOptions().conditions().leaseOnly();
    var transferred = new AtomicLong();

    logger.atDebug()
          .addKeyValue("size", plan.totalSize())
          .addKeyValue("chunkSize", plan.chunkSize())
          .addKeyValue("chunks", plan.chunkCount())
          .addKeyValue("concurrency", plan.concurrency())
          .log("Uploading file in chunks");

    return create(options)
      .thenCompose(created -> {
        var batch = new Batch(plan.concurrency());
        for (var chunk : plan.chunks()) {
          batch.addOperation(() -> appendChunk(data, chunk, followUpConditions, cancellation)
            .thenRun(() -> {
              long loaded = transferred.addAndGet(chunk.length());
              options.progressListener().ifPresent(listener -> listener.onProgress(loaded));
            }));
        }
        return batch.run(cancellation);
      })
      .thenCompose(appended -> flush(plan.totalSize(), options, followUpConditions, cancellation))
      .thenApply(flushed -> new FileUploadResult(flushed, plan.totalSize(), plan.chunkSize(), plan.chunkCount()));
  }

  /**
   * Uploads a stream of unknown length, replacing the file content.
   * <p>
   * The file is created first. The stream is then read in chunks of {@code chunkSize} bytes
   * ({@link TransferLimits#DEFAULT_CHUNK_SIZE} by default), each chunk being appended as soon as
   * it is read. A chunk is only read when an append slot is free, so at most
   * {@code maxConcurrency} chunks are held in memory. Once the stream is exhausted and every
   * append succeeded, the file is flushed at the number of bytes appended.
   * </p>
   * <p>
   * Chunks after the first ones are read on the threads completing the appends. The stream is
   * not closed. A read error or a stream needing more than {@link TransferLimits#MAX_BLOCK_COUNT}
   * appends fails the upload with a {@link DataLakeException}; the file is left unflushed.
   * </p>
   *
   * @param stream  forward-only source of the payload
   * @param options chunking, concurrency and creation options; the single-upload threshold is ignored
   * @return a stage completing with the final flush response and the transfer metadata
   * @throws IllegalArgumentException if an option is out of bounds
   */
  public CompletionStage<FileUploadResult> uploadStream(InputStream stream, FileUploadOptions options) {
    requireNonNull(stream, "stream must not be null");
    requireNonNull(options, "options must not be null");

    long chunkSize = options.chunkSize().orElse(DEFAULT_CHUNK_SIZE);
    if (chunkSize < 1 || chunkSize > MAX_BUFFERED_CHUNK_SIZE) {
      throw new IllegalArgumentException("chunkSize must be in [1, " + MAX_BUFFERED_CHUNK_SIZE + "], got: " + chunkSize);
    }
    int concurrency = options.maxConcurrency().orElse(TransferDefaults.concurrency());
    if (concurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + concurrency);
    }

    var cancellation = options.cancellation();
    var followUpConditions = options.createOptions().conditions().leaseOnly();
    var transferred = new AtomicLong();

    logger.atDebug()
          .addKeyValue("chunkSize", chunkSize)
          .addKeyValue("concurrency", concurrency)
          .log("Uploading stream in chunks");

    var chunks = new StreamChunks(stream, (int) chunkSize, followUpConditions, cancellation, transferred, options);
    return create(options)
      .thenCompose(created -> new Batch(concurrency).run(chunks, cancellation))
      .thenCompose(appended -> flush(transferred.get(), options, followUpConditions, cancellation))
      .thenApply(flushed -> new FileUploadResult(flushed, transferred.get(), chunkSize, chunks.count()));
  }

  private CompletionStage<Void> appendChunk(SeekableData data, ChunkTask chunk, AccessConditions conditions, CancellationSignal cancellation) {
    return Futures.safely(() -> {
      var bytes = data.read(chunk.offset(), (int) chunk.length());
      return operations.appendData(chunk.offset(), bytes, conditions, cancellation);
    });
  }

  private CompletionStage<PathInfo> create(FileUploadOptions options) {
    return Futures.safely(() -> operations.create(PathResourceType.FILE, options.createOptions(), options.cancellation()));
  }

  private CompletionStage<PathInfo> flush(long size, FileUploadOptions options, AccessConditions conditions, CancellationSignal cancellation) {
    cancellation.throwIfCancelled("Upload");
    return operations.flushData(size, options.close(), conditions, cancellation);
  }

  /**
   * Appends of a stream, read one chunk at a time when the batch asks for the next append.
   */
  private final class StreamChunks implements Iterator<Supplier<CompletionStage<Void>>> {
    private final InputStream stream;
    private final int chunkSize;
    private final AccessConditions conditions;
    private final CancellationSignal cancellation;
    private final AtomicLong transferred;
    private final FileUploadOptions options;

    private byte[] pending;
    private boolean ended;
    private long position;
    private volatile int count;

    private StreamChunks(InputStream stream,
                         int chunkSize,
                         AccessConditions conditions,
                         CancellationSignal cancellation,
                         AtomicLong transferred,
                         FileUploadOptions options) {
      this.stream = stream;
      this.chunkSize = chunkSize;
      this.conditions = conditions;
      this.cancellation = cancellation;
      this.transferred = transferred;
      this.options = options;
    }

    int count() {
      return count;
    }

    @Override
    public boolean hasNext() {
      if (pending == null && !ended) pending = readChunk();
      return pending != null;
    }

    @Override
    public Supplier<CompletionStage<Void>> next() {
      if (!hasNext()) throw new NoSuchElementException();
      if (count == MAX_BLOCK_COUNT) {
        throw new DataLakeException("Stream needs more than the maximum of " + MAX_BLOCK_COUNT + " appends of " + chunkSize + " bytes");
      }
      var bytes = pending;
      long offset = position;
      pending = null;
      position += bytes.length;
      count++;
      return () -> Futures.safely(() -> operations.appendData(offset, bytes, conditions, cancellation))
                          .thenRun(() -> {
                            long loaded = transferred.addAndGet(bytes.length);
                            options.progressListener().ifPresent(listener -> listener.onProgress(loaded));
                          });
    }

    private byte[] readChunk() {
      byte[] bytes;
      try {
        bytes = stream.readNBytes(chunkSize);
      } catch (IOException e) {
        throw new DataLakeException("Failed to read the upload stream at offset " + position, e);
      }
      if (bytes.length < chunkSize) ended = true;
      return bytes.length == 0 ? null : bytes;
    }
  }
}
