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

import fr.aneo.datalake.client.exception.DataLakeException;
import fr.aneo.datalake.client.internal.concurrent.Batch;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.path.PathOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

import static fr.aneo.datalake.client.transfer.TransferLimits.MAX_BUFFERED_CHUNK_SIZE;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Downloads a byte range of a file as parallel ranged reads.
 * <p>
 * The range is split with the same rules as uploads: fixed-size chunks with a shorter last one.
 * Each chunk is read with one call and written to its own slot of the destination, so chunks
 * may complete in any order. A failed read stops the scheduling of the remaining chunks; the
 * returned stage fails once the reads already in flight have completed.
 */
public final class ChunkedDownloader {
  private static final Logger logger = LoggerFactory.getLogger(ChunkedDownloader.class);

  private final PathOperations operations;

  public ChunkedDownloader(PathOperations operations) {
    this.operations = requireNonNull(operations, "operations must not be null");
  }

  /**
   * Reads the range into a new array.
   *
   * @param options range, chunking and concurrency options
   * @return a stage completing with the bytes of the range
   * @throws IllegalArgumentException if an option is out of bounds
   */
  public CompletionStage<byte[]> readToBuffer(FileReadOptions options) {
    validate(options);
    return resolveCount(options).thenCompose(count -> {
      if (count > MAX_BUFFERED_CHUNK_SIZE) {
        throw new IllegalArgumentException("Range of " + count + " bytes does not fit in a buffer, use readToFile instead");
      }
      var buffer = new byte[(int) (long) count];
      return readChunks(count, options, (chunk, bytes) -> System.arraycopy(bytes, 0, buffer, (int) chunk.offset(), bytes.length))
        .thenApply(done -> buffer);
    });
  }

  /**
   * Reads the range into a new local file.
   * <p>
   * The file is closed once no chunk is being read or written anymore. If the download fails,
   * the partially written file is deleted.
   *
   * @param target  file to create; it must not exist
   * @param options range, chunking and concurrency options
   * @return a stage completing with the number of bytes written
   * @throws IllegalArgumentException if an option is out of bounds
   */
  public CompletionStage<Long> readToFile(Path target, FileReadOptions options) {
    requireNonNull(target, "target must not be null");
    validate(options);
    if (Files.exists(target)) {
      return failedFuture(new DataLakeException("Cannot download to " + target, new FileAlreadyExistsException(target.toString())));
    }

    return resolveCount(options).thenCompose(count -> {
      FileChannel channel;
      try {
        channel = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      } catch (IOException e) {
        throw new DataLakeException("Failed to create " + target, e);
      }
      return readChunks(count, options, (chunk, bytes) -> write(channel, target, chunk.offset(), bytes))
        .whenComplete((done, throwable) -> {
          close(channel, target);
          if (throwable != null) delete(target);
        })
        .thenApply(done -> count);
    });
  }

  private CompletionStage<Void> readChunks(long count, FileReadOptions options, BiConsumer<ChunkTask, byte[]> sink) {
    if (count == 0) return completedFuture(null);

    int concurrency = options.maxConcurrency().orElse(TransferDefaults.concurrency());
    var plan = TransferPlan.of(count, options.chunkSize(), concurrency);
    var cancellation = options.cancellation();
    var transferred = new AtomicLong();

    logger.atDebug()
          .addKeyValue("offset", options.offset())
          .addKeyValue("size", count)
          .addKeyValue("chunks", plan.chunkCount())
          .addKeyValue("concurrency", plan.concurrency())
          .log("Downloading file in chunks");

    var batch = new Batch(plan.concurrency());
    for (var chunk : plan.chunks()) {
      batch.addOperation(() -> Futures.safely(() -> operations.read(options.offset() + chunk.offset(), chunk.length(), options.conditions(), cancellation))
                                      .thenAccept(bytes -> {
                                        if (bytes.length != chunk.length()) {
                                          throw new DataLakeException("Chunk " + chunk.index() + " returned " + bytes.length + " bytes, expected " + chunk.length());
                                        }
                                        sink.accept(chunk, bytes);
                                        long loaded = transferred.addAndGet(bytes.length);
                                        options.progressListener().ifPresent(listener -> listener.onProgress(loaded));
                                      }));
    }
    var outcome = batch.run(cancellation);
    return batch.settled().thenCompose(settled -> outcome);
  }

  private CompletionStage<Long> resolveCount(FileReadOptions options) {
    var count = options.count();
    if (count.isPresent()) return completedFuture(count.getAsLong());

    return Futures.safely(() -> operations.getProperties(options.conditions(), options.cancellation()))
                  .thenApply(properties -> {
                    long remaining = properties.contentLength() - options.offset();
                    if (remaining < 0) {
                      throw new IllegalArgumentException("offset " + options.offset() + " is beyond the end of the file (" + properties.contentLength() + " bytes)");
                    }
                    return remaining;
                  });
  }

  private static void validate(FileReadOptions options) {
    requireNonNull(options, "options must not be null");
    if (options.offset() < 0) throw new IllegalArgumentException("offset must be >= 0, got: " + options.offset());
    options.count().ifPresent(count -> {
      if (count < 0) throw new IllegalArgumentException("count must be >= 0, got: " + count);
    });
    if (options.chunkSize() < 1 || options.chunkSize() > MAX_BUFFERED_CHUNK_SIZE) {
      throw new IllegalArgumentException("chunkSize must be in [1, " + MAX_BUFFERED_CHUNK_SIZE + "], got: " + options.chunkSize());
    }
    options.maxConcurrency().ifPresent(concurrency -> {
      if (concurrency < 1) throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + concurrency);
    });
  }

  private static void write(FileChannel channel, Path target, long position, byte[] bytes) {
    var buffer = ByteBuffer.wrap(bytes);
    try {
      while (buffer.hasRemaining()) {
        channel.write(buffer, position + buffer.position());
      }
    } catch (IOException e) {
      throw new DataLakeException("Failed to write " + bytes.length + " bytes at offset " + position + " to " + target, e);
    }
  }

  private static void close(FileChannel channel, Path target) {
    try {
      channel.close();
    } catch (IOException e) {
      logger.atWarn()
            .addKeyValue("file", target)
            .setCause(e)
            .log("Failed to close downloaded file");
    }
  }

  private static void delete(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      logger.atWarn()
            .addKeyValue("file", target)
            .setCause(e)
            .log("Failed to delete partially downloaded file");
    }
  }
}
