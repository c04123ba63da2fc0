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
import fr.aneo.datalake.client.exception.DataLakeException;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.testutils.InMemoryPathOperations;
import org.jmock.lib.concurrent.DeterministicScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static fr.aneo.datalake.client.testutils.InMemoryPathOperations.Append;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkedUploaderTest {

  private DeterministicScheduler scheduler;
  private InMemoryPathOperations operations;
  private ChunkedUploader uploader;

  @BeforeEach
  void setUp() {
    scheduler = new DeterministicScheduler();
    operations = new InMemoryPathOperations(scheduler);
    uploader = new ChunkedUploader(operations);
  }

  @Test
  @DisplayName("upload of an empty payload only creates the file")
  void upload_of_empty_payload_only_creates_the_file() {
    // When
    var result = uploader.upload(InMemoryData.from(new byte[0]), FileUploadOptions.defaults()).toCompletableFuture().join();

    // Then
    assertThat(operations.calls).containsExactly("create:file");
    assertThat(result.totalSize()).isZero();
    assertThat(result.chunkCount()).isZero();
  }

  @Test
  @DisplayName("upload below the threshold sends the whole payload in one append then flushes")
  void upload_below_threshold_is_single_shot() {
    // Given
    var data = randomBytes(1000);
    var progress = new ArrayList<Long>();

    // When
    var stage = uploader.upload(InMemoryData.from(data), FileUploadOptions.defaults().withProgressListener(progress::add))
                        .toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    var result = stage.join();
    assertThat(operations.calls).containsExactly("create:file", "append:0:1000", "flush:1000:false");
    assertThat(operations.content).isEqualTo(data);
    assertThat(progress).containsExactly(1000L);
    assertThat(result.chunkCount()).isEqualTo(1);
    assertThat(result.pathInfo().contentLength()).isEqualTo(1000);
  }

  @Test
  @DisplayName("upload above the threshold appends fixed-size chunks and flushes at the total size")
  void upload_above_threshold_appends_chunks() {
    // Given
    var data = randomBytes(10_000_000);
    var options = FileUploadOptions.defaults()
                                   .withChunkSize(4_000_000)
                                   .withMaxConcurrency(3)
                                   .withSingleUploadThreshold(1_000_000);

    // When
    var stage = uploader.upload(InMemoryData.from(data), options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    var result = stage.join();
    assertThat(operations.appends).containsExactlyInAnyOrder(
      new Append(0, 4_000_000),
      new Append(4_000_000, 4_000_000),
      new Append(8_000_000, 2_000_000));
    assertThat(operations.calls.get(0)).isEqualTo("create:file");
    assertThat(operations.calls.get(operations.calls.size() - 1)).isEqualTo("flush:10000000:false");
    assertThat(operations.content).isEqualTo(data);
    assertThat(result.chunkCount()).isEqualTo(3);
    assertThat(result.chunkSize()).isEqualTo(4_000_000);
  }

  @Test
  @DisplayName("upload never has more appends in flight than the configured concurrency")
  void upload_respects_max_concurrency() {
    // Given
    var options = FileUploadOptions.defaults()
                                   .withChunkSize(10)
                                   .withMaxConcurrency(4)
                                   .withSingleUploadThreshold(1);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(1_005)), options).toCompletableFuture();

    // Then
    assertThat(operations.inFlight()).isEqualTo(4);
    scheduler.runUntilIdle();
    assertThat(stage.join().chunkCount()).isEqualTo(101);
    assertThat(operations.appends).hasSize(101);
    assertThat(operations.appends.stream().mapToLong(Append::length).sum()).isEqualTo(1_005);
    assertThat(operations.maxInFlight()).isEqualTo(4);
  }

  @Test
  @DisplayName("upload reports non-decreasing progress ending at the total size")
  void upload_reports_monotonic_progress() {
    // Given
    var progress = Collections.synchronizedList(new ArrayList<Long>());
    var options = FileUploadOptions.defaults()
                                   .withChunkSize(100)
                                   .withMaxConcurrency(3)
                                   .withSingleUploadThreshold(1)
                                   .withProgressListener(progress::add);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(950)), options).toCompletableFuture();
    scheduler.runUntilIdle();
    stage.join();

    // Then
    assertThat(progress).hasSize(10).isSorted();
    assertThat(progress.get(progress.size() - 1)).isEqualTo(950L);
  }

  @Test
  @DisplayName("upload forwards every condition to create and only the lease to appends and flush")
  void upload_forwards_only_lease_after_create() {
    // Given
    var conditions = new AccessConditions("lease-1", "\"etag\"", null, OffsetDateTime.now(), null);
    var options = FileUploadOptions.defaults()
                                   .withCreateOptions(PathCreateOptions.defaults().withConditions(conditions))
                                   .withChunkSize(10)
                                   .withSingleUploadThreshold(1);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(25)), options).toCompletableFuture();
    scheduler.runUntilIdle();
    stage.join();

    // Then
    assertThat(operations.conditions.get(0)).isEqualTo(conditions);
    assertThat(operations.conditions.subList(1, operations.conditions.size())).containsOnly(AccessConditions.lease("lease-1"));
  }

  @Test
  @DisplayName("upload rejects invalid options before creating the file")
  void upload_rejects_invalid_options_before_any_call() {
    var data = InMemoryData.from(randomBytes(10));

    assertThatThrownBy(() -> uploader.upload(data, FileUploadOptions.defaults().withChunkSize(0))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> uploader.upload(data, FileUploadOptions.defaults().withChunkSize(TransferLimits.MAX_CHUNK_SIZE + 1)))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> uploader.upload(data, FileUploadOptions.defaults().withMaxConcurrency(0))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> uploader.upload(data, FileUploadOptions.defaults().withSingleUploadThreshold(0))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> uploader.upload(data, FileUploadOptions.defaults().withSingleUploadThreshold(TransferLimits.MAX_SINGLE_UPLOAD_THRESHOLD + 1)))
      .isInstanceOf(IllegalArgumentException.class);

    assertThat(operations.calls).isEmpty();
  }

  @Test
  @DisplayName("upload rejects a payload larger than the maximum file size")
  void upload_rejects_oversized_payload() {
    // Given
    var huge = new SeekableData() {
      @Override
      public long size() {
        return TransferLimits.MAX_FILE_SIZE + 1;
      }

      @Override
      public byte[] read(long offset, int length) {
        throw new AssertionError("must not be read");
      }
    };

    // When / Then
    assertThatThrownBy(() -> uploader.upload(huge, FileUploadOptions.defaults())).isInstanceOf(IllegalArgumentException.class);
    assertThat(operations.calls).isEmpty();
  }

  @Test
  @DisplayName("upload rejects a chunk size needing more appends than the service accepts")
  void upload_rejects_too_many_chunks() {
    // Given
    var options = FileUploadOptions.defaults().withChunkSize(1).withSingleUploadThreshold(1);

    // When / Then
    assertThatThrownBy(() -> uploader.upload(InMemoryData.from(new byte[TransferLimits.MAX_BLOCK_COUNT + 1]), options))
      .isInstanceOf(IllegalArgumentException.class);
    assertThat(operations.calls).isEmpty();
  }

  @Test
  @DisplayName("upload fails with the append error, stops scheduling and never flushes")
  void upload_fails_on_append_error_without_flush() {
    // Given
    var failure = InMemoryPathOperations.serviceError(400, "InvalidInput");
    operations.appendFailures.put(10L, failure);
    var options = FileUploadOptions.defaults().withChunkSize(10).withMaxConcurrency(2).withSingleUploadThreshold(1);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(100)), options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThatThrownBy(stage::join).hasCause(failure);
    assertThat(operations.calls).noneMatch(call -> call.startsWith("flush"));
    assertThat(operations.appends.size()).isLessThan(10);
  }

  @Test
  @DisplayName("upload stops submitting chunks once cancelled")
  void upload_stops_when_cancelled() {
    // Given
    var signal = new CancellationSignal();
    var options = FileUploadOptions.defaults()
                                   .withChunkSize(10)
                                   .withMaxConcurrency(1)
                                   .withSingleUploadThreshold(1)
                                   .withCancellation(signal);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(100)), options).toCompletableFuture();
    scheduler.runNextPendingCommand();
    signal.cancel();
    scheduler.runUntilIdle();

    // Then
    assertThatThrownBy(stage::join).hasCauseInstanceOf(CancellationException.class);
    assertThat(operations.appends).hasSize(2);
    assertThat(operations.calls).noneMatch(call -> call.startsWith("flush"));
  }

  @Test
  @DisplayName("upload derives the default chunk size from the payload size")
  void upload_derives_default_chunk_size() {
    // Given
    var options = FileUploadOptions.defaults().withSingleUploadThreshold(1);

    // When
    var stage = uploader.upload(InMemoryData.from(randomBytes(20)), options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThat(stage.join().chunkSize()).isEqualTo(TransferLimits.DEFAULT_CHUNK_SIZE);
    assertThat(operations.appends).containsExactly(new Append(0, 20));
  }

  @Test
  @DisplayName("uploadStream appends chunks read from the stream and flushes at the number of bytes appended")
  void upload_stream_appends_chunks_and_flushes_at_bytes_appended() {
    // Given
    var data = randomBytes(25);
    var progress = Collections.synchronizedList(new ArrayList<Long>());
    var options = FileUploadOptions.defaults().withChunkSize(10).withMaxConcurrency(2).withProgressListener(progress::add);

    // When
    var stage = uploader.uploadStream(new ByteArrayInputStream(data), options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    var result = stage.join();
    assertThat(operations.appends).containsExactly(new Append(0, 10), new Append(10, 10), new Append(20, 5));
    assertThat(operations.calls).first().isEqualTo("create:file");
    assertThat(operations.calls).last().isEqualTo("flush:25:false");
    assertThat(operations.content).isEqualTo(data);
    assertThat(operations.maxInFlight()).isEqualTo(2);
    assertThat(progress).isSorted().last().isEqualTo(25L);
    assertThat(result.totalSize()).isEqualTo(25);
    assertThat(result.chunkSize()).isEqualTo(10);
    assertThat(result.chunkCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("uploadStream reads a new chunk only when an append slot is free")
  void upload_stream_bounds_buffered_chunks() {
    // Given
    var stream = new TrackedStream(randomBytes(100));
    var options = FileUploadOptions.defaults().withChunkSize(10).withMaxConcurrency(3);

    // When
    var stage = uploader.uploadStream(stream, options).toCompletableFuture();

    // Then
    assertThat(stream.consumed()).isEqualTo(30);
    assertThat(operations.inFlight()).isEqualTo(3);

    scheduler.runNextPendingCommand();
    assertThat(stream.consumed()).isEqualTo(40);

    scheduler.runUntilIdle();
    assertThat(stage.join().chunkCount()).isEqualTo(10);
    assertThat(operations.maxInFlight()).isEqualTo(3);
    assertThat(operations.calls).last().isEqualTo("flush:100:false");
  }

  @Test
  @DisplayName("uploadStream of an empty stream creates the file and flushes at zero")
  void upload_stream_of_empty_stream() {
    // When
    var result = uploader.uploadStream(new ByteArrayInputStream(new byte[0]), FileUploadOptions.defaults())
                         .toCompletableFuture().join();

    // Then
    assertThat(operations.calls).containsExactly("create:file", "flush:0:false");
    assertThat(result.chunkCount()).isZero();
    assertThat(result.chunkSize()).isEqualTo(TransferLimits.DEFAULT_CHUNK_SIZE);
  }

  @Test
  @DisplayName("uploadStream fails when the stream cannot be read and never flushes")
  void upload_stream_fails_on_read_error() {
    // Given
    var stream = new InputStream() {
      private int served;

      @Override
      public int read() throws IOException {
        if (served == 10) throw new IOException("device unavailable");
        served++;
        return 1;
      }
    };
    var options = FileUploadOptions.defaults().withChunkSize(10).withMaxConcurrency(2);

    // When
    var stage = uploader.uploadStream(stream, options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThatThrownBy(stage::join)
      .hasCauseInstanceOf(DataLakeException.class)
      .hasRootCauseMessage("device unavailable");
    assertThat(operations.calls).noneMatch(call -> call.startsWith("flush"));
  }

  @Test
  @DisplayName("uploadStream fails with the append error and never flushes")
  void upload_stream_fails_on_append_error() {
    // Given
    var failure = InMemoryPathOperations.serviceError(400, "InvalidInput");
    operations.appendFailures.put(20L, failure);
    var options = FileUploadOptions.defaults().withChunkSize(10).withMaxConcurrency(2);

    // When
    var stage = uploader.uploadStream(new ByteArrayInputStream(randomBytes(100)), options).toCompletableFuture();
    scheduler.runUntilIdle();

    // Then
    assertThatThrownBy(stage::join).hasCause(failure);
    assertThat(operations.calls).noneMatch(call -> call.startsWith("flush"));
    assertThat(operations.appends.size()).isLessThan(10);
  }

  @Test
  @DisplayName("uploadStream rejects invalid options before creating the file")
  void upload_stream_rejects_invalid_options() {
    var stream = new ByteArrayInputStream(new byte[1]);
    assertThatThrownBy(() -> uploader.uploadStream(stream, FileUploadOptions.defaults().withChunkSize(0)))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> uploader.uploadStream(stream, FileUploadOptions.defaults().withMaxConcurrency(0)))
      .isInstanceOf(IllegalArgumentException.class);
    assertThat(operations.calls).isEmpty();
  }

  private static final class TrackedStream extends ByteArrayInputStream {
    TrackedStream(byte[] data) {
      super(data);
    }

    synchronized int consumed() {
      return pos;
    }
  }

  private static byte[] randomBytes(int size) {
    var bytes = new byte[size];
    new Random(42).nextBytes(bytes);
    return bytes;
  }

}
