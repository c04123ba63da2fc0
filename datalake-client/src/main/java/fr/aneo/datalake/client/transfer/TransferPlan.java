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

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Split of a transfer into fixed-size chunks. Every chunk has {@code chunkSize} bytes except
 * the last one, which holds the remainder.
 *
 * @param totalSize   number of bytes to transfer
 * @param chunkSize   size of every chunk but the last
 * @param chunkCount  {@code ceil(totalSize / chunkSize)}
 * @param concurrency maximum number of chunks in flight
 */
public record TransferPlan(long totalSize, long chunkSize, int chunkCount, int concurrency) {

  public TransferPlan {
    if (totalSize < 0) throw new IllegalArgumentException("totalSize must be >= 0, got: " + totalSize);
    if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, got: " + chunkSize);
    if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
    if (chunkCount != chunkCount(totalSize, chunkSize)) {
      throw new IllegalArgumentException("chunkCount " + chunkCount + " does not match totalSize " + totalSize + " and chunkSize " + chunkSize);
    }
  }

  /**
   * @throws IllegalArgumentException if a bound is violated or the plan would need more than
   *                                  {@link Integer#MAX_VALUE} chunks
   */
  public static TransferPlan of(long totalSize, long chunkSize, int concurrency) {
    if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, got: " + chunkSize);
    return new TransferPlan(totalSize, chunkSize, chunkCount(totalSize, chunkSize), concurrency);
  }

  public List<ChunkTask> chunks() {
    var chunks = new ArrayList<ChunkTask>(chunkCount);
    for (int i = 0; i < chunkCount; i++) {
      long offset = i * chunkSize;
      chunks.add(new ChunkTask(i, offset, Math.min(chunkSize, totalSize - offset)));
    }
    return chunks;
  }

  private static int chunkCount(long totalSize, long chunkSize) {
    if (totalSize < 0) throw new IllegalArgumentException("totalSize must be >= 0, got: " + totalSize);
    long count = LongMath.divide(totalSize, chunkSize, RoundingMode.CEILING);
    if (count > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Transfer of " + totalSize + " bytes needs too many chunks of " + chunkSize + " bytes");
    }
    return (int) count;
  }
}
