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

/**
 * Payload of an upload that can be read again at any offset.
 * <p>
 * Chunked uploads read disjoint ranges concurrently, so implementations must support concurrent
 * calls to {@link #read(long, int)}.
 *
 * @see InMemoryData
 * @see FileData
 */
public interface SeekableData {

  /**
   * @return total number of bytes of the payload
   */
  long size();

  /**
   * Reads a range of the payload.
   *
   * @param offset first byte to read, in {@code [0, size())}
   * @param length number of bytes to read; {@code offset + length} must not exceed {@link #size()}
   * @return exactly {@code length} bytes
   * @throws fr.aneo.datalake.client.exception.DataLakeException if the payload cannot be read
   */
  byte[] read(long offset, int length);
}
