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

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Upload payload held in a byte array.
 * <p>
 * <strong>Data Integrity:</strong> the array is used directly without defensive copying.
 * Do not modify it while an upload is running.
 *
 * @see FileData
 */
public final class InMemoryData implements SeekableData {
  private final byte[] data;

  private InMemoryData(byte[] data) {
    this.data = requireNonNull(data, "data must not be null");
  }

  public static InMemoryData from(byte[] data) {
    return new InMemoryData(data);
  }

  @Override
  public long size() {
    return data.length;
  }

  @Override
  public byte[] read(long offset, int length) {
    if (offset < 0 || length < 0 || offset + length > data.length) {
      throw new IndexOutOfBoundsException("Range [" + offset + ", " + (offset + length) + ") is outside of [0, " + data.length + ")");
    }
    var start = (int) offset;
    return Arrays.copyOfRange(data, start, start + length);
  }
}
