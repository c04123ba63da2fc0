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
 * One chunk of a transfer.
 *
 * @param index  position of the chunk in the plan, from 0
 * @param offset offset of the first byte, relative to the start of the transferred range
 * @param length number of bytes, always positive
 */
public record ChunkTask(int index, long offset, long length) {

  public ChunkTask {
    if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (length <= 0) throw new IllegalArgumentException("length must be > 0");
  }
}
