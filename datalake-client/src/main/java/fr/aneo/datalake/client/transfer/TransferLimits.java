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
 * Service limits applying to uploads.
 */
public final class TransferLimits {
  private static final long MIB = 1024L * 1024L;

  /** Maximum number of appends committed by one flush. */
  public static final int MAX_BLOCK_COUNT = 50_000;
  public static final long DEFAULT_CHUNK_SIZE = 8 * MIB;
  public static final long MAX_CHUNK_SIZE = 4000 * MIB;
  /** Largest payload sent in a single append. */
  public static final long MAX_SINGLE_UPLOAD_THRESHOLD = 100 * MIB;
  public static final long MAX_FILE_SIZE = MAX_CHUNK_SIZE * MAX_BLOCK_COUNT;

  public static final long DEFAULT_READ_CHUNK_SIZE = 4 * MIB;

  /** Largest chunk that can be buffered in a single array. */
  static final long MAX_BUFFERED_CHUNK_SIZE = Integer.MAX_VALUE - 8;

  private TransferLimits() {
  }
}
