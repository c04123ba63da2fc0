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
 * Receives the number of bytes transferred so far.
 * <p>
 * During a chunked transfer the listener is invoked from the threads completing the chunks,
 * possibly concurrently and not in chunk order. Each call carries the cumulative count right
 * after its chunk was added, so the last call reports the total size.
 */
@FunctionalInterface
public interface TransferProgressListener {
  void onProgress(long loadedBytes);
}
