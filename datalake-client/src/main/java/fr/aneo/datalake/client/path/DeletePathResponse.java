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
package fr.aneo.datalake.client.path;

import com.google.common.base.Strings;

/**
 * Result of one delete call. A recursive delete of a large directory is processed in several
 * calls, chained by continuation tokens.
 *
 * @param continuation token of the next call, {@code null} when the delete is complete
 */
public record DeletePathResponse(String continuation) {

  public boolean hasMore() {
    return !Strings.isNullOrEmpty(continuation);
  }
}
