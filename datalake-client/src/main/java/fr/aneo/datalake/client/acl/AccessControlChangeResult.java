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
package fr.aneo.datalake.client.acl;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a recursive ACL change.
 * <p>
 * A continuation token is present only when the operation stopped because it reached the
 * configured maximum number of batches while the service still had paths to process.
 *
 * @param counters          counters aggregated over every batch
 * @param continuationToken token to resume from, if work remains
 */
public record AccessControlChangeResult(AccessControlChangeCounters counters, Optional<String> continuationToken) {

  public AccessControlChangeResult {
    requireNonNull(counters, "counters must not be null");
    requireNonNull(continuationToken, "continuationToken must not be null");
  }
}
