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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Progress event delivered after each successful batch of a recursive ACL change.
 *
 * @param batchFailures     failed entries reported by this batch
 * @param batchCounters     counters of this batch alone
 * @param aggregateCounters counters summed over all batches so far, this one included
 * @param continuationToken token returned by this batch, {@code null} when the traversal is complete
 */
public record AccessControlChanges(List<AccessControlChangeFailure> batchFailures,
                                   AccessControlChangeCounters batchCounters,
                                   AccessControlChangeCounters aggregateCounters,
                                   String continuationToken) {

  public AccessControlChanges {
    batchFailures = batchFailures == null ? List.of() : List.copyOf(batchFailures);
    requireNonNull(batchCounters, "batchCounters must not be null");
    requireNonNull(aggregateCounters, "aggregateCounters must not be null");
  }
}
