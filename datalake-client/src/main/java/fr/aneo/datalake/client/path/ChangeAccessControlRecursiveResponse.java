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

import fr.aneo.datalake.client.acl.AccessControlChangeCounters;
import fr.aneo.datalake.client.acl.AccessControlChangeFailure;

import java.util.List;

/**
 * Result of one batch of a recursive ACL change.
 *
 * @param continuation          token to pass to the next batch, {@code null} or empty when the traversal is complete
 * @param directoriesSuccessful directories changed by the batch
 * @param filesSuccessful       files changed by the batch
 * @param failureCount          paths the batch failed to change
 * @param failedEntries         details of the failed paths, possibly truncated by the service
 */
public record ChangeAccessControlRecursiveResponse(String continuation,
                                                   long directoriesSuccessful,
                                                   long filesSuccessful,
                                                   long failureCount,
                                                   List<AccessControlChangeFailure> failedEntries) {

  public ChangeAccessControlRecursiveResponse {
    failedEntries = failedEntries == null ? List.of() : List.copyOf(failedEntries);
  }

  public AccessControlChangeCounters counters() {
    return new AccessControlChangeCounters(failureCount, directoriesSuccessful, filesSuccessful);
  }
}
