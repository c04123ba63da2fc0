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

import java.time.OffsetDateTime;

/**
 * Optional preconditions attached to a remote path operation.
 *
 * @param leaseId           lease that must be active on the path
 * @param ifMatch           ETag the path must have
 * @param ifNoneMatch       ETag the path must not have, {@code *} to require that it does not exist
 * @param ifModifiedSince   the path must have been modified after this instant
 * @param ifUnmodifiedSince the path must not have been modified after this instant
 */
public record AccessConditions(String leaseId,
                               String ifMatch,
                               String ifNoneMatch,
                               OffsetDateTime ifModifiedSince,
                               OffsetDateTime ifUnmodifiedSince) {

  public static final String ETAG_ANY = "*";

  private static final AccessConditions NONE = new AccessConditions(null, null, null, null, null);

  public static AccessConditions none() {
    return NONE;
  }

  public static AccessConditions lease(String leaseId) {
    return new AccessConditions(leaseId, null, null, null, null);
  }

  public static AccessConditions ifNotExists() {
    return new AccessConditions(null, null, ETAG_ANY, null, null);
  }

  /**
   * Keeps only the lease id.
   * <p>
   * Once a file has been created by an upload, its ETag changes with every append; the other
   * conditions would then fail the following calls.
   *
   * @return conditions carrying the same lease id and nothing else
   */
  public AccessConditions leaseOnly() {
    return leaseId == null ? NONE : lease(leaseId);
  }

  public AccessConditions withIfNoneMatch(String ifNoneMatch) {
    return new AccessConditions(leaseId, ifMatch, ifNoneMatch, ifModifiedSince, ifUnmodifiedSince);
  }
}
