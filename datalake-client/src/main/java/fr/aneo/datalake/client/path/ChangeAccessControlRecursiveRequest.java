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

import fr.aneo.datalake.client.acl.AccessControlChangeMode;

import static java.util.Objects.requireNonNull;

/**
 * One batch request of a recursive ACL change.
 *
 * @param mode         how the entries are combined with the existing ACL
 * @param acl          ACL in wire form
 * @param maxRecords   maximum number of paths processed by the batch, {@code null} for the service default
 * @param continuation token returned by the previous batch, {@code null} for the first one
 * @param forceFlag    whether the service continues past per-path failures
 */
public record ChangeAccessControlRecursiveRequest(AccessControlChangeMode mode,
                                                  String acl,
                                                  Integer maxRecords,
                                                  String continuation,
                                                  boolean forceFlag) {

  public ChangeAccessControlRecursiveRequest {
    requireNonNull(mode, "mode must not be null");
    requireNonNull(acl, "acl must not be null");
  }
}
