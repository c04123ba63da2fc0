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

import static java.util.Objects.requireNonNull;

/**
 * Designates an access control entry to remove. It has no permission bits.
 * <p>
 * Its wire form is {@code [default:]type:[entityId]}.
 *
 * @param defaultScope      {@code true} to remove a default entry
 * @param accessControlType the scope of the entry
 * @param entityId          the user or group identifier, or {@code null}
 */
public record RemovePathAccessControlEntry(boolean defaultScope,
                                           AccessControlType accessControlType,
                                           String entityId) {

  public RemovePathAccessControlEntry {
    requireNonNull(accessControlType, "accessControlType must not be null");
    entityId = entityId == null ? "" : entityId;
  }

  public static RemovePathAccessControlEntry user(String entityId) {
    return new RemovePathAccessControlEntry(false, AccessControlType.USER, entityId);
  }

  public static RemovePathAccessControlEntry group(String entityId) {
    return new RemovePathAccessControlEntry(false, AccessControlType.GROUP, entityId);
  }

  public static RemovePathAccessControlEntry mask() {
    return new RemovePathAccessControlEntry(false, AccessControlType.MASK, "");
  }

  public RemovePathAccessControlEntry asDefault() {
    return new RemovePathAccessControlEntry(true, accessControlType, entityId);
  }
}
