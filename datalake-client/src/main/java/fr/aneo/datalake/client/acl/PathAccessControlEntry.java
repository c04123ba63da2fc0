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
 * One POSIX access control entry: a scope, an optional principal and its permissions.
 * <p>
 * Its wire form is {@code [default:]type:[entityId]:rwx}. An absent {@code entityId} designates
 * the owning user or group of the path for {@link AccessControlType#USER} and
 * {@link AccessControlType#GROUP}.
 *
 * @param defaultScope      {@code true} for a default entry, inherited by new children of a directory
 * @param accessControlType the scope of the entry
 * @param entityId          the user or group identifier, or {@code null}
 * @param permissions       the granted permissions
 */
public record PathAccessControlEntry(boolean defaultScope,
                                     AccessControlType accessControlType,
                                     String entityId,
                                     RolePermissions permissions) {

  public PathAccessControlEntry {
    requireNonNull(accessControlType, "accessControlType must not be null");
    requireNonNull(permissions, "permissions must not be null");
    entityId = entityId == null ? "" : entityId;
  }

  public static PathAccessControlEntry user(String entityId, RolePermissions permissions) {
    return new PathAccessControlEntry(false, AccessControlType.USER, entityId, permissions);
  }

  public static PathAccessControlEntry group(String entityId, RolePermissions permissions) {
    return new PathAccessControlEntry(false, AccessControlType.GROUP, entityId, permissions);
  }

  public static PathAccessControlEntry mask(RolePermissions permissions) {
    return new PathAccessControlEntry(false, AccessControlType.MASK, "", permissions);
  }

  public static PathAccessControlEntry other(RolePermissions permissions) {
    return new PathAccessControlEntry(false, AccessControlType.OTHER, "", permissions);
  }

  /**
   * @return a copy of this entry marked as a default entry
   */
  public PathAccessControlEntry asDefault() {
    return new PathAccessControlEntry(true, accessControlType, entityId, permissions);
  }
}
