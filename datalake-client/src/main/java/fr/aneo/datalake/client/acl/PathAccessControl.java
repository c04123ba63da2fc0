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

/**
 * Access control state of a single path as returned by the service.
 *
 * @param owner       owning user
 * @param group       owning group
 * @param permissions base permissions, or {@code null} if the service did not return them
 * @param acl         full ordered ACL, including default entries for directories
 */
public record PathAccessControl(String owner,
                                String group,
                                PathPermissions permissions,
                                List<PathAccessControlEntry> acl) {

  public PathAccessControl {
    acl = acl == null ? List.of() : List.copyOf(acl);
  }
}
