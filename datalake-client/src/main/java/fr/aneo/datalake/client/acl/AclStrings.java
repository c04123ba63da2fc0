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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conversions between ACL entries and their comma-separated wire form.
 * <pre>{@code
 * user::rwx,user:1b2c:r-x,group::r-x,mask::r-x,other::---,default:user:1b2c:rwx
 * }</pre>
 */
public final class AclStrings {
  private static final String DEFAULT_PREFIX = "default:";
  private static final Joiner ENTRY_JOINER = Joiner.on(',');
  private static final Splitter ENTRY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter FIELD_SPLITTER = Splitter.on(':');

  private AclStrings() {
  }

  public static String toAclString(List<PathAccessControlEntry> acl) {
    return ENTRY_JOINER.join(acl.stream().map(AclStrings::toEntryString).collect(Collectors.toList()));
  }

  public static String toRemoveAclString(List<RemovePathAccessControlEntry> acl) {
    return ENTRY_JOINER.join(acl.stream().map(AclStrings::toEntryString).collect(Collectors.toList()));
  }

  public static String toEntryString(PathAccessControlEntry entry) {
    return prefix(entry.defaultScope()) + entry.accessControlType().value() + ":" + entry.entityId() + ":" + entry.permissions().toSymbolic();
  }

  public static String toEntryString(RemovePathAccessControlEntry entry) {
    return prefix(entry.defaultScope()) + entry.accessControlType().value() + ":" + entry.entityId();
  }

  /**
   * Parses an ACL returned by the service.
   *
   * @param aclString comma-separated entries; {@code null} or empty yields an empty list
   * @return the entries, in order
   * @throws IllegalArgumentException if an entry is malformed
   */
  public static List<PathAccessControlEntry> parseAcl(String aclString) {
    if (Strings.isNullOrEmpty(aclString)) return List.of();
    return ENTRY_SPLITTER.splitToStream(aclString)
                         .map(AclStrings::parseEntry)
                         .collect(Collectors.toUnmodifiableList());
  }

  public static PathAccessControlEntry parseEntry(String entry) {
    boolean defaultScope = entry.startsWith(DEFAULT_PREFIX);
    var body = defaultScope ? entry.substring(DEFAULT_PREFIX.length()) : entry;
    var fields = FIELD_SPLITTER.splitToList(body);
    if (fields.size() != 3) {
      throw new IllegalArgumentException("Invalid access control entry: " + entry);
    }
    return new PathAccessControlEntry(
      defaultScope,
      AccessControlType.fromValue(fields.get(0)),
      fields.get(1),
      RolePermissions.parse(fields.get(2)));
  }

  private static String prefix(boolean defaultScope) {
    return defaultScope ? DEFAULT_PREFIX : "";
  }
}
