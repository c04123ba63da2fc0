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
 * Owner, group and other permissions of a path, in the symbolic form returned by the service.
 * <p>
 * The form is nine characters such as {@code rwxr-x---}. The last character is {@code t} or
 * {@code T} when the sticky bit is set (with or without execute for other), and a trailing
 * {@code +} marks a path carrying extended ACL entries beyond the three base roles.
 *
 * @param owner        permissions of the owning user
 * @param group        permissions of the owning group
 * @param other        permissions of everyone else
 * @param stickyBit    whether the sticky bit is set
 * @param extendedAcls whether the path has extended ACL entries
 */
public record PathPermissions(RolePermissions owner,
                              RolePermissions group,
                              RolePermissions other,
                              boolean stickyBit,
                              boolean extendedAcls) {

  public PathPermissions {
    requireNonNull(owner, "owner must not be null");
    requireNonNull(group, "group must not be null");
    requireNonNull(other, "other must not be null");
  }

  public static PathPermissions of(RolePermissions owner, RolePermissions group, RolePermissions other) {
    return new PathPermissions(owner, group, other, false, false);
  }

  /**
   * @return the symbolic form sent to the service, without the extended ACL marker
   */
  public String toSymbolic() {
    var otherSymbolic = other.toSymbolic();
    if (stickyBit) {
      otherSymbolic = otherSymbolic.substring(0, 2) + (other.execute() ? "t" : "T");
    }
    return owner.toSymbolic() + group.toSymbolic() + otherSymbolic;
  }

  /**
   * Parses the symbolic form returned by the service.
   *
   * @param symbolic nine characters, optionally followed by {@code +}
   * @return the parsed permissions
   * @throws IllegalArgumentException if the value is malformed
   */
  public static PathPermissions parse(String symbolic) {
    if (symbolic == null || (symbolic.length() != 9 && symbolic.length() != 10)) {
      throw new IllegalArgumentException("Permissions must be 9 or 10 characters long, got: " + symbolic);
    }
    boolean extended = false;
    if (symbolic.length() == 10) {
      if (symbolic.charAt(9) != '+') {
        throw new IllegalArgumentException("Invalid extended ACL marker in permissions: " + symbolic);
      }
      extended = true;
    }
    char stickyChar = symbolic.charAt(8);
    boolean sticky = stickyChar == 't' || stickyChar == 'T';

    return new PathPermissions(
      RolePermissions.parse(symbolic.substring(0, 3)),
      RolePermissions.parse(symbolic.substring(3, 6)),
      RolePermissions.parseWithSticky(symbolic.substring(6, 9)),
      sticky,
      extended);
  }
}
