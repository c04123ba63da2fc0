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

/**
 * Read, write and execute bits for one role.
 * <p>
 * The symbolic form is the usual three-character POSIX notation, for instance {@code r-x}.
 *
 * @param read    read permission
 * @param write   write permission
 * @param execute execute permission
 */
public record RolePermissions(boolean read, boolean write, boolean execute) {

  public static final RolePermissions NONE = new RolePermissions(false, false, false);
  public static final RolePermissions ALL = new RolePermissions(true, true, true);

  /**
   * @return the symbolic form, for instance {@code rw-}
   */
  public String toSymbolic() {
    return (read ? "r" : "-") + (write ? "w" : "-") + (execute ? "x" : "-");
  }

  /**
   * Parses a three-character symbolic form.
   *
   * @param symbolic the permissions, for instance {@code r-x}
   * @return the parsed permissions
   * @throws IllegalArgumentException if the value is not exactly three valid characters
   */
  public static RolePermissions parse(String symbolic) {
    if (symbolic == null || symbolic.length() != 3) {
      throw new IllegalArgumentException("Role permissions must be 3 characters long, got: " + symbolic);
    }
    return new RolePermissions(
      bit(symbolic.charAt(0), 'r', symbolic),
      bit(symbolic.charAt(1), 'w', symbolic),
      bit(symbolic.charAt(2), 'x', symbolic));
  }

  /**
   * Parses the execute position of an owner/other triplet where a sticky bit may replace it.
   * {@code t} means sticky and executable, {@code T} sticky and not executable.
   */
  static RolePermissions parseWithSticky(String symbolic) {
    char last = symbolic.charAt(2);
    if (last == 't' || last == 'T') {
      var base = parse(symbolic.substring(0, 2) + "-");
      return new RolePermissions(base.read(), base.write(), last == 't');
    }
    return parse(symbolic);
  }

  private static boolean bit(char c, char expected, String symbolic) {
    if (c == expected) return true;
    if (c == '-') return false;
    throw new IllegalArgumentException("Invalid role permissions: " + symbolic);
  }
}
