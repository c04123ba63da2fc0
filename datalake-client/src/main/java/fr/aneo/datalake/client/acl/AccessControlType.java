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

import java.util.Arrays;

/**
 * Scope of a POSIX access control entry.
 */
public enum AccessControlType {
  USER("user"),
  GROUP("group"),
  MASK("mask"),
  OTHER("other");

  private final String value;

  AccessControlType(String value) {
    this.value = value;
  }

  /**
   * @return the wire form of this scope, as used in ACL strings
   */
  public String value() {
    return value;
  }

  /**
   * Resolves a scope from its wire form.
   *
   * @param value lower-case scope name
   * @return the matching scope
   * @throws IllegalArgumentException if the value is not a known scope
   */
  public static AccessControlType fromValue(String value) {
    return Arrays.stream(values())
                 .filter(type -> type.value.equals(value))
                 .findFirst()
                 .orElseThrow(() -> new IllegalArgumentException("Unknown access control type: " + value));
  }
}
