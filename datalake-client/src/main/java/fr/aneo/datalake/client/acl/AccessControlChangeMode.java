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
 * How a recursive change combines the given entries with the ACL already present on each path.
 */
public enum AccessControlChangeMode {
  /** Replaces the whole ACL. */
  SET("set"),
  /** Adds or updates the given entries, keeping the others. */
  MODIFY("modify"),
  /** Removes the given entries. */
  REMOVE("remove");

  private final String value;

  AccessControlChangeMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
