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

/**
 * Kind of resource a path designates.
 */
public enum PathResourceType {
  DIRECTORY("directory"),
  FILE("file");

  private final String value;

  PathResourceType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * @param value the wire form, as found in the {@code x-ms-resource-type} header
   * @return the matching type, {@link #FILE} when the value is absent or unknown
   */
  public static PathResourceType fromValue(String value) {
    return DIRECTORY.value.equalsIgnoreCase(value) ? DIRECTORY : FILE;
  }
}
