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

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Options applied when creating a file or a directory.
 * <p>
 * {@code permissions} is either symbolic ({@code rwxr-x---}) or octal ({@code 0750});
 * {@code umask} is octal. Both only apply when the account has a hierarchical namespace.
 */
public record PathCreateOptions(Map<String, String> metadata,
                                String permissions,
                                String umask,
                                AccessConditions conditions) {

  private static final PathCreateOptions DEFAULTS = new PathCreateOptions(Map.of(), null, null, AccessConditions.none());

  public PathCreateOptions {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    requireNonNull(conditions, "conditions must not be null");
  }

  public static PathCreateOptions defaults() {
    return DEFAULTS;
  }

  public PathCreateOptions withMetadata(Map<String, String> metadata) {
    return new PathCreateOptions(metadata, permissions, umask, conditions);
  }

  public PathCreateOptions withPermissions(String permissions) {
    return new PathCreateOptions(metadata, permissions, umask, conditions);
  }

  public PathCreateOptions withUmask(String umask) {
    return new PathCreateOptions(metadata, permissions, umask, conditions);
  }

  public PathCreateOptions withConditions(AccessConditions conditions) {
    return new PathCreateOptions(metadata, permissions, umask, conditions);
  }
}
