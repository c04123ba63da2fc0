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

import java.time.OffsetDateTime;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * System and user properties of a path.
 *
 * @param resourceType  file or directory
 * @param contentLength length in bytes, {@code 0} for a directory
 * @param eTag          current ETag
 * @param lastModified  last modification time
 * @param metadata      user metadata
 */
public record PathProperties(PathResourceType resourceType,
                             long contentLength,
                             String eTag,
                             OffsetDateTime lastModified,
                             Map<String, String> metadata) {

  public PathProperties {
    requireNonNull(resourceType, "resourceType must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public boolean isDirectory() {
    return resourceType == PathResourceType.DIRECTORY;
  }
}
