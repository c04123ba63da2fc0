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

/**
 * Metadata returned by the service after a path was created, flushed or renamed.
 *
 * @param eTag          new ETag of the path, may be {@code null}
 * @param lastModified  last modification time, may be {@code null}
 * @param contentLength file length after the call, {@code 0} when not reported
 */
public record PathInfo(String eTag, OffsetDateTime lastModified, long contentLength) {
}
