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
package fr.aneo.datalake.client.transfer;

import fr.aneo.datalake.client.path.PathInfo;

/**
 * Outcome of an upload.
 *
 * @param pathInfo   response of the final flush, or of the create call for an empty payload
 * @param totalSize  number of bytes uploaded
 * @param chunkSize  chunk size used, or that would have been used for a single-shot upload
 * @param chunkCount number of append calls issued
 */
public record FileUploadResult(PathInfo pathInfo, long totalSize, long chunkSize, int chunkCount) {
}
