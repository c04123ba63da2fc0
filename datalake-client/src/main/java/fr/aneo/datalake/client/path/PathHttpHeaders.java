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
 * System properties of a path, sent as HTTP headers when the path is read.
 * <p>
 * Every field is optional. {@code contentMd5} is the Base64 form of the MD5 digest of the content.
 */
public record PathHttpHeaders(String cacheControl,
                              String contentType,
                              String contentEncoding,
                              String contentLanguage,
                              String contentDisposition,
                              String contentMd5) {

  private static final PathHttpHeaders NONE = new PathHttpHeaders(null, null, null, null, null, null);

  public static PathHttpHeaders none() {
    return NONE;
  }

  public PathHttpHeaders withCacheControl(String cacheControl) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }

  public PathHttpHeaders withContentType(String contentType) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }

  public PathHttpHeaders withContentEncoding(String contentEncoding) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }

  public PathHttpHeaders withContentLanguage(String contentLanguage) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }

  public PathHttpHeaders withContentDisposition(String contentDisposition) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }

  public PathHttpHeaders withContentMd5(String contentMd5) {
    return new PathHttpHeaders(cacheControl, contentType, contentEncoding, contentLanguage, contentDisposition, contentMd5);
  }
}
