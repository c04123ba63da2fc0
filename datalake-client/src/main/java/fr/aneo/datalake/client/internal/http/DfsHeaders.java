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
package fr.aneo.datalake.client.internal.http;

/**
 * Header names of the DFS REST surface.
 */
final class DfsHeaders {
  static final String VERSION = "x-ms-version";
  static final String CLIENT_REQUEST_ID = "x-ms-client-request-id";
  static final String ERROR_CODE = "x-ms-error-code";
  static final String CONTINUATION = "x-ms-continuation";
  static final String LEASE_ID = "x-ms-lease-id";
  static final String PROPERTIES = "x-ms-properties";
  static final String PERMISSIONS = "x-ms-permissions";
  static final String UMASK = "x-ms-umask";
  static final String ACL = "x-ms-acl";
  static final String OWNER = "x-ms-owner";
  static final String GROUP = "x-ms-group";
  static final String RESOURCE_TYPE = "x-ms-resource-type";
  static final String CACHE_CONTROL = "x-ms-cache-control";
  static final String CONTENT_TYPE = "x-ms-content-type";
  static final String CONTENT_ENCODING = "x-ms-content-encoding";
  static final String CONTENT_LANGUAGE = "x-ms-content-language";
  static final String CONTENT_DISPOSITION = "x-ms-content-disposition";
  static final String CONTENT_MD5 = "x-ms-content-md5";
  static final String RANGE = "x-ms-range";
  static final String RENAME_SOURCE = "x-ms-rename-source";
  static final String SOURCE_LEASE_ID = "x-ms-source-lease-id";
  static final String SOURCE_IF_MATCH = "x-ms-source-if-match";
  static final String SOURCE_IF_NONE_MATCH = "x-ms-source-if-none-match";
  static final String SOURCE_IF_MODIFIED_SINCE = "x-ms-source-if-modified-since";
  static final String SOURCE_IF_UNMODIFIED_SINCE = "x-ms-source-if-unmodified-since";
  static final String IF_MATCH = "If-Match";
  static final String IF_NONE_MATCH = "If-None-Match";
  static final String IF_MODIFIED_SINCE = "If-Modified-Since";
  static final String IF_UNMODIFIED_SINCE = "If-Unmodified-Since";
  static final String AUTHORIZATION = "Authorization";
  static final String ETAG = "ETag";
  static final String LAST_MODIFIED = "Last-Modified";
  static final String CONTENT_LENGTH = "Content-Length";

  private DfsHeaders() {
  }
}
