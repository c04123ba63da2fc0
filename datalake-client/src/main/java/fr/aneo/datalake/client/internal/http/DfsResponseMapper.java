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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import fr.aneo.datalake.client.acl.AccessControlChangeFailure;
import fr.aneo.datalake.client.acl.AclStrings;
import fr.aneo.datalake.client.acl.PathAccessControl;
import fr.aneo.datalake.client.acl.PathPermissions;
import fr.aneo.datalake.client.exception.PathOperationException;
import fr.aneo.datalake.client.path.ChangeAccessControlRecursiveResponse;
import fr.aneo.datalake.client.path.DeletePathResponse;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathProperties;
import fr.aneo.datalake.client.path.PathResourceType;

import java.net.http.HttpResponse;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Maps DFS HTTP responses to the path model, and failed responses to {@link PathOperationException}.
 */
final class DfsResponseMapper {
  private static final DateTimeFormatter HTTP_DATE = DateTimeFormatter.RFC_1123_DATE_TIME;
  private static final BaseEncoding BASE64 = BaseEncoding.base64();
  private static final Splitter PROPERTY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final Gson gson = new Gson();

  PathInfo pathInfo(HttpResponse<byte[]> response) {
    return new PathInfo(
      header(response, DfsHeaders.ETAG),
      date(header(response, DfsHeaders.LAST_MODIFIED)),
      response.headers().firstValueAsLong(DfsHeaders.CONTENT_LENGTH).orElse(0));
  }

  PathInfo flushInfo(HttpResponse<byte[]> response, long position) {
    return new PathInfo(header(response, DfsHeaders.ETAG), date(header(response, DfsHeaders.LAST_MODIFIED)), position);
  }

  PathProperties properties(HttpResponse<byte[]> response) {
    return new PathProperties(
      PathResourceType.fromValue(header(response, DfsHeaders.RESOURCE_TYPE)),
      response.headers().firstValueAsLong(DfsHeaders.CONTENT_LENGTH).orElse(0),
      header(response, DfsHeaders.ETAG),
      date(header(response, DfsHeaders.LAST_MODIFIED)),
      decodeProperties(header(response, DfsHeaders.PROPERTIES)));
  }

  PathAccessControl accessControl(HttpResponse<byte[]> response) {
    var permissions = header(response, DfsHeaders.PERMISSIONS);
    return new PathAccessControl(
      header(response, DfsHeaders.OWNER),
      header(response, DfsHeaders.GROUP),
      Strings.isNullOrEmpty(permissions) ? null : PathPermissions.parse(permissions),
      AclStrings.parseAcl(header(response, DfsHeaders.ACL)));
  }

  DeletePathResponse delete(HttpResponse<byte[]> response) {
    return new DeletePathResponse(header(response, DfsHeaders.CONTINUATION));
  }

  ChangeAccessControlRecursiveResponse changeAccessControlRecursive(HttpResponse<byte[]> response) {
    var body = response.body() == null || response.body().length == 0
      ? new SetAccessControlRecursiveBody()
      : parse(response, SetAccessControlRecursiveBody.class);
    var failedEntries = body.failedEntries == null
      ? List.<AccessControlChangeFailure>of()
      : body.failedEntries.stream()
                          .map(entry -> new AccessControlChangeFailure(entry.name, "DIRECTORY".equalsIgnoreCase(entry.type), entry.errorMessage))
                          .collect(Collectors.toList());
    return new ChangeAccessControlRecursiveResponse(
      header(response, DfsHeaders.CONTINUATION),
      body.directoriesSuccessful,
      body.filesSuccessful,
      body.failureCount,
      failedEntries);
  }

  /**
   * Builds the exception of a response with a status of 400 or more.
   * <p>
   * The error code is read from the {@code x-ms-error-code} header, or from the JSON body when
   * the header is absent.
   */
  PathOperationException error(String operation, HttpResponse<byte[]> response) {
    var code = header(response, DfsHeaders.ERROR_CODE);
    String message = null;
    if (response.body() != null && response.body().length > 0) {
      try {
        var body = gson.fromJson(new String(response.body(), UTF_8), ErrorBody.class);
        if (body != null && body.error != null) {
          code = code == null ? body.error.code : code;
          message = body.error.message;
        }
      } catch (JsonParseException e) {
        message = new String(response.body(), UTF_8);
      }
    }
    var text = operation + " failed with status " + response.statusCode()
               + (code == null ? "" : " (" + code + ")")
               + (message == null ? "" : ": " + message);
    return new PathOperationException(text, response.statusCode(), code);
  }

  static String encodeProperties(Map<String, String> metadata) {
    if (metadata.isEmpty()) return null;
    return Joiner.on(',').join(metadata.entrySet()
                                       .stream()
                                       .map(entry -> entry.getKey() + "=" + BASE64.encode(entry.getValue().getBytes(UTF_8)))
                                       .collect(Collectors.toList()));
  }

  static Map<String, String> decodeProperties(String header) {
    var metadata = new LinkedHashMap<String, String>();
    if (Strings.isNullOrEmpty(header)) return metadata;
    for (var property : PROPERTY_SPLITTER.split(header)) {
      int separator = property.indexOf('=');
      if (separator <= 0) continue;
      metadata.put(property.substring(0, separator), new String(BASE64.decode(property.substring(separator + 1)), UTF_8));
    }
    return metadata;
  }

  static String formatDate(OffsetDateTime date) {
    return date == null ? null : HTTP_DATE.format(date);
  }

  private <T> T parse(HttpResponse<byte[]> response, Class<T> type) {
    try {
      return gson.fromJson(new String(response.body(), UTF_8), type);
    } catch (JsonParseException e) {
      throw new PathOperationException("Malformed response body: " + e.getMessage(), e);
    }
  }

  private static String header(HttpResponse<?> response, String name) {
    return response.headers().firstValue(name).orElse(null);
  }

  private static OffsetDateTime date(String value) {
    if (value == null) return null;
    try {
      return OffsetDateTime.parse(value, HTTP_DATE);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static final class SetAccessControlRecursiveBody {
    long directoriesSuccessful;
    long filesSuccessful;
    long failureCount;
    List<FailedEntry> failedEntries;
  }

  private static final class FailedEntry {
    String name;
    String type;
    String errorMessage;
  }

  private static final class ErrorBody {
    ErrorDetail error;
  }

  private static final class ErrorDetail {
    String code;
    String message;
  }
}
