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
package fr.aneo.datalake.client.exception;

import java.util.Optional;

/**
 * Raised when a single remote path operation is rejected by the service or fails in transit.
 * <p>
 * The HTTP status is {@code 0} when no response was received (connection or I/O failure).
 * The service error code, when present, is the value of the {@code x-ms-error-code} header
 * or of the {@code error.code} field of the JSON error body, for example
 * {@code PathAlreadyExists} or {@code PathNotFound}.
 * </p>
 */
public class PathOperationException extends DataLakeException {
  public static final String PATH_ALREADY_EXISTS = "PathAlreadyExists";
  public static final String PATH_NOT_FOUND = "PathNotFound";

  private final int statusCode;
  private final String errorCode;

  public PathOperationException(String message, int statusCode, String errorCode) {
    super(message);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public PathOperationException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.errorCode = null;
  }

  /**
   * @return the HTTP status returned by the service, or {@code 0} if none was received
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * @return the service error code, if the service provided one
   */
  public Optional<String> errorCode() {
    return Optional.ofNullable(errorCode);
  }

  /**
   * Tells whether this failure carries the given service error code.
   *
   * @param code the error code to compare with
   * @return {@code true} if the codes are equal
   */
  public boolean hasErrorCode(String code) {
    return code != null && code.equals(errorCode);
  }
}
