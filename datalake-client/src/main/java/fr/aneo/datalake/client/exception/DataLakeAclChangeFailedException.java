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

import fr.aneo.datalake.client.acl.AccessControlChangeCounters;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Raised when a batch of a recursive access control change fails.
 * <p>
 * Batches that completed before the failure are not rolled back: their changes are already
 * applied on the service side. The exception therefore carries the continuation token as of
 * the last successful batch, which can be passed back through
 * {@code AccessControlChangeOptions.withContinuationToken(String)} to resume the operation,
 * along with the counters aggregated up to that point.
 * </p>
 * <p>
 * When the failure happened on the very first batch of a fresh operation, the token is the
 * one supplied by the caller, usually absent.
 * </p>
 */
public class DataLakeAclChangeFailedException extends DataLakeException {
  private final String continuationToken;
  private final AccessControlChangeCounters aggregateCounters;

  public DataLakeAclChangeFailedException(Throwable cause, String continuationToken, AccessControlChangeCounters aggregateCounters) {
    super("An error occurred while recursively changing the access control list", cause);
    this.continuationToken = continuationToken;
    this.aggregateCounters = requireNonNull(aggregateCounters, "aggregateCounters must not be null");
  }

  /**
   * @return the token to resume from, if one was known when the failure occurred
   */
  public Optional<String> continuationToken() {
    return Optional.ofNullable(continuationToken);
  }

  /**
   * @return the counters accumulated over the batches that succeeded before the failure
   */
  public AccessControlChangeCounters aggregateCounters() {
    return aggregateCounters;
  }
}
