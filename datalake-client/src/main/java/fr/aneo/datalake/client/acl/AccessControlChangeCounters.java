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
package fr.aneo.datalake.client.acl;

/**
 * Number of paths changed, or failed to change, by one or more batches of a recursive ACL change.
 *
 * @param failedChangesCount      paths whose ACL could not be changed
 * @param changedDirectoriesCount directories whose ACL was changed
 * @param changedFilesCount       files whose ACL was changed
 */
public record AccessControlChangeCounters(long failedChangesCount,
                                          long changedDirectoriesCount,
                                          long changedFilesCount) {

  public static final AccessControlChangeCounters ZERO = new AccessControlChangeCounters(0, 0, 0);

  public AccessControlChangeCounters {
    if (failedChangesCount < 0 || changedDirectoriesCount < 0 || changedFilesCount < 0) {
      throw new IllegalArgumentException("Counters must not be negative");
    }
  }

  /**
   * @param other counters to add
   * @return the field-wise sum of both counters
   */
  public AccessControlChangeCounters plus(AccessControlChangeCounters other) {
    return new AccessControlChangeCounters(
      failedChangesCount + other.failedChangesCount,
      changedDirectoriesCount + other.changedDirectoriesCount,
      changedFilesCount + other.changedFilesCount);
  }
}
