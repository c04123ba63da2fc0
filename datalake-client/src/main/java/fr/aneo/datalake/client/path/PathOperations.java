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

import fr.aneo.datalake.client.acl.PathAccessControl;
import fr.aneo.datalake.client.acl.PathPermissions;
import fr.aneo.datalake.client.concurrent.CancellationSignal;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Remote operations on a single path of a Data Lake file system.
 * <p>
 * An instance is bound to one path (file system, path and optional query). Every method is
 * asynchronous: it reports service and transport failures through the returned stage, typically
 * as a {@link fr.aneo.datalake.client.exception.PathOperationException}. Every method takes the
 * cancellation signal of the enclosing operation; implementations abort their in-flight exchange
 * when it is triggered.
 * </p>
 * <p>
 * Implementations must be thread-safe: the transfer engine issues concurrent
 * {@link #appendData} and {@link #read} calls on the same instance.
 * </p>
 *
 * @see PathOperationsFactory
 */
public interface PathOperations {

  /**
   * Applies one batch of a recursive ACL change, starting at this path.
   *
   * @param request      batch parameters
   * @param cancellation signal of the enclosing operation
   * @return the batch counters and the continuation token
   */
  CompletionStage<ChangeAccessControlRecursiveResponse> changeAccessControlRecursive(ChangeAccessControlRecursiveRequest request,
                                                                                     CancellationSignal cancellation);

  /**
   * Creates the path, replacing an existing file unless the conditions forbid it.
   *
   * @param resourceType file or directory
   * @param options      metadata, permissions and conditions
   * @param cancellation signal of the enclosing operation
   * @return the created path metadata
   */
  CompletionStage<PathInfo> create(PathResourceType resourceType, PathCreateOptions options, CancellationSignal cancellation);

  /**
   * Stages bytes at the given position of a file. Staged bytes are not readable until flushed.
   *
   * @param position     offset of the first byte in the file
   * @param data         bytes to stage; must not be modified until the stage completes
   * @param conditions   preconditions, usually the lease only
   * @param cancellation signal of the enclosing operation
   * @return a stage completing when the service acknowledged the bytes
   */
  CompletionStage<Void> appendData(long position, byte[] data, AccessConditions conditions, CancellationSignal cancellation);

  /**
   * Commits previously appended bytes up to {@code position}, which becomes the file length.
   *
   * @param position     final length of the file
   * @param close        whether the service should raise a close event
   * @param conditions   preconditions, usually the lease only
   * @param cancellation signal of the enclosing operation
   * @return the flushed file metadata
   */
  CompletionStage<PathInfo> flushData(long position, boolean close, AccessConditions conditions, CancellationSignal cancellation);

  /**
   * Renames {@code renameSource} onto this path.
   *
   * @param renameSource          source as {@code /fileSystem/path}, optionally followed by its query
   * @param sourceConditions      preconditions on the source
   * @param destinationConditions preconditions on this path
   * @param cancellation          signal of the enclosing operation
   * @return the metadata of this path after the rename
   */
  CompletionStage<PathInfo> rename(String renameSource,
                                   AccessConditions sourceConditions,
                                   AccessConditions destinationConditions,
                                   CancellationSignal cancellation);

  CompletionStage<DeletePathResponse> delete(boolean recursive, String continuation, AccessConditions conditions, CancellationSignal cancellation);

  /**
   * @param userPrincipalName whether owner, group and entity ids are returned as user principal names
   */
  CompletionStage<PathAccessControl> getAccessControl(boolean userPrincipalName, AccessConditions conditions, CancellationSignal cancellation);

  CompletionStage<PathInfo> setAccessControl(String acl, String owner, String group, AccessConditions conditions, CancellationSignal cancellation);

  CompletionStage<PathInfo> setPermissions(PathPermissions permissions, String owner, String group, AccessConditions conditions, CancellationSignal cancellation);

  CompletionStage<PathProperties> getProperties(AccessConditions conditions, CancellationSignal cancellation);

  /**
   * Replaces the user-defined metadata of the path. An empty map removes it.
   */
  CompletionStage<PathInfo> setMetadata(Map<String, String> metadata, AccessConditions conditions, CancellationSignal cancellation);

  /**
   * Sets the system properties of the path. A {@code null} field is not sent.
   */
  CompletionStage<PathInfo> setHttpHeaders(PathHttpHeaders headers, AccessConditions conditions, CancellationSignal cancellation);

  /**
   * Reads a byte range of a file.
   *
   * @param offset       first byte to read
   * @param count        number of bytes to read
   * @param conditions   preconditions
   * @param cancellation signal of the enclosing operation
   * @return exactly {@code count} bytes, fewer only if the file is shorter
   */
  CompletionStage<byte[]> read(long offset, long count, AccessConditions conditions, CancellationSignal cancellation);
}
