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
package fr.aneo.datalake.client;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.net.UrlEscapers;
import fr.aneo.datalake.client.acl.AccessControlChangeMode;
import fr.aneo.datalake.client.acl.AccessControlChangeOptions;
import fr.aneo.datalake.client.acl.AccessControlChangeResult;
import fr.aneo.datalake.client.acl.AccessControlPropagator;
import fr.aneo.datalake.client.acl.AclStrings;
import fr.aneo.datalake.client.acl.PathAccessControl;
import fr.aneo.datalake.client.acl.PathAccessControlEntry;
import fr.aneo.datalake.client.acl.PathPermissions;
import fr.aneo.datalake.client.acl.RemovePathAccessControlEntry;
import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.exception.PathOperationException;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathCreateIfNotExistsResult;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.path.PathDeleteIfExistsResult;
import fr.aneo.datalake.client.path.PathHttpHeaders;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathOperations;
import fr.aneo.datalake.client.path.PathOperationsFactory;
import fr.aneo.datalake.client.path.PathProperties;
import fr.aneo.datalake.client.path.PathResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Client of a single path, file or directory, of a Data Lake file system.
 * <p>
 * This client carries the operations common to files and directories. Use
 * {@link DataLakeFileClient} and {@link DataLakeDirectoryClient} for the kind-specific ones;
 * both wrap a path client.
 * </p>
 *
 * <h2>Recursive access control</h2>
 * <p>
 * {@link #setAccessControlRecursive}, {@link #updateAccessControlRecursive} and
 * {@link #removeAccessControlRecursive} change the ACL of the path and of everything below it,
 * batch by batch. See {@link AccessControlPropagator} for the batching, resumption and failure
 * semantics.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 */
public final class DataLakePathClient {
  private static final Logger logger = LoggerFactory.getLogger(DataLakePathClient.class);
  private static final Splitter QUERY_SPLITTER = Splitter.on('?');

  private final PathOperationsFactory factory;
  private final PathOperations operations;
  private final String fileSystemName;
  private final String path;
  private final String query;

  DataLakePathClient(PathOperationsFactory factory, String fileSystemName, String path, String query) {
    this.factory = requireNonNull(factory, "factory must not be null");
    this.fileSystemName = requireNonNull(fileSystemName, "fileSystemName must not be null");
    this.path = requireNonNull(path, "path must not be null");
    this.query = Strings.emptyToNull(query);
    this.operations = requireNonNull(factory.forPath(fileSystemName, path, this.query), "factory returned null operations");
  }

  public String fileSystemName() {
    return fileSystemName;
  }

  public String path() {
    return path;
  }

  /**
   * @return a client of {@code path/name} on the same file system, sharing the query of this client
   */
  DataLakePathClient child(String name) {
    requireNonNull(name, "name must not be null");
    var trimmed = name.startsWith("/") ? name.substring(1) : name;
    var base = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    return new DataLakePathClient(factory, fileSystemName, base.isEmpty() ? trimmed : base + "/" + trimmed, query);
  }

  /**
   * @return a client of a move destination, as accepted by {@link #move(String, String)}
   */
  DataLakePathClient moved(String destinationFileSystem, String destinationPath) {
    var parts = QUERY_SPLITTER.splitToList(destinationPath);
    return new DataLakePathClient(factory, destinationFileSystem, parts.get(0), parts.size() == 2 ? parts.get(1) : null);
  }

  PathOperations operations() {
    return operations;
  }

  /**
   * @return a directory client of this path; no check is made that the path is a directory
   */
  public DataLakeDirectoryClient toDirectoryClient() {
    return new DataLakeDirectoryClient(this);
  }

  /**
   * @return a file client of this path; no check is made that the path is a file
   */
  public DataLakeFileClient toFileClient() {
    return new DataLakeFileClient(this);
  }

  /**
   * Creates the path. An existing file is overwritten unless the conditions forbid it.
   */
  public CompletionStage<PathInfo> create(PathResourceType resourceType, PathCreateOptions options) {
    requireNonNull(resourceType, "resourceType must not be null");
    requireNonNull(options, "options must not be null");
    return Futures.safely(() -> operations.create(resourceType, options, CancellationSignal.none()));
  }

  /**
   * Creates the path only if it does not exist yet.
   *
   * @return a result whose {@code succeeded} flag is {@code false} if the path already existed
   */
  public CompletionStage<PathCreateIfNotExistsResult> createIfNotExists(PathResourceType resourceType, PathCreateOptions options) {
    requireNonNull(options, "options must not be null");
    var ifNotExists = options.withConditions(options.conditions().withIfNoneMatch(AccessConditions.ETAG_ANY));
    return create(resourceType, ifNotExists)
      .thenApply(info -> new PathCreateIfNotExistsResult(true, info))
      .exceptionallyCompose(throwable -> {
        var cause = Futures.unwrap(throwable);
        if (cause instanceof PathOperationException e && e.hasErrorCode(PathOperationException.PATH_ALREADY_EXISTS)) {
          logger.atDebug().addKeyValue("path", path).log("Path already exists, nothing created");
          return completedFuture(new PathCreateIfNotExistsResult(false, null));
        }
        return failedFuture(cause);
      });
  }

  /**
   * @return {@code true} if the path exists, {@code false} if the service answered 404
   */
  public CompletionStage<Boolean> exists() {
    return getProperties()
      .thenApply(properties -> true)
      .exceptionallyCompose(throwable -> {
        var cause = Futures.unwrap(throwable);
        if (cause instanceof PathOperationException e && e.statusCode() == 404) {
          return completedFuture(false);
        }
        return failedFuture(cause);
      });
  }

  /**
   * Deletes the path. A recursive delete of a large directory is processed in several calls;
   * this method follows the continuation tokens until the service reports completion.
   *
   * @param recursive  whether a non-empty directory is deleted with its content
   * @param conditions preconditions of every delete call
   */
  public CompletionStage<Void> delete(boolean recursive, AccessConditions conditions) {
    requireNonNull(conditions, "conditions must not be null");
    return deleteFrom(recursive, null, conditions);
  }

  private CompletionStage<Void> deleteFrom(boolean recursive, String start, AccessConditions conditions) {
    var continuation = start;
    // Pages answered synchronously are followed in this loop, only a pending one defers to its completion.
    while (true) {
      var token = continuation;
      var page = Futures.safely(() -> operations.delete(recursive, token, conditions, CancellationSignal.none())).toCompletableFuture();
      if (!page.isDone() || page.isCompletedExceptionally()) {
        return page.thenCompose(response -> response.hasMore()
          ? deleteFrom(recursive, response.continuation(), conditions)
          : completedFuture(null));
      }
      var response = page.join();
      if (!response.hasMore()) {
        return completedFuture(null);
      }
      continuation = response.continuation();
    }
  }

  /**
   * Deletes the path if it exists.
   *
   * @return a result whose {@code succeeded} flag is {@code false} if the path did not exist
   */
  public CompletionStage<PathDeleteIfExistsResult> deleteIfExists(boolean recursive, AccessConditions conditions) {
    return delete(recursive, conditions)
      .thenApply(ignored -> new PathDeleteIfExistsResult(true))
      .exceptionallyCompose(throwable -> {
        var cause = Futures.unwrap(throwable);
        if (cause instanceof PathOperationException e && e.hasErrorCode(PathOperationException.PATH_NOT_FOUND)) {
          logger.atDebug().addKeyValue("path", path).log("Path not found, nothing deleted");
          return completedFuture(new PathDeleteIfExistsResult(false));
        }
        return failedFuture(cause);
      });
  }

  public CompletionStage<PathProperties> getProperties() {
    return Futures.safely(() -> operations.getProperties(AccessConditions.none(), CancellationSignal.none()));
  }

  /**
   * Replaces the user-defined metadata of the path.
   *
   * @param metadata   the new metadata; an empty map removes the existing one
   * @param conditions preconditions on the path
   */
  public CompletionStage<PathInfo> setMetadata(Map<String, String> metadata, AccessConditions conditions) {
    requireNonNull(metadata, "metadata must not be null");
    requireNonNull(conditions, "conditions must not be null");
    var copy = Map.copyOf(metadata);
    return Futures.safely(() -> operations.setMetadata(copy, conditions, CancellationSignal.none()));
  }

  /**
   * Sets the system properties returned as HTTP headers when the path is read.
   */
  public CompletionStage<PathInfo> setHttpHeaders(PathHttpHeaders headers, AccessConditions conditions) {
    requireNonNull(headers, "headers must not be null");
    requireNonNull(conditions, "conditions must not be null");
    return Futures.safely(() -> operations.setHttpHeaders(headers, conditions, CancellationSignal.none()));
  }

  /**
   * @param userPrincipalName whether identities are returned as user principal names instead of object ids
   */
  public CompletionStage<PathAccessControl> getAccessControl(boolean userPrincipalName) {
    return Futures.safely(() -> operations.getAccessControl(userPrincipalName, AccessConditions.none(), CancellationSignal.none()));
  }

  /**
   * Replaces the ACL of this path only.
   *
   * @param acl   the full ACL, including the base user, group and other entries
   * @param owner new owner, or {@code null} to keep it
   * @param group new owning group, or {@code null} to keep it
   */
  public CompletionStage<PathInfo> setAccessControl(List<PathAccessControlEntry> acl, String owner, String group) {
    requireNonNull(acl, "acl must not be null");
    var aclString = AclStrings.toAclString(acl);
    return Futures.safely(() -> operations.setAccessControl(aclString, owner, group, AccessConditions.none(), CancellationSignal.none()));
  }

  public CompletionStage<PathInfo> setPermissions(PathPermissions permissions, String owner, String group) {
    requireNonNull(permissions, "permissions must not be null");
    return Futures.safely(() -> operations.setPermissions(permissions, owner, group, AccessConditions.none(), CancellationSignal.none()));
  }

  /**
   * Replaces the ACL of this path and of every path below it.
   *
   * @param acl     the full ACL to apply
   * @param options batching, resumption and progress options
   * @return the counters aggregated over all batches, and a token if {@code maxBatches} stopped the operation early
   * @throws IllegalArgumentException if {@code batchSize} or {@code maxBatches} is lower than 1
   */
  public CompletionStage<AccessControlChangeResult> setAccessControlRecursive(List<PathAccessControlEntry> acl,
                                                                              AccessControlChangeOptions options) {
    requireNonNull(acl, "acl must not be null");
    return new AccessControlPropagator(operations).propagate(AccessControlChangeMode.SET, AclStrings.toAclString(acl), options);
  }

  /**
   * Adds or updates the given entries on this path and every path below it, keeping the other entries.
   *
   * @see #setAccessControlRecursive(List, AccessControlChangeOptions)
   */
  public CompletionStage<AccessControlChangeResult> updateAccessControlRecursive(List<PathAccessControlEntry> acl,
                                                                                 AccessControlChangeOptions options) {
    requireNonNull(acl, "acl must not be null");
    return new AccessControlPropagator(operations).propagate(AccessControlChangeMode.MODIFY, AclStrings.toAclString(acl), options);
  }

  /**
   * Removes the given entries from this path and every path below it.
   *
   * @see #setAccessControlRecursive(List, AccessControlChangeOptions)
   */
  public CompletionStage<AccessControlChangeResult> removeAccessControlRecursive(List<RemovePathAccessControlEntry> acl,
                                                                                 AccessControlChangeOptions options) {
    requireNonNull(acl, "acl must not be null");
    return new AccessControlPropagator(operations).propagate(AccessControlChangeMode.REMOVE, AclStrings.toRemoveAclString(acl), options);
  }

  /**
   * Moves this path within its file system.
   *
   * @param destinationPath destination, optionally followed by {@code ?} and its own query (for instance a SAS)
   * @throws IllegalArgumentException if the destination contains more than one query string
   */
  public CompletionStage<PathInfo> move(String destinationPath) {
    return move(fileSystemName, destinationPath, AccessConditions.none(), AccessConditions.none());
  }

  /**
   * Moves this path to another file system of the same account.
   *
   * @see #move(String, String, AccessConditions, AccessConditions)
   */
  public CompletionStage<PathInfo> move(String destinationFileSystem, String destinationPath) {
    return move(destinationFileSystem, destinationPath, AccessConditions.none(), AccessConditions.none());
  }

  /**
   * Moves this path.
   *
   * @param destinationFileSystem destination file system
   * @param destinationPath       destination, optionally followed by {@code ?} and its own query
   * @param sourceConditions      preconditions on this path
   * @param destinationConditions preconditions on the destination
   * @return the metadata of the destination
   * @throws IllegalArgumentException if the destination contains more than one query string
   */
  public CompletionStage<PathInfo> move(String destinationFileSystem,
                                        String destinationPath,
                                        AccessConditions sourceConditions,
                                        AccessConditions destinationConditions) {
    requireNonNull(destinationFileSystem, "destinationFileSystem must not be null");
    requireNonNull(destinationPath, "destinationPath must not be null");
    requireNonNull(sourceConditions, "sourceConditions must not be null");
    requireNonNull(destinationConditions, "destinationConditions must not be null");

    var parts = QUERY_SPLITTER.splitToList(destinationPath);
    if (parts.size() > 2) {
      throw new IllegalArgumentException("Destination path should not contain more than one query string: " + destinationPath);
    }
    var destinationQuery = parts.size() == 2 ? parts.get(1) : null;
    var destination = factory.forPath(destinationFileSystem, parts.get(0), Strings.emptyToNull(destinationQuery));

    logger.atDebug()
          .addKeyValue("source", path)
          .addKeyValue("destinationFileSystem", destinationFileSystem)
          .addKeyValue("destination", parts.get(0))
          .log("Moving path");

    return Futures.safely(() -> destination.rename(renameSource(), sourceConditions, destinationConditions, CancellationSignal.none()));
  }

  /**
   * @return {@code /fileSystem/path} with encoded segments, followed by the query of this client if any
   */
  String renameSource() {
    var escaper = UrlEscapers.urlPathSegmentEscaper();
    var encodedPath = Splitter.on('/').omitEmptyStrings().splitToStream(path).map(escaper::escape).collect(Collectors.joining("/"));
    var source = "/" + escaper.escape(fileSystemName) + "/" + encodedPath;
    return query == null ? source : source + "?" + query;
  }
}
