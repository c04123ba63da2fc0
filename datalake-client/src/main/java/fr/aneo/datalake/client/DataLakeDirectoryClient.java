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

import fr.aneo.datalake.client.acl.AccessControlChangeOptions;
import fr.aneo.datalake.client.acl.AccessControlChangeResult;
import fr.aneo.datalake.client.acl.PathAccessControl;
import fr.aneo.datalake.client.acl.PathAccessControlEntry;
import fr.aneo.datalake.client.acl.PathPermissions;
import fr.aneo.datalake.client.acl.RemovePathAccessControlEntry;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathCreateIfNotExistsResult;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.path.PathDeleteIfExistsResult;
import fr.aneo.datalake.client.path.PathHttpHeaders;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathProperties;
import fr.aneo.datalake.client.path.PathResourceType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Client of a directory. Every creation issued through it creates a directory.
 *
 * @see DataLakePathClient
 */
public final class DataLakeDirectoryClient {
  private final DataLakePathClient pathClient;

  DataLakeDirectoryClient(DataLakePathClient pathClient) {
    this.pathClient = requireNonNull(pathClient, "pathClient must not be null");
  }

  public String fileSystemName() {
    return pathClient.fileSystemName();
  }

  public String path() {
    return pathClient.path();
  }

  public DataLakePathClient pathClient() {
    return pathClient;
  }

  public DataLakeDirectoryClient getSubdirectoryClient(String name) {
    return new DataLakeDirectoryClient(pathClient.child(name));
  }

  public DataLakeFileClient getFileClient(String name) {
    return new DataLakeFileClient(pathClient.child(name));
  }

  public CompletionStage<PathInfo> create() {
    return create(PathCreateOptions.defaults());
  }

  public CompletionStage<PathInfo> create(PathCreateOptions options) {
    return pathClient.create(PathResourceType.DIRECTORY, options);
  }

  public CompletionStage<PathCreateIfNotExistsResult> createIfNotExists(PathCreateOptions options) {
    return pathClient.createIfNotExists(PathResourceType.DIRECTORY, options);
  }

  public CompletionStage<Boolean> exists() {
    return pathClient.exists();
  }

  /**
   * @param recursive whether the directory is deleted with its content; a non-recursive delete of a non-empty directory fails
   */
  public CompletionStage<Void> delete(boolean recursive) {
    return pathClient.delete(recursive, AccessConditions.none());
  }

  public CompletionStage<PathDeleteIfExistsResult> deleteIfExists(boolean recursive) {
    return pathClient.deleteIfExists(recursive, AccessConditions.none());
  }

  public CompletionStage<PathProperties> getProperties() {
    return pathClient.getProperties();
  }

  public CompletionStage<PathInfo> setMetadata(Map<String, String> metadata) {
    return pathClient.setMetadata(metadata, AccessConditions.none());
  }

  public CompletionStage<PathInfo> setHttpHeaders(PathHttpHeaders headers) {
    return pathClient.setHttpHeaders(headers, AccessConditions.none());
  }

  public CompletionStage<PathAccessControl> getAccessControl() {
    return pathClient.getAccessControl(false);
  }

  public CompletionStage<PathInfo> setAccessControl(List<PathAccessControlEntry> acl) {
    return pathClient.setAccessControl(acl, null, null);
  }

  public CompletionStage<PathInfo> setPermissions(PathPermissions permissions) {
    return pathClient.setPermissions(permissions, null, null);
  }

  public CompletionStage<AccessControlChangeResult> setAccessControlRecursive(List<PathAccessControlEntry> acl, AccessControlChangeOptions options) {
    return pathClient.setAccessControlRecursive(acl, options);
  }

  public CompletionStage<AccessControlChangeResult> updateAccessControlRecursive(List<PathAccessControlEntry> acl, AccessControlChangeOptions options) {
    return pathClient.updateAccessControlRecursive(acl, options);
  }

  public CompletionStage<AccessControlChangeResult> removeAccessControlRecursive(List<RemovePathAccessControlEntry> acl, AccessControlChangeOptions options) {
    return pathClient.removeAccessControlRecursive(acl, options);
  }

  /**
   * Moves the directory within its file system and returns a client of the destination.
   */
  public CompletionStage<DataLakeDirectoryClient> move(String destinationPath) {
    return move(pathClient.fileSystemName(), destinationPath);
  }

  public CompletionStage<DataLakeDirectoryClient> move(String destinationFileSystem, String destinationPath) {
    return pathClient.move(destinationFileSystem, destinationPath)
                     .thenApply(info -> new DataLakeDirectoryClient(pathClient.moved(destinationFileSystem, destinationPath)));
  }
}
