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
import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathCreateIfNotExistsResult;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.path.PathDeleteIfExistsResult;
import fr.aneo.datalake.client.path.PathHttpHeaders;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathProperties;
import fr.aneo.datalake.client.path.PathResourceType;
import fr.aneo.datalake.client.transfer.ChunkedDownloader;
import fr.aneo.datalake.client.transfer.ChunkedUploader;
import fr.aneo.datalake.client.transfer.FileData;
import fr.aneo.datalake.client.transfer.FileReadOptions;
import fr.aneo.datalake.client.transfer.FileUploadOptions;
import fr.aneo.datalake.client.transfer.FileUploadResult;
import fr.aneo.datalake.client.transfer.InMemoryData;
import fr.aneo.datalake.client.transfer.SeekableData;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Client of a file. Every creation issued through it creates a file.
 *
 * <h2>Writing</h2>
 * <p>
 * A file is written in two steps: {@link #append} stages bytes at a position, then
 * {@link #flush} commits everything staged up to a position, which becomes the file length.
 * The {@code upload} methods do both for a whole payload, in parallel chunks when it is large:
 * </p>
 * <pre>{@code
 * fileClient.uploadFile(Path.of("data.bin"), FileUploadOptions.defaults()
 *                                                            .withMaxConcurrency(8)
 *                                                            .withProgressListener(bytes -> log(bytes)))
 *           .toCompletableFuture()
 *           .join();
 * }</pre>
 *
 * @see ChunkedUploader
 * @see ChunkedDownloader
 */
public final class DataLakeFileClient {
  private final DataLakePathClient pathClient;

  DataLakeFileClient(DataLakePathClient pathClient) {
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

  public CompletionStage<PathInfo> create() {
    return create(PathCreateOptions.defaults());
  }

  /**
   * Creates an empty file, replacing an existing one unless the conditions forbid it.
   */
  public CompletionStage<PathInfo> create(PathCreateOptions options) {
    return pathClient.create(PathResourceType.FILE, options);
  }

  public CompletionStage<PathCreateIfNotExistsResult> createIfNotExists(PathCreateOptions options) {
    return pathClient.createIfNotExists(PathResourceType.FILE, options);
  }

  public CompletionStage<Boolean> exists() {
    return pathClient.exists();
  }

  public CompletionStage<Void> delete() {
    return pathClient.delete(false, AccessConditions.none());
  }

  public CompletionStage<PathDeleteIfExistsResult> deleteIfExists() {
    return pathClient.deleteIfExists(false, AccessConditions.none());
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
   * Moves the file within its file system and returns a client of the destination.
   */
  public CompletionStage<DataLakeFileClient> move(String destinationPath) {
    return move(pathClient.fileSystemName(), destinationPath);
  }

  public CompletionStage<DataLakeFileClient> move(String destinationFileSystem, String destinationPath) {
    return pathClient.move(destinationFileSystem, destinationPath)
                     .thenApply(info -> new DataLakeFileClient(pathClient.moved(destinationFileSystem, destinationPath)));
  }

  /**
   * Stages bytes at the given position. They become readable after {@link #flush}.
   *
   * @param data       bytes to stage
   * @param position   offset of the first byte in the file
   * @param conditions preconditions, typically the lease only
   */
  public CompletionStage<Void> append(byte[] data, long position, AccessConditions conditions) {
    requireNonNull(data, "data must not be null");
    requireNonNull(conditions, "conditions must not be null");
    if (position < 0) throw new IllegalArgumentException("position must be >= 0, got: " + position);
    return Futures.safely(() -> pathClient.operations().appendData(position, data, conditions, CancellationSignal.none()));
  }

  /**
   * Commits the staged bytes up to {@code position}, which becomes the length of the file.
   */
  public CompletionStage<PathInfo> flush(long position, boolean close, AccessConditions conditions) {
    requireNonNull(conditions, "conditions must not be null");
    if (position < 0) throw new IllegalArgumentException("position must be >= 0, got: " + position);
    return Futures.safely(() -> pathClient.operations().flushData(position, close, conditions, CancellationSignal.none()));
  }

  public CompletionStage<FileUploadResult> upload(byte[] data, FileUploadOptions options) {
    return upload(InMemoryData.from(data), options);
  }

  /**
   * Uploads a local file.
   *
   * @throws fr.aneo.datalake.client.exception.DataLakeException if the local file does not exist or cannot be read
   */
  public CompletionStage<FileUploadResult> uploadFile(Path file, FileUploadOptions options) {
    return upload(FileData.from(file), options);
  }

  /**
   * Uploads a stream of unknown length, replacing the content of the file. The stream is not closed.
   *
   * @throws IllegalArgumentException if an option is out of bounds
   * @see ChunkedUploader#uploadStream(InputStream, FileUploadOptions)
   */
  public CompletionStage<FileUploadResult> uploadStream(InputStream stream, FileUploadOptions options) {
    return new ChunkedUploader(pathClient.operations()).uploadStream(stream, options);
  }

  /**
   * Uploads a payload, replacing the content of the file.
   *
   * @throws IllegalArgumentException if the payload is too large or an option is out of bounds
   */
  public CompletionStage<FileUploadResult> upload(SeekableData data, FileUploadOptions options) {
    return new ChunkedUploader(pathClient.operations()).upload(data, options);
  }

  /**
   * Reads a range of the file into memory with parallel ranged reads.
   */
  public CompletionStage<byte[]> readToBuffer(FileReadOptions options) {
    return new ChunkedDownloader(pathClient.operations()).readToBuffer(options);
  }

  /**
   * Reads a range of the file into a new local file with parallel ranged reads.
   *
   * @param target local file to create; the download fails if it exists
   * @return the number of bytes written
   */
  public CompletionStage<Long> readToFile(Path target, FileReadOptions options) {
    return new ChunkedDownloader(pathClient.operations()).readToFile(target, options);
  }
}
