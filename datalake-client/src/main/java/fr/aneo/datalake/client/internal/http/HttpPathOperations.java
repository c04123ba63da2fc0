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

import com.google.common.base.Strings;
import fr.aneo.datalake.client.CredentialProvider;
import fr.aneo.datalake.client.DataLakeConnectionConfig;
import fr.aneo.datalake.client.RetryPolicy;
import fr.aneo.datalake.client.acl.PathAccessControl;
import fr.aneo.datalake.client.acl.PathPermissions;
import fr.aneo.datalake.client.concurrent.CancellationSignal;
import fr.aneo.datalake.client.exception.PathOperationException;
import fr.aneo.datalake.client.internal.concurrent.Futures;
import fr.aneo.datalake.client.internal.retry.RetryableOperation;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.ChangeAccessControlRecursiveRequest;
import fr.aneo.datalake.client.path.ChangeAccessControlRecursiveResponse;
import fr.aneo.datalake.client.path.DeletePathResponse;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.path.PathHttpHeaders;
import fr.aneo.datalake.client.path.PathInfo;
import fr.aneo.datalake.client.path.PathOperations;
import fr.aneo.datalake.client.path.PathProperties;
import fr.aneo.datalake.client.path.PathResourceType;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * {@link PathOperations} over the DFS REST surface, on top of {@link HttpClient}.
 * <p>
 * Every call is retried on transient failures according to the configured {@link RetryPolicy},
 * each attempt getting a fresh {@code Authorization} header and client request id. A response
 * with a status of 400 or more fails the call with a {@link PathOperationException}. Triggering
 * the cancellation signal cancels the in-flight exchange.
 * </p>
 */
public final class HttpPathOperations implements PathOperations {
  static final String SERVICE_VERSION = "2020-02-10";

  private final HttpClient httpClient;
  private final DataLakeConnectionConfig config;
  private final CredentialProvider credentials;
  private final String fileSystem;
  private final String path;
  private final String query;
  private final RetryPolicy retryPolicy;
  private final DfsResponseMapper mapper = new DfsResponseMapper();

  public HttpPathOperations(HttpClient httpClient,
                            DataLakeConnectionConfig config,
                            CredentialProvider credentials,
                            String fileSystem,
                            String path,
                            String query) {
    this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.credentials = requireNonNull(credentials, "credentials must not be null");
    this.fileSystem = requireNonNull(fileSystem, "fileSystem must not be null");
    this.path = requireNonNull(path, "path must not be null");
    this.query = query;
    this.retryPolicy = config.retryPolicy();
  }

  @Override
  public CompletionStage<ChangeAccessControlRecursiveResponse> changeAccessControlRecursive(ChangeAccessControlRecursiveRequest request,
                                                                                            CancellationSignal cancellation) {
    var uri = uri().parameter("action", "setAccessControlRecursive")
                   .parameter("mode", request.mode().value())
                   .parameter("maxRecords", request.maxRecords())
                   .parameter("continuation", request.continuation())
                   .parameter("forceFlag", request.forceFlag())
                   .build();
    return send("SetAccessControlRecursive", cancellation, mapper::changeAccessControlRecursive,
      builder -> builder.uri(uri).method("PATCH", BodyPublishers.noBody()).header(DfsHeaders.ACL, request.acl()));
  }

  @Override
  public CompletionStage<PathInfo> create(PathResourceType resourceType, PathCreateOptions options, CancellationSignal cancellation) {
    var uri = uri().parameter("resource", resourceType.value()).build();
    return send("Create", cancellation, mapper::pathInfo, builder -> {
      builder.uri(uri).PUT(BodyPublishers.noBody());
      optionalHeader(builder, DfsHeaders.PROPERTIES, DfsResponseMapper.encodeProperties(options.metadata()));
      optionalHeader(builder, DfsHeaders.PERMISSIONS, options.permissions());
      optionalHeader(builder, DfsHeaders.UMASK, options.umask());
      conditions(builder, options.conditions());
    });
  }

  @Override
  public CompletionStage<Void> appendData(long position, byte[] data, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("action", "append").parameter("position", position).build();
    return send("Append", cancellation, response -> null, builder -> {
      builder.uri(uri).method("PATCH", BodyPublishers.ofByteArray(data));
      optionalHeader(builder, DfsHeaders.LEASE_ID, conditions.leaseId());
    });
  }

  @Override
  public CompletionStage<PathInfo> flushData(long position, boolean close, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("action", "flush").parameter("position", position).parameter("close", close).build();
    return send("Flush", cancellation, response -> mapper.flushInfo(response, position), builder -> {
      builder.uri(uri).method("PATCH", BodyPublishers.noBody());
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<PathInfo> rename(String renameSource,
                                          AccessConditions sourceConditions,
                                          AccessConditions destinationConditions,
                                          CancellationSignal cancellation) {
    var uri = uri().parameter("mode", "legacy").build();
    return send("Rename", cancellation, mapper::pathInfo, builder -> {
      builder.uri(uri).PUT(BodyPublishers.noBody()).header(DfsHeaders.RENAME_SOURCE, renameSource);
      optionalHeader(builder, DfsHeaders.SOURCE_LEASE_ID, sourceConditions.leaseId());
      optionalHeader(builder, DfsHeaders.SOURCE_IF_MATCH, sourceConditions.ifMatch());
      optionalHeader(builder, DfsHeaders.SOURCE_IF_NONE_MATCH, sourceConditions.ifNoneMatch());
      optionalHeader(builder, DfsHeaders.SOURCE_IF_MODIFIED_SINCE, DfsResponseMapper.formatDate(sourceConditions.ifModifiedSince()));
      optionalHeader(builder, DfsHeaders.SOURCE_IF_UNMODIFIED_SINCE, DfsResponseMapper.formatDate(sourceConditions.ifUnmodifiedSince()));
      conditions(builder, destinationConditions);
    });
  }

  @Override
  public CompletionStage<DeletePathResponse> delete(boolean recursive, String continuation, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("recursive", recursive).parameter("continuation", continuation).build();
    return send("Delete", cancellation, mapper::delete, builder -> {
      builder.uri(uri).DELETE();
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<PathAccessControl> getAccessControl(boolean userPrincipalName, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("action", "getAccessControl").parameter("upn", userPrincipalName).build();
    return send("GetAccessControl", cancellation, mapper::accessControl, builder -> {
      builder.uri(uri).method("HEAD", BodyPublishers.noBody());
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<PathInfo> setAccessControl(String acl, String owner, String group, AccessConditions conditions, CancellationSignal cancellation) {
    return setAccessControl("SetAccessControl", DfsHeaders.ACL, acl, owner, group, conditions, cancellation);
  }

  @Override
  public CompletionStage<PathInfo> setPermissions(PathPermissions permissions,
                                                  String owner,
                                                  String group,
                                                  AccessConditions conditions,
                                                  CancellationSignal cancellation) {
    return setAccessControl("SetPermissions", DfsHeaders.PERMISSIONS, permissions.toSymbolic(), owner, group, conditions, cancellation);
  }

  @Override
  public CompletionStage<PathProperties> getProperties(AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().build();
    return send("GetProperties", cancellation, mapper::properties, builder -> {
      builder.uri(uri).method("HEAD", BodyPublishers.noBody());
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<PathInfo> setMetadata(Map<String, String> metadata, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("action", "setProperties").build();
    var properties = Strings.nullToEmpty(DfsResponseMapper.encodeProperties(metadata));
    return send("SetMetadata", cancellation, mapper::pathInfo, builder -> {
      builder.uri(uri).method("PATCH", BodyPublishers.noBody()).header(DfsHeaders.PROPERTIES, properties);
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<PathInfo> setHttpHeaders(PathHttpHeaders headers, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().parameter("action", "setProperties").build();
    return send("SetHttpHeaders", cancellation, mapper::pathInfo, builder -> {
      builder.uri(uri).method("PATCH", BodyPublishers.noBody());
      optionalHeader(builder, DfsHeaders.CACHE_CONTROL, headers.cacheControl());
      optionalHeader(builder, DfsHeaders.CONTENT_TYPE, headers.contentType());
      optionalHeader(builder, DfsHeaders.CONTENT_ENCODING, headers.contentEncoding());
      optionalHeader(builder, DfsHeaders.CONTENT_LANGUAGE, headers.contentLanguage());
      optionalHeader(builder, DfsHeaders.CONTENT_DISPOSITION, headers.contentDisposition());
      optionalHeader(builder, DfsHeaders.CONTENT_MD5, headers.contentMd5());
      conditions(builder, conditions);
    });
  }

  @Override
  public CompletionStage<byte[]> read(long offset, long count, AccessConditions conditions, CancellationSignal cancellation) {
    var uri = uri().build();
    return send("Read", cancellation, HttpResponse::body, builder -> {
      builder.uri(uri).GET().header(DfsHeaders.RANGE, "bytes=" + offset + "-" + (offset + count - 1));
      conditions(builder, conditions);
    });
  }

  private CompletionStage<PathInfo> setAccessControl(String operation,
                                                     String header,
                                                     String value,
                                                     String owner,
                                                     String group,
                                                     AccessConditions conditions,
                                                     CancellationSignal cancellation) {
    var uri = uri().parameter("action", "setAccessControl").build();
    return send(operation, cancellation, mapper::pathInfo, builder -> {
      builder.uri(uri).method("PATCH", BodyPublishers.noBody()).header(header, value);
      optionalHeader(builder, DfsHeaders.OWNER, owner);
      optionalHeader(builder, DfsHeaders.GROUP, group);
      conditions(builder, conditions);
    });
  }

  private DfsUriBuilder uri() {
    return DfsUriBuilder.forPath(config.endpoint(), fileSystem, path, query);
  }

  private <T> CompletionStage<T> send(String operation,
                                      CancellationSignal cancellation,
                                      Function<HttpResponse<byte[]>, T> mapping,
                                      Consumer<HttpRequest.Builder> requestCustomizer) {
    return RetryableOperation.execute(() -> attempt(operation, cancellation, mapping, requestCustomizer), retryPolicy, cancellation);
  }

  private <T> CompletionStage<T> attempt(String operation,
                                         CancellationSignal cancellation,
                                         Function<HttpResponse<byte[]>, T> mapping,
                                         Consumer<HttpRequest.Builder> requestCustomizer) {
    if (cancellation.isCancelled()) {
      return failedFuture(new CancellationException(operation + " was cancelled"));
    }

    var builder = HttpRequest.newBuilder()
                             .timeout(config.requestTimeout())
                             .header(DfsHeaders.VERSION, SERVICE_VERSION)
                             .header(DfsHeaders.CLIENT_REQUEST_ID, UUID.randomUUID().toString());
    credentials.authorizationHeader().ifPresent(value -> builder.header(DfsHeaders.AUTHORIZATION, value));
    requestCustomizer.accept(builder);

    var exchange = httpClient.sendAsync(builder.build(), BodyHandlers.ofByteArray());
    var registration = cancellation.onCancel(() -> exchange.cancel(true));

    return exchange.handle((response, throwable) -> {
      registration.remove();
      if (throwable != null) {
        var cause = Futures.unwrap(throwable);
        if (cause instanceof CancellationException cancelled) throw cancelled;
        if (cause instanceof IOException) throw new PathOperationException(operation + " failed: " + cause.getMessage(), cause);
        throw new PathOperationException(operation + " failed", cause);
      }
      if (response.statusCode() >= 400) throw mapper.error(operation, response);
      return mapping.apply(response);
    });
  }

  private static void conditions(HttpRequest.Builder builder, AccessConditions conditions) {
    optionalHeader(builder, DfsHeaders.LEASE_ID, conditions.leaseId());
    optionalHeader(builder, DfsHeaders.IF_MATCH, conditions.ifMatch());
    optionalHeader(builder, DfsHeaders.IF_NONE_MATCH, conditions.ifNoneMatch());
    optionalHeader(builder, DfsHeaders.IF_MODIFIED_SINCE, DfsResponseMapper.formatDate(conditions.ifModifiedSince()));
    optionalHeader(builder, DfsHeaders.IF_UNMODIFIED_SINCE, DfsResponseMapper.formatDate(conditions.ifUnmodifiedSince()));
  }

  private static void optionalHeader(HttpRequest.Builder builder, String name, String value) {
    if (value != null) builder.header(name, value);
  }
}
