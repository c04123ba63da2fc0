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
import fr.aneo.datalake.client.internal.concurrent.Futures;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Decorator recording one OpenTelemetry span per remote call.
 * <p>
 * A client span named {@code DataLakePath-<operation>} is started when the call starts, with the
 * file system and the path as attributes. If the call fails or throws, the span gets an
 * {@link StatusCode#ERROR} status and records the exception. The span always ends when the
 * call completes. The span is current while the delegate issues the call.
 * </p>
 */
public final class TracingPathOperations implements PathOperations {
  static final AttributeKey<String> FILE_SYSTEM = AttributeKey.stringKey("datalake.file_system");
  static final AttributeKey<String> PATH = AttributeKey.stringKey("datalake.path");

  private static final Logger logger = LoggerFactory.getLogger(TracingPathOperations.class);
  private static final String SPAN_PREFIX = "DataLakePath-";

  private final PathOperations delegate;
  private final Tracer tracer;
  private final String fileSystem;
  private final String path;

  public TracingPathOperations(PathOperations delegate, Tracer tracer, String fileSystem, String path) {
    this.delegate = requireNonNull(delegate, "delegate must not be null");
    this.tracer = requireNonNull(tracer, "tracer must not be null");
    this.fileSystem = requireNonNull(fileSystem, "fileSystem must not be null");
    this.path = requireNonNull(path, "path must not be null");
  }

  @Override
  public CompletionStage<ChangeAccessControlRecursiveResponse> changeAccessControlRecursive(ChangeAccessControlRecursiveRequest request,
                                                                                            CancellationSignal cancellation) {
    return traced("changeAccessControlRecursive", () -> delegate.changeAccessControlRecursive(request, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> create(PathResourceType resourceType, PathCreateOptions options, CancellationSignal cancellation) {
    return traced("create", () -> delegate.create(resourceType, options, cancellation));
  }

  @Override
  public CompletionStage<Void> appendData(long position, byte[] data, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("appendData", () -> delegate.appendData(position, data, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> flushData(long position, boolean close, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("flushData", () -> delegate.flushData(position, close, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> rename(String renameSource,
                                          AccessConditions sourceConditions,
                                          AccessConditions destinationConditions,
                                          CancellationSignal cancellation) {
    return traced("rename", () -> delegate.rename(renameSource, sourceConditions, destinationConditions, cancellation));
  }

  @Override
  public CompletionStage<DeletePathResponse> delete(boolean recursive, String continuation, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("delete", () -> delegate.delete(recursive, continuation, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathAccessControl> getAccessControl(boolean userPrincipalName, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("getAccessControl", () -> delegate.getAccessControl(userPrincipalName, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> setAccessControl(String acl, String owner, String group, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("setAccessControl", () -> delegate.setAccessControl(acl, owner, group, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> setPermissions(PathPermissions permissions,
                                                  String owner,
                                                  String group,
                                                  AccessConditions conditions,
                                                  CancellationSignal cancellation) {
    return traced("setPermissions", () -> delegate.setPermissions(permissions, owner, group, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathProperties> getProperties(AccessConditions conditions, CancellationSignal cancellation) {
    return traced("getProperties", () -> delegate.getProperties(conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> setMetadata(Map<String, String> metadata, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("setMetadata", () -> delegate.setMetadata(metadata, conditions, cancellation));
  }

  @Override
  public CompletionStage<PathInfo> setHttpHeaders(PathHttpHeaders headers, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("setHttpHeaders", () -> delegate.setHttpHeaders(headers, conditions, cancellation));
  }

  @Override
  public CompletionStage<byte[]> read(long offset, long count, AccessConditions conditions, CancellationSignal cancellation) {
    return traced("read", () -> delegate.read(offset, count, conditions, cancellation));
  }

  private <T> CompletionStage<T> traced(String operation, Supplier<? extends CompletionStage<T>> call) {
    Span span = tracer.spanBuilder(SPAN_PREFIX + operation)
                      .setSpanKind(SpanKind.CLIENT)
                      .setAttribute(FILE_SYSTEM, fileSystem)
                      .setAttribute(PATH, path)
                      .startSpan();

    CompletionStage<T> stage;
    try (var scope = span.makeCurrent()) {
      assert scope != null;
      stage = Futures.safely(call);
    }

    return stage.whenComplete((result, throwable) -> {
      if (throwable != null) {
        var cause = Futures.unwrap(throwable);
        span.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
        span.recordException(cause);
        logger.atDebug()
              .addKeyValue("operation", operation)
              .addKeyValue("path", path)
              .addKeyValue("error", cause.getMessage())
              .log("Path operation failed");
      }
      span.end();
    });
  }
}
