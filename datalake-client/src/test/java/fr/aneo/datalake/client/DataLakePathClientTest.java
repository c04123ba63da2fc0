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
import fr.aneo.datalake.client.acl.PathAccessControlEntry;
import fr.aneo.datalake.client.acl.RemovePathAccessControlEntry;
import fr.aneo.datalake.client.acl.RolePermissions;
import fr.aneo.datalake.client.exception.PathOperationException;
import fr.aneo.datalake.client.path.AccessConditions;
import fr.aneo.datalake.client.path.PathCreateOptions;
import fr.aneo.datalake.client.path.PathHttpHeaders;
import fr.aneo.datalake.client.path.PathResourceType;
import fr.aneo.datalake.client.testutils.InMemoryPathOperations;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static fr.aneo.datalake.client.testutils.InMemoryPathOperations.serviceError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataLakePathClientTest {

  private Map<String, InMemoryPathOperations> operationsByPath;
  private DataLakeClientBuilder builder;

  @BeforeEach
  void setUp() {
    operationsByPath = new LinkedHashMap<>();
    builder = new DataLakeClientBuilder()
      .withTracing(false)
      .withPathOperationsFactory((fileSystem, path, query) ->
        operationsByPath.computeIfAbsent(fileSystem + "/" + path + (query == null ? "" : "?" + query), key -> new InMemoryPathOperations()));
  }

  @Test
  @DisplayName("createIfNotExists creates the path with an If-None-Match condition on any ETag")
  void create_if_not_exists_creates_with_if_none_match() {
    // Given
    var client = builder.buildPathClient("fs", "dir/file");

    // When
    var result = client.createIfNotExists(PathResourceType.FILE, PathCreateOptions.defaults()).toCompletableFuture().join();

    // Then
    var operations = operationsByPath.get("fs/dir/file");
    assertThat(result.succeeded()).isTrue();
    assertThat(result.pathInfo()).isNotNull();
    assertThat(operations.calls).containsExactly("create:file");
    assertThat(operations.conditions).containsExactly(AccessConditions.ifNotExists());
  }

  @Test
  @DisplayName("createIfNotExists reports false when the path already exists")
  void create_if_not_exists_reports_existing_path() {
    // Given
    var client = builder.buildPathClient("fs", "dir");
    operationsByPath.get("fs/dir").createFailure = serviceError(409, PathOperationException.PATH_ALREADY_EXISTS);

    // When
    var result = client.createIfNotExists(PathResourceType.DIRECTORY, PathCreateOptions.defaults()).toCompletableFuture().join();

    // Then
    assertThat(result.succeeded()).isFalse();
    assertThat(result.pathInfo()).isNull();
  }

  @Test
  @DisplayName("createIfNotExists propagates other service errors")
  void create_if_not_exists_propagates_other_errors() {
    // Given
    var client = builder.buildPathClient("fs", "dir");
    var failure = serviceError(403, "AuthorizationFailure");
    operationsByPath.get("fs/dir").createFailure = failure;

    // When
    var stage = client.createIfNotExists(PathResourceType.DIRECTORY, PathCreateOptions.defaults()).toCompletableFuture();

    // Then
    assertThatThrownBy(stage::join).hasCause(failure);
  }

  @Test
  @DisplayName("exists maps a 404 to false and propagates other failures")
  void exists_maps_not_found_to_false() {
    // Given
    var client = builder.buildPathClient("fs", "file");
    var operations = operationsByPath.get("fs/file");

    // When / Then
    assertThat(client.exists().toCompletableFuture().join()).isTrue();

    operations.propertiesFailure = serviceError(404, null);
    assertThat(client.exists().toCompletableFuture().join()).isFalse();

    operations.propertiesFailure = serviceError(500, "InternalError");
    assertThatThrownBy(() -> client.exists().toCompletableFuture().join()).hasCauseInstanceOf(PathOperationException.class);
  }

  @Test
  @DisplayName("delete follows continuation tokens until the service reports completion")
  void delete_follows_continuations() {
    // Given
    var client = builder.buildPathClient("fs", "big-dir");
    var operations = operationsByPath.get("fs/big-dir");
    operations.deleteContinuations.add("c1");
    operations.deleteContinuations.add("c2");

    // When
    client.delete(true, AccessConditions.none()).toCompletableFuture().join();

    // Then
    assertThat(operations.calls).containsExactly("delete:true:null", "delete:true:c1", "delete:true:c2");
  }

  @Test
  @DisplayName("delete follows thousands of continuation tokens answered synchronously")
  void delete_follows_many_synchronous_continuations() {
    // Given
    var client = builder.buildPathClient("fs", "huge-dir");
    var operations = operationsByPath.get("fs/huge-dir");
    for (int i = 1; i <= 5_000; i++) {
      operations.deleteContinuations.add("c" + i);
    }

    // When
    client.delete(true, AccessConditions.none()).toCompletableFuture().join();

    // Then
    assertThat(operations.calls).hasSize(5_001);
    assertThat(operations.calls).last().isEqualTo("delete:true:c5000");
    assertThat(operations.deleteContinuations).isEmpty();
  }

  @Test
  @DisplayName("deleteIfExists reports false when the path is not found")
  void delete_if_exists_reports_missing_path() {
    // Given
    var client = builder.buildPathClient("fs", "gone");
    operationsByPath.get("fs/gone").deleteFailure = serviceError(404, PathOperationException.PATH_NOT_FOUND);

    // When
    var result = client.deleteIfExists(false, AccessConditions.none()).toCompletableFuture().join();

    // Then
    assertThat(result.succeeded()).isFalse();
  }

  @Test
  @DisplayName("setAccessControl sends the serialized ACL")
  void set_access_control_sends_serialized_acl() {
    // Given
    var client = builder.buildPathClient("fs", "dir");
    var acl = List.of(
      PathAccessControlEntry.user(null, RolePermissions.ALL),
      PathAccessControlEntry.group("g1", RolePermissions.parse("r-x")),
      PathAccessControlEntry.other(RolePermissions.NONE));

    // When
    client.setAccessControl(acl, null, null).toCompletableFuture().join();

    // Then
    assertThat(operationsByPath.get("fs/dir").calls).containsExactly("setAccessControl:user::rwx,group:g1:r-x,other::---");
  }

  @Test
  @DisplayName("removeAccessControlRecursive sends the entries without permissions in remove mode")
  void remove_access_control_recursive_sends_remove_entries() {
    // Given
    var client = builder.buildPathClient("fs", "dir");
    var operations = operationsByPath.get("fs/dir").thenAclBatch(null, 2, 3, 0);

    // When
    var result = client.removeAccessControlRecursive(List.of(RemovePathAccessControlEntry.user("u1").asDefault()),
                                                     AccessControlChangeOptions.defaults())
                       .toCompletableFuture().join();

    // Then
    assertThat(operations.aclRequests).singleElement().satisfies(request -> {
      assertThat(request.mode().value()).isEqualTo("remove");
      assertThat(request.acl()).isEqualTo("default:user:u1");
    });
    assertThat(result.counters().changedFilesCount()).isEqualTo(3);
    assertThat(result.continuationToken()).isEmpty();
  }

  @Test
  @DisplayName("move sends the rename to the destination with the encoded source")
  void move_sends_rename_to_destination() {
    // Given
    var client = builder.withSasToken("?sv=1&sig=abc").buildPathClient("fs", "dir/a file");

    // When
    client.move("other-fs", "target/b?sv=2").toCompletableFuture().join();

    // Then
    var destination = operationsByPath.get("other-fs/target/b?sv=2");
    assertThat(destination.calls).containsExactly("rename");
    assertThat(destination.lastRenameSource).isEqualTo("/fs/dir/a%20file?sv=1&sig=abc");
  }

  @Test
  @DisplayName("move rejects a destination with more than one query string before any call")
  void move_rejects_several_query_strings() {
    // Given
    var client = builder.buildPathClient("fs", "file");

    // When / Then
    assertThatThrownBy(() -> client.move("dest?a=1?b=2"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("more than one query string");
    assertThat(operationsByPath.values()).allSatisfy(operations -> assertThat(operations.calls).isEmpty());
  }

  @Test
  @DisplayName("builder requires a connection configuration when no operations factory is given")
  void builder_requires_connection_configuration() {
    assertThatThrownBy(() -> new DataLakeClientBuilder().buildPathClient("fs", "file"))
      .isInstanceOf(NullPointerException.class)
      .hasMessageContaining("connectionConfiguration");
  }

  @Test
  @DisplayName("setMetadata replaces the metadata of the path with the given conditions")
  void set_metadata_replaces_metadata() {
    // Given
    var client = builder.buildPathClient("fs", "dir/file");
    var conditions = new AccessConditions(null, "\"v1\"", null, null, null);

    // When
    client.setMetadata(Map.of("owner", "team-a", "tier", "hot"), conditions).toCompletableFuture().join();
    var properties = client.getProperties().toCompletableFuture().join();

    // Then
    var operations = operationsByPath.get("fs/dir/file");
    assertThat(operations.calls).containsExactly("setMetadata:{owner=team-a, tier=hot}", "getProperties");
    assertThat(operations.conditions).containsExactly(conditions);
    assertThat(properties.metadata()).containsOnly(Map.entry("owner", "team-a"), Map.entry("tier", "hot"));
  }

  @Test
  @DisplayName("setHttpHeaders forwards the system properties to the path")
  void set_http_headers_forwards_headers() {
    // Given
    var client = builder.buildPathClient("fs", "dir/report.csv");
    var headers = PathHttpHeaders.none().withContentType("text/csv").withCacheControl("no-cache");

    // When
    client.setHttpHeaders(headers, AccessConditions.none()).toCompletableFuture().join();

    // Then
    var operations = operationsByPath.get("fs/dir/report.csv");
    assertThat(operations.calls).containsExactly("setHttpHeaders");
    assertThat(operations.httpHeaders).isEqualTo(headers);
  }

  @Test
  @DisplayName("toDirectoryClient and toFileClient reuse the path and its operations")
  void to_directory_and_file_clients_share_the_path() {
    // Given
    var client = builder.buildPathClient("fs", "data/item");

    // When
    var directory = client.toDirectoryClient();
    var file = client.toFileClient();
    directory.getProperties().toCompletableFuture().join();
    file.getProperties().toCompletableFuture().join();

    // Then
    assertThat(directory.pathClient()).isSameAs(client);
    assertThat(file.pathClient()).isSameAs(client);
    assertThat(file.fileSystemName()).isEqualTo("fs");
    assertThat(file.path()).isEqualTo("data/item");
    assertThat(operationsByPath).containsOnlyKeys("fs/data/item");
    assertThat(operationsByPath.get("fs/data/item").calls).containsExactly("getProperties", "getProperties");
  }

  @Test
  @DisplayName("builder records a span per remote call on the given tracer")
  void builder_traces_calls_with_given_tracer() {
    // Given
    var exporter = InMemorySpanExporter.create();
    try (var tracerProvider = SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build()) {
      var client = builder.withTracing(true).withTracer(tracerProvider.get("test")).buildPathClient("fs", "traced");

      // When
      client.exists().toCompletableFuture().join();

      // Then
      assertThat(exporter.getFinishedSpanItems()).extracting(SpanData::getName).containsExactly("DataLakePath-getProperties");
    }
  }
}
