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

import fr.aneo.datalake.client.internal.http.HttpPathOperationsFactory;
import fr.aneo.datalake.client.path.PathOperationsFactory;
import fr.aneo.datalake.client.path.TracingPathOperations;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static java.util.Objects.requireNonNull;

/**
 * Fluent builder of Data Lake path, directory and file clients.
 *
 * <p>Usage:
 * <pre>{@code
 * var builder = new DataLakeClientBuilder()
 *     .withConnectionConfiguration(DataLakeConnectionConfig.forEndpoint("https://account.dfs.core.windows.net"))
 *     .withCredentials(CredentialProvider.bearer(tokenSource::token));
 *
 * DataLakeDirectoryClient directory = builder.buildDirectoryClient("filesystem", "data/2024");
 * }</pre>
 *
 * <p>Notes:
 * <ul>
 *   <li>Without credentials, requests are sent anonymously; combine with {@link #withSasToken(String)}
 *       for SAS authorization.</li>
 *   <li>{@link #withPathOperationsFactory(PathOperationsFactory)} replaces the HTTP transport, in which
 *       case no connection configuration is needed.</li>
 *   <li>Every remote call is traced unless {@link #withTracing(boolean)} disables it. Spans go to the
 *       tracer given to {@link #withTracer(Tracer)}, or to the global OpenTelemetry instance.</li>
 * </ul>
 */
public class DataLakeClientBuilder {
  static final String INSTRUMENTATION_NAME = "fr.aneo.datalake.client";

  private DataLakeConnectionConfig connectionConfiguration;
  private CredentialProvider credentials = CredentialProvider.anonymous();
  private PathOperationsFactory pathOperationsFactory;
  private String sasToken;
  private boolean tracing = true;
  private Tracer tracer;

  /**
   * @param connectionConfiguration endpoint, timeout and retry settings
   * @return this builder
   */
  public DataLakeClientBuilder withConnectionConfiguration(DataLakeConnectionConfig connectionConfiguration) {
    this.connectionConfiguration = connectionConfiguration;
    return this;
  }

  public DataLakeClientBuilder withCredentials(CredentialProvider credentials) {
    this.credentials = requireNonNull(credentials, "credentials must not be null");
    return this;
  }

  /**
   * @param sasToken SAS query string appended to every request, with or without leading {@code ?}
   * @return this builder
   */
  public DataLakeClientBuilder withSasToken(String sasToken) {
    this.sasToken = sasToken != null && sasToken.startsWith("?") ? sasToken.substring(1) : sasToken;
    return this;
  }

  /**
   * Replaces the HTTP transport.
   *
   * @param pathOperationsFactory factory of the remote operations of each path
   * @return this builder
   */
  public DataLakeClientBuilder withPathOperationsFactory(PathOperationsFactory pathOperationsFactory) {
    this.pathOperationsFactory = pathOperationsFactory;
    return this;
  }

  public DataLakeClientBuilder withTracing(boolean tracing) {
    this.tracing = tracing;
    return this;
  }

  public DataLakeClientBuilder withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer must not be null");
    return this;
  }

  public DataLakePathClient buildPathClient(String fileSystemName, String path) {
    return new DataLakePathClient(factory(), fileSystemName, path, sasToken);
  }

  public DataLakeDirectoryClient buildDirectoryClient(String fileSystemName, String path) {
    return new DataLakeDirectoryClient(buildPathClient(fileSystemName, path));
  }

  public DataLakeFileClient buildFileClient(String fileSystemName, String path) {
    return new DataLakeFileClient(buildPathClient(fileSystemName, path));
  }

  /**
   * @throws NullPointerException if neither a connection configuration nor a factory was provided
   */
  private PathOperationsFactory factory() {
    PathOperationsFactory base = pathOperationsFactory;
    if (base == null) {
      requireNonNull(connectionConfiguration, "connectionConfiguration must not be null");
      base = HttpPathOperationsFactory.create(connectionConfiguration, credentials);
    }
    if (!tracing) return base;

    var delegate = base;
    var spans = tracer != null ? tracer : GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
    return (fileSystem, path, query) -> new TracingPathOperations(delegate.forPath(fileSystem, path, query), spans, fileSystem, path);
  }
}
