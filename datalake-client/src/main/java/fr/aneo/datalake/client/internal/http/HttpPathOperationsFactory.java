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

import fr.aneo.datalake.client.CredentialProvider;
import fr.aneo.datalake.client.DataLakeConnectionConfig;
import fr.aneo.datalake.client.path.PathOperations;
import fr.aneo.datalake.client.path.PathOperationsFactory;

import java.net.http.HttpClient;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link HttpPathOperations} sharing one {@link HttpClient}.
 */
public final class HttpPathOperationsFactory implements PathOperationsFactory {
  private final HttpClient httpClient;
  private final DataLakeConnectionConfig config;
  private final CredentialProvider credentials;

  public HttpPathOperationsFactory(HttpClient httpClient, DataLakeConnectionConfig config, CredentialProvider credentials) {
    this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.credentials = requireNonNull(credentials, "credentials must not be null");
  }

  public static HttpPathOperationsFactory create(DataLakeConnectionConfig config, CredentialProvider credentials) {
    var httpClient = HttpClient.newBuilder()
                               .connectTimeout(config.requestTimeout())
                               .followRedirects(HttpClient.Redirect.NEVER)
                               .build();
    return new HttpPathOperationsFactory(httpClient, config, credentials);
  }

  @Override
  public PathOperations forPath(String fileSystem, String path, String query) {
    return new HttpPathOperations(httpClient, config, credentials, fileSystem, path, query);
  }
}
