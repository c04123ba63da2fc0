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

/**
 * Creates the {@link PathOperations} bound to a given path.
 * <p>
 * Used by the clients to derive child and rename-destination clients.
 */
@FunctionalInterface
public interface PathOperationsFactory {

  /**
   * @param fileSystem file system name
   * @param path       path relative to the file system root, without leading slash
   * @param query      raw query string to append to every request (for instance a SAS), or {@code null}
   * @return operations bound to that path
   */
  PathOperations forPath(String fileSystem, String path, String query);
}
