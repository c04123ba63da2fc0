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

import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Supplies the {@code Authorization} header of each request.
 * <p>
 * Invoked once per HTTP attempt, so implementations may refresh expiring tokens. Requests
 * authorized through a SAS query string use {@link #anonymous()}.
 */
@FunctionalInterface
public interface CredentialProvider {

  /**
   * @return the header value, or empty to send the request without {@code Authorization}
   */
  Optional<String> authorizationHeader();

  static CredentialProvider anonymous() {
    return Optional::empty;
  }

  /**
   * @param tokenSupplier supplies an OAuth access token, called for every request
   * @return a provider sending {@code Bearer <token>}
   */
  static CredentialProvider bearer(Supplier<String> tokenSupplier) {
    requireNonNull(tokenSupplier, "tokenSupplier must not be null");
    return () -> Optional.of("Bearer " + tokenSupplier.get());
  }
}
