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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds request URIs of the DFS REST surface: {@code endpoint/fileSystem/path?params&query}.
 * <p>
 * Path segments and parameter values are percent-encoded; the raw query of the client, such
 * as a SAS, is appended as is.
 */
final class DfsUriBuilder {
  private static final Escaper SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
  private static final Escaper PARAMETER_ESCAPER = UrlEscapers.urlFormParameterEscaper();
  private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();

  private final String base;
  private final String rawQuery;
  private final List<String> parameters = new ArrayList<>();

  private DfsUriBuilder(String base, String rawQuery) {
    this.base = base;
    this.rawQuery = rawQuery;
  }

  static DfsUriBuilder forPath(String endpoint, String fileSystem, String path, String rawQuery) {
    var encodedPath = PATH_SPLITTER.splitToStream(path)
                                   .map(SEGMENT_ESCAPER::escape)
                                   .collect(Collectors.joining("/"));
    var base = endpoint + "/" + SEGMENT_ESCAPER.escape(fileSystem) + (encodedPath.isEmpty() ? "" : "/" + encodedPath);
    return new DfsUriBuilder(base, Strings.emptyToNull(rawQuery));
  }

  /**
   * Adds a query parameter; a {@code null} value is skipped.
   */
  DfsUriBuilder parameter(String name, Object value) {
    if (value != null) {
      parameters.add(name + "=" + PARAMETER_ESCAPER.escape(value.toString()));
    }
    return this;
  }

  URI build() {
    var query = new ArrayList<>(parameters);
    if (rawQuery != null) query.add(rawQuery);
    return URI.create(query.isEmpty() ? base : base + "?" + Joiner.on('&').join(query));
  }
}
