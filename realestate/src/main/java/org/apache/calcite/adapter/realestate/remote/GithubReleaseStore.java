/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.realestate.remote;

import org.apache.calcite.adapter.realestate.NetworkException;
import org.apache.calcite.adapter.realestate.cache.CacheFormat;
import org.apache.calcite.adapter.realestate.retry.Deadline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RemoteStore} backed by the assets of a GitHub release.
 *
 * <p>Lists assets through {@code GET /repos/{owner}/{repo}/releases/tags/{tag}}
 * and downloads them from their {@code browser_download_url}. Asset names that
 * are not {@code <id>.json.gz}, {@code <id>.csv.gz} or {@code <id>.csv} are
 * ignored. A {@code GITHUB_TOKEN} from the environment, when present, is sent
 * as a bearer token.
 */
public class GithubReleaseStore implements RemoteStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(GithubReleaseStore.class);

  private static final String USER_AGENT = "realestate-data/1.0";

  private final HttpClient httpClient;
  private final ObjectMapper mapper;
  private final String apiBaseUrl;
  private final Duration requestTimeout;
  private final @Nullable String token;

  public GithubReleaseStore(String apiBaseUrl, Duration requestTimeout) {
    this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        new ObjectMapper(), apiBaseUrl, requestTimeout, System.getenv("GITHUB_TOKEN"));
  }

  public GithubReleaseStore(HttpClient httpClient, ObjectMapper mapper, String apiBaseUrl,
      Duration requestTimeout, @Nullable String token) {
    this.httpClient = httpClient;
    this.mapper = mapper;
    this.apiBaseUrl = apiBaseUrl.endsWith("/")
        ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1)
        : apiBaseUrl;
    this.requestTimeout = requestTimeout;
    this.token = token == null || token.isEmpty() ? null : token;
  }

  @Override public List<RemoteAsset> listAssets(String repository, String tag,
      Deadline deadline) throws IOException {
    String url = apiBaseUrl + "/repos/" + repository + "/releases/tags/" + tag;
    HttpRequest request = newRequest(url, deadline)
        .header("Accept", "application/vnd.github+json")
        .GET()
        .build();
    HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() == 404) {
      throw new NetworkException("Release '" + tag + "' not found in " + repository, false);
    }
    checkStatus(response.statusCode(), url);

    JsonNode release;
    try {
      release = mapper.readTree(response.body());
    } catch (IOException e) {
      throw new NetworkException("Malformed release listing from " + url, false, e);
    }
    List<RemoteAsset> assets = new ArrayList<>();
    for (JsonNode node : release.path("assets")) {
      String name = node.path("name").asText("");
      CacheFormat format = CacheFormat.fromFileName(name);
      if (format == null) {
        LOGGER.trace("Skipping asset {} with unsupported format", name);
        continue;
      }
      Instant updatedAt;
      try {
        updatedAt = Instant.parse(node.path("updated_at").asText());
      } catch (DateTimeParseException e) {
        LOGGER.debug("Asset {} has no usable updated_at: {}", name, e.getMessage());
        updatedAt = Instant.EPOCH;
      }
      String digest = node.hasNonNull("digest") ? node.get("digest").asText() : null;
      assets.add(
          new RemoteAsset(name, format, node.path("size").asLong(0), updatedAt,
              node.path("browser_download_url").asText(), digest));
    }
    LOGGER.debug("Release {}@{} lists {} cache assets", repository, tag, assets.size());
    return assets;
  }

  @Override public void download(RemoteAsset asset, Path target, Deadline deadline)
      throws IOException {
    HttpRequest request = newRequest(asset.getDownloadUrl(), deadline)
        .header("Accept", "application/octet-stream")
        .GET()
        .build();
    HttpResponse<Path> response = send(request, HttpResponse.BodyHandlers.ofFile(target));
    if (response.statusCode() != 200) {
      Files.deleteIfExists(target);
      if (response.statusCode() == 404) {
        throw new NetworkException("Asset " + asset.getName() + " not found", false);
      }
      checkStatus(response.statusCode(), asset.getDownloadUrl());
    }
  }

  private HttpRequest.Builder newRequest(String url, Deadline deadline) {
    Duration timeout = deadline.cap(requestTimeout);
    if (timeout.isZero()) {
      throw new NetworkException("Deadline expired before requesting " + url, true);
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(timeout)
        .header("User-Agent", USER_AGENT);
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return builder;
  }

  private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
      throws IOException {
    try {
      return httpClient.send(request, handler);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NetworkException("Interrupted while requesting " + request.uri(), false, e);
    }
  }

  private static void checkStatus(int status, String url) {
    if (status == 200) {
      return;
    }
    boolean retryable = status == 429 || status >= 500;
    throw new NetworkException("HTTP " + status + " from " + url, retryable);
  }
}
