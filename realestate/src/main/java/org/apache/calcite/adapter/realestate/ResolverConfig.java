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
package org.apache.calcite.adapter.realestate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Settings of a {@link DatasetResolver}.
 *
 * <p>Defaults come from the classpath resource {@value #DEFAULT_RESOURCE}; an
 * operand map may override any key, either nested ({@code remote: {tag: x}})
 * or flat with dots ({@code remote.tag: x}). String values may use
 * {@code ${VAR:default}} placeholders.
 */
public final class ResolverConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResolverConfig.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_RESOURCE = "/realestate/realestate.yaml";
  public static final String DEFAULT_REPOSITORY = "viniciusoike/realestatebr";
  public static final String DEFAULT_TAG = "cache-latest";
  public static final String DEFAULT_API_BASE_URL = "https://api.github.com";

  private final Path cacheDirectory;
  private final String remoteRepository;
  private final String remoteTag;
  private final String remoteApiBaseUrl;
  private final Duration retryBaseDelay;
  private final Duration retryMaxDelay;
  private final Duration httpRequestTimeout;
  private final Duration resolveDeadline;
  private final int defaultMaxAgeDays;
  private final Duration lockTimeout;
  private final int maxFutureDays;

  private ResolverConfig(Builder b) {
    this.cacheDirectory = b.cacheDirectory;
    this.remoteRepository = b.remoteRepository;
    this.remoteTag = b.remoteTag;
    this.remoteApiBaseUrl = b.remoteApiBaseUrl;
    this.retryBaseDelay = b.retryBaseDelay;
    this.retryMaxDelay = b.retryMaxDelay;
    this.httpRequestTimeout = b.httpRequestTimeout;
    this.resolveDeadline = b.resolveDeadline;
    this.defaultMaxAgeDays = b.defaultMaxAgeDays;
    this.lockTimeout = b.lockTimeout;
    this.maxFutureDays = b.maxFutureDays;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configuration from the bundled defaults only. */
  public static ResolverConfig load() {
    return fromOperand(null);
  }

  /**
   * Bundled defaults overridden by {@code operand}.
   *
   * @throws ValidationException if the bundled resource cannot be read or a
   *     value has the wrong type
   */
  public static ResolverConfig fromOperand(@Nullable Map<String, Object> operand) {
    JsonNode defaults;
    try {
      defaults = YamlUtils.loadResource(DEFAULT_RESOURCE);
    } catch (IOException e) {
      LOGGER.warn("Could not read {}, using built-in defaults: {}", DEFAULT_RESOURCE,
          e.getMessage());
      defaults = MissingNode.getInstance();
    }
    JsonNode overrides = operand == null
        ? MissingNode.getInstance()
        : MAPPER.valueToTree(operand);

    Builder b = builder();
    String dir = text(overrides, defaults, "cacheDirectory");
    if (dir != null && !dir.trim().isEmpty()) {
      b.cacheDirectory(Paths.get(dir.trim()));
    }
    String repository = text(overrides, defaults, "remote.repository");
    if (repository != null && !repository.isEmpty()) {
      b.remoteRepository(repository);
    }
    String tag = text(overrides, defaults, "remote.tag");
    if (tag != null && !tag.isEmpty()) {
      b.remoteTag(tag);
    }
    String apiBaseUrl = text(overrides, defaults, "remote.apiBaseUrl");
    if (apiBaseUrl != null && !apiBaseUrl.isEmpty()) {
      b.remoteApiBaseUrl(apiBaseUrl);
    }
    Long baseDelay = number(overrides, defaults, "retry.baseDelayMs");
    if (baseDelay != null) {
      b.retryBaseDelay(Duration.ofMillis(baseDelay));
    }
    Long maxDelay = number(overrides, defaults, "retry.maxDelayMs");
    if (maxDelay != null) {
      b.retryMaxDelay(Duration.ofMillis(maxDelay));
    }
    Long requestTimeout = number(overrides, defaults, "http.requestTimeoutSeconds");
    if (requestTimeout != null) {
      b.httpRequestTimeout(Duration.ofSeconds(requestTimeout));
    }
    Long deadline = number(overrides, defaults, "resolve.deadlineSeconds");
    if (deadline != null) {
      b.resolveDeadline(Duration.ofSeconds(deadline));
    }
    Long maxAge = number(overrides, defaults, "cache.defaultMaxAgeDays");
    if (maxAge != null) {
      b.defaultMaxAgeDays(maxAge.intValue());
    }
    Long lockTimeout = number(overrides, defaults, "cache.lockTimeoutMs");
    if (lockTimeout != null) {
      b.lockTimeout(Duration.ofMillis(lockTimeout));
    }
    Long futureDays = number(overrides, defaults, "validation.maxFutureDays");
    if (futureDays != null) {
      b.maxFutureDays(futureDays.intValue());
    }
    return b.build();
  }

  private static @Nullable JsonNode find(JsonNode overrides, JsonNode defaults, String key) {
    for (JsonNode root : new JsonNode[] {overrides, defaults}) {
      if (root instanceof ObjectNode) {
        JsonNode flat = root.get(key);
        if (flat != null && !flat.isNull()) {
          return flat;
        }
        JsonNode nested = root.at("/" + key.replace('.', '/'));
        if (!nested.isMissingNode() && !nested.isNull()) {
          return nested;
        }
      }
    }
    return null;
  }

  private static @Nullable String text(JsonNode overrides, JsonNode defaults, String key) {
    JsonNode node = find(overrides, defaults, key);
    return node == null ? null : ConfigUtils.resolveEnvVar(node.asText());
  }

  private static @Nullable Long number(JsonNode overrides, JsonNode defaults, String key) {
    JsonNode node = find(overrides, defaults, key);
    if (node == null) {
      return null;
    }
    if (node.isNumber()) {
      return node.asLong();
    }
    String value = ConfigUtils.resolveEnvVar(node.asText());
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("Configuration key '" + key
          + "' must be a number, got '" + value + "'");
    }
  }

  public Path getCacheDirectory() {
    return cacheDirectory;
  }

  public String getRemoteRepository() {
    return remoteRepository;
  }

  public String getRemoteTag() {
    return remoteTag;
  }

  public String getRemoteApiBaseUrl() {
    return remoteApiBaseUrl;
  }

  public Duration getRetryBaseDelay() {
    return retryBaseDelay;
  }

  public Duration getRetryMaxDelay() {
    return retryMaxDelay;
  }

  public Duration getHttpRequestTimeout() {
    return httpRequestTimeout;
  }

  /** Time limit of one resolve call; zero means unbounded. */
  public Duration getResolveDeadline() {
    return resolveDeadline;
  }

  public int getDefaultMaxAgeDays() {
    return defaultMaxAgeDays;
  }

  public Duration getLockTimeout() {
    return lockTimeout;
  }

  public int getMaxFutureDays() {
    return maxFutureDays;
  }

  @Override public String toString() {
    return "ResolverConfig{cacheDirectory=" + cacheDirectory
        + ", remote=" + remoteRepository + "@" + remoteTag
        + ", apiBaseUrl=" + remoteApiBaseUrl
        + ", retry=" + retryBaseDelay.toMillis() + ".." + retryMaxDelay.toMillis() + "ms"
        + ", deadline=" + resolveDeadline.getSeconds() + "s}";
  }

  /** Builder for {@link ResolverConfig}; starts from built-in defaults. */
  public static final class Builder {
    private Path cacheDirectory = Paths.get(System.getProperty("user.home"),
        ".realestate", "cache");
    private String remoteRepository = DEFAULT_REPOSITORY;
    private String remoteTag = DEFAULT_TAG;
    private String remoteApiBaseUrl = DEFAULT_API_BASE_URL;
    private Duration retryBaseDelay = Duration.ofMillis(1000);
    private Duration retryMaxDelay = Duration.ofMillis(30000);
    private Duration httpRequestTimeout = Duration.ofSeconds(60);
    private Duration resolveDeadline = Duration.ofSeconds(300);
    private int defaultMaxAgeDays = 14;
    private Duration lockTimeout = Duration.ofSeconds(10);
    private int maxFutureDays = 90;

    private Builder() {
    }

    public Builder cacheDirectory(Path cacheDirectory) {
      this.cacheDirectory = cacheDirectory;
      return this;
    }

    public Builder remoteRepository(String remoteRepository) {
      this.remoteRepository = remoteRepository;
      return this;
    }

    public Builder remoteTag(String remoteTag) {
      this.remoteTag = remoteTag;
      return this;
    }

    public Builder remoteApiBaseUrl(String remoteApiBaseUrl) {
      this.remoteApiBaseUrl = remoteApiBaseUrl.endsWith("/")
          ? remoteApiBaseUrl.substring(0, remoteApiBaseUrl.length() - 1)
          : remoteApiBaseUrl;
      return this;
    }

    public Builder retryBaseDelay(Duration retryBaseDelay) {
      this.retryBaseDelay = retryBaseDelay;
      return this;
    }

    public Builder retryMaxDelay(Duration retryMaxDelay) {
      this.retryMaxDelay = retryMaxDelay;
      return this;
    }

    public Builder httpRequestTimeout(Duration httpRequestTimeout) {
      this.httpRequestTimeout = httpRequestTimeout;
      return this;
    }

    public Builder resolveDeadline(Duration resolveDeadline) {
      this.resolveDeadline = resolveDeadline;
      return this;
    }

    public Builder defaultMaxAgeDays(int defaultMaxAgeDays) {
      this.defaultMaxAgeDays = defaultMaxAgeDays;
      return this;
    }

    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    public Builder maxFutureDays(int maxFutureDays) {
      this.maxFutureDays = maxFutureDays;
      return this;
    }

    public ResolverConfig build() {
      if (retryBaseDelay.isNegative() || retryMaxDelay.isNegative()) {
        throw new ValidationException("Retry delays must not be negative");
      }
      if (resolveDeadline.isNegative()) {
        throw new ValidationException("Resolve deadline must not be negative");
      }
      return new ResolverConfig(this);
    }
  }
}
