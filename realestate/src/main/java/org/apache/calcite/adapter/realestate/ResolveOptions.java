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

import org.apache.calcite.adapter.realestate.retry.RetryPolicy;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call options of {@link DatasetResolver#resolve}.
 *
 * <p>Defaults: source {@code auto}, cache enabled, not quiet, 3 attempts per
 * network-bound tier, write-through enabled, stale cache entries rejected, no
 * parameters.
 */
public final class ResolveOptions {
  private static final ResolveOptions DEFAULTS = builder().build();

  private final SourcePreference source;
  private final boolean useCache;
  private final boolean quiet;
  private final int maxRetries;
  private final boolean writeThrough;
  private final boolean acceptStale;
  private final ImmutableMap<String, Object> params;

  private ResolveOptions(Builder builder) {
    this.source = builder.source;
    this.useCache = builder.useCache;
    this.quiet = builder.quiet;
    this.maxRetries = builder.maxRetries;
    this.writeThrough = builder.writeThrough;
    this.acceptStale = builder.acceptStale;
    this.params = ImmutableMap.copyOf(builder.params);
  }

  public static ResolveOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SourcePreference getSource() {
    return source;
  }

  public boolean isUseCache() {
    return useCache;
  }

  public boolean isQuiet() {
    return quiet;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public boolean isWriteThrough() {
    return writeThrough;
  }

  public boolean isAcceptStale() {
    return acceptStale;
  }

  public Map<String, Object> getParams() {
    return params;
  }

  @Override public String toString() {
    return "ResolveOptions{source=" + source + ", useCache=" + useCache
        + ", quiet=" + quiet + ", maxRetries=" + maxRetries
        + ", writeThrough=" + writeThrough + ", acceptStale=" + acceptStale
        + (params.isEmpty() ? "" : ", params=" + params) + "}";
  }

  /** Builder for {@link ResolveOptions}. */
  public static final class Builder {
    private SourcePreference source = SourcePreference.AUTO;
    private boolean useCache = true;
    private boolean quiet;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private boolean writeThrough = true;
    private boolean acceptStale;
    private final Map<String, Object> params = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder source(SourcePreference source) {
      this.source = source;
      return this;
    }

    /** Source by name: {@code auto}, {@code local}, {@code remote}, {@code live} or an alias. */
    public Builder source(String source) {
      this.source = SourcePreference.fromValue(source);
      return this;
    }

    public Builder useCache(boolean useCache) {
      this.useCache = useCache;
      return this;
    }

    public Builder quiet(boolean quiet) {
      this.quiet = quiet;
      return this;
    }

    /** Checked by the registry when the request is validated. */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder writeThrough(boolean writeThrough) {
      this.writeThrough = writeThrough;
      return this;
    }

    public Builder acceptStale(boolean acceptStale) {
      this.acceptStale = acceptStale;
      return this;
    }

    /** Adds a parameter; a null value leaves the parameter unset. */
    public Builder param(String key, @Nullable Object value) {
      if (value == null) {
        params.remove(key);
      } else {
        params.put(key, value);
      }
      return this;
    }

    public Builder params(Map<String, ?> params) {
      for (Map.Entry<String, ?> entry : params.entrySet()) {
        param(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public ResolveOptions build() {
      return new ResolveOptions(this);
    }
  }
}
