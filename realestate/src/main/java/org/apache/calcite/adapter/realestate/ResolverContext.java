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

import org.apache.calcite.adapter.realestate.bcb.BcbRealEstateFetcher;
import org.apache.calcite.adapter.realestate.bcb.BcbSeriesFetcher;
import org.apache.calcite.adapter.realestate.cache.LocalCacheTier;
import org.apache.calcite.adapter.realestate.cache.PayloadCodec;
import org.apache.calcite.adapter.realestate.cache.StalenessPolicy;
import org.apache.calcite.adapter.realestate.live.DatasetFetcher;
import org.apache.calcite.adapter.realestate.live.LiveFetchTier;
import org.apache.calcite.adapter.realestate.registry.DatasetRegistry;
import org.apache.calcite.adapter.realestate.registry.DatasetRegistryLoader;
import org.apache.calcite.adapter.realestate.remote.GithubReleaseStore;
import org.apache.calcite.adapter.realestate.remote.RemoteCacheTier;
import org.apache.calcite.adapter.realestate.remote.RemoteStore;
import org.apache.calcite.adapter.realestate.retry.RetryExecutor;
import org.apache.calcite.adapter.realestate.retry.Sleeper;
import org.apache.calcite.adapter.realestate.validation.DatasetValidator;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a {@link DatasetResolver} works with, wired once.
 *
 * <p>There is no global state: two contexts over different cache directories
 * or registries are fully independent.
 */
public final class ResolverContext {
  private final ResolverConfig config;
  private final DatasetRegistry registry;
  private final LocalCacheTier localTier;
  private final RemoteCacheTier remoteTier;
  private final LiveFetchTier liveTier;
  private final DatasetValidator validator;
  private final MetadataAttacher attacher;
  private final Clock clock;

  private ResolverContext(ResolverConfig config, DatasetRegistry registry,
      LocalCacheTier localTier, RemoteCacheTier remoteTier, LiveFetchTier liveTier,
      DatasetValidator validator, MetadataAttacher attacher, Clock clock) {
    this.config = config;
    this.registry = registry;
    this.localTier = localTier;
    this.remoteTier = remoteTier;
    this.liveTier = liveTier;
    this.validator = validator;
    this.attacher = attacher;
    this.clock = clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Context with the bundled registry, GitHub store and BCB fetchers. */
  public static ResolverContext create(ResolverConfig config) {
    return builder().config(config).build();
  }

  public ResolverConfig getConfig() {
    return config;
  }

  public DatasetRegistry getRegistry() {
    return registry;
  }

  public LocalCacheTier getLocalTier() {
    return localTier;
  }

  public RemoteCacheTier getRemoteTier() {
    return remoteTier;
  }

  public LiveFetchTier getLiveTier() {
    return liveTier;
  }

  public DatasetValidator getValidator() {
    return validator;
  }

  public MetadataAttacher getAttacher() {
    return attacher;
  }

  public Clock getClock() {
    return clock;
  }

  /** Builder for {@link ResolverContext}. Unset collaborators get production defaults. */
  public static final class Builder {
    private @Nullable ResolverConfig config;
    private @Nullable DatasetRegistry registry;
    private @Nullable RemoteStore remoteStore;
    private @Nullable Map<String, DatasetFetcher> fetchers;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder() {
    }

    public Builder config(ResolverConfig config) {
      this.config = config;
      return this;
    }

    public Builder registry(DatasetRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder remoteStore(RemoteStore remoteStore) {
      this.remoteStore = remoteStore;
      return this;
    }

    /** Registers a live fetcher; the first call replaces the default BCB fetchers. */
    public Builder fetcher(String datasetId, DatasetFetcher fetcher) {
      if (fetchers == null) {
        fetchers = new LinkedHashMap<>();
      }
      fetchers.put(datasetId, fetcher);
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public ResolverContext build() {
      ResolverConfig config = this.config != null ? this.config : ResolverConfig.load();
      DatasetRegistry registry = this.registry != null
          ? this.registry
          : DatasetRegistryLoader.load(config.getMaxFutureDays());
      RemoteStore remoteStore = this.remoteStore != null
          ? this.remoteStore
          : new GithubReleaseStore(config.getRemoteApiBaseUrl(),
              config.getHttpRequestTimeout());
      Map<String, DatasetFetcher> fetchers = this.fetchers;
      if (fetchers == null) {
        fetchers = new LinkedHashMap<>();
        fetchers.put(BcbSeriesFetcher.DATASET_ID,
            new BcbSeriesFetcher(config.getHttpRequestTimeout(), clock));
        fetchers.put(BcbRealEstateFetcher.DATASET_ID,
            new BcbRealEstateFetcher(config.getHttpRequestTimeout()));
      }

      PayloadCodec codec = new PayloadCodec();
      RetryExecutor retryExecutor = new RetryExecutor(sleeper);
      LocalCacheTier localTier = new LocalCacheTier(config.getCacheDirectory(), codec,
          new StalenessPolicy(config.getDefaultMaxAgeDays()), registry::findVisible, clock,
          config.getLockTimeout());
      RemoteCacheTier remoteTier = new RemoteCacheTier(remoteStore,
          config.getRemoteRepository(), config.getRemoteTag(), localTier, codec,
          retryExecutor);
      LiveFetchTier liveTier = new LiveFetchTier(fetchers, retryExecutor);
      return new ResolverContext(config, registry, localTier, remoteTier, liveTier,
          new DatasetValidator(clock), new MetadataAttacher(clock), clock);
    }
  }
}
