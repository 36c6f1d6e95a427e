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
package org.apache.calcite.adapter.realestate.live;

import org.apache.calcite.adapter.realestate.DatasetException;
import org.apache.calcite.adapter.realestate.LiveFetchException;
import org.apache.calcite.adapter.realestate.TableFilter;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.registry.DatasetDescriptor;
import org.apache.calcite.adapter.realestate.retry.Attempted;
import org.apache.calcite.adapter.realestate.retry.Deadline;
import org.apache.calcite.adapter.realestate.retry.RetryExecutor;
import org.apache.calcite.adapter.realestate.retry.RetryPolicy;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Tier that asks a registered {@link DatasetFetcher} for fresh data.
 */
public class LiveFetchTier {
  private static final Logger LOGGER = LoggerFactory.getLogger(LiveFetchTier.class);

  private final ImmutableMap<String, DatasetFetcher> fetchers;
  private final RetryExecutor retryExecutor;

  public LiveFetchTier(Map<String, DatasetFetcher> fetchers, RetryExecutor retryExecutor) {
    this.fetchers = ImmutableMap.copyOf(fetchers);
    this.retryExecutor = retryExecutor;
  }

  /** Whether the descriptor allows live fetching and a fetcher is registered. */
  public boolean canFetch(DatasetDescriptor descriptor) {
    return descriptor.isLiveFetchable() && fetchers.containsKey(descriptor.getId());
  }

  /**
   * Fetches a dataset under the retry policy.
   *
   * @throws LiveFetchException if no fetcher can serve the dataset, or the
   *     fetcher failed on every attempt
   */
  public Attempted<TierResult> fetch(DatasetDescriptor descriptor, FetchParameters params,
      RetryPolicy policy, Deadline deadline) {
    String id = descriptor.getId();
    DatasetFetcher fetcher = fetchers.get(id);
    if (!descriptor.isLiveFetchable() || fetcher == null) {
      throw new LiveFetchException("Dataset '" + id + "' has no live source", false);
    }
    Attempted<TierResult> attempted = retryExecutor.run("Fetching '" + id + "'", () -> {
      if (deadline.isExpired()) {
        throw new LiveFetchException("Deadline expired before fetching '" + id + "'", true);
      }
      TierResult result;
      try {
        result = fetcher.fetch(id, params);
      } catch (DatasetException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new LiveFetchException("Fetcher for '" + id + "' failed: " + e, false, e);
      }
      if (result == null) {
        throw new LiveFetchException("Fetcher for '" + id + "' returned nothing", false);
      }
      return result;
    }, policy, deadline);
    LOGGER.debug("Fetched '{}' live with {} retries", id, attempted.getRetries());
    TierResult keyed =
        TableFilter.keyed(attempted.getValue(), params.getTableKey(), descriptor.isMultiTable());
    return new Attempted<>(keyed, attempted.getAttempts());
  }
}
