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

import org.apache.calcite.adapter.realestate.DatasetException;
import org.apache.calcite.adapter.realestate.NetworkException;
import org.apache.calcite.adapter.realestate.Tier;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.cache.CacheFormat;
import org.apache.calcite.adapter.realestate.cache.CacheMetadata;
import org.apache.calcite.adapter.realestate.cache.CacheSummary;
import org.apache.calcite.adapter.realestate.cache.LocalCacheTier;
import org.apache.calcite.adapter.realestate.cache.PayloadCodec;
import org.apache.calcite.adapter.realestate.retry.Attempted;
import org.apache.calcite.adapter.realestate.retry.Deadline;
import org.apache.calcite.adapter.realestate.retry.RetryExecutor;
import org.apache.calcite.adapter.realestate.retry.RetryPolicy;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tier backed by pre-built cache assets of a remote release.
 *
 * <p>Every network step (listing, download) runs under the caller's
 * {@link RetryPolicy} and {@link Deadline}. Transport failures surface as
 * retryable {@link NetworkException}s; a missing release or asset is fatal.
 */
public class RemoteCacheTier {
  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteCacheTier.class);

  private final RemoteStore store;
  private final String repository;
  private final String tag;
  private final LocalCacheTier local;
  private final PayloadCodec codec;
  private final RetryExecutor retryExecutor;

  public RemoteCacheTier(RemoteStore store, String repository, String tag,
      LocalCacheTier local, PayloadCodec codec, RetryExecutor retryExecutor) {
    this.store = store;
    this.repository = repository;
    this.tag = tag;
    this.local = local;
    this.codec = codec;
    this.retryExecutor = retryExecutor;
  }

  /** {@code owner/repo@tag}. */
  public String describe() {
    return repository + "@" + tag;
  }

  /** Lists the cache assets of the configured release. */
  public Attempted<List<RemoteAsset>> listAssets(RetryPolicy policy, Deadline deadline) {
    return retryExecutor.run("Listing " + describe(), () -> {
      try {
        return store.listAssets(repository, tag, deadline);
      } catch (IOException e) {
        throw new NetworkException("Failed to list assets of " + describe() + ": "
            + e.getMessage(), true, e);
      }
    }, policy, deadline);
  }

  /**
   * Picks the asset of a dataset, preferring {@code json.gz}, then
   * {@code csv.gz}, then {@code csv}.
   */
  public static @Nullable RemoteAsset findAsset(List<RemoteAsset> assets, String datasetId) {
    for (CacheFormat format : CacheFormat.values()) {
      String name = format.fileName(datasetId);
      for (RemoteAsset asset : assets) {
        if (asset.getName().equals(name)) {
          return asset;
        }
      }
    }
    return null;
  }

  /**
   * Downloads an asset to a temporary file and checks that it is non-empty,
   * has the advertised size and, for gzipped formats, starts with the gzip
   * magic bytes. The caller owns the returned file.
   */
  public Attempted<Path> download(RemoteAsset asset, RetryPolicy policy, Deadline deadline) {
    return retryExecutor.run("Downloading " + asset.getName(), () -> {
      Path temp = null;
      try {
        temp = Files.createTempFile("realestate-", "." + asset.getFormat().getExtension());
        store.download(asset, temp, deadline);
        verify(asset, temp);
        return temp;
      } catch (IOException e) {
        deleteQuietly(temp);
        throw new NetworkException("Failed to download " + asset.getName() + ": "
            + e.getMessage(), true, e);
      } catch (RuntimeException e) {
        deleteQuietly(temp);
        throw e;
      }
    }, policy, deadline);
  }

  private static void verify(RemoteAsset asset, Path file) throws IOException {
    long size = Files.size(file);
    if (size == 0) {
      throw new IOException("downloaded file is empty");
    }
    if (asset.getSize() > 0 && size != asset.getSize()) {
      throw new IOException("expected " + asset.getSize() + " bytes, got " + size);
    }
    if (asset.getFormat().isGzipped()) {
      byte[] magic = new byte[2];
      try (InputStream in = Files.newInputStream(file)) {
        if (in.read(magic) != 2 || (magic[0] & 0xff) != 0x1f || (magic[1] & 0xff) != 0x8b) {
          throw new IOException("not a gzip file");
        }
      }
    }
  }

  private static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete temporary file {}: {}", file, e.getMessage());
    }
  }

  /**
   * Whether a local copy is at least as new as a remote asset: equal digests,
   * or a local save time not before the asset's update time.
   */
  public static boolean isUpToDate(@Nullable CacheMetadata localMeta, RemoteAsset asset) {
    if (localMeta == null) {
      return false;
    }
    if (localMeta.digest != null && asset.getDigest() != null) {
      return localMeta.digest.equals(asset.getDigest());
    }
    return !Instant.ofEpochMilli(localMeta.savedAt).isBefore(asset.getUpdatedAt());
  }

  /**
   * Fetches and decodes a dataset's asset for the resolver.
   *
   * @throws NetworkException if the asset is missing, cannot be downloaded or
   *     cannot be decoded
   */
  public Attempted<TierResult> fetch(String datasetId, RetryPolicy policy, Deadline deadline) {
    Attempted<List<RemoteAsset>> listing = listAssets(policy, deadline);
    RemoteAsset asset = findAsset(listing.getValue(), datasetId);
    if (asset == null) {
      throw new NetworkException("No asset for '" + datasetId + "' in " + describe(), false)
          .withAttempts(listing.getAttempts());
    }
    Attempted<Path> downloaded = download(asset, policy, deadline);
    int retries = listing.getRetries() + downloaded.getRetries();
    TierResult payload = decode(asset, downloaded.getValue());
    LOGGER.debug("Fetched '{}' from {} after {} retries", datasetId, describe(), retries);
    return new Attempted<>(payload, retries + 1);
  }

  private TierResult decode(RemoteAsset asset, Path file) {
    try {
      return codec.read(file, asset.getFormat());
    } catch (IOException e) {
      throw new NetworkException("Asset " + asset.getName() + " could not be decoded: "
          + e.getMessage(), false, e);
    } finally {
      deleteQuietly(file);
    }
  }

  /**
   * Refreshes one dataset in the local cache from the remote store.
   *
   * @throws DatasetException if listing, download or saving fails
   */
  public UpdateStatus updateFromRemote(String datasetId, RetryPolicy policy, Deadline deadline) {
    List<RemoteAsset> assets = listAssets(policy, deadline).getValue();
    return update(datasetId, assets, policy, deadline);
  }

  /**
   * Refreshes several datasets, listing the release once. An empty
   * collection means every dataset currently cached. Failures are logged and
   * reported as {@link UpdateStatus#FAILED}.
   */
  public Map<String, UpdateStatus> updateFromRemote(Collection<String> datasetIds,
      RetryPolicy policy, Deadline deadline) {
    Set<String> ids = new LinkedHashSet<>(datasetIds);
    if (ids.isEmpty()) {
      for (CacheSummary summary : local.list()) {
        ids.add(summary.getDatasetId());
      }
    }
    Map<String, UpdateStatus> statuses = new LinkedHashMap<>();
    if (ids.isEmpty()) {
      LOGGER.info("No cached datasets to update");
      return statuses;
    }
    List<RemoteAsset> assets;
    try {
      assets = listAssets(policy, deadline).getValue();
    } catch (DatasetException e) {
      LOGGER.warn("Could not list {}: {}", describe(), e.getMessage());
      for (String id : ids) {
        statuses.put(id, UpdateStatus.FAILED);
      }
      return statuses;
    }
    for (String id : ids) {
      try {
        statuses.put(id, update(id, assets, policy, deadline));
      } catch (DatasetException e) {
        LOGGER.warn("Failed to update '{}' from {}: {}", id, describe(), e.getMessage());
        statuses.put(id, UpdateStatus.FAILED);
      }
    }
    LOGGER.info("Remote update finished: {}", statuses);
    return statuses;
  }

  private UpdateStatus update(String datasetId, List<RemoteAsset> assets, RetryPolicy policy,
      Deadline deadline) {
    RemoteAsset asset = findAsset(assets, datasetId);
    if (asset == null) {
      LOGGER.debug("{} has no asset for '{}'", describe(), datasetId);
      return UpdateStatus.UNKNOWN;
    }
    if (local.contains(datasetId) && isUpToDate(local.metadata(datasetId), asset)) {
      LOGGER.debug("Cached '{}' is up to date with {}", datasetId, asset);
      return UpdateStatus.UP_TO_DATE;
    }
    Path file = download(asset, policy, deadline).getValue();
    TierResult payload = decode(asset, file);
    local.save(datasetId, payload, Tier.REMOTE.getValue(), false, asset.getDigest());
    LOGGER.info("Updated '{}' from {}", datasetId, describe());
    return UpdateStatus.UPDATED;
  }
}
