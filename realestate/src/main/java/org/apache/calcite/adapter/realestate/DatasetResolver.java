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

import org.apache.calcite.adapter.realestate.cache.CacheEntry;
import org.apache.calcite.adapter.realestate.cache.CacheSummary;
import org.apache.calcite.adapter.realestate.live.FetchParameters;
import org.apache.calcite.adapter.realestate.registry.DatasetDescriptor;
import org.apache.calcite.adapter.realestate.registry.DatasetRequest;
import org.apache.calcite.adapter.realestate.registry.DatasetSummary;
import org.apache.calcite.adapter.realestate.remote.UpdateStatus;
import org.apache.calcite.adapter.realestate.retry.Attempted;
import org.apache.calcite.adapter.realestate.retry.Deadline;
import org.apache.calcite.adapter.realestate.retry.RetryPolicy;
import org.apache.calcite.adapter.realestate.validation.ValidationReport;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point: resolves a dataset through the local, remote and live tiers.
 *
 * <p>A call first validates the request against the registry, without any
 * I/O. It then consults either the single pinned tier or, for {@code auto},
 * local, remote and live in that order, stopping at the first tier whose
 * payload is non-empty and holds the requested table. The winning payload is
 * narrowed to the table, validated and annotated with its provenance. Remote
 * and live results are also written through to the local cache.
 *
 * <p>Calls are sequential and synchronous; tiers are never consulted in
 * parallel.
 */
public class DatasetResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetResolver.class);

  static final String NOTE_CACHED_AT = "cached_at";
  static final String NOTE_STALE = "stale";
  static final String NOTE_WARNINGS = "validation_warnings";
  static final String NOTE_WRITE_THROUGH = "write_through";
  static final String NOTE_REMOTE = "remote";

  private final ResolverContext context;

  public DatasetResolver(ResolverContext context) {
    this.context = context;
  }

  /** Resolver over the bundled registry and the default configuration. */
  public static DatasetResolver create() {
    return new DatasetResolver(ResolverContext.create(ResolverConfig.load()));
  }

  public ResolverContext getContext() {
    return context;
  }

  public ResolvedDataset resolve(String datasetId) {
    return resolve(datasetId, null, ResolveOptions.defaults());
  }

  public ResolvedDataset resolve(String datasetId, @Nullable String table) {
    return resolve(datasetId, table, ResolveOptions.defaults());
  }

  /**
   * Resolves with the options spelled out.
   *
   * @param source {@code auto}, {@code local}, {@code remote} or {@code live}
   */
  public ResolvedDataset resolve(String datasetId, @Nullable String table, String source,
      boolean useCache, boolean quiet, int maxRetries) {
    return resolve(datasetId, table, ResolveOptions.builder()
        .source(source)
        .useCache(useCache)
        .quiet(quiet)
        .maxRetries(maxRetries)
        .build());
  }

  public ResolvedDataset resolve(String datasetId, @Nullable String table,
      ResolveOptions options) {
    return resolve(datasetId, table, options, new ResolutionTrace());
  }

  /**
   * Resolves a dataset, recording the states passed through in {@code trace}.
   *
   * @throws NotFoundException if the dataset is unknown or hidden
   * @throws ValidationException if the request is malformed; nothing else
   *     has happened at that point
   * @throws StructuralValidationException if the winning payload is
   *     structurally invalid
   * @throws DatasetException from the last tier tried when every tier failed,
   *     carrying the earlier failures
   */
  public ResolvedDataset resolve(String datasetId, @Nullable String table,
      ResolveOptions options, ResolutionTrace trace) {
    DatasetRequest request;
    try {
      request = context.getRegistry().validate(datasetId, table, options.getParams(),
          options.getMaxRetries());
      if (options.getSource() == SourcePreference.LOCAL && !options.isUseCache()) {
        throw new ValidationException("source 'local' cannot be combined with useCache=false");
      }
    } catch (DatasetException e) {
      trace.advance(ResolutionTrace.State.FAILED);
      throw e;
    }

    DatasetDescriptor descriptor = request.getDescriptor();
    String id = descriptor.getId();
    boolean quiet = options.isQuiet();
    RetryPolicy policy = retryPolicy(options.getMaxRetries());
    Deadline deadline = deadline();
    Tier pinned = options.getSource().getPinnedTier();
    List<Tier> tiers = pinned != null
        ? ImmutableList.of(pinned)
        : ImmutableList.of(Tier.LOCAL, Tier.REMOTE, Tier.LIVE);

    List<TierAttempt> attempts = new ArrayList<>();
    List<DatasetException> failures = new ArrayList<>();
    for (Tier tier : tiers) {
      if (tier == Tier.LOCAL && pinned == null && !options.isUseCache()) {
        attempts.add(new TierAttempt(tier, TierAttempt.Outcome.SKIPPED, "cache disabled", 0));
        continue;
      }
      if (tier == Tier.LIVE && !context.getLiveTier().canFetch(descriptor)) {
        LiveFetchException skipped =
            new LiveFetchException("Dataset '" + id + "' has no live source", false);
        attempts.add(
            new TierAttempt(tier, TierAttempt.Outcome.SKIPPED, skipped.getBaseMessage(), 0));
        failures.add(skipped);
        trace.checked(tier);
        if (pinned != null) {
          trace.advance(ResolutionTrace.State.FAILED);
          throw skipped;
        }
        continue;
      }

      TierHit hit;
      try {
        log(quiet, "Trying {} tier for '{}'", tier, id);
        hit = consult(tier, request, options, policy, deadline);
        trace.checked(tier);
      } catch (DatasetException e) {
        trace.checked(tier);
        attempts.add(TierAttempt.fromFailure(tier, e));
        failures.add(e);
        if (pinned != null) {
          trace.advance(ResolutionTrace.State.FAILED);
          throw e;
        }
        if (e instanceof CacheMissException) {
          log(quiet, "{} tier has no usable copy of '{}'", tier, id);
        } else {
          warn(quiet, "{} tier could not serve '{}': {}", tier, id, e.getMessage());
        }
        continue;
      }
      attempts.add(TierAttempt.hit(tier, hit.retries));
      try {
        ResolvedDataset resolved = finish(request, tier, hit, attempts, options);
        trace.advance(ResolutionTrace.State.DONE);
        log(quiet, "Resolved '{}' from {} tier", id, tier);
        return resolved;
      } catch (DatasetException e) {
        trace.advance(ResolutionTrace.State.FAILED);
        throw e;
      }
    }

    trace.advance(ResolutionTrace.State.FAILED);
    DatasetException last = failures.isEmpty()
        ? new CacheMissException("No tier could be consulted for '" + id + "'")
        : failures.get(failures.size() - 1);
    for (int i = 0; i < failures.size() - 1; i++) {
      last.addSuppressed(failures.get(i));
    }
    last.withTierAttempts(attempts);
    warn(quiet, "Could not resolve '{}': {}", id, last.getMessage());
    throw last;
  }

  /** A tier's payload before filtering, with what the caller should know about it. */
  private static final class TierHit {
    final TierResult payload;
    final int retries;
    final Map<String, String> notes = new LinkedHashMap<>();

    TierHit(TierResult payload, int retries) {
      this.payload = payload;
      this.retries = retries;
    }
  }

  private TierHit consult(Tier tier, DatasetRequest request, ResolveOptions options,
      RetryPolicy policy, Deadline deadline) {
    String id = request.getDatasetId();
    String tableKey = request.getTableKey();
    TierHit hit;
    switch (tier) {
    case LOCAL:
      CacheEntry entry = context.getLocalTier().load(id, options.isAcceptStale());
      if (entry == null) {
        throw new CacheMissException("No usable cached copy of '" + id + "'");
      }
      hit = new TierHit(entry.getPayload(), 0);
      hit.notes.put(NOTE_CACHED_AT, entry.getSavedAt().toString());
      if (entry.isStale()) {
        hit.notes.put(NOTE_STALE, "true");
      }
      break;
    case REMOTE:
      Attempted<TierResult> remote = context.getRemoteTier().fetch(id, policy, deadline);
      hit = new TierHit(remote.getValue(), remote.getRetries());
      hit.notes.put(NOTE_REMOTE, context.getRemoteTier().describe());
      break;
    case LIVE:
      Attempted<TierResult> live = context.getLiveTier().fetch(request.getDescriptor(),
          FetchParameters.of(request, deadline), policy, deadline);
      hit = new TierHit(live.getValue(), live.getRetries());
      break;
    default:
      throw new AssertionError(tier);
    }

    String what = null;
    if (hit.payload.isEmpty()) {
      what = "an empty payload";
    } else if (!TableFilter.contains(hit.payload, tableKey)) {
      what = "a payload without table '" + tableKey + "'";
    } else if (TableFilter.apply(hit.payload, tableKey).isEmpty()) {
      what = "an empty table '" + tableKey + "'";
    }
    if (what != null) {
      String message = tier + " tier returned " + what + " for '" + id + "'";
      switch (tier) {
      case LOCAL:
        throw new CacheMissException(message);
      case REMOTE:
        throw new NetworkException(message, false);
      default:
        throw new LiveFetchException(message, false);
      }
    }
    return hit;
  }

  private ResolvedDataset finish(DatasetRequest request, Tier tier, TierHit hit,
      List<TierAttempt> attempts, ResolveOptions options) {
    DatasetDescriptor descriptor = request.getDescriptor();
    String id = descriptor.getId();
    TierResult filtered = TableFilter.apply(hit.payload, request.getTableKey());

    ValidationReport report =
        context.getValidator().check(filtered, descriptor.getValidationRules());
    if (report.isHardFailure()) {
      throw new StructuralValidationException("Dataset '" + id + "' from " + tier
          + " tier is structurally invalid: " + String.join("; ", report.getFailures()));
    }
    Map<String, String> notes = new LinkedHashMap<>(hit.notes);
    if (!report.getWarnings().isEmpty()) {
      for (String warning : report.getWarnings()) {
        warn(options.isQuiet(), "Dataset '{}': {}", id, warning);
      }
      notes.put(NOTE_WARNINGS, String.join("; ", report.getWarnings()));
    }

    if (tier != Tier.LOCAL && options.isWriteThrough()) {
      try {
        context.getLocalTier().save(id, hit.payload, tier.getValue(), descriptor.isMultiTable());
        notes.put(NOTE_WRITE_THROUGH, "saved");
      } catch (DatasetException | IllegalArgumentException e) {
        LOGGER.warn("Could not write '{}' through to the local cache: {}", id, e.getMessage());
        notes.put(NOTE_WRITE_THROUGH, "failed: " + e.getMessage());
      }
    }
    return context.getAttacher().annotate(id, filtered, tier, request.getTableKey(),
        hit.retries, notes, attempts);
  }

  private RetryPolicy retryPolicy(int maxRetries) {
    ResolverConfig config = context.getConfig();
    return new RetryPolicy(maxRetries, config.getRetryBaseDelay(), config.getRetryMaxDelay(),
        RetryPolicy.RETRYABLE_DATASET_FAILURES);
  }

  private Deadline deadline() {
    Duration timeout = context.getConfig().getResolveDeadline();
    return timeout.isZero()
        ? Deadline.none(context.getClock())
        : Deadline.after(context.getClock(), timeout);
  }

  /** Visible datasets, or all of them, ordered by id. */
  public Iterable<DatasetSummary> listDatasets(boolean includeHidden) {
    return context.getRegistry().list(includeHidden);
  }

  public Iterable<DatasetSummary> listDatasets() {
    return listDatasets(false);
  }

  /**
   * Visible datasets filtered by description, source and geography. Each
   * filter is a case-insensitive pattern; null matches everything.
   */
  public Iterable<DatasetSummary> listDatasets(@Nullable String category,
      @Nullable String source, @Nullable String geography) {
    return context.getRegistry().list(category, source, geography);
  }

  /**
   * Descriptor of a visible dataset.
   *
   * @throws NotFoundException if the dataset is unknown or hidden
   */
  public DatasetDescriptor getDatasetInfo(String datasetId) {
    return context.getRegistry().lookup(datasetId);
  }

  /** Locally cached datasets, newest first. */
  public List<CacheSummary> listCache() {
    return context.getLocalTier().list();
  }

  /**
   * Removes one dataset from the local cache. Legacy aliases are accepted.
   *
   * @return number of files removed
   * @throws NotFoundException if the dataset is unknown or hidden
   */
  public int clearCache(String datasetId) {
    return context.getLocalTier().clear(context.getRegistry().lookup(datasetId).getId());
  }

  /** Empties the local cache. */
  public int clearCache() {
    return context.getLocalTier().clearAll();
  }

  /**
   * Refreshes cached datasets from the remote store.
   *
   * @param datasetIds ids to refresh; empty for every cached dataset
   * @throws NotFoundException if an id is unknown or hidden
   */
  public Map<String, UpdateStatus> updateFromRemote(Collection<String> datasetIds) {
    Set<String> canonical = new LinkedHashSet<>();
    for (String id : datasetIds) {
      canonical.add(context.getRegistry().lookup(id).getId());
    }
    return context.getRemoteTier().updateFromRemote(canonical,
        retryPolicy(RetryPolicy.DEFAULT_MAX_ATTEMPTS), deadline());
  }

  private static void log(boolean quiet, String format, Object... args) {
    if (quiet) {
      LOGGER.debug(format, args);
    } else {
      LOGGER.info(format, args);
    }
  }

  private static void warn(boolean quiet, String format, Object... args) {
    if (quiet) {
      LOGGER.debug(format, args);
    } else {
      LOGGER.warn(format, args);
    }
  }
}
