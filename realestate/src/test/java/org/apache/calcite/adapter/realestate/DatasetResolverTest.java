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
import org.apache.calcite.adapter.realestate.live.CountingFetcher;
import org.apache.calcite.adapter.realestate.registry.DatasetSummary;
import org.apache.calcite.adapter.realestate.remote.FakeRemoteStore;
import org.apache.calcite.adapter.realestate.remote.UpdateStatus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DatasetResolver}, wired with an in-memory remote store and
 * scripted live fetchers.
 */
@Tag("unit")
public class DatasetResolverTest {

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private RecordingSleeper sleeper;
  private FakeRemoteStore remote;
  private CountingFetcher sampleB;
  private CountingFetcher sampleC;
  private CountingFetcher draft;
  private DatasetResolver resolver;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Fixtures.NOW);
    sleeper = new RecordingSleeper(clock);
    remote = new FakeRemoteStore();
    sampleB = new CountingFetcher();
    sampleC = new CountingFetcher();
    draft = new CountingFetcher();
    resolver = newResolver(Duration.ZERO);
  }

  private DatasetResolver newResolver(Duration deadline) {
    ResolverConfig config = ResolverConfig.builder()
        .cacheDirectory(tempDir.resolve("cache"))
        .resolveDeadline(deadline)
        .build();
    return new DatasetResolver(ResolverContext.builder()
        .config(config)
        .registry(Fixtures.registry())
        .remoteStore(remote)
        .fetcher("sample_b", sampleB)
        .fetcher("sample_c", sampleC)
        .fetcher("draft_x", draft)
        .clock(clock)
        .sleeper(sleeper)
        .build());
  }

  private static TierResult tables(int xRows, int yRows) {
    return TierResult.multiple(
        ImmutableMap.of("x", Fixtures.table(xRows), "y", Fixtures.table(yRows)));
  }

  private void cacheLocally(String datasetId, TierResult payload) {
    resolver.getContext().getLocalTier().save(datasetId, payload, "remote");
  }

  private static List<Tier> tiers(ResolvedDataset resolved) {
    List<Tier> tiers = new ArrayList<>();
    for (TierAttempt attempt : resolved.getProvenance().getAttempts()) {
      tiers.add(attempt.getTier());
    }
    return tiers;
  }

  @Test void testLocalHitReturnsRequestedTable() {
    cacheLocally("sample_a", tables(3, 2));

    ResolvedDataset resolved = resolver.resolve("sample_a", "x");

    assertTrue(resolved.getResult().isSingle());
    assertEquals(3, resolved.getTable().rowCount());
    assertEquals(Tier.LOCAL, resolved.getProvenance().getSource());
    assertEquals("x", resolved.getProvenance().getTableKey());
    assertEquals(0, resolved.getProvenance().getRetries());
    assertThat(resolved.getProvenance().getNotes(), hasKey(DatasetResolver.NOTE_CACHED_AT));
    assertTrue(remote.getCalls().isEmpty());
  }

  @Test void testRemoteHitIsPromotedToLocalCache() throws Exception {
    remote.putPayload("sample_a", tables(3, 5), Fixtures.NOW.minus(Duration.ofDays(1)));

    ResolvedDataset first = resolver.resolve("sample_a", "y");
    assertEquals(Tier.REMOTE, first.getProvenance().getSource());
    assertEquals(5, first.getTable().rowCount());
    assertEquals("saved", first.getProvenance().getNotes().get(DatasetResolver.NOTE_WRITE_THROUGH));
    assertThat(tiers(first), contains(Tier.LOCAL, Tier.REMOTE));

    ResolvedDataset second = resolver.resolve("sample_a", "y",
        ResolveOptions.builder().source("local").build());
    assertEquals(Tier.LOCAL, second.getProvenance().getSource());
    assertEquals(5, second.getTable().rowCount());
    assertThat(remote.getCalls(), contains("list", "download:sample_a.json.gz"));
  }

  @Test void testUnknownTableIsRejectedBeforeAnyTier() throws Exception {
    cacheLocally("sample_a", tables(3, 2));
    cacheLocally("sample_c", tables(3, 2));
    Map<String, FileTime> before = cacheFiles();
    int clockReads = clock.getReads();
    ResolutionTrace trace = new ResolutionTrace();

    assertThrows(ValidationException.class,
        () -> resolver.resolve("sample_a", "z", ResolveOptions.defaults(), trace));
    assertThrows(ValidationException.class,
        () -> resolver.resolve("sample_c", "z", ResolveOptions.builder().source("live").build()));

    assertTrue(remote.getCalls().isEmpty());
    assertEquals(0, sampleB.getCallCount());
    assertEquals(0, sampleC.getCallCount());
    // Opening a cache entry reads the clock for its age.
    assertEquals(clockReads, clock.getReads());
    assertEquals(before, cacheFiles());
    assertThat(trace.getHistory(),
        contains(ResolutionTrace.State.NOT_TRIED, ResolutionTrace.State.FAILED));
  }

  private Map<String, FileTime> cacheFiles() throws IOException {
    Map<String, FileTime> files = new TreeMap<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(resolver.getContext().getLocalTier().getDirectory())) {
      for (Path file : stream) {
        files.put(file.getFileName().toString(), Files.getLastModifiedTime(file));
      }
    }
    return files;
  }

  @Test void testLiveRetriesTransientFailures() {
    sampleB.thenThrow(new LiveFetchException("HTTP 503", true))
        .thenThrow(new LiveFetchException("HTTP 503", true))
        .thenReturn(TierResult.single(Fixtures.table(4)));

    ResolvedDataset resolved = resolver.resolve("sample_b");

    assertEquals(Tier.LIVE, resolved.getProvenance().getSource());
    assertEquals(2, resolved.getProvenance().getRetries());
    assertEquals(4, resolved.getTable().rowCount());
    assertEquals(3, sampleB.getCallCount());
    assertEquals(ImmutableList.of(Duration.ofSeconds(1), Duration.ofSeconds(2)),
        sleeper.getSleeps());
    assertThat(tiers(resolved), contains(Tier.LOCAL, Tier.REMOTE, Tier.LIVE));
    assertTrue(resolver.getContext().getLocalTier().contains("sample_b"));
  }

  @Test void testHiddenDatasetIsNotFoundFromAnySource() throws Exception {
    draft.thenReturn(TierResult.single(Fixtures.table(1)));
    remote.putPayload("draft_x", TierResult.single(Fixtures.table(1)),
        Fixtures.NOW.minus(Duration.ofDays(1)));
    cacheLocally("draft_x", TierResult.single(Fixtures.table(1)));

    for (String source : ImmutableList.of("auto", "local", "remote", "live")) {
      ResolveOptions options = ResolveOptions.builder().source(source).build();
      assertThrows(NotFoundException.class,
          () -> resolver.resolve("draft_x", null, options), source);
    }
    assertEquals(0, draft.getCallCount());
    assertTrue(remote.getCalls().isEmpty());
  }

  @Test void testUnknownDatasetIsNotFound() {
    assertThrows(NotFoundException.class, () -> resolver.resolve("no_such_dataset"));
  }

  @Test void testLegacyAliasResolvesToCanonicalId() {
    cacheLocally("sample_a", tables(3, 2));

    ResolvedDataset resolved = resolver.resolve("sample_alpha", "x");

    assertEquals("sample_a", resolved.getDatasetId());
  }

  @Test void testPinnedTierIsTheOnlyTierConsulted() {
    cacheLocally("sample_a", tables(3, 2));
    ResolutionTrace trace = new ResolutionTrace();

    NetworkException e = assertThrows(NetworkException.class,
        () -> resolver.resolve("sample_a", "x",
            ResolveOptions.builder().source("remote").build(), trace));

    assertFalse(e.isRetryable());
    assertThat(trace.getHistory(), contains(ResolutionTrace.State.NOT_TRIED,
        ResolutionTrace.State.REMOTE_CHECKED, ResolutionTrace.State.FAILED));
  }

  @Test void testEveryTierFailingReportsTheChain() {
    ResolutionTrace trace = new ResolutionTrace();

    DatasetException e = assertThrows(DatasetException.class,
        () -> resolver.resolve("cache_only", null, ResolveOptions.defaults(), trace));

    assertTrue(e instanceof LiveFetchException);
    assertEquals(3, e.getTierAttempts().size());
    assertEquals(TierAttempt.Outcome.MISS, e.getTierAttempts().get(0).getOutcome());
    assertEquals(TierAttempt.Outcome.FAILED, e.getTierAttempts().get(1).getOutcome());
    assertEquals(TierAttempt.Outcome.SKIPPED, e.getTierAttempts().get(2).getOutcome());
    assertEquals(2, e.getSuppressed().length);
    assertThat(e.getMessage(), containsString("tried: local (miss"));
    assertThat(trace.getHistory(), contains(ResolutionTrace.State.NOT_TRIED,
        ResolutionTrace.State.LOCAL_CHECKED, ResolutionTrace.State.REMOTE_CHECKED,
        ResolutionTrace.State.LIVE_CHECKED, ResolutionTrace.State.FAILED));
  }

  @Test void testStaleLocalCopyFallsThroughToRemote() throws Exception {
    cacheLocally("sample_a", tables(3, 2));
    clock.advance(Duration.ofDays(20));
    remote.putPayload("sample_a", tables(6, 2), clock.instant());

    ResolvedDataset resolved = resolver.resolve("sample_a", "x");

    assertEquals(Tier.REMOTE, resolved.getProvenance().getSource());
    assertEquals(6, resolved.getTable().rowCount());
  }

  @Test void testStaleLocalCopyServedWhenAccepted() {
    cacheLocally("sample_a", tables(3, 2));
    clock.advance(Duration.ofDays(20));

    ResolvedDataset resolved = resolver.resolve("sample_a", "x",
        ResolveOptions.builder().acceptStale(true).build());

    assertEquals(Tier.LOCAL, resolved.getProvenance().getSource());
    assertEquals("true", resolved.getProvenance().getNotes().get(DatasetResolver.NOTE_STALE));
  }

  @Test void testUseCacheFalseSkipsLocalTier() {
    cacheLocally("sample_b", TierResult.single(Fixtures.table(2)));
    sampleB.thenReturn(TierResult.single(Fixtures.table(7)));

    ResolvedDataset resolved = resolver.resolve("sample_b", null, "auto", false, true, 3);

    assertEquals(Tier.LIVE, resolved.getProvenance().getSource());
    assertEquals(7, resolved.getTable().rowCount());
    assertEquals(TierAttempt.Outcome.SKIPPED,
        resolved.getProvenance().getAttempts().get(0).getOutcome());
  }

  @Test void testLocalSourceWithoutCacheIsRejected() {
    assertThrows(ValidationException.class,
        () -> resolver.resolve("sample_b", null, "local", false, false, 3));
  }

  @Test void testMaxRetriesBelowOneIsRejected() {
    assertThrows(ValidationException.class,
        () -> resolver.resolve("sample_b", null, "auto", true, false, 0));
    assertEquals(0, sampleB.getCallCount());
  }

  @Test void testStructuralFailureIsNotCached() {
    sampleB.thenReturn(TierResult.single(
        DataTable.builder("date").row(LocalDate.of(2024, 1, 1)).build()));
    ResolutionTrace trace = new ResolutionTrace();

    StructuralValidationException e = assertThrows(StructuralValidationException.class,
        () -> resolver.resolve("sample_b", null, ResolveOptions.defaults(), trace));

    assertThat(e.getMessage(), containsString("value"));
    assertFalse(resolver.getContext().getLocalTier().contains("sample_b"));
    assertEquals(ResolutionTrace.State.FAILED, trace.getState());
  }

  @Test void testValidationWarningsAreRecordedInNotes() {
    sampleB.thenReturn(TierResult.single(DataTable.builder("date", "value")
        .row(LocalDate.of(2025, 6, 1), 1.0)
        .build()));

    ResolvedDataset resolved = resolver.resolve("sample_b");

    assertThat(resolved.getProvenance().getNotes().get(DatasetResolver.NOTE_WARNINGS),
        containsString("in the future"));
  }

  @Test void testEmptyCachedPayloadCountsAsMiss() {
    cacheLocally("sample_b", TierResult.single(DataTable.builder("date", "value").build()));
    sampleB.thenReturn(TierResult.single(Fixtures.table(2)));

    ResolvedDataset resolved = resolver.resolve("sample_b");

    assertEquals(Tier.LIVE, resolved.getProvenance().getSource());
    assertEquals(TierAttempt.Outcome.MISS,
        resolved.getProvenance().getAttempts().get(0).getOutcome());
  }

  @Test void testEmptyCachedTableFallsThroughToRemote() throws Exception {
    cacheLocally("sample_a", tables(0, 2));
    remote.putPayload("sample_a", tables(4, 2), Fixtures.NOW.minus(Duration.ofDays(1)));

    ResolvedDataset resolved = resolver.resolve("sample_a", "x");

    assertEquals(Tier.REMOTE, resolved.getProvenance().getSource());
    assertEquals(4, resolved.getTable().rowCount());
    assertThat(tiers(resolved), contains(Tier.LOCAL, Tier.REMOTE));
    assertThat(resolved.getProvenance().getAttempts().get(0).getDetail(),
        containsString("empty table 'x'"));

    ResolvedDataset other = resolver.resolve("sample_a", "y");
    assertEquals(Tier.LOCAL, other.getProvenance().getSource());
  }

  @Test void testNullParameterIsLeftUnset() {
    sampleB.thenReturn(TierResult.single(Fixtures.table(4)));
    Map<String, Object> params = new HashMap<>();
    params.put("date_start", null);
    params.put("date_end", "2023-12-31");
    ResolveOptions options = ResolveOptions.builder()
        .params(params)
        .param("date_start", null)
        .build();

    assertFalse(options.getParams().containsKey("date_start"));
    resolver.resolve("sample_b", null, options);

    assertNull(sampleB.getCalls().get(0).getDateStart());
    assertEquals(LocalDate.of(2023, 12, 31), sampleB.getCalls().get(0).getDateEnd());
  }

  @Test void testFatalLiveFailureIsNotRetried() {
    sampleB.thenThrow(new LiveFetchException("HTTP 400", false));

    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> resolver.resolve("sample_b", null, "live", true, false, 5));

    assertEquals(1, sampleB.getCallCount());
    assertEquals(1, e.getAttempts());
    assertTrue(sleeper.getSleeps().isEmpty());
  }

  @Test void testRetriesAreCappedByMaxRetries() {
    sampleB.thenThrow(new LiveFetchException("HTTP 503", true));

    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> resolver.resolve("sample_b", null, "live", true, false, 2));

    assertEquals(2, sampleB.getCallCount());
    assertEquals(2, e.getAttempts());
    assertThat(e.getMessage(), containsString("after 2 attempts"));
  }

  @Test void testDeadlineStopsRetries() {
    resolver = newResolver(Duration.ofSeconds(1));
    sampleB.thenThrow(new LiveFetchException("HTTP 503", true));

    assertThrows(LiveFetchException.class,
        () -> resolver.resolve("sample_b", null, "live", true, false, 5));

    assertEquals(1, sampleB.getCallCount());
    assertTrue(sleeper.getSleeps().isEmpty());
  }

  @Test void testLiveTableIsMergedIntoCachedTables() {
    cacheLocally("sample_c", TierResult.multiple(ImmutableMap.of("x", Fixtures.table(3))));
    sampleC.thenReturn(TierResult.single(Fixtures.table(4)));

    ResolvedDataset resolved = resolver.resolve("sample_c", "y");

    assertEquals(Tier.LIVE, resolved.getProvenance().getSource());
    assertEquals("y", sampleC.getCalls().get(0).getTableKey());
    CacheEntry cached = resolver.getContext().getLocalTier().load("sample_c", true);
    assertNotNull(cached);
    Map<String, DataTable> tables = cached.getPayload().asMultiple().getTables();
    assertEquals(3, tables.get("x").rowCount());
    assertEquals(4, tables.get("y").rowCount());
  }

  @Test void testWriteThroughCanBeDisabled() {
    sampleB.thenReturn(TierResult.single(Fixtures.table(2)));

    ResolvedDataset resolved = resolver.resolve("sample_b", null,
        ResolveOptions.builder().writeThrough(false).build());

    assertThat(resolved.getProvenance().getNotes(),
        not(hasKey(DatasetResolver.NOTE_WRITE_THROUGH)));
    assertFalse(resolver.getContext().getLocalTier().contains("sample_b"));
  }

  @Test void testDateParametersReachFetcher() {
    sampleB.thenReturn(TierResult.single(Fixtures.table(2)));

    resolver.resolve("sample_b", null, ResolveOptions.builder()
        .source("live")
        .param("date_start", "2023-03-01")
        .param("date_end", LocalDate.of(2023, 12, 31))
        .build());

    assertEquals(LocalDate.of(2023, 3, 1), sampleB.getCalls().get(0).getDateStart());
    assertEquals(LocalDate.of(2023, 12, 31), sampleB.getCalls().get(0).getDateEnd());
  }

  @Test void testInvertedDateRangeIsRejected() {
    assertThrows(ValidationException.class,
        () -> resolver.resolve("sample_b", null, ResolveOptions.builder()
            .param("date_start", "2024-01-01")
            .param("date_end", "2023-01-01")
            .build()));
    assertEquals(0, sampleB.getCallCount());
  }

  @Test void testListDatasetsHidesHiddenEntries() {
    List<String> ids = new ArrayList<>();
    for (DatasetSummary summary : resolver.listDatasets()) {
      ids.add(summary.getId());
    }
    assertEquals(ImmutableList.of("cache_only", "sample_a", "sample_b", "sample_c"), ids);

    int all = 0;
    for (DatasetSummary ignored : resolver.listDatasets(true)) {
      all++;
    }
    assertEquals(5, all);
  }

  @Test void testGetDatasetInfo() {
    assertEquals(ImmutableSet.of("x", "y"), resolver.getDatasetInfo("sample_a").getTables());
    assertThrows(NotFoundException.class, () -> resolver.getDatasetInfo("draft_x"));
  }

  @Test void testClearCacheAcceptsAlias() {
    cacheLocally("sample_a", tables(1, 1));
    cacheLocally("sample_b", TierResult.single(Fixtures.table(1)));
    assertEquals(2, resolver.listCache().size());

    assertEquals(2, resolver.clearCache("sample_alpha"));
    assertEquals(1, resolver.listCache().size());
    assertEquals(2, resolver.clearCache());
    assertTrue(resolver.listCache().isEmpty());
  }

  @Test void testClearCacheRejectsUnknownAndHiddenIds() {
    cacheLocally("draft_x", TierResult.single(Fixtures.table(1)));

    assertThrows(NotFoundException.class, () -> resolver.clearCache("../etc"));
    assertThrows(NotFoundException.class, () -> resolver.clearCache("draft_x"));
    assertEquals(1, resolver.listCache().size());
  }

  @Test void testListDatasetsWithFilters() {
    List<String> ids = new ArrayList<>();
    for (DatasetSummary summary : resolver.listDatasets("credit", "bcb", null)) {
      ids.add(summary.getId());
    }
    assertEquals(ImmutableList.of("sample_a", "sample_c"), ids);
  }

  @Test void testUpdateFromRemote() throws Exception {
    remote.putPayload("sample_a", tables(2, 2), Fixtures.NOW.minus(Duration.ofDays(1)));

    Map<String, UpdateStatus> statuses =
        resolver.updateFromRemote(ImmutableList.of("sample_alpha", "sample_b"));

    assertEquals(UpdateStatus.UPDATED, statuses.get("sample_a"));
    assertEquals(UpdateStatus.UNKNOWN, statuses.get("sample_b"));
    assertEquals(UpdateStatus.UP_TO_DATE,
        resolver.updateFromRemote(ImmutableList.of("sample_a")).get("sample_a"));
  }
}
