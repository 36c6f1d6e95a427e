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
package org.apache.calcite.adapter.realestate.bcb;

import org.apache.calcite.adapter.realestate.DataTable;
import org.apache.calcite.adapter.realestate.Fixtures;
import org.apache.calcite.adapter.realestate.LiveFetchException;
import org.apache.calcite.adapter.realestate.MutableClock;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.live.FetchParameters;
import org.apache.calcite.adapter.realestate.retry.Deadline;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BcbSeriesFetcher}.
 */
@Tag("unit")
public class BcbSeriesFetcherTest {

  private MockWebServer server;
  private MutableClock clock;
  private BcbSeriesFetcher fetcher;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    clock = new MutableClock(Fixtures.NOW);
    Map<String, List<BcbSeriesFetcher.Series>> catalog = ImmutableMap.of(
        "price", ImmutableList.of(new BcbSeriesFetcher.Series(433, "ipca")),
        "credit", ImmutableList.of(new BcbSeriesFetcher.Series(20542, "credit_total"),
            new BcbSeriesFetcher.Series(20611, "credit_pf")));
    String baseUrl = server.url("/dados/serie").toString();
    fetcher = new BcbSeriesFetcher(
        HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), baseUrl,
        Duration.ofSeconds(5), catalog, clock);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private FetchParameters params(String table, LocalDate start, LocalDate end) {
    return new FetchParameters(table, start, end, Collections.<String, String>emptyMap(),
        Deadline.none(clock));
  }

  @Test void testSingleTable() throws Exception {
    server.enqueue(new MockResponse().setBody(
        "[{\"data\":\"01/01/2024\",\"valor\":\"0.42\"},{\"data\":\"01/02/2024\",\"valor\":\"\"}]"));

    TierResult result = fetcher.fetch(BcbSeriesFetcher.DATASET_ID,
        params("price", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)));

    DataTable table = result.asSingle().getTable();
    assertEquals(ImmutableList.of("date", "code_bcb", "name", "value"), table.getColumns());
    assertEquals(2, table.rowCount());
    assertEquals(LocalDate.of(2024, 1, 1), table.getValue(0, "date"));
    assertEquals(433L, table.getValue(0, "code_bcb"));
    assertEquals("ipca", table.getValue(0, "name"));
    assertEquals(0.42, table.getValue(0, "value"));
    assertNull(table.getValue(1, "value"));

    RecordedRequest request = server.takeRequest();
    assertEquals("/dados/serie/bcdata.sgs.433/dados?formato=json"
        + "&dataInicial=01/01/2024&dataFinal=31/03/2024", request.getPath());
  }

  @Test void testAllTablesWithDefaultRange() throws Exception {
    for (int i = 0; i < 3; i++) {
      server.enqueue(new MockResponse().setBody("[{\"data\":\"01/05/2024\",\"valor\":\"1\"}]"));
    }

    TierResult result = fetcher.fetch(BcbSeriesFetcher.DATASET_ID, params(null, null, null));

    assertFalse(result.isSingle());
    assertEquals(ImmutableList.of("price", "credit"),
        ImmutableList.copyOf(result.asMultiple().getTables().keySet()));
    assertEquals(2, result.asMultiple().get("credit").rowCount());
    assertTrue(server.takeRequest().getPath()
        .endsWith("dataInicial=01/01/2010&dataFinal=01/06/2024"));
    assertEquals(3, server.getRequestCount());
  }

  @Test void testUnknownTableIsFatal() {
    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbSeriesFetcher.DATASET_ID, params("rates", null, null)));
    assertFalse(e.isRetryable());
    assertEquals(0, server.getRequestCount());
  }

  @Test void testServerErrorIsRetryable() {
    server.enqueue(new MockResponse().setResponseCode(502));

    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbSeriesFetcher.DATASET_ID, params("price", null, null)));
    assertTrue(e.isRetryable());
  }

  @Test void testExpiredDeadlineSendsNothing() {
    Deadline deadline = Deadline.after(clock, Duration.ofSeconds(1));
    clock.advance(Duration.ofSeconds(1));

    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbSeriesFetcher.DATASET_ID, new FetchParameters("price", null,
            null, Collections.<String, String>emptyMap(), deadline)));
    assertTrue(e.isRetryable());
    assertEquals(0, server.getRequestCount());
  }

  @Test void testMalformedResponseIsFatal() {
    server.enqueue(new MockResponse().setBody("{\"erro\":\"x\"}"));
    server.enqueue(new MockResponse().setBody("[{\"data\":\"2024-01-01\",\"valor\":\"1\"}]"));

    assertFalse(assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbSeriesFetcher.DATASET_ID, params("price", null, null)))
        .isRetryable());
    assertFalse(assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbSeriesFetcher.DATASET_ID, params("price", null, null)))
        .isRetryable());
  }

  @Test void testBundledCatalog() {
    Map<String, ? extends List<BcbSeriesFetcher.Series>> catalog =
        BcbSeriesFetcher.loadCatalog(BcbSeriesFetcher.CATALOG_RESOURCE);

    assertEquals(ImmutableList.of("price", "credit", "activity"),
        ImmutableList.copyOf(catalog.keySet()));
    assertEquals(433, catalog.get("price").get(0).code);
  }
}
