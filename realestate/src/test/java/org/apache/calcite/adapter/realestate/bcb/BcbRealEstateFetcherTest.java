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

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BcbRealEstateFetcher}.
 */
@Tag("unit")
public class BcbRealEstateFetcherTest {

  private static final String CSV = "\uFEFFData,Info,Valor\n"
      + "2024-02-01,imoveis_valor_financiado_sp,\"1234,5\"\n"
      + "2024-01-01,imoveis_valor_financiado_sp,\"1000,0\"\n"
      + "2024-01-01,imoveis_valor_financiado_br,\"9000\"\n"
      + "2024-01-01,direcionamento_home_equity_pf_rj,\"12,25\"\n"
      + "2024-01-01,indices_ivg_r_br,\"n/d\"\n"
      + "2024-01-01,outros_qualquer_br,1\n";

  private MockWebServer server;
  private MutableClock clock;
  private BcbRealEstateFetcher fetcher;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    clock = new MutableClock(Fixtures.NOW);
    fetcher = new BcbRealEstateFetcher(
        HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
        server.url("/olinda/mercadoimobiliario").toString(), Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private FetchParameters params(String table, LocalDate start, LocalDate end) {
    return new FetchParameters(table, start, end, Collections.<String, String>emptyMap(),
        Deadline.none(clock));
  }

  @Test void testAllTables() {
    server.enqueue(new MockResponse().setBody(CSV));

    TierResult result = fetcher.fetch(BcbRealEstateFetcher.DATASET_ID, params(null, null, null));

    assertEquals(ImmutableList.of("application", "indices", "units"),
        ImmutableList.copyOf(result.asMultiple().getTables().keySet()));
    DataTable units = result.asMultiple().get("units");
    assertEquals(ImmutableList.of("date", "series_info", "category", "type", "abbrev_state",
        "value"), units.getColumns());
    assertEquals(3, units.rowCount());
    assertEquals(LocalDate.of(2024, 1, 1), units.getValue(0, "date"));
    assertEquals("imoveis_valor_financiado_br", units.getValue(0, "series_info"));
    assertEquals("BR", units.getValue(0, "abbrev_state"));
    assertEquals("SP", units.getValue(1, "abbrev_state"));
    assertEquals(1000.0, units.getValue(1, "value"));
    assertEquals(1234.5, units.getValue(2, "value"));
    assertEquals("valor", units.getValue(2, "type"));

    DataTable application = result.asMultiple().get("application");
    assertEquals("home-equity", application.getValue(0, "type"));
    assertEquals("RJ", application.getValue(0, "abbrev_state"));
    assertEquals(12.25, application.getValue(0, "value"));

    assertNull(result.asMultiple().get("indices").getValue(0, "value"));
    assertEquals("ivg-r", result.asMultiple().get("indices").getValue(0, "type"));
  }

  @Test void testRequestedTableWithDateRange() {
    server.enqueue(new MockResponse().setBody(CSV));

    TierResult result = fetcher.fetch(BcbRealEstateFetcher.DATASET_ID,
        params("units", LocalDate.of(2024, 2, 1), null));

    DataTable units = result.asSingle().getTable();
    assertEquals(1, units.rowCount());
    assertEquals(LocalDate.of(2024, 2, 1), units.getValue(0, "date"));
  }

  @Test void testEmptyRequestedTableIsSingle() {
    server.enqueue(new MockResponse().setBody(CSV));

    TierResult result = fetcher.fetch(BcbRealEstateFetcher.DATASET_ID,
        params("accounting", null, null));

    assertTrue(result.isSingle());
    assertTrue(result.isEmpty());
  }

  @Test void testUnknownTableIsFatal() {
    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbRealEstateFetcher.DATASET_ID, params("rates", null, null)));
    assertFalse(e.isRetryable());
    assertEquals(0, server.getRequestCount());
  }

  @Test void testMissingColumnIsFatal() {
    server.enqueue(new MockResponse().setBody("Data,Valor\n2024-01-01,1\n"));

    LiveFetchException e = assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbRealEstateFetcher.DATASET_ID, params(null, null, null)));
    assertFalse(e.isRetryable());
  }

  @Test void testBadDateIsFatal() {
    server.enqueue(new MockResponse().setBody("Data,Info,Valor\nlast month,imoveis_x_br,1\n"));

    assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbRealEstateFetcher.DATASET_ID, params(null, null, null)));
  }

  @Test void testThrottlingIsRetryable() {
    server.enqueue(new MockResponse().setResponseCode(429));

    assertTrue(assertThrows(LiveFetchException.class,
        () -> fetcher.fetch(BcbRealEstateFetcher.DATASET_ID, params(null, null, null)))
        .isRetryable());
  }

  @Test void testHelpers() {
    assertEquals("direcionamento_home-equity_pf",
        BcbRealEstateFetcher.normalizeInfo("Direcionamento_Home_Equity_PF"));
    assertEquals("MG", BcbRealEstateFetcher.stateOf("imoveis_valor_mg"));
    assertEquals("BR", BcbRealEstateFetcher.stateOf("x"));
    assertEquals(3.5, BcbRealEstateFetcher.parseValue("3,5"));
    assertNull(BcbRealEstateFetcher.parseValue(" "));
    assertNull(BcbRealEstateFetcher.parseValue("-"));
  }
}
