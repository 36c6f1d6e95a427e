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
import org.apache.calcite.adapter.realestate.DatasetException;
import org.apache.calcite.adapter.realestate.LiveFetchException;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.YamlUtils;
import org.apache.calcite.adapter.realestate.live.AbstractHttpFetcher;
import org.apache.calcite.adapter.realestate.live.FetchParameters;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time series from the Banco Central do Brasil SGS API, grouped into tables
 * by the series catalog {@value #CATALOG_RESOURCE}.
 *
 * <p>Each table has the columns {@code date, code_bcb, name, value}. The date
 * range defaults to {@link #DEFAULT_DATE_START} until today.
 */
public class BcbSeriesFetcher extends AbstractHttpFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(BcbSeriesFetcher.class);

  public static final String DATASET_ID = "bcb_series";
  public static final String DEFAULT_BASE_URL = "https://api.bcb.gov.br/dados/serie";
  public static final String CATALOG_RESOURCE = "/realestate/bcb-series.yaml";
  public static final LocalDate DEFAULT_DATE_START = LocalDate.of(2010, 1, 1);

  private static final DateTimeFormatter BCB_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

  private final String baseUrl;
  private final ImmutableMap<String, ImmutableList<Series>> catalog;
  private final Clock clock;

  public BcbSeriesFetcher(Duration requestTimeout, Clock clock) {
    super(requestTimeout);
    this.baseUrl = DEFAULT_BASE_URL;
    this.catalog = loadCatalog(CATALOG_RESOURCE);
    this.clock = clock;
  }

  public BcbSeriesFetcher(HttpClient httpClient, String baseUrl, Duration requestTimeout,
      Map<String, List<Series>> catalog, Clock clock) {
    super(httpClient, requestTimeout);
    this.baseUrl = baseUrl;
    ImmutableMap.Builder<String, ImmutableList<Series>> builder = ImmutableMap.builder();
    for (Map.Entry<String, List<Series>> entry : catalog.entrySet()) {
      builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.catalog = builder.build();
    this.clock = clock;
  }

  /** A catalogued SGS series. */
  public static final class Series {
    final long code;
    final String name;

    public Series(long code, String name) {
      this.code = code;
      this.name = name;
    }

    @Override public String toString() {
      return name + " (" + code + ")";
    }
  }

  /**
   * Reads the series catalog:
   * <pre>
   * tables:
   *   price:
   *     - {code: 433, name: ipca}
   * </pre>
   */
  static ImmutableMap<String, ImmutableList<Series>> loadCatalog(String resource) {
    JsonNode root;
    try {
      root = YamlUtils.loadResource(resource);
    } catch (IOException e) {
      throw new DatasetException("Failed to load BCB series catalog " + resource, e);
    }
    ImmutableMap.Builder<String, ImmutableList<Series>> builder = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> tables = root.path("tables").fields();
    while (tables.hasNext()) {
      Map.Entry<String, JsonNode> table = tables.next();
      ImmutableList.Builder<Series> series = ImmutableList.builder();
      for (JsonNode node : table.getValue()) {
        series.add(new Series(node.path("code").asLong(), node.path("name").asText()));
      }
      builder.put(table.getKey(), series.build());
    }
    return builder.build();
  }

  @Override public TierResult fetch(String datasetId, FetchParameters params) {
    LocalDate start = params.getDateStart() != null
        ? params.getDateStart()
        : DEFAULT_DATE_START;
    LocalDate end = params.getDateEnd() != null
        ? params.getDateEnd()
        : LocalDate.now(clock);

    String tableKey = params.getTableKey();
    if (tableKey != null) {
      List<Series> series = catalog.get(tableKey);
      if (series == null) {
        throw new LiveFetchException("No BCB series catalogued for table '" + tableKey + "'",
            false);
      }
      return TierResult.single(fetchTable(series, start, end, params));
    }
    Map<String, DataTable> tables = new LinkedHashMap<>();
    for (Map.Entry<String, ImmutableList<Series>> entry : catalog.entrySet()) {
      tables.put(entry.getKey(), fetchTable(entry.getValue(), start, end, params));
    }
    return TierResult.multiple(tables);
  }

  private DataTable fetchTable(List<Series> series, LocalDate start, LocalDate end,
      FetchParameters params) {
    DataTable.Builder table = DataTable.builder("date", "code_bcb", "name", "value");
    for (Series s : series) {
      String url = baseUrl + "/bcdata.sgs." + s.code + "/dados?formato=json"
          + "&dataInicial=" + BCB_DATE.format(start)
          + "&dataFinal=" + BCB_DATE.format(end);
      JsonNode observations = getJson(url, params.getDeadline());
      if (!observations.isArray()) {
        throw new LiveFetchException("Unexpected SGS response for series " + s, false);
      }
      int count = 0;
      for (JsonNode observation : observations) {
        table.row(parseDate(observation.path("data").asText(), s), s.code, s.name,
            parseValue(observation.path("valor").asText(""), s));
        count++;
      }
      LOGGER.debug("Series {}: {} observations", s, count);
    }
    return table.build();
  }

  private static LocalDate parseDate(String text, Series series) {
    try {
      return LocalDate.parse(text, BCB_DATE);
    } catch (DateTimeParseException e) {
      throw new LiveFetchException("Bad date '" + text + "' in series " + series, false, e);
    }
  }

  private static @Nullable Double parseValue(String text, Series series) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(trimmed);
    } catch (NumberFormatException e) {
      throw new LiveFetchException("Bad value '" + text + "' in series " + series, false, e);
    }
  }
}
