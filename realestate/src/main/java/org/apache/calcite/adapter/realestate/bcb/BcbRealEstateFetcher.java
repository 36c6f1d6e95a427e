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
import org.apache.calcite.adapter.realestate.LiveFetchException;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.live.AbstractHttpFetcher;
import org.apache.calcite.adapter.realestate.live.FetchParameters;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Real estate credit market statistics from the Banco Central do Brasil
 * Olinda OData service.
 *
 * <p>The service returns one long CSV of {@code Data,Info,Valor}. {@code Info}
 * is an underscore separated code such as {@code imoveis_valor_financiado_sp}:
 * its first element selects the table, its second is the series type, and its
 * last two letters name the state when they are a state abbreviation (else
 * the series covers the whole country, {@code BR}).
 */
public class BcbRealEstateFetcher extends AbstractHttpFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(BcbRealEstateFetcher.class);

  public static final String DATASET_ID = "bcb_realestate";
  public static final String DEFAULT_URL =
      "https://olinda.bcb.gov.br/olinda/servico/MercadoImobiliario/versao/v1/odata/"
          + "mercadoimobiliario?$format=text/csv&$select=Data,Info,Valor";

  /** Info category to table key. */
  static final ImmutableMap<String, String> CATEGORY_TABLES = ImmutableMap.of(
      "contabil", "accounting",
      "direcionamento", "application",
      "indices", "indices",
      "fontes", "sources",
      "imoveis", "units");

  /** Compound words that must survive the split on underscores. */
  private static final ImmutableMap<String, String> COMPOUND_WORDS = ImmutableMap.of(
      "home_equity", "home-equity",
      "risco_operacao", "risco-operacao",
      "d_mais", "d-mais",
      "ivg_r", "ivg-r",
      "mvg_r", "mvg-r");

  private static final ImmutableSet<String> STATES = ImmutableSet.of(
      "br", "ro", "ac", "am", "rr", "pa", "ap", "to", "ma", "pi", "ce", "rn", "pb", "pe",
      "al", "se", "ba", "mg", "es", "rj", "sp", "pr", "sc", "rs", "ms", "mt", "go", "df");

  private static final List<String> COLUMNS = ImmutableList.of(
      "date", "series_info", "category", "type", "abbrev_state", "value");

  private final String url;

  public BcbRealEstateFetcher(Duration requestTimeout) {
    super(requestTimeout);
    this.url = DEFAULT_URL;
  }

  public BcbRealEstateFetcher(HttpClient httpClient, String url, Duration requestTimeout) {
    super(httpClient, requestTimeout);
    this.url = url;
  }

  @Override public TierResult fetch(String datasetId, FetchParameters params) {
    String tableKey = params.getTableKey();
    if (tableKey != null && !CATEGORY_TABLES.containsValue(tableKey)) {
      throw new LiveFetchException("Unknown BCB real estate table '" + tableKey + "'", false);
    }
    List<String[]> lines = getCsv(url, ',', params.getDeadline());
    if (lines.isEmpty()) {
      throw new LiveFetchException("Empty response from " + url, false);
    }
    List<String> header = Arrays.asList(lines.get(0));
    int dateIndex = indexOf(header, "Data");
    int infoIndex = indexOf(header, "Info");
    int valueIndex = indexOf(header, "Valor");

    Map<String, List<List<@Nullable Object>>> rowsByTable = new LinkedHashMap<>();
    for (String table : CATEGORY_TABLES.values()) {
      rowsByTable.put(table, new ArrayList<List<@Nullable Object>>());
    }
    int skipped = 0;
    for (int i = 1; i < lines.size(); i++) {
      String[] line = lines.get(i);
      if (line.length <= Math.max(dateIndex, Math.max(infoIndex, valueIndex))) {
        if (line.length == 1 && line[0].trim().isEmpty()) {
          continue;
        }
        throw new LiveFetchException("Short CSV line " + (i + 1) + " from " + url, false);
      }
      LocalDate date = parseDate(line[dateIndex]);
      if (params.getDateStart() != null && date.isBefore(params.getDateStart())
          || params.getDateEnd() != null && date.isAfter(params.getDateEnd())) {
        continue;
      }
      String info = line[infoIndex].trim();
      String[] parts = normalizeInfo(info).split("_");
      String table = CATEGORY_TABLES.get(parts[0]);
      if (table == null) {
        skipped++;
        continue;
      }
      List<@Nullable Object> row = new ArrayList<>(COLUMNS.size());
      row.add(date);
      row.add(info);
      row.add(parts[0]);
      row.add(parts.length > 1 ? parts[1] : null);
      row.add(stateOf(info));
      row.add(parseValue(line[valueIndex]));
      rowsByTable.get(table).add(row);
    }
    if (skipped > 0) {
      LOGGER.debug("Skipped {} rows with an unknown category", skipped);
    }

    Comparator<List<@Nullable Object>> order =
        Comparator.comparing((List<@Nullable Object> row) -> (LocalDate) row.get(0))
            .thenComparing(row -> (String) row.get(1));
    if (tableKey != null) {
      List<List<@Nullable Object>> rows = rowsByTable.get(tableKey);
      rows.sort(order);
      return TierResult.single(DataTable.of(COLUMNS, rows));
    }
    Map<String, DataTable> tables = new LinkedHashMap<>();
    for (Map.Entry<String, List<List<@Nullable Object>>> entry : rowsByTable.entrySet()) {
      if (entry.getValue().isEmpty()) {
        continue;
      }
      entry.getValue().sort(order);
      tables.put(entry.getKey(), DataTable.of(COLUMNS, entry.getValue()));
    }
    return TierResult.multiple(tables);
  }

  private int indexOf(List<String> header, String column) {
    for (int i = 0; i < header.size(); i++) {
      String name = header.get(i).replace("\uFEFF", "").trim();
      if (name.equalsIgnoreCase(column)) {
        return i;
      }
    }
    throw new LiveFetchException("Column '" + column + "' missing from " + url
        + "; got " + header, false);
  }

  static String normalizeInfo(String info) {
    String normalized = info.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : COMPOUND_WORDS.entrySet()) {
      normalized = normalized.replace(entry.getKey(), entry.getValue());
    }
    return normalized;
  }

  /** Upper-case state abbreviation from the last two letters of an info code, else BR. */
  static String stateOf(String info) {
    if (info.length() >= 2) {
      String suffix = info.substring(info.length() - 2).toLowerCase(Locale.ROOT);
      if (STATES.contains(suffix)) {
        return suffix.toUpperCase(Locale.ROOT);
      }
    }
    return "BR";
  }

  private static LocalDate parseDate(String text) {
    String trimmed = text.trim();
    try {
      if (trimmed.length() >= 10 && trimmed.charAt(4) == '-') {
        return LocalDate.parse(trimmed.substring(0, 10));
      }
      return LocalDate.parse(trimmed, DateTimeFormatter.ofPattern("dd/MM/yyyy"));
    } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
      throw new LiveFetchException("Bad date '" + text + "' in BCB real estate data", false, e);
    }
  }

  /** Values use a decimal comma; unparseable values become null. */
  static @Nullable Double parseValue(String text) {
    String trimmed = text.trim().replace(',', '.');
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(trimmed);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
