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
package org.apache.calcite.adapter.realestate.cache;

import org.apache.calcite.adapter.realestate.DataTable;
import org.apache.calcite.adapter.realestate.TierResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes cached payloads.
 *
 * <p>{@code json.gz} is the native format and keeps the single/multiple shape:
 * <pre>
 * {"kind": "single", "columns": [...], "rows": [[...], ...]}
 * {"kind": "multiple", "tables": {"sbpe": {"columns": [...], "rows": [...]}}}
 * </pre>
 * CSV payloads (plain or gzipped) always decode to a single table. Dates and
 * other non-JSON values are written as their ISO string form.
 */
public class PayloadCodec {
  private static final String KIND_SINGLE = "single";
  private static final String KIND_MULTIPLE = "multiple";
  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+([eE][-+]?\\d+)?");

  private final ObjectMapper mapper;

  public PayloadCodec() {
    this(new ObjectMapper());
  }

  public PayloadCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /** Writes {@code payload} as gzipped JSON. */
  public void writeJson(TierResult payload, Path target) throws IOException {
    ObjectNode root = mapper.createObjectNode();
    if (payload.isSingle()) {
      root.put("kind", KIND_SINGLE);
      writeTable(root, payload.asSingle().getTable());
    } else {
      root.put("kind", KIND_MULTIPLE);
      ObjectNode tables = root.putObject("tables");
      for (Map.Entry<String, DataTable> entry
          : payload.asMultiple().getTables().entrySet()) {
        writeTable(tables.putObject(entry.getKey()), entry.getValue());
      }
    }
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
      mapper.writeValue(out, root);
    }
  }

  private static void writeTable(ObjectNode node, DataTable table) {
    ArrayNode columns = node.putArray("columns");
    for (String column : table.getColumns()) {
      columns.add(column);
    }
    ArrayNode rows = node.putArray("rows");
    for (List<@Nullable Object> row : table.getRows()) {
      ArrayNode values = rows.addArray();
      for (Object value : row) {
        if (value == null) {
          values.addNull();
        } else if (value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte) {
          values.add(((Number) value).longValue());
        } else if (value instanceof BigDecimal) {
          values.add((BigDecimal) value);
        } else if (value instanceof Number) {
          values.add(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
          values.add((Boolean) value);
        } else {
          values.add(value.toString());
        }
      }
    }
  }

  /**
   * Decodes a payload file.
   *
   * @throws IOException if the file cannot be read or does not hold a table
   */
  public TierResult read(Path file, CacheFormat format) throws IOException {
    try (InputStream in = open(file, format)) {
      switch (format) {
      case JSON_GZ:
        return readJson(in);
      case CSV_GZ:
      case CSV:
        return TierResult.single(readCsv(in));
      default:
        throw new IOException("Unsupported format " + format);
      }
    }
  }

  private static InputStream open(Path file, CacheFormat format) throws IOException {
    InputStream in = new BufferedInputStream(Files.newInputStream(file));
    return format.isGzipped() ? new GZIPInputStream(in) : in;
  }

  private TierResult readJson(InputStream in) throws IOException {
    JsonNode root = mapper.readTree(in);
    if (root == null || !root.isObject()) {
      throw new IOException("Cached payload is not a JSON object");
    }
    String kind = root.path("kind").asText();
    if (KIND_SINGLE.equals(kind)) {
      return TierResult.single(readTable(root));
    }
    if (KIND_MULTIPLE.equals(kind)) {
      Map<String, DataTable> tables = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = root.path("tables").fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        tables.put(field.getKey(), readTable(field.getValue()));
      }
      return TierResult.multiple(tables);
    }
    throw new IOException("Unknown payload kind '" + kind + "'");
  }

  private static DataTable readTable(JsonNode node) throws IOException {
    if (!node.path("columns").isArray() || !node.path("rows").isArray()) {
      throw new IOException("Table is missing 'columns' or 'rows'");
    }
    List<String> columns = new ArrayList<>();
    for (JsonNode column : node.get("columns")) {
      columns.add(column.asText());
    }
    List<List<@Nullable Object>> rows = new ArrayList<>();
    for (JsonNode row : node.get("rows")) {
      List<@Nullable Object> values = new ArrayList<>(row.size());
      for (JsonNode value : row) {
        values.add(toValue(value));
      }
      rows.add(values);
    }
    try {
      return DataTable.of(columns, rows);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed table: " + e.getMessage(), e);
    }
  }

  private static @Nullable Object toValue(JsonNode value) {
    if (value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isIntegralNumber() && value.canConvertToLong()) {
      return value.asLong();
    }
    if (value.isNumber()) {
      return value.asDouble();
    }
    if (value.isBoolean()) {
      return value.asBoolean();
    }
    return value.asText();
  }

  /**
   * Reads a CSV document with a header row. Empty cells and {@code NA} become
   * nulls; integral and decimal literals become numbers.
   */
  public DataTable readCsv(InputStream in) throws IOException {
    Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
    List<String[]> lines;
    try (CSVReader csv = new CSVReader(reader)) {
      lines = csv.readAll();
    } catch (CsvException e) {
      throw new IOException("Malformed CSV: " + e.getMessage(), e);
    }
    if (lines.isEmpty()) {
      throw new IOException("CSV payload has no header row");
    }
    List<String> columns = new ArrayList<>(Arrays.asList(lines.get(0)));
    if (!columns.isEmpty() && columns.get(0).startsWith("\uFEFF")) {
      columns.set(0, columns.get(0).substring(1));
    }
    List<List<@Nullable Object>> rows = new ArrayList<>();
    for (int i = 1; i < lines.size(); i++) {
      String[] line = lines.get(i);
      if (line.length == 1 && line[0].isEmpty()) {
        continue;
      }
      if (line.length != columns.size()) {
        throw new IOException("CSV line " + (i + 1) + " has " + line.length
            + " cells, expected " + columns.size());
      }
      List<@Nullable Object> values = new ArrayList<>(line.length);
      for (String cell : line) {
        values.add(parseCell(cell));
      }
      rows.add(values);
    }
    try {
      return DataTable.of(columns, rows);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed CSV: " + e.getMessage(), e);
    }
  }

  static @Nullable Object parseCell(@Nullable String cell) {
    if (cell == null) {
      return null;
    }
    String trimmed = cell.trim();
    if (trimmed.isEmpty() || "NA".equals(trimmed)) {
      return null;
    }
    if (INTEGER.matcher(trimmed).matches()) {
      return Long.parseLong(trimmed);
    }
    if (DECIMAL.matcher(trimmed).matches()) {
      return Double.parseDouble(trimmed);
    }
    return cell;
  }
}
