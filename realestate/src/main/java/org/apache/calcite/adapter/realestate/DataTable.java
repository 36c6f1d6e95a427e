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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable rectangular table: an ordered list of column names and rows of
 * values, one value per column.
 *
 * <p>Values are whatever the producing tier decoded (strings, numbers,
 * {@link java.time.LocalDate}s, booleans or nulls). The resolver does not
 * interpret them beyond the checks made by the validator.
 */
public final class DataTable {
  private final ImmutableList<String> columns;
  private final List<List<@Nullable Object>> rows;

  private DataTable(ImmutableList<String> columns, List<List<@Nullable Object>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Creates a table, copying the given rows.
   *
   * @throws IllegalArgumentException if a column name repeats or a row has the
   *     wrong width
   */
  public static DataTable of(List<String> columns, List<? extends List<?>> rows) {
    Set<String> seen = new HashSet<>();
    for (String column : columns) {
      if (column == null || !seen.add(column)) {
        throw new IllegalArgumentException("Duplicate or null column name: " + column);
      }
    }
    List<List<@Nullable Object>> copy = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<?> row = rows.get(i);
      if (row.size() != columns.size()) {
        throw new IllegalArgumentException("Row " + i + " has " + row.size()
            + " values, expected " + columns.size());
      }
      copy.add(Collections.unmodifiableList(new ArrayList<@Nullable Object>(row)));
    }
    return new DataTable(ImmutableList.copyOf(columns), Collections.unmodifiableList(copy));
  }

  /** Builds a table from row maps; columns follow the key order of the first row. */
  public static DataTable fromRecords(List<? extends Map<String, ?>> records) {
    if (records.isEmpty()) {
      return of(Collections.<String>emptyList(), Collections.<List<Object>>emptyList());
    }
    List<String> columns = new ArrayList<>(records.get(0).keySet());
    List<List<Object>> rows = new ArrayList<>(records.size());
    for (Map<String, ?> record : records) {
      List<Object> row = new ArrayList<>(columns.size());
      for (String column : columns) {
        row.add(record.get(column));
      }
      rows.add(row);
    }
    return of(columns, rows);
  }

  /** Starts a table with the given columns, filled row by row. */
  public static Builder builder(String... columns) {
    return new Builder(Arrays.asList(columns));
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<List<@Nullable Object>> getRows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /** Position of a column, or -1. */
  public int columnIndex(String column) {
    return columns.indexOf(column);
  }

  /** Values of one column, top to bottom. */
  public List<@Nullable Object> column(String column) {
    int index = columnIndex(column);
    if (index < 0) {
      throw new IllegalArgumentException("No column '" + column + "' in " + columns);
    }
    List<@Nullable Object> values = new ArrayList<>(rows.size());
    for (List<@Nullable Object> row : rows) {
      values.add(row.get(index));
    }
    return values;
  }

  public @Nullable Object getValue(int row, String column) {
    int index = columnIndex(column);
    if (index < 0) {
      throw new IllegalArgumentException("No column '" + column + "' in " + columns);
    }
    return rows.get(row).get(index);
  }

  /** One row as a column-name keyed map. */
  public Map<String, @Nullable Object> rowAsMap(int row) {
    Map<String, @Nullable Object> map = new LinkedHashMap<>();
    List<@Nullable Object> values = rows.get(row);
    for (int i = 0; i < columns.size(); i++) {
      map.put(columns.get(i), values.get(i));
    }
    return map;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DataTable that = (DataTable) o;
    return columns.equals(that.columns) && rows.equals(that.rows);
  }

  @Override public int hashCode() {
    return Objects.hash(columns, rows);
  }

  @Override public String toString() {
    return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
  }

  /** Accumulates rows for a {@link DataTable}. */
  public static final class Builder {
    private final List<String> columns;
    private final List<List<Object>> rows = new ArrayList<>();

    private Builder(List<String> columns) {
      this.columns = columns;
    }

    public Builder row(Object... values) {
      rows.add(Arrays.asList(values));
      return this;
    }

    public DataTable build() {
      return DataTable.of(columns, rows);
    }
  }
}
