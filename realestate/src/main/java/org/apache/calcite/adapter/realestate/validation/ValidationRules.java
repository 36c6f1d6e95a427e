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
package org.apache.calcite.adapter.realestate.validation;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Structural expectations for the tables of one dataset.
 *
 * <p>Read from the {@code validation} block of a dataset in
 * {@code datasets.yaml}:
 * <pre>
 * validation:
 *   requiredColumns: [date, value]
 *   dateColumn: date
 *   minRows: 12
 * </pre>
 */
public final class ValidationRules {
  public static final String DEFAULT_DATE_COLUMN = "date";
  public static final int DEFAULT_MIN_ROWS = 1;
  public static final int DEFAULT_MAX_FUTURE_DAYS = 90;

  /** No required columns, date checks on a {@code date} column when present. */
  public static final ValidationRules DEFAULTS = new ValidationRules(
      Collections.<String>emptyList(), DEFAULT_DATE_COLUMN, DEFAULT_MIN_ROWS,
      DEFAULT_MAX_FUTURE_DAYS);

  private final ImmutableList<String> requiredColumns;
  private final @Nullable String dateColumn;
  private final int minRows;
  private final int maxFutureDays;

  public ValidationRules(List<String> requiredColumns, @Nullable String dateColumn,
      int minRows, int maxFutureDays) {
    this.requiredColumns = ImmutableList.copyOf(requiredColumns);
    this.dateColumn = dateColumn;
    this.minRows = minRows;
    this.maxFutureDays = maxFutureDays;
  }

  /**
   * Builds rules from a parsed YAML block; missing keys fall back to the
   * defaults.
   *
   * @throws IllegalArgumentException if a key holds a value of the wrong type
   */
  public static ValidationRules fromMap(@Nullable Map<String, Object> map, int maxFutureDays) {
    if (map == null) {
      return DEFAULTS.withMaxFutureDays(maxFutureDays);
    }
    List<String> required = new ArrayList<>();
    Object columns = map.get("requiredColumns");
    if (columns instanceof List) {
      for (Object column : (List<?>) columns) {
        if (!(column instanceof String)) {
          throw new IllegalArgumentException("requiredColumns must list column names, got "
              + column);
        }
        required.add((String) column);
      }
    } else if (columns != null) {
      throw new IllegalArgumentException("requiredColumns must be a list, got " + columns);
    }
    String dateColumn = DEFAULT_DATE_COLUMN;
    if (map.containsKey("dateColumn")) {
      Object value = map.get("dateColumn");
      if (value != null && !(value instanceof String)) {
        throw new IllegalArgumentException("dateColumn must be a column name, got " + value);
      }
      dateColumn = (String) value;
    }
    int minRows = intValue(map, "minRows", DEFAULT_MIN_ROWS);
    int futureDays = intValue(map, "maxFutureDays", maxFutureDays);
    return new ValidationRules(required, dateColumn, minRows, futureDays);
  }

  private static int intValue(Map<String, Object> map, String key, int defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(key + " must be a number, got " + value);
    }
    return ((Number) value).intValue();
  }

  public ValidationRules withMaxFutureDays(int days) {
    return new ValidationRules(requiredColumns, dateColumn, minRows, days);
  }

  public List<String> getRequiredColumns() {
    return requiredColumns;
  }

  /** Column holding observation dates, or null to skip date checks. */
  public @Nullable String getDateColumn() {
    return dateColumn;
  }

  public int getMinRows() {
    return minRows;
  }

  public int getMaxFutureDays() {
    return maxFutureDays;
  }

  @Override public String toString() {
    return "ValidationRules{required=" + requiredColumns
        + ", dateColumn=" + dateColumn
        + ", minRows=" + minRows
        + ", maxFutureDays=" + maxFutureDays + "}";
  }
}
