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

import org.apache.calcite.adapter.realestate.DataTable;
import org.apache.calcite.adapter.realestate.TierResult;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Post-fetch structural and content checks.
 *
 * <p>Hard failures: a table with no rows, a missing required column, a null or
 * unparseable value in the date column. Soft warnings: dates further in the
 * future than {@link ValidationRules#getMaxFutureDays()}, fewer rows than
 * {@link ValidationRules#getMinRows()}. Every table of a multi-table payload
 * is checked and findings are prefixed with the table key.
 */
public class DatasetValidator {
  private final Clock clock;

  public DatasetValidator(Clock clock) {
    this.clock = clock;
  }

  public ValidationReport check(TierResult result, ValidationRules rules) {
    List<String> warnings = new ArrayList<>();
    List<String> failures = new ArrayList<>();
    if (result.isSingle()) {
      checkTable(result.asSingle().getTable(), rules, "", warnings, failures);
    } else {
      Map<String, DataTable> tables = result.asMultiple().getTables();
      if (tables.isEmpty()) {
        failures.add("payload contains no tables");
      }
      for (Map.Entry<String, DataTable> entry : tables.entrySet()) {
        checkTable(entry.getValue(), rules, entry.getKey() + ": ", warnings, failures);
      }
    }
    return ValidationReport.of(warnings, failures);
  }

  private void checkTable(DataTable table, ValidationRules rules, String prefix,
      List<String> warnings, List<String> failures) {
    if (table.isEmpty()) {
      failures.add(prefix + "table has zero rows");
      return;
    }
    List<String> missing = new ArrayList<>();
    for (String column : rules.getRequiredColumns()) {
      if (!table.hasColumn(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      failures.add(prefix + "missing required columns " + missing);
    }
    if (table.rowCount() < rules.getMinRows()) {
      warnings.add(prefix + "only " + table.rowCount() + " rows (expected >= "
          + rules.getMinRows() + ")");
    }
    String dateColumn = rules.getDateColumn();
    if (dateColumn != null && table.hasColumn(dateColumn)) {
      checkDates(table.column(dateColumn), rules, prefix, warnings, failures);
    }
  }

  private void checkDates(List<@Nullable Object> values, ValidationRules rules, String prefix,
      List<String> warnings, List<String> failures) {
    int invalid = 0;
    LocalDate latest = null;
    for (Object value : values) {
      LocalDate date = toDate(value);
      if (date == null) {
        invalid++;
      } else if (latest == null || date.isAfter(latest)) {
        latest = date;
      }
    }
    if (invalid > 0) {
      failures.add(prefix + invalid + " null or unparseable dates");
      return;
    }
    LocalDate limit = LocalDate.now(clock).plusDays(rules.getMaxFutureDays());
    if (latest != null && latest.isAfter(limit)) {
      warnings.add(prefix + "latest date " + latest + " is more than "
          + rules.getMaxFutureDays() + " days in the future");
    }
  }

  /** Interprets a cell as a date; null if it is not one. */
  static @Nullable LocalDate toDate(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toLocalDate();
    }
    if (value instanceof Instant) {
      return ((Instant) value).atOffset(ZoneOffset.UTC).toLocalDate();
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant().atOffset(ZoneOffset.UTC).toLocalDate();
    }
    String text = value.toString().trim();
    if (text.length() >= 10) {
      try {
        return LocalDate.parse(text.substring(0, 10));
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    return null;
  }
}
