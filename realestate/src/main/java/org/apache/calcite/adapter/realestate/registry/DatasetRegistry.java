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
package org.apache.calcite.adapter.realestate.registry;

import org.apache.calcite.adapter.realestate.NotFoundException;
import org.apache.calcite.adapter.realestate.ValidationException;
import org.apache.calcite.adapter.realestate.retry.RetryPolicy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static catalog of dataset descriptors.
 *
 * <p>Hidden datasets behave exactly like unknown ones for every public
 * operation: they are left out of {@link #list(boolean)} unless asked for, and
 * {@link #lookup} and {@link #validate} reject them with the same opaque
 * {@link NotFoundException}. None of the methods perform I/O.
 */
public class DatasetRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistry.class);

  /** Table value that means "every table" on multi-table datasets. */
  public static final String ALL_TABLES = "all";
  public static final String DATE_START = "date_start";
  public static final String DATE_END = "date_end";

  private final Map<String, DatasetDescriptor> descriptors = new TreeMap<>();
  private final Map<String, String> aliases = new HashMap<>();

  public DatasetRegistry(Collection<DatasetDescriptor> descriptors) {
    for (DatasetDescriptor descriptor : descriptors) {
      if (this.descriptors.put(descriptor.getId(), descriptor) != null) {
        throw new IllegalArgumentException("Duplicate dataset id: " + descriptor.getId());
      }
    }
    for (DatasetDescriptor descriptor : descriptors) {
      for (String alias : descriptor.getLegacyAliases()) {
        if (this.descriptors.containsKey(alias) || aliases.put(alias, descriptor.getId()) != null) {
          throw new IllegalArgumentException("Legacy alias '" + alias
              + "' of dataset '" + descriptor.getId() + "' is already taken");
        }
      }
    }
  }

  /**
   * Finds a visible descriptor by id or legacy alias.
   *
   * @throws NotFoundException if the id is unknown or the dataset is hidden
   */
  public DatasetDescriptor lookup(String id) {
    DatasetDescriptor descriptor = find(id);
    if (descriptor == null || descriptor.isHidden()) {
      throw new NotFoundException(id);
    }
    return descriptor;
  }

  /** Like {@link #lookup} but returns null instead of throwing. */
  public @Nullable DatasetDescriptor findVisible(String id) {
    DatasetDescriptor descriptor = find(id);
    return descriptor == null || descriptor.isHidden() ? null : descriptor;
  }

  private @Nullable DatasetDescriptor find(@Nullable String id) {
    if (id == null) {
      return null;
    }
    DatasetDescriptor descriptor = descriptors.get(id);
    if (descriptor != null) {
      return descriptor;
    }
    String canonical = aliases.get(id);
    if (canonical != null) {
      LOGGER.warn("Dataset name '{}' is deprecated. Use '{}' instead.", id, canonical);
      return descriptors.get(canonical);
    }
    return null;
  }

  /**
   * Lazy, restartable view of dataset summaries ordered by id. Each call to
   * {@code iterator()} walks the catalog again.
   */
  public Iterable<DatasetSummary> list(boolean includeHidden) {
    Iterable<DatasetDescriptor> visible = includeHidden
        ? descriptors.values()
        : Iterables.filter(descriptors.values(), d -> !d.isHidden());
    return Iterables.transform(visible, DatasetSummary::of);
  }

  /** Visible summaries only. */
  public Iterable<DatasetSummary> list() {
    return list(false);
  }

  /**
   * Visible summaries whose description, source and geography match the given
   * patterns. Each pattern is a case-insensitive regular expression searched
   * anywhere in the field; a null pattern matches everything. The view stays
   * lazy and ordered by id.
   *
   * @param category pattern matched against the description
   * @param source pattern matched against the data source
   * @param geography pattern matched against the geographic coverage
   * @throws ValidationException if a pattern is not a valid regular expression
   */
  public Iterable<DatasetSummary> list(@Nullable String category, @Nullable String source,
      @Nullable String geography) {
    Predicate<DatasetSummary> byCategory = matching("category", category,
        DatasetSummary::getDescription);
    Predicate<DatasetSummary> bySource = matching("source", source, DatasetSummary::getSource);
    Predicate<DatasetSummary> byGeography = matching("geography", geography,
        DatasetSummary::getGeography);
    return Iterables.filter(list(false),
        summary -> byCategory.test(summary) && bySource.test(summary)
            && byGeography.test(summary));
  }

  private static Predicate<DatasetSummary> matching(String name, @Nullable String pattern,
      Function<DatasetSummary, String> field) {
    if (pattern == null) {
      return summary -> true;
    }
    Pattern compiled;
    try {
      compiled = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    } catch (PatternSyntaxException e) {
      throw new ValidationException("Invalid " + name + " filter '" + pattern + "': "
          + e.getDescription());
    }
    return summary -> compiled.matcher(field.apply(summary)).find();
  }

  /** Every descriptor, hidden ones included; for maintenance code only. */
  public Collection<DatasetDescriptor> descriptors() {
    return ImmutableList.copyOf(descriptors.values());
  }

  /**
   * Checks a request against the catalog and normalizes it.
   *
   * @param id dataset id or legacy alias
   * @param table table key, {@code "all"} or null
   * @param params optional parameters: {@code date_start} and {@code date_end}
   *     as {@link LocalDate} or ISO-8601 strings
   * @param maxRetries attempts allowed per network-bound tier, at least 1
   * @throws NotFoundException for an unknown or hidden dataset
   * @throws ValidationException for a table or parameter the dataset does not accept
   */
  public DatasetRequest validate(String id, @Nullable String table, Map<String, ?> params,
      int maxRetries) {
    if (id == null || id.trim().isEmpty()) {
      throw new ValidationException("Dataset id must be a non-empty string");
    }
    if (maxRetries < 1) {
      throw new ValidationException("maxRetries must be at least 1, got " + maxRetries);
    }
    DatasetDescriptor descriptor = lookup(id.trim());
    String tableKey = normalizeTable(descriptor, table);

    LocalDate dateStart = null;
    LocalDate dateEnd = null;
    Map<String, String> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : params.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (DATE_START.equals(key)) {
        dateStart = toDate(key, value);
        normalized.put(key, dateStart.toString());
      } else if (DATE_END.equals(key)) {
        dateEnd = toDate(key, value);
        normalized.put(key, dateEnd.toString());
      } else {
        throw new ValidationException("Unknown parameter '" + key + "'; supported: "
            + DATE_START + ", " + DATE_END);
      }
    }
    if (dateStart != null && dateEnd != null && dateStart.isAfter(dateEnd)) {
      throw new ValidationException(DATE_START + " " + dateStart + " is after "
          + DATE_END + " " + dateEnd);
    }
    return new DatasetRequest(descriptor, tableKey, dateStart, dateEnd, normalized, maxRetries);
  }

  /** Validates a request with the default number of retries. */
  public DatasetRequest validate(String id, @Nullable String table, Map<String, ?> params) {
    return validate(id, table, params, RetryPolicy.DEFAULT_MAX_ATTEMPTS);
  }

  /** Validates a request without parameters. */
  public DatasetRequest validate(String id, @Nullable String table) {
    return validate(id, table, new HashMap<String, Object>());
  }

  private static @Nullable String normalizeTable(DatasetDescriptor descriptor,
      @Nullable String table) {
    if (table == null) {
      return null;
    }
    String key = table.trim();
    if (key.isEmpty()) {
      throw new ValidationException("Table must be a non-empty string");
    }
    if (!descriptor.isMultiTable()) {
      throw new ValidationException("Dataset '" + descriptor.getId()
          + "' has a single table; got table '" + key + "'");
    }
    if (ALL_TABLES.equals(key)) {
      return null;
    }
    if (!descriptor.hasTable(key)) {
      throw new ValidationException("Invalid table '" + key + "' for dataset '"
          + descriptor.getId() + "'. Valid tables: " + descriptor.getTables());
    }
    return key;
  }

  private static LocalDate toDate(String key, Object value) {
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    if (value instanceof CharSequence) {
      try {
        return LocalDate.parse(value.toString().trim());
      } catch (DateTimeParseException e) {
        throw new ValidationException(key + " must be a YYYY-MM-DD date, got '" + value + "'");
      }
    }
    throw new ValidationException(key + " must be a date, got "
        + value.getClass().getSimpleName());
  }
}
