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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Payload produced by a tier: either a single table or a mapping from table
 * key to table. No other shape is allowed.
 *
 * <p>Callers distinguish the two with {@link #isSingle()} or
 * {@link #map(Function, Function)}.
 */
public abstract class TierResult {

  private TierResult() {
  }

  /** Wraps one table. */
  public static Single single(DataTable table) {
    return new Single(table);
  }

  /** Wraps tables keyed by table key; iteration order is preserved. */
  public static Multiple multiple(Map<String, DataTable> tables) {
    return new Multiple(tables);
  }

  public abstract boolean isSingle();

  /** Total rows across all tables. */
  public abstract int rowCount();

  /** True when no table holds any row. */
  public boolean isEmpty() {
    return rowCount() == 0;
  }

  public Single asSingle() {
    if (!isSingle()) {
      throw new IllegalStateException("Result holds multiple tables");
    }
    return (Single) this;
  }

  public Multiple asMultiple() {
    if (isSingle()) {
      throw new IllegalStateException("Result holds a single table");
    }
    return (Multiple) this;
  }

  /** Applies the function matching the concrete shape. */
  public <R> R map(Function<Single, R> onSingle, Function<Multiple, R> onMultiple) {
    return isSingle() ? onSingle.apply((Single) this) : onMultiple.apply((Multiple) this);
  }

  /** Exactly one table. */
  public static final class Single extends TierResult {
    private final DataTable table;

    private Single(DataTable table) {
      this.table = Objects.requireNonNull(table, "table");
    }

    public DataTable getTable() {
      return table;
    }

    @Override public boolean isSingle() {
      return true;
    }

    @Override public int rowCount() {
      return table.rowCount();
    }

    @Override public boolean equals(Object o) {
      return o instanceof Single && table.equals(((Single) o).table);
    }

    @Override public int hashCode() {
      return table.hashCode();
    }

    @Override public String toString() {
      return "Single{" + table + "}";
    }
  }

  /** Tables keyed by table key. */
  public static final class Multiple extends TierResult {
    private final ImmutableMap<String, DataTable> tables;

    private Multiple(Map<String, DataTable> tables) {
      this.tables = ImmutableMap.copyOf(tables);
    }

    public Map<String, DataTable> getTables() {
      return tables;
    }

    public boolean contains(String tableKey) {
      return tables.containsKey(tableKey);
    }

    public DataTable get(String tableKey) {
      DataTable table = tables.get(tableKey);
      if (table == null) {
        throw new IllegalArgumentException("No table '" + tableKey + "' in " + tables.keySet());
      }
      return table;
    }

    @Override public boolean isSingle() {
      return false;
    }

    @Override public int rowCount() {
      int rows = 0;
      for (DataTable table : tables.values()) {
        rows += table.rowCount();
      }
      return rows;
    }

    @Override public boolean equals(Object o) {
      return o instanceof Multiple && tables.equals(((Multiple) o).tables);
    }

    @Override public int hashCode() {
      return tables.hashCode();
    }

    @Override public String toString() {
      return "Multiple{" + tables + "}";
    }
  }
}
