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
package org.apache.calcite.adapter.realestate.live;

import org.apache.calcite.adapter.realestate.registry.DatasetRequest;
import org.apache.calcite.adapter.realestate.retry.Deadline;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Map;

/**
 * What a {@link DatasetFetcher} is asked for: an optional table, an optional
 * date range and the deadline its network calls must respect.
 */
public final class FetchParameters {
  private final @Nullable String tableKey;
  private final @Nullable LocalDate dateStart;
  private final @Nullable LocalDate dateEnd;
  private final ImmutableMap<String, String> parameters;
  private final Deadline deadline;

  public FetchParameters(@Nullable String tableKey, @Nullable LocalDate dateStart,
      @Nullable LocalDate dateEnd, Map<String, String> parameters, Deadline deadline) {
    this.tableKey = tableKey;
    this.dateStart = dateStart;
    this.dateEnd = dateEnd;
    this.parameters = ImmutableMap.copyOf(parameters);
    this.deadline = deadline;
  }

  public static FetchParameters of(DatasetRequest request, Deadline deadline) {
    return new FetchParameters(request.getTableKey(), request.getDateStart(),
        request.getDateEnd(), request.getParameters(), deadline);
  }

  /** Requested table, or null for every table. */
  public @Nullable String getTableKey() {
    return tableKey;
  }

  public @Nullable LocalDate getDateStart() {
    return dateStart;
  }

  public @Nullable LocalDate getDateEnd() {
    return dateEnd;
  }

  public Map<String, String> getParameters() {
    return parameters;
  }

  public Deadline getDeadline() {
    return deadline;
  }

  @Override public String toString() {
    return "FetchParameters{table=" + tableKey + ", " + parameters + "}";
  }
}
