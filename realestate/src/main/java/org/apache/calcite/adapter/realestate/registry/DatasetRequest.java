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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Map;

/**
 * A request that passed registry validation: canonical descriptor, table key
 * belonging to it (or none) and typed parameters.
 */
public final class DatasetRequest {
  private final DatasetDescriptor descriptor;
  private final @Nullable String tableKey;
  private final @Nullable LocalDate dateStart;
  private final @Nullable LocalDate dateEnd;
  private final ImmutableMap<String, String> parameters;
  private final int maxRetries;

  DatasetRequest(DatasetDescriptor descriptor, @Nullable String tableKey,
      @Nullable LocalDate dateStart, @Nullable LocalDate dateEnd,
      Map<String, String> parameters, int maxRetries) {
    this.descriptor = descriptor;
    this.tableKey = tableKey;
    this.dateStart = dateStart;
    this.dateEnd = dateEnd;
    this.parameters = ImmutableMap.copyOf(parameters);
    this.maxRetries = maxRetries;
  }

  public DatasetDescriptor getDescriptor() {
    return descriptor;
  }

  public String getDatasetId() {
    return descriptor.getId();
  }

  public @Nullable String getTableKey() {
    return tableKey;
  }

  public @Nullable LocalDate getDateStart() {
    return dateStart;
  }

  public @Nullable LocalDate getDateEnd() {
    return dateEnd;
  }

  /** Normalized parameters as strings, e.g. {@code date_start=2020-01-01}. */
  public Map<String, String> getParameters() {
    return parameters;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  @Override public String toString() {
    return "DatasetRequest{" + descriptor.getId()
        + (tableKey != null ? "/" + tableKey : "")
        + (parameters.isEmpty() ? "" : ", " + parameters) + "}";
  }
}
