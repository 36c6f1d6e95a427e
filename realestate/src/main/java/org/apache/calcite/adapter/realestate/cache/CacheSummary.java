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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * One row of the cache listing.
 */
public final class CacheSummary {
  private final String datasetId;
  private final String fileName;
  private final CacheFormat format;
  private final long sizeBytes;
  private final Instant savedAt;
  private final long ageDays;
  private final boolean stale;
  private final @Nullable String source;
  private final ImmutableList<String> tables;

  public CacheSummary(String datasetId, String fileName, CacheFormat format, long sizeBytes,
      Instant savedAt, long ageDays, boolean stale, @Nullable String source,
      List<String> tables) {
    this.datasetId = datasetId;
    this.fileName = fileName;
    this.format = format;
    this.sizeBytes = sizeBytes;
    this.savedAt = savedAt;
    this.ageDays = ageDays;
    this.stale = stale;
    this.source = source;
    this.tables = ImmutableList.copyOf(tables);
  }

  public String getDatasetId() {
    return datasetId;
  }

  public String getFileName() {
    return fileName;
  }

  public CacheFormat getFormat() {
    return format;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public Instant getSavedAt() {
    return savedAt;
  }

  public long getAgeDays() {
    return ageDays;
  }

  public boolean isStale() {
    return stale;
  }

  public @Nullable String getSource() {
    return source;
  }

  public List<String> getTables() {
    return tables;
  }

  @Override public String toString() {
    return String.format("%s (%s, %.1f KB, %d days%s)", fileName, format,
        sizeBytes / 1024.0, ageDays, stale ? ", stale" : "");
  }
}
