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

import org.apache.calcite.adapter.realestate.TierResult;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A payload read from or written to the local cache.
 */
public final class CacheEntry {
  private final String datasetId;
  private final TierResult payload;
  private final Instant savedAt;
  private final long sizeBytes;
  private final CacheFormat format;
  private final @Nullable String source;
  private final Path file;
  private final boolean stale;

  public CacheEntry(String datasetId, TierResult payload, Instant savedAt, long sizeBytes,
      CacheFormat format, @Nullable String source, Path file, boolean stale) {
    this.datasetId = datasetId;
    this.payload = payload;
    this.savedAt = savedAt;
    this.sizeBytes = sizeBytes;
    this.format = format;
    this.source = source;
    this.file = file;
    this.stale = stale;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public TierResult getPayload() {
    return payload;
  }

  public Instant getSavedAt() {
    return savedAt;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public CacheFormat getFormat() {
    return format;
  }

  /** Tier that originally produced the payload, if recorded. */
  public @Nullable String getSource() {
    return source;
  }

  public Path getFile() {
    return file;
  }

  /** Whether the entry was older than its freshness threshold when read. */
  public boolean isStale() {
    return stale;
  }

  @Override public String toString() {
    return "CacheEntry{" + datasetId + ", " + format + ", savedAt=" + savedAt
        + ", " + sizeBytes + " bytes" + (stale ? ", stale" : "") + "}";
  }
}
