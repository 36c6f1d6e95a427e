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
package org.apache.calcite.adapter.realestate.remote;

import org.apache.calcite.adapter.realestate.cache.CacheFormat;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * One downloadable file of a remote release, e.g. {@code abecip.json.gz}.
 */
public final class RemoteAsset {
  private final String datasetId;
  private final String name;
  private final CacheFormat format;
  private final long size;
  private final Instant updatedAt;
  private final String downloadUrl;
  private final @Nullable String digest;

  public RemoteAsset(String name, CacheFormat format, long size, Instant updatedAt,
      String downloadUrl, @Nullable String digest) {
    this.datasetId = format.datasetId(name);
    this.name = name;
    this.format = format;
    this.size = size;
    this.updatedAt = updatedAt;
    this.downloadUrl = downloadUrl;
    this.digest = digest;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public String getName() {
    return name;
  }

  public CacheFormat getFormat() {
    return format;
  }

  /** Size in bytes as advertised by the store; 0 if unknown. */
  public long getSize() {
    return size;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public String getDownloadUrl() {
    return downloadUrl;
  }

  /** Content digest such as {@code sha256:...}, when the store publishes one. */
  public @Nullable String getDigest() {
    return digest;
  }

  @Override public String toString() {
    return name + " (" + size + " bytes, updated " + updatedAt + ")";
  }
}
