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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Serialized forms a cached payload may take, in lookup preference order.
 */
public enum CacheFormat {
  JSON_GZ("json.gz", true),
  CSV_GZ("csv.gz", true),
  CSV("csv", false);

  private final String extension;
  private final boolean gzipped;

  CacheFormat(String extension, boolean gzipped) {
    this.extension = extension;
    this.gzipped = gzipped;
  }

  public String getExtension() {
    return extension;
  }

  public boolean isGzipped() {
    return gzipped;
  }

  /** File name of a payload for a dataset, e.g. {@code abecip.json.gz}. */
  public String fileName(String datasetId) {
    return datasetId + "." + extension;
  }

  /** Format matching a file name, or null if none does. */
  public static @Nullable CacheFormat fromFileName(String fileName) {
    for (CacheFormat format : values()) {
      if (fileName.endsWith("." + format.extension)) {
        return format;
      }
    }
    return null;
  }

  /** Dataset id encoded in a payload file name. */
  public String datasetId(String fileName) {
    return fileName.substring(0, fileName.length() - extension.length() - 1);
  }

  public static CacheFormat fromValue(String value) {
    for (CacheFormat format : values()) {
      if (format.extension.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown cache format: " + value);
  }

  @Override public String toString() {
    return extension;
  }
}
