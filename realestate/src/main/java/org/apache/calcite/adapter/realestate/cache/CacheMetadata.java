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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Sidecar record stored next to each cached payload as {@code <id>.meta.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheMetadata {
  /** Epoch millis of the save. */
  @JsonProperty("savedAt")
  public long savedAt;

  @JsonProperty("format")
  public String format;

  @JsonProperty("sizeBytes")
  public long sizeBytes;

  @JsonProperty("rowCount")
  public long rowCount;

  @JsonProperty("colCount")
  public int colCount;

  /** Tier the payload came from, e.g. "remote" or "live". */
  @JsonProperty("source")
  public String source;

  /** Digest of the remote asset the payload was promoted from, if any. */
  @JsonProperty("digest")
  public String digest;

  /** Table keys of a multi-table payload; empty for a single table. */
  @JsonProperty("tables")
  public List<String> tables = new ArrayList<>();
}
