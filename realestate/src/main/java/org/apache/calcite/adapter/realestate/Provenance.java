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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * How a resolved dataset was obtained. Carried next to the payload, never
 * inside it.
 */
public final class Provenance {
  private final Tier source;
  private final Instant fetchedAt;
  private final @Nullable String tableKey;
  private final int retries;
  private final ImmutableMap<String, String> notes;
  private final ImmutableList<TierAttempt> attempts;

  public Provenance(Tier source, Instant fetchedAt, @Nullable String tableKey, int retries,
      Map<String, String> notes, List<TierAttempt> attempts) {
    this.source = source;
    this.fetchedAt = fetchedAt;
    this.tableKey = tableKey;
    this.retries = retries;
    this.notes = ImmutableMap.copyOf(notes);
    this.attempts = ImmutableList.copyOf(attempts);
  }

  /** Tier that produced the payload. */
  public Tier getSource() {
    return source;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }

  /** Table key applied by the table filter, or null when none was requested. */
  public @Nullable String getTableKey() {
    return tableKey;
  }

  /** Retries made by the winning tier (attempts minus one). */
  public int getRetries() {
    return retries;
  }

  public Map<String, String> getNotes() {
    return notes;
  }

  /** Every tier consulted, in order, ending with the winning one. */
  public List<TierAttempt> getAttempts() {
    return attempts;
  }

  @Override public String toString() {
    return "Provenance{source=" + source
        + ", fetchedAt=" + fetchedAt
        + ", table=" + tableKey
        + ", retries=" + retries
        + ", notes=" + notes + "}";
  }
}
