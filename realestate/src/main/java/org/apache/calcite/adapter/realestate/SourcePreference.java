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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Which tier (or chain of tiers) a request may be satisfied from.
 *
 * <ul>
 *   <li>{@link #AUTO} - local, then remote, then live; first success wins</li>
 *   <li>{@link #LOCAL} - local cache only</li>
 *   <li>{@link #REMOTE} - remote asset store only</li>
 *   <li>{@link #LIVE} - original source only</li>
 * </ul>
 */
public enum SourcePreference {
  AUTO("auto", null, null),
  LOCAL("local", "cache", Tier.LOCAL),
  REMOTE("remote", "github", Tier.REMOTE),
  LIVE("live", "fresh", Tier.LIVE);

  private final String value;
  private final @Nullable String legacyValue;
  private final @Nullable Tier tier;

  SourcePreference(String value, @Nullable String legacyValue, @Nullable Tier tier) {
    this.value = value;
    this.legacyValue = legacyValue;
    this.tier = tier;
  }

  public String getValue() {
    return value;
  }

  /** The single tier this preference pins, or null for {@link #AUTO}. */
  public @Nullable Tier getPinnedTier() {
    return tier;
  }

  public boolean isPinned() {
    return tier != null;
  }

  /**
   * Parses a source name. The older names {@code cache}, {@code github} and
   * {@code fresh} are accepted as aliases of local, remote and live.
   *
   * @throws ValidationException if the value matches no source
   */
  public static SourcePreference fromValue(String value) {
    if (value != null) {
      for (SourcePreference source : values()) {
        if (source.value.equalsIgnoreCase(value)
            || (source.legacyValue != null && source.legacyValue.equalsIgnoreCase(value))) {
          return source;
        }
      }
    }
    throw new ValidationException("Unknown source '" + value
        + "'; expected one of auto, local, remote, live");
  }
}
