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

/**
 * The three backends a dataset request may be satisfied from, in the order
 * the automatic fallback consults them.
 */
public enum Tier {
  /** Persisted cache in the local cache directory. */
  LOCAL("local"),

  /** Versioned assets published to the remote store. */
  REMOTE("remote"),

  /** Fetch from the original institution through a registered collaborator. */
  LIVE("live");

  private final String value;

  Tier(String value) {
    this.value = value;
  }

  /** Lower-case name used in logs, provenance and cache sidecars. */
  public String getValue() {
    return value;
  }

  /**
   * Parses the lower-case tier name.
   *
   * @throws IllegalArgumentException if the value names no tier
   */
  public static Tier fromValue(String value) {
    for (Tier tier : values()) {
      if (tier.value.equalsIgnoreCase(value)) {
        return tier;
      }
    }
    throw new IllegalArgumentException("Unknown tier: " + value);
  }

  @Override public String toString() {
    return value;
  }
}
