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

import java.util.Locale;

/**
 * How often the upstream source publishes new data. Determines how long a
 * cached copy is considered fresh when the dataset sets no explicit limit.
 */
public enum UpdateSchedule {
  WEEKLY(14),
  MONTHLY(60),
  MANUAL(-1);

  private final int defaultMaxAgeDays;

  UpdateSchedule(int defaultMaxAgeDays) {
    this.defaultMaxAgeDays = defaultMaxAgeDays;
  }

  /** Freshness limit in days, or -1 when the cache never goes stale. */
  public int getDefaultMaxAgeDays() {
    return defaultMaxAgeDays;
  }

  public static UpdateSchedule fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
