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

import org.apache.calcite.adapter.realestate.registry.DatasetDescriptor;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Age threshold after which a cached entry is considered stale.
 *
 * <p>The threshold is the descriptor's {@code warnAfterDays} when set, else
 * the default of its update schedule (manual datasets never go stale), else
 * the configured default for ids the registry does not know.
 */
public class StalenessPolicy {
  private final int defaultMaxAgeDays;

  public StalenessPolicy(int defaultMaxAgeDays) {
    this.defaultMaxAgeDays = defaultMaxAgeDays;
  }

  /** Maximum age in days, or a negative number for "never stale". */
  public int maxAgeDays(@Nullable DatasetDescriptor descriptor) {
    if (descriptor == null) {
      return defaultMaxAgeDays;
    }
    if (descriptor.getWarnAfterDays() != null) {
      return descriptor.getWarnAfterDays();
    }
    return descriptor.getUpdateSchedule().getDefaultMaxAgeDays();
  }

  public boolean isStale(Instant savedAt, @Nullable DatasetDescriptor descriptor, Instant now) {
    int maxAge = maxAgeDays(descriptor);
    if (maxAge < 0) {
      return false;
    }
    return ageDays(savedAt, now) > maxAge;
  }

  public static long ageDays(Instant savedAt, Instant now) {
    return Math.max(0, Duration.between(savedAt, now).toDays());
  }
}
