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

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Pairs a final payload with its {@link Provenance}. The payload is passed
 * through untouched.
 */
public final class MetadataAttacher {
  private final Clock clock;

  public MetadataAttacher(Clock clock) {
    this.clock = clock;
  }

  public ResolvedDataset annotate(String datasetId, TierResult result, Tier tier,
      @Nullable String tableKey, int retries, Map<String, String> notes,
      List<TierAttempt> attempts) {
    Provenance provenance =
        new Provenance(tier, clock.instant(), tableKey, retries, notes, attempts);
    return new ResolvedDataset(datasetId, result, provenance);
  }
}
