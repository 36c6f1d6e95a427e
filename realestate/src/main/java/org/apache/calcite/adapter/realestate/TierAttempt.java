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

import java.util.Locale;

/**
 * Outcome of consulting one tier during a single resolution.
 */
public final class TierAttempt {

  /** What happened when the tier was consulted. */
  public enum Outcome {
    /** The tier produced the result that was returned. */
    HIT,
    /** The tier had nothing usable for the request. */
    MISS,
    /** The tier failed with an error. */
    FAILED,
    /** The tier cannot serve this dataset and was not called. */
    SKIPPED
  }

  private final Tier tier;
  private final Outcome outcome;
  private final @Nullable String detail;
  private final int retries;

  public TierAttempt(Tier tier, Outcome outcome, @Nullable String detail, int retries) {
    this.tier = tier;
    this.outcome = outcome;
    this.detail = detail;
    this.retries = retries;
  }

  public static TierAttempt hit(Tier tier, int retries) {
    return new TierAttempt(tier, Outcome.HIT, null, retries);
  }

  /** Builds the attempt record for a tier that raised {@code e}. */
  public static TierAttempt fromFailure(Tier tier, DatasetException e) {
    Outcome outcome = e instanceof CacheMissException ? Outcome.MISS : Outcome.FAILED;
    return new TierAttempt(tier, outcome, e.getBaseMessage(), Math.max(0, e.getAttempts() - 1));
  }

  public Tier getTier() {
    return tier;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public @Nullable String getDetail() {
    return detail;
  }

  public int getRetries() {
    return retries;
  }

  /** Short human-readable form, e.g. {@code remote (failed: HTTP 503)}. */
  public String describe() {
    StringBuilder sb = new StringBuilder(tier.getValue())
        .append(" (").append(outcome.name().toLowerCase(Locale.ROOT));
    if (detail != null) {
      sb.append(": ").append(detail);
    }
    return sb.append(')').toString();
  }

  @Override public String toString() {
    return "TierAttempt{" + describe() + ", retries=" + retries + "}";
  }
}
