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
package org.apache.calcite.adapter.realestate.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time after which network work for one resolution must stop.
 */
public final class Deadline {
  private final Clock clock;
  private final Instant expiresAt;

  private Deadline(Clock clock, Instant expiresAt) {
    this.clock = clock;
    this.expiresAt = expiresAt;
  }

  /** Deadline {@code timeout} from now on the given clock. */
  public static Deadline after(Clock clock, Duration timeout) {
    return new Deadline(clock, clock.instant().plus(timeout));
  }

  /** Deadline that never expires. */
  public static Deadline none(Clock clock) {
    return new Deadline(clock, Instant.MAX);
  }

  public boolean isUnbounded() {
    return expiresAt.equals(Instant.MAX);
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  /** Time left, never negative. */
  public Duration remaining() {
    if (isUnbounded()) {
      return Duration.ofSeconds(Long.MAX_VALUE);
    }
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /** Whether waiting {@code pause} would run past the deadline. */
  public boolean wouldExpireAfter(Duration pause) {
    return !isUnbounded() && pause.compareTo(remaining()) >= 0;
  }

  /** The smaller of {@code timeout} and the time left. */
  public Duration cap(Duration timeout) {
    Duration left = remaining();
    return timeout.compareTo(left) <= 0 ? timeout : left;
  }

  @Override public String toString() {
    return isUnbounded() ? "Deadline{none}" : "Deadline{" + expiresAt + "}";
  }
}
