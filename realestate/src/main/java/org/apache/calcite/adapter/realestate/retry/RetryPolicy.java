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

import org.apache.calcite.adapter.realestate.DatasetException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff: at most {@code maxAttempts} invocations, pausing
 * {@code min(baseDelay * 2^(attempt-1), maxDelay)} after each retryable failure.
 */
public final class RetryPolicy {
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** Retries failures that report themselves retryable. */
  public static final Predicate<Throwable> RETRYABLE_DATASET_FAILURES =
      t -> t instanceof DatasetException && ((DatasetException) t).isRetryable();

  private final int maxAttempts;
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final Predicate<Throwable> retryable;

  public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
      Predicate<Throwable> retryable) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must not be negative");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.retryable = retryable;
  }

  /** Policy with default delays that retries retryable dataset failures. */
  public static RetryPolicy of(int maxAttempts) {
    return new RetryPolicy(maxAttempts, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY,
        RETRYABLE_DATASET_FAILURES);
  }

  /** Same delays and classifier, different number of attempts. */
  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, baseDelay, maxDelay, retryable);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getBaseDelay() {
    return baseDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public boolean isRetryable(Throwable t) {
    return retryable.test(t);
  }

  /**
   * Pause after the given failed attempt (1-based).
   */
  public Duration delayAfter(int attempt) {
    int shift = Math.min(Math.max(attempt - 1, 0), 30);
    long millis;
    try {
      millis = Math.multiplyExact(baseDelay.toMillis(), 1L << shift);
    } catch (ArithmeticException e) {
      millis = Long.MAX_VALUE;
    }
    return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
  }

  @Override public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts
        + ", baseDelay=" + baseDelay
        + ", maxDelay=" + maxDelay + "}";
  }
}
