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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>A retryable failure is followed by a backoff pause and another attempt; a
 * fatal failure is rethrown at once. When the attempts run out, or the next
 * pause would cross the deadline, the last failure is rethrown with the number
 * of attempts recorded on it.
 */
public class RetryExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

  /** A unit of work that may fail with a {@link DatasetException}. */
  @FunctionalInterface
  public interface Operation<T> {
    T call();
  }

  private final Sleeper sleeper;

  public RetryExecutor(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  public <T> Attempted<T> run(String description, Operation<T> operation, RetryPolicy policy,
      Deadline deadline) {
    int maxAttempts = policy.getMaxAttempts();
    for (int attempt = 1;; attempt++) {
      try {
        return new Attempted<>(operation.call(), attempt);
      } catch (DatasetException e) {
        if (!policy.isRetryable(e)) {
          LOGGER.debug("{} failed with a fatal error on attempt {}: {}",
              description, attempt, e.getBaseMessage());
          throw e.withAttempts(attempt);
        }
        if (attempt >= maxAttempts) {
          LOGGER.warn("{} failed after {} attempts: {}", description, attempt, e.getBaseMessage());
          throw e.withAttempts(attempt);
        }
        Duration delay = policy.delayAfter(attempt);
        if (deadline.wouldExpireAfter(delay)) {
          LOGGER.warn("{} failed on attempt {} and the deadline leaves no room for a retry: {}",
              description, attempt, e.getBaseMessage());
          throw e.withAttempts(attempt);
        }
        LOGGER.warn("{} failed: {} - retrying in {} ms (attempt {}/{})",
            description, e.getBaseMessage(), delay.toMillis(), attempt, maxAttempts);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e.withAttempts(attempt);
        }
      }
    }
  }
}
