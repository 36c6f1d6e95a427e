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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the exceptions raised while resolving a dataset.
 *
 * <p>Every failure that reaches a caller of {@link DatasetResolver} is one of
 * the subclasses of this type. Besides the usual message and cause, an instance
 * carries the number of attempts made by the retry wrapper and, when the
 * resolver gave up on several tiers, the chain of earlier tier failures.
 */
public class DatasetException extends RuntimeException {

  private int attempts = 1;
  private final List<TierAttempt> tierAttempts = new ArrayList<>();

  /**
   * Creates a new DatasetException with the specified message.
   */
  public DatasetException(String message) {
    super(message);
  }

  /**
   * Creates a new DatasetException with the specified message and cause.
   */
  public DatasetException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the operation that produced this failure may succeed if repeated.
   * Only transport-level failures are retryable.
   */
  public boolean isRetryable() {
    return false;
  }

  /** Number of times the failing operation was invoked. */
  public int getAttempts() {
    return attempts;
  }

  /** Records how many attempts the retry wrapper made before giving up. */
  public DatasetException withAttempts(int attempts) {
    this.attempts = Math.max(1, attempts);
    return this;
  }

  /** Tier failures recorded before this one, oldest first. */
  public List<TierAttempt> getTierAttempts() {
    return Collections.unmodifiableList(tierAttempts);
  }

  /** Attaches the chain of tiers the resolver tried before this failure. */
  public DatasetException withTierAttempts(List<TierAttempt> attempts) {
    tierAttempts.clear();
    tierAttempts.addAll(attempts);
    return this;
  }

  /** The message without the attempt and tier annotations. */
  public String getBaseMessage() {
    return super.getMessage();
  }

  @Override public String getMessage() {
    StringBuilder message = new StringBuilder(String.valueOf(super.getMessage()));
    if (attempts > 1) {
      message.append(" (after ").append(attempts).append(" attempts)");
    }
    if (!tierAttempts.isEmpty()) {
      message.append("; tried: ");
      for (int i = 0; i < tierAttempts.size(); i++) {
        if (i > 0) {
          message.append(", ");
        }
        message.append(tierAttempts.get(i).describe());
      }
    }
    return message.toString();
  }
}
