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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * States one resolve call went through.
 *
 * <p>{@code NOT_TRIED -> LOCAL_CHECKED -> REMOTE_CHECKED -> LIVE_CHECKED -> DONE},
 * skipping the tiers a call does not consult, or {@code FAILED} from any
 * non-terminal state.
 */
public final class ResolutionTrace {

  /** Resolution state. */
  public enum State {
    NOT_TRIED,
    LOCAL_CHECKED,
    REMOTE_CHECKED,
    LIVE_CHECKED,
    DONE,
    FAILED;

    boolean isTerminal() {
      return this == DONE || this == FAILED;
    }

    static State checked(Tier tier) {
      switch (tier) {
      case LOCAL:
        return LOCAL_CHECKED;
      case REMOTE:
        return REMOTE_CHECKED;
      case LIVE:
        return LIVE_CHECKED;
      default:
        throw new AssertionError(tier);
      }
    }
  }

  private final List<State> history = new ArrayList<>();

  public ResolutionTrace() {
    history.add(State.NOT_TRIED);
  }

  public State getState() {
    return history.get(history.size() - 1);
  }

  /** Every state entered, in order, starting with {@code NOT_TRIED}. */
  public List<State> getHistory() {
    return ImmutableList.copyOf(history);
  }

  void advance(State next) {
    State current = getState();
    if (current.isTerminal()) {
      throw new IllegalStateException("Resolution already " + current);
    }
    if (!next.isTerminal() && next.compareTo(current) <= 0) {
      throw new IllegalStateException("Cannot go from " + current + " to " + next);
    }
    history.add(next);
  }

  void checked(Tier tier) {
    advance(State.checked(tier));
  }

  @Override public String toString() {
    return "ResolutionTrace" + history;
  }
}
