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
package org.apache.calcite.adapter.realestate.validation;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of checking a payload against its {@link ValidationRules}.
 *
 * <ul>
 *   <li>{@link Level#OK} - nothing to report</li>
 *   <li>{@link Level#SOFT_WARNING} - suspicious content, returned to the caller
 *       with the warnings logged</li>
 *   <li>{@link Level#HARD_FAILURE} - structurally invalid, never returned</li>
 * </ul>
 */
public final class ValidationReport {

  /** Severity of the worst finding. */
  public enum Level {
    OK,
    SOFT_WARNING,
    HARD_FAILURE
  }

  private static final ValidationReport OK_REPORT =
      new ValidationReport(ImmutableList.<String>of(), ImmutableList.<String>of());

  private final ImmutableList<String> warnings;
  private final ImmutableList<String> failures;

  private ValidationReport(List<String> warnings, List<String> failures) {
    this.warnings = ImmutableList.copyOf(warnings);
    this.failures = ImmutableList.copyOf(failures);
  }

  public static ValidationReport ok() {
    return OK_REPORT;
  }

  public static ValidationReport of(List<String> warnings, List<String> failures) {
    if (warnings.isEmpty() && failures.isEmpty()) {
      return OK_REPORT;
    }
    return new ValidationReport(warnings, failures);
  }

  public Level getLevel() {
    if (!failures.isEmpty()) {
      return Level.HARD_FAILURE;
    }
    return warnings.isEmpty() ? Level.OK : Level.SOFT_WARNING;
  }

  public boolean isHardFailure() {
    return getLevel() == Level.HARD_FAILURE;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public List<String> getFailures() {
    return failures;
  }

  @Override public String toString() {
    if (getLevel() == Level.OK) {
      return "ValidationReport{OK}";
    }
    return "ValidationReport{" + getLevel() + ", failures=" + failures
        + ", warnings=" + warnings + "}";
  }
}
