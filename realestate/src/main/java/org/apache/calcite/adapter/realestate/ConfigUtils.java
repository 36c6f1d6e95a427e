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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for configuration values.
 */
public final class ConfigUtils {
  /** {@code ${VAR}} or {@code ${VAR:default}}. */
  private static final Pattern ENV_VAR_PATTERN =
      Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");

  private ConfigUtils() {
  }

  /**
   * Replaces {@code ${VAR:default}} placeholders with the environment variable
   * {@code VAR}, else the system property {@code VAR}, else {@code default}.
   * A placeholder with no value and no default becomes the empty string.
   */
  public static @Nullable String resolveEnvVar(@Nullable String value) {
    if (value == null || !value.contains("${")) {
      return value;
    }
    Matcher matcher = ENV_VAR_PATTERN.matcher(value);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      String varName = matcher.group(1);
      String defaultValue = matcher.group(2);
      String resolved = System.getenv(varName);
      if (resolved == null) {
        resolved = System.getProperty(varName);
      }
      if (resolved == null) {
        resolved = defaultValue != null ? defaultValue : "";
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
