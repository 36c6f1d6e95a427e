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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ResolverConfig} and {@link ConfigUtils}.
 */
@Tag("unit")
public class ResolverConfigTest {

  private static final String PROPERTY = "REALESTATE_TEST_PLACEHOLDER";

  @AfterEach
  void tearDown() {
    System.clearProperty(PROPERTY);
  }

  @Test void testBundledDefaults() {
    ResolverConfig config = ResolverConfig.load();

    assertEquals(ResolverConfig.DEFAULT_API_BASE_URL, config.getRemoteApiBaseUrl());
    assertEquals(Duration.ofSeconds(1), config.getRetryBaseDelay());
    assertEquals(Duration.ofSeconds(30), config.getRetryMaxDelay());
    assertEquals(Duration.ofSeconds(60), config.getHttpRequestTimeout());
    assertEquals(Duration.ofSeconds(300), config.getResolveDeadline());
    assertEquals(14, config.getDefaultMaxAgeDays());
    assertEquals(Duration.ofSeconds(10), config.getLockTimeout());
    assertEquals(90, config.getMaxFutureDays());
  }

  @Test void testNestedAndDottedOverrides() {
    Map<String, Object> retry = new HashMap<>();
    retry.put("baseDelayMs", 250);
    Map<String, Object> operand = new HashMap<>();
    operand.put("retry", retry);
    operand.put("resolve.deadlineSeconds", "0");
    operand.put("cacheDirectory", "/tmp/realestate-test");
    operand.put("remote.tag", "cache-2024-06");

    ResolverConfig config = ResolverConfig.fromOperand(operand);

    assertEquals(Duration.ofMillis(250), config.getRetryBaseDelay());
    assertEquals(Duration.ofSeconds(30), config.getRetryMaxDelay());
    assertEquals(Duration.ZERO, config.getResolveDeadline());
    assertEquals(Paths.get("/tmp/realestate-test"), config.getCacheDirectory());
    assertEquals("cache-2024-06", config.getRemoteTag());
  }

  @Test void testPlaceholdersInOverrides() {
    System.setProperty(PROPERTY, "/tmp/from-property");
    Map<String, Object> operand = new HashMap<>();
    operand.put("cacheDirectory", "${" + PROPERTY + ":/tmp/unused}");
    operand.put("cache.defaultMaxAgeDays", "${REALESTATE_UNSET_VARIABLE:21}");

    ResolverConfig config = ResolverConfig.fromOperand(operand);

    assertEquals(Paths.get("/tmp/from-property"), config.getCacheDirectory());
    assertEquals(21, config.getDefaultMaxAgeDays());
  }

  @Test void testNonNumericValueIsRejected() {
    Map<String, Object> operand = new HashMap<>();
    operand.put("retry.maxDelayMs", "soon");

    assertThrows(ValidationException.class, () -> ResolverConfig.fromOperand(operand));
  }

  @Test void testResolveEnvVar() {
    assertNull(ConfigUtils.resolveEnvVar(null));
    assertEquals("plain", ConfigUtils.resolveEnvVar("plain"));
    assertEquals("a-fallback-b",
        ConfigUtils.resolveEnvVar("a-${REALESTATE_UNSET_VARIABLE:fallback}-b"));
    assertEquals("", ConfigUtils.resolveEnvVar("${REALESTATE_UNSET_VARIABLE}"));

    System.setProperty(PROPERTY, "x$y");
    assertEquals("x$y/x$y",
        ConfigUtils.resolveEnvVar("${" + PROPERTY + "}/${" + PROPERTY + "}"));
  }
}
