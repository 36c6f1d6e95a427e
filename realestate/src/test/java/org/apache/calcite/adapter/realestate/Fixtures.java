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

import org.apache.calcite.adapter.realestate.registry.DatasetRegistry;
import org.apache.calcite.adapter.realestate.registry.DatasetRegistryLoader;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Shared test data.
 */
public final class Fixtures {
  /** "Now" for every test that uses a fixed clock. */
  public static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  public static final String TEST_DATASETS = "/realestate/test-datasets.yaml";

  private Fixtures() {
  }

  /** Monthly {@code date, value} table starting January 2023. */
  public static DataTable table(int rows) {
    DataTable.Builder builder = DataTable.builder("date", "value");
    for (int i = 0; i < rows; i++) {
      builder.row(LocalDate.of(2023, 1, 1).plusMonths(i), 100.0 + i);
    }
    return builder.build();
  }

  public static DatasetRegistry registry() {
    return DatasetRegistryLoader.load(TEST_DATASETS, 90);
  }
}
