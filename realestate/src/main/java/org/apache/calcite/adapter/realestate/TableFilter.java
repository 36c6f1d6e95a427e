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

import java.util.Collections;

/**
 * Narrows a tier payload down to the requested table.
 *
 * <p>With no table key a {@link TierResult.Multiple} passes through unchanged and
 * a lone table stays {@link TierResult.Single}. With a key the output is always
 * the single matching table.
 */
public final class TableFilter {

  private TableFilter() {
  }

  /**
   * Whether {@code result} can satisfy a request for {@code tableKey}. A
   * request without a table key is satisfied by any shape.
   */
  public static boolean contains(TierResult result, @Nullable String tableKey) {
    if (tableKey == null) {
      return true;
    }
    return !result.isSingle() && result.asMultiple().contains(tableKey);
  }

  /**
   * Applies the filter.
   *
   * @throws IllegalArgumentException if the key is absent; callers check
   *     {@link #contains} first
   */
  public static TierResult apply(TierResult result, @Nullable String tableKey) {
    if (tableKey == null) {
      return result;
    }
    if (result.isSingle()) {
      throw new IllegalArgumentException("Payload has no table keys; cannot select '"
          + tableKey + "'");
    }
    return TierResult.single(result.asMultiple().get(tableKey));
  }

  /**
   * Keys a lone table under the requested table so that it can be stored and
   * merged with other tables of a multi-table dataset.
   */
  public static TierResult keyed(TierResult result, @Nullable String tableKey,
      boolean multiTable) {
    if (multiTable && tableKey != null && result.isSingle()) {
      return TierResult.multiple(
          Collections.singletonMap(tableKey, result.asSingle().getTable()));
    }
    return result;
  }
}
