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

/**
 * A resolved payload together with its provenance.
 */
public final class ResolvedDataset {
  private final String datasetId;
  private final TierResult result;
  private final Provenance provenance;

  public ResolvedDataset(String datasetId, TierResult result, Provenance provenance) {
    this.datasetId = datasetId;
    this.result = result;
    this.provenance = provenance;
  }

  /** Canonical id of the dataset (legacy aliases already resolved). */
  public String getDatasetId() {
    return datasetId;
  }

  public TierResult getResult() {
    return result;
  }

  public Provenance getProvenance() {
    return provenance;
  }

  /** Shortcut for {@code getResult().asSingle().getTable()}. */
  public DataTable getTable() {
    return result.asSingle().getTable();
  }

  @Override public String toString() {
    return "ResolvedDataset{" + datasetId + ", " + result + ", " + provenance + "}";
  }
}
