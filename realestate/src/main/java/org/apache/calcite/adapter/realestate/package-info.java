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

/**
 * Resolution of Brazilian real estate datasets.
 *
 * <p>{@link org.apache.calcite.adapter.realestate.DatasetResolver} answers a
 * request for a dataset, and optionally one of its tables, from three tiers:
 * <ul>
 *   <li>the local cache directory
 *       ({@link org.apache.calcite.adapter.realestate.cache})</li>
 *   <li>assets published on a GitHub release
 *       ({@link org.apache.calcite.adapter.realestate.remote})</li>
 *   <li>the original publisher, for the datasets that have a live fetcher
 *       ({@link org.apache.calcite.adapter.realestate.live})</li>
 * </ul>
 *
 * <p>Typical use:
 * <pre>
 * DatasetResolver resolver = DatasetResolver.create();
 * ResolvedDataset sbpe = resolver.resolve("abecip", "sbpe");
 * DataTable table = sbpe.getTable();
 * Tier from = sbpe.getProvenance().getSource();
 * </pre>
 *
 * <p>The catalog lives in {@code realestate/datasets.yaml} and the resolver
 * defaults in {@code realestate/realestate.yaml}; both are read from the
 * classpath.
 */
package org.apache.calcite.adapter.realestate;
