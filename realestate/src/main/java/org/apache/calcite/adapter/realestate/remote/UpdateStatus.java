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
package org.apache.calcite.adapter.realestate.remote;

/**
 * Outcome of refreshing one dataset from the remote store.
 */
public enum UpdateStatus {
  /** A newer asset was downloaded into the local cache. */
  UPDATED,
  /** The local copy is at least as new as the remote asset. */
  UP_TO_DATE,
  /** The store has no asset for the dataset. */
  UNKNOWN,
  /** Listing, download or decoding failed. */
  FAILED
}
