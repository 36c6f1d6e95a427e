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

import org.apache.calcite.adapter.realestate.retry.Deadline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A versioned store of cache assets.
 *
 * <p>Implementations throw {@link IOException} for transport failures, which
 * callers treat as retryable, and
 * {@link org.apache.calcite.adapter.realestate.NetworkException} when they
 * can classify the failure themselves.
 */
public interface RemoteStore {

  /** Assets of release {@code tag} of {@code repository}. */
  List<RemoteAsset> listAssets(String repository, String tag, Deadline deadline)
      throws IOException;

  /** Downloads an asset's bytes into {@code target}, replacing it. */
  void download(RemoteAsset asset, Path target, Deadline deadline) throws IOException;
}
