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
package org.apache.calcite.adapter.realestate.registry;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Discovery view of a dataset: what {@code listDatasets} hands out.
 */
public final class DatasetSummary {
  private final String id;
  private final String displayName;
  private final ImmutableList<String> tables;
  private final Visibility visibility;
  private final String description;
  private final String source;
  private final String geography;

  private DatasetSummary(DatasetDescriptor descriptor) {
    this.id = descriptor.getId();
    this.displayName = descriptor.getDisplayName();
    this.tables = ImmutableList.copyOf(descriptor.getTables());
    this.visibility = descriptor.getVisibility();
    this.description = descriptor.getDescription();
    this.source = descriptor.getSource();
    this.geography = descriptor.getGeography();
  }

  public static DatasetSummary of(DatasetDescriptor descriptor) {
    return new DatasetSummary(descriptor);
  }

  public String getId() {
    return id;
  }

  public String getDisplayName() {
    return displayName;
  }

  public List<String> getTables() {
    return tables;
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public String getDescription() {
    return description;
  }

  public String getSource() {
    return source;
  }

  public String getGeography() {
    return geography;
  }

  @Override public String toString() {
    return id + " (" + displayName + ")" + (tables.isEmpty() ? "" : " " + tables);
  }
}
