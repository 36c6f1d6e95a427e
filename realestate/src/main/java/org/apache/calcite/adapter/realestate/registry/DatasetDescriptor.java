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

import org.apache.calcite.adapter.realestate.validation.ValidationRules;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry describing one dataset: identity, table layout, visibility and
 * what it can be served from. Immutable once the registry is loaded.
 */
public final class DatasetDescriptor {
  private final String id;
  private final String displayName;
  private final ImmutableSet<String> tables;
  private final Visibility visibility;
  private final ImmutableSet<Capability> capabilities;
  private final ImmutableList<String> legacyAliases;
  private final String description;
  private final String source;
  private final String geography;
  private final String frequency;
  private final UpdateSchedule updateSchedule;
  private final @Nullable Integer warnAfterDays;
  private final ValidationRules validationRules;

  private DatasetDescriptor(Builder builder) {
    this.id = builder.id;
    this.displayName = builder.displayName != null ? builder.displayName : builder.id;
    this.tables = ImmutableSet.copyOf(builder.tables);
    this.visibility = builder.visibility;
    this.capabilities = ImmutableSet.copyOf(builder.capabilities);
    this.legacyAliases = ImmutableList.copyOf(builder.legacyAliases);
    this.description = builder.description;
    this.source = builder.source;
    this.geography = builder.geography;
    this.frequency = builder.frequency;
    this.updateSchedule = builder.updateSchedule;
    this.warnAfterDays = builder.warnAfterDays;
    this.validationRules = builder.validationRules;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String getId() {
    return id;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Table keys in declaration order; empty for a single implicit table. */
  public Set<String> getTables() {
    return tables;
  }

  public boolean isMultiTable() {
    return !tables.isEmpty();
  }

  public boolean hasTable(String table) {
    return tables.contains(table);
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public boolean isHidden() {
    return visibility == Visibility.HIDDEN;
  }

  public Set<Capability> getCapabilities() {
    return capabilities;
  }

  public boolean isLiveFetchable() {
    return capabilities.contains(Capability.LIVE_FETCHABLE);
  }

  public boolean isCacheOnly() {
    return capabilities.contains(Capability.CACHE_ONLY);
  }

  public List<String> getLegacyAliases() {
    return legacyAliases;
  }

  public String getDescription() {
    return description;
  }

  /** Publishing institution. */
  public String getSource() {
    return source;
  }

  public String getGeography() {
    return geography;
  }

  public String getFrequency() {
    return frequency;
  }

  public UpdateSchedule getUpdateSchedule() {
    return updateSchedule;
  }

  /** Explicit freshness limit for cached copies, overriding the schedule. */
  public @Nullable Integer getWarnAfterDays() {
    return warnAfterDays;
  }

  public ValidationRules getValidationRules() {
    return validationRules;
  }

  @Override public boolean equals(Object o) {
    return o instanceof DatasetDescriptor && id.equals(((DatasetDescriptor) o).id);
  }

  @Override public int hashCode() {
    return id.hashCode();
  }

  @Override public String toString() {
    return "DatasetDescriptor{" + id + ", tables=" + tables + ", " + visibility
        + ", " + capabilities + "}";
  }

  /** Builder for {@link DatasetDescriptor}. */
  public static final class Builder {
    private final String id;
    private @Nullable String displayName;
    private final Set<String> tables = new LinkedHashSet<>();
    private Visibility visibility = Visibility.PUBLIC;
    private final Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
    private final Set<String> legacyAliases = new LinkedHashSet<>();
    private String description = "";
    private String source = "";
    private String geography = "";
    private String frequency = "";
    private UpdateSchedule updateSchedule = UpdateSchedule.WEEKLY;
    private @Nullable Integer warnAfterDays;
    private ValidationRules validationRules = ValidationRules.DEFAULTS;

    private Builder(String id) {
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException("dataset id cannot be null or empty");
      }
      this.id = id;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder tables(Collection<String> tables) {
      this.tables.addAll(tables);
      return this;
    }

    public Builder tables(String... tables) {
      return tables(Arrays.asList(tables));
    }

    public Builder visibility(Visibility visibility) {
      this.visibility = Objects.requireNonNull(visibility, "visibility");
      return this;
    }

    public Builder capability(Capability capability) {
      this.capabilities.add(capability);
      return this;
    }

    public Builder legacyAliases(Collection<String> aliases) {
      this.legacyAliases.addAll(aliases);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder geography(String geography) {
      this.geography = geography;
      return this;
    }

    public Builder frequency(String frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder updateSchedule(UpdateSchedule updateSchedule) {
      this.updateSchedule = updateSchedule;
      return this;
    }

    public Builder warnAfterDays(@Nullable Integer warnAfterDays) {
      this.warnAfterDays = warnAfterDays;
      return this;
    }

    public Builder validationRules(ValidationRules validationRules) {
      this.validationRules = validationRules;
      return this;
    }

    public DatasetDescriptor build() {
      if (capabilities.contains(Capability.CACHE_ONLY)
          && capabilities.contains(Capability.LIVE_FETCHABLE)) {
        throw new IllegalArgumentException("Dataset '" + id
            + "' cannot be both cache-only and live-fetchable");
      }
      return new DatasetDescriptor(this);
    }
  }
}
