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

import org.apache.calcite.adapter.realestate.DatasetException;
import org.apache.calcite.adapter.realestate.YamlUtils;
import org.apache.calcite.adapter.realestate.validation.ValidationRules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link DatasetRegistry} from a YAML catalog.
 *
 * <p>Catalog layout:
 * <pre>
 * datasets:
 *   abecip:
 *     displayName: ABECIP Housing Credit Indicators
 *     tables: [sbpe, units, cgi]
 *     visibility: public
 *     capabilities: [live_fetchable]
 *     legacyAliases: [abecip_indicators]
 *     updateSchedule: monthly
 *     warnAfterDays: 45
 *     validation:
 *       requiredColumns: [date]
 * </pre>
 */
public final class DatasetRegistryLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistryLoader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_RESOURCE = "/realestate/datasets.yaml";

  private DatasetRegistryLoader() {
  }

  /** Loads the bundled catalog. */
  public static DatasetRegistry load(int maxFutureDays) {
    return load(DEFAULT_RESOURCE, maxFutureDays);
  }

  /**
   * Loads a catalog from the classpath.
   *
   * @throws DatasetException if the resource is missing or malformed
   */
  public static DatasetRegistry load(String resource, int maxFutureDays) {
    JsonNode root;
    try {
      root = YamlUtils.loadResource(resource);
    } catch (IOException e) {
      throw new DatasetException("Failed to load dataset registry " + resource, e);
    }
    DatasetRegistry registry = fromTree(root, maxFutureDays);
    LOGGER.debug("Loaded dataset registry from {}", resource);
    return registry;
  }

  /** Builds a registry from an already parsed catalog. */
  public static DatasetRegistry fromTree(JsonNode root, int maxFutureDays) {
    JsonNode datasets = root.path("datasets");
    if (!datasets.isObject()) {
      throw new DatasetException("Dataset registry has no 'datasets' section");
    }
    List<DatasetDescriptor> descriptors = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = datasets.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      try {
        descriptors.add(toDescriptor(field.getKey(), field.getValue(), maxFutureDays));
      } catch (IllegalArgumentException e) {
        throw new DatasetException("Invalid registry entry '" + field.getKey() + "': "
            + e.getMessage(), e);
      }
    }
    try {
      return new DatasetRegistry(descriptors);
    } catch (IllegalArgumentException e) {
      throw new DatasetException("Invalid dataset registry: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static DatasetDescriptor toDescriptor(String id, JsonNode node, int maxFutureDays) {
    DatasetDescriptor.Builder builder = DatasetDescriptor.builder(id)
        .displayName(node.path("displayName").asText(id))
        .tables(strings(node.path("tables")))
        .legacyAliases(strings(node.path("legacyAliases")))
        .description(node.path("description").asText(""))
        .source(node.path("source").asText(""))
        .geography(node.path("geography").asText(""))
        .frequency(node.path("frequency").asText(""));
    if (node.hasNonNull("visibility")) {
      builder.visibility(
          Visibility.valueOf(node.get("visibility").asText().toUpperCase(Locale.ROOT)));
    }
    for (String capability : strings(node.path("capabilities"))) {
      builder.capability(Capability.valueOf(capability.toUpperCase(Locale.ROOT)));
    }
    if (node.hasNonNull("updateSchedule")) {
      builder.updateSchedule(UpdateSchedule.fromValue(node.get("updateSchedule").asText()));
    }
    if (node.hasNonNull("warnAfterDays")) {
      builder.warnAfterDays(node.get("warnAfterDays").asInt());
    }
    Map<String, Object> validation = node.has("validation")
        ? MAPPER.convertValue(node.get("validation"), Map.class)
        : null;
    builder.validationRules(ValidationRules.fromMap(validation, maxFutureDays));
    return builder.build();
  }

  private static List<String> strings(JsonNode node) {
    List<String> values = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode element : node) {
        values.add(element.asText());
      }
    }
    return values;
  }
}
