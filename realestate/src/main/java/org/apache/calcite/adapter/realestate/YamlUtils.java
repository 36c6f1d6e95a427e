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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the bundled YAML resources (dataset catalog, series catalog, resolver
 * defaults) into Jackson trees.
 *
 * <p>YAML goes through SnakeYAML so that anchors and aliases shared between
 * dataset entries are resolved, then through Jackson so that callers work with
 * a single tree API.
 */
public final class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlUtils() {
  }

  /**
   * Parses YAML or JSON, choosing the parser by the resource name's extension.
   *
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(200);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsed;
      try {
        parsed = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return JSON_MAPPER.valueToTree(parsed);
    }
    return JSON_MAPPER.readTree(stream);
  }

  /**
   * Loads a classpath resource.
   *
   * @throws IOException if the resource is missing or malformed
   */
  public static JsonNode loadResource(String resource) throws IOException {
    try (InputStream in = YamlUtils.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Resource not found on classpath: " + resource);
      }
      return parseYamlOrJson(in, resource);
    }
  }
}
