/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.geoarrow.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/** Layer-level {@code geo} metadata describing geometry columns. */
public record GeoMetadata(String primaryColumn, Map<String, GeoColumn> columns) {

  public static final String METADATA_KEY = "geo";
  public static final GeoMetadata EMPTY = new GeoMetadata(null, Map.of());

  private static final Logger LOG = Logger.getLogger(GeoMetadata.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public GeoMetadata {
    columns = Map.copyOf(columns);
  }

  /**
   * One geometry column entry.
   *
   * @param geometryTypes type names such as {@code "Polygon"} or {@code "MultiLineString Z"}
   * @param bbox raw {@code bbox} numbers, possibly empty
   */
  public record GeoColumn(String encoding, List<String> geometryTypes, List<Double> bbox) {

    public GeoColumn {
      geometryTypes = List.copyOf(geometryTypes);
      bbox = List.copyOf(bbox);
    }

    public Optional<Extent> extent() {
      return Extent.fromBboxArray(bbox);
    }

    /** Merged declared type, or empty when no types are listed. */
    public Optional<GeometryType> declaredType() {
      GeometryType merged = null;
      for (String name : geometryTypes) {
        GeometryType type = parseTypeName(name);
        merged = merged == null ? type : merged.merge(type);
      }
      return Optional.ofNullable(merged);
    }
  }

  public Optional<GeoColumn> column(String name) {
    return Optional.ofNullable(columns.get(name));
  }

  static GeometryType parseTypeName(String name) {
    String trimmed = name.trim();
    boolean hasZ = false;
    boolean hasM = false;
    String upper = trimmed.toUpperCase(Locale.ROOT);
    if (upper.endsWith(" ZM")) {
      hasZ = true;
      hasM = true;
      trimmed = trimmed.substring(0, trimmed.length() - 3);
    } else if (upper.endsWith(" Z")) {
      hasZ = true;
      trimmed = trimmed.substring(0, trimmed.length() - 2);
    } else if (upper.endsWith(" M")) {
      hasM = true;
      trimmed = trimmed.substring(0, trimmed.length() - 2);
    }
    return new GeometryType(GeometryKind.fromName(trimmed.trim()), hasZ, hasM);
  }

  public static GeoMetadata fromMetadata(Map<String, String> metadata) {
    if (metadata == null) {
      return EMPTY;
    }
    String json = metadata.get(METADATA_KEY);
    if (json == null || json.isBlank()) {
      return EMPTY;
    }
    return parse(json);
  }

  public static GeoMetadata parse(String json) {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      LOG.warnf("Cannot parse %s metadata: %s", METADATA_KEY, e.getOriginalMessage());
      return EMPTY;
    }
    if (root == null || !root.isObject()) {
      return EMPTY;
    }
    Map<String, GeoColumn> columns = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.path("columns").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode column = entry.getValue();
      List<String> types = new ArrayList<>();
      for (JsonNode type : column.path("geometry_types")) {
        if (type.isTextual()) {
          types.add(type.asText());
        }
      }
      List<Double> bbox = new ArrayList<>();
      for (JsonNode value : column.path("bbox")) {
        if (value.isNumber()) {
          bbox.add(value.asDouble());
        }
      }
      columns.put(
          entry.getKey(), new GeoColumn(column.path("encoding").asText("WKB"), types, bbox));
    }
    String primary =
        root.path("primary_column").isTextual() ? root.path("primary_column").asText() : null;
    return new GeoMetadata(primary, columns);
  }
}
