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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Externally supplied attribute hints, stored as JSON under the {@code gdal:schema} schema
 * metadata key.
 *
 * <pre>{@code
 * {"fid": "fid", "columns": {"name": {"type": "String", "width": 32, "comment": "..."}}}
 * }</pre>
 */
public record SchemaOverlay(String fidColumn, Map<String, ColumnOverride> columns) {

  public static final String METADATA_KEY = "gdal:schema";
  public static final SchemaOverlay EMPTY = new SchemaOverlay(null, Map.of());

  private static final Logger LOG = Logger.getLogger(SchemaOverlay.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public SchemaOverlay {
    columns = Map.copyOf(columns);
  }

  /** Overlay entry for one column; {@code width}/{@code precision} are {@code 0} when unset. */
  public record ColumnOverride(
      String type,
      String subType,
      int width,
      int precision,
      String alternativeName,
      String comment) {}

  public Optional<ColumnOverride> column(String name) {
    return Optional.ofNullable(columns.get(name));
  }

  /** Reads the overlay from schema metadata, or {@link #EMPTY} when absent or malformed. */
  public static SchemaOverlay fromMetadata(Map<String, String> metadata) {
    if (metadata == null) {
      return EMPTY;
    }
    String json = metadata.get(METADATA_KEY);
    if (json == null || json.isBlank()) {
      return EMPTY;
    }
    return parse(json);
  }

  public static SchemaOverlay parse(String json) {
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
    String fid = root.path("fid").isTextual() ? root.path("fid").asText() : null;
    Map<String, ColumnOverride> columns = new LinkedHashMap<>();
    JsonNode columnsNode = root.path("columns");
    Iterator<Map.Entry<String, JsonNode>> it = columnsNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode column = entry.getValue();
      columns.put(
          entry.getKey(),
          new ColumnOverride(
              column.path("type").asText(""),
              column.path("subtype").asText(""),
              column.path("width").asInt(0),
              column.path("precision").asInt(0),
              column.path("alternative_name").asText(""),
              column.path("comment").asText("")));
    }
    return new SchemaOverlay(fid, columns);
  }
}
