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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.jboss.logging.Logger;

/** Builds a {@link LayerSchema} from an Arrow schema and its metadata. */
public final class LayerSchemaReader {

  private static final Logger LOG = Logger.getLogger(LayerSchemaReader.class);

  private LayerSchemaReader() {}

  /**
   * Maps every top-level column. Geometry columns are recognised from {@code
   * ARROW:extension:name} field metadata or the {@code geo} layer metadata; rejected geometry
   * columns are mapped as attributes.
   *
   * @param useSchemaOverlay whether the {@code gdal:schema} metadata is consulted
   */
  public static LayerSchema read(
      Schema schema, DictionaryProvider dictionaries, boolean useSchemaOverlay) {
    Map<String, String> metadata = schema.getCustomMetadata();
    SchemaOverlay overlay =
        useSchemaOverlay ? SchemaOverlay.fromMetadata(metadata) : SchemaOverlay.EMPTY;
    GeoMetadata geo = GeoMetadata.fromMetadata(metadata);
    ArrayTypeMapper mapper = new ArrayTypeMapper(overlay, dictionaries);

    LayerSchema.Builder builder = LayerSchema.builder(schema);
    builder.fidName(overlay.fidColumn());
    List<Field> fields = schema.getFields();
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      String name = field.getName();
      if (isFidColumn(overlay, field)) {
        builder.fid(name, i);
        continue;
      }
      Optional<GeoMetadata.GeoColumn> geoColumn = geo.column(name);
      Optional<String> tag =
          GeometryEncodingResolver.extensionName(field)
              .or(() -> geoColumn.map(GeoMetadata.GeoColumn::encoding));
      if (tag.isPresent()) {
        GeometryEncodingResolver.Resolution resolution =
            GeometryEncodingResolver.resolve(field, tag.get());
        if (resolution.isAccepted()) {
          GeometryType type = resolution.type();
          if (resolution.encoding().isWellKnown()) {
            type = geoColumn.flatMap(GeoMetadata.GeoColumn::declaredType).orElse(type);
          }
          Extent extent = geoColumn.flatMap(GeoMetadata.GeoColumn::extent).orElse(null);
          builder.addGeometry(
              new GeometryFieldDefinition(
                  name, resolution.encoding(), type, field.isNullable(), i),
              extent);
          continue;
        }
      }
      mapper.appendField(builder, field, ColumnPath.of(i));
    }
    LayerSchema layerSchema = builder.build();
    LOG.debugf(
        "Mapped %d columns to %d attributes and %d geometry fields",
        fields.size(), layerSchema.attributeCount(), layerSchema.geometryCount());
    return layerSchema;
  }

  private static boolean isFidColumn(SchemaOverlay overlay, Field field) {
    if (overlay.fidColumn() == null || !overlay.fidColumn().equals(field.getName())) {
      return false;
    }
    PhysicalType type = PhysicalType.of(field);
    return type == PhysicalType.INT32 || type == PhysicalType.INT64;
  }
}
