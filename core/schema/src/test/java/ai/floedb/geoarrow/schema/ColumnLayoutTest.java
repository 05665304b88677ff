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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

class ColumnLayoutTest {

  private static LayerSchema schema() {
    Field fid = Field.notNullable("fid", new ArrowType.Int(64, true));
    Field a = Field.nullable("a", new ArrowType.Int(32, true));
    Field s =
        new Field(
            "s",
            FieldType.nullable(ArrowType.Struct.INSTANCE),
            List.of(
                Field.nullable("x", new ArrowType.Int(32, true)),
                Field.nullable("y", new ArrowType.Int(32, true))));
    Field geom =
        new Field(
            "geom",
            new FieldType(
                true,
                ArrowType.Binary.INSTANCE,
                null,
                Map.of(GeometryEncodingResolver.EXTENSION_NAME_KEY, "ogc.wkb")),
            null);
    Schema physical =
        new Schema(
            List.of(fid, a, s, geom), Map.of(SchemaOverlay.METADATA_KEY, "{\"fid\":\"fid\"}"));
    return LayerSchemaReader.read(physical, null, true);
  }

  @Test
  void fullLayoutKeepsPhysicalPositions() {
    ColumnLayout layout = ColumnLayout.full(schema());

    assertThat(layout.isFullProjection()).isTrue();
    assertThat(layout.projectedColumns()).containsExactly(0, 1, 2, 3);
    assertThat(layout.attributeArrayIndex(2)).isEqualTo(2);
    assertThat(layout.geometryArrayIndex(0)).isEqualTo(3);
    assertThat(layout.fidArrayIndex()).isZero();
  }

  @Test
  void ignoringDropsColumnsAndShiftsIndexes() {
    LayerSchema schema = schema();
    BitSet ignored = new BitSet();
    ignored.set(schema.attributeIndex("a"));

    ColumnLayout layout = ColumnLayout.of(schema, ignored, new BitSet());

    assertThat(layout.projectedColumns()).containsExactly(0, 2, 3);
    assertThat(layout.attributeArrayIndex(schema.attributeIndex("a"))).isEqualTo(-1);
    assertThat(layout.attributeArrayIndex(schema.attributeIndex("s.y"))).isEqualTo(1);
    assertThat(layout.geometryArrayIndex(0)).isEqualTo(2);
    assertThat(layout.isConsistent()).isTrue();
  }

  @Test
  void partiallyIgnoredStructIsInconsistent() {
    LayerSchema schema = schema();
    BitSet ignored = new BitSet();
    ignored.set(schema.attributeIndex("s.x"));

    ColumnLayout layout = ColumnLayout.of(schema, ignored, new BitSet());

    assertThat(layout.isConsistent()).isFalse();
    assertThat(layout.projectedColumns()).containsExactly(0, 1, 2, 3);
  }
}
