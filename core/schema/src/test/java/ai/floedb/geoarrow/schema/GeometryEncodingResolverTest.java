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

import java.util.List;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.Test;

class GeometryEncodingResolverTest {

  private static final ArrowType DOUBLE =
      new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);

  private static Field point(int size, String valueName) {
    return new Field(
        "geom",
        FieldType.nullable(new ArrowType.FixedSizeList(size)),
        List.of(Field.notNullable(valueName, DOUBLE)));
  }

  private static Field listOf(Field child, int depth) {
    Field field = child;
    for (int i = 0; i < depth; i++) {
      field = new Field("geom", FieldType.nullable(new ArrowType.List()), List.of(field));
    }
    return field;
  }

  @Test
  void wellKnownEncodingsRequireMatchingPhysicalType() {
    assertThat(
            GeometryEncodingResolver.resolve(Field.nullable("g", ArrowType.Utf8.INSTANCE), "WKT")
                .encoding())
        .isEqualTo(GeometryEncoding.WKT);
    assertThat(
            GeometryEncodingResolver.resolve(
                    Field.nullable("g", ArrowType.LargeBinary.INSTANCE), "geoarrow.wkb")
                .encoding())
        .isEqualTo(GeometryEncoding.WKB);

    GeometryEncodingResolver.Resolution rejected =
        GeometryEncodingResolver.resolve(Field.nullable("g", ArrowType.Binary.INSTANCE), "ogc.wkt");
    assertThat(rejected.isAccepted()).isFalse();
    assertThat(rejected.diagnostic()).contains("g").contains("non String type");
  }

  @Test
  void pointDimensionalityFollowsSizeAndValueName() {
    assertThat(GeometryEncodingResolver.resolve(point(2, "xy"), "geoarrow.point").type())
        .isEqualTo(new GeometryType(GeometryKind.POINT, false, false));
    assertThat(GeometryEncodingResolver.resolve(point(3, "xyz"), "geoarrow.point").type())
        .isEqualTo(new GeometryType(GeometryKind.POINT, true, false));
    assertThat(GeometryEncodingResolver.resolve(point(3, "xym"), "geoarrow.point").type())
        .isEqualTo(new GeometryType(GeometryKind.POINT, false, true));
    assertThat(GeometryEncodingResolver.resolve(point(4, "xyzm"), "geoarrow.point").type())
        .isEqualTo(new GeometryType(GeometryKind.POINT, true, true));
    assertThat(GeometryEncodingResolver.resolve(point(5, "xyzmq"), "geoarrow.point").isAccepted())
        .isFalse();
  }

  @Test
  void listEncodingsRequireExactNesting() {
    Field xy = point(2, "xy");
    assertThat(
            GeometryEncodingResolver.resolve(listOf(xy, 1), "geoarrow.linestring").encoding())
        .isEqualTo(GeometryEncoding.LINESTRING);
    assertThat(GeometryEncodingResolver.resolve(listOf(xy, 2), "geoarrow.polygon").encoding())
        .isEqualTo(GeometryEncoding.POLYGON);
    assertThat(
            GeometryEncodingResolver.resolve(listOf(xy, 1), "geoarrow.multipoint").encoding())
        .isEqualTo(GeometryEncoding.MULTIPOINT);
    assertThat(
            GeometryEncodingResolver.resolve(listOf(xy, 2), "geoarrow.multilinestring")
                .encoding())
        .isEqualTo(GeometryEncoding.MULTILINESTRING);

    GeometryEncodingResolver.Resolution multipolygon =
        GeometryEncodingResolver.resolve(listOf(point(4, "xyzm"), 3), "geoarrow.multipolygon");
    assertThat(multipolygon.type())
        .isEqualTo(new GeometryType(GeometryKind.MULTIPOLYGON, true, true));

    assertThat(GeometryEncodingResolver.resolve(listOf(xy, 2), "geoarrow.linestring").isAccepted())
        .isFalse();
  }

  @Test
  void unknownEncodingIsRejected() {
    GeometryEncodingResolver.Resolution resolution =
        GeometryEncodingResolver.resolve(
            Field.nullable("g", ArrowType.Binary.INSTANCE), "geoarrow.box");

    assertThat(resolution.isAccepted()).isFalse();
    assertThat(resolution.diagnostic()).contains("unhandled encoding");
  }
}
