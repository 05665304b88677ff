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

package ai.floedb.geoarrow.layer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.geoarrow.geometry.GeoArrowVectors;
import ai.floedb.geoarrow.geometry.GeometryCodec;
import ai.floedb.geoarrow.schema.AttributeDefinition;
import ai.floedb.geoarrow.schema.AttributeType;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.LayerSchemaReader;
import ai.floedb.geoarrow.schema.SchemaOverlay;
import ai.floedb.geoarrow.schema.TimeZoneFlags;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.Float2Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeStampMilliTZVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Point;

class FeatureReaderTest {

  private BufferAllocator allocator;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator();
  }

  @AfterEach
  void tearDown() {
    allocator.close();
  }

  @Test
  void scalarValues() {
    try (BitVector bool = new BitVector("b", allocator);
        UInt8Vector unsigned = new UInt8Vector("u", allocator);
        Float2Vector half = new Float2Vector("h", allocator);
        DateDayVector date32 = new DateDayVector("d32", allocator);
        DateMilliVector date64 = new DateMilliVector("d64", allocator);
        TimeMilliVector time = new TimeMilliVector("t", allocator);
        DecimalVector decimal = new DecimalVector("dec", allocator, 4, 2)) {
      bool.allocateNew(1);
      bool.set(0, 1);
      bool.setValueCount(1);
      unsigned.allocateNew(1);
      unsigned.set(0, -1L);
      unsigned.setValueCount(1);
      half.allocateNew(1);
      half.set(0, (short) 0x3E00);
      half.setValueCount(1);
      date32.allocateNew(1);
      date32.set(0, 19000);
      date32.setValueCount(1);
      date64.allocateNew(1);
      date64.set(0, 86_400_000L);
      date64.setValueCount(1);
      time.allocateNew(1);
      time.set(0, 3_600_500);
      time.setValueCount(1);
      decimal.allocateNew(1);
      decimal.setSafe(0, new BigDecimal("12.50"));
      decimal.setValueCount(1);

      assertThat(FeatureReader.scalar(bool, 0)).isEqualTo(1);
      assertThat(FeatureReader.scalar(unsigned, 0)).isEqualTo(1.8446744073709552E19);
      assertThat(FeatureReader.scalar(half, 0)).isEqualTo(1.5);
      assertThat(FeatureReader.scalar(date32, 0)).isEqualTo(LocalDate.ofEpochDay(19000));
      assertThat(FeatureReader.scalar(date64, 0)).isEqualTo(LocalDate.of(1970, 1, 2));
      assertThat(FeatureReader.scalar(time, 0)).isEqualTo(LocalTime.of(1, 0, 0, 500_000_000));
      assertThat(FeatureReader.scalar(decimal, 0)).isEqualTo(12.5);
    }
  }

  @Test
  void timestampKeepsDeclaredOffset() {
    try (TimeStampMilliTZVector vector = new TimeStampMilliTZVector("ts", allocator, "+01:00")) {
      vector.allocateNew(1);
      vector.set(0, 0L);
      vector.setValueCount(1);
      int flag = TimeZoneFlags.fromTimezone("+01:00").getAsInt();
      AttributeDefinition attribute =
          AttributeDefinition.builder("ts", AttributeType.DATETIME).timeZoneFlag(flag).build();

      Object value = FeatureReader.value(vector, 0, attribute);

      assertThat(value)
          .isEqualTo(OffsetDateTime.of(1970, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1)));
    }
  }

  @Test
  void listNullsBecomeNaNOrEmptyString() {
    try (ListVector reals = ListVector.empty("r", allocator);
        ListVector strings = ListVector.empty("s", allocator)) {
      reals.addOrGetVector(
          FieldType.nullable(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)));
      reals.allocateNew();
      Float8Vector realItems = (Float8Vector) reals.getDataVector();
      reals.startNewValue(0);
      realItems.setSafe(0, 2.5);
      realItems.setNull(1);
      reals.endValue(0, 2);
      realItems.setValueCount(2);
      reals.setValueCount(1);

      strings.addOrGetVector(FieldType.nullable(ArrowType.Utf8.INSTANCE));
      strings.allocateNew();
      VarCharVector stringItems = (VarCharVector) strings.getDataVector();
      strings.startNewValue(0);
      stringItems.setNull(0);
      stringItems.setSafe(1, "x".getBytes());
      strings.endValue(0, 2);
      stringItems.setValueCount(2);
      strings.setValueCount(1);

      Object realList =
          FeatureReader.value(
              reals, 0, AttributeDefinition.builder("r", AttributeType.REAL_LIST).build());
      Object stringList =
          FeatureReader.value(
              strings, 0, AttributeDefinition.builder("s", AttributeType.STRING_LIST).build());

      assertThat((double[]) realList).containsExactly(2.5, Double.NaN);
      assertThat(stringList).isEqualTo(List.of("", "x"));
    }
  }

  @Test
  void structRendersAsJsonWithoutNullMembers() {
    try (StructVector struct = StructVector.empty("s", allocator)) {
      IntVector a =
          struct.addOrGet("a", FieldType.nullable(new ArrowType.Int(32, true)), IntVector.class);
      IntVector b =
          struct.addOrGet("b", FieldType.nullable(new ArrowType.Int(32, true)), IntVector.class);
      struct.allocateNew();
      a.setSafe(0, 1);
      b.setNull(0);
      struct.setIndexDefined(0);
      a.setValueCount(1);
      b.setValueCount(1);
      struct.setValueCount(1);

      assertThat(FeatureReader.toJson(struct, 0).toString()).isEqualTo("{\"a\":1}");
    }
  }

  @Test
  void readsFidAttributesAndGeometry() {
    BigIntVector id = new BigIntVector("id", allocator);
    id.allocateNew(2);
    id.set(0, 42);
    id.setNull(1);
    id.setValueCount(2);
    StructVector struct = StructVector.empty("s", allocator);
    IntVector a =
        struct.addOrGet("a", FieldType.nullable(new ArrowType.Int(32, true)), IntVector.class);
    struct.allocateNew();
    a.setSafe(0, 7);
    struct.setIndexDefined(0);
    struct.setNull(1);
    a.setValueCount(2);
    struct.setValueCount(2);
    VarCharVector name = TestBatches.strings(allocator, "name", "first", "second");

    try (VectorSchemaRoot batch =
        TestBatches.batch(
            id,
            struct,
            name,
            GeoArrowVectors.wkb(
                allocator, "geom", GeoArrowVectors.wkbOf("POINT (1 2)"), null))) {
      Schema physical =
          new Schema(
              batch.getSchema().getFields(),
              Map.of(SchemaOverlay.METADATA_KEY, "{\"fid\":\"id\"}"));
      LayerSchema schema = LayerSchemaReader.read(physical, null, true);
      FeatureReader reader =
          new FeatureReader(schema, ColumnLayout.full(schema), new GeometryCodec());

      Feature first = reader.read(batch, 0, 0);
      Feature second = reader.read(batch, 1, 1);

      assertThat(schema.attributes())
          .extracting(AttributeDefinition::name)
          .containsExactly("s.a", "name");
      assertThat(first.fid()).isEqualTo(42);
      assertThat(first.value(0)).isEqualTo(7);
      assertThat(first.value(1)).isEqualTo("first");
      Point point = (Point) first.geometry(0).geometry();
      assertThat(point.getX()).isEqualTo(1.0);
      assertThat(point.getY()).isEqualTo(2.0);

      assertThat(second.fid()).isEqualTo(Feature.NULL_FID);
      assertThat(second.isNull(0)).isTrue();
      assertThat(second.geometry(0)).isNull();
    }
  }

  @Test
  void ignoredAttributesStayNull() {
    try (VectorSchemaRoot batch =
        TestBatches.batch(
            TestBatches.ints(allocator, "n", 5), TestBatches.strings(allocator, "name", "x"))) {
      LayerSchema schema = LayerSchemaReader.read(batch.getSchema(), null, true);
      BitSet ignored = new BitSet();
      ignored.set(0);
      ColumnLayout layout = ColumnLayout.of(schema, ignored, new BitSet());
      VectorSchemaRoot projected =
          new VectorSchemaRoot(
              List.of(batch.getVector(1).getField()), List.of(batch.getVector(1)), 1);
      FeatureReader reader = new FeatureReader(schema, layout, new GeometryCodec());

      Feature feature = reader.read(projected, 0, 3);

      assertThat(feature.fid()).isEqualTo(3);
      assertThat(feature.isNull(0)).isTrue();
      assertThat(feature.value(1)).isEqualTo("x");
    }
  }
}
