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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

class ArrayTypeMapperTest {

  private static final Schema EMPTY = new Schema(List.of());

  private static LayerSchema map(Field field) {
    return map(field, SchemaOverlay.EMPTY);
  }

  private static LayerSchema map(Field field, SchemaOverlay overlay) {
    LayerSchema.Builder builder = LayerSchema.builder(EMPTY);
    new ArrayTypeMapper(overlay, null).appendField(builder, field, ColumnPath.of(0));
    return builder.build();
  }

  private static AttributeDefinition single(ArrowType type) {
    LayerSchema schema = map(Field.nullable("f", type));
    assertThat(schema.attributeCount()).isEqualTo(1);
    return schema.attribute(0);
  }

  @Test
  void mapsScalarTypesPerTable() {
    assertThat(single(ArrowType.Bool.INSTANCE))
        .extracting(AttributeDefinition::type, AttributeDefinition::subType)
        .containsExactly(AttributeType.INTEGER, AttributeSubType.BOOLEAN);
    assertThat(single(new ArrowType.Int(8, false)).type()).isEqualTo(AttributeType.INTEGER);
    assertThat(single(new ArrowType.Int(8, true)).type()).isEqualTo(AttributeType.INTEGER);
    assertThat(single(new ArrowType.Int(16, false)).type()).isEqualTo(AttributeType.INTEGER);
    assertThat(single(new ArrowType.Int(16, true)))
        .extracting(AttributeDefinition::type, AttributeDefinition::subType)
        .containsExactly(AttributeType.INTEGER, AttributeSubType.INT16);
    assertThat(single(new ArrowType.Int(32, false)).type()).isEqualTo(AttributeType.INTEGER64);
    assertThat(single(new ArrowType.Int(32, true)).type()).isEqualTo(AttributeType.INTEGER);
    assertThat(single(new ArrowType.Int(64, false)).type()).isEqualTo(AttributeType.REAL);
    assertThat(single(new ArrowType.Int(64, true)).type()).isEqualTo(AttributeType.INTEGER64);
    assertThat(single(new ArrowType.FloatingPoint(FloatingPointPrecision.HALF)))
        .extracting(AttributeDefinition::type, AttributeDefinition::subType)
        .containsExactly(AttributeType.REAL, AttributeSubType.FLOAT32);
    assertThat(single(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)).subType())
        .isEqualTo(AttributeSubType.FLOAT32);
    assertThat(single(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)))
        .extracting(AttributeDefinition::type, AttributeDefinition::subType)
        .containsExactly(AttributeType.REAL, AttributeSubType.NONE);
    assertThat(single(ArrowType.Utf8.INSTANCE).type()).isEqualTo(AttributeType.STRING);
    assertThat(single(ArrowType.LargeUtf8.INSTANCE).type()).isEqualTo(AttributeType.STRING);
    assertThat(single(ArrowType.Binary.INSTANCE).type()).isEqualTo(AttributeType.BINARY);
    assertThat(single(ArrowType.LargeBinary.INSTANCE).type()).isEqualTo(AttributeType.BINARY);
    assertThat(single(new ArrowType.FixedSizeBinary(16)))
        .extracting(AttributeDefinition::type, AttributeDefinition::width)
        .containsExactly(AttributeType.BINARY, 16);
    assertThat(single(new ArrowType.Date(DateUnit.DAY)).type()).isEqualTo(AttributeType.DATE);
    assertThat(single(new ArrowType.Date(DateUnit.MILLISECOND)).type())
        .isEqualTo(AttributeType.DATE);
    assertThat(single(new ArrowType.Time(TimeUnit.MILLISECOND, 32)).type())
        .isEqualTo(AttributeType.TIME);
    assertThat(single(new ArrowType.Time(TimeUnit.MICROSECOND, 64)).type())
        .isEqualTo(AttributeType.INTEGER64);
    assertThat(single(new ArrowType.Decimal(12, 3, 128)))
        .extracting(
            AttributeDefinition::type, AttributeDefinition::width, AttributeDefinition::precision)
        .containsExactly(AttributeType.REAL, 12, 3);
    assertThat(single(new ArrowType.Decimal(40, 5, 256)).width()).isEqualTo(40);
  }

  @Test
  void mappingIsDeterministic() {
    Field field = Field.nullable("f", new ArrowType.Timestamp(TimeUnit.MICROSECOND, "+01:00"));
    assertThat(map(field).attribute(0)).isEqualTo(map(field).attribute(0));
  }

  @Test
  void timestampTimezoneBecomesFlag() {
    assertThat(single(new ArrowType.Timestamp(TimeUnit.SECOND, null)).timeZoneFlag())
        .isEqualTo(TimeZoneFlags.UNKNOWN);
    assertThat(single(new ArrowType.Timestamp(TimeUnit.SECOND, "UTC")).timeZoneFlag())
        .isEqualTo(TimeZoneFlags.UTC);
    assertThat(single(new ArrowType.Timestamp(TimeUnit.SECOND, "+02:00")).timeZoneFlag())
        .isEqualTo(108);
    assertThat(single(new ArrowType.Timestamp(TimeUnit.SECOND, "Mars/Olympus")).timeZoneFlag())
        .isEqualTo(TimeZoneFlags.UTC);
  }

  @Test
  void mapsListsByElementType() {
    assertThat(listOf(new ArrowType.Int(32, true)).type()).isEqualTo(AttributeType.INTEGER_LIST);
    assertThat(listOf(ArrowType.Bool.INSTANCE).subType()).isEqualTo(AttributeSubType.BOOLEAN);
    assertThat(listOf(new ArrowType.Int(32, false)).type())
        .isEqualTo(AttributeType.INTEGER64_LIST);
    assertThat(listOf(new ArrowType.Int(64, false)).type()).isEqualTo(AttributeType.REAL_LIST);
    assertThat(listOf(new ArrowType.Decimal(10, 2, 128)).type())
        .isEqualTo(AttributeType.REAL_LIST);
    assertThat(listOf(ArrowType.Utf8.INSTANCE).type()).isEqualTo(AttributeType.STRING_LIST);
  }

  @Test
  void listOfStructCollapsesToJson() {
    Field struct =
        new Field(
            "item",
            FieldType.nullable(ArrowType.Struct.INSTANCE),
            List.of(Field.nullable("a", new ArrowType.Int(32, true))));
    Field list = new Field("l", FieldType.nullable(new ArrowType.List()), List.of(struct));

    AttributeDefinition attribute = map(list).attribute(0);

    assertThat(attribute.type()).isEqualTo(AttributeType.STRING);
    assertThat(attribute.subType()).isEqualTo(AttributeSubType.JSON);
  }

  @Test
  void listOfBinaryIsRejected() {
    Field list =
        new Field(
            "l",
            FieldType.nullable(new ArrowType.List()),
            List.of(Field.nullable("item", ArrowType.Binary.INSTANCE)));

    assertThat(map(list).attributeCount()).isZero();
  }

  @Test
  void mapsWithStringKeysBecomeJson() {
    assertThat(map(mapField(ArrowType.Utf8.INSTANCE)).attribute(0).subType())
        .isEqualTo(AttributeSubType.JSON);
    assertThat(map(mapField(new ArrowType.Int(32, true))).attributeCount()).isZero();
  }

  @Test
  void unsupportedTypesAreDropped() {
    assertThat(map(Field.nullable("d", new ArrowType.Duration(TimeUnit.SECOND))).attributeCount())
        .isZero();
    Field largeList =
        new Field(
            "l",
            FieldType.nullable(ArrowType.LargeList.INSTANCE),
            List.of(Field.nullable("item", new ArrowType.Int(32, true))));
    assertThat(map(largeList).attributeCount()).isZero();
  }

  @Test
  void flattensStructsAndRecordsBboxColumns() {
    ArrowType dbl = new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    Field bbox =
        new Field(
            "bbox",
            FieldType.nullable(ArrowType.Struct.INSTANCE),
            List.of(
                Field.nullable("minx", dbl),
                Field.nullable("miny", dbl),
                Field.nullable("maxx", dbl),
                Field.nullable("maxy", dbl)));

    LayerSchema schema = map(bbox);

    assertThat(schema.attributes())
        .extracting(AttributeDefinition::name)
        .containsExactly("bbox.minx", "bbox.miny", "bbox.maxx", "bbox.maxy");
    assertThat(schema.attributePath(2).indices()).containsExactly(0, 2);
    assertThat(schema.bboxColumns()).isEqualTo(new BboxColumns(0, 1, 2, 3));
  }

  @Test
  void overlayFillsSubtypeWidthAndNamesButNeverType() {
    SchemaOverlay overlay =
        new SchemaOverlay(
            null,
            Map.of(
                "flag",
                new SchemaOverlay.ColumnOverride("integer", "boolean", 1, 0, "Flag", "a flag"),
                "name",
                new SchemaOverlay.ColumnOverride("Real", "", 40, 0, "", "")));

    AttributeDefinition flag = map(Field.nullable("flag", new ArrowType.Int(32, true)), overlay)
        .attribute(0);
    AttributeDefinition name = map(Field.nullable("name", ArrowType.Utf8.INSTANCE), overlay)
        .attribute(0);

    assertThat(flag.subType()).isEqualTo(AttributeSubType.BOOLEAN);
    assertThat(flag.width()).isEqualTo(1);
    assertThat(flag.alternativeName()).isEqualTo("Flag");
    assertThat(flag.comment()).isEqualTo("a flag");
    assertThat(name.type()).isEqualTo(AttributeType.STRING);
    assertThat(name.width()).isEqualTo(40);
  }

  @Test
  void inferredSubtypeWinsOverOverlay() {
    SchemaOverlay overlay =
        new SchemaOverlay(
            null,
            Map.of("s", new SchemaOverlay.ColumnOverride("Integer", "Boolean", 0, 0, "", "")));

    AttributeDefinition attribute =
        map(Field.nullable("s", new ArrowType.Int(16, true)), overlay).attribute(0);

    assertThat(attribute.subType()).isEqualTo(AttributeSubType.INT16);
  }

  @Test
  void textDictionaryBecomesIndexWithDomain() {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VarCharVector values = new VarCharVector("dict", allocator)) {
      values.allocateNew();
      values.setSafe(0, "road".getBytes(StandardCharsets.UTF_8));
      values.setNull(1);
      values.setSafe(2, "river".getBytes(StandardCharsets.UTF_8));
      values.setValueCount(3);
      DictionaryEncoding encoding = new DictionaryEncoding(7L, false, new ArrowType.Int(32, true));
      DictionaryProvider.MapDictionaryProvider provider =
          new DictionaryProvider.MapDictionaryProvider();
      provider.put(new Dictionary(values, encoding));
      Field field =
          new Field("kind", new FieldType(true, new ArrowType.Int(32, true), encoding), null);

      LayerSchema.Builder builder = LayerSchema.builder(EMPTY);
      new ArrayTypeMapper(SchemaOverlay.EMPTY, provider)
          .appendField(builder, field, ColumnPath.of(0));
      LayerSchema schema = builder.build();

      assertThat(schema.attribute(0).type()).isEqualTo(AttributeType.INTEGER);
      assertThat(schema.attribute(0).domainName()).isEqualTo("kindDomain");
      CodedValueDomain domain = schema.domains().get("kindDomain");
      assertThat(domain.codeType()).isEqualTo(AttributeType.INTEGER);
      assertThat(domain.values())
          .containsExactlyInAnyOrderEntriesOf(Map.of(0L, "road", 2L, "river"));
    }
  }

  @Test
  void nonTextDictionaryIsRejected() {
    DictionaryEncoding encoding = new DictionaryEncoding(1L, false, new ArrowType.Int(8, true));
    Field field =
        new Field(
            "codes",
            new FieldType(
                true, new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE), encoding),
            null);

    assertThat(map(field).attributeCount()).isZero();
  }

  private static AttributeDefinition listOf(ArrowType elementType) {
    Field list =
        new Field(
            "l",
            FieldType.nullable(new ArrowType.List()),
            List.of(Field.nullable("item", elementType)));
    return map(list).attribute(0);
  }

  private static Field mapField(ArrowType keyType) {
    Field entries =
        new Field(
            "entries",
            FieldType.notNullable(ArrowType.Struct.INSTANCE),
            List.of(
                Field.notNullable("key", keyType),
                Field.nullable("value", new ArrowType.Int(32, true))));
    return new Field("m", FieldType.nullable(new ArrowType.Map(false)), List.of(entries));
  }
}
