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

import ai.floedb.geoarrow.geometry.GeometryCodec;
import ai.floedb.geoarrow.geometry.GeometryValue;
import ai.floedb.geoarrow.schema.AttributeDefinition;
import ai.floedb.geoarrow.schema.AttributeSubType;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.ColumnPath;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.PhysicalType;
import ai.floedb.geoarrow.schema.TimeZoneFlags;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float2Vector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.LargeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.MapVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.pojo.ArrowType;

/** Materializes batch rows as {@link Feature}s under a column layout. */
final class FeatureReader {

  private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

  private final LayerSchema schema;
  private final ColumnLayout layout;
  private final GeometryCodec codec;

  FeatureReader(LayerSchema schema, ColumnLayout layout, GeometryCodec codec) {
    this.schema = schema;
    this.layout = layout;
    this.codec = codec;
  }

  /**
   * Reads {@code row}.
   *
   * @param featureIndex sequential position of the row in the layer, used as identifier when the
   *     layer has no identifier column
   */
  Feature read(VectorSchemaRoot batch, int row, long featureIndex) {
    long fid = featureIndex;
    if (layout.fidArrayIndex() >= 0) {
      FieldVector fidVector = batch.getVector(layout.fidArrayIndex());
      fid =
          fidVector.isNull(row)
              ? Feature.NULL_FID
              : ((BaseIntVector) fidVector).getValueAsLong(row);
    }

    Object[] values = new Object[schema.attributeCount()];
    for (int i = 0; i < values.length; i++) {
      int arrayIndex = layout.attributeArrayIndex(i);
      if (arrayIndex < 0) {
        continue;
      }
      ColumnPath path = schema.attributePath(i);
      FieldVector column = batch.getVector(arrayIndex);
      if (!StructPaths.isNull(column, path, row)) {
        values[i] = value(StructPaths.leaf(column, path), row, schema.attribute(i));
      }
    }

    GeometryValue[] geometries = new GeometryValue[schema.geometryCount()];
    for (int i = 0; i < geometries.length; i++) {
      int arrayIndex = layout.geometryArrayIndex(i);
      if (arrayIndex >= 0) {
        geometries[i] = codec.decode(batch.getVector(arrayIndex), schema.geometryField(i), row);
      }
    }
    return new Feature(fid, values, geometries);
  }

  /** Value of a non-null leaf row. */
  static Object value(FieldVector vector, int row, AttributeDefinition attribute) {
    PhysicalType type = PhysicalType.of(vector.getField().getType());
    return switch (type) {
      case LIST, FIXED_SIZE_LIST -> list(vector, row, attribute);
      case MAP -> toJson(vector, row).toString();
      case TIMESTAMP -> timestamp((TimeStampVector) vector, row, attribute.timeZoneFlag());
      default -> scalar(vector, row);
    };
  }

  /** Scalar value, or {@code null} for a type without a scalar mapping. */
  static Object scalar(FieldVector vector, int row) {
    return switch (PhysicalType.of(vector.getField().getType())) {
      case BOOL -> Integer.valueOf(((BitVector) vector).get(row));
      case INT8, UINT8, INT16, UINT16, INT32 ->
          Integer.valueOf((int) ((BaseIntVector) vector).getValueAsLong(row));
      case UINT32, INT64 -> Long.valueOf(((BaseIntVector) vector).getValueAsLong(row));
      // Values above 2^53 lose precision.
      case UINT64 ->
          Double.valueOf(((UInt8Vector) vector).getObjectNoOverflow(row).doubleValue());
      case HALF_FLOAT -> Double.valueOf(((Float2Vector) vector).getValueAsDouble(row));
      case FLOAT -> Double.valueOf(((Float4Vector) vector).get(row));
      case DOUBLE -> Double.valueOf(((Float8Vector) vector).get(row));
      case STRING, LARGE_STRING -> vector.getObject(row).toString();
      case BINARY, LARGE_BINARY, FIXED_SIZE_BINARY -> vector.getObject(row);
      case DATE32 -> LocalDate.ofEpochDay(((DateDayVector) vector).get(row));
      case DATE64 ->
          LocalDate.ofInstant(
              Instant.ofEpochMilli(((DateMilliVector) vector).get(row)), ZoneOffset.UTC);
      case TIME32 -> {
        if (vector instanceof TimeSecVector seconds) {
          yield LocalTime.ofSecondOfDay(seconds.get(row));
        }
        yield LocalTime.ofNanoOfDay(((TimeMilliVector) vector).get(row) * 1_000_000L);
      }
      case TIME64 -> {
        if (vector instanceof TimeMicroVector micros) {
          yield Long.valueOf(micros.get(row));
        }
        yield Long.valueOf(((TimeNanoVector) vector).get(row));
      }
      case TIMESTAMP -> timestamp((TimeStampVector) vector, row, TimeZoneFlags.UNKNOWN);
      case DECIMAL128 -> decimal(((DecimalVector) vector).getObject(row));
      case DECIMAL256 -> decimal(((Decimal256Vector) vector).getObject(row));
      case NULL, LIST, LARGE_LIST, FIXED_SIZE_LIST, STRUCT, MAP, DICTIONARY, EXTENSION,
          UNSUPPORTED ->
          null;
    };
  }

  private static Double decimal(BigDecimal value) {
    // Parsed back from text, like the constraint evaluator, so both see the same double.
    return Double.valueOf(Double.parseDouble(value.toString()));
  }

  static Object timestamp(TimeStampVector vector, int row, int timeZoneFlag) {
    long raw = vector.get(row);
    ArrowType.Timestamp type = (ArrowType.Timestamp) vector.getField().getType();
    Instant instant =
        switch (type.getUnit()) {
          case SECOND -> Instant.ofEpochSecond(raw);
          case MILLISECOND -> Instant.ofEpochMilli(raw);
          case MICROSECOND ->
              Instant.ofEpochSecond(
                  Math.floorDiv(raw, 1_000_000L), Math.floorMod(raw, 1_000_000L) * 1_000L);
          case NANOSECOND ->
              Instant.ofEpochSecond(
                  Math.floorDiv(raw, 1_000_000_000L), Math.floorMod(raw, 1_000_000_000L));
        };
    if (TimeZoneFlags.hasOffset(timeZoneFlag)) {
      return OffsetDateTime.ofInstant(instant, TimeZoneFlags.toOffset(timeZoneFlag));
    }
    return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  private static Object list(FieldVector vector, int row, AttributeDefinition attribute) {
    if (attribute.subType() == AttributeSubType.JSON) {
      return toJson(vector, row).toString();
    }
    FieldVector elements;
    int start;
    int end;
    if (vector instanceof FixedSizeListVector fixed) {
      elements = fixed.getDataVector();
      start = row * fixed.getListSize();
      end = start + fixed.getListSize();
    } else {
      ListVector list = (ListVector) vector;
      elements = list.getDataVector();
      start = list.getElementStartIndex(row);
      end = list.getElementEndIndex(row);
    }

    int count = end - start;
    switch (attribute.type()) {
      case INTEGER_LIST -> {
        int[] result = new int[count];
        for (int i = 0; i < count; i++) {
          Object element = elements.isNull(start + i) ? null : scalar(elements, start + i);
          result[i] = element == null ? 0 : ((Number) element).intValue();
        }
        return result;
      }
      case INTEGER64_LIST -> {
        long[] result = new long[count];
        for (int i = 0; i < count; i++) {
          Object element = elements.isNull(start + i) ? null : scalar(elements, start + i);
          result[i] = element == null ? 0 : ((Number) element).longValue();
        }
        return result;
      }
      case REAL_LIST -> {
        double[] result = new double[count];
        for (int i = 0; i < count; i++) {
          Object element = elements.isNull(start + i) ? null : scalar(elements, start + i);
          result[i] = element == null ? Double.NaN : ((Number) element).doubleValue();
        }
        return result;
      }
      case STRING_LIST -> {
        List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          result.add(elements.isNull(start + i) ? "" : scalar(elements, start + i).toString());
        }
        return result;
      }
      default ->
          throw new IllegalStateException(
              "List column " + attribute.name() + " mapped to " + attribute.type());
    }
  }

  /** JSON rendering of a nested value. Struct members that are null are left out. */
  static JsonNode toJson(FieldVector vector, int index) {
    if (vector.isNull(index)) {
      return JSON.nullNode();
    }
    switch (PhysicalType.of(vector.getField().getType())) {
      case STRUCT -> {
        ObjectNode object = JSON.objectNode();
        for (FieldVector child : ((StructVector) vector).getChildrenFromFields()) {
          if (!child.isNull(index)) {
            object.set(child.getName(), toJson(child, index));
          }
        }
        return object;
      }
      case MAP -> {
        MapVector map = (MapVector) vector;
        StructVector entries = (StructVector) map.getDataVector();
        FieldVector keys = (FieldVector) entries.getChildByOrdinal(0);
        FieldVector values = (FieldVector) entries.getChildByOrdinal(1);
        ObjectNode object = JSON.objectNode();
        for (int i = map.getElementStartIndex(index); i < map.getElementEndIndex(index); i++) {
          if (!keys.isNull(i)) {
            object.set(keys.getObject(i).toString(), toJson(values, i));
          }
        }
        return object;
      }
      case LIST -> {
        ListVector list = (ListVector) vector;
        return array(
            list.getDataVector(),
            list.getElementStartIndex(index),
            list.getElementEndIndex(index));
      }
      case LARGE_LIST -> {
        LargeListVector list = (LargeListVector) vector;
        long start = list.getOffsetBuffer().getLong((long) index * Long.BYTES);
        long end = list.getOffsetBuffer().getLong((long) (index + 1) * Long.BYTES);
        return array(list.getDataVector(), Math.toIntExact(start), Math.toIntExact(end));
      }
      case FIXED_SIZE_LIST -> {
        FixedSizeListVector list = (FixedSizeListVector) vector;
        int start = index * list.getListSize();
        return array(list.getDataVector(), start, start + list.getListSize());
      }
      case BOOL -> {
        return JSON.booleanNode(((BitVector) vector).get(index) != 0);
      }
      default -> {
        Object value = scalar(vector, index);
        if (value instanceof Integer || value instanceof Long) {
          return JSON.numberNode(((Number) value).longValue());
        }
        if (value instanceof Double real) {
          return JSON.numberNode(real.doubleValue());
        }
        return value == null ? JSON.nullNode() : JSON.textNode(value.toString());
      }
    }
  }

  private static ArrayNode array(FieldVector elements, int start, int end) {
    ArrayNode array = JSON.arrayNode(end - start);
    for (int i = start; i < end; i++) {
      array.add(toJson(elements, i));
    }
    return array;
  }
}
