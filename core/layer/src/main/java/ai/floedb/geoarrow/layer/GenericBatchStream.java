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

import ai.floedb.geoarrow.geometry.GeometryValue;
import ai.floedb.geoarrow.geometry.IsoWkbWriter;
import ai.floedb.geoarrow.schema.AttributeDefinition;
import ai.floedb.geoarrow.schema.AttributeSubType;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.GeometryEncoding;
import ai.floedb.geoarrow.schema.GeometryEncodingResolver;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.TimeZoneFlags;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Builds Arrow batches from materialized features.
 *
 * <p>Batches hold an {@value #FID_COLUMN} column, the non-ignored attributes and the non-ignored
 * geometries as ISO WKB. Works over any {@link FeatureIterator}, so it serves every request the
 * in-place export cannot.
 */
public final class GenericBatchStream implements BatchStream {

  public static final String FID_COLUMN = "OGC_FID";

  static final String JSON_EXTENSION = "arrow.json";

  private final FeatureIterator features;
  private final LayerSchema schema;
  private final ColumnLayout layout;
  private final StreamOptions options;
  private final SharedAllocator allocator;
  private final Schema exportSchema;
  private boolean eof;

  public GenericBatchStream(
      FeatureIterator features,
      LayerSchema schema,
      ColumnLayout layout,
      StreamOptions options,
      SharedAllocator allocator) {
    this.features = Objects.requireNonNull(features, "features");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.options = Objects.requireNonNull(options, "options");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.exportSchema = buildSchema();
  }

  private Schema buildSchema() {
    List<Field> fields = new ArrayList<>();
    fields.add(Field.notNullable(FID_COLUMN, new ArrowType.Int(64, true)));
    for (int i = 0; i < schema.attributeCount(); i++) {
      if (!layout.isAttributeIgnored(i)) {
        fields.add(attributeField(schema.attribute(i)));
      }
    }
    String wkb = options.metadataEncoding().extensionName(GeometryEncoding.WKB);
    for (int i = 0; i < schema.geometryCount(); i++) {
      if (!layout.isGeometryIgnored(i)) {
        fields.add(
            new Field(
                schema.geometryField(i).name(),
                new FieldType(
                    true,
                    ArrowType.Binary.INSTANCE,
                    null,
                    Map.of(GeometryEncodingResolver.EXTENSION_NAME_KEY, wkb)),
                null));
      }
    }
    return new Schema(fields);
  }

  static Field attributeField(AttributeDefinition attribute) {
    String name = attribute.name();
    return switch (attribute.type()) {
      case INTEGER -> Field.nullable(name, integerType(attribute.subType()));
      case INTEGER64 -> Field.nullable(name, new ArrowType.Int(64, true));
      case REAL -> Field.nullable(name, realType(attribute.subType()));
      case STRING -> {
        if (attribute.subType() == AttributeSubType.JSON) {
          yield new Field(
              name,
              new FieldType(
                  true,
                  ArrowType.Utf8.INSTANCE,
                  null,
                  Map.of(GeometryEncodingResolver.EXTENSION_NAME_KEY, JSON_EXTENSION)),
              null);
        }
        yield Field.nullable(name, ArrowType.Utf8.INSTANCE);
      }
      case BINARY -> Field.nullable(name, ArrowType.Binary.INSTANCE);
      case DATE -> Field.nullable(name, new ArrowType.Date(DateUnit.DAY));
      case TIME -> Field.nullable(name, new ArrowType.Time(TimeUnit.MILLISECOND, 32));
      case DATETIME ->
          Field.nullable(
              name,
              new ArrowType.Timestamp(TimeUnit.MILLISECOND, timezone(attribute.timeZoneFlag())));
      case INTEGER_LIST -> list(name, integerType(attribute.subType()));
      case INTEGER64_LIST -> list(name, new ArrowType.Int(64, true));
      case REAL_LIST -> list(name, realType(attribute.subType()));
      case STRING_LIST -> list(name, ArrowType.Utf8.INSTANCE);
    };
  }

  private static ArrowType integerType(AttributeSubType subType) {
    return switch (subType) {
      case BOOLEAN -> ArrowType.Bool.INSTANCE;
      case INT16 -> new ArrowType.Int(16, true);
      default -> new ArrowType.Int(32, true);
    };
  }

  private static ArrowType realType(AttributeSubType subType) {
    return new ArrowType.FloatingPoint(
        subType == AttributeSubType.FLOAT32
            ? FloatingPointPrecision.SINGLE
            : FloatingPointPrecision.DOUBLE);
  }

  private static Field list(String name, ArrowType elementType) {
    return new Field(
        name,
        FieldType.nullable(ArrowType.List.INSTANCE),
        List.of(Field.nullable("item", elementType)));
  }

  static String timezone(int timeZoneFlag) {
    if (timeZoneFlag == TimeZoneFlags.UTC) {
      return "UTC";
    }
    return TimeZoneFlags.hasOffset(timeZoneFlag)
        ? TimeZoneFlags.toOffset(timeZoneFlag).getId()
        : null;
  }

  @Override
  public Schema schema() {
    return exportSchema;
  }

  @Override
  public ExportedBatch next() throws IOException {
    if (eof) {
      return null;
    }
    List<Feature> pending = new ArrayList<>();
    while (pending.size() < options.maxFeaturesInBatch()) {
      Feature feature = features.next();
      if (feature == null) {
        eof = true;
        break;
      }
      pending.add(feature);
    }
    if (pending.isEmpty()) {
      return null;
    }

    VectorSchemaRoot root = VectorSchemaRoot.create(exportSchema, allocator.allocator());
    try {
      root.allocateNew();
      write(root, pending);
      VectorSchemaRoot built = root;
      ReleaseHandle handle = ReleaseHandle.of(built::close).wrap(allocator.lease());
      root = null;
      return new ExportedBatch(built, handle);
    } finally {
      if (root != null) {
        root.close();
      }
    }
  }

  private void write(VectorSchemaRoot root, List<Feature> batch) {
    BigIntVector fids = (BigIntVector) root.getVector(0);
    for (int row = 0; row < batch.size(); row++) {
      fids.setSafe(row, batch.get(row).fid());
    }
    int column = 1;
    for (int i = 0; i < schema.attributeCount(); i++) {
      if (layout.isAttributeIgnored(i)) {
        continue;
      }
      FieldVector vector = root.getVector(column++);
      for (int row = 0; row < batch.size(); row++) {
        Object value = batch.get(row).value(i);
        if (value != null) {
          writeValue(vector, row, value);
        } else if (vector instanceof ListVector list) {
          list.setNull(row);
        }
      }
    }
    for (int i = 0; i < schema.geometryCount(); i++) {
      if (layout.isGeometryIgnored(i)) {
        continue;
      }
      VarBinaryVector vector = (VarBinaryVector) root.getVector(column++);
      for (int row = 0; row < batch.size(); row++) {
        GeometryValue value = batch.get(row).geometry(i);
        if (value != null) {
          vector.setSafe(row, IsoWkbWriter.write(value));
        }
      }
    }
    root.setRowCount(batch.size());
  }

  private static void writeValue(FieldVector vector, int row, Object value) {
    if (vector instanceof BitVector bits) {
      bits.setSafe(row, ((Number) value).intValue() != 0 ? 1 : 0);
    } else if (vector instanceof BaseIntVector integers) {
      integers.setWithPossibleTruncate(row, ((Number) value).longValue());
    } else if (vector instanceof Float4Vector floats) {
      floats.setSafe(row, ((Number) value).floatValue());
    } else if (vector instanceof Float8Vector doubles) {
      doubles.setSafe(row, ((Number) value).doubleValue());
    } else if (vector instanceof VarCharVector strings) {
      strings.setSafe(row, value.toString().getBytes(StandardCharsets.UTF_8));
    } else if (vector instanceof VarBinaryVector binary) {
      binary.setSafe(row, (byte[]) value);
    } else if (vector instanceof DateDayVector dates) {
      dates.setSafe(row, Math.toIntExact(((LocalDate) value).toEpochDay()));
    } else if (vector instanceof TimeMilliVector times) {
      times.setSafe(row, (int) (((LocalTime) value).toNanoOfDay() / 1_000_000L));
    } else if (vector instanceof TimeStampVector timestamps) {
      timestamps.setSafe(row, epochMillis(value));
    } else if (vector instanceof ListVector list) {
      writeList(list, row, value);
    } else {
      throw new IllegalStateException("Unexpected export vector " + vector.getField());
    }
  }

  private static long epochMillis(Object value) {
    if (value instanceof OffsetDateTime offset) {
      return offset.toInstant().toEpochMilli();
    }
    return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
  }

  private static void writeList(ListVector list, int row, Object value) {
    FieldVector elements = list.getDataVector();
    int start = list.startNewValue(row);
    int count;
    if (value instanceof int[] ints) {
      count = ints.length;
      for (int i = 0; i < count; i++) {
        writeValue(elements, start + i, Integer.valueOf(ints[i]));
      }
    } else if (value instanceof long[] longs) {
      count = longs.length;
      for (int i = 0; i < count; i++) {
        writeValue(elements, start + i, Long.valueOf(longs[i]));
      }
    } else if (value instanceof double[] doubles) {
      count = doubles.length;
      for (int i = 0; i < count; i++) {
        writeValue(elements, start + i, Double.valueOf(doubles[i]));
      }
    } else {
      List<?> strings = (List<?>) value;
      count = strings.size();
      for (int i = 0; i < count; i++) {
        writeValue(elements, start + i, strings.get(i));
      }
    }
    list.endValue(row, count);
  }

  @Override
  public void close() {
    eof = true;
  }
}
