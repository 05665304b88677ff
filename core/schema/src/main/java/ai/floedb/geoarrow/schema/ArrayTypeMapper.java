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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.jboss.logging.Logger;

/**
 * Maps physical Arrow fields to flattened attribute descriptors.
 *
 * <p>Struct columns are flattened depth first into {@code parent.child} attributes. Dictionary
 * columns with text values and an integral index become integer attributes bound to a coded-value
 * domain. Types without a mapping are dropped with a warning.
 */
public final class ArrayTypeMapper {

  private static final Logger LOG = Logger.getLogger(ArrayTypeMapper.class);

  private final SchemaOverlay overlay;
  private final DictionaryProvider dictionaries;

  public ArrayTypeMapper(SchemaOverlay overlay, DictionaryProvider dictionaries) {
    this.overlay = Objects.requireNonNull(overlay, "overlay");
    this.dictionaries = dictionaries;
  }

  /**
   * Appends the attributes for {@code field} to {@code schema}.
   *
   * @return number of attributes appended, {@code 0} when the field was rejected
   */
  public int appendField(LayerSchema.Builder schema, Field field, ColumnPath path) {
    return appendField(schema, field, field.getName(), path);
  }

  private int appendField(
      LayerSchema.Builder schema, Field field, String name, ColumnPath path) {
    PhysicalType physical = PhysicalType.of(field);
    ArrowType type = field.getType();
    String domainName = null;

    if (physical == PhysicalType.DICTIONARY) {
      DictionaryEncoding encoding = field.getDictionary();
      Dictionary dictionary = dictionaries == null ? null : dictionaries.lookup(encoding.getId());
      ArrowType valueType = dictionary != null ? dictionary.getVectorType() : type;
      PhysicalType indexType = PhysicalType.of(encoding.getIndexType());
      if (path.depth() != 1 || !PhysicalType.of(valueType).isString() || !indexType.isInteger()) {
        LOG.warnf("Field %s of unhandled type %s ignored", name, type);
        return 0;
      }
      domainName = name + "Domain";
      type = encoding.getIndexType();
      physical = indexType;
      if (dictionary != null) {
        schema.addDomain(buildDomain(domainName, indexType, dictionary.getVector()));
      }
    }

    if (physical == PhysicalType.STRUCT) {
      int added = 0;
      List<Field> children = field.getChildren();
      for (int j = 0; j < children.size(); j++) {
        Field child = children.get(j);
        added += appendField(schema, child, name + "." + child.getName(), path.child(j));
      }
      return added;
    }

    AttributeDefinition.Builder builder = mapType(name, field, type, physical);
    if (builder == null) {
      return 0;
    }
    builder.domainName(domainName);
    applyOverlay(name, builder);
    builder.nullable(field.isNullable());
    int index = schema.addAttribute(builder.build(), path);
    if (physical == PhysicalType.DOUBLE) {
      schema.registerBboxColumn(name, index);
    }
    return 1;
  }

  private AttributeDefinition.Builder mapType(
      String name, Field field, ArrowType type, PhysicalType physical) {
    return switch (physical) {
      case NULL, STRING, LARGE_STRING -> AttributeDefinition.builder(name, AttributeType.STRING);
      case BOOL ->
          AttributeDefinition.builder(name, AttributeType.INTEGER)
              .subType(AttributeSubType.BOOLEAN);
      case UINT8, INT8, UINT16, INT32 -> AttributeDefinition.builder(name, AttributeType.INTEGER);
      case INT16 ->
          AttributeDefinition.builder(name, AttributeType.INTEGER).subType(AttributeSubType.INT16);
      // Time64 exceeds the millisecond resolution of the time type.
      case UINT32, INT64, TIME64 -> AttributeDefinition.builder(name, AttributeType.INTEGER64);
      // Values above 2^53 lose precision.
      case UINT64, DOUBLE -> AttributeDefinition.builder(name, AttributeType.REAL);
      case HALF_FLOAT, FLOAT ->
          AttributeDefinition.builder(name, AttributeType.REAL).subType(AttributeSubType.FLOAT32);
      case BINARY, LARGE_BINARY -> AttributeDefinition.builder(name, AttributeType.BINARY);
      case FIXED_SIZE_BINARY ->
          AttributeDefinition.builder(name, AttributeType.BINARY)
              .width(((ArrowType.FixedSizeBinary) type).getByteWidth());
      case DATE32, DATE64 -> AttributeDefinition.builder(name, AttributeType.DATE);
      case TIMESTAMP -> dateTime(name, (ArrowType.Timestamp) type);
      case TIME32 -> AttributeDefinition.builder(name, AttributeType.TIME);
      case DECIMAL128, DECIMAL256 -> {
        ArrowType.Decimal decimal = (ArrowType.Decimal) type;
        yield AttributeDefinition.builder(name, AttributeType.REAL)
            .width(decimal.getPrecision())
            .precision(decimal.getScale());
      }
      case LIST, FIXED_SIZE_LIST -> listType(name, field);
      case MAP -> {
        if (isHandledMap(field)) {
          yield AttributeDefinition.builder(name, AttributeType.STRING)
              .subType(AttributeSubType.JSON);
        }
        yield reject(name, type);
      }
      case LARGE_LIST, STRUCT, DICTIONARY, EXTENSION, UNSUPPORTED -> reject(name, type);
    };
  }

  private AttributeDefinition.Builder dateTime(String name, ArrowType.Timestamp type) {
    OptionalInt flag = TimeZoneFlags.fromTimezone(type.getTimezone());
    int tzFlag;
    if (flag.isPresent()) {
      tzFlag = flag.getAsInt();
    } else {
      LOG.warnf(
          "Field %s has unrecognized timezone %s. UTC datetime will be used instead.",
          name, type.getTimezone());
      tzFlag = TimeZoneFlags.UTC;
    }
    return AttributeDefinition.builder(name, AttributeType.DATETIME).timeZoneFlag(tzFlag);
  }

  private AttributeDefinition.Builder listType(String name, Field field) {
    Field element = field.getChildren().get(0);
    PhysicalType elementType = PhysicalType.of(element);
    return switch (elementType) {
      case BOOL ->
          AttributeDefinition.builder(name, AttributeType.INTEGER_LIST)
              .subType(AttributeSubType.BOOLEAN);
      case UINT8, INT8, UINT16, INT16, INT32 ->
          AttributeDefinition.builder(name, AttributeType.INTEGER_LIST);
      case UINT32, INT64 -> AttributeDefinition.builder(name, AttributeType.INTEGER64_LIST);
      case UINT64, DOUBLE, DECIMAL128, DECIMAL256 ->
          AttributeDefinition.builder(name, AttributeType.REAL_LIST);
      case HALF_FLOAT, FLOAT ->
          AttributeDefinition.builder(name, AttributeType.REAL_LIST)
              .subType(AttributeSubType.FLOAT32);
      case STRING, LARGE_STRING -> AttributeDefinition.builder(name, AttributeType.STRING_LIST);
      default -> {
        if (isHandledListOrMapValue(element)) {
          yield AttributeDefinition.builder(name, AttributeType.STRING)
              .subType(AttributeSubType.JSON);
        }
        yield reject(name, field.getType());
      }
    };
  }

  /** Whether a list element or map value can be rendered as JSON. */
  static boolean isHandledListOrMapValue(Field value) {
    return switch (PhysicalType.of(value)) {
      case BOOL,
          INT8,
          UINT8,
          INT16,
          UINT16,
          INT32,
          UINT32,
          INT64,
          UINT64,
          HALF_FLOAT,
          FLOAT,
          DOUBLE,
          DECIMAL128,
          DECIMAL256,
          STRING,
          LARGE_STRING,
          STRUCT ->
          true;
      case MAP -> isHandledMap(value);
      case LIST, LARGE_LIST, FIXED_SIZE_LIST ->
          isHandledListOrMapValue(value.getChildren().get(0));
      default -> false;
    };
  }

  /** A map is handled when its keys are strings and its values are handled. */
  static boolean isHandledMap(Field map) {
    if (map.getChildren().isEmpty()) {
      return false;
    }
    List<Field> entry = map.getChildren().get(0).getChildren();
    if (entry.size() != 2) {
      return false;
    }
    return PhysicalType.of(entry.get(0)) == PhysicalType.STRING
        && isHandledListOrMapValue(entry.get(1));
  }

  private static AttributeDefinition.Builder reject(String name, ArrowType type) {
    LOG.warnf("Field %s of unhandled type %s ignored", name, type);
    return null;
  }

  private void applyOverlay(String name, AttributeDefinition.Builder builder) {
    overlay
        .column(name)
        .ifPresent(
            override -> {
              AttributeType overlayType =
                  AttributeType.fromName(override.type()).orElse(AttributeType.STRING);
              AttributeSubType overlaySubType =
                  AttributeSubType.fromName(override.subType()).orElse(AttributeSubType.NONE);
              if (overlayType == builder.type()) {
                if (builder.subType() == AttributeSubType.NONE) {
                  builder.subType(overlaySubType);
                } else if (builder.subType() != overlaySubType) {
                  LOG.debugf(
                      "Field subtype inferred from Arrow schema is %s, whereas the one in %s is"
                          + " %s. Using the former one.",
                      builder.subType().typeName(),
                      SchemaOverlay.METADATA_KEY,
                      overlaySubType.typeName());
                }
              } else {
                LOG.debugf(
                    "Field type inferred from Arrow schema is %s, whereas the one in %s is %s."
                        + " Using the former one.",
                    builder.type().typeName(), SchemaOverlay.METADATA_KEY, overlayType.typeName());
              }
              if (override.width() > 0) {
                builder.width(override.width());
              }
              if (override.precision() > 0) {
                builder.precision(override.precision());
              }
              if (!override.alternativeName().isEmpty()) {
                builder.alternativeName(override.alternativeName());
              }
              if (!override.comment().isEmpty()) {
                builder.comment(override.comment());
              }
            });
  }

  /** Code {@code i} maps to dictionary value {@code i} for every non-null value. */
  static CodedValueDomain buildDomain(String name, PhysicalType indexType, FieldVector values) {
    AttributeType codeType =
        switch (indexType) {
          case UINT32, UINT64, INT64 -> AttributeType.INTEGER64;
          default -> AttributeType.INTEGER;
        };
    Map<Long, String> codes = new LinkedHashMap<>();
    for (int i = 0; i < values.getValueCount(); i++) {
      if (!values.isNull(i)) {
        codes.put((long) i, String.valueOf(values.getObject(i)));
      }
    }
    return new CodedValueDomain(name, codeType, codes);
  }
}
