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

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Closed set of physical array kinds the reader distinguishes.
 *
 * <p>Classification from Arrow types happens once, in {@link #of(ArrowType)}. Callers dispatch
 * with switch expressions over this enum so that a new constant has to be handled everywhere.
 */
public enum PhysicalType {
  NULL,
  BOOL,
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
  STRING,
  LARGE_STRING,
  BINARY,
  LARGE_BINARY,
  FIXED_SIZE_BINARY,
  DATE32,
  DATE64,
  TIMESTAMP,
  TIME32,
  TIME64,
  DECIMAL128,
  DECIMAL256,
  LIST,
  LARGE_LIST,
  FIXED_SIZE_LIST,
  STRUCT,
  MAP,
  DICTIONARY,
  EXTENSION,
  UNSUPPORTED;

  /** Classifies a schema field; dictionary-encoded fields report {@link #DICTIONARY}. */
  public static PhysicalType of(Field field) {
    if (field.getDictionary() != null) {
      return DICTIONARY;
    }
    return of(field.getType());
  }

  public static PhysicalType of(ArrowType type) {
    if (type instanceof ArrowType.Null) {
      return NULL;
    }
    if (type instanceof ArrowType.Bool) {
      return BOOL;
    }
    if (type instanceof ArrowType.Int intType) {
      return switch (intType.getBitWidth()) {
        case 8 -> intType.getIsSigned() ? INT8 : UINT8;
        case 16 -> intType.getIsSigned() ? INT16 : UINT16;
        case 32 -> intType.getIsSigned() ? INT32 : UINT32;
        case 64 -> intType.getIsSigned() ? INT64 : UINT64;
        default -> UNSUPPORTED;
      };
    }
    if (type instanceof ArrowType.FloatingPoint floatType) {
      return switch (floatType.getPrecision()) {
        case HALF -> HALF_FLOAT;
        case SINGLE -> FLOAT;
        case DOUBLE -> DOUBLE;
      };
    }
    if (type instanceof ArrowType.Utf8) {
      return STRING;
    }
    if (type instanceof ArrowType.LargeUtf8) {
      return LARGE_STRING;
    }
    if (type instanceof ArrowType.Binary) {
      return BINARY;
    }
    if (type instanceof ArrowType.LargeBinary) {
      return LARGE_BINARY;
    }
    if (type instanceof ArrowType.FixedSizeBinary) {
      return FIXED_SIZE_BINARY;
    }
    if (type instanceof ArrowType.Date dateType) {
      return dateType.getUnit() == DateUnit.DAY ? DATE32 : DATE64;
    }
    if (type instanceof ArrowType.Timestamp) {
      return TIMESTAMP;
    }
    if (type instanceof ArrowType.Time timeType) {
      return timeType.getBitWidth() == 32 ? TIME32 : TIME64;
    }
    if (type instanceof ArrowType.Decimal decimalType) {
      return decimalType.getBitWidth() == 256 ? DECIMAL256 : DECIMAL128;
    }
    if (type instanceof ArrowType.Map) {
      return MAP;
    }
    if (type instanceof ArrowType.List) {
      return LIST;
    }
    if (type instanceof ArrowType.LargeList) {
      return LARGE_LIST;
    }
    if (type instanceof ArrowType.FixedSizeList) {
      return FIXED_SIZE_LIST;
    }
    if (type instanceof ArrowType.Struct) {
      return STRUCT;
    }
    if (type instanceof ArrowType.ExtensionType) {
      return EXTENSION;
    }
    return UNSUPPORTED;
  }

  public boolean isInteger() {
    return switch (this) {
      case INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64, UINT64 -> true;
      default -> false;
    };
  }

  public boolean isString() {
    return this == STRING || this == LARGE_STRING;
  }
}
