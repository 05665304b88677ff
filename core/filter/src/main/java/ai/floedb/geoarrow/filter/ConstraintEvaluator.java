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

package ai.floedb.geoarrow.filter;

import ai.floedb.geoarrow.schema.PhysicalType;
import java.math.BigDecimal;
import java.util.List;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float2Vector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.StructVector;

/**
 * Evaluates bound constraints against one row of a materialized batch.
 *
 * <p>Coercion rules:
 *
 * <ul>
 *   <li>integer columns are widened to 64 bits; unsigned 64-bit values are compared as doubles
 *   <li>float columns, half floats included, are compared as doubles, so integer literals are
 *       converted to floating point
 *   <li>decimal columns go through their text form and are parsed as doubles, which loses
 *       precision beyond 17 significant digits
 *   <li>string columns compare their raw UTF-8 bytes, unsigned and lexicographically, against the
 *       literal's text form
 *   <li>a numeric column compared with a string literal compares its decimal text ({@code %f} for
 *       floating point values)
 * </ul>
 */
public final class ConstraintEvaluator {

  private ConstraintEvaluator() {}

  /**
   * Returns {@code true} when the row fails at least one constraint.
   *
   * @param featureIndex sequential position of the row in the layer, read by row counter
   *     constraints
   */
  public static boolean skip(
      List<BoundConstraint> constraints, VectorSchemaRoot batch, int row, long featureIndex) {
    for (BoundConstraint bound : constraints) {
      if (fails(bound, batch, row, featureIndex)) {
        return true;
      }
    }
    return false;
  }

  static boolean fails(BoundConstraint bound, VectorSchemaRoot batch, int row, long featureIndex) {
    Constraint constraint = bound.constraint();
    if (bound.isDisabled()) {
      return false;
    }
    if (bound.readsRowCounter()) {
      return !matchesInteger(constraint, featureIndex);
    }

    FieldVector vector = batch.getVector(bound.arrayIndex());
    boolean isNull = vector.isNull(row);
    for (int ordinal : bound.childPath()) {
      vector = (FieldVector) ((StructVector) vector).getChildByOrdinal(ordinal);
      isNull = isNull || vector.isNull(row);
    }

    switch (constraint.op()) {
      case IS_NULL:
        return !isNull;
      case IS_NOT_NULL:
        return isNull;
      default:
        if (isNull) {
          return true;
        }
    }
    return !matches(constraint, vector, row);
  }

  /** Whether constraints on a column of this type are evaluated rather than ignored. */
  public static boolean supports(PhysicalType type) {
    return switch (type) {
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
          STRING,
          LARGE_STRING,
          DECIMAL128,
          DECIMAL256 -> true;
      case NULL,
          BINARY,
          LARGE_BINARY,
          FIXED_SIZE_BINARY,
          DATE32,
          DATE64,
          TIMESTAMP,
          TIME32,
          TIME64,
          LIST,
          LARGE_LIST,
          FIXED_SIZE_LIST,
          STRUCT,
          MAP,
          DICTIONARY,
          EXTENSION,
          UNSUPPORTED -> false;
    };
  }

  // Dictionary-encoded vectors hold their indices, so the field type (not PhysicalType.of(Field))
  // selects the comparison.
  private static boolean matches(Constraint constraint, FieldVector vector, int row) {
    PhysicalType type = PhysicalType.of(vector.getField().getType());
    return switch (type) {
      case BOOL -> matchesInteger(constraint, ((BitVector) vector).get(row));
      case INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64 ->
          matchesInteger(constraint, ((BaseIntVector) vector).getValueAsLong(row));
      case UINT64 -> matchesReal(constraint, unsignedToDouble(((UInt8Vector) vector).get(row)));
      case HALF_FLOAT -> matchesReal(constraint, ((Float2Vector) vector).getValueAsDouble(row));
      case FLOAT -> matchesReal(constraint, ((Float4Vector) vector).get(row));
      case DOUBLE -> matchesReal(constraint, ((Float8Vector) vector).get(row));
      case STRING -> {
        VarCharVector strings = (VarCharVector) vector;
        int comparison =
            compareUtf8(
                strings.getDataBuffer(),
                strings.getOffsetBuffer().getInt((long) row * Integer.BYTES),
                strings.getValueLength(row),
                constraint.value().textBytes());
        yield constraint.op().relational().test(comparison);
      }
      case LARGE_STRING -> {
        LargeVarCharVector strings = (LargeVarCharVector) vector;
        int comparison =
            compareUtf8(
                strings.getDataBuffer(),
                strings.getOffsetBuffer().getLong((long) row * Long.BYTES),
                strings.getValueLength(row),
                constraint.value().textBytes());
        yield constraint.op().relational().test(comparison);
      }
      case DECIMAL128 ->
          matchesReal(constraint, decimalAsDouble(((DecimalVector) vector).getObject(row)));
      case DECIMAL256 ->
          matchesReal(constraint, decimalAsDouble(((Decimal256Vector) vector).getObject(row)));
      case NULL,
          BINARY,
          LARGE_BINARY,
          FIXED_SIZE_BINARY,
          DATE32,
          DATE64,
          TIMESTAMP,
          TIME32,
          TIME64,
          LIST,
          LARGE_LIST,
          FIXED_SIZE_LIST,
          STRUCT,
          MAP,
          DICTIONARY,
          EXTENSION,
          UNSUPPORTED -> true;
    };
  }

  static boolean matchesInteger(Constraint constraint, long value) {
    CompareOp op = constraint.op().relational();
    ConstraintValue literal = constraint.value();
    return switch (literal.kind()) {
      case INTEGER, INTEGER64 -> op.test(value, literal.integerValue());
      case REAL -> op.test((double) value, literal.realValue());
      case STRING -> op.test(Long.toString(value).compareTo(literal.text()));
    };
  }

  static boolean matchesReal(Constraint constraint, double value) {
    CompareOp op = constraint.op().relational();
    ConstraintValue literal = constraint.value();
    return switch (literal.kind()) {
      case INTEGER, INTEGER64 -> op.test(value, (double) literal.integerValue());
      case REAL -> op.test(value, literal.realValue());
      case STRING -> op.test(ConstraintValue.formatReal(value).compareTo(literal.text()));
    };
  }

  /** Unsigned byte-wise comparison of a value in {@code data} with {@code literal}. */
  static int compareUtf8(ArrowBuf data, long start, int length, byte[] literal) {
    int common = Math.min(length, literal.length);
    for (int i = 0; i < common; i++) {
      int left = data.getByte(start + i) & 0xFF;
      int right = literal[i] & 0xFF;
      if (left != right) {
        return left - right;
      }
    }
    return Integer.compare(length, literal.length);
  }

  static double unsignedToDouble(long value) {
    double magnitude = (double) (value & Long.MAX_VALUE);
    return value < 0 ? magnitude + 0x1.0p63 : magnitude;
  }

  private static double decimalAsDouble(BigDecimal value) {
    return Double.parseDouble(value.toString());
  }
}
