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

import ai.floedb.geoarrow.filter.CompareOp;
import ai.floedb.geoarrow.filter.ConstraintCompiler;
import ai.floedb.geoarrow.filter.Expr;
import ai.floedb.geoarrow.schema.LayerSchema;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Objects;

/**
 * Evaluates an attribute filter on materialized features.
 *
 * <p>Used for the parts of a filter that could not be compiled to columnar constraints.
 * Comparisons involving null are unknown and unknown rows do not match. Ignored fields read as
 * null. Date and time values compare with string literals such as {@code '2024/01/31'} or {@code
 * '2024-01-31 10:00:00'}.
 */
final class FeatureExpressionMatcher {

  private static final int FID = -1;

  private final Expr expression;
  private final LayerSchema schema;

  /**
   * @throws IllegalArgumentException when the expression references an unknown field
   */
  FeatureExpressionMatcher(Expr expression, LayerSchema schema) {
    this.expression = Expr.rewriteBetween(Objects.requireNonNull(expression, "expression"));
    this.schema = Objects.requireNonNull(schema, "schema");
    validate(this.expression);
  }

  boolean matches(Feature feature) {
    return Boolean.TRUE.equals(evaluate(expression, feature));
  }

  private void validate(Expr expr) {
    if (expr instanceof Expr.ColumnRef column) {
      resolve(column.name());
    } else if (expr instanceof Expr.Compare compare) {
      validate(compare.left());
      validate(compare.right());
    } else if (expr instanceof Expr.And and) {
      validate(and.left());
      validate(and.right());
    } else if (expr instanceof Expr.Or or) {
      validate(or.left());
      validate(or.right());
    } else if (expr instanceof Expr.Not not) {
      validate(not.expression());
    } else if (expr instanceof Expr.IsNull isNull) {
      validate(isNull.expression());
    }
  }

  private int resolve(String name) {
    int index = schema.attributeIndex(name);
    if (index >= 0) {
      return index;
    }
    if (name.equalsIgnoreCase(ConstraintCompiler.FID_NAME)
        || (schema.fidName() != null && name.equalsIgnoreCase(schema.fidName()))) {
      return FID;
    }
    throw new IllegalArgumentException("Unknown field in attribute filter: " + name);
  }

  /** Three-valued result, {@code null} when unknown. */
  private Boolean evaluate(Expr expr, Feature feature) {
    if (expr instanceof Expr.And and) {
      Boolean left = evaluate(and.left(), feature);
      if (Boolean.FALSE.equals(left)) {
        return false;
      }
      Boolean right = evaluate(and.right(), feature);
      if (Boolean.FALSE.equals(right)) {
        return false;
      }
      return left == null || right == null ? null : true;
    }
    if (expr instanceof Expr.Or or) {
      Boolean left = evaluate(or.left(), feature);
      if (Boolean.TRUE.equals(left)) {
        return true;
      }
      Boolean right = evaluate(or.right(), feature);
      if (Boolean.TRUE.equals(right)) {
        return true;
      }
      return left == null || right == null ? null : false;
    }
    if (expr instanceof Expr.Not not) {
      Boolean operand = evaluate(not.expression(), feature);
      return operand == null ? null : !operand;
    }
    if (expr instanceof Expr.IsNull isNull) {
      return operand(isNull.expression(), feature) == null;
    }
    if (expr instanceof Expr.Compare compare) {
      Object left = operand(compare.left(), feature);
      Object right = operand(compare.right(), feature);
      return left == null || right == null ? null : compare(compare.op(), left, right);
    }
    throw new IllegalArgumentException("Not a boolean expression: " + expr);
  }

  private Object operand(Expr expr, Feature feature) {
    if (expr instanceof Expr.ColumnRef column) {
      int index = resolve(column.name());
      return index == FID ? Long.valueOf(feature.fid()) : feature.value(index);
    }
    if (expr instanceof Expr.Literal literal) {
      return literal.value();
    }
    throw new IllegalArgumentException("Not a value expression: " + expr);
  }

  static Boolean compare(CompareOp op, Object left, Object right) {
    if (left instanceof Number l && right instanceof Number r) {
      if (isIntegral(l) && isIntegral(r)) {
        return op.test(l.longValue(), r.longValue());
      }
      return op.test(l.doubleValue(), r.doubleValue());
    }
    if (left instanceof String l && right instanceof String r) {
      return op.test(compareUtf8(l, r));
    }
    if (left instanceof Number l && right instanceof String r) {
      Double parsed = parseDouble(r);
      return parsed == null ? null : op.test(l.doubleValue(), parsed);
    }
    if (left instanceof String l && right instanceof Number r) {
      Double parsed = parseDouble(l);
      return parsed == null ? null : op.test(parsed, r.doubleValue());
    }
    if (left instanceof Temporal && right instanceof String r) {
      Integer comparison = compareTemporal(left, r);
      return comparison == null ? null : op.test(comparison);
    }
    if (left instanceof String l && right instanceof Temporal) {
      Integer comparison = compareTemporal(right, l);
      return comparison == null ? null : op.flip().test(comparison);
    }
    return null;
  }

  /** Unsigned UTF-8 byte order, which is code point order and matches the columnar skip. */
  static int compareUtf8(String left, String right) {
    return Arrays.compareUnsigned(
        left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Long || value instanceof Integer;
  }

  private static Double parseDouble(String text) {
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Compares {@code value} with the same kind of value parsed from {@code text}. */
  private static Integer compareTemporal(Object value, String text) {
    String iso = text.trim().replace('/', '-');
    try {
      if (value instanceof LocalDate date) {
        return date.compareTo(LocalDate.parse(iso));
      }
      if (value instanceof LocalTime time) {
        return time.compareTo(LocalTime.parse(iso));
      }
      String dateTime = iso.replace(' ', 'T');
      if (value instanceof LocalDateTime local) {
        return local.compareTo(LocalDateTime.parse(dateTime));
      }
      if (value instanceof OffsetDateTime offset) {
        return offset.toInstant().compareTo(OffsetDateTime.parse(dateTime).toInstant());
      }
    } catch (DateTimeParseException e) {
      return null;
    }
    return null;
  }
}
