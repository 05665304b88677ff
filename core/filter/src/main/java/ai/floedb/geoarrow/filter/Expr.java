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

import java.util.Objects;

/** Logical expression tree for attribute predicates. */
public sealed interface Expr
    permits Expr.ColumnRef,
        Expr.Literal,
        Expr.Compare,
        Expr.And,
        Expr.Or,
        Expr.Not,
        Expr.IsNull,
        Expr.Between {

  /** Column reference by field name, matched case-insensitively. */
  record ColumnRef(String name) implements Expr {
    public ColumnRef {
      Objects.requireNonNull(name, "name");
    }
  }

  /**
   * Constant literal.
   *
   * @param value a {@link Long}, {@link Double} or {@link String}
   */
  record Literal(Object value) implements Expr {
    public Literal {
      Objects.requireNonNull(value, "value");
      if (!(value instanceof Long || value instanceof Double || value instanceof String)) {
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass());
      }
    }

    public boolean isNumeric() {
      return value instanceof Long || value instanceof Double;
    }
  }

  /** Binary comparison. */
  record Compare(CompareOp op, Expr left, Expr right) implements Expr {
    public Compare {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }
  }

  /** Boolean AND. */
  record And(Expr left, Expr right) implements Expr {}

  /** Boolean OR. */
  record Or(Expr left, Expr right) implements Expr {}

  /** Negation. */
  record Not(Expr expression) implements Expr {}

  /** Null check. */
  record IsNull(Expr expression) implements Expr {}

  /** Inclusive range check. */
  record Between(Expr value, Expr low, Expr high) implements Expr {}

  static ColumnRef column(String name) {
    return new ColumnRef(name);
  }

  static Literal literal(long value) {
    return new Literal(value);
  }

  static Literal literal(double value) {
    return new Literal(value);
  }

  static Literal literal(String value) {
    return new Literal(value);
  }

  static Compare compare(Expr left, CompareOp op, Expr right) {
    return new Compare(op, left, right);
  }

  static And and(Expr left, Expr right) {
    return new And(left, right);
  }

  /** Replaces every {@code BETWEEN} node with {@code value >= low AND value <= high}. */
  static Expr rewriteBetween(Expr expr) {
    if (expr instanceof Between between) {
      Expr value = rewriteBetween(between.value());
      return new And(
          new Compare(CompareOp.GE, value, rewriteBetween(between.low())),
          new Compare(CompareOp.LE, value, rewriteBetween(between.high())));
    }
    if (expr instanceof And and) {
      return new And(rewriteBetween(and.left()), rewriteBetween(and.right()));
    }
    if (expr instanceof Or or) {
      return new Or(rewriteBetween(or.left()), rewriteBetween(or.right()));
    }
    if (expr instanceof Not not) {
      return new Not(rewriteBetween(not.expression()));
    }
    if (expr instanceof IsNull isNull) {
      return new IsNull(rewriteBetween(isNull.expression()));
    }
    if (expr instanceof Compare compare) {
      return new Compare(
          compare.op(), rewriteBetween(compare.left()), rewriteBetween(compare.right()));
    }
    return expr;
  }
}
