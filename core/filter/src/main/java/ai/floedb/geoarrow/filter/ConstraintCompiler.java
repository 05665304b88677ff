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

import ai.floedb.geoarrow.schema.AttributeDefinition;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.ColumnPath;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.PhysicalType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.types.pojo.Field;
import org.jboss.logging.Logger;

/**
 * Turns an attribute predicate into per-column constraints the reader can test directly against
 * batch columns.
 *
 * <p>Only the top-level conjunction is decomposed. Each conjunct compiles when it is a comparison
 * between one column and one constant, a null check on a column, or the negation of a null check.
 * Everything else is left to the generic evaluator, which {@link CompiledFilter#complete()}
 * reports.
 */
public final class ConstraintCompiler {

  private static final Logger LOG = Logger.getLogger(ConstraintCompiler.class);

  /** Name under which the row identifier can always be referenced. */
  public static final String FID_NAME = "FID";

  private static final int UNRESOLVED = Integer.MIN_VALUE;

  private final LayerSchema schema;
  private final List<Constraint> constraints = new ArrayList<>();
  private boolean complete = true;

  private ConstraintCompiler(LayerSchema schema) {
    this.schema = schema;
  }

  public static CompiledFilter compile(Expr expr, LayerSchema schema) {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(schema, "schema");
    ConstraintCompiler compiler = new ConstraintCompiler(schema);
    compiler.explore(Expr.rewriteBetween(expr));
    return new CompiledFilter(compiler.constraints, compiler.complete);
  }

  /**
   * Resolves the batch column each constraint reads under {@code layout}.
   *
   * <p>A constraint on an attribute that is not materialized is disabled with a warning. A
   * constraint on the row identifier reads the sequential row position when the layer has no
   * identifier column at all.
   */
  public static List<BoundConstraint> bind(
      CompiledFilter filter, LayerSchema schema, ColumnLayout layout) {
    List<BoundConstraint> bound = new ArrayList<>(filter.constraints().size());
    for (Constraint constraint : filter.constraints()) {
      if (constraint.targetsFid()) {
        int arrayIndex = layout.fidArrayIndex();
        if (arrayIndex < 0) {
          if (schema.fidName() == null) {
            arrayIndex = BoundConstraint.ROW_COUNTER;
          } else {
            LOG.debugf("Constraint on field %s cannot be applied", schema.fidName());
            arrayIndex = BoundConstraint.DISABLED;
          }
        }
        bound.add(new BoundConstraint(constraint, arrayIndex, List.of()));
        continue;
      }

      int arrayIndex = layout.attributeArrayIndex(constraint.field());
      if (arrayIndex < 0) {
        LOG.warnf(
            "Constraint on field %s cannot be applied due to it being ignored",
            schema.attribute(constraint.field()).name());
        bound.add(new BoundConstraint(constraint, BoundConstraint.DISABLED, List.of()));
        continue;
      }
      List<Integer> indices = schema.attributePath(constraint.field()).indices();
      bound.add(new BoundConstraint(constraint, arrayIndex, indices.subList(1, indices.size())));
    }
    return bound;
  }

  private void explore(Expr expr) {
    if (expr instanceof Expr.And and) {
      explore(and.left());
      explore(and.right());
      return;
    }
    boolean compiled;
    if (expr instanceof Expr.Compare compare) {
      compiled = compileComparison(compare);
    } else if (expr instanceof Expr.IsNull isNull) {
      compiled = compileNullCheck(isNull.expression(), ConstraintOp.IS_NULL);
    } else if (expr instanceof Expr.Not not && not.expression() instanceof Expr.IsNull isNull) {
      compiled = compileNullCheck(isNull.expression(), ConstraintOp.IS_NOT_NULL);
    } else {
      compiled = false;
    }
    if (!compiled) {
      complete = false;
    }
  }

  private boolean compileComparison(Expr.Compare compare) {
    Expr.ColumnRef column;
    Expr.Literal literal;
    CompareOp op = compare.op();
    if (compare.left() instanceof Expr.ColumnRef ref && compare.right() instanceof Expr.Literal l) {
      column = ref;
      literal = l;
    } else if (compare.right() instanceof Expr.ColumnRef ref
        && compare.left() instanceof Expr.Literal l) {
      column = ref;
      literal = l;
      op = op.flip();
    } else {
      return false;
    }

    int field = resolve(column.name());
    if (field == UNRESOLVED) {
      return false;
    }
    ConstraintValue value =
        field == Constraint.FID_FIELD ? coerceFid(literal) : coerce(field, literal);
    if (value == null) {
      return false;
    }
    constraints.add(new Constraint(field, ConstraintOp.of(op), value));
    return field == Constraint.FID_FIELD || evaluable(field);
  }

  private boolean compileNullCheck(Expr operand, ConstraintOp op) {
    if (!(operand instanceof Expr.ColumnRef column)) {
      return false;
    }
    int field = resolve(column.name());
    if (field == UNRESOLVED || field == Constraint.FID_FIELD) {
      return false;
    }
    constraints.add(new Constraint(field, op, null));
    return true;
  }

  private int resolve(String name) {
    int index = schema.attributeIndex(name);
    if (index >= 0) {
      return index;
    }
    if (name.equalsIgnoreCase(FID_NAME)
        || (schema.fidName() != null && name.equalsIgnoreCase(schema.fidName()))) {
      return Constraint.FID_FIELD;
    }
    return UNRESOLVED;
  }

  private static ConstraintValue coerceFid(Expr.Literal literal) {
    return integer64(literal.value());
  }

  /**
   * Numeric literals narrow to the column's integer width only when no precision is lost; any
   * other number keeps its full value and the evaluator widens the column to compare.
   */
  private ConstraintValue coerce(int field, Expr.Literal literal) {
    AttributeDefinition attribute = schema.attribute(field);
    Object value = literal.value();
    return switch (attribute.type()) {
      case INTEGER -> {
        if (value instanceof Long l && l == l.intValue()) {
          yield ConstraintValue.ofInteger(l.intValue());
        }
        if (value instanceof Double d && d == (int) d.doubleValue()) {
          yield ConstraintValue.ofInteger((int) d.doubleValue());
        }
        yield integer64(value);
      }
      case INTEGER64 -> integer64(value);
      case REAL -> {
        if (value instanceof Long l) {
          yield ConstraintValue.ofReal(l);
        }
        if (value instanceof Double d) {
          yield ConstraintValue.ofReal(d);
        }
        yield null;
      }
      case STRING -> value instanceof String s ? ConstraintValue.ofString(s) : null;
      case BINARY,
          DATE,
          TIME,
          DATETIME,
          INTEGER_LIST,
          INTEGER64_LIST,
          REAL_LIST,
          STRING_LIST -> null;
    };
  }

  /** Whether the leaf column of {@code field} is one the evaluator compares. */
  private boolean evaluable(int field) {
    ColumnPath path = schema.attributePath(field);
    Field leaf = schema.physicalSchema().getFields().get(path.column());
    for (int level = 1; level < path.depth(); level++) {
      leaf = leaf.getChildren().get(path.get(level));
    }
    return ConstraintEvaluator.supports(PhysicalType.of(leaf.getType()));
  }

  private static ConstraintValue integer64(Object value) {
    if (value instanceof Long l) {
      return ConstraintValue.ofInteger64(l);
    }
    if (value instanceof Double d) {
      return isIntegral(d) && d >= -0x1p63 && d < 0x1p63
          ? ConstraintValue.ofInteger64((long) d.doubleValue())
          : ConstraintValue.ofReal(d);
    }
    return null;
  }

  private static boolean isIntegral(double value) {
    return value == Math.rint(value) && !Double.isInfinite(value);
  }
}
