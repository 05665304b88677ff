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

/**
 * One comparison pushed down to the columnar reader.
 *
 * @param field attribute index, or {@link #FID_FIELD} for the row identifier
 * @param value coerced literal, {@code null} for null checks
 */
public record Constraint(int field, ConstraintOp op, ConstraintValue value) {

  public static final int FID_FIELD = -1;

  public Constraint {
    Objects.requireNonNull(op, "op");
    if (op.isNullCheck() != (value == null)) {
      throw new IllegalArgumentException("null checks take no value, comparisons need one");
    }
  }

  public static Constraint isNull(int field) {
    return new Constraint(field, ConstraintOp.IS_NULL, null);
  }

  public static Constraint isNotNull(int field) {
    return new Constraint(field, ConstraintOp.IS_NOT_NULL, null);
  }

  public boolean targetsFid() {
    return field == FID_FIELD;
  }
}
