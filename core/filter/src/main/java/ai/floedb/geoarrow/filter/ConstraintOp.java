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

/** Operator of a compiled {@link Constraint}. */
public enum ConstraintOp {
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  IS_NULL,
  IS_NOT_NULL;

  public static ConstraintOp of(CompareOp op) {
    return switch (op) {
      case EQ -> EQ;
      case NE -> NE;
      case LT -> LT;
      case LE -> LE;
      case GT -> GT;
      case GE -> GE;
    };
  }

  public boolean isNullCheck() {
    return this == IS_NULL || this == IS_NOT_NULL;
  }

  /**
   * Relational form of this operator.
   *
   * @throws IllegalStateException for null checks
   */
  public CompareOp relational() {
    return switch (this) {
      case EQ -> CompareOp.EQ;
      case NE -> CompareOp.NE;
      case LT -> CompareOp.LT;
      case LE -> CompareOp.LE;
      case GT -> CompareOp.GT;
      case GE -> CompareOp.GE;
      case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException(name() + " is not relational");
    };
  }
}
