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

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Literal of a compiled constraint, already coerced to the semantic type of the target field.
 * Every value also carries a text form, used when a string column is compared with a numeric
 * constraint or a numeric column with a string constraint.
 */
public final class ConstraintValue {

  /** Semantic type the literal was coerced to. */
  public enum Kind {
    INTEGER,
    INTEGER64,
    REAL,
    STRING
  }

  private final Kind kind;
  private final long integerValue;
  private final double realValue;
  private final String text;
  private final byte[] textBytes;

  private ConstraintValue(Kind kind, long integerValue, double realValue, String text) {
    this.kind = kind;
    this.integerValue = integerValue;
    this.realValue = realValue;
    this.text = text;
    this.textBytes = text.getBytes(StandardCharsets.UTF_8);
  }

  public static ConstraintValue ofInteger(int value) {
    return new ConstraintValue(Kind.INTEGER, value, value, Integer.toString(value));
  }

  public static ConstraintValue ofInteger64(long value) {
    return new ConstraintValue(Kind.INTEGER64, value, value, Long.toString(value));
  }

  public static ConstraintValue ofReal(double value) {
    return new ConstraintValue(Kind.REAL, (long) value, value, formatReal(value));
  }

  public static ConstraintValue ofString(String value) {
    Objects.requireNonNull(value, "value");
    return new ConstraintValue(Kind.STRING, 0, Double.NaN, value);
  }

  /** Fixed six-decimal rendering used wherever a real is compared as text. */
  public static String formatReal(double value) {
    return String.format(Locale.ROOT, "%f", value);
  }

  public Kind kind() {
    return kind;
  }

  /** Integer value for {@link Kind#INTEGER} and {@link Kind#INTEGER64}. */
  public long integerValue() {
    return integerValue;
  }

  public double realValue() {
    return realValue;
  }

  public String text() {
    return text;
  }

  byte[] textBytes() {
    return textBytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConstraintValue other)) {
      return false;
    }
    return kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @Override
  public String toString() {
    return kind == Kind.STRING ? "'" + text + "'" : text;
  }
}
