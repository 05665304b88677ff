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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.geoarrow.filter.CompareOp;
import ai.floedb.geoarrow.filter.Expr;
import ai.floedb.geoarrow.geometry.GeometryValue;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.LayerSchemaReader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

class FeatureExpressionMatcherTest {

  private static final LayerSchema SCHEMA =
      LayerSchemaReader.read(
          new Schema(
              List.of(
                  Field.nullable("n", new ArrowType.Int(32, true)),
                  Field.nullable("name", ArrowType.Utf8.INSTANCE),
                  Field.nullable("day", new ArrowType.Date(DateUnit.DAY)))),
          null,
          true);

  private static Feature feature(long fid, Object n, Object name, Object day) {
    return new Feature(fid, new Object[] {n, name, day}, new GeometryValue[0]);
  }

  private static FeatureExpressionMatcher matcher(Expr expr) {
    return new FeatureExpressionMatcher(expr, SCHEMA);
  }

  @Test
  void orMatchesEitherSide() {
    FeatureExpressionMatcher matcher =
        matcher(
            new Expr.Or(
                Expr.compare(Expr.column("n"), CompareOp.EQ, Expr.literal(1)),
                Expr.compare(Expr.column("NAME"), CompareOp.EQ, Expr.literal("b"))));

    assertThat(matcher.matches(feature(0, 1, "a", null))).isTrue();
    assertThat(matcher.matches(feature(1, 2, "b", null))).isTrue();
    assertThat(matcher.matches(feature(2, 2, "c", null))).isFalse();
  }

  @Test
  void nullComparisonsAreUnknown() {
    Expr greater = Expr.compare(Expr.column("n"), CompareOp.GT, Expr.literal(0));

    assertThat(matcher(greater).matches(feature(0, null, "a", null))).isFalse();
    assertThat(matcher(new Expr.Not(greater)).matches(feature(0, null, "a", null))).isFalse();
    assertThat(matcher(new Expr.IsNull(Expr.column("n"))).matches(feature(0, null, "a", null)))
        .isTrue();
    assertThat(
            matcher(new Expr.Or(greater, new Expr.IsNull(Expr.column("name"))))
                .matches(feature(0, null, null, null)))
        .isTrue();
  }

  @Test
  void betweenAndFid() {
    FeatureExpressionMatcher between =
        matcher(new Expr.Between(Expr.column("n"), Expr.literal(2), Expr.literal(4.5)));
    FeatureExpressionMatcher fid =
        matcher(Expr.compare(Expr.column("fid"), CompareOp.GE, Expr.literal(10)));

    assertThat(between.matches(feature(0, 2, null, null))).isTrue();
    assertThat(between.matches(feature(0, 5, null, null))).isFalse();
    assertThat(fid.matches(feature(10, null, null, null))).isTrue();
    assertThat(fid.matches(feature(9, null, null, null))).isFalse();
  }

  @Test
  void datesCompareWithStringLiterals() {
    FeatureExpressionMatcher after =
        matcher(Expr.compare(Expr.literal("2024/01/31"), CompareOp.LT, Expr.column("day")));

    assertThat(after.matches(feature(0, null, null, LocalDate.of(2024, 2, 1)))).isTrue();
    assertThat(after.matches(feature(0, null, null, LocalDate.of(2024, 1, 31)))).isFalse();
  }

  @Test
  void mixedOperands() {
    assertThat(FeatureExpressionMatcher.compare(CompareOp.EQ, 3, 3L)).isTrue();
    assertThat(FeatureExpressionMatcher.compare(CompareOp.LT, 2.5, "3")).isTrue();
    assertThat(FeatureExpressionMatcher.compare(CompareOp.LT, 2.5, "three")).isNull();
    assertThat(
            FeatureExpressionMatcher.compare(
                CompareOp.GE,
                LocalDateTime.of(2024, 1, 31, 10, 0),
                "2024-01-31 10:00:00"))
        .isTrue();
    assertThat(FeatureExpressionMatcher.compare(CompareOp.EQ, new byte[] {1}, "1")).isNull();
  }

  @Test
  void stringsOrderByCodePoint() {
    // U+1F600 sorts after U+FF61 by code point, but its UTF-16 surrogate sorts before
    String emoji = "\uD83D\uDE00";
    String halfwidthStop = "\uFF61";

    assertThat(FeatureExpressionMatcher.compare(CompareOp.GT, emoji, halfwidthStop)).isTrue();
    assertThat(FeatureExpressionMatcher.compare(CompareOp.LT, "ab", "abc")).isTrue();
    assertThat(FeatureExpressionMatcher.compare(CompareOp.LT, "z", "\u00e9")).isTrue();
  }

  @Test
  void rejectsUnknownFields() {
    assertThatThrownBy(
            () -> matcher(Expr.compare(Expr.column("missing"), CompareOp.EQ, Expr.literal(1))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("missing");
  }
}
