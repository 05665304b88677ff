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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Which physical columns are materialized for a given set of ignored fields, and where each
 * attribute, geometry and the row identifier sit in a materialized batch.
 *
 * <p>A top-level column is dropped only when every attribute or geometry mapped to it is ignored.
 * The row identifier column is always kept.
 */
public final class ColumnLayout {

  private final BitSet ignoredAttributes;
  private final BitSet ignoredGeometries;
  private final List<Integer> projectedColumns;
  private final int[] attributeArrayIndex;
  private final int[] geometryArrayIndex;
  private final int fidArrayIndex;
  private final boolean consistent;
  private final boolean fullProjection;

  private ColumnLayout(
      BitSet ignoredAttributes,
      BitSet ignoredGeometries,
      List<Integer> projectedColumns,
      int[] attributeArrayIndex,
      int[] geometryArrayIndex,
      int fidArrayIndex,
      boolean consistent,
      boolean fullProjection) {
    this.ignoredAttributes = ignoredAttributes;
    this.ignoredGeometries = ignoredGeometries;
    this.projectedColumns = projectedColumns;
    this.attributeArrayIndex = attributeArrayIndex;
    this.geometryArrayIndex = geometryArrayIndex;
    this.fidArrayIndex = fidArrayIndex;
    this.consistent = consistent;
    this.fullProjection = fullProjection;
  }

  public static ColumnLayout full(LayerSchema schema) {
    return of(schema, new BitSet(), new BitSet());
  }

  public static ColumnLayout of(
      LayerSchema schema, BitSet ignoredAttributes, BitSet ignoredGeometries) {
    Objects.requireNonNull(schema, "schema");
    int columnCount = schema.physicalColumnCount();
    int[] mapped = new int[columnCount];
    int[] ignored = new int[columnCount];
    for (int i = 0; i < schema.attributeCount(); i++) {
      int column = schema.attributePath(i).column();
      mapped[column]++;
      if (ignoredAttributes.get(i)) {
        ignored[column]++;
      }
    }
    for (int i = 0; i < schema.geometryCount(); i++) {
      int column = schema.geometryField(i).column();
      mapped[column]++;
      if (ignoredGeometries.get(i)) {
        ignored[column]++;
      }
    }

    int[] columnArrayIndex = new int[columnCount];
    Arrays.fill(columnArrayIndex, -1);
    List<Integer> projected = new ArrayList<>(columnCount);
    boolean consistent = true;
    for (int column = 0; column < columnCount; column++) {
      boolean dropped =
          mapped[column] > 0 && ignored[column] == mapped[column] && column != schema.fidColumn();
      if (ignored[column] > 0 && ignored[column] < mapped[column]) {
        consistent = false;
      }
      if (!dropped) {
        columnArrayIndex[column] = projected.size();
        projected.add(column);
      }
    }

    int[] attributeIndex = new int[schema.attributeCount()];
    for (int i = 0; i < attributeIndex.length; i++) {
      attributeIndex[i] =
          ignoredAttributes.get(i) ? -1 : columnArrayIndex[schema.attributePath(i).column()];
    }
    int[] geometryIndex = new int[schema.geometryCount()];
    for (int i = 0; i < geometryIndex.length; i++) {
      geometryIndex[i] =
          ignoredGeometries.get(i) ? -1 : columnArrayIndex[schema.geometryField(i).column()];
    }
    int fidIndex = schema.fidColumn() >= 0 ? columnArrayIndex[schema.fidColumn()] : -1;
    return new ColumnLayout(
        (BitSet) ignoredAttributes.clone(),
        (BitSet) ignoredGeometries.clone(),
        List.copyOf(projected),
        attributeIndex,
        geometryIndex,
        fidIndex,
        consistent,
        projected.size() == columnCount);
  }

  /** Physical column indexes present in materialized batches, in batch order. */
  public List<Integer> projectedColumns() {
    return projectedColumns;
  }

  public boolean isFullProjection() {
    return fullProjection;
  }

  public boolean isAttributeIgnored(int attribute) {
    return ignoredAttributes.get(attribute);
  }

  public boolean isGeometryIgnored(int geometry) {
    return ignoredGeometries.get(geometry);
  }

  /** Batch column holding the attribute's top-level column, {@code -1} when not materialized. */
  public int attributeArrayIndex(int attribute) {
    return attributeArrayIndex[attribute];
  }

  public int geometryArrayIndex(int geometry) {
    return geometryArrayIndex[geometry];
  }

  public int fidArrayIndex() {
    return fidArrayIndex;
  }

  /** Whether every struct column has either all or none of its leaves ignored. */
  public boolean isConsistent() {
    return consistent;
  }
}
