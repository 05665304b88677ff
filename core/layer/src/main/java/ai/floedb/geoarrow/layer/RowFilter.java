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

import ai.floedb.geoarrow.filter.BoundConstraint;
import ai.floedb.geoarrow.filter.ConstraintEvaluator;
import ai.floedb.geoarrow.geometry.GeometryCodec;
import ai.floedb.geoarrow.geometry.GeometryValue;
import ai.floedb.geoarrow.schema.BboxColumns;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.ColumnPath;
import ai.floedb.geoarrow.schema.GeometryFieldDefinition;
import ai.floedb.geoarrow.schema.LayerSchema;
import java.util.List;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * Row admission tests shared by feature iteration and stream post-filtering.
 *
 * <p>{@link #skip} runs the cheap tests in order: null geometry, bounding box, then attribute
 * constraints. {@link #acceptsGeometry} is the exact spatial test on a decoded value.
 */
final class RowFilter {

  static final RowFilter NONE = new RowFilter(null, null, -1, null, null, List.of());

  private final GeometryCodec codec;
  private final GeometryFieldDefinition geometryField;
  private final int geometryArrayIndex;
  private final Geometry filterGeometry;
  private final Envelope filterEnvelope;
  private final boolean filterIsRectangle;
  private final BboxReader bbox;
  private final List<BoundConstraint> constraints;

  private RowFilter(
      GeometryCodec codec,
      GeometryFieldDefinition geometryField,
      int geometryArrayIndex,
      Geometry filterGeometry,
      BboxReader bbox,
      List<BoundConstraint> constraints) {
    this.codec = codec;
    this.geometryField = geometryField;
    this.geometryArrayIndex = geometryArrayIndex;
    this.filterGeometry = filterGeometry;
    this.filterEnvelope = filterGeometry == null ? null : filterGeometry.getEnvelopeInternal();
    this.filterIsRectangle = filterGeometry != null && filterGeometry.isRectangle();
    this.bbox = bbox;
    this.constraints = List.copyOf(constraints);
  }

  /**
   * Builds the filter for the current layer state.
   *
   * @param geometryIndex geometry field of the spatial filter, ignored when {@code filter} is null
   * @param useBbox whether {@code bbox.*} columns may replace the geometry envelope
   */
  static RowFilter create(
      LayerSchema schema,
      ColumnLayout layout,
      GeometryCodec codec,
      int geometryIndex,
      Geometry filter,
      boolean useBbox,
      List<BoundConstraint> constraints) {
    if (filter == null || layout.geometryArrayIndex(geometryIndex) < 0) {
      return new RowFilter(codec, null, -1, null, null, constraints);
    }
    BboxReader bbox = null;
    // The bbox columns describe the first geometry column.
    if (useBbox && geometryIndex == 0) {
      bbox = BboxReader.create(schema, layout);
    }
    return new RowFilter(
        codec,
        schema.geometryField(geometryIndex),
        layout.geometryArrayIndex(geometryIndex),
        filter,
        bbox,
        constraints);
  }

  boolean isEmpty() {
    return filterGeometry == null && constraints.isEmpty();
  }

  boolean hasSpatialFilter() {
    return filterGeometry != null;
  }

  /** Whether {@code row} fails one of the cheap tests. */
  boolean skip(VectorSchemaRoot batch, int row, long featureIndex) {
    if (filterGeometry != null) {
      FieldVector geometry = batch.getVector(geometryArrayIndex);
      if (geometry.isNull(row)) {
        return true;
      }
      Envelope envelope = bbox == null ? null : bbox.envelope(batch, row);
      if (envelope == null) {
        envelope = codec.envelope(geometry, geometryField, row);
      }
      if (envelope == null || !envelope.intersects(filterEnvelope)) {
        return true;
      }
    }
    return ConstraintEvaluator.skip(constraints, batch, row, featureIndex);
  }

  /** Exact spatial test of an already decoded geometry. */
  boolean acceptsGeometry(GeometryValue value) {
    if (filterGeometry == null) {
      return true;
    }
    if (value == null || value.isEmpty()) {
      return false;
    }
    Envelope envelope = value.geometry().getEnvelopeInternal();
    if (!envelope.intersects(filterEnvelope)) {
      return false;
    }
    if (filterIsRectangle && filterEnvelope.contains(envelope)) {
      return true;
    }
    return filterGeometry.intersects(value.geometry());
  }

  /** Decodes the filtered geometry of {@code row} and runs the exact spatial test on it. */
  boolean acceptsRow(VectorSchemaRoot batch, int row) {
    if (filterGeometry == null) {
      return true;
    }
    return acceptsGeometry(codec.decode(batch.getVector(geometryArrayIndex), geometryField, row));
  }

  int geometryArrayIndex() {
    return geometryArrayIndex;
  }

  /** Reads the four {@code bbox.*} double columns of a row. */
  static final class BboxReader {

    private final int[] arrayIndexes = new int[4];
    private final ColumnPath[] paths = new ColumnPath[4];

    private BboxReader() {}

    /** Returns {@code null} unless all four columns are materialized. */
    static BboxReader create(LayerSchema schema, ColumnLayout layout) {
      BboxColumns columns = schema.bboxColumns();
      if (!columns.isComplete()) {
        return null;
      }
      int[] attributes = {columns.minX(), columns.minY(), columns.maxX(), columns.maxY()};
      BboxReader reader = new BboxReader();
      for (int i = 0; i < attributes.length; i++) {
        int arrayIndex = layout.attributeArrayIndex(attributes[i]);
        if (arrayIndex < 0) {
          return null;
        }
        reader.arrayIndexes[i] = arrayIndex;
        reader.paths[i] = schema.attributePath(attributes[i]);
      }
      return reader;
    }

    /** Envelope from the columns, or {@code null} when one of them is null at {@code row}. */
    Envelope envelope(VectorSchemaRoot batch, int row) {
      double[] values = new double[4];
      for (int i = 0; i < values.length; i++) {
        FieldVector column = batch.getVector(arrayIndexes[i]);
        if (StructPaths.isNull(column, paths[i], row)) {
          return null;
        }
        values[i] = ((Float8Vector) StructPaths.leaf(column, paths[i])).get(row);
      }
      return new Envelope(values[0], values[2], values[1], values[3]);
    }
  }
}
