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

package ai.floedb.geoarrow.geometry;

import ai.floedb.geoarrow.schema.GeometryType;
import java.nio.ByteOrder;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;

/** Interleaved point coordinates held by the innermost fixed-size list of a geoarrow column. */
final class PointValues {

  private final FieldVector values;
  private final ArrowBuf coordinates;
  private final int dimension;
  private final int measures;

  private PointValues(FieldVector values, int dimension, int measures) {
    this.values = values;
    this.coordinates = values.getDataBuffer();
    this.dimension = dimension;
    this.measures = measures;
  }

  static PointValues of(FixedSizeListVector points, GeometryType type) {
    return new PointValues(points.getDataVector(), type.dimension(), type.hasM() ? 1 : 0);
  }

  boolean isNull(int point) {
    return values.isNull(point * dimension);
  }

  double x(int point) {
    return ordinate(point, 0);
  }

  double y(int point) {
    return ordinate(point, 1);
  }

  /** Geoarrow writes an empty point as NaN coordinates. */
  boolean isEmptyPoint(int point) {
    return Double.isNaN(x(point)) && Double.isNaN(y(point));
  }

  PackedCoordinateSequence.Double empty() {
    return new PackedCoordinateSequence.Double(0, dimension, measures);
  }

  /** Copies {@code count} points starting at point {@code first}. */
  PackedCoordinateSequence.Double sequence(int first, int count) {
    if (dimension == 2) {
      double[] xy = new double[count * 2];
      if (count > 0) {
        long offset = (long) first * 2 * Float8Vector.TYPE_WIDTH;
        coordinates
            .nioBuffer(offset, xy.length * Float8Vector.TYPE_WIDTH)
            .order(ByteOrder.LITTLE_ENDIAN)
            .asDoubleBuffer()
            .get(xy);
      }
      return new PackedCoordinateSequence.Double(xy, 2, 0);
    }
    PackedCoordinateSequence.Double sequence =
        new PackedCoordinateSequence.Double(count, dimension, measures);
    for (int k = 0; k < count; k++) {
      for (int d = 0; d < dimension; d++) {
        sequence.setOrdinate(k, d, ordinate(first + k, d));
      }
    }
    return sequence;
  }

  private double ordinate(int point, int index) {
    return coordinates.getDouble(((long) point * dimension + index) * Float8Vector.TYPE_WIDTH);
  }
}
