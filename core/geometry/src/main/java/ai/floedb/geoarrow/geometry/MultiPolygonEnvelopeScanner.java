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
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.locationtech.jts.geom.Envelope;

/**
 * Envelope of {@code geoarrow.multipolygon} rows computed from offsets and raw coordinates. Only
 * the first ring of each part is read: holes lie inside their shell.
 */
public final class MultiPolygonEnvelopeScanner {

  private final ListVector parts;
  private final ListVector rings;
  private final ListVector ringPoints;
  private final PointValues points;

  public MultiPolygonEnvelopeScanner(FieldVector vector, GeometryType type) {
    this.parts = (ListVector) BinaryValues.storage(vector);
    this.rings = ListOffsets.child(parts);
    this.ringPoints = ListOffsets.child(rings);
    this.points = PointValues.of((FixedSizeListVector) ringPoints.getDataVector(), type);
  }

  /**
   * Expands {@code envelope} with the outer rings of {@code row}.
   *
   * @return the number of parts of the row
   */
  public int scan(int row, Envelope envelope) {
    int firstPart = ListOffsets.start(parts, row);
    int partEnd = ListOffsets.end(parts, row);
    for (int part = firstPart; part < partEnd; part++) {
      int firstRing = ListOffsets.start(rings, part);
      if (firstRing == ListOffsets.end(rings, part)) {
        continue;
      }
      int pointEnd = ListOffsets.end(ringPoints, firstRing);
      for (int point = ListOffsets.start(ringPoints, firstRing); point < pointEnd; point++) {
        envelope.expandToInclude(points.x(point), points.y(point));
      }
    }
    return partEnd - firstPart;
  }
}
