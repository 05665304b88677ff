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

import java.util.List;
import java.util.Optional;

/** Axis-aligned 2-D bounding box. */
public record Extent(double minX, double minY, double maxX, double maxY) {

  /**
   * Reads a {@code bbox} metadata array: four values are {@code [minx, miny, maxx, maxy]}, six
   * values carry Z as {@code [minx, miny, minz, maxx, maxy, maxz]} and Z is dropped. Anything else,
   * or an inverted X range, is rejected.
   */
  public static Optional<Extent> fromBboxArray(List<Double> values) {
    if (values == null) {
      return Optional.empty();
    }
    Extent extent;
    if (values.size() == 4) {
      extent = new Extent(values.get(0), values.get(1), values.get(2), values.get(3));
    } else if (values.size() == 6) {
      extent = new Extent(values.get(0), values.get(1), values.get(3), values.get(4));
    } else {
      return Optional.empty();
    }
    return extent.minX <= extent.maxX ? Optional.of(extent) : Optional.empty();
  }

  public boolean intersects(Extent other) {
    return minX <= other.maxX && other.minX <= maxX && minY <= other.maxY && other.minY <= maxY;
  }

  public Extent merge(Extent other) {
    return new Extent(
        Math.min(minX, other.minX),
        Math.min(minY, other.minY),
        Math.max(maxX, other.maxX),
        Math.max(maxY, other.maxY));
  }
}
