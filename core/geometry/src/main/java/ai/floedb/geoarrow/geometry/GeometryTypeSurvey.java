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

import ai.floedb.geoarrow.schema.GeometryEncoding;
import ai.floedb.geoarrow.schema.GeometryKind;
import ai.floedb.geoarrow.schema.GeometryType;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;
import org.apache.arrow.vector.FieldVector;

/** Infers the geometry type of a WKB or WKT column from the headers of its values. */
public final class GeometryTypeSurvey {

  private GeometryTypeSurvey() {}

  /**
   * Combines the types of all non-null rows. Linestrings and polygons mixed with their multi form
   * promote to the multi form; any other mix yields {@link GeometryType#UNKNOWN}.
   *
   * @return empty when no row has a readable type
   */
  public static Optional<GeometryType> survey(FieldVector vector, GeometryEncoding encoding) {
    FieldVector storage = BinaryValues.storage(vector);
    GeometryType merged = null;
    for (int row = 0; row < storage.getValueCount(); row++) {
      if (storage.isNull(row)) {
        continue;
      }
      ByteBuffer value = BinaryValues.view(storage, row);
      Optional<GeometryType> type =
          switch (encoding) {
            case WKB -> wkbType(value);
            case WKT -> wktType(value);
            case POINT, LINESTRING, POLYGON, MULTIPOINT, MULTILINESTRING, MULTIPOLYGON ->
                throw new IllegalArgumentException("Not a well-known encoding: " + encoding);
          };
      if (type.isEmpty()) {
        continue;
      }
      if (merged == null) {
        merged = type.get();
        continue;
      }
      merged = merged.merge(type.get());
      if (merged.kind() == GeometryKind.UNKNOWN) {
        return Optional.of(GeometryType.UNKNOWN);
      }
    }
    return Optional.ofNullable(merged);
  }

  /** Type named by the first five bytes of a WKB payload. */
  public static Optional<GeometryType> wkbType(ByteBuffer wkb) {
    if (wkb.remaining() < 5) {
      return Optional.empty();
    }
    int position = wkb.position();
    byte order = wkb.get(position);
    if (order != 0 && order != 1) {
      return Optional.empty();
    }
    int code =
        wkb.duplicate()
            .order(order == 1 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN)
            .getInt(position + 1);
    return Optional.of(GeometryType.fromWkbCode(code));
  }

  /** Type named by the leading keyword and dimensionality tag of a WKT value. */
  public static Optional<GeometryType> wktType(ByteBuffer wkt) {
    if (!wkt.hasRemaining()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new WktLexer(wkt).header().type());
    } catch (IOException e) {
      return Optional.empty();
    }
  }
}
