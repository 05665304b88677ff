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

import ai.floedb.geoarrow.schema.GeometryKind;
import ai.floedb.geoarrow.schema.GeometryType;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Writes little-endian ISO WKB. Dimensionality comes from the value's type: an ordinate the
 * coordinates do not carry is written as {@code 0}, and an empty point as NaN ordinates.
 */
public final class IsoWkbWriter {

  private static final int HEADER_SIZE = 5;

  private IsoWkbWriter() {}

  public static byte[] write(GeometryValue value) {
    GeometryType type = value.type();
    Geometry geometry = value.geometry();
    int dimension = type.dimension();
    ByteBuffer out =
        ByteBuffer.allocate(size(geometry, dimension)).order(ByteOrder.LITTLE_ENDIAN);
    write(out, geometry, type);
    return out.array();
  }

  static GeometryKind kindOf(Geometry geometry) {
    if (geometry instanceof Point) {
      return GeometryKind.POINT;
    }
    if (geometry instanceof LineString) {
      return GeometryKind.LINESTRING;
    }
    if (geometry instanceof Polygon) {
      return GeometryKind.POLYGON;
    }
    if (geometry instanceof MultiPoint) {
      return GeometryKind.MULTIPOINT;
    }
    if (geometry instanceof MultiLineString) {
      return GeometryKind.MULTILINESTRING;
    }
    if (geometry instanceof MultiPolygon) {
      return GeometryKind.MULTIPOLYGON;
    }
    return GeometryKind.GEOMETRYCOLLECTION;
  }

  private static int size(Geometry geometry, int dimension) {
    int coordinateSize = dimension * Double.BYTES;
    return switch (kindOf(geometry)) {
      case POINT -> HEADER_SIZE + coordinateSize;
      case LINESTRING ->
          HEADER_SIZE + Integer.BYTES + geometry.getNumPoints() * coordinateSize;
      case POLYGON -> {
        Polygon polygon = (Polygon) geometry;
        int size = HEADER_SIZE + Integer.BYTES;
        if (!polygon.isEmpty()) {
          size += Integer.BYTES + polygon.getExteriorRing().getNumPoints() * coordinateSize;
          for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            size += Integer.BYTES + polygon.getInteriorRingN(i).getNumPoints() * coordinateSize;
          }
        }
        yield size;
      }
      case MULTIPOINT, MULTILINESTRING, MULTIPOLYGON, GEOMETRYCOLLECTION, UNKNOWN -> {
        int size = HEADER_SIZE + Integer.BYTES;
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
          size += size(geometry.getGeometryN(i), dimension);
        }
        yield size;
      }
    };
  }

  private static void write(ByteBuffer out, Geometry geometry, GeometryType type) {
    GeometryKind kind = kindOf(geometry);
    out.put((byte) 1);
    out.putInt(type.withKind(kind).isoCode());
    switch (kind) {
      case POINT -> {
        CoordinateSequence sequence = ((Point) geometry).getCoordinateSequence();
        if (sequence.size() == 0) {
          for (int d = 0; d < type.dimension(); d++) {
            out.putDouble(Double.NaN);
          }
        } else {
          coordinate(out, sequence, 0, type);
        }
      }
      case LINESTRING -> sequence(out, ((LineString) geometry).getCoordinateSequence(), type);
      case POLYGON -> {
        Polygon polygon = (Polygon) geometry;
        if (polygon.isEmpty()) {
          out.putInt(0);
        } else {
          out.putInt(1 + polygon.getNumInteriorRing());
          sequence(out, polygon.getExteriorRing().getCoordinateSequence(), type);
          for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            sequence(out, polygon.getInteriorRingN(i).getCoordinateSequence(), type);
          }
        }
      }
      case MULTIPOINT, MULTILINESTRING, MULTIPOLYGON, GEOMETRYCOLLECTION, UNKNOWN -> {
        GeometryCollection collection = (GeometryCollection) geometry;
        out.putInt(collection.getNumGeometries());
        for (int i = 0; i < collection.getNumGeometries(); i++) {
          write(out, collection.getGeometryN(i), type);
        }
      }
    }
  }

  private static void sequence(ByteBuffer out, CoordinateSequence sequence, GeometryType type) {
    out.putInt(sequence.size());
    for (int i = 0; i < sequence.size(); i++) {
      coordinate(out, sequence, i, type);
    }
  }

  private static void coordinate(
      ByteBuffer out, CoordinateSequence sequence, int index, GeometryType type) {
    out.putDouble(sequence.getX(index));
    out.putDouble(sequence.getY(index));
    if (type.hasZ()) {
      out.putDouble(sequence.hasZ() ? sequence.getZ(index) : 0);
    }
    if (type.hasM()) {
      out.putDouble(sequence.hasM() ? sequence.getM(index) : 0);
    }
  }
}
