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

import ai.floedb.geoarrow.schema.GeometryFieldDefinition;
import ai.floedb.geoarrow.schema.GeometryKind;
import ai.floedb.geoarrow.schema.GeometryType;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.jboss.logging.Logger;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequences;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKTReader;

/**
 * Decodes geometry values out of Arrow columns in any supported encoding, and computes row
 * envelopes without building geometries where the encoding allows it.
 *
 * <p>Malformed values decode to {@code null}; the failure is logged at debug level.
 */
public class GeometryCodec {

  private static final Logger LOG = Logger.getLogger(GeometryCodec.class);

  static final GeometryFactory FACTORY =
      new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  /**
   * Decodes {@code row} of {@code vector}. Values are promoted to the field's multi type where
   * the field declares one, and a declared Z flag is carried over.
   *
   * @return the value, or {@code null} for a null row, an empty payload or a malformed value
   */
  public GeometryValue decode(FieldVector vector, GeometryFieldDefinition field, int row) {
    FieldVector storage = BinaryValues.storage(vector);
    if (storage.isNull(row)) {
      return null;
    }
    GeometryValue value;
    try {
      value =
          switch (field.encoding()) {
            case WKB -> decodeWkb(BinaryValues.view(storage, row));
            case WKT -> decodeWkt(BinaryValues.view(storage, row));
            case POINT -> point((FixedSizeListVector) storage, row, field.type());
            case LINESTRING -> lineString((ListVector) storage, row, field.type());
            case POLYGON -> polygon((ListVector) storage, row, field.type());
            case MULTIPOINT -> multiPoint((ListVector) storage, row, field.type());
            case MULTILINESTRING -> multiLineString((ListVector) storage, row, field.type());
            case MULTIPOLYGON -> multiPolygon((ListVector) storage, row, field.type());
          };
    } catch (IllegalArgumentException e) {
      LOG.debugf("Invalid geometry in field %s at row %d: %s", field.name(), row, e.getMessage());
      return null;
    }
    return value == null ? null : toDeclaredType(value, field.type());
  }

  /**
   * 2-D envelope of {@code row}. WKB payloads are scanned without decoding and multipolygon
   * columns are read from the outer ring of each part; other encodings are decoded.
   *
   * @return the envelope, or {@code null} for a null, empty or malformed geometry
   */
  public Envelope envelope(FieldVector vector, GeometryFieldDefinition field, int row) {
    FieldVector storage = BinaryValues.storage(vector);
    if (storage.isNull(row)) {
      return null;
    }
    Envelope envelope = new Envelope();
    return switch (field.encoding()) {
      case WKB -> {
        ByteBuffer wkb = BinaryValues.view(storage, row);
        boolean scanned = wkb.hasRemaining() && WkbEnvelopeScanner.scan(wkb, envelope);
        yield scanned && !envelope.isNull() ? envelope : null;
      }
      case MULTIPOLYGON -> {
        int parts = new MultiPolygonEnvelopeScanner(storage, field.type()).scan(row, envelope);
        yield parts > 0 && !envelope.isNull() ? envelope : null;
      }
      case WKT, POINT, LINESTRING, POLYGON, MULTIPOINT, MULTILINESTRING -> {
        GeometryValue value = decode(vector, field, row);
        yield value == null || value.isEmpty() ? null : value.geometry().getEnvelopeInternal();
      }
    };
  }

  public GeometryValue decodeWkb(byte[] wkb) {
    return decodeWkb(ByteBuffer.wrap(wkb));
  }

  GeometryValue decodeWkb(ByteBuffer wkb) {
    if (!wkb.hasRemaining()) {
      return null;
    }
    GeometryType type = GeometryTypeSurvey.wkbType(wkb).orElse(null);
    if (type == null) {
      LOG.debugf("Invalid WKB header");
      return null;
    }
    byte[] bytes = new byte[wkb.remaining()];
    wkb.duplicate().get(bytes);
    try {
      return new GeometryValue(new WKBReader(FACTORY).read(bytes), type);
    } catch (ParseException e) {
      LOG.debugf("Cannot parse WKB: %s", e.getMessage());
      return null;
    }
  }

  public GeometryValue decodeWkt(String wkt) {
    return decodeWkt(ByteBuffer.wrap(wkt.getBytes(StandardCharsets.UTF_8)));
  }

  GeometryValue decodeWkt(ByteBuffer wkt) {
    if (!wkt.hasRemaining()) {
      return null;
    }
    GeometryType type = GeometryTypeSurvey.wktType(wkt).orElse(null);
    if (type == null) {
      LOG.debugf("Invalid WKT keyword");
      return null;
    }
    String text = StandardCharsets.UTF_8.decode(wkt.duplicate()).toString();
    try {
      return new GeometryValue(new WKTReader(FACTORY).read(text), type);
    } catch (ParseException e) {
      LOG.debugf("Cannot parse WKT: %s", e.getMessage());
      return null;
    }
  }

  /** Encodes a value as little-endian ISO WKB. */
  public byte[] encodeWkb(GeometryValue value) {
    return IsoWkbWriter.write(value);
  }

  private static GeometryValue toDeclaredType(GeometryValue value, GeometryType declared) {
    Geometry geometry = value.geometry();
    GeometryType type = value.type();
    if (type.kind() == GeometryKind.LINESTRING
        && declared.kind() == GeometryKind.MULTILINESTRING) {
      geometry = FACTORY.createMultiLineString(new LineString[] {(LineString) geometry});
      type = type.withKind(GeometryKind.MULTILINESTRING);
    } else if (type.kind() == GeometryKind.POLYGON
        && declared.kind() == GeometryKind.MULTIPOLYGON) {
      geometry = FACTORY.createMultiPolygon(new Polygon[] {(Polygon) geometry});
      type = type.withKind(GeometryKind.MULTIPOLYGON);
    }
    if (declared.hasZ() && !type.hasZ()) {
      type = type.withZ(true);
    }
    return geometry == value.geometry() && type.equals(value.type())
        ? value
        : new GeometryValue(geometry, type);
  }

  private static GeometryValue point(FixedSizeListVector vector, int row, GeometryType type) {
    PointValues points = PointValues.of(vector, type);
    if (points.isNull(row)) {
      return null;
    }
    GeometryType pointType = type.withKind(GeometryKind.POINT);
    if (points.isEmptyPoint(row)) {
      return new GeometryValue(FACTORY.createPoint(points.empty()), pointType);
    }
    return new GeometryValue(FACTORY.createPoint(points.sequence(row, 1)), pointType);
  }

  private static GeometryValue lineString(ListVector lines, int row, GeometryType type) {
    PointValues points = PointValues.of((FixedSizeListVector) lines.getDataVector(), type);
    int first = ListOffsets.start(lines, row);
    int count = ListOffsets.end(lines, row) - first;
    return new GeometryValue(
        FACTORY.createLineString(lineSequence(points.sequence(first, count))),
        type.withKind(GeometryKind.LINESTRING));
  }

  private static GeometryValue polygon(ListVector polygons, int row, GeometryType type) {
    ListVector rings = ListOffsets.child(polygons);
    PointValues points = PointValues.of((FixedSizeListVector) rings.getDataVector(), type);
    int firstRing = ListOffsets.start(polygons, row);
    Polygon polygon = buildPolygon(rings, points, firstRing, ListOffsets.end(polygons, row));
    return new GeometryValue(polygon, type.withKind(GeometryKind.POLYGON));
  }

  private static GeometryValue multiPoint(ListVector multiPoints, int row, GeometryType type) {
    PointValues points = PointValues.of((FixedSizeListVector) multiPoints.getDataVector(), type);
    int first = ListOffsets.start(multiPoints, row);
    int count = ListOffsets.end(multiPoints, row) - first;
    return new GeometryValue(
        FACTORY.createMultiPoint(points.sequence(first, count)),
        type.withKind(GeometryKind.MULTIPOINT));
  }

  private static GeometryValue multiLineString(ListVector multiLines, int row, GeometryType type) {
    ListVector lines = ListOffsets.child(multiLines);
    PointValues points = PointValues.of((FixedSizeListVector) lines.getDataVector(), type);
    int firstLine = ListOffsets.start(multiLines, row);
    LineString[] parts = new LineString[ListOffsets.end(multiLines, row) - firstLine];
    for (int k = 0; k < parts.length; k++) {
      int first = ListOffsets.start(lines, firstLine + k);
      int count = ListOffsets.end(lines, firstLine + k) - first;
      parts[k] = FACTORY.createLineString(lineSequence(points.sequence(first, count)));
    }
    return new GeometryValue(
        FACTORY.createMultiLineString(parts), type.withKind(GeometryKind.MULTILINESTRING));
  }

  private static GeometryValue multiPolygon(ListVector multiPolygons, int row, GeometryType type) {
    ListVector polygons = ListOffsets.child(multiPolygons);
    ListVector rings = ListOffsets.child(polygons);
    PointValues points = PointValues.of((FixedSizeListVector) rings.getDataVector(), type);
    int firstPart = ListOffsets.start(multiPolygons, row);
    Polygon[] parts = new Polygon[ListOffsets.end(multiPolygons, row) - firstPart];
    for (int j = 0; j < parts.length; j++) {
      int part = firstPart + j;
      parts[j] =
          buildPolygon(
              rings, points, ListOffsets.start(polygons, part), ListOffsets.end(polygons, part));
    }
    return new GeometryValue(
        FACTORY.createMultiPolygon(parts), type.withKind(GeometryKind.MULTIPOLYGON));
  }

  private static Polygon buildPolygon(
      ListVector rings, PointValues points, int firstRing, int ringEnd) {
    if (firstRing == ringEnd) {
      return FACTORY.createPolygon(FACTORY.createLinearRing(points.empty()), null);
    }
    LinearRing shell = ring(rings, points, firstRing);
    LinearRing[] holes = new LinearRing[ringEnd - firstRing - 1];
    for (int k = 0; k < holes.length; k++) {
      holes[k] = ring(rings, points, firstRing + 1 + k);
    }
    return FACTORY.createPolygon(shell, holes);
  }

  private static LinearRing ring(ListVector rings, PointValues points, int ring) {
    int first = ListOffsets.start(rings, ring);
    int count = ListOffsets.end(rings, ring) - first;
    return FACTORY.createLinearRing(
        CoordinateSequences.ensureValidRing(
            FACTORY.getCoordinateSequenceFactory(), points.sequence(first, count)));
  }

  /** A lone point is repeated so the line has the two points JTS requires, as WKBReader does. */
  private static CoordinateSequence lineSequence(CoordinateSequence points) {
    if (points.size() != 1) {
      return points;
    }
    return CoordinateSequences.extend(FACTORY.getCoordinateSequenceFactory(), points, 2);
  }
}
