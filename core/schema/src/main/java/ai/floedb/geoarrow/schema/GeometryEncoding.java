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

import java.util.Optional;

/** Physical encodings a geometry column may use. */
public enum GeometryEncoding {
  WKB(GeometryKind.UNKNOWN, -1),
  WKT(GeometryKind.UNKNOWN, -1),
  POINT(GeometryKind.POINT, 0),
  LINESTRING(GeometryKind.LINESTRING, 1),
  POLYGON(GeometryKind.POLYGON, 2),
  MULTIPOINT(GeometryKind.MULTIPOINT, 1),
  MULTILINESTRING(GeometryKind.MULTILINESTRING, 2),
  MULTIPOLYGON(GeometryKind.MULTIPOLYGON, 3);

  private final GeometryKind baseKind;
  private final int listDepth;

  GeometryEncoding(GeometryKind baseKind, int listDepth) {
    this.baseKind = baseKind;
    this.listDepth = listDepth;
  }

  public GeometryKind baseKind() {
    return baseKind;
  }

  /** Number of variable-length list levels around the point array, {@code -1} for WKB/WKT. */
  public int listDepth() {
    return listDepth;
  }

  public boolean isWellKnown() {
    return this == WKB || this == WKT;
  }

  /**
   * Maps an encoding tag, as found in {@code ARROW:extension:name} field metadata or in {@code geo}
   * layer metadata, to an encoding. Unrecognized tags yield an empty result.
   */
  public static Optional<GeometryEncoding> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return switch (tag) {
      case "WKT", "ogc.wkt", "geoarrow.wkt" -> Optional.of(WKT);
      case "WKB", "ogc.wkb", "geoarrow.wkb" -> Optional.of(WKB);
      case "geoarrow.point" -> Optional.of(POINT);
      case "geoarrow.linestring" -> Optional.of(LINESTRING);
      case "geoarrow.polygon" -> Optional.of(POLYGON);
      case "geoarrow.multipoint" -> Optional.of(MULTIPOINT);
      case "geoarrow.multilinestring" -> Optional.of(MULTILINESTRING);
      case "geoarrow.multipolygon" -> Optional.of(MULTIPOLYGON);
      default -> Optional.empty();
    };
  }
}
