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

/** Base geometry kinds, numbered as in the well-known binary type codes. */
public enum GeometryKind {
  UNKNOWN(0, "Unknown"),
  POINT(1, "Point"),
  LINESTRING(2, "LineString"),
  POLYGON(3, "Polygon"),
  MULTIPOINT(4, "MultiPoint"),
  MULTILINESTRING(5, "MultiLineString"),
  MULTIPOLYGON(6, "MultiPolygon"),
  GEOMETRYCOLLECTION(7, "GeometryCollection");

  private final int code;
  private final String displayName;

  GeometryKind(int code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  public int code() {
    return code;
  }

  public String displayName() {
    return displayName;
  }

  public static GeometryKind fromCode(int code) {
    for (GeometryKind kind : values()) {
      if (kind.code == code) {
        return kind;
      }
    }
    return UNKNOWN;
  }

  /** Returns the kind named in WKT or GeoParquet {@code geometry_types}, ignoring case. */
  public static GeometryKind fromName(String name) {
    for (GeometryKind kind : values()) {
      if (kind.displayName.equalsIgnoreCase(name)) {
        return kind;
      }
    }
    return UNKNOWN;
  }

  public GeometryKind toMulti() {
    return switch (this) {
      case POINT -> MULTIPOINT;
      case LINESTRING -> MULTILINESTRING;
      case POLYGON -> MULTIPOLYGON;
      default -> this;
    };
  }
}
