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

import java.util.Objects;

/** A geometry kind together with its Z and M dimensionality flags. */
public record GeometryType(GeometryKind kind, boolean hasZ, boolean hasM) {

  public static final GeometryType UNKNOWN = new GeometryType(GeometryKind.UNKNOWN, false, false);

  private static final int EWKB_Z = 0x80000000;
  private static final int EWKB_M = 0x40000000;
  private static final int EWKB_SRID = 0x20000000;

  public GeometryType {
    Objects.requireNonNull(kind, "kind");
  }

  public static GeometryType of(GeometryKind kind) {
    return new GeometryType(kind, false, false);
  }

  /** Decodes an ISO (1000/2000/3000 offsets) or extended (high bit flags) WKB type code. */
  public static GeometryType fromWkbCode(int code) {
    boolean hasZ = (code & EWKB_Z) != 0;
    boolean hasM = (code & EWKB_M) != 0;
    int base = code & ~(EWKB_Z | EWKB_M | EWKB_SRID);
    int iso = base / 1000;
    base = base % 1000;
    if (iso == 1 || iso == 3) {
      hasZ = true;
    }
    if (iso == 2 || iso == 3) {
      hasM = true;
    }
    return new GeometryType(GeometryKind.fromCode(base), hasZ, hasM);
  }

  /** ISO well-known binary code, e.g. {@code 3006} for a multipolygon with Z and M. */
  public int isoCode() {
    return kind.code() + (hasZ ? 1000 : 0) + (hasM ? 2000 : 0);
  }

  public int dimension() {
    return 2 + (hasZ ? 1 : 0) + (hasM ? 1 : 0);
  }

  public GeometryType withKind(GeometryKind newKind) {
    return new GeometryType(newKind, hasZ, hasM);
  }

  public GeometryType withZ(boolean z) {
    return new GeometryType(kind, z, hasM);
  }

  /**
   * Combines the type of another geometry seen in the same column. Linestrings and polygons mixed
   * with their multi form yield the multi form, other mixes yield {@link GeometryKind#UNKNOWN}.
   * Dimensionality flags are or-ed.
   */
  public GeometryType merge(GeometryType other) {
    GeometryKind merged = kind;
    if (kind != other.kind) {
      if (isLineFamily(kind) && isLineFamily(other.kind)) {
        merged = GeometryKind.MULTILINESTRING;
      } else if (isPolygonFamily(kind) && isPolygonFamily(other.kind)) {
        merged = GeometryKind.MULTIPOLYGON;
      } else {
        merged = GeometryKind.UNKNOWN;
      }
    }
    return new GeometryType(merged, hasZ || other.hasZ, hasM || other.hasM);
  }

  private static boolean isLineFamily(GeometryKind kind) {
    return kind == GeometryKind.LINESTRING || kind == GeometryKind.MULTILINESTRING;
  }

  private static boolean isPolygonFamily(GeometryKind kind) {
    return kind == GeometryKind.POLYGON || kind == GeometryKind.MULTIPOLYGON;
  }

  @Override
  public String toString() {
    String suffix = hasZ && hasM ? " ZM" : hasZ ? " Z" : hasM ? " M" : "";
    return kind.displayName() + suffix;
  }
}
