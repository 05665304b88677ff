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

import ai.floedb.geoarrow.geometry.GeometryValue;
import java.util.Arrays;

/**
 * One materialized row.
 *
 * <p>Attribute values are {@link Integer}, {@link Long}, {@link Double}, {@link String}, {@code
 * byte[]}, {@link java.time.LocalDate}, {@link java.time.LocalTime}, {@link
 * java.time.LocalDateTime}, {@link java.time.OffsetDateTime}, {@code int[]}, {@code long[]},
 * {@code double[]} or {@code List<String>} depending on the attribute type. Null and ignored
 * fields are {@code null}.
 */
public final class Feature {

  public static final long NULL_FID = -1;

  private final long fid;
  private final Object[] values;
  private final GeometryValue[] geometries;

  Feature(long fid, Object[] values, GeometryValue[] geometries) {
    this.fid = fid;
    this.values = values;
    this.geometries = geometries;
  }

  public long fid() {
    return fid;
  }

  public int attributeCount() {
    return values.length;
  }

  public Object value(int attribute) {
    return values[attribute];
  }

  public boolean isNull(int attribute) {
    return values[attribute] == null;
  }

  public int geometryCount() {
    return geometries.length;
  }

  /** Geometry of field {@code index}, {@code null} when null or ignored. */
  public GeometryValue geometry(int index) {
    return geometries[index];
  }

  @Override
  public String toString() {
    return "Feature{fid=" + fid + ", values=" + Arrays.deepToString(values) + "}";
  }
}
