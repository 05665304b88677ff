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
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * A decoded geometry together with its nominal type.
 *
 * <p>JTS does not keep dimensionality on empty geometries, so the Z and M flags travel in {@link
 * #type()}.
 */
public record GeometryValue(Geometry geometry, GeometryType type) {

  public GeometryValue {
    Objects.requireNonNull(geometry, "geometry");
    Objects.requireNonNull(type, "type");
  }

  public boolean isEmpty() {
    return geometry.isEmpty();
  }
}
