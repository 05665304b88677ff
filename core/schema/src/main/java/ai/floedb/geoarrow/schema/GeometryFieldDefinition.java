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

/**
 * Descriptor of a geometry field.
 *
 * @param column index of the top-level physical column holding the geometry
 * @param type nominal geometry type; decoded values are promoted to it where possible
 */
public record GeometryFieldDefinition(
    String name, GeometryEncoding encoding, GeometryType type, boolean nullable, int column) {

  public GeometryFieldDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(encoding, "encoding");
    Objects.requireNonNull(type, "type");
  }

  public GeometryFieldDefinition withType(GeometryType newType) {
    return new GeometryFieldDefinition(name, encoding, newType, nullable, column);
  }
}
