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

import java.util.Locale;
import java.util.Optional;

/** Refinement of an {@link AttributeType}. */
public enum AttributeSubType {
  NONE("None"),
  BOOLEAN("Boolean"),
  INT16("Int16"),
  FLOAT32("Float32"),
  JSON("JSON"),
  UUID("UUID");

  private final String typeName;

  AttributeSubType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  public static Optional<AttributeSubType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AttributeSubType subType : values()) {
      if (subType.typeName.toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(subType);
      }
    }
    return Optional.empty();
  }
}
