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

/** Semantic type of an attribute field. */
public enum AttributeType {
  INTEGER("Integer"),
  INTEGER64("Integer64"),
  REAL("Real"),
  STRING("String"),
  BINARY("Binary"),
  DATE("Date"),
  TIME("Time"),
  DATETIME("DateTime"),
  INTEGER_LIST("IntegerList"),
  INTEGER64_LIST("Integer64List"),
  REAL_LIST("RealList"),
  STRING_LIST("StringList");

  private final String typeName;

  AttributeType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  public boolean isList() {
    return switch (this) {
      case INTEGER_LIST, INTEGER64_LIST, REAL_LIST, STRING_LIST -> true;
      default -> false;
    };
  }

  /** Case-insensitive lookup by the names used in schema overlays. */
  public static Optional<AttributeType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AttributeType type : values()) {
      if (type.typeName.toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
