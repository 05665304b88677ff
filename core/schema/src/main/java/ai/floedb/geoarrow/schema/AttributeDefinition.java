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
 * Descriptor of one flattened attribute field.
 *
 * @param width declared width, {@code 0} when unset
 * @param precision declared precision, {@code 0} when unset
 * @param domainName name of the coded-value domain, or {@code null}
 * @param timeZoneFlag {@link TimeZoneFlags} value for date-time fields
 */
public record AttributeDefinition(
    String name,
    AttributeType type,
    AttributeSubType subType,
    int width,
    int precision,
    boolean nullable,
    String domainName,
    String alternativeName,
    String comment,
    int timeZoneFlag) {

  public AttributeDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(subType, "subType");
  }

  public static Builder builder(String name, AttributeType type) {
    return new Builder(name, type);
  }

  public Builder toBuilder() {
    Builder builder = new Builder(name, type);
    builder.subType = subType;
    builder.width = width;
    builder.precision = precision;
    builder.nullable = nullable;
    builder.domainName = domainName;
    builder.alternativeName = alternativeName;
    builder.comment = comment;
    builder.timeZoneFlag = timeZoneFlag;
    return builder;
  }

  /** Mutable builder used while a schema is being mapped. */
  public static final class Builder {
    private final String name;
    private AttributeType type;
    private AttributeSubType subType = AttributeSubType.NONE;
    private int width;
    private int precision;
    private boolean nullable = true;
    private String domainName;
    private String alternativeName;
    private String comment;
    private int timeZoneFlag = TimeZoneFlags.UNKNOWN;

    private Builder(String name, AttributeType type) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
    }

    public AttributeType type() {
      return type;
    }

    public AttributeSubType subType() {
      return subType;
    }

    public Builder type(AttributeType type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    public Builder subType(AttributeSubType subType) {
      this.subType = Objects.requireNonNull(subType, "subType");
      return this;
    }

    public Builder width(int width) {
      this.width = width;
      return this;
    }

    public Builder precision(int precision) {
      this.precision = precision;
      return this;
    }

    public Builder nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder domainName(String domainName) {
      this.domainName = domainName;
      return this;
    }

    public Builder alternativeName(String alternativeName) {
      this.alternativeName = alternativeName;
      return this;
    }

    public Builder comment(String comment) {
      this.comment = comment;
      return this;
    }

    public Builder timeZoneFlag(int timeZoneFlag) {
      this.timeZoneFlag = timeZoneFlag;
      return this;
    }

    public AttributeDefinition build() {
      return new AttributeDefinition(
          name,
          type,
          subType,
          width,
          precision,
          nullable,
          domainName,
          alternativeName,
          comment,
          timeZoneFlag);
    }
  }
}
