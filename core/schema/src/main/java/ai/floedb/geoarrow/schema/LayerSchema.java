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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Flattened feature schema of a layer together with the mapping of every attribute and geometry
 * back to its physical column. Immutable once built.
 */
public final class LayerSchema {

  private final Schema physicalSchema;
  private final List<AttributeDefinition> attributes;
  private final List<ColumnPath> attributePaths;
  private final List<GeometryFieldDefinition> geometryFields;
  private final List<Extent> metadataExtents;
  private final Map<String, CodedValueDomain> domains;
  private final BboxColumns bboxColumns;
  private final String fidName;
  private final int fidColumn;

  private LayerSchema(Builder builder) {
    this.physicalSchema = builder.physicalSchema;
    this.attributes = List.copyOf(builder.attributes);
    this.attributePaths = List.copyOf(builder.attributePaths);
    this.geometryFields = List.copyOf(builder.geometryFields);
    this.metadataExtents = Collections.unmodifiableList(new ArrayList<>(builder.metadataExtents));
    this.domains = Collections.unmodifiableMap(new LinkedHashMap<>(builder.domains));
    this.bboxColumns = builder.bboxColumns;
    this.fidName = builder.fidName;
    this.fidColumn = builder.fidColumn;
  }

  public static Builder builder(Schema physicalSchema) {
    return new Builder(physicalSchema);
  }

  public Schema physicalSchema() {
    return physicalSchema;
  }

  public int attributeCount() {
    return attributes.size();
  }

  public AttributeDefinition attribute(int index) {
    return attributes.get(index);
  }

  public List<AttributeDefinition> attributes() {
    return attributes;
  }

  public ColumnPath attributePath(int index) {
    return attributePaths.get(index);
  }

  /** Case-insensitive attribute lookup, {@code -1} when absent. */
  public int attributeIndex(String name) {
    for (int i = 0; i < attributes.size(); i++) {
      if (attributes.get(i).name().equalsIgnoreCase(name)) {
        return i;
      }
    }
    return -1;
  }

  public int geometryCount() {
    return geometryFields.size();
  }

  public GeometryFieldDefinition geometryField(int index) {
    return geometryFields.get(index);
  }

  public List<GeometryFieldDefinition> geometryFields() {
    return geometryFields;
  }

  public int geometryIndex(String name) {
    for (int i = 0; i < geometryFields.size(); i++) {
      if (geometryFields.get(i).name().equalsIgnoreCase(name)) {
        return i;
      }
    }
    return -1;
  }

  /** Extent advertised by layer metadata for a geometry field. */
  public Optional<Extent> metadataExtent(int geometryIndex) {
    return Optional.ofNullable(metadataExtents.get(geometryIndex));
  }

  public Map<String, CodedValueDomain> domains() {
    return domains;
  }

  public BboxColumns bboxColumns() {
    return bboxColumns;
  }

  /** Index of the physical row identifier column, {@code -1} when there is none. */
  public int fidColumn() {
    return fidColumn;
  }

  /** Name of the row identifier, from the overlay, or {@code null}. */
  public String fidName() {
    return fidName;
  }

  public int physicalColumnCount() {
    return physicalSchema.getFields().size();
  }

  /** Returns a copy with the nominal type of one geometry field replaced. */
  public LayerSchema withGeometryType(int geometryIndex, GeometryType type) {
    Builder builder = new Builder(physicalSchema);
    builder.attributes.addAll(attributes);
    builder.attributePaths.addAll(attributePaths);
    builder.geometryFields.addAll(geometryFields);
    builder.geometryFields.set(
        geometryIndex, geometryFields.get(geometryIndex).withType(type));
    builder.metadataExtents.addAll(metadataExtents);
    builder.domains.putAll(domains);
    builder.bboxColumns = bboxColumns;
    builder.fidName = fidName;
    builder.fidColumn = fidColumn;
    return new LayerSchema(builder);
  }

  /** Accumulates attributes while a physical schema is being mapped. */
  public static final class Builder {
    private final Schema physicalSchema;
    private final List<AttributeDefinition> attributes = new ArrayList<>();
    private final List<ColumnPath> attributePaths = new ArrayList<>();
    private final List<GeometryFieldDefinition> geometryFields = new ArrayList<>();
    private final List<Extent> metadataExtents = new ArrayList<>();
    private final Map<String, CodedValueDomain> domains = new LinkedHashMap<>();
    private BboxColumns bboxColumns = BboxColumns.NONE;
    private String fidName;
    private int fidColumn = -1;

    private Builder(Schema physicalSchema) {
      this.physicalSchema = Objects.requireNonNull(physicalSchema, "physicalSchema");
    }

    /** Adds an attribute and returns its index. */
    public int addAttribute(AttributeDefinition attribute, ColumnPath path) {
      attributes.add(Objects.requireNonNull(attribute, "attribute"));
      attributePaths.add(Objects.requireNonNull(path, "path"));
      return attributes.size() - 1;
    }

    public int addGeometry(GeometryFieldDefinition geometry, Extent metadataExtent) {
      geometryFields.add(Objects.requireNonNull(geometry, "geometry"));
      metadataExtents.add(metadataExtent);
      return geometryFields.size() - 1;
    }

    public void addDomain(CodedValueDomain domain) {
      domains.put(domain.name(), domain);
    }

    /** Records {@code index} when {@code name} follows the {@code bbox.*} column convention. */
    void registerBboxColumn(String name, int index) {
      bboxColumns = bboxColumns.with(name, index);
    }

    public Builder fid(String name, int column) {
      this.fidName = name;
      this.fidColumn = column;
      return this;
    }

    public Builder fidName(String name) {
      this.fidName = name;
      return this;
    }

    public int attributeCount() {
      return attributes.size();
    }

    public LayerSchema build() {
      return new LayerSchema(this);
    }
  }
}
