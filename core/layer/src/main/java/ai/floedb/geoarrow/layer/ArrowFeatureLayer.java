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

import ai.floedb.geoarrow.filter.BoundConstraint;
import ai.floedb.geoarrow.filter.CompiledFilter;
import ai.floedb.geoarrow.filter.ConstraintCompiler;
import ai.floedb.geoarrow.filter.Expr;
import ai.floedb.geoarrow.geometry.GeometryCodec;
import ai.floedb.geoarrow.geometry.GeometryTypeSurvey;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.Extent;
import ai.floedb.geoarrow.schema.GeometryFieldDefinition;
import ai.floedb.geoarrow.schema.GeometryKind;
import ai.floedb.geoarrow.schema.GeometryType;
import ai.floedb.geoarrow.schema.LayerSchema;
import ai.floedb.geoarrow.schema.LayerSchemaReader;
import java.io.IOException;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.jboss.logging.Logger;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * Feature layer over the record batches of a {@link BatchSource}.
 *
 * <p>Features are read row by row through a {@link BatchCursor}, or streamed batch by batch with
 * {@link #getArrowStream(StreamOptions)}. Spatial and attribute filters apply to both. The layer
 * owns its source and is meant for use by one thread at a time.
 */
public class ArrowFeatureLayer implements AutoCloseable {

  private static final Logger LOG = Logger.getLogger(ArrowFeatureLayer.class);

  /** Name accepted by {@link #setIgnoredFields} for the first geometry field. */
  public static final String DEFAULT_GEOMETRY_NAME = "OGR_GEOMETRY";

  public enum Capability {
    /** Every geometry field has an extent without scanning batches. */
    FAST_GET_EXTENT,
    /** {@link #getArrowStream(StreamOptions)} exports loaded batches directly. */
    FAST_GET_ARROW_STREAM,
    IGNORE_FIELDS,
    STRINGS_AS_UTF8
  }

  private final BatchSource source;
  private final LayerSchema schema;
  private final LayerOptions options;
  private final GeometryCodec codec;
  private final SharedAllocator allocator;
  private final BatchCursor cursor;
  private final Extent[] extents;

  private ColumnLayout layout;
  private FeatureReader reader;
  private CompiledFilter compiledFilter = CompiledFilter.NONE;
  private List<BoundConstraint> boundConstraints = List.of();
  private FeatureExpressionMatcher matcher;
  private boolean attributeFilterInstalled;
  private Geometry spatialFilter;
  private int spatialFilterField = -1;
  private boolean spatialFilterMayMatch = true;
  private RowFilter rowFilter = RowFilter.NONE;
  private boolean closed;

  private ArrowFeatureLayer(
      BatchSource source,
      LayerSchema schema,
      LayerOptions options,
      BufferAllocator allocator,
      GeometryCodec codec) {
    this.source = source;
    this.schema = schema;
    this.options = options;
    this.codec = codec;
    this.allocator = new SharedAllocator(allocator, "geoarrow-layer");
    this.cursor = new BatchCursor(source);
    this.extents = new Extent[schema.geometryCount()];
    applyLayout(ColumnLayout.full(schema));
  }

  /**
   * Opens a layer. The schema is read from the source; WKB and WKT geometry fields without a
   * declared type are typed from the first batch.
   *
   * @param allocator parent of the allocator exported batches are allocated from; must share its
   *     root allocator with the source's batches
   */
  public static ArrowFeatureLayer open(
      BatchSource source, LayerOptions options, BufferAllocator allocator) throws IOException {
    return open(source, options, allocator, new GeometryCodec());
  }

  static ArrowFeatureLayer open(
      BatchSource source, LayerOptions options, BufferAllocator allocator, GeometryCodec codec)
      throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(allocator, "allocator");
    LayerSchema schema =
        LayerSchemaReader.read(source.schema(), source.dictionaries(), options.readSchemaOverlay());
    schema = surveyGeometryTypes(schema, source);
    return new ArrowFeatureLayer(source, schema, options, allocator, codec);
  }

  private static LayerSchema surveyGeometryTypes(LayerSchema schema, BatchSource source)
      throws IOException {
    ColumnarBatch first = null;
    try {
      for (int i = 0; i < schema.geometryCount(); i++) {
        GeometryFieldDefinition field = schema.geometryField(i);
        if (!field.encoding().isWellKnown() || field.type().kind() != GeometryKind.UNKNOWN) {
          continue;
        }
        if (first == null) {
          first = source.next();
          if (first == null) {
            break;
          }
        }
        FieldVector vector = first.root().getVector(field.column());
        Optional<GeometryType> type = GeometryTypeSurvey.survey(vector, field.encoding());
        if (type.isPresent()) {
          LOG.debugf("Geometry field %s typed as %s from first batch", field.name(), type.get());
          schema = schema.withGeometryType(i, type.get());
        }
      }
    } finally {
      if (first != null) {
        first.close();
        source.rewind();
      }
    }
    return schema;
  }

  public LayerSchema schema() {
    return schema;
  }

  public ColumnLayout layout() {
    return layout;
  }

  /**
   * Marks attribute and geometry fields as not materialized, replacing any previous set. Columns
   * whose fields are all ignored are no longer read. Resets reading.
   *
   * @throws IllegalArgumentException when a name matches no field
   */
  public void setIgnoredFields(Collection<String> names) {
    ensureOpen();
    BitSet attributes = new BitSet();
    BitSet geometries = new BitSet();
    for (String name : names) {
      int attribute = schema.attributeIndex(name);
      if (attribute >= 0) {
        attributes.set(attribute);
        continue;
      }
      int geometry = schema.geometryIndex(name);
      if (geometry < 0 && name.equalsIgnoreCase(DEFAULT_GEOMETRY_NAME)) {
        geometry = schema.geometryCount() > 0 ? 0 : -1;
      }
      if (geometry < 0) {
        throw new IllegalArgumentException("Unknown field: " + name);
      }
      geometries.set(geometry);
    }
    applyLayout(ColumnLayout.of(schema, attributes, geometries));
    cursor.invalidate();
  }

  private void applyLayout(ColumnLayout newLayout) {
    layout = newLayout;
    source.project(layout.projectedColumns());
    reader = new FeatureReader(schema, layout, codec);
    boundConstraints = ConstraintCompiler.bind(compiledFilter, schema, layout);
    rebuildRowFilter();
  }

  public void setSpatialFilter(Geometry filter) {
    setSpatialFilter(0, filter);
  }

  /**
   * Installs a spatial filter on a geometry field, or removes it when {@code filter} is null.
   * Resets reading.
   */
  public void setSpatialFilter(int geometryIndex, Geometry filter) {
    ensureOpen();
    if (filter != null) {
      Objects.checkIndex(geometryIndex, schema.geometryCount());
    }
    if (spatialFilter != null) {
      cursor.invalidate();
    }
    spatialFilter = filter;
    spatialFilterField = filter == null ? -1 : geometryIndex;
    spatialFilterMayMatch = true;
    if (filter != null) {
      Optional<Extent> extent = fastExtent(geometryIndex);
      if (extent.isPresent()) {
        Envelope envelope = filter.getEnvelopeInternal();
        spatialFilterMayMatch =
            !envelope.isNull()
                && extent
                    .get()
                    .intersects(
                        new Extent(
                            envelope.getMinX(),
                            envelope.getMinY(),
                            envelope.getMaxX(),
                            envelope.getMaxY()));
      }
      if (layout.isGeometryIgnored(geometryIndex)) {
        LOG.debugf(
            "Spatial filter on ignored geometry field %s is not applied",
            schema.geometryField(geometryIndex).name());
      }
    }
    rebuildRowFilter();
    resetReading();
  }

  /**
   * Installs an attribute filter, or removes it when {@code filter} is null. Comparisons and null
   * checks joined by a top-level {@code AND} are evaluated on the batch columns; anything else is
   * evaluated on materialized features. Resets reading.
   *
   * @throws IllegalArgumentException when the filter references an unknown field
   */
  public void setAttributeFilter(Expr filter) {
    ensureOpen();
    FeatureExpressionMatcher newMatcher =
        filter == null ? null : new FeatureExpressionMatcher(filter, schema);
    if (attributeFilterInstalled) {
      cursor.invalidate();
    }
    attributeFilterInstalled = filter != null;
    if (filter == null) {
      compiledFilter = CompiledFilter.NONE;
    } else if (options.optimizedAttributeFilter()) {
      compiledFilter = ConstraintCompiler.compile(filter, schema);
    } else {
      compiledFilter = new CompiledFilter(List.of(), false);
    }
    matcher = compiledFilter.complete() ? null : newMatcher;
    boundConstraints = ConstraintCompiler.bind(compiledFilter, schema, layout);
    rebuildRowFilter();
    resetReading();
  }

  private void rebuildRowFilter() {
    rowFilter =
        RowFilter.create(
            schema,
            layout,
            codec,
            spatialFilterField,
            spatialFilter,
            options.useBbox(),
            boundConstraints);
  }

  public void resetReading() {
    ensureOpen();
    cursor.reset();
  }

  /** Returns the next feature passing the installed filters, or {@code null} at the end. */
  public Feature nextFeature() throws IOException {
    ensureOpen();
    if (!spatialFilterMayMatch) {
      return null;
    }
    BatchCursor.RowTest test = rowFilter.isEmpty() ? null : rowFilter::skip;
    while (cursor.advance(test)) {
      Feature feature = reader.read(cursor.root(), cursor.row(), cursor.featureIndex());
      cursor.consume();
      if (rowFilter.hasSpatialFilter()
          && !rowFilter.acceptsGeometry(feature.geometry(spatialFilterField))) {
        continue;
      }
      if (matcher != null && !matcher.matches(feature)) {
        continue;
      }
      return feature;
    }
    return null;
  }

  /**
   * Extent of a geometry field: the computed extent when there is one, then the {@code geo}
   * metadata bounding box. With {@code force}, every batch is scanned otherwise and the result is
   * kept; reading restarts afterwards.
   */
  public Optional<Extent> getExtent(int geometryIndex, boolean force) throws IOException {
    ensureOpen();
    Objects.checkIndex(geometryIndex, schema.geometryCount());
    Optional<Extent> fast = fastExtent(geometryIndex);
    if (fast.isPresent() || !force) {
      return fast;
    }
    GeometryFieldDefinition field = schema.geometryField(geometryIndex);
    int arrayIndex = layout.geometryArrayIndex(geometryIndex);
    if (arrayIndex < 0) {
      LOG.debugf("Geometry field %s is ignored, its extent cannot be computed", field.name());
      return Optional.empty();
    }

    Envelope total = new Envelope();
    cursor.invalidate();
    try {
      BatchCursor.Slice slice;
      while ((slice = cursor.takeRemaining()) != null) {
        FieldVector vector = slice.root().getVector(arrayIndex);
        int end = slice.offset() + slice.length();
        for (int row = slice.offset(); row < end; row++) {
          Envelope envelope = codec.envelope(vector, field, row);
          if (envelope != null) {
            total.expandToInclude(envelope);
          }
        }
      }
    } finally {
      cursor.invalidate();
    }
    if (total.isNull()) {
      return Optional.empty();
    }
    Extent extent = new Extent(total.getMinX(), total.getMinY(), total.getMaxX(), total.getMaxY());
    extents[geometryIndex] = extent;
    return Optional.of(extent);
  }

  private Optional<Extent> fastExtent(int geometryIndex) {
    if (extents[geometryIndex] != null) {
      return Optional.of(extents[geometryIndex]);
    }
    return options.useBbox() ? schema.metadataExtent(geometryIndex) : Optional.empty();
  }

  public boolean testCapability(Capability capability) {
    return switch (capability) {
      case FAST_GET_EXTENT -> {
        for (int i = 0; i < schema.geometryCount(); i++) {
          if (fastExtent(i).isEmpty()) {
            yield false;
          }
        }
        yield true;
      }
      case FAST_GET_ARROW_STREAM ->
          !options.forceGenericStream()
              && new StreamExporter(this).canExport(StreamOptions.defaults());
      case IGNORE_FIELDS, STRINGS_AS_UTF8 -> true;
    };
  }

  /**
   * Streams the features passing the installed filters as Arrow batches, from the first row.
   * Batches are exported as loaded when {@link StreamExporter} supports the request, and rebuilt
   * from features otherwise.
   */
  public BatchStream getArrowStream(StreamOptions streamOptions) throws IOException {
    ensureOpen();
    Objects.requireNonNull(streamOptions, "streamOptions");
    resetReading();
    FastPath fastPath = new StreamExporter(this);
    if (!options.forceGenericStream() && fastPath.canExport(streamOptions)) {
      return fastPath.open(streamOptions);
    }
    LOG.debugf("Streaming through materialized features");
    return new GenericBatchStream(this::nextFeature, schema, layout, streamOptions, allocator);
  }

  BatchCursor cursor() {
    return cursor;
  }

  RowFilter rowFilter() {
    return rowFilter;
  }

  SharedAllocator sharedAllocator() {
    return allocator;
  }

  boolean hasFilters() {
    return spatialFilter != null || attributeFilterInstalled;
  }

  /** Whether the installed filters can be applied to whole batches. */
  boolean canPostFilter() {
    return matcher == null;
  }

  boolean spatialFilterMayMatch() {
    return spatialFilterMayMatch;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Layer is closed");
    }
  }

  /** Closes the source. Batches already exported stay valid until they are closed. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      cursor.close();
      source.close();
    } finally {
      allocator.release();
    }
  }
}
