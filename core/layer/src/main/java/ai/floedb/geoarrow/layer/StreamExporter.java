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

import ai.floedb.geoarrow.geometry.WkbColumnTranscoder;
import ai.floedb.geoarrow.schema.ColumnLayout;
import ai.floedb.geoarrow.schema.GeometryEncoding;
import ai.floedb.geoarrow.schema.GeometryEncodingResolver;
import ai.floedb.geoarrow.schema.GeometryFieldDefinition;
import ai.floedb.geoarrow.schema.LayerSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.TransferPair;
import org.jboss.logging.Logger;

/**
 * Exports the loaded batches of a layer without rebuilding them row by row.
 *
 * <p>Each batch is sliced into the layer allocator, compacted to the rows passing the installed
 * filters, and has its WKT columns re-encoded when WKB is requested. Usable when every
 * non-ignored geometry can be delivered in the requested encoding, the column layout is
 * consistent and the filters can be applied to whole batches.
 */
final class StreamExporter implements FastPath {

  private static final Logger LOG = Logger.getLogger(StreamExporter.class);

  private final ArrowFeatureLayer layer;
  private final LayerSchema schema;
  private final ColumnLayout layout;

  StreamExporter(ArrowFeatureLayer layer) {
    this.layer = layer;
    this.schema = layer.schema();
    this.layout = layer.layout();
  }

  @Override
  public boolean canExport(StreamOptions options) {
    if (options.wkbRequested()) {
      for (int i = 0; i < schema.geometryCount(); i++) {
        GeometryFieldDefinition field = schema.geometryField(i);
        if (!layout.isGeometryIgnored(i) && !field.encoding().isWellKnown()) {
          LOG.debugf("Geometry field %s cannot be exported as WKB in place", field.name());
          return false;
        }
      }
    }
    if (!layout.isConsistent()) {
      LOG.debugf("Struct columns are partially ignored");
      return false;
    }
    return layer.canPostFilter();
  }

  @Override
  public BatchStream open(StreamOptions options) {
    if (!canExport(options)) {
      throw new IllegalStateException("Layer batches cannot be exported in place");
    }
    return new Stream(options);
  }

  /**
   * Field of an exported column. WKT becomes binary when WKB is requested and well-known geometry
   * columns without an extension name get one.
   */
  static Field exportField(
      Field physical, GeometryFieldDefinition geometry, StreamOptions options) {
    if (geometry == null || !geometry.encoding().isWellKnown()) {
      return physical;
    }
    String key = GeometryEncodingResolver.EXTENSION_NAME_KEY;
    if (geometry.encoding() == GeometryEncoding.WKT && options.wkbRequested()) {
      String name = options.metadataEncoding().extensionName(GeometryEncoding.WKB);
      return new Field(
          physical.getName(),
          new FieldType(physical.isNullable(), ArrowType.Binary.INSTANCE, null, Map.of(key, name)),
          null);
    }
    if (GeometryEncodingResolver.extensionName(physical).isPresent()) {
      return physical;
    }
    Map<String, String> metadata = new HashMap<>();
    if (physical.getMetadata() != null) {
      metadata.putAll(physical.getMetadata());
    }
    metadata.put(key, options.metadataEncoding().extensionName(geometry.encoding()));
    return new Field(
        physical.getName(),
        new FieldType(
            physical.isNullable(), physical.getType(), physical.getDictionary(), metadata),
        physical.getChildren());
  }

  private final class Stream implements BatchStream {

    private final StreamOptions options;
    private final Schema exportSchema;
    private final GeometryFieldDefinition[] geometryByColumn;
    private boolean eof;

    Stream(StreamOptions options) {
      this.options = options;
      List<Integer> columns = layout.projectedColumns();
      this.geometryByColumn = new GeometryFieldDefinition[columns.size()];
      for (int i = 0; i < schema.geometryCount(); i++) {
        int arrayIndex = layout.geometryArrayIndex(i);
        if (arrayIndex >= 0) {
          geometryByColumn[arrayIndex] = schema.geometryField(i);
        }
      }
      List<Field> fields = new ArrayList<>(columns.size());
      for (int j = 0; j < columns.size(); j++) {
        Field physical = schema.physicalSchema().getFields().get(columns.get(j));
        fields.add(exportField(physical, geometryByColumn[j], options));
      }
      this.exportSchema = new Schema(fields);
    }

    @Override
    public Schema schema() {
      return exportSchema;
    }

    @Override
    public ExportedBatch next() throws IOException {
      if (eof) {
        return null;
      }
      if (!layer.spatialFilterMayMatch()) {
        eof = true;
        return null;
      }
      BufferAllocator allocator = layer.sharedAllocator().allocator();
      while (true) {
        BatchCursor.Slice slice = layer.cursor().takeRemaining();
        if (slice == null) {
          eof = true;
          if (layer.hasFilters()) {
            layer.cursor().invalidate();
          }
          return null;
        }
        VectorSchemaRoot root = split(slice, allocator);
        try {
          VectorSchemaRoot filtered =
              BatchPostFilter.filter(
                  root, layer.rowFilter(), slice.firstFeatureIndex(), allocator);
          if (filtered != root) {
            root.close();
            root = filtered;
          }
          if (root.getRowCount() > 0) {
            root = encodeGeometries(root, allocator);
            VectorSchemaRoot exported = root;
            ReleaseHandle handle =
                ReleaseHandle.of(exported::close).wrap(layer.sharedAllocator().lease());
            root = null;
            return new ExportedBatch(exported, handle);
          }
        } finally {
          if (root != null) {
            root.close();
          }
        }
      }
    }

    /** Zero-copy view of the slice's rows, accounted to {@code allocator}. */
    private VectorSchemaRoot split(BatchCursor.Slice slice, BufferAllocator allocator) {
      List<FieldVector> vectors = new ArrayList<>();
      try {
        for (FieldVector vector : slice.root().getFieldVectors()) {
          TransferPair pair = vector.getTransferPair(allocator);
          pair.splitAndTransfer(slice.offset(), slice.length());
          vectors.add((FieldVector) pair.getTo());
        }
      } catch (RuntimeException e) {
        vectors.forEach(FieldVector::close);
        throw e;
      }
      VectorSchemaRoot root = new VectorSchemaRoot(vectors);
      root.setRowCount(slice.length());
      return root;
    }

    /**
     * Replaces geometry columns whose field changes on export. Replaced vectors are closed and
     * the others move to the returned root. On failure the vectors created so far are closed.
     */
    private VectorSchemaRoot encodeGeometries(VectorSchemaRoot root, BufferAllocator allocator)
        throws IOException {
      List<FieldVector> vectors = new ArrayList<>(root.getFieldVectors());
      List<FieldVector> created = new ArrayList<>();
      try {
        for (int j = 0; j < vectors.size(); j++) {
          GeometryFieldDefinition geometry = geometryByColumn[j];
          Field target = exportSchema.getFields().get(j);
          FieldVector vector = vectors.get(j);
          if (geometry == null || target.equals(vector.getField())) {
            continue;
          }
          FieldVector replacement;
          if (geometry.encoding() == GeometryEncoding.WKT && options.wkbRequested()) {
            replacement = WkbColumnTranscoder.transcode(vector, target, allocator);
          } else {
            replacement = target.createVector(allocator);
            vector.makeTransferPair(replacement).transfer();
          }
          created.add(replacement);
          vectors.set(j, replacement);
        }
      } catch (IOException | RuntimeException e) {
        created.forEach(FieldVector::close);
        throw e;
      }
      if (created.isEmpty()) {
        return root;
      }
      for (int j = 0; j < vectors.size(); j++) {
        if (vectors.get(j) != root.getVector(j)) {
          root.getVector(j).close();
        }
      }
      VectorSchemaRoot encoded = new VectorSchemaRoot(vectors);
      encoded.setRowCount(root.getRowCount());
      return encoded;
    }

    @Override
    public void close() {
      eof = true;
    }
  }
}
