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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.geoarrow.filter.CompareOp;
import ai.floedb.geoarrow.filter.Expr;
import ai.floedb.geoarrow.geometry.GeoArrowVectors;
import ai.floedb.geoarrow.schema.GeoMetadata;
import ai.floedb.geoarrow.schema.GeometryEncodingResolver;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

class StreamExporterTest {

  private static final StreamOptions WKB =
      StreamOptions.parse(Map.of(StreamOptions.GEOMETRY_ENCODING, "WKB"));

  private BufferAllocator allocator;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator();
  }

  @AfterEach
  void tearDown() {
    allocator.close();
  }

  private VectorSchemaRoot wkbPoints(Integer[] values, String... wkt) {
    byte[][] wkb = new byte[wkt.length][];
    for (int i = 0; i < wkt.length; i++) {
      wkb[i] = GeoArrowVectors.wkbOf(wkt[i]);
    }
    return TestBatches.batch(
        TestBatches.ints(allocator, "n", values), GeoArrowVectors.wkb(allocator, "geom", wkb));
  }

  private static String extensionName(Field field) {
    return field.getMetadata().get(GeometryEncodingResolver.EXTENSION_NAME_KEY);
  }

  @Test
  void wktIsTranscodedToWkb() throws Exception {
    InMemoryBatchSource source =
        TestBatches.source(
            allocator,
            TestBatches.batch(
                GeoArrowVectors.wkt(allocator, "geom", "POINT (1 2)", null, "POINT (3 4)")));
    try (ArrowFeatureLayer layer =
        ArrowFeatureLayer.open(source, LayerOptions.DEFAULTS, allocator)) {
      assertThat(layer.testCapability(ArrowFeatureLayer.Capability.FAST_GET_ARROW_STREAM))
          .isTrue();
      BatchStream stream = layer.getArrowStream(WKB);
      assertThat(stream).isNotInstanceOf(GenericBatchStream.class);

      Field field = stream.schema().getFields().get(0);
      assertThat(field.getType()).isEqualTo(ArrowType.Binary.INSTANCE);
      assertThat(extensionName(field)).isEqualTo("ogc.wkb");

      try (ExportedBatch batch = stream.next()) {
        VarBinaryVector geom = (VarBinaryVector) batch.root().getVector(0);
        assertThat(batch.rowCount()).isEqualTo(3);
        assertThat(geom.getOffsetBuffer().getInt(0)).isZero();
        assertThat(geom.getOffsetBuffer().getInt(4)).isEqualTo(21);
        assertThat(geom.getOffsetBuffer().getInt(8)).isEqualTo(21);
        assertThat(geom.getOffsetBuffer().getInt(12)).isEqualTo(42);
        assertThat(geom.isNull(1)).isTrue();
        assertThat(geom.get(2)).isEqualTo(GeoArrowVectors.wkbOf("POINT (3 4)"));
      }
      assertThat(stream.next()).isNull();
    }
  }

  @Test
  void postFilterDropsRowsAndEmptyBatches() throws Exception {
    InMemoryBatchSource source =
        TestBatches.source(
            allocator,
            wkbPoints(new Integer[] {1, 2}, "POINT (50 50)", "POINT (60 60)"),
            wkbPoints(new Integer[] {3, 4, 5}, "POINT (1 1)", "POINT (50 50)", "POINT (2 2)"));
    try (ArrowFeatureLayer layer =
        ArrowFeatureLayer.open(source, LayerOptions.DEFAULTS, allocator)) {
      layer.setSpatialFilter(
          new GeometryFactory().toGeometry(new Envelope(0, 10, 0, 10)));
      layer.setAttributeFilter(Expr.compare(Expr.column("n"), CompareOp.NE, Expr.literal(5)));

      BatchStream stream = layer.getArrowStream(StreamOptions.defaults());
      try (ExportedBatch batch = stream.next()) {
        IntVector n = (IntVector) batch.root().getVector(0);
        assertThat(batch.rowCount()).isEqualTo(1);
        assertThat(n.get(0)).isEqualTo(3);
      }
      assertThat(stream.next()).isNull();
      assertThat(layer.cursor().state()).isEqualTo(BatchCursor.State.NO_BATCH);
    }
  }

  @Test
  void unlabeledWkbGetsGeoArrowName() throws Exception {
    VarBinaryVector geom = new VarBinaryVector("geom", allocator);
    geom.allocateNew();
    geom.setSafe(0, GeoArrowVectors.wkbOf("POINT (1 2)"));
    geom.setValueCount(1);
    String geo =
        "{\"primary_column\":\"geom\",\"columns\":{\"geom\":{\"encoding\":\"WKB\","
            + "\"geometry_types\":[\"Point\"]}}}";
    InMemoryBatchSource source =
        TestBatches.source(
            allocator, Map.of(GeoMetadata.METADATA_KEY, geo), TestBatches.batch(geom));
    StreamOptions options =
        StreamOptions.parse(Map.of(StreamOptions.GEOMETRY_METADATA_ENCODING, "GEOARROW"));
    try (ArrowFeatureLayer layer =
        ArrowFeatureLayer.open(source, LayerOptions.DEFAULTS, allocator)) {
      BatchStream stream = layer.getArrowStream(options);

      assertThat(extensionName(stream.schema().getFields().get(0))).isEqualTo("geoarrow.wkb");
      try (ExportedBatch batch = stream.next()) {
        Field exported = batch.root().getVector(0).getField();
        assertThat(extensionName(exported)).isEqualTo("geoarrow.wkb");
        assertThat(((VarBinaryVector) batch.root().getVector(0)).get(0))
            .isEqualTo(GeoArrowVectors.wkbOf("POINT (1 2)"));
      }
    }
  }

  @Test
  void exportedBatchOutlivesLayer() throws Exception {
    InMemoryBatchSource source =
        TestBatches.source(
            allocator, wkbPoints(new Integer[] {7, 8}, "POINT (1 2)", "POINT (3 4)"));
    ArrowFeatureLayer layer = ArrowFeatureLayer.open(source, LayerOptions.DEFAULTS, allocator);
    ExportedBatch batch = layer.getArrowStream(StreamOptions.defaults()).next();
    layer.close();

    assertThat(layer.sharedAllocator().isClosed()).isFalse();
    assertThat(((IntVector) batch.root().getVector(0)).get(1)).isEqualTo(8);

    batch.close();
    assertThat(batch.isReleased()).isTrue();
    assertThat(layer.sharedAllocator().isClosed()).isTrue();
  }
}
