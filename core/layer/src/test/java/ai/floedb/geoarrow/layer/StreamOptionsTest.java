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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.geoarrow.schema.GeometryEncoding;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StreamOptionsTest {

  @Test
  void defaults() {
    StreamOptions options = StreamOptions.parse(Map.of());

    assertThat(options.wkbRequested()).isFalse();
    assertThat(options.metadataEncoding()).isEqualTo(StreamOptions.MetadataEncoding.OGC);
    assertThat(options.maxFeaturesInBatch()).isEqualTo(65536);
  }

  @Test
  void parsesKnownValues() {
    StreamOptions options =
        StreamOptions.parse(
            Map.of(
                StreamOptions.GEOMETRY_ENCODING, "wkb",
                StreamOptions.GEOMETRY_METADATA_ENCODING, "GEOARROW",
                StreamOptions.MAX_FEATURES_IN_BATCH, "10"));

    assertThat(options.wkbRequested()).isTrue();
    assertThat(options.metadataEncoding().extensionName(GeometryEncoding.WKB))
        .isEqualTo("geoarrow.wkb");
    assertThat(options.maxFeaturesInBatch()).isEqualTo(10);
  }

  @Test
  void unsupportedMetadataEncodingKeepsDefault() {
    StreamOptions options =
        StreamOptions.parse(Map.of(StreamOptions.GEOMETRY_METADATA_ENCODING, "ESRI"));

    assertThat(options.metadataEncoding()).isEqualTo(StreamOptions.MetadataEncoding.OGC);
  }

  @Test
  void rejectsInvalidValues() {
    assertThatThrownBy(() -> StreamOptions.parse(Map.of(StreamOptions.GEOMETRY_ENCODING, "WKT")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("GEOMETRY_ENCODING");
    assertThatThrownBy(
            () -> StreamOptions.parse(Map.of(StreamOptions.MAX_FEATURES_IN_BATCH, "0")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> StreamOptions.parse(Map.of(StreamOptions.MAX_FEATURES_IN_BATCH, "many")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
