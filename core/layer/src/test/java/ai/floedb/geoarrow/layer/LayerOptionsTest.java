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

import org.junit.jupiter.api.Test;

class LayerOptionsTest {

  @Test
  void readsDriverKeysFromConfig() {
    LayerOptions options = LayerOptions.fromConfig("Parquet");

    assertThat(options.useBbox()).isFalse();
    assertThat(options.optimizedAttributeFilter()).isFalse();
    assertThat(options.readSchemaOverlay()).isTrue();
    assertThat(options.forceGenericStream()).isTrue();
  }

  @Test
  void unsetKeysKeepDefaults() {
    LayerOptions options = LayerOptions.fromConfig("arrow");

    assertThat(options.useBbox()).isTrue();
    assertThat(options.optimizedAttributeFilter()).isTrue();
    assertThat(options.readSchemaOverlay()).isTrue();
    assertThat(options.forceGenericStream()).isTrue();
  }

  @Test
  void missingKeyFallsBack() {
    assertThat(LayerOptions.flag("floecat.geoarrow.unknown.key", true)).isTrue();
    assertThat(LayerOptions.flag("floecat.geoarrow.unknown.key", false)).isFalse();
  }
}
