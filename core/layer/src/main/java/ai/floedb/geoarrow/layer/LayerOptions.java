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

import java.util.Locale;
import java.util.Objects;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Reader switches of one layer.
 *
 * @param readSchemaOverlay whether the {@code gdal:schema} metadata refines field types
 * @param optimizedAttributeFilter whether attribute filters are compiled to columnar constraints
 * @param useBbox whether {@code bbox.*} columns and {@code geo} metadata extents are trusted
 * @param forceGenericStream whether streaming always goes through the per-feature path
 */
public record LayerOptions(
    boolean readSchemaOverlay,
    boolean optimizedAttributeFilter,
    boolean useBbox,
    boolean forceGenericStream) {

  private static final Logger LOG = Logger.getLogger(LayerOptions.class);

  static final String PREFIX = "floecat.geoarrow.";

  public static final LayerOptions DEFAULTS = new LayerOptions(true, true, true, false);

  /**
   * Resolves the options of {@code driver} from MicroProfile Config, for instance {@code
   * floecat.geoarrow.parquet.use-bbox}. Unset keys, and every key when no configuration is
   * available, take their default.
   */
  public static LayerOptions fromConfig(String driver) {
    Objects.requireNonNull(driver, "driver");
    String prefix = PREFIX + driver.toLowerCase(Locale.ROOT) + ".";
    return new LayerOptions(
        flag(prefix + "read-gdal-schema", DEFAULTS.readSchemaOverlay),
        flag(prefix + "optimized-attribute-filter", DEFAULTS.optimizedAttributeFilter),
        flag(prefix + "use-bbox", DEFAULTS.useBbox),
        flag(PREFIX + "stream-base-impl", DEFAULTS.forceGenericStream));
  }

  public LayerOptions withUseBbox(boolean value) {
    return new LayerOptions(readSchemaOverlay, optimizedAttributeFilter, value, forceGenericStream);
  }

  public LayerOptions withOptimizedAttributeFilter(boolean value) {
    return new LayerOptions(readSchemaOverlay, value, useBbox, forceGenericStream);
  }

  public LayerOptions withForceGenericStream(boolean value) {
    return new LayerOptions(readSchemaOverlay, optimizedAttributeFilter, useBbox, value);
  }

  static boolean flag(String name, boolean defaultValue) {
    try {
      return ConfigProvider.getConfig()
          .getOptionalValue(name, Boolean.class)
          .orElse(defaultValue);
    } catch (IllegalStateException | NoClassDefFoundError e) {
      return defaultValue;
    } catch (IllegalArgumentException e) {
      LOG.warnf("Invalid value for %s, using %s: %s", name, defaultValue, e.getMessage());
      return defaultValue;
    }
  }
}
