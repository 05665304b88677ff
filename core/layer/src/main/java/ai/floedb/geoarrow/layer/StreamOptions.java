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

import ai.floedb.geoarrow.schema.GeometryEncoding;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/** Options of {@link ArrowFeatureLayer#getArrowStream(StreamOptions)}. */
public final class StreamOptions {

  private static final Logger LOG = Logger.getLogger(StreamOptions.class);

  public static final String GEOMETRY_ENCODING = "GEOMETRY_ENCODING";
  public static final String GEOMETRY_METADATA_ENCODING = "GEOMETRY_METADATA_ENCODING";
  public static final String MAX_FEATURES_IN_BATCH = "MAX_FEATURES_IN_BATCH";

  public static final int DEFAULT_MAX_FEATURES_IN_BATCH = 65536;

  /** Naming convention of the extension name written on exported geometry columns. */
  public enum MetadataEncoding {
    OGC("ogc"),
    GEOARROW("geoarrow");

    private final String prefix;

    MetadataEncoding(String prefix) {
      this.prefix = prefix;
    }

    /** Extension name for a well-known encoding, e.g. {@code ogc.wkb}. */
    public String extensionName(GeometryEncoding encoding) {
      return switch (encoding) {
        case WKB -> prefix + ".wkb";
        case WKT -> prefix + ".wkt";
        case POINT, LINESTRING, POLYGON, MULTIPOINT, MULTILINESTRING, MULTIPOLYGON ->
            throw new IllegalArgumentException("Not a well-known encoding: " + encoding);
      };
    }
  }

  private static final StreamOptions DEFAULTS =
      new StreamOptions(false, MetadataEncoding.OGC, DEFAULT_MAX_FEATURES_IN_BATCH);

  private final boolean wkbRequested;
  private final MetadataEncoding metadataEncoding;
  private final int maxFeaturesInBatch;

  private StreamOptions(
      boolean wkbRequested, MetadataEncoding metadataEncoding, int maxFeaturesInBatch) {
    this.wkbRequested = wkbRequested;
    this.metadataEncoding = metadataEncoding;
    this.maxFeaturesInBatch = maxFeaturesInBatch;
  }

  public static StreamOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Parses {@code KEY=VALUE} style options. Keys are matched exactly, values ignoring case.
   *
   * @throws IllegalArgumentException for an unsupported geometry encoding or batch size
   */
  public static StreamOptions parse(Map<String, String> options) {
    boolean wkb = false;
    String encoding = options.get(GEOMETRY_ENCODING);
    if (encoding != null && !encoding.isEmpty()) {
      if (!encoding.equalsIgnoreCase("WKB")) {
        throw new IllegalArgumentException("Unsupported GEOMETRY_ENCODING value: " + encoding);
      }
      wkb = true;
    }

    MetadataEncoding metadata = MetadataEncoding.OGC;
    String metadataValue = options.get(GEOMETRY_METADATA_ENCODING);
    if (metadataValue != null) {
      switch (metadataValue.toUpperCase(Locale.ROOT)) {
        case "OGC" -> metadata = MetadataEncoding.OGC;
        case "GEOARROW" -> metadata = MetadataEncoding.GEOARROW;
        default -> LOG.warnf("Unsupported GEOMETRY_METADATA_ENCODING value: %s", metadataValue);
      }
    }

    int maxFeatures = DEFAULT_MAX_FEATURES_IN_BATCH;
    String maxValue = options.get(MAX_FEATURES_IN_BATCH);
    if (maxValue != null) {
      try {
        maxFeatures = Integer.parseInt(maxValue.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid MAX_FEATURES_IN_BATCH value: " + maxValue, e);
      }
      if (maxFeatures <= 0) {
        throw new IllegalArgumentException("Invalid MAX_FEATURES_IN_BATCH value: " + maxValue);
      }
    }
    return new StreamOptions(wkb, metadata, maxFeatures);
  }

  /** Whether geometry columns are requested as WKB. */
  public boolean wkbRequested() {
    return wkbRequested;
  }

  public MetadataEncoding metadataEncoding() {
    return metadataEncoding;
  }

  public int maxFeaturesInBatch() {
    return maxFeaturesInBatch;
  }
}
