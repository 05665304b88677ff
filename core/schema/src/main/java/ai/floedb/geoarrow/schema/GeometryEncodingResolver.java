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

import java.util.Map;
import java.util.Optional;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.jboss.logging.Logger;

/** Validates a declared geometry encoding against the physical type of its column. */
public final class GeometryEncodingResolver {

  public static final String EXTENSION_NAME_KEY = "ARROW:extension:name";

  private static final Logger LOG = Logger.getLogger(GeometryEncodingResolver.class);

  private GeometryEncodingResolver() {}

  /** Outcome of a resolution; {@link #encoding()} is {@code null} when rejected. */
  public record Resolution(GeometryEncoding encoding, GeometryType type, String diagnostic) {

    static Resolution accepted(GeometryEncoding encoding, GeometryType type) {
      return new Resolution(encoding, type, null);
    }

    static Resolution rejected(String diagnostic) {
      return new Resolution(null, null, diagnostic);
    }

    public boolean isAccepted() {
      return encoding != null;
    }
  }

  /** Returns the {@code ARROW:extension:name} metadata value of a field, if any. */
  public static Optional<String> extensionName(Field field) {
    Map<String, String> metadata = field.getMetadata();
    String value = metadata == null ? null : metadata.get(EXTENSION_NAME_KEY);
    if (value == null && field.getType() instanceof ArrowType.ExtensionType extension) {
      value = extension.extensionName();
    }
    return Optional.ofNullable(value);
  }

  /**
   * Resolves {@code tag} for {@code field}. Rejections are logged; the caller then handles the
   * column as a regular attribute.
   */
  public static Resolution resolve(Field field, String tag) {
    String name = field.getName();
    ArrowType type = storageType(field.getType());
    Optional<GeometryEncoding> declared = GeometryEncoding.fromTag(tag);
    if (declared.isEmpty()) {
      return reject(
          String.format(
              "Geometry column %s uses a unhandled encoding: %s. Handling it as a regular field",
              name, tag));
    }
    GeometryEncoding encoding = declared.get();
    PhysicalType physical = PhysicalType.of(type);
    return switch (encoding) {
      case WKT ->
          physical.isString()
              ? Resolution.accepted(encoding, GeometryType.UNKNOWN)
              : reject(
                  String.format(
                      "Geometry column %s has a non String type: %s. Handling it as a regular"
                          + " field",
                      name, type));
      case WKB ->
          physical == PhysicalType.BINARY || physical == PhysicalType.LARGE_BINARY
              ? Resolution.accepted(encoding, GeometryType.UNKNOWN)
              : reject(
                  String.format(
                      "Geometry column %s has a non Binary type: %s. Handling it as a regular"
                          + " field",
                      name, type));
      case POINT, LINESTRING, POLYGON, MULTIPOINT, MULTILINESTRING, MULTIPOLYGON -> {
        GeometryType pointType = listOfPointType(field, type, encoding.listDepth());
        if (pointType == null) {
          yield reject(
              String.format(
                  "Geometry column %s has a type incompatible with %s: %s. Handling it as a"
                      + " regular field",
                  name, tag, type));
        }
        yield Resolution.accepted(
            encoding, new GeometryType(encoding.baseKind(), pointType.hasZ(), pointType.hasM()));
      }
    };
  }

  private static Resolution reject(String diagnostic) {
    LOG.warn(diagnostic);
    return Resolution.rejected(diagnostic);
  }

  private static ArrowType storageType(ArrowType type) {
    if (type instanceof ArrowType.ExtensionType extension) {
      return extension.storageType();
    }
    return type;
  }

  /** Point dimensionality of a {@code depth}-times nested list of points, or {@code null}. */
  private static GeometryType listOfPointType(Field field, ArrowType type, int depth) {
    if (depth == 0) {
      return pointType(field, type);
    }
    if (!(type instanceof ArrowType.List) || field.getChildren().isEmpty()) {
      return null;
    }
    Field child = field.getChildren().get(0);
    return listOfPointType(child, storageType(child.getType()), depth - 1);
  }

  /**
   * A point is a fixed-size list of 2, 3 or 4 doubles. Three values are XYM when the value field
   * is named {@code xym} and XYZ otherwise.
   */
  private static GeometryType pointType(Field field, ArrowType type) {
    if (!(type instanceof ArrowType.FixedSizeList fixedList) || field.getChildren().isEmpty()) {
      return null;
    }
    Field value = field.getChildren().get(0);
    if (PhysicalType.of(value.getType()) != PhysicalType.DOUBLE) {
      return null;
    }
    return switch (fixedList.getListSize()) {
      case 2 -> GeometryType.of(GeometryKind.POINT);
      case 3 ->
          "xym".equals(value.getName())
              ? new GeometryType(GeometryKind.POINT, false, true)
              : new GeometryType(GeometryKind.POINT, true, false);
      case 4 -> new GeometryType(GeometryKind.POINT, true, true);
      default -> null;
    };
  }
}
