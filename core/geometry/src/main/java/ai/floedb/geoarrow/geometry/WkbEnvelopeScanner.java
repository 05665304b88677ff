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

package ai.floedb.geoarrow.geometry;

import ai.floedb.geoarrow.schema.GeometryType;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.locationtech.jts.geom.Envelope;

/**
 * Computes the 2-D envelope of a WKB payload by walking its structure, reading only X and Y.
 * Both ISO and extended (EWKB) type codes are accepted, in either byte order.
 */
public final class WkbEnvelopeScanner {

  private static final int EWKB_SRID = 0x20000000;
  private static final int MAX_DEPTH = 32;

  private WkbEnvelopeScanner() {}

  public static boolean scan(byte[] wkb, Envelope envelope) {
    return scan(ByteBuffer.wrap(wkb), envelope);
  }

  /**
   * Expands {@code envelope} with every point between the buffer's position and limit. The
   * buffer itself is not moved.
   *
   * @return {@code false} for a truncated or unsupported payload, in which case {@code envelope}
   *     may have been partially expanded
   */
  public static boolean scan(ByteBuffer wkb, Envelope envelope) {
    return geometry(wkb.slice(), envelope, 0);
  }

  private static boolean geometry(ByteBuffer in, Envelope envelope, int depth) {
    if (depth > MAX_DEPTH || in.remaining() < 5) {
      return false;
    }
    byte order = in.get();
    if (order == 0) {
      in.order(ByteOrder.BIG_ENDIAN);
    } else if (order == 1) {
      in.order(ByteOrder.LITTLE_ENDIAN);
    } else {
      return false;
    }
    int code = in.getInt();
    if ((code & EWKB_SRID) != 0) {
      if (in.remaining() < 4) {
        return false;
      }
      in.getInt();
    }
    GeometryType type = GeometryType.fromWkbCode(code);
    int dimension = type.dimension();
    return switch (type.kind()) {
      case POINT -> points(in, 1, dimension, envelope);
      case LINESTRING -> in.remaining() >= 4 && points(in, in.getInt(), dimension, envelope);
      case POLYGON -> rings(in, dimension, envelope);
      case MULTIPOINT, MULTILINESTRING, MULTIPOLYGON, GEOMETRYCOLLECTION ->
          parts(in, envelope, depth);
      case UNKNOWN -> false;
    };
  }

  private static boolean rings(ByteBuffer in, int dimension, Envelope envelope) {
    if (in.remaining() < 4) {
      return false;
    }
    int ringCount = in.getInt();
    if (ringCount < 0) {
      return false;
    }
    for (int i = 0; i < ringCount; i++) {
      if (in.remaining() < 4 || !points(in, in.getInt(), dimension, envelope)) {
        return false;
      }
    }
    return true;
  }

  private static boolean parts(ByteBuffer in, Envelope envelope, int depth) {
    if (in.remaining() < 4) {
      return false;
    }
    int partCount = in.getInt();
    if (partCount < 0 || (long) partCount * 5 > in.remaining()) {
      return false;
    }
    for (int i = 0; i < partCount; i++) {
      if (!geometry(in, envelope, depth + 1)) {
        return false;
      }
    }
    return true;
  }

  private static boolean points(ByteBuffer in, int count, int dimension, Envelope envelope) {
    long bytes = (long) count * dimension * Double.BYTES;
    if (count < 0 || bytes > in.remaining()) {
      return false;
    }
    int skip = (dimension - 2) * Double.BYTES;
    for (int i = 0; i < count; i++) {
      double x = in.getDouble();
      double y = in.getDouble();
      in.position(in.position() + skip);
      if (!Double.isNaN(x) && !Double.isNaN(y)) {
        envelope.expandToInclude(x, y);
      }
    }
    return true;
  }
}
