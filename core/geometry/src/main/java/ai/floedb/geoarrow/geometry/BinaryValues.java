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

import ai.floedb.geoarrow.schema.PhysicalType;
import java.nio.ByteBuffer;
import org.apache.arrow.vector.ExtensionTypeVector;
import org.apache.arrow.vector.FieldVector;

/** Zero-copy access to the payload of binary and string columns. */
final class BinaryValues {

  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private BinaryValues() {}

  /** Unwraps extension vectors to the vector holding their storage. */
  static FieldVector storage(FieldVector vector) {
    if (vector instanceof ExtensionTypeVector<?> extension) {
      return extension.getUnderlyingVector();
    }
    return vector;
  }

  /**
   * Returns a view over the bytes of {@code row}. The view shares memory with the vector and is
   * only valid while the vector is.
   */
  static ByteBuffer view(FieldVector vector, int row) {
    long start;
    long end;
    switch (PhysicalType.of(vector.getField().getType())) {
      case BINARY, STRING -> {
        start = vector.getOffsetBuffer().getInt((long) row * Integer.BYTES);
        end = vector.getOffsetBuffer().getInt((long) (row + 1) * Integer.BYTES);
      }
      case LARGE_BINARY, LARGE_STRING -> {
        start = vector.getOffsetBuffer().getLong((long) row * Long.BYTES);
        end = vector.getOffsetBuffer().getLong((long) (row + 1) * Long.BYTES);
      }
      default ->
          throw new IllegalArgumentException(
              "Not a binary or string column: " + vector.getField());
    }
    long length = end - start;
    if (length == 0) {
      return EMPTY.duplicate();
    }
    if (length > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Value too large at row " + row + ": " + length);
    }
    return vector.getDataBuffer().nioBuffer(start, (int) length);
  }

  static byte[] bytes(FieldVector vector, int row) {
    ByteBuffer view = view(vector, row);
    byte[] bytes = new byte[view.remaining()];
    view.get(bytes);
    return bytes;
  }
}
