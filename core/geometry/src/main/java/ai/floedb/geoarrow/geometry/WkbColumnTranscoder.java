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
import java.io.IOException;
import java.util.List;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BitVectorHelper;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.ipc.message.ArrowFieldNode;
import org.apache.arrow.vector.types.pojo.Field;

/** Re-encodes a WKT string column as a WKB binary column. */
public final class WkbColumnTranscoder {

  static final long DEFAULT_WKB_SIZE = 100;

  private WkbColumnTranscoder() {}

  /**
   * Translates every non-null row of {@code wkt} and returns a new binary column described by
   * {@code target}. Null rows stay null and take no bytes. The caller owns the returned vector.
   *
   * @throws GeometryCapacityException when the WKB of the column exceeds 32-bit offsets
   * @throws IOException when a row is not valid WKT
   */
  public static VarBinaryVector transcode(FieldVector wkt, Field target, BufferAllocator allocator)
      throws IOException {
    return transcode(wkt, target, allocator, WkbAppendBuffer.MAX_SIZE);
  }

  static VarBinaryVector transcode(
      FieldVector wkt, Field target, BufferAllocator allocator, long maxSize) throws IOException {
    FieldVector source = BinaryValues.storage(wkt);
    PhysicalType type = PhysicalType.of(source.getField().getType());
    if (type != PhysicalType.STRING && type != PhysicalType.LARGE_STRING) {
      throw new IllegalArgumentException("Not a WKT column: " + source.getField());
    }
    int rowCount = source.getValueCount();
    long initialCapacity = Math.min(maxSize, DEFAULT_WKB_SIZE * rowCount);
    try (WkbAppendBuffer data = new WkbAppendBuffer(allocator, initialCapacity, maxSize);
        ArrowBuf offsets = allocator.buffer((long) (rowCount + 1) * Integer.BYTES);
        ArrowBuf validity = allocator.buffer(BitVectorHelper.getValidityBufferSize(rowCount))) {
      validity.setZero(0, validity.capacity());
      WktToWkbTranslator translator = new WktToWkbTranslator(data);
      int nullCount = 0;
      for (int row = 0; row < rowCount; row++) {
        offsets.setInt((long) row * Integer.BYTES, (int) data.size());
        if (source.isNull(row)) {
          nullCount++;
          continue;
        }
        BitVectorHelper.setBit(validity, row);
        translator.translate(BinaryValues.view(source, row));
      }
      offsets.setInt((long) rowCount * Integer.BYTES, (int) data.size());

      VarBinaryVector result = new VarBinaryVector(target, allocator);
      boolean loaded = false;
      try {
        result.loadFieldBuffers(
            new ArrowFieldNode(rowCount, nullCount), List.of(validity, offsets, data.buffer()));
        loaded = true;
        return result;
      } finally {
        if (!loaded) {
          result.close();
        }
      }
    }
  }
}
