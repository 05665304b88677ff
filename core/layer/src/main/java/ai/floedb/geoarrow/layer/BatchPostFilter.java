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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/** Compacts an exported batch down to the rows a {@link RowFilter} admits. */
final class BatchPostFilter {

  private BatchPostFilter() {}

  /**
   * Filters {@code batch}. When every row is admitted the batch itself is returned; otherwise a
   * new root allocated from {@code allocator} is returned and {@code batch} is left to the caller.
   *
   * @param firstFeatureIndex feature index of row {@code 0}
   */
  static VectorSchemaRoot filter(
      VectorSchemaRoot batch, RowFilter filter, long firstFeatureIndex, BufferAllocator allocator) {
    if (filter.isEmpty()) {
      return batch;
    }
    int rowCount = batch.getRowCount();
    try (BitVector mask = new BitVector("selection", allocator)) {
      mask.allocateNew(rowCount);
      int selected = 0;
      for (int row = 0; row < rowCount; row++) {
        boolean admitted =
            !filter.skip(batch, row, firstFeatureIndex + row) && filter.acceptsRow(batch, row);
        mask.set(row, admitted ? 1 : 0);
        if (admitted) {
          selected++;
        }
      }
      mask.setValueCount(rowCount);
      if (selected == rowCount) {
        return batch;
      }

      VectorSchemaRoot filteredRoot = VectorSchemaRoot.create(batch.getSchema(), allocator);
      boolean copied = false;
      try {
        copySelection(batch, filteredRoot, mask, selected);
        copied = true;
        return filteredRoot;
      } finally {
        if (!copied) {
          filteredRoot.close();
        }
      }
    }
  }

  /** Copies the masked rows of {@code src} into {@code dst}, one column at a time. */
  private static void copySelection(
      VectorSchemaRoot src, VectorSchemaRoot dst, BitVector mask, int selected) {
    int rowCount = src.getRowCount();
    for (int column = 0; column < src.getFieldVectors().size(); column++) {
      FieldVector from = src.getVector(column);
      FieldVector to = dst.getVector(column);
      to.setInitialCapacity(selected);
      to.allocateNew();
      int out = 0;
      for (int row = 0; row < rowCount; row++) {
        if (mask.get(row) != 0) {
          to.copyFromSafe(row, out++, from);
        }
      }
      to.setValueCount(out);
    }
    dst.setRowCount(selected);
  }
}
