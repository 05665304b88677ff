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

import java.io.IOException;
import java.util.Objects;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Row position over the batches of a {@link BatchSource}.
 *
 * <p>The cursor owns its current batch and releases it when moving to the next one, on
 * invalidation and on close. The feature index counts every row passed over, admitted or not.
 */
final class BatchCursor implements AutoCloseable {

  enum State {
    NO_BATCH,
    IN_BATCH,
    EXHAUSTED
  }

  /** Cheap per-row rejection test. */
  @FunctionalInterface
  interface RowTest {
    boolean skip(VectorSchemaRoot batch, int row, long featureIndex);
  }

  /** Unread rows of one batch, valid until the cursor moves on. */
  record Slice(VectorSchemaRoot root, int offset, int length, long firstFeatureIndex) {}

  private enum ScanResult {
    FOUND,
    NEED_NEXT_BATCH
  }

  private final BatchSource source;
  private State state = State.NO_BATCH;
  private ColumnarBatch batch;
  private int batchIndex = -1;
  private int row;
  private long featureIndex;

  BatchCursor(BatchSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  State state() {
    return state;
  }

  VectorSchemaRoot root() {
    if (state != State.IN_BATCH) {
      throw new IllegalStateException("No current batch: " + state);
    }
    return batch.root();
  }

  int row() {
    return row;
  }

  long featureIndex() {
    return featureIndex;
  }

  /**
   * Positions on the next row that {@code test} does not skip, loading batches as needed.
   *
   * @return {@code false} once every batch is exhausted
   */
  boolean advance(RowTest test) throws IOException {
    while (state != State.EXHAUSTED) {
      if (state == State.IN_BATCH && scanBatch(test) == ScanResult.FOUND) {
        return true;
      }
      loadNextBatch();
    }
    return false;
  }

  private ScanResult scanBatch(RowTest test) {
    VectorSchemaRoot root = batch.root();
    int rowCount = root.getRowCount();
    while (row < rowCount) {
      if (test == null || !test.skip(root, row, featureIndex)) {
        return ScanResult.FOUND;
      }
      row++;
      featureIndex++;
    }
    return ScanResult.NEED_NEXT_BATCH;
  }

  /** Moves past the row {@link #advance} stopped on. */
  void consume() {
    row++;
    featureIndex++;
  }

  /**
   * Hands out every unread row of the current batch, loading the next non-empty batch when none
   * is left, and moves past them.
   *
   * @return the rows, or {@code null} once every batch is exhausted
   */
  Slice takeRemaining() throws IOException {
    while (state != State.EXHAUSTED) {
      if (state == State.IN_BATCH) {
        int rowCount = batch.root().getRowCount();
        if (row < rowCount) {
          Slice slice = new Slice(batch.root(), row, rowCount - row, featureIndex);
          featureIndex += rowCount - row;
          row = rowCount;
          return slice;
        }
      }
      loadNextBatch();
    }
    return null;
  }

  private void loadNextBatch() throws IOException {
    releaseBatch();
    ColumnarBatch next = source.next();
    if (next == null) {
      state = State.EXHAUSTED;
      return;
    }
    batch = next;
    batchIndex++;
    row = 0;
    state = State.IN_BATCH;
  }

  /** Restarts at the first row, keeping the current batch when it is the first one. */
  void reset() {
    if (state == State.IN_BATCH && batchIndex == 0) {
      row = 0;
      featureIndex = 0;
      return;
    }
    invalidate();
  }

  /** Drops the current batch and rewinds the source. */
  void invalidate() {
    releaseBatch();
    source.rewind();
    state = State.NO_BATCH;
    batchIndex = -1;
    row = 0;
    featureIndex = 0;
  }

  private void releaseBatch() {
    if (batch != null) {
      batch.close();
      batch = null;
    }
  }

  @Override
  public void close() {
    releaseBatch();
    state = State.EXHAUSTED;
  }
}
