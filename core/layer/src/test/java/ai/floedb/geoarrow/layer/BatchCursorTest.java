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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.IntVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchCursorTest {

  private BufferAllocator allocator;
  private InMemoryBatchSource source;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator();
    source =
        TestBatches.source(
            allocator,
            TestBatches.batch(TestBatches.ints(allocator, "v", 1, 2)),
            TestBatches.batch(TestBatches.ints(allocator, "v")),
            TestBatches.batch(TestBatches.ints(allocator, "v", 3, 4, 5)));
  }

  @AfterEach
  void tearDown() {
    source.close();
    allocator.close();
  }

  private static int value(BatchCursor cursor) {
    return ((IntVector) cursor.root().getVector(0)).get(cursor.row());
  }

  @Test
  void featureIndexCountsSkippedRows() throws Exception {
    try (BatchCursor cursor = new BatchCursor(source)) {
      BatchCursor.RowTest odd =
          (batch, row, index) -> ((IntVector) batch.getVector(0)).get(row) % 2 == 0;

      assertThat(cursor.advance(odd)).isTrue();
      assertThat(value(cursor)).isEqualTo(1);
      assertThat(cursor.featureIndex()).isZero();
      cursor.consume();

      assertThat(cursor.advance(odd)).isTrue();
      assertThat(value(cursor)).isEqualTo(3);
      assertThat(cursor.featureIndex()).isEqualTo(2);
      cursor.consume();

      assertThat(cursor.advance(odd)).isTrue();
      assertThat(value(cursor)).isEqualTo(5);
      assertThat(cursor.featureIndex()).isEqualTo(4);
      cursor.consume();

      assertThat(cursor.advance(odd)).isFalse();
      assertThat(cursor.state()).isEqualTo(BatchCursor.State.EXHAUSTED);
    }
  }

  @Test
  void takeRemainingSkipsEmptyBatches() throws Exception {
    try (BatchCursor cursor = new BatchCursor(source)) {
      assertThat(cursor.advance(null)).isTrue();
      cursor.consume();

      BatchCursor.Slice first = cursor.takeRemaining();
      assertThat(first.offset()).isEqualTo(1);
      assertThat(first.length()).isEqualTo(1);
      assertThat(first.firstFeatureIndex()).isEqualTo(1);

      BatchCursor.Slice second = cursor.takeRemaining();
      assertThat(second.offset()).isZero();
      assertThat(second.length()).isEqualTo(3);
      assertThat(second.firstFeatureIndex()).isEqualTo(2);

      assertThat(cursor.takeRemaining()).isNull();
    }
    assertThat(source.loadCount()).isEqualTo(3);
  }

  @Test
  void resetKeepsFirstBatch() throws Exception {
    try (BatchCursor cursor = new BatchCursor(source)) {
      cursor.advance(null);
      cursor.consume();
      cursor.reset();

      assertThat(cursor.state()).isEqualTo(BatchCursor.State.IN_BATCH);
      assertThat(cursor.advance(null)).isTrue();
      assertThat(value(cursor)).isEqualTo(1);
      assertThat(source.loadCount()).isEqualTo(1);
    }
  }

  @Test
  void resetAfterFirstBatchRewindsSource() throws Exception {
    try (BatchCursor cursor = new BatchCursor(source)) {
      cursor.takeRemaining();
      cursor.takeRemaining();
      cursor.reset();

      assertThat(cursor.state()).isEqualTo(BatchCursor.State.NO_BATCH);
      assertThat(cursor.featureIndex()).isZero();
      assertThat(cursor.advance(null)).isTrue();
      assertThat(value(cursor)).isEqualTo(1);
    }
  }
}
