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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.TransferPair;

/**
 * {@link BatchSource} over record batches already in memory.
 *
 * <p>The source owns the batches it was given. Each batch it returns is a zero-copy view sharing
 * buffers with the stored batch, so it stays valid after the source is closed.
 */
public final class InMemoryBatchSource implements BatchSource {

  private final Schema schema;
  private final List<VectorSchemaRoot> batches;
  private final DictionaryProvider dictionaries;
  private final BufferAllocator allocator;
  private List<Integer> projection;
  private int position;
  private int loads;

  public InMemoryBatchSource(
      Schema schema,
      List<VectorSchemaRoot> batches,
      DictionaryProvider dictionaries,
      BufferAllocator allocator) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.batches = List.copyOf(batches);
    this.dictionaries = dictionaries;
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.projection = IntStream.range(0, schema.getFields().size()).boxed().toList();
  }

  @Override
  public Schema schema() {
    return schema;
  }

  @Override
  public DictionaryProvider dictionaries() {
    return dictionaries;
  }

  @Override
  public void project(List<Integer> columns) {
    for (int column : columns) {
      Objects.checkIndex(column, schema.getFields().size());
    }
    this.projection = List.copyOf(columns);
  }

  @Override
  public ColumnarBatch next() {
    if (position >= batches.size()) {
      return null;
    }
    VectorSchemaRoot stored = batches.get(position++);
    loads++;
    int rowCount = stored.getRowCount();
    List<FieldVector> vectors = new ArrayList<>(projection.size());
    for (int column : projection) {
      FieldVector vector = stored.getVector(column);
      if (rowCount == 0) {
        FieldVector empty = vector.getField().createVector(allocator);
        empty.setValueCount(0);
        vectors.add(empty);
        continue;
      }
      TransferPair pair = vector.getTransferPair(allocator);
      pair.splitAndTransfer(0, rowCount);
      vectors.add((FieldVector) pair.getTo());
    }
    VectorSchemaRoot view = new VectorSchemaRoot(vectors);
    view.setRowCount(rowCount);
    return new SimpleColumnarBatch(view);
  }

  @Override
  public void rewind() {
    position = 0;
  }

  /** Number of batches handed out so far. */
  public int loadCount() {
    return loads;
  }

  @Override
  public void close() {
    batches.forEach(VectorSchemaRoot::close);
  }
}
