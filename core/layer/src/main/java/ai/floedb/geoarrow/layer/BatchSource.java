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
import java.util.List;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Pull-based supplier of the record batches of one layer.
 *
 * <p>Batches returned by {@link #next()} hold only the projected top-level columns, in projection
 * order, and are owned by the caller.
 */
public interface BatchSource extends AutoCloseable {

  /** Full physical schema, before projection. */
  Schema schema();

  /** Dictionaries of dictionary-encoded columns, or {@code null} when there are none. */
  DictionaryProvider dictionaries();

  /** Restricts the batches returned from now on to {@code columns}. */
  void project(List<Integer> columns);

  /** Returns the next batch, or {@code null} once every batch was returned. */
  ColumnarBatch next() throws IOException;

  /** Restarts from the first batch. */
  void rewind();

  @Override
  void close();
}
