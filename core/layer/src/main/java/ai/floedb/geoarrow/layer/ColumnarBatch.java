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

import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * A record batch handed out by a {@link BatchSource} or a {@link BatchStream}. The receiver owns
 * it and must close it; the root is unusable afterwards.
 */
public interface ColumnarBatch extends AutoCloseable {

  VectorSchemaRoot root();

  default int rowCount() {
    return root().getRowCount();
  }

  /** Releases the vectors of the batch. Closing twice is a no-op. */
  @Override
  void close();
}
