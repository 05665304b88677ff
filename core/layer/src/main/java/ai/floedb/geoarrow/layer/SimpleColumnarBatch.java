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

import java.util.Objects;
import org.apache.arrow.vector.VectorSchemaRoot;

/** Batch owning a root it closes on {@link #close()}. */
public final class SimpleColumnarBatch implements ColumnarBatch {

  private final VectorSchemaRoot root;
  private boolean closed;

  public SimpleColumnarBatch(VectorSchemaRoot root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  @Override
  public VectorSchemaRoot root() {
    if (closed) {
      throw new IllegalStateException("Batch is closed");
    }
    return root;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    root.close();
  }
}
