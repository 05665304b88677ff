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

/**
 * A batch handed to a stream consumer. Closing it runs its {@link ReleaseHandle}, which frees the
 * vectors and then returns the batch's lease on the layer allocator.
 */
public final class ExportedBatch implements ColumnarBatch {

  private final VectorSchemaRoot root;
  private final ReleaseHandle handle;

  public ExportedBatch(VectorSchemaRoot root, ReleaseHandle handle) {
    this.root = Objects.requireNonNull(root, "root");
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public VectorSchemaRoot root() {
    if (handle.isReleased()) {
      throw new IllegalStateException("Batch has been released");
    }
    return root;
  }

  public boolean isReleased() {
    return handle.isReleased();
  }

  @Override
  public void close() {
    handle.release();
  }
}
