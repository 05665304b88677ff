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
import org.apache.arrow.memory.BufferAllocator;
import org.jboss.logging.Logger;

/**
 * Child allocator shared by a layer and the batches it exports.
 *
 * <p>The layer holds the first reference and every exported batch takes a lease. The allocator is
 * closed when the last reference goes away, so exported batches may outlive their layer.
 */
public final class SharedAllocator {

  private static final Logger LOG = Logger.getLogger(SharedAllocator.class);

  private final BufferAllocator allocator;
  private int references = 1;

  public SharedAllocator(BufferAllocator parent, String name) {
    Objects.requireNonNull(parent, "parent");
    this.allocator = parent.newChildAllocator(name, 0, Long.MAX_VALUE);
  }

  public BufferAllocator allocator() {
    if (references == 0) {
      throw new IllegalStateException("Shared allocator has been closed");
    }
    return allocator;
  }

  /** Takes a reference that is returned by running the result. */
  public Runnable lease() {
    if (references == 0) {
      throw new IllegalStateException("Shared allocator has been closed");
    }
    references++;
    return this::release;
  }

  /** Returns one reference. */
  public void release() {
    if (references == 0) {
      return;
    }
    if (--references == 0) {
      try {
        allocator.close();
      } catch (RuntimeException e) {
        LOG.warn("Error closing shared layer allocator", e);
      }
    }
  }

  public boolean isClosed() {
    return references == 0;
  }

  int references() {
    return references;
  }
}
