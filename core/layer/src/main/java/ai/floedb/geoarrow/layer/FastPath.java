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

/**
 * Export that hands out loaded batches directly instead of rebuilding them from features.
 *
 * <p>Implementations decide per request whether their preconditions hold; callers fall back to
 * {@link GenericBatchStream} otherwise.
 */
public interface FastPath {

  boolean canExport(StreamOptions options);

  /**
   * Opens a stream over the remaining batches.
   *
   * @throws IllegalStateException when {@link #canExport(StreamOptions)} is false
   */
  BatchStream open(StreamOptions options) throws IOException;
}
