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
import org.apache.arrow.vector.types.pojo.Schema;

/** Pull-based stream of exported batches. */
public interface BatchStream extends AutoCloseable {

  /** Schema of every batch of the stream. */
  Schema schema();

  /**
   * Returns the next non-empty batch, or {@code null} at the end of the stream. The caller must
   * close every returned batch.
   */
  ExportedBatch next() throws IOException;

  @Override
  void close();
}
