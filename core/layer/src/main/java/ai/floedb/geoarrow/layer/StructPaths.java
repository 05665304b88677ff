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

import ai.floedb.geoarrow.schema.ColumnPath;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.StructVector;

/** Navigation from a top-level batch column to a flattened struct leaf. */
final class StructPaths {

  private StructPaths() {}

  /** Leaf vector of {@code path} below the top-level {@code column}. */
  static FieldVector leaf(FieldVector column, ColumnPath path) {
    FieldVector vector = column;
    for (int level = 1; level < path.depth(); level++) {
      vector = (FieldVector) ((StructVector) vector).getChildByOrdinal(path.get(level));
    }
    return vector;
  }

  /** Whether the leaf or any enclosing struct is null at {@code row}. */
  static boolean isNull(FieldVector column, ColumnPath path, int row) {
    FieldVector vector = column;
    for (int level = 1; level < path.depth(); level++) {
      if (vector.isNull(row)) {
        return true;
      }
      vector = (FieldVector) ((StructVector) vector).getChildByOrdinal(path.get(level));
    }
    return vector.isNull(row);
  }
}
