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

package ai.floedb.geoarrow.schema;

import java.util.ArrayList;
import java.util.List;

/** Child indices locating a leaf inside a possibly nested top-level column. */
public record ColumnPath(List<Integer> indices) {

  public ColumnPath {
    indices = List.copyOf(indices);
    if (indices.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
  }

  public static ColumnPath of(int column) {
    return new ColumnPath(List.of(column));
  }

  public ColumnPath child(int index) {
    List<Integer> next = new ArrayList<>(indices.size() + 1);
    next.addAll(indices);
    next.add(index);
    return new ColumnPath(next);
  }

  /** Index of the top-level physical column. */
  public int column() {
    return indices.get(0);
  }

  public int depth() {
    return indices.size();
  }

  public int get(int level) {
    return indices.get(level);
  }

  public boolean isNested() {
    return indices.size() > 1;
  }
}
