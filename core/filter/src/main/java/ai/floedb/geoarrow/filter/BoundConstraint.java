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

package ai.floedb.geoarrow.filter;

import java.util.List;
import java.util.Objects;

/**
 * A constraint resolved against the columns of materialized batches.
 *
 * @param arrayIndex batch column to read, {@link #ROW_COUNTER} when the row identifier is the
 *     sequential row position, or {@link #DISABLED}
 * @param childPath struct child ordinals leading from the batch column to the compared leaf
 */
public record BoundConstraint(Constraint constraint, int arrayIndex, List<Integer> childPath) {

  public static final int DISABLED = -1;
  public static final int ROW_COUNTER = -2;

  public BoundConstraint {
    Objects.requireNonNull(constraint, "constraint");
    childPath = List.copyOf(childPath);
  }

  public boolean isDisabled() {
    return arrayIndex == DISABLED;
  }

  public boolean readsRowCounter() {
    return arrayIndex == ROW_COUNTER;
  }
}
