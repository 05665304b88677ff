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

/**
 * Result of compiling a predicate.
 *
 * @param complete whether the constraints alone decide the predicate exactly, so the predicate
 *     need not be evaluated again on materialized features
 */
public record CompiledFilter(List<Constraint> constraints, boolean complete) {

  public static final CompiledFilter NONE = new CompiledFilter(List.of(), true);

  public CompiledFilter {
    constraints = List.copyOf(constraints);
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }
}
