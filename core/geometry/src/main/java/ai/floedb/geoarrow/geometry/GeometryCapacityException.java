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

package ai.floedb.geoarrow.geometry;

import java.io.IOException;

/** Thrown when re-encoded geometries no longer fit in a 32-bit offset column. */
public class GeometryCapacityException extends IOException {

  private final long requested;

  public GeometryCapacityException(long requested, long limit) {
    super(
        String.format(
            "Cannot grow geometry buffer to %d bytes: limit is %d bytes", requested, limit));
    this.requested = requested;
  }

  public long requested() {
    return requested;
  }
}
