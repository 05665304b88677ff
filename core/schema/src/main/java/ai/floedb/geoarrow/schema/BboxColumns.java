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

/**
 * Attribute indexes of the {@code bbox.minx}, {@code bbox.miny}, {@code bbox.maxx} and {@code
 * bbox.maxy} double columns.
 */
public record BboxColumns(int minX, int minY, int maxX, int maxY) {

  public static final String MIN_X = "bbox.minx";
  public static final String MIN_Y = "bbox.miny";
  public static final String MAX_X = "bbox.maxx";
  public static final String MAX_Y = "bbox.maxy";

  public static final BboxColumns NONE = new BboxColumns(-1, -1, -1, -1);

  public boolean isComplete() {
    return minX >= 0 && minY >= 0 && maxX >= 0 && maxY >= 0;
  }

  BboxColumns with(String name, int fieldIndex) {
    return switch (name) {
      case MIN_X -> new BboxColumns(fieldIndex, minY, maxX, maxY);
      case MIN_Y -> new BboxColumns(minX, fieldIndex, maxX, maxY);
      case MAX_X -> new BboxColumns(minX, minY, fieldIndex, maxY);
      case MAX_Y -> new BboxColumns(minX, minY, maxX, fieldIndex);
      default -> this;
    };
  }
}
