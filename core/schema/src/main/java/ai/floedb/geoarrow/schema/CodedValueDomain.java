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

import java.util.Map;
import java.util.Objects;

/** Named code to text lookup table attached to a dictionary-encoded integer field. */
public record CodedValueDomain(String name, AttributeType codeType, Map<Long, String> values) {

  public CodedValueDomain {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(codeType, "codeType");
    values = Map.copyOf(values);
  }
}
