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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SharedAllocatorTest {

  private final BufferAllocator root = new RootAllocator();

  @AfterEach
  void tearDown() {
    root.close();
  }

  @Test
  void closesAfterLastReference() {
    SharedAllocator shared = new SharedAllocator(root, "test");
    Runnable first = shared.lease();
    Runnable second = shared.lease();
    assertThat(shared.references()).isEqualTo(3);

    shared.release();
    first.run();
    assertThat(shared.isClosed()).isFalse();
    assertThat(root.getChildAllocators()).hasSize(1);

    second.run();
    assertThat(shared.isClosed()).isTrue();
    assertThat(root.getChildAllocators()).isEmpty();
  }

  @Test
  void closedAllocatorRejectsUse() {
    SharedAllocator shared = new SharedAllocator(root, "test");
    shared.release();
    shared.release();

    assertThat(shared.references()).isZero();
    assertThatThrownBy(shared::lease).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(shared::allocator).isInstanceOf(IllegalStateException.class);
  }
}
