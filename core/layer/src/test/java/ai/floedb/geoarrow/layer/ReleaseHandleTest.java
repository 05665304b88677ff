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

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReleaseHandleTest {

  @Test
  void runsAtMostOnce() {
    List<String> calls = new ArrayList<>();
    ReleaseHandle handle = ReleaseHandle.of(() -> calls.add("release"));

    handle.release();
    handle.release();

    assertThat(calls).containsExactly("release");
    assertThat(handle.isReleased()).isTrue();
  }

  @Test
  void wrapRunsPreviousActionFirst() {
    List<String> calls = new ArrayList<>();
    ReleaseHandle inner = ReleaseHandle.of(() -> calls.add("vectors"));
    ReleaseHandle outer = inner.wrap(() -> calls.add("allocator"));

    inner.release();
    assertThat(calls).isEmpty();

    outer.release();
    outer.release();
    assertThat(calls).containsExactly("vectors", "allocator");
  }

  @Test
  void ownActionRunsWhenPreviousFails() {
    List<String> calls = new ArrayList<>();
    ReleaseHandle handle =
        ReleaseHandle.of(
                () -> {
                  throw new IllegalStateException("boom");
                })
            .wrap(() -> calls.add("allocator"));

    assertThatThrownBy(handle::release).hasMessage("boom");
    assertThat(calls).containsExactly("allocator");
    assertThat(handle.isReleased()).isTrue();
  }

  @Test
  void consumedHandleCannotBeWrapped() {
    ReleaseHandle handle = ReleaseHandle.of(() -> {});
    handle.release();

    assertThatThrownBy(() -> handle.wrap(() -> {})).isInstanceOf(IllegalStateException.class);
  }
}
