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

import java.util.Objects;

/**
 * Cleanup action that runs at most once.
 *
 * <p>{@link #wrap(Runnable)} moves the action into a new handle that runs it before its own, so
 * whatever owns the memory behind a batch is released after the batch itself.
 */
public final class ReleaseHandle {

  private Runnable action;

  private ReleaseHandle(Runnable action) {
    this.action = action;
  }

  public static ReleaseHandle of(Runnable action) {
    return new ReleaseHandle(Objects.requireNonNull(action, "action"));
  }

  /**
   * Returns a handle running this handle's action, then {@code own}. This handle is emptied and
   * releasing it afterwards does nothing.
   *
   * @throws IllegalStateException when this handle was already released or wrapped
   */
  public ReleaseHandle wrap(Runnable own) {
    Objects.requireNonNull(own, "own");
    Runnable previous = take();
    if (previous == null) {
      throw new IllegalStateException("Release handle already consumed");
    }
    return new ReleaseHandle(
        () -> {
          try {
            previous.run();
          } finally {
            own.run();
          }
        });
  }

  public void release() {
    Runnable pending = take();
    if (pending != null) {
      pending.run();
    }
  }

  public boolean isReleased() {
    return action == null;
  }

  private Runnable take() {
    Runnable pending = action;
    action = null;
    return pending;
  }
}
