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

import java.util.Objects;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Growable little-endian output buffer backed by Arrow memory. Capacity doubles on demand but
 * never exceeds the configured maximum, which defaults to the largest 32-bit signed offset.
 */
public final class WkbAppendBuffer implements AutoCloseable {

  public static final long MAX_SIZE = Integer.MAX_VALUE;

  private final BufferAllocator allocator;
  private final long maxSize;
  private ArrowBuf buffer;
  private long capacity;
  private long size;

  public WkbAppendBuffer(BufferAllocator allocator, long initialCapacity) {
    this(allocator, initialCapacity, MAX_SIZE);
  }

  WkbAppendBuffer(BufferAllocator allocator, long initialCapacity, long maxSize) {
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.maxSize = maxSize;
    this.capacity = Math.min(maxSize, Math.max(0, initialCapacity));
    this.buffer = allocator.buffer(capacity);
  }

  public long size() {
    return size;
  }

  /** Backing buffer; bytes past {@link #size()} are undefined. */
  public ArrowBuf buffer() {
    return buffer;
  }

  public void putByte(int value) throws GeometryCapacityException {
    reserve(Byte.BYTES);
    buffer.setByte(size, value);
    size += Byte.BYTES;
  }

  public void putInt(int value) throws GeometryCapacityException {
    reserve(Integer.BYTES);
    buffer.setInt(size, value);
    size += Integer.BYTES;
  }

  public void putDouble(double value) throws GeometryCapacityException {
    reserve(Double.BYTES);
    buffer.setDouble(size, value);
    size += Double.BYTES;
  }

  /** Overwrites an int already written at {@code position}. */
  public void setInt(long position, int value) {
    if (position < 0 || position + Integer.BYTES > size) {
      throw new IndexOutOfBoundsException("position " + position + ", size " + size);
    }
    buffer.setInt(position, value);
  }

  private void reserve(long itemSize) throws GeometryCapacityException {
    if (itemSize <= capacity - size) {
      return;
    }
    if (itemSize > maxSize - size) {
      throw new GeometryCapacityException(size + itemSize, maxSize);
    }
    long newCapacity = Math.max(size + itemSize, Math.min(maxSize, capacity * 2));
    ArrowBuf grown = allocator.buffer(newCapacity);
    grown.setBytes(0, buffer, 0, size);
    buffer.close();
    buffer = grown;
    capacity = newCapacity;
  }

  @Override
  public void close() {
    buffer.close();
  }
}
