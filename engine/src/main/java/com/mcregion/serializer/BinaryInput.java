/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.mcregion.serializer;

import com.mcregion.exception.CorruptNBTException;
import com.mcregion.exception.StorageException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads big-endian primitives and length-prefixed blocks from a sequential byte source. All the reads go through a single scratch buffer
 * that grows to the largest request seen so far and is reused across calls: the array returned by {@link #read(int)} is valid only until
 * the next read.
 * <p>
 * This class is not thread safe, use one instance per parsing session.
 */
public class BinaryInput {
  public static final int BYTE_SERIALIZED_SIZE   = 1;
  public static final int SHORT_SERIALIZED_SIZE  = 2;
  public static final int INT_SERIALIZED_SIZE    = 4;
  public static final int LONG_SERIALIZED_SIZE   = 8;
  public static final int FLOAT_SERIALIZED_SIZE  = 4;
  public static final int DOUBLE_SERIALIZED_SIZE = 8;

  private static final int DEFAULT_ALLOCATION_CHUNK = 512;
  // LENGTH PREFIXES COME FROM UNTRUSTED DATA: THE BUFFER GROWS ONLY AS FAST AS THE SOURCE DELIVERS BYTES
  private static final int MAX_GROWTH_STEP          = 8 * 1024 * 1024;
  private static final int MAX_ARRAY_SIZE           = Integer.MAX_VALUE - 8;

  private final InputStream source;
  private       byte[]      buffer;
  private final ByteBuffer  view;
  private       long        position;

  public BinaryInput(final InputStream source) {
    this.source = source;
    this.buffer = new byte[DEFAULT_ALLOCATION_CHUNK];
    this.view = ByteBuffer.allocate(LONG_SERIALIZED_SIZE);
  }

  /**
   * Reads exactly <code>length</code> bytes.
   *
   * @return the scratch buffer, whose first <code>length</code> bytes are the ones just read
   *
   * @throws StorageException if the source ends before <code>length</code> bytes or fails
   */
  public byte[] read(final int length) {
    if (length < 0 || length > MAX_ARRAY_SIZE)
      throw new IllegalArgumentException("Invalid length " + length);

    int read = 0;
    while (read < length) {
      final int toRead = Math.min(length - read, MAX_GROWTH_STEP);
      checkForAllocation(read + toRead);

      final int n;
      try {
        n = source.readNBytes(buffer, read, toRead);
      } catch (final IOException e) {
        throw new StorageException("Failed to read file", e).addContext("position", position + read).addContext("requested", length);
      }

      read += n;
      if (n < toRead)
        throw new StorageException("Failed to read file", new EOFException("Unexpected end of stream after " + read + " of " + length + " bytes"))
            .addContext("position", position + read).addContext("requested", length);
    }

    position += length;
    return buffer;
  }

  /**
   * Reads all the remaining bytes of the source into a new array owned by the caller.
   */
  public byte[] readFully() {
    try {
      final byte[] content = source.readAllBytes();
      position += content.length;
      return content;
    } catch (final IOException e) {
      throw new StorageException("Failed to read file", e).addContext("position", position);
    }
  }

  public int readUnsignedByte() {
    return read(BYTE_SERIALIZED_SIZE)[0] & 0xFF;
  }

  public byte readByte() {
    return read(BYTE_SERIALIZED_SIZE)[0];
  }

  public short readShort() {
    return wrap(SHORT_SERIALIZED_SIZE).getShort();
  }

  public int readUnsignedShort() {
    return readShort() & 0xFFFF;
  }

  public int readInt() {
    return wrap(INT_SERIALIZED_SIZE).getInt();
  }

  public long readUnsignedInt() {
    return readInt() & 0xFFFFFFFFL;
  }

  public long readLong() {
    return wrap(LONG_SERIALIZED_SIZE).getLong();
  }

  public float readFloat() {
    return wrap(FLOAT_SERIALIZED_SIZE).getFloat();
  }

  public double readDouble() {
    return wrap(DOUBLE_SERIALIZED_SIZE).getDouble();
  }

  /**
   * Reads a block prefixed by its length as unsigned 32-bit integer.
   */
  public byte[] readByteArray() {
    final int length = toArrayLength(readUnsignedInt(), BYTE_SERIALIZED_SIZE);
    return Arrays.copyOf(read(length), length);
  }

  /**
   * Reads a UTF-8 string prefixed by its length in bytes as unsigned 16-bit integer. Malformed sequences are replaced, never rejected.
   */
  public String readString() {
    final int length = readUnsignedShort();
    return new String(read(length), 0, length, StandardCharsets.UTF_8);
  }

  /**
   * Reads an array of 32-bit integers prefixed by the number of elements as unsigned 32-bit integer.
   */
  public int[] readIntArray() {
    final long count = readUnsignedInt();
    final int length = toArrayLength(count, INT_SERIALIZED_SIZE);
    // ALLOCATE ONLY AFTER THE SOURCE DELIVERED ALL THE BYTES
    final byte[] content = read(length);
    final int[] result = new int[(int) count];
    ByteBuffer.wrap(content, 0, length).asIntBuffer().get(result);
    return result;
  }

  /**
   * Reads an array of 64-bit integers prefixed by the number of elements as unsigned 32-bit integer.
   */
  public long[] readLongArray() {
    final long count = readUnsignedInt();
    final int length = toArrayLength(count, LONG_SERIALIZED_SIZE);
    // ALLOCATE ONLY AFTER THE SOURCE DELIVERED ALL THE BYTES
    final byte[] content = read(length);
    final long[] result = new long[(int) count];
    ByteBuffer.wrap(content, 0, length).asLongBuffer().get(result);
    return result;
  }

  /**
   * Returns the number of bytes consumed so far.
   */
  public long position() {
    return position;
  }

  private ByteBuffer wrap(final int size) {
    final byte[] content = read(size);
    view.clear();
    view.put(content, 0, size);
    view.flip();
    return view;
  }

  private void checkForAllocation(final int requested) {
    if (requested > buffer.length) {
      int newSize = buffer.length;
      while (newSize < requested)
        newSize = newSize > MAX_ARRAY_SIZE / 2 ? MAX_ARRAY_SIZE : newSize * 2;
      buffer = Arrays.copyOf(buffer, newSize);
    }
  }

  private int toArrayLength(final long count, final int elementSize) {
    final long bytes = count * elementSize;
    if (bytes > MAX_ARRAY_SIZE)
      throw new CorruptNBTException("Array of " + count + " elements of " + elementSize + " bytes is too large").addContext("position",
          position);
    return (int) bytes;
  }
}
