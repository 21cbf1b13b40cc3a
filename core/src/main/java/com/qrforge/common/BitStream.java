/*
 * Copyright 2026 qrforge authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.qrforge.common;

import java.util.Arrays;

/**
 * <p>An ordered sequence of bits. Bits are written at the end, most significant bit of each
 * value first, and consumed from the front through an independent read cursor.</p>
 *
 * <p>Not thread-safe. Callers that need to read the same bits more than once take a
 * {@link #copy()}, which starts over at the first bit.</p>
 */
public final class BitStream {

  /** Returned by {@link #popBit()} once every written bit has been read. */
  public static final int EXHAUSTED = -1;

  private static final byte[] EMPTY_BYTES = {};

  private byte[] bytes;
  private int size;
  private int readPosition;

  public BitStream() {
    this.bytes = EMPTY_BYTES;
  }

  private BitStream(byte[] bytes, int size) {
    this.bytes = bytes;
    this.size = size;
  }

  /**
   * @return number of bits written so far
   */
  public int getSize() {
    return size;
  }

  public int getSizeInBytes() {
    return (size + 7) / 8;
  }

  /**
   * @return number of written bits not yet consumed by {@link #popBit()}
   */
  public int getRemaining() {
    return size - readPosition;
  }

  /**
   * Appends the least-significant bits, from value, in order from most-significant to
   * least-significant. For example, appending 6 bits from 0x000001E will append the bits
   * 0, 1, 1, 1, 1, 0 in that order.
   *
   * @param value {@code int} containing bits to append
   * @param numBits bits from value to append
   * @throws IllegalArgumentException if {@code value} does not fit in {@code numBits} bits
   */
  public void appendBits(int value, int numBits) {
    if (numBits < 0 || numBits > 31) {
      throw new IllegalArgumentException("Num bits must be between 0 and 31");
    }
    if (value < 0 || (value >>> numBits) != 0) {
      throw new IllegalArgumentException("Value " + value + " does not fit in " + numBits + " bits");
    }
    for (int i = numBits - 1; i >= 0; i--) {
      appendBit(((value >>> i) & 1) != 0);
    }
  }

  public void appendBit(boolean bit) {
    if ((size & 0x07) == 0) {
      ensureCapacity(size / 8 + 1);
    }
    if (bit) {
      bytes[size >>> 3] |= (byte) (0x80 >>> (size & 0x07));
    }
    size++;
  }

  /**
   * Appends every byte of {@code values} as an 8-bit group.
   */
  public void appendBytes(byte[] values) {
    if ((size & 0x07) == 0) {
      int offset = size / 8;
      ensureCapacity(offset + values.length);
      System.arraycopy(values, 0, bytes, offset, values.length);
      size += values.length * 8;
    } else {
      for (byte value : values) {
        appendBits(value & 0xFF, 8);
      }
    }
  }

  /**
   * Consumes the next unread bit.
   *
   * @return 0 or 1, or {@link #EXHAUSTED} when no unread bit is left
   */
  public int popBit() {
    if (readPosition >= size) {
      return EXHAUSTED;
    }
    int bit = (bytes[readPosition >>> 3] >>> (7 - (readPosition & 0x07))) & 1;
    readPosition++;
    return bit;
  }

  /**
   * @param i bit to get
   * @return true iff bit i is set
   */
  public boolean get(int i) {
    if (i < 0 || i >= size) {
      throw new IndexOutOfBoundsException("Bit " + i + " out of range [0, " + size + ")");
    }
    return ((bytes[i >>> 3] >>> (7 - (i & 0x07))) & 1) != 0;
  }

  /**
   * @return the written bits packed into bytes, first bit in the high bit of the first byte
   * @throws IllegalStateException if the number of written bits is not a multiple of 8
   */
  public byte[] toBytes() {
    if ((size & 0x07) != 0) {
      throw new IllegalStateException("Bit length " + size + " is not a multiple of 8");
    }
    return Arrays.copyOf(bytes, size / 8);
  }

  /**
   * @return an independent stream holding the same bits, with its read cursor at the first bit
   */
  public BitStream copy() {
    return new BitStream(Arrays.copyOf(bytes, getSizeInBytes()), size);
  }

  public void clear() {
    bytes = EMPTY_BYTES;
    size = 0;
    readPosition = 0;
  }

  private void ensureCapacity(int numBytes) {
    if (numBytes > bytes.length) {
      bytes = Arrays.copyOf(bytes, Math.max(numBytes, bytes.length * 2));
    }
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder(size + (size / 8) + 1);
    for (int i = 0; i < size; i++) {
      if ((i & 0x07) == 0 && i > 0) {
        result.append(' ');
      }
      result.append(get(i) ? 'X' : '.');
    }
    return result.toString();
  }

}
