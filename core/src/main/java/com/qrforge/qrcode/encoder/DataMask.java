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

package com.qrforge.qrcode.encoder;

/**
 * <p>Encapsulates data masks for the data bits in a QR code, per ISO 18004:2006 6.8. A mask
 * flips a data module when its condition holds at the module's column {@code x} and row
 * {@code y}.</p>
 */
public enum DataMask {

  /**
   * 000: mask bits for which (x + y) mod 2 == 0
   */
  DATA_MASK_000() {
    @Override
    public boolean isMasked(int x, int y) {
      return ((x + y) & 0x01) == 0;
    }
  },

  /**
   * 001: mask bits for which y mod 2 == 0
   */
  DATA_MASK_001() {
    @Override
    public boolean isMasked(int x, int y) {
      return (y & 0x01) == 0;
    }
  },

  /**
   * 010: mask bits for which x mod 3 == 0
   */
  DATA_MASK_010() {
    @Override
    public boolean isMasked(int x, int y) {
      return x % 3 == 0;
    }
  },

  /**
   * 011: mask bits for which (x + y) mod 3 == 0
   */
  DATA_MASK_011() {
    @Override
    public boolean isMasked(int x, int y) {
      return (x + y) % 3 == 0;
    }
  },

  /**
   * 100: mask bits for which (y/2 + x/3) mod 2 == 0
   */
  DATA_MASK_100() {
    @Override
    public boolean isMasked(int x, int y) {
      return (((y / 2) + (x / 3)) & 0x01) == 0;
    }
  },

  /**
   * 101: mask bits for which xy mod 2 + xy mod 3 == 0
   */
  DATA_MASK_101() {
    @Override
    public boolean isMasked(int x, int y) {
      int temp = x * y;
      return (temp & 0x01) + (temp % 3) == 0;
    }
  },

  /**
   * 110: mask bits for which (xy mod 2 + xy mod 3) mod 2 == 0
   */
  DATA_MASK_110() {
    @Override
    public boolean isMasked(int x, int y) {
      int temp = x * y;
      return (((temp & 0x01) + (temp % 3)) & 0x01) == 0;
    }
  },

  /**
   * 111: mask bits for which ((x+y) mod 2 + xy mod 3) mod 2 == 0
   */
  DATA_MASK_111() {
    @Override
    public boolean isMasked(int x, int y) {
      return ((((x + y) & 0x01) + ((x * y) % 3)) & 0x01) == 0;
    }
  };

  private static final DataMask[] VALUES = values();

  /**
   * @param x column of the module
   * @param y row of the module
   * @return true iff the bit at that position should be flipped
   */
  public abstract boolean isMasked(int x, int y);

  /**
   * @return the three-bit reference written into format information
   */
  public int getReference() {
    return ordinal();
  }

  /**
   * @param reference a value between 0 and 7 indicating one of the eight possible
   *  data mask patterns a QR Code may use
   * @return DataMask encapsulating the data mask pattern
   */
  public static DataMask forReference(int reference) {
    if (reference < 0 || reference >= VALUES.length) {
      throw new IllegalArgumentException("Invalid mask pattern: " + reference);
    }
    return VALUES[reference];
  }

}
