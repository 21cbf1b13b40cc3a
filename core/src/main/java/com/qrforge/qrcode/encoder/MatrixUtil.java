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

import com.qrforge.common.BitStream;
import com.qrforge.qrcode.common.ErrorCorrectionLevel;
import com.qrforge.qrcode.common.Version;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws function patterns, format and version information, and masked data bits into a
 * {@link ByteMatrix}.
 */
final class MatrixUtil {

  // 7x7 finder pattern surrounded by its one-module light separator
  private static final int[][] POSITION_DETECTION_PATTERN = {
      {0, 0, 0, 0, 0, 0, 0, 0, 0},
      {0, 1, 1, 1, 1, 1, 1, 1, 0},
      {0, 1, 0, 0, 0, 0, 0, 1, 0},
      {0, 1, 0, 1, 1, 1, 0, 1, 0},
      {0, 1, 0, 1, 1, 1, 0, 1, 0},
      {0, 1, 0, 1, 1, 1, 0, 1, 0},
      {0, 1, 0, 0, 0, 0, 0, 1, 0},
      {0, 1, 1, 1, 1, 1, 1, 1, 0},
      {0, 0, 0, 0, 0, 0, 0, 0, 0},
  };

  private static final int[][] POSITION_ADJUSTMENT_PATTERN = {
      {1, 1, 1, 1, 1},
      {1, 0, 0, 0, 1},
      {1, 0, 1, 0, 1},
      {1, 0, 0, 0, 1},
      {1, 1, 1, 1, 1},
  };

  // Type info cells around the top-left finder, as {x, y}, least significant bit first
  private static final int[][] TYPE_INFO_COORDINATES = {
      {8, 0},
      {8, 1},
      {8, 2},
      {8, 3},
      {8, 4},
      {8, 5},
      {8, 7},
      {8, 8},
      {7, 8},
      {5, 8},
      {4, 8},
      {3, 8},
      {2, 8},
      {1, 8},
      {0, 8},
  };

  // From Appendix D in JISX0510:2004 (p. 67)
  private static final int VERSION_INFO_POLY = 0x1f25;  // 1 1111 0010 0101

  // From Appendix C in JISX0510:2004 (p.65).
  private static final int TYPE_INFO_POLY = 0x537;
  private static final int TYPE_INFO_MASK_PATTERN = 0x5412;

  private MatrixUtil() {
    // do nothing
  }

  // Set all cells to -1.  -1 means that the cell is empty (not set yet).
  static void clearMatrix(ByteMatrix matrix) {
    matrix.clear(ByteMatrix.UNSET);
  }

  /**
   * Build the matrix of one mask trial from scratch: function patterns, format information,
   * version information and finally the data bits, which are consumed from {@code dataBits}.
   */
  static void buildMatrix(BitStream dataBits,
                          Version version,
                          DataMask mask,
                          ByteMatrix matrix) {
    clearMatrix(matrix);
    embedBasicPatterns(version, matrix);
    embedTypeInfo(version.getErrorCorrectionLevel(), mask.getReference(), matrix);
    maybeEmbedVersionInfo(version, matrix);
    embedDataBits(dataBits, mask, matrix);
  }

  /**
   * Embed basic patterns. On success, modify the matrix and return true.
   * The basic patterns are:
   * - Position detection patterns
   * - Timing patterns
   * - Dark dot at the left bottom corner
   * - Position adjustment patterns, if need be
   */
  static void embedBasicPatterns(Version version, ByteMatrix matrix) {
    int dimension = matrix.getWidth();
    embedPositionDetectionPattern(-1, -1, matrix);
    embedPositionDetectionPattern(dimension - 8, -1, matrix);
    embedPositionDetectionPattern(-1, dimension - 8, matrix);
    maybeEmbedPositionAdjustmentPatterns(version, matrix);
    embedTimingPatterns(matrix);
    embedDarkDotAtLeftBottomCorner(matrix);
  }

  /**
   * Embed type information: the error correction level and mask reference, twice.
   */
  static void embedTypeInfo(ErrorCorrectionLevel ecLevel, int maskPattern, ByteMatrix matrix) {
    int typeInfoBits = makeTypeInfoBits(ecLevel, maskPattern);
    int dimension = matrix.getWidth();

    for (int i = 0; i < TYPE_INFO_COORDINATES.length; ++i) {
      boolean bit = ((typeInfoBits >>> i) & 1) != 0;

      // Type info bits at the left top corner.
      int x1 = TYPE_INFO_COORDINATES[i][0];
      int y1 = TYPE_INFO_COORDINATES[i][1];
      matrix.set(x1, y1, bit);

      if (i < 8) {
        // Right top corner.
        matrix.set(dimension - 1 - i, 8, bit);
      } else {
        // Left bottom corner.
        matrix.set(8, dimension - 15 + i, bit);
      }
    }
  }

  /**
   * Embed version information if need be. See 8.10 of JISX0510:2004 (p.47) for how to embed
   * version information.
   */
  static void maybeEmbedVersionInfo(Version version, ByteMatrix matrix) {
    if (version.getVersionNumber() < 7) {  // Version info is necessary if version >= 7.
      return;  // Don't need version info.
    }
    int versionInfoBits = makeVersionInfoBits(version.getVersionNumber());
    int dimension = matrix.getWidth();

    for (int i = 0; i < 18; i++) {
      boolean bit = ((versionInfoBits >>> i) & 1) != 0;
      int a = dimension - 11 + i % 3;
      int b = i / 3;
      // Right top corner.
      matrix.set(a, b, bit);
      // Left bottom corner.
      matrix.set(b, a, bit);
    }
  }

  /**
   * Embed data bits into the cells left empty by the previous steps, walking the zigzag path
   * and flipping the bits selected by {@code mask}. Once {@code dataBits} runs out, the
   * remaining cells receive 0 before masking.
   */
  static void embedDataBits(BitStream dataBits, DataMask mask, ByteMatrix matrix) {
    for (ModulePosition position : zigzagPath(matrix.getWidth())) {
      int x = position.getX();
      int y = position.getY();
      if (matrix.get(x, y) != ByteMatrix.UNSET) {
        continue;
      }
      int bit = dataBits.popBit();
      if (bit == BitStream.EXHAUSTED) {
        bit = 0;
      }
      if (mask.isMasked(x, y)) {
        bit ^= 1;
      }
      matrix.set(x, y, bit);
    }
  }

  /**
   * The placement order of data modules: column pairs from the right edge, sweeping up then
   * down alternately and stepping over the vertical timing pattern at column 6.
   */
  static List<ModulePosition> zigzagPath(int dimension) {
    List<ModulePosition> path = new ArrayList<>(dimension * dimension);
    boolean goingUp = true;
    int column = dimension - 1;
    while (column > 0) {
      if (column == 6) {
        column--;
      }
      for (int i = 0; i < dimension; i++) {
        int row = goingUp ? dimension - 1 - i : i;
        path.add(new ModulePosition(column, row));
        path.add(new ModulePosition(column - 1, row));
      }
      goingUp = !goingUp;
      column -= 2;
    }
    return path;
  }

  /**
   * Make bit vector of type information. Encode error correction level and mask pattern. See 8.9
   * of JISX0510:2004 (p.45) for details.
   *
   * @return the 15 format bits, BCH protected and masked with 0x5412
   */
  static int makeTypeInfoBits(ErrorCorrectionLevel ecLevel, int maskPattern) {
    if (!QRCode.isValidMaskPattern(maskPattern)) {
      throw new IllegalArgumentException("Invalid mask pattern: " + maskPattern);
    }
    int typeInfo = (ecLevel.getBits() << 3) | maskPattern;
    int remainder = calculateBCHRemainder(typeInfo << 10, TYPE_INFO_POLY, 14, 10);
    return ((typeInfo << 10) | remainder) ^ TYPE_INFO_MASK_PATTERN;
  }

  /**
   * Make bit vector of version information. See 8.10 of JISX0510:2004 (p.45) for details.
   *
   * @return the 18 version bits: the 6-bit version followed by its 12-bit BCH remainder
   */
  static int makeVersionInfoBits(int versionNumber) {
    int remainder = calculateBCHRemainder(versionNumber << 12, VERSION_INFO_POLY, 17, 12);
    return (versionNumber << 12) | remainder;
  }

  /**
   * Reduces {@code data} against {@code poly}, whose highest term is x^{@code polyDegree}, by
   * clearing every set bit from {@code highBit} down to {@code polyDegree}.
   */
  static int calculateBCHRemainder(int data, int poly, int highBit, int polyDegree) {
    int value = data;
    for (int i = highBit; i >= polyDegree; i--) {
      if (((value >>> i) & 1) != 0) {
        value ^= poly << (i - polyDegree);
      }
    }
    return value & ((1 << polyDegree) - 1);
  }

  private static void embedTimingPatterns(ByteMatrix matrix) {
    // -8 is for skipping position detection patterns (size 7), and two horizontal/vertical
    // separation patterns (size 1). Thus, 8 = 7 + 1.
    for (int i = 8; i < matrix.getWidth() - 8; ++i) {
      int bit = (i + 1) % 2;
      matrix.set(i, 6, bit);
      matrix.set(6, i, bit);
    }
  }

  // Embed the lonely dark dot at left bottom corner. JISX0510:2004 (p.46)
  private static void embedDarkDotAtLeftBottomCorner(ByteMatrix matrix) {
    matrix.set(8, matrix.getHeight() - 8, 1);
  }

  private static void embedPositionAdjustmentPattern(int xStart, int yStart, ByteMatrix matrix) {
    for (int y = 0; y < 5; ++y) {
      int[] patternY = POSITION_ADJUSTMENT_PATTERN[y];
      for (int x = 0; x < 5; ++x) {
        matrix.set(xStart + x, yStart + y, patternY[x]);
      }
    }
  }

  // Clipped to the matrix, since the separators of a corner pattern fall outside of it
  private static void embedPositionDetectionPattern(int xStart, int yStart, ByteMatrix matrix) {
    for (int y = 0; y < 9; ++y) {
      int[] patternY = POSITION_DETECTION_PATTERN[y];
      for (int x = 0; x < 9; ++x) {
        int targetX = xStart + x;
        int targetY = yStart + y;
        if (isInside(targetX, targetY, matrix)) {
          matrix.set(targetX, targetY, patternY[x]);
        }
      }
    }
  }

  // An alignment pattern is skipped altogether when it would overlap anything drawn before it
  private static void maybeEmbedPositionAdjustmentPatterns(Version version, ByteMatrix matrix) {
    int[] centers = version.getAlignmentPatternCenters();
    for (int y : centers) {
      for (int x : centers) {
        int xStart = x - 2;
        int yStart = y - 2;
        if (isFootprintEmpty(xStart, yStart, matrix)) {
          embedPositionAdjustmentPattern(xStart, yStart, matrix);
        }
      }
    }
  }

  private static boolean isFootprintEmpty(int xStart, int yStart, ByteMatrix matrix) {
    for (int y = yStart; y < yStart + 5; y++) {
      for (int x = xStart; x < xStart + 5; x++) {
        if (isInside(x, y, matrix) && matrix.get(x, y) != ByteMatrix.UNSET) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean isInside(int x, int y, ByteMatrix matrix) {
    return x >= 0 && x < matrix.getWidth() && y >= 0 && y < matrix.getHeight();
  }

}
