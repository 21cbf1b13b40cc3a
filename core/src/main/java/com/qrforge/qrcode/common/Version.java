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

package com.qrforge.qrcode.common;

/**
 * <p>The parameters of a QR Code symbol of one version at one error correction level: its
 * dimension, codeword counts, alignment pattern positions and the way its codewords are split
 * into Reed-Solomon blocks. Instances are immutable and shared.</p>
 *
 * <p>See ISO 18004:2006 Annex D.</p>
 */
public final class Version {

  public static final int MIN_VERSION_NUMBER = 1;
  public static final int MAX_VERSION_NUMBER = 40;

  // Indexed by [level ordinal][version number]; column 0 is unused
  private static final int[][] EC_CODEWORDS_PER_BLOCK = {
      {-1, 7, 10, 15, 20, 26, 18, 20, 24, 30, 18, 20, 24, 26, 30, 22, 24, 28, 30, 28, 28,
          28, 28, 30, 30, 26, 28, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30},
      {-1, 10, 16, 26, 18, 24, 16, 18, 22, 22, 26, 30, 22, 22, 24, 24, 28, 28, 26, 26, 26,
          26, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28, 28},
      {-1, 13, 22, 18, 26, 18, 24, 18, 22, 20, 24, 28, 26, 24, 20, 30, 24, 28, 28, 26, 30,
          28, 30, 30, 30, 30, 28, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30},
      {-1, 17, 28, 22, 16, 22, 28, 26, 26, 24, 28, 24, 28, 22, 24, 24, 30, 28, 28, 26, 28,
          30, 24, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30, 30},
  };

  private static final int[][] NUM_ERROR_CORRECTION_BLOCKS = {
      {-1, 1, 1, 1, 1, 1, 2, 2, 2, 2, 4, 4, 4, 4, 4, 6, 6, 6, 6, 7, 8,
          8, 9, 9, 10, 12, 12, 12, 13, 14, 15, 16, 17, 18, 19, 19, 20, 21, 22, 24, 25},
      {-1, 1, 1, 1, 2, 2, 4, 4, 4, 5, 5, 5, 8, 9, 9, 10, 10, 11, 13, 14, 16,
          17, 17, 18, 20, 21, 23, 25, 26, 28, 29, 31, 33, 35, 37, 38, 40, 43, 45, 47, 49},
      {-1, 1, 1, 2, 2, 4, 4, 6, 6, 8, 8, 8, 10, 12, 16, 12, 17, 16, 18, 21, 20,
          23, 23, 25, 27, 29, 34, 34, 35, 38, 40, 43, 45, 48, 51, 53, 56, 59, 62, 65, 68},
      {-1, 1, 1, 2, 4, 4, 4, 5, 6, 8, 8, 11, 11, 16, 16, 18, 16, 19, 21, 25, 25,
          25, 34, 30, 32, 35, 37, 40, 42, 45, 48, 51, 54, 57, 60, 63, 66, 70, 74, 77, 81},
  };

  private static final Version[][] VERSIONS = buildVersions();

  private final int versionNumber;
  private final ErrorCorrectionLevel ecLevel;
  private final int dimension;
  private final int totalCodewords;
  private final int[] alignmentPatternCenters;
  private final int ecCodewordsPerBlock;
  private final ECBlocks ecBlocks;
  private final int numDataCodewords;

  private Version(int versionNumber, ErrorCorrectionLevel ecLevel) {
    int ecLevelNum = getECLevelNum(ecLevel);
    this.versionNumber = versionNumber;
    this.ecLevel = ecLevel;
    this.dimension = getDimensionForVersion(versionNumber);
    this.totalCodewords = getNumRawDataModules(versionNumber) / 8;
    this.alignmentPatternCenters = buildAlignmentPatternCenters(versionNumber);
    this.ecCodewordsPerBlock = EC_CODEWORDS_PER_BLOCK[ecLevelNum][versionNumber];

    int numBlocks = NUM_ERROR_CORRECTION_BLOCKS[ecLevelNum][versionNumber];
    this.numDataCodewords = totalCodewords - ecCodewordsPerBlock * numBlocks;
    if (numDataCodewords < 0) {
      throw new IllegalStateException("Negative data codeword count for version " + versionNumber + '-' + ecLevel);
    }

    // Blocks one codeword longer than the others take up the remainder, and come last
    int numLongBlocks = totalCodewords % numBlocks;
    int numShortBlocks = numBlocks - numLongBlocks;
    int shortBlockLength = totalCodewords / numBlocks;
    ECB shortBlocks = new ECB(numShortBlocks, shortBlockLength, shortBlockLength - ecCodewordsPerBlock);
    if (numLongBlocks == 0) {
      this.ecBlocks = new ECBlocks(ecCodewordsPerBlock, shortBlocks);
    } else {
      ECB longBlocks = new ECB(numLongBlocks, shortBlockLength + 1, shortBlockLength + 1 - ecCodewordsPerBlock);
      this.ecBlocks = new ECBlocks(ecCodewordsPerBlock, shortBlocks, longBlocks);
    }
  }

  /**
   * @param versionNumber version number, 1 to 40
   * @param ecLevel error correction level
   * @return the shared instance for that version and level
   * @throws IllegalArgumentException if the version number is out of range
   */
  public static Version getVersion(int versionNumber, ErrorCorrectionLevel ecLevel) {
    if (versionNumber < MIN_VERSION_NUMBER || versionNumber > MAX_VERSION_NUMBER) {
      throw new IllegalArgumentException("Version must be between 1 and 40, was " + versionNumber);
    }
    if (ecLevel == null) {
      throw new IllegalArgumentException("Error correction level is required");
    }
    return VERSIONS[versionNumber - 1][getECLevelNum(ecLevel)];
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public ErrorCorrectionLevel getErrorCorrectionLevel() {
    return ecLevel;
  }

  /**
   * @return modules per side, {@code 17 + 4 * version}
   */
  public int getDimensionForVersion() {
    return dimension;
  }

  /**
   * @return data and error correction codewords together
   */
  public int getTotalCodewords() {
    return totalCodewords;
  }

  public int getNumDataCodewords() {
    return numDataCodewords;
  }

  public int getECCodewordsPerBlock() {
    return ecCodewordsPerBlock;
  }

  public int getNumBlocks() {
    return ecBlocks.getNumBlocks();
  }

  public ECBlocks getECBlocks() {
    return ecBlocks;
  }

  /**
   * @return width of the character count field of byte mode segments
   */
  public int getCharacterCountBits() {
    return Mode.BYTE.getCharacterCountBits(versionNumber);
  }

  /**
   * @return alignment pattern centers along one axis, ascending; empty for version 1
   */
  public int[] getAlignmentPatternCenters() {
    return alignmentPatternCenters.clone();
  }

  public int getAlignmentPatternCount() {
    return alignmentPatternCenters.length;
  }

  public static int getDimensionForVersion(int versionNumber) {
    return 17 + 4 * versionNumber;
  }

  /**
   * @return modules left for data and error correction codewords, remainder bits included,
   *  once every function pattern and the format and version areas are excluded
   */
  static int getNumRawDataModules(int versionNumber) {
    int result = (16 * versionNumber + 128) * versionNumber + 64;
    if (versionNumber >= 2) {
      int numAlign = versionNumber / 7 + 2;
      result -= (25 * numAlign - 10) * numAlign - 55;
      if (versionNumber >= 7) {
        result -= 36;
      }
    }
    return result;
  }

  private static int[] buildAlignmentPatternCenters(int versionNumber) {
    if (versionNumber == 1) {
      return new int[0];
    }
    int numAlign = versionNumber / 7 + 2;
    int step;
    if (versionNumber == 32) {
      step = 26;
    } else {
      step = (versionNumber * 4 + numAlign * 2 + 1) / (2 * numAlign - 2) * 2;
    }
    int[] result = new int[numAlign];
    result[0] = 6;
    for (int i = result.length - 1, position = getDimensionForVersion(versionNumber) - 7; i >= 1; i--, position -= step) {
      result[i] = position;
    }
    return result;
  }

  private static int getECLevelNum(ErrorCorrectionLevel ecLevel) {
    int ecLevelNum = 0;
    switch (ecLevel) {
      case L:
        ecLevelNum = 0;
        break;
      case M:
        ecLevelNum = 1;
        break;
      case Q:
        ecLevelNum = 2;
        break;
      case H:
        ecLevelNum = 3;
        break;
    }
    return ecLevelNum;
  }

  private static Version[][] buildVersions() {
    ErrorCorrectionLevel[] levels = ErrorCorrectionLevel.values();
    Version[][] versions = new Version[MAX_VERSION_NUMBER][levels.length];
    for (int number = MIN_VERSION_NUMBER; number <= MAX_VERSION_NUMBER; number++) {
      for (ErrorCorrectionLevel level : levels) {
        versions[number - 1][getECLevelNum(level)] = new Version(number, level);
      }
    }
    return versions;
  }

  @Override
  public String toString() {
    return versionNumber + "-" + ecLevel;
  }

  /**
   * <p>Encapsulates a set of error-correction blocks in one symbol version. Most versions will
   * use blocks of differing sizes within one version, so, this encapsulates the parameters for
   * each set of blocks. It also holds the number of error-correction codewords per block since it
   * will be the same across all blocks within one version.</p>
   */
  public static final class ECBlocks {
    private final int ecCodewordsPerBlock;
    private final ECB[] ecBlocks;

    ECBlocks(int ecCodewordsPerBlock, ECB... ecBlocks) {
      this.ecCodewordsPerBlock = ecCodewordsPerBlock;
      this.ecBlocks = ecBlocks;
    }

    public int getECCodewordsPerBlock() {
      return ecCodewordsPerBlock;
    }

    public int getNumBlocks() {
      int total = 0;
      for (ECB ecBlock : ecBlocks) {
        total += ecBlock.getCount();
      }
      return total;
    }

    /**
     * @return block groups, shorter blocks first
     */
    public ECB[] getECBlocks() {
      return ecBlocks.clone();
    }
  }

  /**
   * <p>Encapsulates the parameters for one error-correction block in one symbol version.
   * This includes the number of data codewords, and the number of times a block with these
   * parameters is used consecutively in the QR code version's format.</p>
   */
  public static final class ECB {
    private final int count;
    private final int codewords;
    private final int dataCodewords;

    ECB(int count, int codewords, int dataCodewords) {
      this.count = count;
      this.codewords = codewords;
      this.dataCodewords = dataCodewords;
    }

    public int getCount() {
      return count;
    }

    public int getCodewords() {
      return codewords;
    }

    public int getDataCodewords() {
      return dataCodewords;
    }
  }

}
