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
 * Penalty rules used to choose between the eight data masks. A lower total penalty means
 * fewer patterns that could confuse a reader.
 */
final class MaskUtil {

  // Penalty weights from section 6.8.2.1
  private static final int N1 = 3;
  private static final int N2 = 3;
  private static final int N3 = 40;
  private static final int N4 = 10;

  private static final byte[] FINDER_LIKE_BEFORE_QUIET = {1, 0, 1, 1, 1, 0, 1, 0, 0, 0, 0};
  private static final byte[] FINDER_LIKE_AFTER_QUIET = {0, 0, 0, 0, 1, 0, 1, 1, 1, 0, 1};

  private MaskUtil() {
    // do nothing
  }

  /**
   * @return the sum of the four penalty rules for a fully drawn matrix
   */
  static int calculateMaskPenalty(ByteMatrix matrix) {
    return applyMaskPenaltyRule1(matrix)
        + applyMaskPenaltyRule2(matrix)
        + applyMaskPenaltyRule3(matrix)
        + applyMaskPenaltyRule4(matrix);
  }

  /**
   * Apply mask penalty rule 1 and return the penalty. Find repetitive cells with the same color and
   * give penalty to them. Example: 00000 or 11111.
   */
  static int applyMaskPenaltyRule1(ByteMatrix matrix) {
    return applyMaskPenaltyRule1Internal(matrix, true) + applyMaskPenaltyRule1Internal(matrix, false);
  }

  /**
   * Apply mask penalty rule 2 and return the penalty. Find 2x2 blocks with the same color and give
   * penalty to them. Overlapping blocks each count.
   */
  static int applyMaskPenaltyRule2(ByteMatrix matrix) {
    int penalty = 0;
    byte[][] array = matrix.getArray();
    int width = matrix.getWidth();
    int height = matrix.getHeight();
    for (int y = 0; y < height - 1; y++) {
      byte[] arrayY = array[y];
      byte[] arrayNextY = array[y + 1];
      for (int x = 0; x < width - 1; x++) {
        int value = arrayY[x];
        if (value == arrayY[x + 1] && value == arrayNextY[x] && value == arrayNextY[x + 1]) {
          penalty++;
        }
      }
    }
    return N2 * penalty;
  }

  /**
   * Apply mask penalty rule 3 and return the penalty. Find consecutive runs of 1:1:3:1:1:4
   * starting with black, or 4:1:1:3:1:1 starting with white, and give penalty to them. If we
   * find patterns like 000010111010000, we give penalty twice (i.e. 40 * 2).
   */
  static int applyMaskPenaltyRule3(ByteMatrix matrix) {
    int numPenalties = 0;
    byte[][] array = matrix.getArray();
    int width = matrix.getWidth();
    int height = matrix.getHeight();
    int patternLength = FINDER_LIKE_BEFORE_QUIET.length;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x + patternLength <= width; x++) {
        if (matchesHorizontal(array[y], x, FINDER_LIKE_BEFORE_QUIET)) {
          numPenalties++;
        }
        if (matchesHorizontal(array[y], x, FINDER_LIKE_AFTER_QUIET)) {
          numPenalties++;
        }
      }
    }
    for (int x = 0; x < width; x++) {
      for (int y = 0; y + patternLength <= height; y++) {
        if (matchesVertical(array, x, y, FINDER_LIKE_BEFORE_QUIET)) {
          numPenalties++;
        }
        if (matchesVertical(array, x, y, FINDER_LIKE_AFTER_QUIET)) {
          numPenalties++;
        }
      }
    }
    return numPenalties * N3;
  }

  private static boolean matchesHorizontal(byte[] rowArray, int from, byte[] pattern) {
    for (int i = 0; i < pattern.length; i++) {
      if (rowArray[from + i] != pattern[i]) {
        return false;
      }
    }
    return true;
  }

  private static boolean matchesVertical(byte[][] array, int col, int from, byte[] pattern) {
    for (int i = 0; i < pattern.length; i++) {
      if (array[from + i][col] != pattern[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Apply mask penalty rule 4 and return the penalty. Calculate the ratio of dark cells and give
   * penalty if the ratio is far from 50%. It gives 10 penalty for 5% distance.
   */
  static int applyMaskPenaltyRule4(ByteMatrix matrix) {
    int numDarkCells = 0;
    byte[][] array = matrix.getArray();
    int width = matrix.getWidth();
    int height = matrix.getHeight();
    for (int y = 0; y < height; y++) {
      byte[] arrayY = array[y];
      for (int x = 0; x < width; x++) {
        if (arrayY[x] == 1) {
          numDarkCells++;
        }
      }
    }
    int numTotalCells = matrix.getHeight() * matrix.getWidth();
    // floor(|100 * dark / total - 50| / 5), kept in integers
    int fivePercentVariances = Math.abs(numDarkCells * 100 - numTotalCells * 50) / (numTotalCells * 5);
    return fivePercentVariances * N4;
  }

  /**
   * Helper function for applyMaskPenaltyRule1. We need this for doing this calculation in both
   * vertical and horizontal orders respectively.
   */
  private static int applyMaskPenaltyRule1Internal(ByteMatrix matrix, boolean isHorizontal) {
    int penalty = 0;
    int iLimit = isHorizontal ? matrix.getHeight() : matrix.getWidth();
    int jLimit = isHorizontal ? matrix.getWidth() : matrix.getHeight();
    byte[][] array = matrix.getArray();
    for (int i = 0; i < iLimit; i++) {
      int numSameBitCells = 0;
      int prevBit = -1;
      for (int j = 0; j < jLimit; j++) {
        int bit = isHorizontal ? array[i][j] : array[j][i];
        if (bit == prevBit) {
          numSameBitCells++;
        } else {
          if (numSameBitCells >= 5) {
            penalty += N1 + (numSameBitCells - 5);
          }
          numSameBitCells = 1;  // Include the cell itself.
          prevBit = bit;
        }
      }
      if (numSameBitCells >= 5) {
        penalty += N1 + (numSameBitCells - 5);
      }
    }
    return penalty;
  }

}
