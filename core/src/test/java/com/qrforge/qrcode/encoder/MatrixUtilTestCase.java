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
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tests {@link MatrixUtil}.
 */
public final class MatrixUtilTestCase extends Assert {

  private static ByteMatrix functionPatterns(Version version, int maskPattern) {
    int dimension = version.getDimensionForVersion();
    ByteMatrix matrix = new ByteMatrix(dimension, dimension);
    MatrixUtil.clearMatrix(matrix);
    MatrixUtil.embedBasicPatterns(version, matrix);
    MatrixUtil.embedTypeInfo(version.getErrorCorrectionLevel(), maskPattern, matrix);
    MatrixUtil.maybeEmbedVersionInfo(version, matrix);
    return matrix;
  }

  private static int countUnset(ByteMatrix matrix) {
    int count = 0;
    for (int y = 0; y < matrix.getHeight(); y++) {
      for (int x = 0; x < matrix.getWidth(); x++) {
        if (matrix.get(x, y) == ByteMatrix.UNSET) {
          count++;
        }
      }
    }
    return count;
  }

  @Test
  public void testClearMatrix() {
    ByteMatrix matrix = new ByteMatrix(2, 2);
    MatrixUtil.clearMatrix(matrix);
    assertEquals(ByteMatrix.UNSET, matrix.get(0, 0));
    assertEquals(ByteMatrix.UNSET, matrix.get(1, 1));
    assertFalse(matrix.isComplete());
  }

  @Test
  public void testMakeTypeInfoBits() {
    assertEquals(0x3A06, MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.Q, 3));
    assertEquals(0x77C4, MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.L, 0));
    assertEquals(0x5412, MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.M, 0));
    assertEquals(0x083B, MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.H, 7));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMakeTypeInfoBitsRejectsBadMask() {
    MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.Q, 8);
  }

  @Test
  public void testMakeVersionInfoBits() {
    assertEquals(0x07C94, MatrixUtil.makeVersionInfoBits(7));
    assertEquals(0x085BC, MatrixUtil.makeVersionInfoBits(8));
    assertEquals(0x15683, MatrixUtil.makeVersionInfoBits(21));
    assertEquals(0x28C69, MatrixUtil.makeVersionInfoBits(40));
  }

  @Test
  public void testCalculateBCHRemainder() {
    // 0x537 divides itself
    assertEquals(0, MatrixUtil.calculateBCHRemainder(0x537, 0x537, 14, 10));
    assertEquals(0, MatrixUtil.calculateBCHRemainder(0, 0x537, 14, 10));
    assertEquals(0x1F25 & 0xFFF, MatrixUtil.calculateBCHRemainder(1 << 12, 0x1F25, 17, 12));
  }

  @Test
  public void testEmbedBasicPatternsVersion1() {
    Version version = Version.getVersion(1, ErrorCorrectionLevel.M);
    ByteMatrix matrix = new ByteMatrix(21, 21);
    MatrixUtil.clearMatrix(matrix);
    MatrixUtil.embedBasicPatterns(version, matrix);

    int[][] corners = {{0, 0}, {14, 0}, {0, 14}};
    for (int[] corner : corners) {
      int x0 = corner[0];
      int y0 = corner[1];
      for (int i = 0; i < 7; i++) {
        // outer dark ring
        assertEquals(1, matrix.get(x0 + i, y0));
        assertEquals(1, matrix.get(x0 + i, y0 + 6));
        assertEquals(1, matrix.get(x0, y0 + i));
        assertEquals(1, matrix.get(x0 + 6, y0 + i));
      }
      // light ring and dark 3x3 center
      assertEquals(0, matrix.get(x0 + 1, y0 + 1));
      assertEquals(0, matrix.get(x0 + 5, y0 + 5));
      for (int y = 2; y <= 4; y++) {
        for (int x = 2; x <= 4; x++) {
          assertEquals(1, matrix.get(x0 + x, y0 + y));
        }
      }
    }
    // separators
    assertEquals(0, matrix.get(7, 7));
    assertEquals(0, matrix.get(13, 7));
    assertEquals(0, matrix.get(7, 13));
    // timing patterns
    for (int i = 8; i <= 12; i++) {
      assertEquals((i + 1) % 2, matrix.get(i, 6));
      assertEquals((i + 1) % 2, matrix.get(6, i));
    }
    // dark module
    assertEquals(1, matrix.get(8, 13));
    // the bottom right stays open for data
    assertEquals(ByteMatrix.UNSET, matrix.get(20, 20));
  }

  @Test
  public void testAlignmentPatternVersion7() {
    Version version = Version.getVersion(7, ErrorCorrectionLevel.Q);
    ByteMatrix matrix = functionPatterns(version, 0);
    int[][] expectedCenters = {{22, 22}, {38, 38}, {6, 22}, {22, 6}, {22, 38}, {38, 22}};
    for (int[] center : expectedCenters) {
      int cx = center[0];
      int cy = center[1];
      assertEquals(1, matrix.get(cx, cy));
      assertEquals(0, matrix.get(cx + 1, cy));
      assertEquals(0, matrix.get(cx, cy - 1));
      assertEquals(1, matrix.get(cx - 2, cy - 2));
      assertEquals(1, matrix.get(cx + 2, cy + 2));
    }
  }

  @Test
  public void testDataModuleCountMatchesCodewordCapacity() {
    for (int number = Version.MIN_VERSION_NUMBER; number <= Version.MAX_VERSION_NUMBER; number++) {
      Version version = Version.getVersion(number, ErrorCorrectionLevel.L);
      int remainderBits = countUnset(functionPatterns(version, 0)) - version.getTotalCodewords() * 8;
      assertTrue("version " + number + " leaves " + remainderBits, remainderBits >= 0 && remainderBits < 8);
    }
    assertEquals(208, countUnset(functionPatterns(Version.getVersion(1, ErrorCorrectionLevel.M), 0)));
    assertEquals(1568, countUnset(functionPatterns(Version.getVersion(7, ErrorCorrectionLevel.Q), 0)));
  }

  @Test
  public void testEmbedTypeInfo() {
    Version version = Version.getVersion(1, ErrorCorrectionLevel.Q);
    ByteMatrix matrix = functionPatterns(version, 3);
    int expected = MatrixUtil.makeTypeInfoBits(ErrorCorrectionLevel.Q, 3);

    int[][] topLeft = {{8, 0}, {8, 1}, {8, 2}, {8, 3}, {8, 4}, {8, 5}, {8, 7}, {8, 8},
                       {7, 8}, {5, 8}, {4, 8}, {3, 8}, {2, 8}, {1, 8}, {0, 8}};
    int firstCopy = 0;
    int secondCopy = 0;
    for (int i = 0; i < 15; i++) {
      firstCopy |= matrix.get(topLeft[i][0], topLeft[i][1]) << i;
      int bit = i < 8 ? matrix.get(20 - i, 8) : matrix.get(8, 21 - 15 + i);
      secondCopy |= bit << i;
    }
    assertEquals(expected, firstCopy);
    assertEquals(expected, secondCopy);
  }

  @Test
  public void testEmbedVersionInfo() {
    Version version = Version.getVersion(7, ErrorCorrectionLevel.Q);
    ByteMatrix matrix = functionPatterns(version, 0);
    int versionInfoBits = MatrixUtil.makeVersionInfoBits(7);
    for (int i = 0; i < 18; i++) {
      int bit = (versionInfoBits >>> i) & 1;
      assertEquals(bit, matrix.get(45 - 11 + i % 3, i / 3));
      assertEquals(bit, matrix.get(i / 3, 45 - 11 + i % 3));
    }
  }

  @Test
  public void testNoVersionInfoBelowVersion7() {
    Version version = Version.getVersion(6, ErrorCorrectionLevel.Q);
    ByteMatrix matrix = functionPatterns(version, 0);
    int dimension = version.getDimensionForVersion();
    assertEquals(ByteMatrix.UNSET, matrix.get(dimension - 11, 0));
    assertEquals(ByteMatrix.UNSET, matrix.get(0, dimension - 11));
  }

  @Test
  public void testZigzagPath() {
    List<ModulePosition> path = MatrixUtil.zigzagPath(21);
    assertEquals(20 * 21, path.size());
    Set<ModulePosition> unique = new HashSet<>(path);
    assertEquals(path.size(), unique.size());
    for (ModulePosition position : path) {
      assertNotEquals(6, position.getX());
    }
    assertEquals(new ModulePosition(20, 20), path.get(0));
    assertEquals(new ModulePosition(19, 20), path.get(1));
    assertEquals(new ModulePosition(20, 19), path.get(2));
    // second sweep runs downwards
    assertEquals(new ModulePosition(18, 0), path.get(42));
    assertEquals(new ModulePosition(17, 0), path.get(43));
    // last pair of columns left of the timing pattern
    assertEquals(new ModulePosition(0, 20), path.get(path.size() - 1));
  }

  @Test
  public void testBuildMatrix() {
    Version version = Version.getVersion(7, ErrorCorrectionLevel.Q);
    BitStream bits = new BitStream();
    for (int i = 0; i < version.getTotalCodewords(); i++) {
      bits.appendBits((i * 37) & 0xFF, 8);
    }
    ByteMatrix matrix = new ByteMatrix(45, 45);
    MatrixUtil.buildMatrix(bits, version, DataMask.DATA_MASK_101, matrix);
    assertTrue(matrix.isComplete());
    assertEquals(0, bits.getRemaining());
  }

}
