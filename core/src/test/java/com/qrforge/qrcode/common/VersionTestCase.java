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

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests {@link Version}.
 */
public final class VersionTestCase extends Assert {

  @Test
  public void checkVersion1() {
    Version version = Version.getVersion(1, ErrorCorrectionLevel.M);
    assertEquals(1, version.getVersionNumber());
    assertEquals(ErrorCorrectionLevel.M, version.getErrorCorrectionLevel());
    assertEquals(21, version.getDimensionForVersion());
    assertEquals(26, version.getTotalCodewords());
    assertEquals(16, version.getNumDataCodewords());
    assertEquals(10, version.getECCodewordsPerBlock());
    assertEquals(1, version.getNumBlocks());
    assertEquals(0, version.getAlignmentPatternCount());
    assertEquals(8, version.getCharacterCountBits());
  }

  @Test
  public void checkVersion4() {
    Version version = Version.getVersion(4, ErrorCorrectionLevel.M);
    assertEquals(100, version.getTotalCodewords());
    assertEquals(64, version.getNumDataCodewords());
    assertEquals(2, version.getNumBlocks());
    Version.ECB[] ecBlocks = version.getECBlocks().getECBlocks();
    assertEquals(1, ecBlocks.length);
    assertEquals(2, ecBlocks[0].getCount());
    assertEquals(50, ecBlocks[0].getCodewords());
    assertEquals(32, ecBlocks[0].getDataCodewords());
  }

  @Test
  public void checkVersion7() {
    Version version = Version.getVersion(7, ErrorCorrectionLevel.Q);
    assertEquals(45, version.getDimensionForVersion());
    assertEquals(196, version.getTotalCodewords());
    assertEquals(88, version.getNumDataCodewords());
    assertEquals(6, version.getNumBlocks());
    assertArrayEquals(new int[] {6, 22, 38}, version.getAlignmentPatternCenters());

    // Short blocks come first
    Version.ECB[] ecBlocks = version.getECBlocks().getECBlocks();
    assertEquals(2, ecBlocks.length);
    assertEquals(2, ecBlocks[0].getCount());
    assertEquals(32, ecBlocks[0].getCodewords());
    assertEquals(14, ecBlocks[0].getDataCodewords());
    assertEquals(4, ecBlocks[1].getCount());
    assertEquals(33, ecBlocks[1].getCodewords());
    assertEquals(15, ecBlocks[1].getDataCodewords());
  }

  @Test
  public void checkVersion10() {
    Version version = Version.getVersion(10, ErrorCorrectionLevel.L);
    assertEquals(346, version.getTotalCodewords());
    assertEquals(274, version.getNumDataCodewords());
    assertEquals(4, version.getNumBlocks());
    assertEquals(16, version.getCharacterCountBits());
  }

  @Test
  public void checkVersion40() {
    assertEquals(2956, Version.getVersion(40, ErrorCorrectionLevel.L).getNumDataCodewords());
    assertEquals(1276, Version.getVersion(40, ErrorCorrectionLevel.H).getNumDataCodewords());
    Version version = Version.getVersion(40, ErrorCorrectionLevel.H);
    assertEquals(177, version.getDimensionForVersion());
    assertEquals(3706, version.getTotalCodewords());
    assertEquals(81, version.getNumBlocks());
    assertArrayEquals(new int[] {6, 30, 58, 86, 114, 142, 170}, version.getAlignmentPatternCenters());
  }

  @Test
  public void testAlignmentPatternCenters() {
    assertArrayEquals(new int[] {6, 18}, Version.getVersion(2, ErrorCorrectionLevel.L).getAlignmentPatternCenters());
    assertArrayEquals(new int[] {6, 26, 48, 70}, Version.getVersion(15, ErrorCorrectionLevel.L).getAlignmentPatternCenters());
    assertArrayEquals(new int[] {6, 34, 60, 86, 112, 138},
        Version.getVersion(32, ErrorCorrectionLevel.L).getAlignmentPatternCenters());
  }

  @Test
  public void testBlockLayoutAddsUp() {
    for (int number = Version.MIN_VERSION_NUMBER; number <= Version.MAX_VERSION_NUMBER; number++) {
      for (ErrorCorrectionLevel level : ErrorCorrectionLevel.values()) {
        Version version = Version.getVersion(number, level);
        assertEquals(Version.getDimensionForVersion(number), version.getDimensionForVersion());
        assertTrue(version.getNumDataCodewords() >= 0);

        int totalCodewords = 0;
        int dataCodewords = 0;
        int numBlocks = 0;
        for (Version.ECB ecb : version.getECBlocks().getECBlocks()) {
          totalCodewords += ecb.getCount() * ecb.getCodewords();
          dataCodewords += ecb.getCount() * ecb.getDataCodewords();
          numBlocks += ecb.getCount();
          assertEquals(version.getECCodewordsPerBlock(), ecb.getCodewords() - ecb.getDataCodewords());
        }
        assertEquals(version.toString(), version.getTotalCodewords(), totalCodewords);
        assertEquals(version.toString(), version.getNumDataCodewords(), dataCodewords);
        assertEquals(version.getNumBlocks(), numBlocks);
      }
    }
  }

  @Test
  public void testRawDataModules() {
    assertEquals(208, Version.getNumRawDataModules(1));
    assertEquals(359, Version.getNumRawDataModules(2));
    assertEquals(1568, Version.getNumRawDataModules(7));
    assertEquals(29648, Version.getNumRawDataModules(40));
  }

  @Test
  public void testVersionsAreShared() {
    assertSame(Version.getVersion(7, ErrorCorrectionLevel.Q), Version.getVersion(7, ErrorCorrectionLevel.Q));
    assertNotSame(Version.getVersion(7, ErrorCorrectionLevel.Q), Version.getVersion(7, ErrorCorrectionLevel.H));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVersionTooSmall() {
    Version.getVersion(0, ErrorCorrectionLevel.L);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVersionTooLarge() {
    Version.getVersion(41, ErrorCorrectionLevel.L);
  }

}
