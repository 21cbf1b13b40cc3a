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
 * Tests {@link ErrorCorrectionLevel}.
 */
public final class ErrorCorrectionLevelTestCase extends Assert {

  @Test
  public void testForBits() {
    assertSame(ErrorCorrectionLevel.M, ErrorCorrectionLevel.forBits(0));
    assertSame(ErrorCorrectionLevel.L, ErrorCorrectionLevel.forBits(1));
    assertSame(ErrorCorrectionLevel.H, ErrorCorrectionLevel.forBits(2));
    assertSame(ErrorCorrectionLevel.Q, ErrorCorrectionLevel.forBits(3));
  }

  @Test
  public void testTableOrderDiffersFromFormatBits() {
    assertEquals(0, ErrorCorrectionLevel.L.ordinal());
    assertEquals(1, ErrorCorrectionLevel.M.ordinal());
    assertEquals(2, ErrorCorrectionLevel.Q.ordinal());
    assertEquals(3, ErrorCorrectionLevel.H.ordinal());
    assertEquals(1, ErrorCorrectionLevel.L.getBits());
    assertEquals(0, ErrorCorrectionLevel.M.getBits());
    assertEquals(3, ErrorCorrectionLevel.Q.getBits());
    assertEquals(2, ErrorCorrectionLevel.H.getBits());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadECLevel() {
    ErrorCorrectionLevel.forBits(4);
  }

}
