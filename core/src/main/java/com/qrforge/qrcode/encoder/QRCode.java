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

import com.qrforge.qrcode.common.ErrorCorrectionLevel;
import com.qrforge.qrcode.common.Mode;
import com.qrforge.qrcode.common.Version;

/**
 * The result of encoding: the parameters of the symbol and its finished module matrix.
 */
public final class QRCode {

  public static final int NUM_MASK_PATTERNS = 8;

  /** Passed as a mask pattern to let the encoder pick the mask with the lowest penalty. */
  public static final int AUTO_MASK = -1;

  private final Mode mode;
  private final ErrorCorrectionLevel ecLevel;
  private final Version version;
  private final int maskPattern;
  private final int penalty;
  private final ByteMatrix matrix;

  QRCode(Mode mode, Version version, int maskPattern, int penalty, ByteMatrix matrix) {
    this.mode = mode;
    this.ecLevel = version.getErrorCorrectionLevel();
    this.version = version;
    this.maskPattern = maskPattern;
    this.penalty = penalty;
    this.matrix = matrix;
  }

  public Mode getMode() {
    return mode;
  }

  public ErrorCorrectionLevel getECLevel() {
    return ecLevel;
  }

  public Version getVersion() {
    return version;
  }

  public int getMaskPattern() {
    return maskPattern;
  }

  /**
   * @return total mask penalty of the matrix, or -1 when the mask was pinned and never scored
   */
  public int getPenalty() {
    return penalty;
  }

  public ByteMatrix getMatrix() {
    return matrix;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder(200);
    result.append("<<\n");
    result.append(" mode: ");
    result.append(mode);
    result.append("\n ecLevel: ");
    result.append(ecLevel);
    result.append("\n version: ");
    result.append(version.getVersionNumber());
    result.append("\n maskPattern: ");
    result.append(maskPattern);
    if (matrix == null) {
      result.append("\n matrix: null\n");
    } else {
      result.append("\n matrix:\n");
      result.append(matrix);
    }
    result.append(">>\n");
    return result.toString();
  }

  // Check if "mask_pattern" is valid.
  public static boolean isValidMaskPattern(int maskPattern) {
    return maskPattern >= 0 && maskPattern < NUM_MASK_PATTERNS;
  }

}
