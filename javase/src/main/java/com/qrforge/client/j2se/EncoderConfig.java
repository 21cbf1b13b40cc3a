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

package com.qrforge.client.j2se;

import com.qrforge.qrcode.common.ErrorCorrectionLevel;
import com.qrforge.qrcode.common.Version;
import com.qrforge.qrcode.encoder.QRCode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Validated parameters of one encoding request: image geometry, symbol parameters and the
 * payload bytes. Every setter rejects bad input with an {@link IllegalArgumentException} whose
 * message is fit to show to the user.
 */
public final class EncoderConfig {

  public static final int DEFAULT_SIZE = 256;
  public static final int DEFAULT_MARGIN = 20;
  public static final int DEFAULT_VERSION = 7;
  public static final ErrorCorrectionLevel DEFAULT_ERROR_CORRECTION_LEVEL = ErrorCorrectionLevel.Q;
  public static final String DEFAULT_TEXT = "https://github.com/agtkh/";

  private static final String AUTO_MASK = "auto";

  private int size = DEFAULT_SIZE;
  private int margin = DEFAULT_MARGIN;
  private int version = DEFAULT_VERSION;
  private ErrorCorrectionLevel errorCorrectionLevel = DEFAULT_ERROR_CORRECTION_LEVEL;
  private int maskPattern = QRCode.AUTO_MASK;
  private byte[] contents = DEFAULT_TEXT.getBytes(StandardCharsets.UTF_8);

  public int getSize() {
    return size;
  }

  public void setSize(int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Size must be positive.");
    }
    this.size = size;
  }

  public int getMargin() {
    return margin;
  }

  public void setMargin(int margin) {
    if (margin < 0) {
      throw new IllegalArgumentException("Margin must not be negative.");
    }
    this.margin = margin;
  }

  public int getVersion() {
    return version;
  }

  public void setVersion(int version) {
    if (version < Version.MIN_VERSION_NUMBER || version > Version.MAX_VERSION_NUMBER) {
      throw new IllegalArgumentException("Version must be between 1 and 40.");
    }
    this.version = version;
  }

  public ErrorCorrectionLevel getErrorCorrectionLevel() {
    return errorCorrectionLevel;
  }

  /**
   * @param name one of L, M, Q or H, in any case
   */
  public void setErrorCorrectionLevel(String name) {
    switch (name.toUpperCase(Locale.ROOT)) {
      case "L":
        errorCorrectionLevel = ErrorCorrectionLevel.L;
        break;
      case "M":
        errorCorrectionLevel = ErrorCorrectionLevel.M;
        break;
      case "Q":
        errorCorrectionLevel = ErrorCorrectionLevel.Q;
        break;
      case "H":
        errorCorrectionLevel = ErrorCorrectionLevel.H;
        break;
      default:
        throw new IllegalArgumentException("Invalid Error Correction Level. Use L, M, Q, or H.");
    }
  }

  /**
   * @return the pinned mask, 0 to 7, or {@link QRCode#AUTO_MASK}
   */
  public int getMaskPattern() {
    return maskPattern;
  }

  /**
   * @param value {@code auto} or a mask reference from 0 to 7
   */
  public void setMaskPattern(String value) {
    if (AUTO_MASK.equals(value)) {
      maskPattern = QRCode.AUTO_MASK;
      return;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Invalid mask pattern value.", nfe);
    }
    if (!QRCode.isValidMaskPattern(parsed)) {
      throw new IllegalArgumentException("Mask pattern must be between 0 and 7.");
    }
    maskPattern = parsed;
  }

  public byte[] getContents() {
    return contents.clone();
  }

  /**
   * Picks the payload from the first source given, in the order {@code base64}, {@code bytes},
   * {@code text}. With no source given the payload is {@link #DEFAULT_TEXT}.
   *
   * @param base64 standard Base64 of the payload, or null
   * @param bytes comma separated decimal byte values, or null
   * @param text text encoded as UTF-8, or null
   */
  public void setContents(String base64, String bytes, String text) {
    if (base64 != null) {
      contents = decodeBase64(base64);
    } else if (bytes != null) {
      contents = parseByteList(bytes);
    } else if (text != null) {
      contents = text.getBytes(StandardCharsets.UTF_8);
    } else {
      contents = DEFAULT_TEXT.getBytes(StandardCharsets.UTF_8);
    }
  }

  static byte[] decodeBase64(String base64) {
    try {
      return Base64.getDecoder().decode(base64);
    } catch (IllegalArgumentException iae) {
      throw new IllegalArgumentException("Invalid Base64 string provided in 'base64' parameter.", iae);
    }
  }

  static byte[] parseByteList(String bytes) {
    String[] values = bytes.split(",", -1);
    byte[] result = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      int value;
      try {
        value = Integer.parseInt(values[i].trim());
      } catch (NumberFormatException nfe) {
        throw new IllegalArgumentException("Invalid byte value in 'bytes' parameter: '" + values[i] + "'", nfe);
      }
      if (value < 0 || value > 255) {
        throw new IllegalArgumentException("Byte value in 'bytes' parameter must be between 0 and 255.");
      }
      result[i] = (byte) value;
    }
    return result;
  }

}
