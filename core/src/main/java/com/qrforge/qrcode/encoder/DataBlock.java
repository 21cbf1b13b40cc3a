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

import com.qrforge.common.reedsolomon.ReedSolomonEncoder;
import com.qrforge.qrcode.common.Version;

/**
 * <p>Encapsulates a block of data within a QR Code. QR Codes may split their data into
 * multiple blocks, each of which is a unit of data and error-correction codewords. Each
 * is represented by an instance of this class.</p>
 */
final class DataBlock {

  private final byte[] dataBytes;
  private final byte[] errorCorrectionBytes;

  private DataBlock(byte[] dataBytes, byte[] errorCorrectionBytes) {
    this.dataBytes = dataBytes;
    this.errorCorrectionBytes = errorCorrectionBytes;
  }

  /**
   * <p>Splits the data codewords of a symbol into its blocks, shorter blocks first, and
   * computes the error correction codewords of each.</p>
   *
   * @param dataCodewords all data codewords of the symbol, in order
   * @param version version and error correction level of the symbol
   * @param rsEncoder encoder for the error correction codewords
   * @return DataBlocks in the order they are interleaved
   */
  static DataBlock[] getDataBlocks(byte[] dataCodewords,
                                   Version version,
                                   ReedSolomonEncoder rsEncoder) {

    if (dataCodewords.length != version.getNumDataCodewords()) {
      throw new IllegalArgumentException("Expected " + version.getNumDataCodewords()
          + " data codewords but got " + dataCodewords.length);
    }

    Version.ECBlocks ecBlocks = version.getECBlocks();
    int numEcBytesInBlock = ecBlocks.getECCodewordsPerBlock();
    DataBlock[] result = new DataBlock[ecBlocks.getNumBlocks()];

    int resultOffset = 0;
    int dataOffset = 0;
    for (Version.ECB ecBlock : ecBlocks.getECBlocks()) {
      for (int i = 0; i < ecBlock.getCount(); i++) {
        int numDataBytesInBlock = ecBlock.getDataCodewords();
        byte[] dataBytes = new byte[numDataBytesInBlock];
        System.arraycopy(dataCodewords, dataOffset, dataBytes, 0, numDataBytesInBlock);
        dataOffset += numDataBytesInBlock;
        byte[] ecBytes = generateECBytes(dataBytes, numEcBytesInBlock, rsEncoder);
        result[resultOffset++] = new DataBlock(dataBytes, ecBytes);
      }
    }
    return result;
  }

  static byte[] generateECBytes(byte[] dataBytes, int numEcBytesInBlock, ReedSolomonEncoder rsEncoder) {
    int numDataBytes = dataBytes.length;
    int[] toEncode = new int[numDataBytes];
    for (int i = 0; i < numDataBytes; i++) {
      toEncode[i] = dataBytes[i] & 0xFF;
    }
    int[] ecCodewords = rsEncoder.encode(toEncode, numEcBytesInBlock);
    byte[] ecBytes = new byte[ecCodewords.length];
    for (int i = 0; i < ecCodewords.length; i++) {
      ecBytes[i] = (byte) ecCodewords[i];
    }
    return ecBytes;
  }

  byte[] getDataBytes() {
    return dataBytes;
  }

  byte[] getErrorCorrectionBytes() {
    return errorCorrectionBytes;
  }

}
