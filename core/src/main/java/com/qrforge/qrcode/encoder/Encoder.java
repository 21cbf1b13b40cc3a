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

import com.qrforge.CapacityExceededException;
import com.qrforge.WriterException;
import com.qrforge.common.BitStream;
import com.qrforge.common.reedsolomon.GenericGF;
import com.qrforge.common.reedsolomon.ReedSolomonEncoder;
import com.qrforge.qrcode.common.ErrorCorrectionLevel;
import com.qrforge.qrcode.common.Mode;
import com.qrforge.qrcode.common.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * <p>The main class which implements QR Code encoding: payload bytes in, finished module
 * matrix out.</p>
 *
 * <p>An instance caches Reed-Solomon generator polynomials and is not thread-safe. When built
 * with an {@link Executor}, the eight mask trials of automatic mask selection run on it.</p>
 */
public final class Encoder {

  private static final Logger logger = LoggerFactory.getLogger(Encoder.class);

  private static final int[] PAD_BYTES = {0xEC, 0x11};
  private static final int TERMINATOR_BITS = 4;

  private final ReedSolomonEncoder rsEncoder;
  private final Executor executor;

  public Encoder() {
    this(null);
  }

  /**
   * @param executor runs the mask trials, or {@code null} to run them on the calling thread
   */
  public Encoder(Executor executor) {
    this.rsEncoder = new ReedSolomonEncoder(GenericGF.QR_CODE_FIELD_256);
    this.executor = executor;
  }

  /**
   * Encodes {@code content} in byte mode, choosing the mask with the lowest penalty.
   *
   * @see #encode(byte[], int, ErrorCorrectionLevel, int)
   */
  public QRCode encode(byte[] content, int versionNumber, ErrorCorrectionLevel ecLevel)
      throws WriterException {
    return encode(content, versionNumber, ecLevel, QRCode.AUTO_MASK);
  }

  /**
   * Encodes {@code content} in byte mode into a symbol of the given version and level.
   *
   * @param content payload bytes
   * @param versionNumber symbol version, 1 to 40
   * @param ecLevel error correction level
   * @param maskPattern mask to apply, 0 to 7, or {@link QRCode#AUTO_MASK}
   * @return the symbol, every module of its matrix set to 0 or 1
   * @throws CapacityExceededException if the payload does not fit the version and level
   * @throws WriterException if the interleaved codewords do not add up to the symbol capacity
   * @throws IllegalArgumentException if the version or mask is out of range
   */
  public QRCode encode(byte[] content,
                       int versionNumber,
                       ErrorCorrectionLevel ecLevel,
                       int maskPattern) throws WriterException {
    if (maskPattern != QRCode.AUTO_MASK && !QRCode.isValidMaskPattern(maskPattern)) {
      throw new IllegalArgumentException("Invalid mask pattern: " + maskPattern);
    }
    Version version = Version.getVersion(versionNumber, ecLevel);

    BitStream dataBits = buildDataCodewords(content, Mode.BYTE, version);
    BitStream finalBits = interleaveWithECBytes(dataBits.toBytes(), version);

    if (maskPattern != QRCode.AUTO_MASK) {
      MaskTrial trial = buildTrial(finalBits.copy(), version, DataMask.forReference(maskPattern));
      return new QRCode(Mode.BYTE, version, maskPattern, -1, trial.matrix);
    }

    MaskTrial best = chooseMaskPattern(finalBits, version);
    logger.debug("Version {}: selected mask {} with penalty {}", version, best.maskPattern, best.penalty);
    return new QRCode(Mode.BYTE, version, best.maskPattern, best.penalty, best.matrix);
  }

  /**
   * Builds the data codewords: mode indicator, character count, payload, terminator when it
   * fits, zero bits up to a byte boundary and alternating pad bytes up to the capacity.
   *
   * @return exactly {@code version.getNumDataCodewords() * 8} bits
   * @throws CapacityExceededException if the payload does not fit
   */
  static BitStream buildDataCodewords(byte[] content, Mode mode, Version version)
      throws CapacityExceededException {
    int capacityBits = version.getNumDataCodewords() * 8;
    int numLetterBits = mode.getCharacterCountBits(version.getVersionNumber());
    int requiredBits = 4 + numLetterBits + content.length * 8;
    if (requiredBits > capacityBits) {
      throw new CapacityExceededException(requiredBits, capacityBits);
    }

    BitStream bits = new BitStream();
    bits.appendBits(mode.getBits(), 4);
    bits.appendBits(content.length, numLetterBits);
    bits.appendBytes(content);

    if (bits.getSize() <= capacityBits - TERMINATOR_BITS) {
      bits.appendBits(0, TERMINATOR_BITS);
    }
    while ((bits.getSize() & 0x07) != 0) {
      bits.appendBit(false);
    }
    for (int i = 0; bits.getSize() < capacityBits; i++) {
      bits.appendBits(PAD_BYTES[i % PAD_BYTES.length], 8);
    }
    return bits;
  }

  /**
   * Interleave the data codewords with the error correction codewords of their blocks: the
   * i-th data byte of every block that has one, for each i, then the i-th error correction
   * byte of every block, for each i.
   *
   * @throws WriterException if the result is not exactly the symbol's total codeword count
   */
  BitStream interleaveWithECBytes(byte[] dataBytes, Version version) throws WriterException {
    DataBlock[] blocks = DataBlock.getDataBlocks(dataBytes, version, rsEncoder);

    int maxNumDataBytes = 0;
    int maxNumEcBytes = 0;
    for (DataBlock block : blocks) {
      maxNumDataBytes = Math.max(maxNumDataBytes, block.getDataBytes().length);
      maxNumEcBytes = Math.max(maxNumEcBytes, block.getErrorCorrectionBytes().length);
    }

    BitStream result = new BitStream();
    for (int i = 0; i < maxNumDataBytes; i++) {
      for (DataBlock block : blocks) {
        byte[] data = block.getDataBytes();
        if (i < data.length) {
          result.appendBits(data[i] & 0xFF, 8);
        }
      }
    }
    for (int i = 0; i < maxNumEcBytes; i++) {
      for (DataBlock block : blocks) {
        byte[] ecBytes = block.getErrorCorrectionBytes();
        if (i < ecBytes.length) {
          result.appendBits(ecBytes[i] & 0xFF, 8);
        }
      }
    }

    int expectedBits = version.getTotalCodewords() * 8;
    if (result.getSize() != expectedBits) {
      throw new WriterException("Interleaving error: " + result.getSize() + " and " + expectedBits + " differ.");
    }
    return result;
  }

  private MaskTrial chooseMaskPattern(BitStream finalBits, Version version) {
    MaskTrial[] trials = new MaskTrial[QRCode.NUM_MASK_PATTERNS];
    if (executor == null) {
      for (int maskPattern = 0; maskPattern < QRCode.NUM_MASK_PATTERNS; maskPattern++) {
        trials[maskPattern] = scoreTrial(finalBits.copy(), version, DataMask.forReference(maskPattern));
      }
    } else {
      List<CompletableFuture<MaskTrial>> futures = new ArrayList<>(QRCode.NUM_MASK_PATTERNS);
      for (int maskPattern = 0; maskPattern < QRCode.NUM_MASK_PATTERNS; maskPattern++) {
        BitStream trialBits = finalBits.copy();
        DataMask mask = DataMask.forReference(maskPattern);
        futures.add(CompletableFuture.supplyAsync(() -> scoreTrial(trialBits, version, mask), executor));
      }
      for (int maskPattern = 0; maskPattern < QRCode.NUM_MASK_PATTERNS; maskPattern++) {
        trials[maskPattern] = join(futures.get(maskPattern));
      }
    }

    // Strict comparison in mask order: the lowest mask wins a tie
    MaskTrial best = trials[0];
    for (MaskTrial trial : trials) {
      logger.debug("Version {}: mask {} penalty {}", version, trial.maskPattern, trial.penalty);
      if (trial.penalty < best.penalty) {
        best = trial;
      }
    }
    return best;
  }

  private static MaskTrial buildTrial(BitStream bits, Version version, DataMask mask) {
    int dimension = version.getDimensionForVersion();
    ByteMatrix matrix = new ByteMatrix(dimension, dimension);
    MatrixUtil.buildMatrix(bits, version, mask, matrix);
    return new MaskTrial(mask.getReference(), -1, matrix);
  }

  private static MaskTrial scoreTrial(BitStream bits, Version version, DataMask mask) {
    MaskTrial trial = buildTrial(bits, version, mask);
    return new MaskTrial(trial.maskPattern, MaskUtil.calculateMaskPenalty(trial.matrix), trial.matrix);
  }

  private static MaskTrial join(CompletableFuture<MaskTrial> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  private static final class MaskTrial {
    private final int maskPattern;
    private final int penalty;
    private final ByteMatrix matrix;

    MaskTrial(int maskPattern, int penalty, ByteMatrix matrix) {
      this.maskPattern = maskPattern;
      this.penalty = penalty;
      this.matrix = matrix;
    }
  }

}
