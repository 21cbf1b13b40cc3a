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

import com.qrforge.WriterException;
import com.qrforge.qrcode.encoder.Encoder;
import com.qrforge.qrcode.encoder.QRCode;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line utility for encoding a QR Code into a PNG file. When the request cannot be
 * encoded, the file holds an image of the error message instead.
 */
public final class CommandLineEncoder {

  private static final Logger logger = LoggerFactory.getLogger(CommandLineEncoder.class);

  static final int SUCCESS = 0;
  static final int ENCODING_FAILED = 1;
  static final int USAGE_ERROR = 2;

  private CommandLineEncoder() {
  }

  public static void main(String[] args) throws IOException {
    int status = run(args);
    if (status != SUCCESS) {
      System.exit(status);
    }
  }

  static int run(String[] args) throws IOException {
    OptionParser parser = new OptionParser();
    OptionSpec<Integer> sizeO = parser.accepts("size", "Image width and height in pixels")
        .withRequiredArg().ofType(Integer.class).defaultsTo(EncoderConfig.DEFAULT_SIZE);
    OptionSpec<Integer> marginO = parser.accepts("margin", "White border in pixels")
        .withRequiredArg().ofType(Integer.class).defaultsTo(EncoderConfig.DEFAULT_MARGIN);
    OptionSpec<String> base64O = parser.accepts("base64", "Payload as Base64")
        .withRequiredArg();
    OptionSpec<String> bytesO = parser.accepts("bytes", "Payload as comma separated byte values")
        .withRequiredArg();
    OptionSpec<String> textO = parser.accepts("text", "Payload as UTF-8 text")
        .withRequiredArg();
    OptionSpec<Integer> versionO = parser.accepts("version", "Symbol version, 1 to 40")
        .withRequiredArg().ofType(Integer.class).defaultsTo(EncoderConfig.DEFAULT_VERSION);
    OptionSpec<String> eclO = parser.accepts("ecl", "Error correction level: L, M, Q or H")
        .withRequiredArg().defaultsTo(EncoderConfig.DEFAULT_ERROR_CORRECTION_LEVEL.name());
    OptionSpec<String> maskO = parser.accepts("mask", "Mask pattern, 0 to 7, or auto")
        .withRequiredArg().defaultsTo("auto");
    OptionSpec<File> outputO = parser.accepts("output", "PNG file to write")
        .withRequiredArg().ofType(File.class).defaultsTo(new File("qrcode.png"));
    OptionSpec<Void> helpO = parser.accepts("help", "Show this help").forHelp();

    // typed values are converted on access, so they are read under the same handler
    OptionSet options;
    Path output;
    int size;
    int margin;
    int version;
    try {
      options = parser.parse(args);
      if (options.has(helpO)) {
        parser.printHelpOn(System.out);
        return SUCCESS;
      }
      output = options.valueOf(outputO).toPath();
      size = options.valueOf(sizeO);
      margin = options.valueOf(marginO);
      version = options.valueOf(versionO);
    } catch (OptionException e) {
      logger.error("Invalid arguments: {}", e.getMessage());
      parser.printHelpOn(System.err);
      return USAGE_ERROR;
    }

    BufferedImage image;
    int status;
    try {
      EncoderConfig config = new EncoderConfig();
      config.setSize(size);
      config.setMargin(margin);
      config.setVersion(version);
      config.setErrorCorrectionLevel(options.valueOf(eclO));
      config.setMaskPattern(options.valueOf(maskO));
      config.setContents(options.valueOf(base64O), options.valueOf(bytesO), options.valueOf(textO));
      image = encode(config);
      status = SUCCESS;
    } catch (WriterException | IllegalArgumentException e) {
      logger.error("Could not encode: {}", e.getMessage());
      int errorSize = size > 0 ? size : EncoderConfig.DEFAULT_SIZE;
      image = ErrorImageWriter.toBufferedImage(e.getMessage(), errorSize, errorSize);
      status = ENCODING_FAILED;
    }

    MatrixToImageWriter.writeToPath(image, output);
    logger.info("Wrote {}x{} image to {}", image.getWidth(), image.getHeight(), output);
    return status;
  }

  static BufferedImage encode(EncoderConfig config) throws WriterException {
    QRCode qrCode = new Encoder().encode(config.getContents(),
                                         config.getVersion(),
                                         config.getErrorCorrectionLevel(),
                                         config.getMaskPattern());
    logger.debug("Encoded {} bytes as version {}-{} with mask {}",
                 config.getContents().length,
                 config.getVersion(),
                 config.getErrorCorrectionLevel(),
                 qrCode.getMaskPattern());
    return MatrixToImageWriter.toBufferedImage(qrCode.getMatrix(), config.getSize(), config.getMargin());
  }

}
