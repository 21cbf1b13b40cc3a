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

import com.qrforge.qrcode.encoder.ByteMatrix;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Writes a {@link ByteMatrix} to {@link BufferedImage}, file or stream. Modules are scaled to
 * fill the image inside a white margin; module edges are rounded to whole pixels, so module
 * sizes may differ by one pixel.
 */
public final class MatrixToImageWriter {

  public static final String FORMAT = "png";

  private static final int BLACK = 0xFF000000;
  private static final int WHITE = 0xFFFFFFFF;

  private MatrixToImageWriter() {
  }

  /**
   * Renders a {@link ByteMatrix} as an image, where "dark" modules are black and "light" ones
   * are white. Unset modules are left white.
   *
   * @param matrix a finished {@link ByteMatrix}
   * @param size width and height of the image in pixels
   * @param margin white border on each side in pixels
   * @return {@link BufferedImage} representation of the input
   * @throws IllegalArgumentException if the margin leaves no room for the modules
   */
  public static BufferedImage toBufferedImage(ByteMatrix matrix, int size, int margin) {
    int drawSize = size - 2 * margin;
    if (drawSize <= 0) {
      throw new IllegalArgumentException("Margin is too large");
    }
    int moduleCount = matrix.getWidth();
    double moduleSize = (double) drawSize / moduleCount;

    BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = image.createGraphics();
    try {
      graphics.setColor(new Color(WHITE, true));
      graphics.fillRect(0, 0, size, size);
      graphics.setColor(new Color(BLACK, true));
      for (int y = 0; y < moduleCount; y++) {
        for (int x = 0; x < moduleCount; x++) {
          if (matrix.get(x, y) != 1) {
            continue;
          }
          int left = (int) Math.round(margin + x * moduleSize);
          int top = (int) Math.round(margin + y * moduleSize);
          int right = (int) Math.round(margin + (x + 1) * moduleSize - 1);
          int bottom = (int) Math.round(margin + (y + 1) * moduleSize - 1);
          if (right >= left && bottom >= top) {
            graphics.fillRect(left, top, right - left + 1, bottom - top + 1);
          }
        }
      }
    } finally {
      graphics.dispose();
    }
    return image;
  }

  /**
   * @param matrix {@link ByteMatrix} to write
   * @param size width and height of the image in pixels
   * @param margin white border on each side in pixels
   * @param file file {@link Path} to write image to
   * @throws IOException if writes to the file fail
   */
  public static void writeToPath(ByteMatrix matrix, int size, int margin, Path file) throws IOException {
    writeToPath(toBufferedImage(matrix, size, margin), file);
  }

  /**
   * @param matrix {@link ByteMatrix} to write
   * @param size width and height of the image in pixels
   * @param margin white border on each side in pixels
   * @param stream {@link OutputStream} to write image to
   * @throws IOException if writes to the stream fail
   */
  public static void writeToStream(ByteMatrix matrix, int size, int margin, OutputStream stream)
      throws IOException {
    BufferedImage image = toBufferedImage(matrix, size, margin);
    if (!ImageIO.write(image, FORMAT, stream)) {
      throw new IOException("Could not write an image of format " + FORMAT);
    }
  }

  static void writeToPath(BufferedImage image, Path file) throws IOException {
    if (!ImageIO.write(image, FORMAT, file.toFile())) {
      throw new IOException("Could not write an image of format " + FORMAT + " to " + file);
    }
  }

}
