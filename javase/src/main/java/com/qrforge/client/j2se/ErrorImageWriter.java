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

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders an error message in place of a symbol: red text, word-wrapped and centered on a
 * white image.
 */
public final class ErrorImageWriter {

  private static final Color BACKGROUND = Color.WHITE;
  private static final Color TEXT = new Color(211, 47, 47);
  private static final int PADDING = 20;
  private static final int LINE_SPACING = 5;
  private static final Font FONT = new Font(Font.MONOSPACED, Font.PLAIN, 13);

  private ErrorImageWriter() {
  }

  public static BufferedImage toBufferedImage(String message, int width, int height) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = image.createGraphics();
    try {
      graphics.setColor(BACKGROUND);
      graphics.fillRect(0, 0, width, height);
      graphics.setColor(TEXT);
      graphics.setFont(FONT);

      FontMetrics metrics = graphics.getFontMetrics();
      int charWidth = Math.max(1, metrics.charWidth('M'));
      int lineHeight = metrics.getHeight() + LINE_SPACING;
      List<String> lines = wrap(message == null ? "" : message, (width - 2 * PADDING) / charWidth);

      int y = (height - lines.size() * lineHeight) / 2 + metrics.getAscent();
      for (String line : lines) {
        int x = (width - metrics.stringWidth(line)) / 2;
        graphics.drawString(line, x, y);
        y += lineHeight;
      }
    } finally {
      graphics.dispose();
    }
    return image;
  }

  /**
   * Breaks {@code message} into lines of at most {@code charsPerLine} characters, at whitespace
   * where possible. Words longer than a line are cut.
   *
   * @param charsPerLine line width; values below 1 are treated as 1
   */
  static List<String> wrap(String message, int charsPerLine) {
    int width = Math.max(1, charsPerLine);
    List<String> lines = new ArrayList<>();
    StringBuilder line = new StringBuilder();
    for (String word : message.trim().split("\\s+")) {
      if (word.isEmpty()) {
        continue;
      }
      if (line.length() > 0 && line.length() + 1 + word.length() <= width) {
        line.append(' ').append(word);
        continue;
      }
      if (line.length() > 0) {
        lines.add(line.toString());
        line.setLength(0);
      }
      while (word.length() > width) {
        lines.add(word.substring(0, width));
        word = word.substring(width);
      }
      line.append(word);
    }
    if (line.length() > 0) {
      lines.add(line.toString());
    }
    return lines;
  }

}
