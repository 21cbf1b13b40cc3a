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

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Tests {@link CommandLineEncoder}.
 */
public final class CommandLineEncoderTestCase extends Assert {

  @Rule
  public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testEncodeToFile() throws IOException {
    File output = new File(temporaryFolder.getRoot(), "hello.png");
    int status = CommandLineEncoder.run(new String[] {
        "--text", "hello", "--version", "2", "--ecl", "m", "--mask", "3",
        "--size", "100", "--margin", "4", "--output", output.getPath()});
    assertEquals(CommandLineEncoder.SUCCESS, status);
    BufferedImage image = ImageIO.read(output);
    assertNotNull(image);
    assertEquals(100, image.getWidth());
    assertEquals(100, image.getHeight());
    // top left module of the finder pattern
    assertEquals(0xFF000000, image.getRGB(4, 4));
    assertEquals(0xFFFFFFFF, image.getRGB(1, 1));
  }

  @Test
  public void testDefaults() throws IOException {
    File output = new File(temporaryFolder.getRoot(), "default.png");
    assertEquals(CommandLineEncoder.SUCCESS, CommandLineEncoder.run(new String[] {"--output", output.getPath()}));
    BufferedImage image = ImageIO.read(output);
    assertEquals(256, image.getWidth());
    assertEquals(0xFF000000, image.getRGB(20, 20));
  }

  @Test
  public void testHelp() throws IOException {
    assertEquals(CommandLineEncoder.SUCCESS, CommandLineEncoder.run(new String[] {"--help"}));
  }

  @Test
  public void testUnknownOption() throws IOException {
    assertEquals(CommandLineEncoder.USAGE_ERROR, CommandLineEncoder.run(new String[] {"--colour", "red"}));
  }

  @Test
  public void testNonNumericSize() throws IOException {
    assertEquals(CommandLineEncoder.USAGE_ERROR, CommandLineEncoder.run(new String[] {"--size", "big"}));
  }

  @Test
  public void testVersionOutOfRangeWritesErrorImage() throws IOException {
    assertErrorImage(256, "--version", "41");
  }

  @Test
  public void testPayloadTooLargeWritesErrorImage() throws IOException {
    assertErrorImage(256, "--version", "1", "--ecl", "L",
                     "--text", "this payload is far too long for a version 1 symbol");
  }

  @Test
  public void testMarginTooLargeWritesErrorImage() throws IOException {
    assertErrorImage(100, "--size", "100", "--margin", "60");
  }

  @Test
  public void testInvalidSizeWritesDefaultSizeErrorImage() throws IOException {
    assertErrorImage(256, "--size", "0");
  }

  @Test
  public void testInvalidMaskWritesErrorImage() throws IOException {
    assertErrorImage(256, "--mask", "9");
  }

  private void assertErrorImage(int expectedSize, String... args) throws IOException {
    File output = new File(temporaryFolder.getRoot(), "error.png");
    String[] allArgs = new String[args.length + 2];
    System.arraycopy(args, 0, allArgs, 0, args.length);
    allArgs[args.length] = "--output";
    allArgs[args.length + 1] = output.getPath();

    assertEquals(CommandLineEncoder.ENCODING_FAILED, CommandLineEncoder.run(allArgs));
    BufferedImage image = ImageIO.read(output);
    assertNotNull(image);
    assertEquals(expectedSize, image.getWidth());
    assertEquals(expectedSize, image.getHeight());
    assertEquals(0xFFFFFFFF, image.getRGB(0, 0));
    assertTrue("no text drawn", countNonWhite(image) > 0);
  }

  private static int countNonWhite(BufferedImage image) {
    int count = 0;
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        if (image.getRGB(x, y) != 0xFFFFFFFF) {
          count++;
        }
      }
    }
    return count;
  }

}
