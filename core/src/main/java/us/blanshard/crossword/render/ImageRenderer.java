/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.render;

import com.google.common.io.Files;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Locale;

import javax.imageio.ImageIO;

/**
 * Draws a {@link LetterGrid} as an image: white squares for open cells, black
 * for blocked ones, letters centered in their squares.
 */
public final class ImageRenderer {

  public static final int CELL_SIZE = 100;
  public static final int CELL_BORDER = 2;
  public static final int FONT_SIZE = 80;

  /** The format used when a file's extension names none ImageIO knows. */
  public static final String DEFAULT_FORMAT = "png";

  private ImageRenderer() {}

  /** Renders the given grid. */
  public static BufferedImage render(LetterGrid grid) {
    BufferedImage image = new BufferedImage(
        Math.max(1, grid.width() * CELL_SIZE), Math.max(1, grid.height() * CELL_SIZE),
        BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(Color.BLACK);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      int interior = CELL_SIZE - 2 * CELL_BORDER;
      for (int row = 0; row < grid.height(); ++row) {
        for (int column = 0; column < grid.width(); ++column) {
          if (!grid.isOpen(row, column)) continue;
          int left = column * CELL_SIZE + CELL_BORDER;
          int top = row * CELL_SIZE + CELL_BORDER;
          g.setColor(Color.WHITE);
          g.fillRect(left, top, interior, interior);
          Character letter = grid.get(row, column);
          if (letter != null)
            drawLetter(g, letter.toString(), left, top, interior);
        }
      }
    } finally {
      g.dispose();
    }
    return image;
  }

  private static void drawLetter(Graphics2D g, String letter, int left, int top, int interior) {
    g.setRenderingHint(
        RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, FONT_SIZE));
    g.setColor(Color.BLACK);
    FontMetrics metrics = g.getFontMetrics();
    int x = left + (interior - metrics.stringWidth(letter)) / 2;
    int y = top + (interior - metrics.getHeight()) / 2 + metrics.getAscent();
    g.drawString(letter, x, y);
  }

  /**
   * Writes the rendered grid to the given file, in the format its extension
   * names, or {@link #DEFAULT_FORMAT}.
   */
  public static void write(LetterGrid grid, File file) throws IOException {
    String format = formatFor(file);
    if (!ImageIO.write(render(grid), format, file))
      throw new IOException("No image writer for format " + format);
  }

  /** Returns the image format to use for the given file. */
  static String formatFor(File file) {
    String extension = Files.getFileExtension(file.getName()).toLowerCase(Locale.ROOT);
    if (!extension.isEmpty() && ImageIO.getImageWritersBySuffix(extension).hasNext())
      return extension;
    return DEFAULT_FORMAT;
  }
}
