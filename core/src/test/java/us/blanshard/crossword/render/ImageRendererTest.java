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

import static org.junit.Assert.assertEquals;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.TestPuzzles;
import us.blanshard.crossword.core.Variable;

import com.google.common.collect.ImmutableMap;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

public class ImageRendererTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private final Crossword crossword = TestPuzzles.structure0();
  private final LetterGrid blank = LetterGrid.of(crossword, ImmutableMap.<Variable, String>of());

  private static final int BLACK = Color.BLACK.getRGB();
  private static final int WHITE = Color.WHITE.getRGB();

  @Test public void cells() {
    BufferedImage image = ImageRenderer.render(blank);
    assertEquals(500, image.getWidth());
    assertEquals(500, image.getHeight());
    assertEquals(BLACK, image.getRGB(50, 50));    // Blocked (0, 0)
    assertEquals(WHITE, image.getRGB(150, 50));   // Open (0, 1)
    assertEquals(BLACK, image.getRGB(100, 50));   // Border between them
    assertEquals(BLACK, image.getRGB(150, 199));  // Bottom border of (1, 1)
    assertEquals(WHITE, image.getRGB(450, 450));  // Open (4, 4)
  }

  @Test public void formats() {
    assertEquals("png", ImageRenderer.formatFor(new File("out.png")));
    assertEquals("png", ImageRenderer.formatFor(new File("out")));
    assertEquals("png", ImageRenderer.formatFor(new File("out.nonsense")));
    assertEquals("jpg", ImageRenderer.formatFor(new File("OUT.JPG")));
  }

  @Test public void write() throws IOException {
    File file = new File(folder.getRoot(), "blank.png");
    ImageRenderer.write(blank, file);
    BufferedImage image = ImageIO.read(file);
    assertEquals(500, image.getWidth());
    assertEquals(WHITE, image.getRGB(150, 50));
  }
}
