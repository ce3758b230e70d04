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
package us.blanshard.crossword.core;

import static org.junit.Assert.assertEquals;
import static us.blanshard.crossword.core.TestPuzzles.BOTTOM;
import static us.blanshard.crossword.core.TestPuzzles.LEFT;
import static us.blanshard.crossword.core.TestPuzzles.RIGHT;
import static us.blanshard.crossword.core.TestPuzzles.TOP;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

public class StructureTest {

  @Test public void fromString() {
    Structure structure = Structure.fromString("#__\n_#\n");
    assertEquals(2, structure.height());
    assertEquals(3, structure.width());
    assertEquals(false, structure.isOpen(0, 0));
    assertEquals(true, structure.isOpen(0, 1));
    assertEquals(true, structure.isOpen(1, 0));
    assertEquals(false, structure.isOpen(1, 2));  // Past the end of a short line
    assertEquals(false, structure.isOpen(-1, 1));
    assertEquals(false, structure.isOpen(0, 3));
    assertEquals(ImmutableList.of("#__", "_##"), structure.toRows());
  }

  @Test public void windowsLineEndings() {
    assertEquals(Structure.fromString("__\n_#"), Structure.fromString("__\r\n_#\r\n"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void empty() {
    Structure.fromString("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void noColumns() {
    Structure.fromString("\n\n");
  }

  @Test public void variables() {
    Structure structure = Structure.fromString("#___#\n#_##_\n#_##_\n#_##_\n#____\n");
    assertEquals(ImmutableSet.of(TOP, LEFT, RIGHT, BOTTOM), structure.variables());
    assertEquals(ImmutableList.of(TOP, LEFT, RIGHT, BOTTOM), structure.variables().asList());
  }

  @Test public void singleCellsAreNotSlots() {
    Structure structure = Structure.fromString("_#_\n#__\n_#_");
    assertEquals(ImmutableSet.of(Variable.across(1, 1, 2), Variable.down(0, 2, 3)),
                 structure.variables());
  }

  @Test public void noSlots() {
    assertEquals(0, Structure.fromString("#_#\n_#_").variables().size());
  }
}
