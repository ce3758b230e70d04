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
import static org.junit.Assert.assertNull;
import static us.blanshard.crossword.core.TestPuzzles.BOTTOM;
import static us.blanshard.crossword.core.TestPuzzles.LEFT;
import static us.blanshard.crossword.core.TestPuzzles.RIGHT;
import static us.blanshard.crossword.core.TestPuzzles.TOP;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

public class CrosswordTest {

  private final Crossword crossword = TestPuzzles.structure0();

  @Test public void dimensions() {
    assertEquals(5, crossword.height());
    assertEquals(5, crossword.width());
  }

  @Test public void words() {
    assertEquals(10, crossword.words().size());
    assertEquals("EIGHT", crossword.words().first());
    assertEquals("TWO", crossword.words().last());
  }

  @Test public void wordsAreCleaned() {
    Crossword c = TestPuzzles.crossingPair(" at", "AT", "to\t", "", "   ", "Ox");
    assertEquals(ImmutableSet.of("AT", "OX", "TO"), c.words());
  }

  @Test public void overlaps() {
    assertEquals(Overlap.of(0, 0), crossword.overlap(TOP, LEFT));
    assertEquals(Overlap.of(0, 0), crossword.overlap(LEFT, TOP));
    assertEquals(Overlap.of(4, 0), crossword.overlap(LEFT, BOTTOM));
    assertEquals(Overlap.of(0, 4), crossword.overlap(BOTTOM, LEFT));
    assertEquals(Overlap.of(3, 3), crossword.overlap(RIGHT, BOTTOM));
    assertNull(crossword.overlap(TOP, RIGHT));
    assertNull(crossword.overlap(TOP, BOTTOM));
    assertNull(crossword.overlap(LEFT, RIGHT));
    assertNull(crossword.overlap(TOP, TOP));
    assertNull(crossword.overlap(TOP, Variable.across(3, 3, 3)));
  }

  @Test public void overlapsAreSymmetric() {
    for (Variable x : crossword.variables()) {
      for (Variable y : crossword.variables()) {
        Overlap overlap = crossword.overlap(x, y);
        if (overlap == null) assertNull(crossword.overlap(y, x));
        else assertEquals(overlap.reverse(), crossword.overlap(y, x));
      }
    }
  }

  @Test public void neighbors() {
    assertEquals(ImmutableSet.of(LEFT), crossword.neighbors(TOP));
    assertEquals(ImmutableSet.of(TOP, BOTTOM), crossword.neighbors(LEFT));
    assertEquals(ImmutableSet.of(LEFT, RIGHT), crossword.neighbors(BOTTOM));
    assertEquals(1, crossword.degree(TOP));
    assertEquals(2, crossword.degree(LEFT));
    assertEquals(1, crossword.degree(RIGHT));
    assertEquals(2, crossword.degree(BOTTOM));
  }

  @Test public void arcs() {
    ImmutableList<Arc> arcs = crossword.arcs();
    assertEquals(6, arcs.size());
    assertEquals(true, arcs.contains(Arc.of(TOP, LEFT)));
    assertEquals(true, arcs.contains(Arc.of(LEFT, TOP)));
    assertEquals(false, arcs.contains(Arc.of(TOP, RIGHT)));
  }

  @Test public void builtFromSlots() {
    Crossword c = TestPuzzles.crossingPair("AT", "TO", "OX");
    assertEquals(2, c.height());
    assertEquals(2, c.width());
    assertEquals(false, c.structure().isOpen(1, 0));
    assertEquals(true, c.structure().isOpen(1, 1));
    assertEquals(Overlap.of(1, 0), c.overlap(Variable.across(0, 0, 2), Variable.down(0, 1, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void slotsSharingTwoCells() {
    Crossword.builder()
        .addVariable(Variable.across(0, 0, 3))
        .addVariable(Variable.across(0, 1, 3))
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void structureAndSlots() {
    Crossword.builder()
        .setStructure(Structure.fromString("__"))
        .addVariable(Variable.across(0, 0, 2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void nothingToBuild() {
    Crossword.builder().addWords("CAT").build();
  }
}
