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

import us.blanshard.crossword.core.Cell;
import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Structure;
import us.blanshard.crossword.core.Variable;

import com.google.common.collect.ImmutableList;

import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The letters a (possibly partial) solution puts in each cell of a crossword
 * grid.  Its string form is the usual way to show a solution.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LetterGrid {

  /** How a blocked cell is drawn in the string form. */
  public static final char BLOCK = '\u2588';  // Full block

  private final Structure structure;
  private final char[][] letters;  // 0 for no letter

  private LetterGrid(Structure structure, char[][] letters) {
    this.structure = structure;
    this.letters = letters;
  }

  /**
   * Lays the given words into their slots.  Letters past the end of a slot
   * are dropped; where two words disagree on a cell the later slot wins.
   */
  public static LetterGrid of(Crossword crossword, Map<Variable, String> words) {
    char[][] letters = new char[crossword.height()][crossword.width()];
    for (Map.Entry<Variable, String> entry : words.entrySet()) {
      Variable var = entry.getKey();
      String word = entry.getValue();
      for (int k = 0; k < word.length() && k < var.length; ++k) {
        Cell cell = var.cell(k);
        letters[cell.row][cell.column] = word.charAt(k);
      }
    }
    return new LetterGrid(crossword.structure(), letters);
  }

  public int height() {
    return structure.height();
  }

  public int width() {
    return structure.width();
  }

  public boolean isOpen(int row, int column) {
    return structure.isOpen(row, column);
  }

  /** Returns the letter in the given cell, or null if it has none. */
  @Nullable public Character get(int row, int column) {
    char c = letters[row][column];
    return c == 0 ? null : c;
  }

  /** Returns one string per row, as described in {@link #toString}. */
  public ImmutableList<String> toRows() {
    ImmutableList.Builder<String> rows = ImmutableList.builder();
    for (int row = 0; row < height(); ++row) {
      StringBuilder sb = new StringBuilder();
      for (int column = 0; column < width(); ++column) {
        if (!isOpen(row, column)) sb.append(BLOCK);
        else if (letters[row][column] == 0) sb.append(' ');
        else sb.append(letters[row][column]);
      }
      rows.add(sb.toString());
    }
    return rows.build();
  }

  /**
   * Shows the grid a row per line: {@link #BLOCK} for blocked cells, the
   * letter for filled cells, and a space for open cells without a letter.
   */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (String row : toRows())
      sb.append(row).append('\n');
    return sb.toString();
  }
}
