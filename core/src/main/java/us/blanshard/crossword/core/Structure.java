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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * The shape of a crossword grid: which cells are open for letters and which
 * are blocked.  Knows how to find the slots (variables) the shape implies.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Structure {

  /** The character marking an open cell in the text form. */
  public static final char OPEN = '_';

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private final boolean[][] open;
  private final int width;

  private Structure(boolean[][] open, int width) {
    this.open = open;
    this.width = width;
  }

  /**
   * Parses the text form of a structure: one line per row, with {@link #OPEN}
   * for open cells and anything else for blocked ones.  Lines may have
   * different lengths; the missing cells of short lines are blocked.  A
   * trailing newline does not add a row.
   */
  public static Structure fromString(String s) {
    List<String> lines = LINE_SPLITTER.splitToList(s);
    if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty())
      lines = lines.subList(0, lines.size() - 1);
    checkArgument(!lines.isEmpty(), "Structure.fromString requires at least one row");

    int width = 0;
    for (String line : lines)
      width = Math.max(width, line.length());
    checkArgument(width > 0, "Structure.fromString requires at least one column");

    boolean[][] open = new boolean[lines.size()][width];
    for (int row = 0; row < lines.size(); ++row) {
      String line = lines.get(row);
      for (int column = 0; column < line.length(); ++column)
        open[row][column] = line.charAt(column) == OPEN;
    }
    return new Structure(open, width);
  }

  /**
   * Returns the structure whose open cells are exactly those covered by the
   * given slots, sized to their bounding box.
   */
  static Structure covering(Iterable<Variable> variables) {
    int height = 0;
    int width = 0;
    for (Variable var : variables) {
      height = Math.max(height, var.end().row + 1);
      width = Math.max(width, var.end().column + 1);
    }
    boolean[][] open = new boolean[height][width];
    for (Variable var : variables)
      for (Cell cell : var.cells())
        open[cell.row][cell.column] = true;
    return new Structure(open, width);
  }

  public int height() {
    return open.length;
  }

  public int width() {
    return width;
  }

  /** Tells whether the given cell is inside the grid and open. */
  public boolean isOpen(int row, int column) {
    return row >= 0 && row < open.length
        && column >= 0 && column < width
        && open[row][column];
  }

  public boolean isOpen(Cell cell) {
    return isOpen(cell.row, cell.column);
  }

  /**
   * Finds every slot of the grid: each maximal run of two or more open cells,
   * across or down.
   */
  public ImmutableSortedSet<Variable> variables() {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    for (int row = 0; row < height(); ++row) {
      for (int column = 0; column < width; ++column) {
        for (Direction direction : Direction.values()) {
          if (!isOpen(row, column)
              || isOpen(row - direction.rowDelta, column - direction.columnDelta))
            continue;  // Not the start of a run.
          int length = 1;
          while (isOpen(row + length * direction.rowDelta, column + length * direction.columnDelta))
            ++length;
          if (length > 1)
            builder.add(Variable.of(row, column, direction, length));
        }
      }
    }
    return builder.build();
  }

  /** Returns the rows of the text form of this structure. */
  public ImmutableList<String> toRows() {
    ImmutableList.Builder<String> rows = ImmutableList.builder();
    for (boolean[] line : open) {
      StringBuilder sb = new StringBuilder();
      for (boolean cell : line)
        sb.append(cell ? OPEN : '#');
      rows.add(sb.toString());
    }
    return rows.build();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Structure)) return false;
    return Arrays.deepEquals(this.open, ((Structure) o).open);
  }

  @Override public int hashCode() {
    return Arrays.deepHashCode(open);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (String row : toRows())
      sb.append(row).append('\n');
    return sb.toString();
  }
}
