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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * One slot of a crossword grid: a run of cells starting at row {@link #i} and
 * column {@link #j}, {@link #length} cells long, running {@link #direction}.
 * Two variables are equal when all four attributes are.
 *
 * <p> Variables are ordered by row, then column, then direction, then length.
 * All iteration over a puzzle's variables follows this order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Variable implements Comparable<Variable> {

  /** The starting row, zero-based. */
  public final int i;

  /** The starting column, zero-based. */
  public final int j;

  /** The number of cells in the slot. */
  public final int length;

  public final Direction direction;

  /** The cells of the slot, in word order. */
  private final ImmutableList<Cell> cells;

  public static Variable of(int i, int j, Direction direction, int length) {
    return new Variable(i, j, direction, length);
  }

  public static Variable across(int i, int j, int length) {
    return of(i, j, Direction.ACROSS, length);
  }

  public static Variable down(int i, int j, int length) {
    return of(i, j, Direction.DOWN, length);
  }

  private Variable(int i, int j, Direction direction, int length) {
    checkArgument(length > 0, "slot length must be positive, got %s", length);
    checkArgument(i >= 0 && j >= 0, "slot must start inside the grid, got (%s, %s)", i, j);
    this.i = i;
    this.j = j;
    this.direction = checkNotNull(direction);
    this.length = length;
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int k = 0; k < length; ++k)
      builder.add(Cell.of(i + k * direction.rowDelta, j + k * direction.columnDelta));
    this.cells = builder.build();
  }

  /** Returns the cells this slot covers, first letter first. */
  public ImmutableList<Cell> cells() {
    return cells;
  }

  /** Returns the cell holding the letter at the given index of the word. */
  public Cell cell(int k) {
    return cells.get(k);
  }

  /** Returns the last cell of the slot. */
  public Cell end() {
    return cells.get(length - 1);
  }

  @Override public int compareTo(Variable that) {
    return ComparisonChain.start()
        .compare(this.i, that.i)
        .compare(this.j, that.j)
        .compare(this.direction, that.direction)
        .compare(this.length, that.length)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Variable)) return false;
    Variable that = (Variable) o;
    return this.i == that.i
        && this.j == that.j
        && this.length == that.length
        && this.direction == that.direction;
  }

  @Override public int hashCode() {
    return Objects.hashCode(i, j, length, direction);
  }

  @Override public String toString() {
    return String.format("(%d, %d) %s : %d", i, j, direction, length);
  }
}
