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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable crossword puzzle: the grid's structure, its slots, the
 * vocabulary that may fill them, and the table of overlaps between every pair
 * of intersecting slots.  The overlaps come from the geometry alone: two slots
 * overlap when they share a cell.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Crossword {

  private final Structure structure;
  private final ImmutableSortedSet<Variable> variables;
  private final ImmutableSortedSet<String> words;
  private final ImmutableTable<Variable, Variable, Overlap> overlaps;
  private final ImmutableList<Arc> arcs;

  private Crossword(Structure structure, ImmutableSortedSet<Variable> variables,
      ImmutableSortedSet<String> words) {
    this.structure = structure;
    this.variables = variables;
    this.words = words;
    this.overlaps = computeOverlaps(variables);
    ImmutableList.Builder<Arc> arcs = ImmutableList.builder();
    for (Table.Cell<Variable, Variable, Overlap> cell : overlaps.cellSet())
      arcs.add(Arc.of(cell.getRowKey(), cell.getColumnKey()));
    this.arcs = arcs.build();
  }

  /** Makes the puzzle whose slots are those of the given structure. */
  public static Crossword of(Structure structure, Iterable<String> words) {
    return builder().setStructure(structure).addWords(words).build();
  }

  /** Returns a new Builder. */
  public static Builder builder() {
    return new Builder();
  }

  public Structure structure() {
    return structure;
  }

  public int height() {
    return structure.height();
  }

  public int width() {
    return structure.width();
  }

  /** All the slots, in their natural order. */
  public ImmutableSortedSet<Variable> variables() {
    return variables;
  }

  /** The vocabulary, upper-cased, in lexicographic order. */
  public ImmutableSortedSet<String> words() {
    return words;
  }

  /**
   * Returns the overlap between the two given slots, with {@link Overlap#first}
   * indexing x's word; or null if they share no cell.
   */
  @Nullable public Overlap overlap(Variable x, Variable y) {
    return overlaps.get(x, y);
  }

  /** Returns the slots that share a cell with the given one. */
  public ImmutableSet<Variable> neighbors(Variable var) {
    return overlaps.row(var).keySet();
  }

  /** Returns the number of slots the given one overlaps. */
  public int degree(Variable var) {
    return overlaps.row(var).size();
  }

  /** Returns every arc between overlapping slots, both directions. */
  public ImmutableList<Arc> arcs() {
    return arcs;
  }

  private static ImmutableTable<Variable, Variable, Overlap> computeOverlaps(
      Iterable<Variable> variables) {
    // Index every cell by the slots covering it.
    Map<Cell, List<Variable>> covering = Maps.newHashMap();
    for (Variable var : variables) {
      for (Cell cell : var.cells()) {
        List<Variable> list = covering.get(cell);
        if (list == null) covering.put(cell, list = Lists.newArrayList());
        list.add(var);
      }
    }

    Table<Variable, Variable, Overlap> table = TreeBasedTable.create();
    for (Map.Entry<Cell, List<Variable>> entry : covering.entrySet()) {
      List<Variable> list = entry.getValue();
      for (Variable x : list) {
        for (Variable y : list) {
          if (x.equals(y)) continue;
          checkArgument(!table.contains(x, y), "slots %s and %s share more than one cell", x, y);
          Cell cell = entry.getKey();
          table.put(x, y, Overlap.of(x.cells().indexOf(cell), y.cells().indexOf(cell)));
        }
      }
    }
    return ImmutableTable.copyOf(table);
  }

  /**
   * Assembles a crossword either from a structure, whose slots it finds, or
   * from individually added slots.  Words are trimmed and upper-cased; blank
   * ones are dropped.
   */
  @NotThreadSafe
  public static final class Builder {
    @Nullable private Structure structure;
    private final Set<Variable> variables = Sets.newTreeSet();
    private final ImmutableSortedSet.Builder<String> words = ImmutableSortedSet.naturalOrder();

    private Builder() {}

    /** Uses the given structure, and all the slots it implies. */
    public Builder setStructure(Structure structure) {
      checkArgument(variables.isEmpty(), "can't mix a structure with explicit slots");
      this.structure = checkNotNull(structure);
      return this;
    }

    public Builder addVariable(Variable var) {
      checkArgument(structure == null, "can't mix a structure with explicit slots");
      variables.add(checkNotNull(var));
      return this;
    }

    public Builder addVariables(Iterable<Variable> vars) {
      for (Variable var : vars)
        addVariable(var);
      return this;
    }

    public Builder addWord(String word) {
      String normalized = CharMatcher.whitespace().trimFrom(word).toUpperCase(Locale.ROOT);
      if (!normalized.isEmpty())
        words.add(normalized);
      return this;
    }

    public Builder addWords(Iterable<String> words) {
      for (String word : words)
        addWord(word);
      return this;
    }

    public Builder addWords(String... words) {
      for (String word : words)
        addWord(word);
      return this;
    }

    public Crossword build() {
      if (structure != null)
        return new Crossword(structure, structure.variables(), words.build());
      checkArgument(!variables.isEmpty(), "a crossword needs a structure or at least one slot");
      return new Crossword(
          Structure.covering(variables), ImmutableSortedSet.copyOf(variables), words.build());
    }
  }
}
