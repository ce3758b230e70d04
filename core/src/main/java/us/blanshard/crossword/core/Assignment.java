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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mapping from every slot of a puzzle to either a word or nothing.  The
 * backtracking search owns a single instance and extends and undoes it in
 * place.  Does not enforce any of the puzzle's constraints.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Assignment {

  private final SortedMap<Variable, String> words = Maps.newTreeMap();
  private final ImmutableSortedSet<Variable> variables;

  /** Makes an assignment covering the given slots, all unassigned. */
  public Assignment(Iterable<Variable> variables) {
    this.variables = ImmutableSortedSet.copyOf(variables);
  }

  /** Makes an empty assignment over the slots of the given puzzle. */
  public static Assignment empty(Crossword crossword) {
    return new Assignment(crossword.variables());
  }

  /** The slots this assignment covers. */
  public ImmutableSortedSet<Variable> variables() {
    return variables;
  }

  /** Returns the word assigned to the given slot, or null. */
  @Nullable public String get(Variable var) {
    return words.get(var);
  }

  public boolean isAssigned(Variable var) {
    return words.containsKey(var);
  }

  /** Assigns the given word to the given slot, replacing any previous word. */
  public Assignment assign(Variable var, String word) {
    checkArgument(variables.contains(var), "no such slot: %s", var);
    words.put(var, checkNotNull(word));
    return this;
  }

  /** Marks the given slot unassigned again. */
  public Assignment unassign(Variable var) {
    words.remove(var);
    return this;
  }

  /** Returns the number of slots with words. */
  public int size() {
    return words.size();
  }

  /** Tells whether every slot has a word. */
  public boolean isComplete() {
    return words.size() == variables.size();
  }

  /** Returns the assigned slots and their words. */
  public Map<Variable, String> assigned() {
    return Collections.unmodifiableSortedMap(words);
  }

  /** Returns an immutable copy of the assigned slots and their words. */
  public ImmutableSortedMap<Variable, String> snapshot() {
    return ImmutableSortedMap.copyOfSorted(words);
  }

  @Override public String toString() {
    return words.toString();
  }
}
