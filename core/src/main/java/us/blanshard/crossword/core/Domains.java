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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The candidate words still possible for each slot of one puzzle.  Starts with
 * the whole vocabulary in every slot; candidates can be removed but never
 * added back.  Each set iterates its words in lexicographic order.
 *
 * <p> One instance belongs to one solve: make a fresh one per puzzle.
 */
@NotThreadSafe
public final class Domains {

  private final SortedMap<Variable, SortedSet<String>> domains = Maps.newTreeMap();

  private Domains(Crossword crossword) {
    for (Variable var : crossword.variables())
      domains.put(var, Sets.newTreeSet(crossword.words()));
  }

  /** Returns the full, unpruned domains of the given puzzle. */
  public static Domains of(Crossword crossword) {
    return new Domains(crossword);
  }

  /** Returns the slots this store covers. */
  public Set<Variable> variables() {
    return Collections.unmodifiableSet(domains.keySet());
  }

  /** Returns a read-only view of the given slot's candidates. */
  public SortedSet<String> get(Variable var) {
    return Collections.unmodifiableSortedSet(domain(var));
  }

  public int size(Variable var) {
    return domain(var).size();
  }

  public boolean isEmpty(Variable var) {
    return domain(var).isEmpty();
  }

  public boolean contains(Variable var, String word) {
    return domain(var).contains(word);
  }

  /** Removes a candidate, returns true if it was there. */
  public boolean remove(Variable var, String word) {
    return domain(var).remove(word);
  }

  /** Removes the given candidates, returns how many were there. */
  public int removeAll(Variable var, Collection<String> words) {
    SortedSet<String> domain = domain(var);
    int before = domain.size();
    domain.removeAll(words);
    return before - domain.size();
  }

  /** Returns the total number of candidates over all slots. */
  public int totalSize() {
    int answer = 0;
    for (SortedSet<String> domain : domains.values())
      answer += domain.size();
    return answer;
  }

  /** Returns an immutable copy of the current state. */
  public ImmutableSortedMap<Variable, ImmutableSortedSet<String>> snapshot() {
    ImmutableSortedMap.Builder<Variable, ImmutableSortedSet<String>> builder =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Variable, SortedSet<String>> entry : domains.entrySet())
      builder.put(entry.getKey(), ImmutableSortedSet.copyOfSorted(entry.getValue()));
    return builder.build();
  }

  private SortedSet<String> domain(Variable var) {
    SortedSet<String> domain = domains.get(var);
    checkArgument(domain != null, "no such slot: %s", var);
    return domain;
  }

  @Override public String toString() {
    return domains.toString();
  }
}
