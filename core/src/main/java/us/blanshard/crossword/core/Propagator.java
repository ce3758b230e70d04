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

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Prunes a puzzle's {@link Domains} before search: first by each slot's own
 * length constraint (node consistency), then by the overlaps between slots
 * (arc consistency, using AC-3).  Only ever removes candidates.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Propagator {
  private static final Logger logger = Logger.getLogger(Propagator.class.getName());

  private final Crossword crossword;
  private final Domains domains;
  private int numRevisions;
  private int numPruned;

  public Propagator(Crossword crossword, Domains domains) {
    this.crossword = crossword;
    this.domains = domains;
  }

  /** The number of times {@link #revise} has compared two overlapping slots. */
  public int getRevisionCount() {
    return numRevisions;
  }

  /** The number of candidates removed so far. */
  public int getPrunedCount() {
    return numPruned;
  }

  /**
   * Removes from every slot's domain the words whose length differs from the
   * slot's.  Returns the number of words removed.  May leave a domain empty;
   * that is found out later.
   */
  public int enforceNodeConsistency() {
    int removed = 0;
    for (Variable var : crossword.variables()) {
      List<String> wrongLength = Lists.newArrayList();
      for (String word : domains.get(var)) {
        if (word.length() != var.length)
          wrongLength.add(word);
      }
      removed += domains.removeAll(var, wrongLength);
    }
    numPruned += removed;
    logger.fine("node consistency removed " + removed + " candidates");
    return removed;
  }

  /**
   * Makes x's domain consistent with y's: removes each candidate of x that
   * puts a letter in the shared cell that no candidate of y puts there.  A
   * candidate too short to reach the shared cell is removed.  Returns true if
   * anything was removed; a pair of slots that don't overlap is left alone.
   */
  public boolean revise(Variable x, Variable y) {
    Overlap overlap = crossword.overlap(x, y);
    if (overlap == null)
      return false;
    ++numRevisions;

    // The letters y's candidates can put in the shared cell.
    Set<Character> supported = Sets.newHashSet();
    for (String wy : domains.get(y)) {
      if (Overlap.reaches(wy, overlap.second))
        supported.add(wy.charAt(overlap.second));
    }

    List<String> unsupported = Lists.newArrayList();
    for (String wx : domains.get(x)) {
      if (!Overlap.reaches(wx, overlap.first)) {
        unsupported.add(wx);  // Too short to have a letter there.
      } else if (!supported.contains(wx.charAt(overlap.first))) {
        unsupported.add(wx);
      }
    }

    int removed = domains.removeAll(x, unsupported);
    numPruned += removed;
    return removed > 0;
  }

  /**
   * Enforces arc consistency over every arc of the puzzle.  Returns false if
   * some slot is left with no candidates, in which case the puzzle has no
   * solution.
   */
  public boolean ac3() {
    return ac3(crossword.arcs());
  }

  /**
   * Enforces arc consistency starting from the given arcs, and re-examining
   * the arcs into any slot whose domain shrinks.  Arcs are processed first in,
   * first out.  Returns false as soon as some slot is left with no candidates.
   */
  public boolean ac3(Iterable<Arc> arcs) {
    ArrayDeque<Arc> queue = new ArrayDeque<Arc>();
    Set<Arc> pending = Sets.newHashSet();
    for (Arc arc : arcs) {
      if (pending.add(arc))
        queue.addLast(arc);
    }

    while (!queue.isEmpty()) {
      Arc arc = queue.removeFirst();
      pending.remove(arc);
      if (crossword.overlap(arc.x, arc.y) == null)
        continue;

      boolean revised = revise(arc.x, arc.y);
      if (domains.isEmpty(arc.x)) {
        if (logger.isLoggable(Level.FINE))
          logger.fine("arc consistency emptied the domain of " + arc.x);
        return false;
      }

      if (revised) {
        for (Variable z : crossword.neighbors(arc.x)) {
          if (z.equals(arc.y)) continue;
          Arc next = Arc.of(z, arc.x);
          if (pending.add(next))
            queue.addLast(next);
        }
      }
    }
    return true;
  }
}
