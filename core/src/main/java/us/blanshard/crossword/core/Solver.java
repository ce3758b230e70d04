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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Functions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Fills a crossword: prunes the domains with node and arc consistency, then
 * runs a depth-first backtracking search that picks the slot with the fewest
 * candidates left (most overlaps breaking ties) and tries its least
 * constraining words first.
 *
 * <p> The search extends and undoes a single {@link Assignment} in place, so
 * its memory is bounded by the number of slots.  A solver instance does one
 * solve.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /** A step budget that never runs out. */
  public static final long UNLIMITED = Long.MAX_VALUE;

  /**
   * Solves the given puzzle, returns a summary of the result.
   */
  public static Result solve(Crossword crossword) {
    return solve(crossword, UNLIMITED);
  }

  /**
   * Solves the given puzzle, giving up after the given number of search
   * steps; returns a summary of the result.
   */
  public static Result solve(Crossword crossword, long maxSteps) {
    return new Solver(crossword, maxSteps).solve();
  }

  /** The ways a solve can end. */
  public enum Status {
    SOLVED,      // Every slot filled, no constraint broken.
    INFEASIBLE,  // Arc consistency left some slot with no candidates.
    EXHAUSTED,   // The search tried everything without success.
    ABANDONED;   // The search ran out of steps.

    /** Tells whether this status means the puzzle was shown to have no solution. */
    public boolean provesNoSolution() {
      return this == INFEASIBLE || this == EXHAUSTED;
    }
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Status status;
    public final long numSteps;  // Slots chosen for expansion by the search
    public final int numPruned;  // Candidates removed by propagation
    @Nullable private final ImmutableSortedMap<Variable, String> solution;

    Result(Status status, @Nullable ImmutableSortedMap<Variable, String> solution,
        long numSteps, int numPruned) {
      checkArgument((status == Status.SOLVED) == (solution != null));
      this.status = status;
      this.solution = solution;
      this.numSteps = numSteps;
      this.numPruned = numPruned;
    }

    public boolean isSolved() {
      return status == Status.SOLVED;
    }

    /** Returns the word for every slot.  Only available when solved. */
    public ImmutableSortedMap<Variable, String> getSolution() {
      checkState(solution != null, "no solution: %s", status);
      return solution;
    }

    @Override public String toString() {
      return status + " after " + numSteps + " steps, " + numPruned + " pruned";
    }
  }

  private final Crossword crossword;
  private final Domains domains;
  private final Propagator propagator;
  private final long maxSteps;
  private long numSteps;
  private boolean abandoned;

  public Solver(Crossword crossword) {
    this(crossword, UNLIMITED);
  }

  public Solver(Crossword crossword, long maxSteps) {
    this(crossword, Domains.of(crossword), maxSteps);
  }

  /**
   * Makes a solver that works on the given domains, which must cover the
   * puzzle's slots.
   */
  public Solver(Crossword crossword, Domains domains, long maxSteps) {
    checkArgument(maxSteps >= 0, "negative step budget");
    checkArgument(domains.variables().equals(crossword.variables()),
        "domains don't match the puzzle's slots");
    this.crossword = crossword;
    this.domains = domains;
    this.propagator = new Propagator(crossword, domains);
    this.maxSteps = maxSteps;
  }

  public Domains getDomains() {
    return domains;
  }

  public Propagator getPropagator() {
    return propagator;
  }

  /** Returns the number of search steps taken so far. */
  public long getStepCount() {
    return numSteps;
  }

  /**
   * Enforces node consistency, then arc consistency, then searches.  The
   * search is skipped when arc consistency shows there is no solution.
   */
  public Result solve() {
    propagator.enforceNodeConsistency();
    if (!propagator.ac3()) {
      logger.info("no solution: arc consistency left a slot with no candidates");
      return new Result(Status.INFEASIBLE, null, 0, propagator.getPrunedCount());
    }
    if (logger.isLoggable(Level.FINE))
      logger.fine(domains.totalSize() + " candidates left after propagation");

    Assignment assignment = Assignment.empty(crossword);
    Status status;
    if (backtrack(assignment)) status = Status.SOLVED;
    else status = abandoned ? Status.ABANDONED : Status.EXHAUSTED;

    if (logger.isLoggable(Level.FINE))
      logger.fine("search " + status + " after " + numSteps + " steps");
    return new Result(status, status == Status.SOLVED ? assignment.snapshot() : null,
        numSteps, propagator.getPrunedCount());
  }

  /**
   * Extends the given assignment to a complete and consistent one if
   * possible.  Returns true with the assignment complete, or false with the
   * assignment exactly as it was given.
   */
  public boolean backtrack(Assignment assignment) {
    if (assignment.isComplete())
      return true;
    if (numSteps >= maxSteps) {
      abandoned = true;
      return false;
    }
    ++numSteps;

    Variable var = selectUnassignedVariable(assignment);
    for (String word : orderDomainValues(var, assignment)) {
      assignment.assign(var, word);
      if (consistent(assignment) && backtrack(assignment))
        return true;
      assignment.unassign(var);
      if (abandoned)
        break;
    }
    return false;
  }

  /**
   * Tells whether the given assignment breaks no rule: no word is used twice,
   * every word fits its slot, and overlapping slots agree on their shared
   * letters.  Unassigned slots are ignored.
   */
  public boolean consistent(Assignment assignment) {
    Set<String> used = Sets.newHashSet();
    for (Map.Entry<Variable, String> entry : assignment.assigned().entrySet()) {
      Variable var = entry.getKey();
      String word = entry.getValue();
      if (!used.add(word))
        return false;  // Already in another slot.
      if (word.length() != var.length)
        return false;
      for (Variable neighbor : crossword.neighbors(var)) {
        String other = assignment.get(neighbor);
        if (other != null && !crossword.overlap(var, neighbor).agrees(word, other))
          return false;
      }
    }
    return true;
  }

  /**
   * Returns the candidates of the given slot, ordered by how many candidates
   * each one rules out for the slot's unassigned neighbors, fewest first.  A
   * neighbor's candidate is ruled out if it is the same word or disagrees on
   * the shared letter.  Ties stay in lexicographic order.
   */
  public List<String> orderDomainValues(Variable var, Assignment assignment) {
    List<Variable> openNeighbors = Lists.newArrayList();
    for (Variable neighbor : crossword.neighbors(var)) {
      if (!assignment.isAssigned(neighbor))
        openNeighbors.add(neighbor);
    }

    Map<String, Integer> ruledOut = Maps.newHashMap();
    for (String word : domains.get(var)) {
      int count = 0;
      for (Variable neighbor : openNeighbors) {
        Overlap overlap = crossword.overlap(var, neighbor);
        for (String other : domains.get(neighbor)) {
          if (other.equals(word) || !overlap.agrees(word, other))
            ++count;
        }
      }
      ruledOut.put(word, count);
    }
    return Ordering.natural().onResultOf(Functions.forMap(ruledOut)).sortedCopy(domains.get(var));
  }

  /**
   * Chooses the unassigned slot with the fewest remaining candidates,
   * breaking ties in favor of the slot with the most neighbors, and then in
   * favor of the earliest slot.  Returns null if every slot is assigned.
   */
  @Nullable public Variable selectUnassignedVariable(Assignment assignment) {
    Variable best = null;
    for (Variable var : assignment.variables()) {
      if (assignment.isAssigned(var)) continue;
      if (best == null || compareForSelection(var, best) < 0)
        best = var;
    }
    return best;
  }

  private int compareForSelection(Variable a, Variable b) {
    return ComparisonChain.start()
        .compare(domains.size(a), domains.size(b))
        .compare(crossword.degree(b), crossword.degree(a))
        .result();
  }
}
