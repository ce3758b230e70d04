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
package us.blanshard.crossword.cli;

import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.logging.Level.SEVERE;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.io.PuzzleFiles;

import com.google.common.base.Stopwatch;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Solves one puzzle repeatedly, and spits out statistics about the solver's
 * work and time.
 *
 * @author Luke Blanshard
 */
public class SolveStats {
  private static final Logger logger = Logger.getLogger(SolveStats.class.getName());

  private static final int DEFAULT_COUNT = 10;

  public static void main(String[] args) {
    Tools.configureLogging();
    if (args.length < 2 || args.length > 3) exitWithUsage();
    int count;
    try {
      count = args.length > 2 ? Integer.decode(args[2]) : DEFAULT_COUNT;
    } catch (NumberFormatException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }

    Crossword crossword;
    try {
      crossword = PuzzleFiles.readCrossword(new File(args[0]), new File(args[1]));
    } catch (IOException e) {
      logger.log(SEVERE, "Unable to read puzzle", e);
      System.err.println("Unable to read puzzle: " + e.getMessage());
      System.exit(1);
      return;
    }

    System.out.printf("Solving %d slots with %d words, %d times%n",
        crossword.variables().size(), crossword.words().size(), count);

    // Start with a few rounds and no printing, to get all the machinery
    // warmed up.
    solve(crossword, 3, false);

    // Then do the real work.
    solve(crossword, count, true);
  }

  private static void exitWithUsage() {
    System.err.println("Usage: SolveStats <structure> <words> [<count>]");
    System.exit(1);
  }

  private static void solve(Crossword crossword, int count, boolean print) {
    if (print) System.out.println("Run\tStatus\tSteps\tPruned\tMicros");
    for (int run = 1; run <= count; ++run) {
      Stopwatch stopwatch = Stopwatch.createStarted();
      Solver.Result result = Solver.solve(crossword);
      stopwatch.stop();

      long micros = stopwatch.elapsed(MICROSECONDS);
      if (print) {
        System.out.printf("%d\t%s\t%d\t%d\t%d%n",
            run, result.status, result.numSteps, result.numPruned, micros);
      }
    }
  }
}
