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

import static java.util.logging.Level.SEVERE;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.io.CrosswordJson;
import us.blanshard.crossword.io.PuzzleFiles;
import us.blanshard.crossword.render.ImageRenderer;
import us.blanshard.crossword.render.LetterGrid;

import com.google.common.collect.Lists;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Fills a crossword structure with words from a word list, prints the result,
 * and optionally saves it as an image or as json.
 *
 * @author Luke Blanshard
 */
public class Generate {
  private static final Logger logger = Logger.getLogger(Generate.class.getName());

  static final String MAX_STEPS_FLAG = "--max-steps=";

  public static void main(String[] args) {
    Tools.configureLogging();
    List<String> files = Lists.newArrayList();
    long maxSteps = Solver.UNLIMITED;
    try {
      for (String arg : args) {
        if (arg.startsWith(MAX_STEPS_FLAG))
          maxSteps = Long.decode(arg.substring(MAX_STEPS_FLAG.length()));
        else
          files.add(arg);
      }
    } catch (NumberFormatException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }
    if (files.size() < 2 || files.size() > 3 || maxSteps < 0) exitWithUsage();

    File output = files.size() > 2 ? new File(files.get(2)) : null;
    int status = run(new File(files.get(0)), new File(files.get(1)), output, maxSteps, System.out);
    System.exit(status);
  }

  private static void exitWithUsage() {
    System.err.println(
        "Usage: Generate [" + MAX_STEPS_FLAG + "<n>] <structure> <words> [<output>]");
    System.exit(1);
  }

  /**
   * Does the work of {@link #main}, printing to the given stream.  Returns the
   * process exit status: zero unless the input couldn't be read or the output
   * couldn't be written.  An unsolvable puzzle is not an error.
   */
  static int run(File structureFile, File wordsFile, @Nullable File output, long maxSteps,
      PrintStream out) {
    Crossword crossword;
    try {
      crossword = PuzzleFiles.readCrossword(structureFile, wordsFile);
    } catch (IOException e) {
      logger.log(SEVERE, "Unable to read puzzle from " + structureFile + " and " + wordsFile, e);
      System.err.println("Unable to read puzzle: " + e.getMessage());
      return 1;
    } catch (IllegalArgumentException e) {
      logger.log(SEVERE, "Malformed puzzle in " + structureFile, e);
      System.err.println("Malformed puzzle: " + e.getMessage());
      return 1;
    }

    Solver.Result result = Solver.solve(crossword, maxSteps);
    switch (result.status) {
      case SOLVED:
        out.print(LetterGrid.of(crossword, result.getSolution()));
        break;
      case ABANDONED:
        out.println("No solution found within " + maxSteps + " steps.");
        break;
      default:
        out.println("No solution.");
        break;
    }

    if (output == null) return 0;
    try {
      if (Files.getFileExtension(output.getName()).equalsIgnoreCase("json")) {
        CrosswordJson.write(crossword, result, output);
      } else if (result.isSolved()) {
        ImageRenderer.write(LetterGrid.of(crossword, result.getSolution()), output);
      }
    } catch (IOException e) {
      logger.log(SEVERE, "Unable to write " + output, e);
      System.err.println("Unable to write " + output + ": " + e.getMessage());
      return 1;
    }
    return 0;
  }
}
