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
package us.blanshard.crossword.io;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Structure;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the two text files that describe a puzzle: the structure file, in the
 * form {@link Structure#fromString} parses, and the word list, one word per
 * line.  Both are UTF-8.
 *
 * @author Luke Blanshard
 */
public final class PuzzleFiles {

  private PuzzleFiles() {}

  public static Structure readStructure(File file) throws IOException {
    return readStructure(Files.asCharSource(file, StandardCharsets.UTF_8));
  }

  public static Structure readStructure(CharSource source) throws IOException {
    return Structure.fromString(source.read());
  }

  public static ImmutableList<String> readWords(File file) throws IOException {
    return readWords(Files.asCharSource(file, StandardCharsets.UTF_8));
  }

  /** Returns the lines of the given source; the crossword builder cleans them. */
  public static ImmutableList<String> readWords(CharSource source) throws IOException {
    return source.readLines();
  }

  /** Reads both files and makes the puzzle they describe. */
  public static Crossword readCrossword(File structureFile, File wordsFile) throws IOException {
    return Crossword.of(readStructure(structureFile), readWords(wordsFile));
  }

  public static Crossword readCrossword(CharSource structure, CharSource words)
      throws IOException {
    return Crossword.of(readStructure(structure), readWords(words));
  }
}
