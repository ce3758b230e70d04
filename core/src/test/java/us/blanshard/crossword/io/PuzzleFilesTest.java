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

import static org.junit.Assert.assertEquals;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Structure;
import us.blanshard.crossword.core.TestPuzzles;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class PuzzleFilesTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  @Test public void readResources() throws IOException {
    Crossword crossword = PuzzleFiles.readCrossword(
        TestPuzzles.resource("structure0.txt"), TestPuzzles.resource("words0.txt"));
    assertEquals(4, crossword.variables().size());
    assertEquals(10, crossword.words().size());
    assertEquals(true, crossword.words().contains("SEVEN"));
  }

  @Test public void readFiles() throws IOException {
    File structure = folder.newFile("structure.txt");
    File words = folder.newFile("words.txt");
    Files.asCharSink(structure, StandardCharsets.UTF_8).write("__\n#_\n");
    Files.asCharSink(words, StandardCharsets.UTF_8).write("at\nto\nox\n");

    assertEquals(Structure.fromString("__\n#_"), PuzzleFiles.readStructure(structure));
    assertEquals(ImmutableList.of("at", "to", "ox"), PuzzleFiles.readWords(words));

    Crossword crossword = PuzzleFiles.readCrossword(structure, words);
    assertEquals(2, crossword.variables().size());
    assertEquals(ImmutableList.of("AT", "OX", "TO"), crossword.words().asList());
  }

  @Test(expected = FileNotFoundException.class)
  public void missingFile() throws IOException {
    PuzzleFiles.readStructure(new File(folder.getRoot(), "nothing-here.txt"));
  }
}
