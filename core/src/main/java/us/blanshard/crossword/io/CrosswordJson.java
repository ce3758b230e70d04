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
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Variable;
import us.blanshard.crossword.render.LetterGrid;

import com.google.common.io.Files;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Static methods that convert solver results to json.
 *
 * @author Luke Blanshard
 */
public class CrosswordJson {

  /** Pretty-prints, and leaves the block character alone. */
  public static final Gson GSON = new GsonBuilder()
      .setPrettyPrinting()
      .disableHtmlEscaping()
      .create();

  /**
   * Describes the given result for the given puzzle.  The entries and the grid
   * are only included when the puzzle was solved.
   */
  public static JsonObject toJson(Crossword crossword, Solver.Result result) {
    JsonObject object = new JsonObject();
    object.addProperty("width", crossword.width());
    object.addProperty("height", crossword.height());
    object.addProperty("status", result.status.name());
    object.addProperty("steps", result.numSteps);
    object.addProperty("pruned", result.numPruned);
    if (result.isSolved()) {
      object.add("entries", entries(result.getSolution()));
      JsonArray grid = new JsonArray();
      for (String row : LetterGrid.of(crossword, result.getSolution()).toRows())
        grid.add(new JsonPrimitive(row));
      object.add("grid", grid);
    }
    return object;
  }

  private static JsonArray entries(Map<Variable, String> solution) {
    JsonArray array = new JsonArray();
    for (Map.Entry<Variable, String> entry : solution.entrySet()) {
      Variable var = entry.getKey();
      JsonObject object = new JsonObject();
      object.addProperty("row", var.i);
      object.addProperty("column", var.j);
      object.addProperty("direction", var.direction.name());
      object.addProperty("length", var.length);
      object.addProperty("word", entry.getValue());
      array.add(object);
    }
    return array;
  }

  public static String toJsonString(Crossword crossword, Solver.Result result) {
    return GSON.toJson(toJson(crossword, result));
  }

  /** Writes the json form of the result to the given file, as UTF-8. */
  public static void write(Crossword crossword, Solver.Result result, File file)
      throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(toJsonString(crossword, result));
  }
}
