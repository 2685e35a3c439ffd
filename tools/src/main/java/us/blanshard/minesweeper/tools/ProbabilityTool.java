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
package us.blanshard.minesweeper.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.minesweeper.board.GridBoard;
import us.blanshard.minesweeper.json.BoardJson;
import us.blanshard.minesweeper.solver.GroupDistribution;
import us.blanshard.minesweeper.solver.ProbabilityEngine;
import us.blanshard.minesweeper.solver.ProbabilityResult;
import us.blanshard.minesweeper.solver.SolverBudget;
import us.blanshard.minesweeper.solver.SolverException;
import us.blanshard.minesweeper.solver.SolverOptions;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Loads a minesweeper board from a file, and prints the probability of a
 * mine in each of its unknown cells.  Boards ending in ".json" are read as
 * json, others as text.  The budget comes from the system properties named
 * in {@link SolverBudget}; "--ignore-flags" treats flagged cells as unknown.
 *
 * @author Luke Blanshard
 */
public class ProbabilityTool {
  static final String IGNORE_FLAGS = "--ignore-flags";
  static final String USAGE =
      "Usage: ProbabilityTool [" + IGNORE_FLAGS + "] <board-file> <mines> [<per-cell>]";

  public static void main(String[] args) throws IOException {
    int status = run(args, System.out, System.err);
    if (status != 0) System.exit(status);
  }

  /**
   * Does the work of {@link #main}, returning the exit status: 0 for
   * success, 1 for bad arguments, 2 when the board has no probabilities.
   */
  static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
    List<String> list = Lists.newArrayList(args);
    boolean ignoreFlags = list.remove(IGNORE_FLAGS);
    if (list.size() < 2 || list.size() > 3) return usage(err);
    File file = new File(list.get(0));
    Integer mines = Ints.tryParse(list.get(1));
    Integer perCell = list.size() > 2 ? Ints.tryParse(list.get(2)) : Integer.valueOf(1);
    if (mines == null || perCell == null || mines < 0 || perCell < 1) return usage(err);

    String text = Files.asCharSource(file, UTF_8).read();
    GridBoard board = file.getName().endsWith(".json")
        ? BoardJson.toBoard(text)
        : GridBoard.fromString(text);
    out.print(board);
    out.println();

    ProbabilityEngine engine = new ProbabilityEngine(SolverOptions.builder()
        .setBudget(SolverBudget.fromSystemProperties())
        .setIgnoreFlags(ignoreFlags)
        .build());
    Stopwatch stopwatch = Stopwatch.createStarted();
    ProbabilityResult result;
    try {
      result = engine.analyze(board, mines, perCell);
    } catch (SolverException e) {
      err.printf("No probabilities: %s%n", e.getMessage());
      return 2;
    }
    stopwatch.stop();

    out.print(result.toGridString(board));
    out.println();
    for (GroupDistribution group : result.groups)
      out.println(group);
    if (result.outerProbability != null)
      out.printf("%d outer cells: %.4f%n", result.outerCellCount, result.outerProbability);
    out.printf("%s, %d ms%n", result, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return 0;
  }

  private static int usage(PrintStream err) {
    err.println(USAGE);
    return 1;
  }
}
