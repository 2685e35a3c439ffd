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
package us.blanshard.minesweeper.solver;

import us.blanshard.minesweeper.board.Board;
import us.blanshard.minesweeper.board.Coord;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Locale;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Everything a probability calculation worked out about a board: the chance
 * of a mine in each unknown cell, plus the group distributions behind those
 * numbers.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ProbabilityResult {
  /** For each unknown cell, the probability that it holds a mine. */
  public final ImmutableSortedMap<Coord, Double> probabilities;
  /** One per equivalence group, in group order. */
  public final ImmutableList<GroupDistribution> groups;
  /** How many configurations satisfied the numbers. */
  public final long configurationCount;
  /** The mean number of mines among the edge cells. */
  public final double expectedEdgeMines;
  /** The probability shared by every outer cell, null when there are none. */
  @Nullable public final Double outerProbability;
  public final int outerCellCount;

  public ProbabilityResult(
      ImmutableSortedMap<Coord, Double> probabilities,
      ImmutableList<GroupDistribution> groups,
      long configurationCount,
      double expectedEdgeMines,
      @Nullable Double outerProbability,
      int outerCellCount) {
    this.probabilities = probabilities;
    this.groups = groups;
    this.configurationCount = configurationCount;
    this.expectedEdgeMines = expectedEdgeMines;
    this.outerProbability = outerProbability;
    this.outerCellCount = outerCellCount;
  }

  /** Returns the probability for the given cell, or null if it has none. */
  @Nullable public Double get(Coord coord) {
    return probabilities.get(coord);
  }

  /**
   * Renders the probabilities laid out like the given board, as percentages
   * with one decimal place.  Cells without a probability show as dashes.
   */
  public String toGridString(Board board) {
    int xSize = 0;
    int ySize = 0;
    for (Coord coord : board.allCoords()) {
      xSize = Math.max(xSize, coord.x + 1);
      ySize = Math.max(ySize, coord.y + 1);
    }
    StringBuilder sb = new StringBuilder();
    for (int y = 0; y < ySize; ++y) {
      for (int x = 0; x < xSize; ++x) {
        if (x > 0) sb.append(' ');
        Double p = probabilities.get(Coord.of(x, y));
        String cell = p == null ? "-" : String.format(Locale.US, "%.1f", 100 * p);
        sb.append(Strings.padStart(cell, 5, ' '));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  @Override public String toString() {
    return String.format("%d cells, %d groups, %d configurations, %.3f expected edge mines",
        probabilities.size(), groups.size(), configurationCount, expectedEdgeMines);
  }
}
