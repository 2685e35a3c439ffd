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

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * The probability of each possible mine count of one equivalence group, and
 * what follows from it for the group's cells.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class GroupDistribution {
  public final EquivalenceGroup group;
  /** Indexed by mine count, from zero to the group's capacity. */
  public final ImmutableList<Double> probabilities;
  /** The chance that any one cell of the group holds a mine. */
  public final double cellProbability;
  /** The mean number of mines in the group. */
  public final double expectedMines;

  public GroupDistribution(
      EquivalenceGroup group, Iterable<Double> probabilities, double cellProbability,
      double expectedMines) {
    this.group = group;
    this.probabilities = ImmutableList.copyOf(probabilities);
    this.cellProbability = cellProbability;
    this.expectedMines = expectedMines;
  }

  /** The probability that the group holds exactly the given number of mines. */
  public double get(int mines) {
    return mines < probabilities.size() ? probabilities.get(mines) : 0;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder().append(group.coords).append(':');
    for (int j = 0; j < probabilities.size(); ++j)
      sb.append(String.format(" %d=%.4f", j, probabilities.get(j)));
    return sb.append(String.format(" (cell %.4f, expected %.3f)", cellProbability, expectedMines))
        .toString();
  }
}
