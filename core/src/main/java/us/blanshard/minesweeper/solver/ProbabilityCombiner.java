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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.logging.Level.SEVERE;

import us.blanshard.minesweeper.board.Coord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.math.DoubleMath;

import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Turns the configurations of a constraint system into probabilities.
 *
 * <p> Mines are distinguishable, so a configuration with m_i mines in group i
 * and M mines in all stands for k! / (m_1! ... m_n! (k-M)!) ways to split the
 * k remaining mines among the groups and the outer cells, times the ways each
 * part can arrange its share.  Weights are kept as logs and scaled by the
 * largest seen so far, so nothing overflows however large the board.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class ProbabilityCombiner {

  private static final Logger logger = Logger.getLogger(ProbabilityCombiner.class.getName());

  /** How far outside [0, 1] rounding error may push a probability. */
  static final double RANGE_TOLERANCE = 1e-4;
  /** How far from 1 a group distribution may sum. */
  static final double SUM_TOLERANCE = 1e-6;

  private final Combinatorics combinatorics;

  public ProbabilityCombiner(Combinatorics combinatorics) {
    this.combinatorics = combinatorics;
  }

  /**
   * Weighs the given configurations of the system and works out every
   * unknown cell's probability, given the number of mines not yet pinned
   * down anywhere on the board.
   *
   * @throws NoSolutionException if there are no configurations, or none can
   *     be reconciled with the mine count
   * @throws SolverTimeoutException if iterating the configurations does
   */
  public ProbabilityResult combine(
      ConstraintSystem system, Iterator<Configuration> configurations, int minesRemaining) {
    checkArgument(minesRemaining >= 0, "Negative mine count: %s", minesRemaining);
    int k = minesRemaining;
    int perCell = system.perCell;
    ImmutableList<EquivalenceGroup> groups = system.groups;
    int outerCells = system.outerCoords.size();
    long outerCapacity = (long) outerCells * perCell;
    long capacity = outerCapacity;
    for (EquivalenceGroup group : groups)
      capacity += group.maxMines;
    if (k > capacity)
      throw new NoSolutionException(String.format(
          "%d mines don't fit in %d unknown cells holding at most %d each",
          k, system.unknownCellCount(), perCell));

    // Log weight of each group's share, and of the outer cells' share.  The
    // k! is common to every configuration and cancels.
    double[][] groupTerms = new double[groups.size()][];
    for (EquivalenceGroup group : groups) {
      double[] terms = groupTerms[group.id] = new double[group.maxMines + 1];
      for (int j = 0; j < terms.length; ++j)
        terms[j] = combinatorics.logArrangementCount(group.size(), j, perCell)
            - combinatorics.logFactorial(j);
    }
    double[] outerTerms = new double[(int) Math.min(k, outerCapacity) + 1];
    for (int r = 0; r < outerTerms.length; ++r)
      outerTerms[r] = combinatorics.logArrangementCount(outerCells, r, perCell)
          - combinatorics.logFactorial(r);

    // Weight totals, all scaled by exp(-maxLog).
    double maxLog = Double.NEGATIVE_INFINITY;
    double total = 0;
    double[][] mass = new double[groups.size()][];
    for (EquivalenceGroup group : groups)
      mass[group.id] = new double[group.maxMines + 1];
    long count = 0;

    while (configurations.hasNext()) {
      Configuration config = configurations.next();
      ++count;
      int edgeMines = config.getTotalMines();
      if (edgeMines > k || k - edgeMines >= outerTerms.length) continue;  // Outer cells overflow.
      double logWeight = outerTerms[k - edgeMines];
      if (logWeight == Double.NEGATIVE_INFINITY) continue;
      for (int i = 0; i < groupTerms.length; ++i)
        logWeight += groupTerms[i][config.get(i)];
      if (logWeight > maxLog) {
        double scale = Math.exp(maxLog - logWeight);
        total *= scale;
        for (double[] row : mass)
          for (int j = 0; j < row.length; ++j)
            row[j] *= scale;
        maxLog = logWeight;
      }
      double weight = Math.exp(logWeight - maxLog);
      total += weight;
      for (int i = 0; i < mass.length; ++i)
        mass[i][config.get(i)] += weight;
    }

    if (count == 0)
      throw new NoSolutionException("No arrangement of mines satisfies the numbers");
    if (total == 0)
      throw new NoSolutionException(String.format(
          "None of the %,d arrangements satisfying the numbers leaves room for %d mines",
          count, k));

    ImmutableSortedMap.Builder<Coord, Double> probabilities = ImmutableSortedMap.naturalOrder();
    List<GroupDistribution> distributions = Lists.newArrayList();
    double expectedEdgeMines = 0;
    for (EquivalenceGroup group : groups) {
      double[] dist = mass[group.id];
      double sum = 0;
      double cellProbability = 0;
      double expected = 0;
      for (int j = 0; j < dist.length; ++j) {
        dist[j] /= total;
        sum += dist[j];
        expected += j * dist[j];
        if (dist[j] > 0)
          cellProbability += dist[j] * combinatorics.unsafeProbability(group.size(), j, perCell);
      }
      if (!DoubleMath.fuzzyEquals(sum, 1, SUM_TOLERANCE))
        throw inconsistent(String.format(
            "Distribution for group %s sums to %s: %s", group, sum, Arrays.toString(dist)));
      cellProbability = checkRange(cellProbability, group);
      for (int j = 0; j < dist.length; ++j)
        dist[j] = checkRange(dist[j], group);

      List<Double> list = Lists.newArrayListWithCapacity(dist.length);
      for (double d : dist) list.add(d);
      distributions.add(new GroupDistribution(group, list, cellProbability, expected));
      for (Coord coord : group.coords)
        probabilities.put(coord, cellProbability);
      expectedEdgeMines += expected;
    }

    Double outerProbability = null;
    if (outerCells > 0) {
      int outerMines = k - DoubleMath.roundToInt(expectedEdgeMines, RoundingMode.HALF_UP);
      outerProbability = checkRange(
          combinatorics.unsafeProbability(outerCells, outerMines, perCell), system.outerCoords);
      for (Coord coord : system.outerCoords)
        probabilities.put(coord, outerProbability);
    }

    return new ProbabilityResult(
        probabilities.build(), ImmutableList.copyOf(distributions), count, expectedEdgeMines,
        outerProbability, outerCells);
  }

  /**
   * Returns the given probability pulled into [0, 1], as long as it was close
   * enough to start with.
   */
  static double checkRange(double p, Object where) {
    if (Double.isNaN(p) || p < -RANGE_TOLERANCE || p > 1 + RANGE_TOLERANCE)
      throw inconsistent(String.format("Probability %s out of range for %s", p, where));
    return Math.min(1.0, Math.max(0.0, p));
  }

  private static InternalConsistencyException inconsistent(String message) {
    logger.log(SEVERE, message);
    return new InternalConsistencyException(message);
  }
}
