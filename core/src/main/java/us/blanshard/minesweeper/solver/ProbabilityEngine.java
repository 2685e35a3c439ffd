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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.INFO;

import us.blanshard.minesweeper.board.Board;
import us.blanshard.minesweeper.board.Coord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Works out, for every unknown cell of a minesweeper board, the probability
 * that it holds a mine, assuming every arrangement of the remaining mines
 * consistent with the board is equally likely.
 *
 * <p> The work goes in four stages: the numbers are read off the board as
 * constraints, the cells under them are grouped by which constraints they
 * border, the ways of spreading mines over the groups are enumerated, and
 * those are weighed into probabilities.
 *
 * <p> An engine keeps tables of counts between calls.  Use each from one
 * thread only.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class ProbabilityEngine {

  private static final Logger logger = Logger.getLogger(ProbabilityEngine.class.getName());

  private final Combinatorics combinatorics;
  private final SolverOptions options;

  public ProbabilityEngine() {
    this(SolverOptions.DEFAULT);
  }

  public ProbabilityEngine(SolverOptions options) {
    this(new Combinatorics(), options);
  }

  public ProbabilityEngine(Combinatorics combinatorics, SolverOptions options) {
    this.combinatorics = checkNotNull(combinatorics);
    this.options = checkNotNull(options);
  }

  public SolverOptions getOptions() {
    return options;
  }

  /**
   * Returns the probability of a mine in each unknown cell of the board.
   *
   * @param board the board as the player sees it
   * @param minesRemaining the mines not shown by flags or revealed mines
   * @param perCell the most mines one cell may hold
   */
  public ImmutableSortedMap<Coord, Double> computeProbabilities(
      Board board, int minesRemaining, int perCell) {
    return analyze(board, minesRemaining, perCell).probabilities;
  }

  /**
   * Like {@link #computeProbabilities}, but returns the group distributions
   * and totals along with the probabilities.
   *
   * @throws MalformedBoardException if the numbers contradict the board
   * @throws NoSolutionException if no arrangement of mines fits
   * @throws SolverTimeoutException if the options' budget runs out
   * @throws InternalConsistencyException if a probability comes out wrong
   */
  public ProbabilityResult analyze(Board board, int minesRemaining, int perCell) {
    checkNotNull(board);
    checkArgument(minesRemaining >= 0, "Negative mine count: %s", minesRemaining);
    checkArgument(perCell >= 1, "Cells must hold at least one mine: %s", perCell);

    ConstraintExtractor extractor = new ConstraintExtractor(perCell, options.ignoreFlags);
    ImmutableList<Coord> unknowns = extractor.unknownCoords(board);
    if (!ConstraintExtractor.hasNumbers(board))
      return uniform(unknowns, minesRemaining, perCell);

    ImmutableList<NumberConstraint> constraints = extractor.extract(board);
    ConstraintSystem system = Grouper.group(constraints, unknowns, perCell);
    ConfigurationEnumerator.Iter configurations =
        new ConfigurationEnumerator(system, options.budget).iterator();
    ProbabilityResult result;
    try {
      result = new ProbabilityCombiner(combinatorics)
          .combine(system, configurations, minesRemaining);
    } catch (SolverTimeoutException e) {
      logger.log(INFO, "Gave up on {0} groups from {1} numbers: {2}",
          new Object[] {system.groups.size(), constraints.size(), e.getMessage()});
      throw e;
    }
    if (logger.isLoggable(FINE)) {
      logger.log(FINE, "{0} numbers, {1} groups, {2} outer cells: {3} configurations"
          + " in {4} steps, {5} ms", new Object[] {
              constraints.size(), system.groups.size(), system.outerCoords.size(),
              configurations.getConfigurationCount(), configurations.getStepCount(),
              configurations.getElapsedMillis()});
    }
    return result;
  }

  /**
   * With no numbers showing, every unknown cell is alike.
   */
  private ProbabilityResult uniform(ImmutableList<Coord> unknowns, int minesRemaining, int perCell) {
    int cells = unknowns.size();
    if (minesRemaining > (long) cells * perCell)
      throw new NoSolutionException(String.format(
          "%d mines don't fit in %d cells holding at most %d each", minesRemaining, cells, perCell));
    ImmutableSortedMap.Builder<Coord, Double> probabilities = ImmutableSortedMap.naturalOrder();
    Double p = null;
    if (cells > 0) {
      p = combinatorics.unsafeProbability(cells, minesRemaining, perCell);
      for (Coord coord : unknowns)
        probabilities.put(coord, p);
    }
    logger.log(FINE, "No numbers showing, {0} cells share probability {1}", new Object[] {cells, p});
    return new ProbabilityResult(
        probabilities.build(), ImmutableList.<GroupDistribution>of(), 0, 0, p, cells);
  }
}
