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

import static com.google.common.truth.Truth.assertThat;
import static us.blanshard.minesweeper.TestHelper.c;
import static us.blanshard.minesweeper.TestHelper.sys;

import org.junit.Test;

public class ProbabilityCombinerTest {

  private final ProbabilityCombiner combiner = new ProbabilityCombiner(new Combinatorics());

  private ProbabilityResult combine(ConstraintSystem system, int mines) {
    return combiner.combine(
        system, new ConfigurationEnumerator(system, SolverBudget.UNLIMITED).iterator(), mines);
  }

  @Test public void mineCountDecides() {
    ConstraintSystem system = sys("1 # #\n# # 1");

    ProbabilityResult one = combine(system, 1);
    assertThat(one.configurationCount).isEqualTo(2);
    assertThat(one.get(c(1, 0))).isWithin(1e-12).of(0.5);
    assertThat(one.get(c(1, 1))).isWithin(1e-12).of(0.5);
    assertThat(one.get(c(0, 1))).isEqualTo(0.0);
    assertThat(one.get(c(2, 0))).isEqualTo(0.0);
    assertThat(one.groups.get(1).probabilities).containsExactly(0.0, 1.0).inOrder();
    assertThat(one.expectedEdgeMines).isWithin(1e-12).of(1.0);
    assertThat(one.outerProbability).isNull();

    ProbabilityResult two = combine(system, 2);
    assertThat(two.get(c(0, 1))).isEqualTo(1.0);
    assertThat(two.get(c(2, 0))).isEqualTo(1.0);
    assertThat(two.get(c(1, 0))).isEqualTo(0.0);
    assertThat(two.expectedEdgeMines).isWithin(1e-12).of(2.0);
  }

  @Test(expected = NoSolutionException.class)
  public void tooManyMines() {
    combine(sys("1 # #\n# # 1"), 3);
  }

  @Test(expected = NoSolutionException.class)
  public void mineCountOverflowsCells() {
    combine(sys("# 1 #\n# # #\n# # #"), Integer.MAX_VALUE);
  }

  @Test(expected = NoSolutionException.class)
  public void noConfigurations() {
    combine(sys("# 1 #\n# 3 #\n. . ."), 3);
  }

  @Test public void outerCells() {
    ConstraintSystem system = sys("# # # #\n# 1 # #\n# # # #");
    ProbabilityResult result = combine(system, 2);
    assertThat(result.get(c(0, 0))).isWithin(1e-12).of(1.0 / 8);
    assertThat(result.get(c(2, 2))).isWithin(1e-12).of(1.0 / 8);
    assertThat(result.outerProbability).isWithin(1e-12).of(1.0 / 3);
    assertThat(result.get(c(3, 1))).isWithin(1e-12).of(1.0 / 3);
    assertThat(result.outerCellCount).isEqualTo(3);
    assertThat(result.probabilities).hasSize(11);
  }

  @Test public void noCellsLeft() {
    ConstraintSystem system = sys("1 #");
    ProbabilityResult result = combine(system, 1);
    assertThat(result.get(c(1, 0))).isEqualTo(1.0);
    assertThat(result.outerProbability).isNull();
  }

  @Test public void distributionsSumToOne() {
    ConstraintSystem system = sys(
        "# # # # # #\n"
        + "# 2 # 3 # #\n"
        + "# # # # 2 #\n"
        + "# 1 # # # #\n");
    ProbabilityResult result = combine(system, 6);
    for (GroupDistribution distribution : result.groups) {
      double sum = 0;
      double expected = 0;
      for (int j = 0; j < distribution.probabilities.size(); ++j) {
        sum += distribution.get(j);
        expected += j * distribution.get(j);
      }
      assertThat(sum).isWithin(1e-9).of(1.0);
      assertThat(distribution.expectedMines).isWithin(1e-9).of(expected);
      assertThat(distribution.cellProbability).isAtLeast(0.0);
      assertThat(distribution.cellProbability).isAtMost(1.0);
    }
  }

  @Test public void rangeCheck() {
    assertThat(ProbabilityCombiner.checkRange(0.25, "x")).isEqualTo(0.25);
    assertThat(ProbabilityCombiner.checkRange(1.00005, "x")).isEqualTo(1.0);
    assertThat(ProbabilityCombiner.checkRange(-0.00005, "x")).isEqualTo(0.0);
  }

  @Test(expected = InternalConsistencyException.class)
  public void outOfRange() {
    ProbabilityCombiner.checkRange(1.01, "x");
  }

  @Test(expected = InternalConsistencyException.class)
  public void notANumber() {
    ProbabilityCombiner.checkRange(Double.NaN, "x");
  }
}
