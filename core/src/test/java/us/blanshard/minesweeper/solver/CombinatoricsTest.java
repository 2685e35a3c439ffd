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

import com.google.common.math.BigIntegerMath;

import org.junit.Test;

import java.math.BigInteger;

public class CombinatoricsTest {

  private final Combinatorics comb = new Combinatorics();

  private long count(int cells, int mines, int perCell) {
    return comb.arrangementCount(cells, mines, perCell).longValueExact();
  }

  /** Counts by trying every way of dropping each mine into a cell. */
  private static long bruteForce(int cells, int mines, int perCell, boolean firstMustBeEmpty) {
    long answer = 0;
    int[] choice = new int[mines];
    long total = 1;
    for (int i = 0; i < mines; ++i) total *= cells;
    for (long n = 0; n < total; ++n) {
      long rest = n;
      int[] counts = new int[cells];
      boolean ok = true;
      for (int i = 0; i < mines; ++i) {
        choice[i] = (int) (rest % cells);
        rest /= cells;
        if (++counts[choice[i]] > perCell) ok = false;
      }
      if (ok && (!firstMustBeEmpty || counts[0] == 0)) ++answer;
    }
    return answer;
  }

  @Test public void knownCounts() {
    assertThat(count(2, 3, 2)).isEqualTo(6);
    assertThat(count(3, 4, 2)).isEqualTo(54);
    assertThat(count(3, 5, 3)).isEqualTo(210);
    assertThat(count(4, 5, 2)).isEqualTo(600);
    assertThat(count(10, 15, 2)).isEqualTo(31138995888000L);
  }

  @Test public void closedForms() {
    assertThat(count(5, 2, 1)).isEqualTo(20);
    assertThat(count(3, 2, 2)).isEqualTo(9);
    assertThat(count(5, 0, 1)).isEqualTo(1);
    assertThat(count(0, 0, 1)).isEqualTo(1);
    assertThat(count(1, 3, 3)).isEqualTo(1);
    assertThat(count(2, 3, 1)).isEqualTo(0);
    assertThat(count(1, 4, 3)).isEqualTo(0);
    assertThat(count(0, 1, 2)).isEqualTo(0);
  }

  @Test public void matchesBruteForce() {
    for (int cells = 1; cells <= 4; ++cells)
      for (int mines = 0; mines <= 6; ++mines)
        for (int perCell = 1; perCell <= 3; ++perCell)
          assertThat(count(cells, mines, perCell))
              .isEqualTo(bruteForce(cells, mines, perCell, false));
  }

  @Test public void logCounts() {
    for (int cells = 0; cells <= 12; ++cells)
      for (int mines = 0; mines <= 14; ++mines)
        for (int perCell = 1; perCell <= 4; ++perCell) {
          BigInteger count = comb.arrangementCount(cells, mines, perCell);
          double log = comb.logArrangementCount(cells, mines, perCell);
          if (count.signum() == 0) {
            assertThat(log).isNegativeInfinity();
          } else {
            assertThat(log).isWithin(1e-9 * Math.max(1, log)).of(Combinatorics.ln(count));
          }
        }
  }

  @Test public void hugeCounts() {
    double one = comb.logArrangementCount(200, 150, 1);
    double two = comb.logArrangementCount(200, 150, 2);
    double unbounded = 150 * Math.log(200);
    assertThat(one).isFinite();
    assertThat(two).isFinite();
    assertThat(one).isLessThan(two);
    assertThat(two).isLessThan(unbounded);
    assertThat(comb.logArrangementCount(1000, 600, 1)).isFinite();
  }

  @Test public void ln() {
    assertThat(Combinatorics.ln(BigInteger.ONE)).isEqualTo(0.0);
    assertThat(Combinatorics.ln(BigInteger.valueOf(1000))).isWithin(1e-12).of(Math.log(1000));
    assertThat(Combinatorics.ln(BigInteger.TEN.pow(500))).isWithin(1e-9).of(500 * Math.log(10));
    assertThat(Combinatorics.ln(BigIntegerMath.factorial(400)))
        .isWithin(1e-8).of(comb.logFactorial(400));
  }

  @Test public void logFactorial() {
    assertThat(comb.logFactorial(0)).isEqualTo(0.0);
    assertThat(comb.logFactorial(1)).isEqualTo(0.0);
    assertThat(comb.logFactorial(5)).isWithin(1e-12).of(Math.log(120));
    assertThat(comb.logFactorial(3)).isWithin(1e-12).of(Math.log(6));
  }

  @Test public void unsafeProbability() {
    assertThat(comb.unsafeProbability(2, 1, 1)).isWithin(1e-12).of(0.5);
    assertThat(comb.unsafeProbability(3, 2, 1)).isWithin(1e-12).of(2.0 / 3);
    assertThat(comb.unsafeProbability(10, 10, 1)).isEqualTo(1.0);
    assertThat(comb.unsafeProbability(5, 0, 2)).isEqualTo(0.0);
    assertThat(comb.unsafeProbability(2, 3, 2)).isEqualTo(1.0);
    assertThat(comb.unsafeProbability(4, 2, 2)).isWithin(1e-12).of(7.0 / 16);
    assertThat(comb.unsafeProbability(3, 4, 2)).isWithin(1e-12).of(8.0 / 9);
    assertThat(comb.unsafeProbability(10, 15, 2)).isWithin(1e-12).of(117.0 / 127);
  }

  @Test public void unsafeProbabilityMatchesBruteForce() {
    for (int cells = 1; cells <= 4; ++cells)
      for (int perCell = 1; perCell <= 3; ++perCell)
        for (int mines = 0; mines <= cells * perCell && mines <= 6; ++mines) {
          double expected = 1 - (double) bruteForce(cells, mines, perCell, true)
              / bruteForce(cells, mines, perCell, false);
          assertThat(comb.unsafeProbability(cells, mines, perCell)).isWithin(1e-12).of(expected);
        }
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooManyMines() {
    comb.unsafeProbability(2, 5, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void noCells() {
    comb.unsafeProbability(0, 0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeCells() {
    comb.arrangementCount(-1, 0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroPerCell() {
    comb.arrangementCount(3, 1, 0);
  }
}
