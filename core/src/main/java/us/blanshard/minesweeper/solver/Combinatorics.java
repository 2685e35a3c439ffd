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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.math.BigIntegerMath;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Counts the ways to arrange mines in cells, and derives single-cell
 * probabilities from those counts.  Mines are treated as distinguishable
 * throughout, so that counts for separate groups of cells multiply together
 * consistently.
 *
 * <p> Instances remember the expensive counts they have computed; the tables
 * belong to the instance, so share one only within a single thread.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Combinatorics {

  private static final double LN_2 = Math.log(2);

  /** Counts with a per-cell cap that actually bites, keyed by the cap. */
  private final Map<Integer, BoundedTable> boundedTables = Maps.newHashMap();

  /** Natural logs of factorials, grown on demand. */
  private double[] logFactorials = {0.0};
  private int logFactorialsSize = 1;

  /**
   * Returns the number of ways to put the given number of distinguishable
   * mines into the given number of distinguishable cells, with no cell holding
   * more than {@code perCell} mines.
   */
  public BigInteger arrangementCount(int cells, int mines, int perCell) {
    checkCounts(cells, mines, perCell);
    if (mines > (long) cells * perCell) return BigInteger.ZERO;
    if (mines == 0 || cells == 1) return BigInteger.ONE;
    if (perCell == 1) return fallingFactorial(cells, mines);
    if (perCell >= mines) return BigInteger.valueOf(cells).pow(mines);
    return boundedTable(perCell).get(cells, mines);
  }

  /**
   * Returns the natural log of {@link #arrangementCount}, or negative infinity
   * when there are no arrangements.  Avoids big integers except when the
   * per-cell cap bites.
   */
  public double logArrangementCount(int cells, int mines, int perCell) {
    checkCounts(cells, mines, perCell);
    if (mines > (long) cells * perCell) return Double.NEGATIVE_INFINITY;
    if (mines == 0 || cells == 1) return 0;
    if (perCell == 1) return logFactorial(cells) - logFactorial(cells - mines);
    if (perCell >= mines) return mines * Math.log(cells);
    return ln(boundedTable(perCell).get(cells, mines));
  }

  /**
   * Returns the probability that one particular cell holds at least one mine,
   * when the given number of mines are arranged at random among the given
   * cells.
   *
   * @throws IllegalArgumentException if the mines don't fit in the cells
   */
  public double unsafeProbability(int cells, int mines, int perCell) {
    checkCounts(cells, mines, perCell);
    checkArgument(cells > 0, "No cells to hold %s mines", mines);
    if (mines > (long) cells * perCell) {
      throw new IllegalArgumentException(String.format(
          "Too many mines for the space in the cells: %d mines, %d cells, %d per cell",
          mines, cells, perCell));
    }
    if (mines > (long) perCell * (cells - 1)) return 1;  // The cell can't be empty.
    if (perCell == 1) return (double) mines / cells;
    if (perCell >= mines) return 1 - Math.pow(1 - 1.0 / cells, mines);
    // One minus the chance the cell is empty, ie all the mines are in the
    // other cells.  Divided in the log domain, the counts get huge.
    return 1 - Math.exp(logArrangementCount(cells - 1, mines, perCell)
                        - logArrangementCount(cells, mines, perCell));
  }

  /** Returns the natural log of n factorial. */
  public double logFactorial(int n) {
    checkArgument(n >= 0, "Negative factorial: %s", n);
    if (n >= logFactorialsSize) {
      if (n >= logFactorials.length)
        logFactorials = Arrays.copyOf(logFactorials, Math.max(n + 1, 2 * logFactorials.length));
      for (int i = logFactorialsSize; i <= n; ++i)
        logFactorials[i] = logFactorials[i - 1] + Math.log(i);
      logFactorialsSize = n + 1;
    }
    return logFactorials[n];
  }

  /**
   * Returns the natural log of the given positive integer, which may be far
   * larger than a double can hold.
   */
  public static double ln(BigInteger value) {
    checkArgument(value.signum() > 0, "Log of non-positive number %s", value);
    int excess = value.bitLength() - 1022;
    if (excess > 0) {
      value = value.shiftRight(excess);
    } else {
      excess = 0;
    }
    return Math.log(value.doubleValue()) + excess * LN_2;
  }

  private static void checkCounts(int cells, int mines, int perCell) {
    checkArgument(cells >= 0, "Negative cell count: %s", cells);
    checkArgument(mines >= 0, "Negative mine count: %s", mines);
    checkArgument(perCell >= 1, "Cells must hold at least one mine: %s", perCell);
  }

  private static BigInteger fallingFactorial(int n, int k) {
    BigInteger answer = BigInteger.ONE;
    for (int i = n - k + 1; i <= n; ++i)
      answer = answer.multiply(BigInteger.valueOf(i));
    return answer;
  }

  private BoundedTable boundedTable(int perCell) {
    BoundedTable table = boundedTables.get(perCell);
    if (table == null) {
      table = new BoundedTable(perCell);
      boundedTables.put(perCell, table);
    }
    return table;
  }

  /**
   * Arrangement counts for one per-cell cap, built cell by cell: with c cells
   * and m mines, the last cell takes j of the mines (chosen C(m, j) ways) and
   * the other c-1 cells take the rest.  This sums the same terms as
   * enumerating every bounded partition of the mines, without ever listing
   * the partitions.
   */
  private static final class BoundedTable {
    private final int perCell;
    private final List<BigInteger[]> rows = Lists.newArrayList();  // Indexed by cell count.
    private BigInteger[][] binomials;  // [m][j] for j up to perCell.
    private int maxMines = -1;

    BoundedTable(int perCell) {
      this.perCell = perCell;
    }

    BigInteger get(int cells, int mines) {
      if (mines > maxMines) reset(Math.max(mines, 2 * maxMines));
      while (rows.size() <= cells)
        rows.add(nextRow(rows.get(rows.size() - 1)));
      return rows.get(cells)[mines];
    }

    private void reset(int maxMines) {
      this.maxMines = maxMines;
      binomials = new BigInteger[maxMines + 1][];
      for (int m = 0; m <= maxMines; ++m) {
        binomials[m] = new BigInteger[Math.min(perCell, m) + 1];
        for (int j = 0; j < binomials[m].length; ++j)
          binomials[m][j] = BigIntegerMath.binomial(m, j);
      }
      BigInteger[] noCells = new BigInteger[maxMines + 1];
      Arrays.fill(noCells, BigInteger.ZERO);
      noCells[0] = BigInteger.ONE;
      rows.clear();
      rows.add(noCells);
    }

    private BigInteger[] nextRow(BigInteger[] prev) {
      BigInteger[] row = new BigInteger[maxMines + 1];
      for (int m = 0; m <= maxMines; ++m) {
        BigInteger sum = BigInteger.ZERO;
        for (int j = 0; j < binomials[m].length; ++j) {
          if (prev[m - j].signum() != 0)
            sum = sum.add(binomials[m][j].multiply(prev[m - j]));
        }
        row[m] = sum;
      }
      return row;
    }
  }
}
