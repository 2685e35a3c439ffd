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
package us.blanshard.minesweeper.board;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable rectangular minesweeper board in which every cell neighbors
 * the (up to) eight cells around it.  The nested Builder class is a mutable
 * version of the board.  It accepts any contents at any coordinate: it does
 * not enforce the rules of the game.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class GridBoard implements Board {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();
  private static final Splitter CELL_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final int xSize;
  private final int ySize;
  private final CellContents[] cells;  // Row by row.
  private final ImmutableList<Coord> allCoords;

  private GridBoard(int xSize, int ySize, CellContents[] cells) {
    this.xSize = xSize;
    this.ySize = ySize;
    this.cells = cells;
    ImmutableList.Builder<Coord> builder = ImmutableList.builder();
    for (int y = 0; y < ySize; ++y)
      for (int x = 0; x < xSize; ++x)
        builder.add(Coord.of(x, y));
    this.allCoords = builder.build();
  }

  /** Returns a builder for a board of the given size, all cells unclicked. */
  public static Builder builder(int xSize, int ySize) {
    checkArgument(xSize > 0 && ySize > 0, "Board must have cells: %sx%s", xSize, ySize);
    CellContents[] cells = new CellContents[xSize * ySize];
    Arrays.fill(cells, CellContents.UNCLICKED);
    return new Builder(new GridBoard(xSize, ySize, cells));
  }

  /** Returns a mutable version of this board. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  public int getXSize() {
    return xSize;
  }

  public int getYSize() {
    return ySize;
  }

  /** Tells whether the given coordinate lies on this board. */
  public boolean contains(Coord coord) {
    return coord.x < xSize && coord.y < ySize;
  }

  @Override public CellContents get(Coord coord) {
    return cells[index(coord)];
  }

  @Override public List<Coord> neighbors(Coord coord) {
    checkArgument(contains(coord), "%s is not on the board", coord);
    List<Coord> answer = Lists.newArrayListWithCapacity(8);
    for (int x = Math.max(0, coord.x - 1); x <= Math.min(xSize - 1, coord.x + 1); ++x)
      for (int y = Math.max(0, coord.y - 1); y <= Math.min(ySize - 1, coord.y + 1); ++y)
        if (x != coord.x || y != coord.y)
          answer.add(Coord.of(x, y));
    return answer;
  }

  @Override public List<Coord> allCoords() {
    return allCoords;
  }

  @NotThreadSafe
  public static final class Builder {
    private GridBoard board;
    private boolean built;

    private Builder(GridBoard board) {
      this.board = board;
      this.built = true;
    }

    private GridBoard board() {
      if (built) {
        board = new GridBoard(board.xSize, board.ySize, board.cells.clone());
        built = false;
      }
      return board;
    }

    /** Returns an immutable snapshot of this board. */
    public GridBoard build() {
      built = true;
      return board;
    }

    public CellContents get(Coord coord) {
      return board.get(coord);
    }

    /** Sets the contents at the given coordinate. */
    public Builder put(Coord coord, CellContents contents) {
      board().cells[board.index(coord)] = checkNotNull(contents);
      return this;
    }

    /** Sets the contents at the given x and y. */
    public Builder put(int x, int y, CellContents contents) {
      return put(Coord.of(x, y), contents);
    }

    /** Resets every cell to unclicked. */
    public Builder reset() {
      Arrays.fill(board().cells, CellContents.UNCLICKED);
      return this;
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof GridBoard)) return false;
    GridBoard that = (GridBoard) o;
    return this.xSize == that.xSize && Arrays.equals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return xSize * 31 + Arrays.hashCode(cells);
  }

  /**
   * Renders the board one row per line, cells separated by spaces, with
   * zeros shown as dots.  Can be reversed by {@link #fromString}.
   */
  @Override public String toString() {
    int width = 1;
    for (CellContents contents : cells)
      width = Math.max(width, contents.toString().length());
    StringBuilder sb = new StringBuilder();
    for (int y = 0; y < ySize; ++y) {
      for (int x = 0; x < xSize; ++x) {
        if (x > 0) sb.append(' ');
        CellContents contents = cells[y * xSize + x];
        String s = contents.equals(CellContents.num(0)) ? "." : contents.toString();
        sb.append(Strings.padEnd(s, width, ' '));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /**
   * Parses a board: one row per line, cells separated by whitespace, each
   * cell in the form read by {@link CellContents#fromString}.  Blank lines
   * are ignored; every row must have the same length.
   */
  public static GridBoard fromString(String s) {
    List<List<CellContents>> rows = Lists.newArrayList();
    for (String line : LINE_SPLITTER.split(s)) {
      List<CellContents> row = Lists.newArrayList();
      for (String cell : CELL_SPLITTER.split(line))
        row.add(CellContents.fromString(cell));
      rows.add(row);
    }
    return fromRows(rows);
  }

  /** Makes a board from a list of rows, top to bottom. */
  public static GridBoard fromRows(List<? extends List<? extends CellContents>> rows) {
    checkArgument(!rows.isEmpty(), "Board has no rows");
    int xSize = rows.get(0).size();
    Builder builder = builder(xSize, rows.size());
    for (int y = 0; y < rows.size(); ++y) {
      List<? extends CellContents> row = rows.get(y);
      checkArgument(row.size() == xSize,
          "Row %s has %s cells, expected %s", y, row.size(), xSize);
      for (int x = 0; x < xSize; ++x)
        builder.put(x, y, row.get(x));
    }
    return builder.build();
  }

  private int index(Coord coord) {
    checkArgument(contains(coord), "%s is not on the board", coord);
    return coord.y * xSize + coord.x;
  }
}
