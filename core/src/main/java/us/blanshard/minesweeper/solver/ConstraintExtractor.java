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

import us.blanshard.minesweeper.board.Board;
import us.blanshard.minesweeper.board.CellContents;
import us.blanshard.minesweeper.board.Coord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * Reads the number constraints off a board.  Flags, revealed mines and hit
 * mines pin down mines; wrong flags are known to be safe.  With the
 * ignore-flags option, flags are read as if they were unclicked.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ConstraintExtractor {

  private final int perCell;
  private final boolean ignoreFlags;

  public ConstraintExtractor(int perCell, boolean ignoreFlags) {
    checkArgument(perCell >= 1, "Cells must hold at least one mine: %s", perCell);
    this.perCell = perCell;
    this.ignoreFlags = ignoreFlags;
  }

  /**
   * Tells whether the given contents leave the cell's mine count unknown, ie
   * whether the cell should get a probability.
   */
  public boolean isUnknown(CellContents contents) {
    return contents.isUnclicked() || (ignoreFlags && contents.type == CellContents.Type.FLAG);
  }

  /** Returns the board's unknown cells in coordinate order. */
  public ImmutableList<Coord> unknownCoords(Board board) {
    List<Coord> answer = Lists.newArrayList();
    for (Coord coord : board.allCoords())
      if (isUnknown(board.get(coord)))
        answer.add(coord);
    return Ordering.natural().immutableSortedCopy(answer);
  }

  /** Tells whether the board shows any numbers at all. */
  public static boolean hasNumbers(Board board) {
    for (Coord coord : board.allCoords())
      if (board.get(coord).type == CellContents.Type.NUM)
        return true;
    return false;
  }

  /**
   * Returns the informative constraints of the given board, ordered by
   * coordinate and numbered from zero.  Numbers with no unknown neighbors
   * are checked but left out.
   *
   * @throws MalformedBoardException if the board's numbers can't be right
   */
  public ImmutableList<NumberConstraint> extract(Board board) {
    List<Coord> coords = Ordering.natural().sortedCopy(board.allCoords());
    ImmutableList.Builder<NumberConstraint> builder = ImmutableList.builder();
    int nextId = 0;
    for (Coord coord : coords) {
      CellContents contents = board.get(coord);
      checkPinned(coord, contents);
      if (contents.type != CellContents.Type.NUM) continue;
      int number = ((CellContents.Num) contents).number;
      if (number == 0) continue;

      int residual = number;
      List<Coord> unknowns = Lists.newArrayList();
      for (Coord neighbor : board.neighbors(coord)) {
        CellContents n = board.get(neighbor);
        if (isUnknown(n)) unknowns.add(neighbor);
        else residual -= pinned(n);
      }
      if (residual < 0) {
        throw new MalformedBoardException(coord, String.format(
            "Number %d has %d too many mines around it", number, -residual));
      }
      if (residual > unknowns.size() * perCell) {
        throw new MalformedBoardException(coord, String.format(
            "Number %d needs %d more mines but only %d cells hold at most %d each",
            number, residual, unknowns.size(), perCell));
      }
      if (unknowns.isEmpty()) continue;
      builder.add(new NumberConstraint(
          nextId++, coord, residual, Ordering.natural().sortedCopy(unknowns)));
    }
    return builder.build();
  }

  /** How many mines the given known contents pin down. */
  private int pinned(CellContents contents) {
    switch (contents.type) {
      case FLAG:
      case MINE:
      case HIT_MINE:
        return ((CellContents.MineType) contents).count;
      default:
        return 0;
    }
  }

  private void checkPinned(Coord coord, CellContents contents) {
    if (isUnknown(contents)) return;
    int count = pinned(contents);
    if (count > perCell) {
      throw new MalformedBoardException(coord, String.format(
          "%s shows %d mines but cells hold at most %d", contents.type, count, perCell));
    }
  }
}
