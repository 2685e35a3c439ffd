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

import java.util.List;

/**
 * A read-only snapshot of a minesweeper board as the player sees it.  The
 * probability engine consumes boards through this interface and never
 * changes them.
 *
 * @author Luke Blanshard
 */
public interface Board {

  /** Returns what the player sees at the given coordinate. */
  CellContents get(Coord coord);

  /**
   * Returns the coordinates adjacent to the given one under the board's
   * adjacency rule, not including the coordinate itself.
   */
  List<Coord> neighbors(Coord coord);

  /** Returns every coordinate on the board, in a fixed order. */
  List<Coord> allCoords();
}
