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

import us.blanshard.minesweeper.board.Coord;

import javax.annotation.Nullable;

/**
 * Thrown when the board cannot be a state of a real game: a revealed number
 * needs more mines than its unclicked neighbors can hold, or fewer than its
 * flagged neighbors already show.
 */
public class MalformedBoardException extends SolverException {
  private static final long serialVersionUID = 1L;

  @Nullable private final Coord coord;

  public MalformedBoardException(@Nullable Coord coord, String message) {
    super(coord == null ? message : message + " at " + coord);
    this.coord = coord;
  }

  /** The offending cell, if there is one. */
  @Nullable public Coord getCoord() {
    return coord;
  }
}
