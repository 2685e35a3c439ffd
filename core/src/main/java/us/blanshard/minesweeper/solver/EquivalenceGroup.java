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

import us.blanshard.minesweeper.board.Coord;

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * A set of edge cells that border exactly the same number constraints.  The
 * cells of a group are interchangeable, so only the total number of mines in
 * the group matters to the constraints.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class EquivalenceGroup {
  public final int id;
  /** The group's cells, in coordinate order. */
  public final ImmutableList<Coord> coords;
  /** The ids of the constraints the cells border, ascending. */
  public final ImmutableList<Integer> constraintIds;
  /** The most mines the group can hold without breaking a constraint. */
  public final int maxMines;

  public EquivalenceGroup(int id, Iterable<Coord> coords, Iterable<Integer> constraintIds, int maxMines) {
    this.id = id;
    this.coords = ImmutableList.copyOf(coords);
    this.constraintIds = ImmutableList.copyOf(constraintIds);
    this.maxMines = maxMines;
    checkArgument(!this.coords.isEmpty(), "Empty group");
    checkArgument(maxMines >= 0, "Negative capacity %s", maxMines);
  }

  /** The number of cells in the group. */
  public int size() {
    return coords.size();
  }

  /** The cell that orders the group among its peers. */
  public Coord first() {
    return coords.get(0);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof EquivalenceGroup)) return false;
    EquivalenceGroup that = (EquivalenceGroup) o;
    return this.id == that.id
        && this.maxMines == that.maxMines
        && this.coords.equals(that.coords)
        && this.constraintIds.equals(that.constraintIds);
  }

  @Override public int hashCode() {
    return coords.hashCode();
  }

  @Override public String toString() {
    return "g" + id + coords + " <= " + maxMines;
  }
}
