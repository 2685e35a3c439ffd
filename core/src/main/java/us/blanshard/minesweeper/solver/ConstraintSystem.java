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
 * The constraints of one board together with the equivalence groups of the
 * cells they cover, and the unknown cells no constraint touches.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ConstraintSystem {
  public final int perCell;
  public final ImmutableList<NumberConstraint> constraints;
  public final ImmutableList<EquivalenceGroup> groups;
  /** For each constraint, the ids of the groups it covers, ascending. */
  public final ImmutableList<ImmutableList<Integer>> groupsByConstraint;
  /** The unknown cells bordering no constraint, in coordinate order. */
  public final ImmutableList<Coord> outerCoords;

  public ConstraintSystem(
      int perCell,
      ImmutableList<NumberConstraint> constraints,
      ImmutableList<EquivalenceGroup> groups,
      ImmutableList<ImmutableList<Integer>> groupsByConstraint,
      ImmutableList<Coord> outerCoords) {
    checkArgument(groupsByConstraint.size() == constraints.size());
    this.perCell = perCell;
    this.constraints = constraints;
    this.groups = groups;
    this.groupsByConstraint = groupsByConstraint;
    this.outerCoords = outerCoords;
  }

  /** The number of cells bordering at least one constraint. */
  public int edgeCellCount() {
    int count = 0;
    for (EquivalenceGroup group : groups)
      count += group.size();
    return count;
  }

  /** The number of unknown cells, edge and outer together. */
  public int unknownCellCount() {
    return edgeCellCount() + outerCoords.size();
  }
}
