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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Partitions the cells under a board's constraints into equivalence groups.
 *
 * @author Luke Blanshard
 */
public final class Grouper {

  /**
   * Groups the cells of the given constraints.  Groups are numbered in the
   * order of their smallest cells.  The unknown cells that no constraint
   * covers become the system's outer cells.
   */
  public static ConstraintSystem group(
      List<NumberConstraint> constraints, List<Coord> unknownCoords, int perCell) {
    for (int i = 0; i < constraints.size(); ++i)
      checkArgument(constraints.get(i).id == i, "Constraint %s out of place", constraints.get(i));

    // Cell to the constraints it borders.  Constraints are visited in id
    // order, so each set fills in ascending order.
    Map<Coord, SortedSet<Integer>> constraintsByCell = Maps.newTreeMap();
    for (NumberConstraint constraint : constraints) {
      for (Coord coord : constraint.unclickedNeighbors) {
        SortedSet<Integer> ids = constraintsByCell.get(coord);
        if (ids == null) constraintsByCell.put(coord, ids = Sets.newTreeSet());
        ids.add(constraint.id);
      }
    }

    // Cells come out of the tree map in order, so each bucket is first seen
    // at its smallest cell.
    Map<ImmutableSortedSet<Integer>, List<Coord>> buckets = Maps.newLinkedHashMap();
    for (Map.Entry<Coord, SortedSet<Integer>> entry : constraintsByCell.entrySet()) {
      ImmutableSortedSet<Integer> key = ImmutableSortedSet.copyOfSorted(entry.getValue());
      List<Coord> cells = buckets.get(key);
      if (cells == null) buckets.put(key, cells = Lists.newArrayList());
      cells.add(entry.getKey());
    }

    ImmutableList.Builder<EquivalenceGroup> groups = ImmutableList.builder();
    ListMultimap<Integer, Integer> groupIdsByConstraint = ArrayListMultimap.create();
    int id = 0;
    for (Map.Entry<ImmutableSortedSet<Integer>, List<Coord>> entry : buckets.entrySet()) {
      int maxMines = entry.getValue().size() * perCell;
      for (int c : entry.getKey()) {
        maxMines = Math.min(maxMines, constraints.get(c).residual);
        groupIdsByConstraint.put(c, id);
      }
      groups.add(new EquivalenceGroup(id++, entry.getValue(), entry.getKey(), maxMines));
    }

    ImmutableList.Builder<ImmutableList<Integer>> groupsByConstraint = ImmutableList.builder();
    for (NumberConstraint constraint : constraints)
      groupsByConstraint.add(ImmutableList.copyOf(groupIdsByConstraint.get(constraint.id)));

    ImmutableList.Builder<Coord> outer = ImmutableList.builder();
    for (Coord coord : unknownCoords)
      if (!constraintsByCell.containsKey(coord))
        outer.add(coord);

    return new ConstraintSystem(
        perCell, ImmutableList.copyOf(constraints), groups.build(), groupsByConstraint.build(),
        outer.build());
  }

  private Grouper() {}
}
