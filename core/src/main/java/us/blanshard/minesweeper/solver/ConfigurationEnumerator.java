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

import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A depth-first, worklist-based enumerator of the configurations of a
 * constraint system.  This is an Iterable: its iterator lazily returns every
 * valid configuration, in ascending lexicographic order, spending the given
 * budget as it goes.
 *
 * <p> Each group's mine count is bounded below by what its constraints still
 * need beyond the capacity of their later groups, and above by what its
 * constraints still allow, so most dead ends are never entered.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ConfigurationEnumerator implements Iterable<Configuration> {

  private final ConstraintSystem system;
  private final SolverBudget budget;
  private final int[] residuals;
  /**
   * For each group index i and constraint c, the total capacity of c's groups
   * numbered i or later.
   */
  private final int[][] capacityFrom;

  public ConfigurationEnumerator(ConstraintSystem system, SolverBudget budget) {
    this.system = system;
    this.budget = budget;
    int numGroups = system.groups.size();
    int numConstraints = system.constraints.size();
    this.residuals = new int[numConstraints];
    for (NumberConstraint constraint : system.constraints)
      residuals[constraint.id] = constraint.residual;
    this.capacityFrom = new int[numGroups + 1][numConstraints];
    for (int i = numGroups - 1; i >= 0; --i) {
      capacityFrom[i] = capacityFrom[i + 1].clone();
      EquivalenceGroup group = system.groups.get(i);
      for (int c : group.constraintIds)
        capacityFrom[i][c] += group.maxMines;
    }
  }

  @Override public Iter iterator() {
    return new Iter(budget.start());
  }

  /**
   * Iterates through the configurations, throwing {@link
   * SolverTimeoutException} from {@link #hasNext} once the budget runs out.
   */
  public final class Iter implements Iterator<Configuration> {
    private final SolverBudget.Tracker tracker;
    private final ArrayDeque<WorkItem> worklist = new ArrayDeque<WorkItem>();
    private boolean nextComputed;
    @Nullable private Configuration next;
    private long stepCount;

    private Iter(SolverBudget.Tracker tracker) {
      this.tracker = tracker;
      worklist.add(new WorkItem(new int[system.groups.size()], new int[residuals.length], 0));
    }

    /** Returns the number of search nodes expanded so far. */
    public long getStepCount() {
      return stepCount;
    }

    public long getConfigurationCount() {
      return tracker.getConfigurationCount();
    }

    public long getElapsedMillis() {
      return tracker.getElapsedMillis();
    }

    @Override public boolean hasNext() {
      if (!nextComputed) {
        next = computeNext();
        nextComputed = true;
      }
      return next != null;
    }

    @Override public Configuration next() {
      if (!hasNext()) throw new NoSuchElementException();
      nextComputed = false;
      return next;
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }

    @Nullable private Configuration computeNext() {
      while (!worklist.isEmpty()) {
        WorkItem item = worklist.removeFirst();
        if (item.groupIndex == item.counts.length) {
          if (satisfied(item.sums)) {
            tracker.countConfiguration();
            return Configuration.of(item.counts);
          }
          continue;
        }
        ++stepCount;
        tracker.checkTime();
        pushBranches(item);
      }
      return null;
    }

    private boolean satisfied(int[] sums) {
      for (int c = 0; c < sums.length; ++c)
        if (sums[c] != residuals[c])
          return false;
      return true;
    }

    /**
     * Pushes one item for each feasible mine count of the item's group, so
     * the smallest count comes off the worklist first.
     */
    private void pushBranches(WorkItem item) {
      int i = item.groupIndex;
      EquivalenceGroup group = system.groups.get(i);
      int lower = 0;
      int upper = group.maxMines;
      for (int c : group.constraintIds) {
        int needed = residuals[c] - item.sums[c];
        lower = Math.max(lower, needed - capacityFrom[i + 1][c]);
        upper = Math.min(upper, needed);
      }
      for (int j = upper; j >= lower; --j) {
        int[] counts = item.counts.clone();
        int[] sums = item.sums.clone();
        counts[i] = j;
        for (int c : group.constraintIds)
          sums[c] += j;
        worklist.addFirst(new WorkItem(counts, sums, i + 1));
      }
    }
  }

  /** A partial configuration: counts for the groups before groupIndex. */
  private static final class WorkItem {
    final int[] counts;
    final int[] sums;  // Running total for each constraint.
    final int groupIndex;

    WorkItem(int[] counts, int[] sums, int groupIndex) {
      this.counts = counts;
      this.sums = sums;
      this.groupIndex = groupIndex;
    }
  }

  /** Returns all the configurations at once. */
  public ImmutableList<Configuration> toList() {
    return ImmutableList.copyOf(this);
  }
}
