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

import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One way to satisfy a constraint system: how many mines each equivalence
 * group holds, in group order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Configuration {

  private final int[] counts;
  private final int totalMines;

  public static Configuration of(int... counts) {
    return new Configuration(counts.clone());
  }

  private Configuration(int[] counts) {
    int total = 0;
    for (int count : counts) {
      checkArgument(count >= 0, "Negative mine count in %s", Arrays.toString(counts));
      total += count;
    }
    this.counts = counts;
    this.totalMines = total;
  }

  /** The number of mines in the given group. */
  public int get(int groupId) {
    return counts[groupId];
  }

  /** The number of groups. */
  public int size() {
    return counts.length;
  }

  /** The number of mines in all the groups together. */
  public int getTotalMines() {
    return totalMines;
  }

  public List<Integer> asList() {
    return Ints.asList(counts.clone());
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Configuration)) return false;
    return Arrays.equals(this.counts, ((Configuration) o).counts);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(counts);
  }

  @Override public String toString() {
    return Arrays.toString(counts);
  }
}
