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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * What one revealed number says about its unclicked neighbors: exactly
 * {@link #residual} more mines lie among them, once the mines already pinned
 * down by flags are subtracted.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class NumberConstraint {
  /** Position of this constraint in the extractor's output. */
  public final int id;
  /** Where the number is. */
  public final Coord coord;
  public final int residual;
  /** The unclicked neighbors, in coordinate order. */
  public final ImmutableList<Coord> unclickedNeighbors;

  public NumberConstraint(int id, Coord coord, int residual, Iterable<Coord> unclickedNeighbors) {
    checkArgument(id >= 0);
    checkArgument(residual >= 0, "Negative residual %s at %s", residual, coord);
    this.id = id;
    this.coord = coord;
    this.residual = residual;
    this.unclickedNeighbors = ImmutableList.copyOf(unclickedNeighbors);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof NumberConstraint)) return false;
    NumberConstraint that = (NumberConstraint) o;
    return this.id == that.id
        && this.coord.equals(that.coord)
        && this.residual == that.residual
        && this.unclickedNeighbors.equals(that.unclickedNeighbors);
  }

  @Override public int hashCode() {
    return Objects.hashCode(id, coord, residual, unclickedNeighbors);
  }

  @Override public String toString() {
    return "c" + id + coord + "=" + residual + unclickedNeighbors;
  }
}
