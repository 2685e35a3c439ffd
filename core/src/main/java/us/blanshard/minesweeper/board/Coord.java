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

import com.google.common.collect.ComparisonChain;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A cell position on a minesweeper board: x counts columns from the left, y
 * counts rows from the top, both from zero.  Coordinates order by x, then by
 * y.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Coord implements Comparable<Coord> {

  /** The column, counting from zero. */
  public final int x;

  /** The row, counting from zero. */
  public final int y;

  public static Coord of(int x, int y) {
    checkArgument(x >= 0 && y >= 0, "Negative coordinate (%s, %s)", x, y);
    if (x < CACHED && y < CACHED) return instances[x * CACHED + y];
    return new Coord(x, y);
  }

  @Override public int compareTo(@Nonnull Coord that) {
    return ComparisonChain.start()
        .compare(this.x, that.x)
        .compare(this.y, that.y)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Coord)) return false;
    Coord that = (Coord) o;
    return this.x == that.x && this.y == that.y;
  }

  @Override public int hashCode() {
    return x * 31 + y;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", x, y);
  }

  private Coord(int x, int y) {
    this.x = x;
    this.y = y;
  }

  // Boards up to 64x64 share instances.
  private static final int CACHED = 64;
  private static final Coord[] instances;
  static {
    instances = new Coord[CACHED * CACHED];
    for (int x = 0; x < CACHED; ++x)
      for (int y = 0; y < CACHED; ++y)
        instances[x * CACHED + y] = new Coord(x, y);
  }
}
