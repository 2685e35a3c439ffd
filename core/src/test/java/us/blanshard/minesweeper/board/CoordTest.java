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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertSame;

import com.google.common.collect.Ordering;

import org.junit.Test;

import java.util.Arrays;

public class CoordTest {

  @Test public void sharedInstances() {
    assertSame(Coord.of(3, 5), Coord.of(3, 5));
    assertThat(Coord.of(100, 2)).isEqualTo(Coord.of(100, 2));
    assertThat(Coord.of(100, 2).hashCode()).isEqualTo(Coord.of(100, 2).hashCode());
  }

  @Test public void ordersByXThenY() {
    assertThat(Ordering.natural().sortedCopy(Arrays.asList(
        Coord.of(1, 0), Coord.of(0, 2), Coord.of(0, 1), Coord.of(70, 0))))
        .containsExactly(Coord.of(0, 1), Coord.of(0, 2), Coord.of(1, 0), Coord.of(70, 0))
        .inOrder();
  }

  @Test(expected = IllegalArgumentException.class)
  public void negative() {
    Coord.of(0, -1);
  }

  @Test public void string() {
    assertThat(Coord.of(2, 7).toString()).isEqualTo("(2, 7)");
  }
}
