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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;
import static us.blanshard.minesweeper.TestHelper.b;
import static us.blanshard.minesweeper.TestHelper.cfg;
import static us.blanshard.minesweeper.TestHelper.sys;

import com.google.common.base.Ticker;

import org.junit.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

public class ConfigurationEnumeratorTest {

  private static List<Configuration> all(ConstraintSystem system) {
    return new ConfigurationEnumerator(system, SolverBudget.UNLIMITED).toList();
  }

  @Test public void chain() {
    assertThat(all(sys("1 # #\n# # 1"))).containsExactly(cfg(0, 1, 0), cfg(1, 0, 1)).inOrder();
  }

  @Test public void unique() {
    assertThat(all(sys("# # # #\n1 2 2 1"))).containsExactly(cfg(0, 1, 1, 0));
  }

  @Test public void largerBoard() {
    ConstraintSystem system = sys(
        "# 2 # # #\n"
        + "# # # # #\n"
        + "# 3 # # #\n"
        + "# 2 # 4 #\n"
        + "# # # # #\n");
    assertThat(system.groups).hasSize(7);
    assertThat(all(system)).containsExactly(
        cfg(0, 2, 0, 0, 1, 1, 2),
        cfg(0, 2, 0, 1, 1, 0, 3),
        cfg(0, 2, 1, 0, 0, 1, 3),
        cfg(0, 2, 1, 1, 0, 0, 4),
        cfg(1, 1, 0, 0, 2, 0, 2),
        cfg(1, 1, 1, 0, 1, 0, 3),
        cfg(1, 1, 2, 0, 0, 0, 4)).inOrder();
  }

  @Test public void everyConfigurationSatisfiesEveryConstraint() {
    ConstraintSystem system = sys(
        "# # # # # #\n"
        + "# 2 # 3 # #\n"
        + "# # # # 2 #\n"
        + "# 1 # # # #\n");
    List<Configuration> configs = all(system);
    assertThat(configs).isNotEmpty();
    for (Configuration config : configs) {
      for (NumberConstraint constraint : system.constraints) {
        int sum = 0;
        for (int g : system.groupsByConstraint.get(constraint.id))
          sum += config.get(g);
        assertThat(sum).isEqualTo(constraint.residual);
      }
      for (EquivalenceGroup group : system.groups)
        assertThat(config.get(group.id)).isAtMost(group.maxMines);
    }
  }

  @Test public void contradiction() {
    // The 1 and the 3 see the same cells.
    assertThat(all(sys("# 1 #\n# 3 #\n. . ."))).isEmpty();
  }

  @Test public void noGroups() {
    assertThat(all(sys("# #\n# #"))).containsExactly(cfg());
  }

  @Test public void perCell() {
    ConstraintSystem system = sys(b("2 #"), 2);
    assertThat(all(system)).containsExactly(cfg(2));
  }

  @Test public void configurationBudget() {
    ConstraintSystem system = sys("1 # #\n# # 1");
    SolverBudget budget = SolverBudget.builder().setMaxConfigurations(1).build();
    ConfigurationEnumerator.Iter iter = new ConfigurationEnumerator(system, budget).iterator();
    assertThat(iter.next()).isEqualTo(cfg(0, 1, 0));
    try {
      iter.hasNext();
      fail();
    } catch (SolverTimeoutException e) {
      assertThat(e.getConfigurationCount()).isEqualTo(1);
    }
  }

  @Test public void timeBudget() {
    final long[] nanos = {0};
    Ticker ticker = new Ticker() {
      @Override public long read() {
        return nanos[0] += TimeUnit.MILLISECONDS.toNanos(30);
      }
    };
    SolverBudget budget = SolverBudget.builder().setTimeLimitMillis(100).setTicker(ticker).build();
    ConstraintSystem system = sys(
        "# 2 # # #\n"
        + "# # # # #\n"
        + "# 3 # # #\n"
        + "# 2 # 4 #\n"
        + "# # # # #\n");
    try {
      new ConfigurationEnumerator(system, budget).toList();
      fail();
    } catch (SolverTimeoutException e) {
      assertThat(e.getElapsedMillis()).isGreaterThan(100L);
    }
  }
}
