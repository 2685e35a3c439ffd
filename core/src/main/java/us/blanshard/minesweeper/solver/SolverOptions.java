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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Settings for a probability engine.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class SolverOptions {

  public static final SolverOptions DEFAULT = builder().build();

  public final SolverBudget budget;
  /** Whether to treat flags as unclicked cells rather than known mines. */
  public final boolean ignoreFlags;

  private SolverOptions(SolverBudget budget, boolean ignoreFlags) {
    this.budget = budget;
    this.ignoreFlags = ignoreFlags;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().setBudget(budget).setIgnoreFlags(ignoreFlags);
  }

  @Override public String toString() {
    return "budget " + budget + (ignoreFlags ? ", ignoring flags" : "");
  }

  @NotThreadSafe
  public static final class Builder {
    private SolverBudget budget = SolverBudget.DEFAULT;
    private boolean ignoreFlags;

    private Builder() {}

    public Builder setBudget(SolverBudget budget) {
      this.budget = checkNotNull(budget);
      return this;
    }

    public Builder setIgnoreFlags(boolean ignoreFlags) {
      this.ignoreFlags = ignoreFlags;
      return this;
    }

    public SolverOptions build() {
      return new SolverOptions(budget, ignoreFlags);
    }
  }
}
