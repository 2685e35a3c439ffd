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

/**
 * Thrown when the configuration search exceeds its {@link SolverBudget}.  A
 * caller may retry with a larger budget.
 */
public class SolverTimeoutException extends SolverException {
  private static final long serialVersionUID = 1L;

  private final long configurationCount;
  private final long elapsedMillis;

  public SolverTimeoutException(String message, long configurationCount, long elapsedMillis) {
    super(String.format("%s (%,d configurations, %,d ms)",
                        message, configurationCount, elapsedMillis));
    this.configurationCount = configurationCount;
    this.elapsedMillis = elapsedMillis;
  }

  /** The number of configurations found before the search stopped. */
  public long getConfigurationCount() {
    return configurationCount;
  }

  /** How long the search ran before it stopped. */
  public long getElapsedMillis() {
    return elapsedMillis;
  }
}
