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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.WARNING;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.primitives.Longs;

import java.util.logging.Logger;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Limits on how much work one probability calculation may do: how many
 * configurations it may find, and how long it may run.  Time is read from a
 * {@link Ticker}, so tests can control it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class SolverBudget {

  private static final Logger logger = Logger.getLogger(SolverBudget.class.getName());

  public static final String MAX_CONFIGURATIONS_PROPERTY = "minesweeper.solver.maxConfigurations";
  public static final String TIME_LIMIT_PROPERTY = "minesweeper.solver.timeLimitMillis";

  public static final long DEFAULT_MAX_CONFIGURATIONS = 1000000;
  public static final long DEFAULT_TIME_LIMIT_MILLIS = 10000;

  /** A million configurations in ten seconds. */
  public static final SolverBudget DEFAULT = builder().build();

  /** No limits at all. */
  public static final SolverBudget UNLIMITED = builder()
      .setMaxConfigurations(Long.MAX_VALUE)
      .setTimeLimitMillis(Long.MAX_VALUE)
      .build();

  public final long maxConfigurations;
  public final long timeLimitMillis;
  private final Ticker ticker;

  private SolverBudget(Builder builder) {
    this.maxConfigurations = builder.maxConfigurations;
    this.timeLimitMillis = builder.timeLimitMillis;
    this.ticker = builder.ticker;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setMaxConfigurations(maxConfigurations)
        .setTimeLimitMillis(timeLimitMillis)
        .setTicker(ticker);
  }

  /**
   * Returns the default budget, overridden by the system properties {@value
   * #MAX_CONFIGURATIONS_PROPERTY} and {@value #TIME_LIMIT_PROPERTY} where
   * they hold positive numbers.
   */
  public static SolverBudget fromSystemProperties() {
    return builder()
        .setMaxConfigurations(longProperty(MAX_CONFIGURATIONS_PROPERTY, DEFAULT_MAX_CONFIGURATIONS))
        .setTimeLimitMillis(longProperty(TIME_LIMIT_PROPERTY, DEFAULT_TIME_LIMIT_MILLIS))
        .build();
  }

  private static long longProperty(String name, long defaultValue) {
    String value = System.getProperty(name);
    if (Strings.isNullOrEmpty(value)) return defaultValue;
    Long parsed = Longs.tryParse(value.trim());
    if (parsed == null || parsed <= 0) {
      logger.log(WARNING, "Ignoring bad value for {0}: {1}", new Object[] {name, value});
      return defaultValue;
    }
    return parsed;
  }

  /** Starts spending this budget. */
  public Tracker start() {
    return new Tracker();
  }

  @Override public String toString() {
    return String.format("%,d configurations in %,d ms", maxConfigurations, timeLimitMillis);
  }

  /**
   * Keeps track of the work done against a budget, and stops the work by
   * throwing {@link SolverTimeoutException} when the budget runs out.
   */
  @NotThreadSafe
  public final class Tracker {
    private final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    private long configurationCount;

    /** Checks the clock; called at every branch of the search. */
    public void checkTime() {
      long elapsed = getElapsedMillis();
      if (elapsed > timeLimitMillis)
        throw new SolverTimeoutException(
            "Time limit of " + timeLimitMillis + " ms exceeded", configurationCount, elapsed);
    }

    /** Records one more configuration found. */
    public void countConfiguration() {
      if (++configurationCount > maxConfigurations)
        throw new SolverTimeoutException(
            "More than " + maxConfigurations + " configurations",
            configurationCount - 1, getElapsedMillis());
    }

    public long getConfigurationCount() {
      return configurationCount;
    }

    public long getElapsedMillis() {
      return stopwatch.elapsed(MILLISECONDS);
    }
  }

  @NotThreadSafe
  public static final class Builder {
    private long maxConfigurations = DEFAULT_MAX_CONFIGURATIONS;
    private long timeLimitMillis = DEFAULT_TIME_LIMIT_MILLIS;
    private Ticker ticker = Ticker.systemTicker();

    private Builder() {}

    public Builder setMaxConfigurations(long maxConfigurations) {
      checkArgument(maxConfigurations > 0, "Budget must allow some configurations");
      this.maxConfigurations = maxConfigurations;
      return this;
    }

    public Builder setTimeLimitMillis(long timeLimitMillis) {
      checkArgument(timeLimitMillis > 0, "Budget must allow some time");
      this.timeLimitMillis = timeLimitMillis;
      return this;
    }

    public Builder setTicker(Ticker ticker) {
      this.ticker = checkNotNull(ticker);
      return this;
    }

    public SolverBudget build() {
      return new SolverBudget(this);
    }
  }
}
