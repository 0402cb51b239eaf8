// This file is part of PerfSignal.
// Copyright (C) 2021  The PerfSignal Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.perfsignal.changepoints;

import com.google.common.base.MoreObjects;

import net.perfsignal.data.ChangePointCategory;
import net.perfsignal.data.ChangePointStatistics;

/**
 * The log ratio of the means after and before a change point along with
 * its category. Both means positive means higher is better (throughput)
 * and the ratio is {@code next / previous}. Otherwise lower is better
 * (latency) and the ratio is inverted.
 * <p>
 * Each threshold test classifies a value equal to the threshold into the
 * lower band.
 *
 * @since 1.0
 */
public final class Magnitude {

  public static final double MAJOR_REGRESSION = 
      Math.log(1 / Math.pow(Math.E, .5));
  public static final double MODERATE_REGRESSION = 
      Math.log(1 / Math.pow(Math.E, .2));
  public static final double MINOR_REGRESSION = 0;
  public static final double MAJOR_IMPROVEMENT = 
      Math.log(Math.pow(Math.E, .5));
  public static final double MODERATE_IMPROVEMENT = 
      Math.log(Math.pow(Math.E, .2));

  /** Returned when there are no statistics to work with. */
  public static final Magnitude UNCATEGORIZED = 
      new Magnitude(null, ChangePointCategory.UNCATEGORIZED);

  private final Double magnitude;
  private final ChangePointCategory category;

  private Magnitude(final Double magnitude, 
                    final ChangePointCategory category) {
    this.magnitude = magnitude;
    this.category = category;
  }

  /** @return The magnitude or null if uncategorized. */
  public Double magnitude() {
    return magnitude;
  }

  public ChangePointCategory category() {
    return category;
  }

  /**
   * @param statistics The statistics of a change point, may be null.
   * @return The magnitude, {@link #UNCATEGORIZED} if either side is missing.
   */
  public static Magnitude calculate(final ChangePointStatistics statistics) {
    if (statistics == null || statistics.previous() == null 
        || statistics.next() == null) {
      return UNCATEGORIZED;
    }
    return calculate(statistics.previous().mean(), statistics.next().mean());
  }

  /**
   * @param previous_mean The mean before the change point.
   * @param next_mean The mean after the change point.
   * @return The magnitude and category.
   */
  public static Magnitude calculate(final double previous_mean,
                                    final double next_mean) {
    final double magnitude;
    if (previous_mean == 0 && next_mean == 0) {
      magnitude = 0;
    } else if (previous_mean == 0) {
      magnitude = Double.POSITIVE_INFINITY;
    } else if (next_mean == 0) {
      magnitude = Double.NEGATIVE_INFINITY;
    } else if (next_mean >= 0 && previous_mean >= 0) {
      magnitude = Math.log(next_mean / previous_mean);
    } else {
      magnitude = Math.log(previous_mean / next_mean);
    }
    return new Magnitude(magnitude, categorize(magnitude));
  }

  /**
   * @param magnitude The magnitude.
   * @return The band the magnitude falls into.
   */
  public static ChangePointCategory categorize(final double magnitude) {
    if (magnitude < MAJOR_REGRESSION) {
      return ChangePointCategory.MAJOR_REGRESSION;
    } else if (magnitude < MODERATE_REGRESSION) {
      return ChangePointCategory.MODERATE_REGRESSION;
    } else if (magnitude < MINOR_REGRESSION) {
      return ChangePointCategory.MINOR_REGRESSION;
    } else if (magnitude > MAJOR_IMPROVEMENT) {
      return ChangePointCategory.MAJOR_IMPROVEMENT;
    } else if (magnitude > MODERATE_IMPROVEMENT) {
      return ChangePointCategory.MODERATE_IMPROVEMENT;
    }
    return ChangePointCategory.MINOR_IMPROVEMENT;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("magnitude", magnitude)
        .add("category", category)
        .toString();
  }
}
