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
package net.perfsignal.changepoints.range;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import net.perfsignal.data.ChangePointStatistics;
import net.perfsignal.data.SegmentStatistics;
import net.perfsignal.exceptions.NumericComputationException;

/**
 * Refines the indices accepted by the search into boundaries between two
 * adjacent points and links them into a chain that partitions the series.
 * <p>
 * For each index the mean of the points behind and ahead of it are compared
 * to the value at the index. The side with the larger deviation holds the
 * jump. Within {@code bounds} points on that side the point furthest from
 * the opposite mean, weighted by {@link ExponentialWeights}, becomes the
 * start of the boundary.
 *
 * @since 1.0
 */
public class RangeFinder {
  private static final Logger LOG = LoggerFactory.getLogger(RangeFinder.class);

  /** The default number of points considered on the chosen side. */
  public static final int DEFAULT_BOUNDS = 1;

  private final double weighting;
  private final int bounds;

  /** Ctor with the default weighting and bounds. */
  public RangeFinder() {
    this(ExponentialWeights.DEFAULT_WEIGHTING, DEFAULT_BOUNDS);
  }

  /**
   * Default ctor.
   * @param weighting The decay weighting between 0 and 1 exclusive.
   * @param bounds The number of points to consider, at least 1.
   */
  public RangeFinder(final double weighting, final int bounds) {
    Preconditions.checkArgument(weighting > 0 && weighting < 1,
        "Weighting must be between 0 and 1: %s", weighting);
    Preconditions.checkArgument(bounds > 0,
        "Bounds must be greater than 0: %s", bounds);
    this.weighting = weighting;
    this.bounds = bounds;
  }

  public double weighting() {
    return weighting;
  }

  public int bounds() {
    return bounds;
  }

  /**
   * Computes and links the ranges for the accepted indices.
   * @param sorted_indices The accepted indices, ascending.
   * @param series The compacted series the indices refer to.
   * @return The linked ranges in the same order as the indices.
   */
  public List<ChangePointRange> findRanges(final int[] sorted_indices,
                                           final double[] series) {
    final List<Boundary> boundaries = Lists.newArrayListWithCapacity(
        sorted_indices.length);
    int prev_index = 0;
    for (int i = 0; i < sorted_indices.length; i++) {
      final int next_index = i + 1 < sorted_indices.length 
          ? sorted_indices[i + 1] : series.length;
      final Boundary boundary = selectStartEnd(series, prev_index, 
          sorted_indices[i], next_index);
      boundaries.add(boundary);
      prev_index = boundary.end();
    }
    return link(boundaries, series);
  }

  /**
   * Localizes the boundary for a single index.
   * @param series The compacted series.
   * @param prev_index The end of the previous boundary or 0.
   * @param index The accepted index.
   * @param next_index The next accepted index or the series length.
   * @return The boundary.
   * @throws NumericComputationException if the averages or the weighted
   * deviations overflowed.
   */
  public Boundary selectStartEnd(final double[] series,
                                 final int prev_index,
                                 final int index,
                                 final int next_index) {
    if (next_index == prev_index) {
      LOG.debug("Next and previous index are both {}", next_index);
      return new Boundary(index, next_index, next_index, Location.AHEAD);
    }

    final double value = series[index];
    double behind_average = mean(series, prev_index, index - 1);
    double ahead_average = mean(series, index + 1, next_index);
    if (Double.isInfinite(behind_average) || Double.isInfinite(ahead_average)) {
      throw new NumericComputationException("Averages around " + index 
          + " overflowed: behind=" + behind_average + " ahead=" 
          + ahead_average, index);
    }

    if (behind_average == ahead_average) {
      LOG.debug("Behind and ahead averages are both {}", behind_average);
      final int start = Math.max(index - 1, prev_index);
      return new Boundary(index, start, start + 1, Location.AHEAD);
    }

    final Location location;
    if (Double.isNaN(ahead_average)) {
      ahead_average = value;
      location = Location.BEHIND;
    } else if (Double.isNaN(behind_average)) {
      behind_average = value;
      location = Location.AHEAD;
    } else if (Math.abs(ahead_average - value) 
        > Math.abs(behind_average - value)) {
      location = Location.AHEAD;
    } else {
      location = Location.BEHIND;
    }

    int start;
    final int end;
    if (location == Location.BEHIND) {
      start = Math.max(index - bounds + 1, prev_index);
      end = index + 1;
    } else {
      start = index;
      end = Math.min(index + bounds, next_index);
    }

    double[] weights = ExponentialWeights.exponential(end - start, weighting);
    if (location == Location.AHEAD) {
      weights = ExponentialWeights.flip(weights);
    }
    final double delta = location == Location.AHEAD 
        ? ahead_average : behind_average;

    final int length = end - start;
    int position = 0;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < length; i++) {
      final double weight;
      if (weights.length == 1) {
        weight = weights[0];
      } else {
        weight = i < weights.length ? weights[i] : 0;
      }
      final double point = (series[start + i] - delta) * weight;
      final double squared = point * point;
      if (!Double.isFinite(squared)) {
        throw new NumericComputationException("Weighted deviation of point " 
            + (start + i) + " from " + delta + " was not finite", start + i);
      }
      if (squared > max) {
        max = squared;
        position = i;
      }
    }

    // pull back if we landed on the last point
    if (position + 1 == length) {
      position--;
    }
    start += position;
    if (start < prev_index) {
      start = prev_index + 1;
    }
    if (start > next_index) {
      start = next_index - 1;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Index " + index + " in [" + prev_index + ", " + next_index 
          + ") located " + location.getName() + " at " + start);
    }
    return new Boundary(index, start, start + 1, location);
  }

  /**
   * Chains the boundaries so each range knows the end of the previous one
   * and the start of the next one, then describes the segments in between.
   * @param boundaries The boundaries, ascending.
   * @param series The compacted series.
   * @return The linked ranges.
   */
  public List<ChangePointRange> link(final List<Boundary> boundaries,
                                     final double[] series) {
    if (boundaries.isEmpty()) {
      return Collections.emptyList();
    }
    final int size = boundaries.size();
    final int[] previous = new int[size];
    final int[] next = new int[size];
    previous[0] = 0;
    next[size - 1] = series.length;
    for (int i = 0; i < size - 1; i++) {
      next[i] = boundaries.get(i + 1).start();
      previous[i + 1] = boundaries.get(i).end();
    }

    final Map<Range<Integer>, SegmentStatistics> lookup = Maps.newHashMap();
    final List<ChangePointRange> ranges = Lists.newArrayListWithCapacity(size);
    for (int i = 0; i < size; i++) {
      final Boundary boundary = boundaries.get(i);
      final SegmentStatistics before = describe(series, previous[i],
          boundary.start(), lookup);
      final SegmentStatistics after = describe(series, boundary.end(),
          next[i], lookup);
      final ChangePointStatistics statistics = before == null && after == null
          ? null : new ChangePointStatistics(before, after);
      ranges.add(new ChangePointRange(boundary.index(), boundary.start(),
          boundary.end(), previous[i], next[i], boundary.location(),
          statistics));
    }
    return ranges;
  }

  /**
   * Describes {@code series[start:end]}.
   * @param series The series.
   * @param start The inclusive start.
   * @param end The exclusive end.
   * @param lookup Previously described segments keyed on their range.
   * @return The statistics or null if the segment is empty.
   * @throws NumericComputationException if a moment overflowed.
   */
  @VisibleForTesting
  static SegmentStatistics describe(final double[] series,
                                    final int start,
                                    final int end,
                                    final Map<Range<Integer>, SegmentStatistics> lookup) {
    if (end <= start) {
      return null;
    }
    final Range<Integer> key = Range.closedOpen(start, end);
    SegmentStatistics statistics = lookup.get(key);
    if (statistics != null) {
      return statistics;
    }

    if (end - start == 1) {
      statistics = SegmentStatistics.newBuilder()
          .setNobs(1)
          .setMinMax(series[start], series[start])
          .setMean(series[start])
          .setVariance(Double.NaN)
          .setSkewness(0)
          .setKurtosis(-3)
          .build();
    } else {
      final int length = end - start;
      final double mean = new Mean().evaluate(series, start, length);
      double m2 = 0;
      double m3 = 0;
      double m4 = 0;
      for (int i = start; i < end; i++) {
        final double d = series[i] - mean;
        final double d2 = d * d;
        m2 += d2;
        m3 += d2 * d;
        m4 += d2 * d2;
      }
      m2 /= length;
      m3 /= length;
      m4 /= length;
      // treat round off as a constant segment
      final double eps = Math.ulp(1.0) * mean;
      final boolean constant = m2 <= eps * eps;
      final double variance = 
          new Variance(true).evaluate(series, start, length);
      final double skewness = constant ? 0 : m3 / Math.pow(m2, 1.5);
      final double kurtosis = constant ? -3 : m4 / (m2 * m2) - 3;
      if (!Double.isFinite(mean) || !Double.isFinite(m2) 
          || !Double.isFinite(m3) || !Double.isFinite(m4)
          || !Double.isFinite(variance) || !Double.isFinite(skewness) 
          || !Double.isFinite(kurtosis)) {
        throw new NumericComputationException("Statistics of [" + start 
            + ", " + end + ") were not finite: mean=" + mean + " m2=" + m2 
            + " m3=" + m3 + " m4=" + m4 + " variance=" + variance, start);
      }
      statistics = SegmentStatistics.newBuilder()
          .setNobs(length)
          .setMinMax(new Min().evaluate(series, start, length),
                     new Max().evaluate(series, start, length))
          .setMean(mean)
          .setVariance(variance)
          .setSkewness(skewness)
          .setKurtosis(kurtosis)
          .build();
    }
    lookup.put(key, statistics);
    return statistics;
  }

  /** @return The mean of {@code series[from:to]} or NaN if empty. */
  private static double mean(final double[] series,
                             final int from,
                             final int to) {
    if (to <= from) {
      return Double.NaN;
    }
    return new Mean().evaluate(series, from, to - from);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("weighting", weighting)
        .add("bounds", bounds)
        .toString();
  }

  /** An unlinked boundary for a single accepted index. */
  public static final class Boundary {
    private final int index;
    private final int start;
    private final int end;
    private final Location location;

    public Boundary(final int index,
                    final int start,
                    final int end,
                    final Location location) {
      this.index = index;
      this.start = start;
      this.end = end;
      this.location = location;
    }

    public int index() {
      return index;
    }

    public int start() {
      return start;
    }

    public int end() {
      return end;
    }

    public Location location() {
      return location;
    }

    @Override
    public String toString() {
      return "index=" + index + " [" + start + ", " + end + ") " 
          + location.getName();
    }
  }
}
