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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import net.perfsignal.data.PerformanceSeries;

/**
 * Drops the points that must not take part in change point detection.
 * A point is excluded when it is an outlier or was rejected and has not
 * been whitelisted, or when a user confirmed it as an outlier. A user
 * rejection of the outlier marking always keeps the point.
 *
 * @since 1.0
 */
public class SeriesPreprocessor {
  private static final Logger LOG = LoggerFactory.getLogger(
      SeriesPreprocessor.class);

  /**
   * @param series A non-null series.
   * @return The compacted series, empty if every point was excluded.
   */
  public CompactedSeries compact(final PerformanceSeries series) {
    Preconditions.checkNotNull(series, "Series cannot be null.");
    final int size = series.size();
    final boolean[] mask = new boolean[size];
    int kept = 0;
    for (int i = 0; i < size; i++) {
      mask[i] = isMasked(series, i);
      if (!mask[i]) {
        kept++;
      }
    }

    final double[] values = new double[kept];
    final int[] index_map = new int[kept];
    int j = 0;
    for (int i = 0; i < size; i++) {
      if (!mask[i]) {
        values[j] = series.value(i);
        index_map[j] = i;
        j++;
      }
    }
    if (LOG.isDebugEnabled() && kept != size) {
      LOG.debug("Masked " + (size - kept) + " of " + size + " points for " 
          + series.id());
    }
    return new CompactedSeries(series, values, index_map, mask);
  }

  /**
   * @param series The series.
   * @param i The index of the point.
   * @return Whether or not the point is excluded.
   */
  static boolean isMasked(final PerformanceSeries series, final int i) {
    if (series.userMarkedRejected(i)) {
      return false;
    }
    final boolean whitelisted = series.whitelisted(i);
    return (series.outlier(i) && !whitelisted)
        || (series.rejected(i) && !whitelisted)
        || series.userMarkedConfirmed(i);
  }
}
