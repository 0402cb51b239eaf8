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
package net.perfsignal.changepoints.qhat;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The outcome of one E-Divisive search.
 *
 * @since 1.0
 */
public final class EDivisiveResult {
  private final List<QHatCandidate> change_points;
  private final List<Integer> windows;
  private final double max_q;
  private final double min_change;

  /**
   * Default ctor.
   * @param change_points The accepted candidates in acceptance order.
   * @param windows The window boundaries of the final pass.
   * @param max_q The largest statistic of the first pass over the whole
   * series.
   * @param min_change The smallest candidate statistic that was tested.
   */
  public EDivisiveResult(final List<QHatCandidate> change_points,
                         final List<Integer> windows,
                         final double max_q,
                         final double min_change) {
    this.change_points = ImmutableList.copyOf(change_points);
    this.windows = ImmutableList.copyOf(windows);
    this.max_q = max_q;
    this.min_change = min_change;
  }

  /** @return The accepted candidates in acceptance order, i.e. descending
   * significance. */
  public List<QHatCandidate> changePoints() {
    return change_points;
  }

  /** @return The window boundaries of the final pass, starting with 0 and
   * ending with the length of the series. */
  public List<Integer> windows() {
    return windows;
  }

  public double maxQ() {
    return max_q;
  }

  public double minChange() {
    return min_change;
  }

  /** @return The accepted indices sorted ascending. */
  public int[] sortedIndices() {
    final int[] indices = new int[change_points.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = change_points.get(i).index();
    }
    Arrays.sort(indices);
    return indices;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("change_points", change_points)
        .add("windows", windows)
        .add("max_q", max_q)
        .add("min_change", min_change)
        .toString();
  }
}
