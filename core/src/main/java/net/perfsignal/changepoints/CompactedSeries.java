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

import net.perfsignal.data.PerformanceSeries;

/**
 * The unmasked values of a series with the mapping from compacted positions
 * back to the original positions.
 *
 * @since 1.0
 */
public final class CompactedSeries {
  private final PerformanceSeries original;
  private final double[] values;
  private final int[] index_map;
  private final boolean[] mask;

  /**
   * Default ctor.
   * @param original The source series.
   * @param values The kept values.
   * @param index_map For each kept value its index in the source series.
   * @param mask For each source point whether it was excluded.
   */
  public CompactedSeries(final PerformanceSeries original,
                         final double[] values,
                         final int[] index_map,
                         final boolean[] mask) {
    if (values.length != index_map.length) {
      throw new IllegalArgumentException("Values and index map must have "
          + "the same length.");
    }
    if (mask.length != original.size()) {
      throw new IllegalArgumentException("Mask must match the original "
          + "series length.");
    }
    this.original = original;
    this.values = values;
    this.index_map = index_map;
    this.mask = mask;
  }

  /** @return The source series. */
  public PerformanceSeries original() {
    return original;
  }

  /** @return The kept values. Do not modify. */
  public double[] values() {
    return values;
  }

  /** @return The number of kept values. */
  public int size() {
    return values.length;
  }

  /**
   * @param compacted_index A position in the compacted series.
   * @return The position of the same point in the original series.
   */
  public int originalIndex(final int compacted_index) {
    return index_map[compacted_index];
  }

  /**
   * @param original_index A position in the original series.
   * @return Whether or not the point was excluded.
   */
  public boolean masked(final int original_index) {
    return mask[original_index];
  }
}
