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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import net.perfsignal.data.ChangePointStatistics;

/**
 * The localized boundary of an accepted candidate in compacted series
 * coordinates. The jump lies between {@code start} and {@code end}, and
 * {@code previous} and {@code next} are the ends of the neighbouring
 * ranges (or the ends of the series).
 *
 * @since 1.0
 */
public final class ChangePointRange {
  private final int index;
  private final int start;
  private final int end;
  private final int previous;
  private final int next;
  private final Location location;
  private final ChangePointStatistics statistics;

  /**
   * Default ctor.
   * @param index The candidate index found by the search.
   * @param start The last point before the jump.
   * @param end The first point after the jump.
   * @param previous The end of the preceding range or 0.
   * @param next The start of the following range or the series length.
   * @param location The side of the candidate the jump was found on.
   * @param statistics The statistics of the surrounding segments, null if
   * both segments are empty.
   */
  public ChangePointRange(final int index,
                          final int start,
                          final int end,
                          final int previous,
                          final int next,
                          final Location location,
                          final ChangePointStatistics statistics) {
    this.index = index;
    this.start = start;
    this.end = end;
    this.previous = previous;
    this.next = next;
    this.location = location;
    this.statistics = statistics;
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

  public int previous() {
    return previous;
  }

  public int next() {
    return next;
  }

  public Location location() {
    return location;
  }

  /** @return The segment statistics, may be null. */
  public ChangePointStatistics statistics() {
    return statistics;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ChangePointRange other = (ChangePointRange) o;
    return index == other.index
        && start == other.start
        && end == other.end
        && previous == other.previous
        && next == other.next
        && location == other.location
        && Objects.equal(statistics, other.statistics);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(index, start, end, previous, next, location);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("index", index)
        .add("start", start)
        .add("end", end)
        .add("previous", previous)
        .add("next", next)
        .add("location", location)
        .add("statistics", statistics)
        .toString();
  }
}
