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
package net.perfsignal.compute;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import net.perfsignal.data.TestIdentifier;

/**
 * The outcome of computing the change points of one series.
 *
 * @since 1.0
 */
public final class ComputeResult {
  private final TestIdentifier id;
  private final int points;
  private final int change_points;
  private final boolean written;

  /**
   * Default ctor.
   * @param id The series identifier.
   * @param points The number of points fetched for the computation.
   * @param change_points The number of change points found.
   * @param written Whether or not the store was modified.
   */
  public ComputeResult(final TestIdentifier id,
                       final int points,
                       final int change_points,
                       final boolean written) {
    this.id = id;
    this.points = points;
    this.change_points = change_points;
    this.written = written;
  }

  public TestIdentifier id() {
    return id;
  }

  /** @return The number of points fetched for the computation. */
  public int points() {
    return points;
  }

  /** @return The number of change points found. */
  public int changePoints() {
    return change_points;
  }

  /** @return False if the stored change points were already up to date. */
  public boolean written() {
    return written;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ComputeResult other = (ComputeResult) o;
    return Objects.equal(id, other.id)
        && points == other.points
        && change_points == other.change_points
        && written == other.written;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, points, change_points, written);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("points", points)
        .add("change_points", change_points)
        .add("written", written)
        .toString();
  }
}
