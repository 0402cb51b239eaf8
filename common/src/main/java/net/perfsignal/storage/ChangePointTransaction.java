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
package net.perfsignal.storage;

import java.util.List;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.SegmentStatistics;

/**
 * The operations available on the change points of a single series within
 * one all-or-nothing transaction.
 *
 * @since 1.0
 */
public interface ChangePointTransaction {

  /**
   * @param order An optional exclusive lower bound, null for all.
   * @return The change points with an order greater than the bound,
   * ascending by order.
   */
  public List<ChangePoint> findNewerThan(final Long order);

  /**
   * @param order An optional exclusive lower bound, null for all.
   * @return The number of change points deleted.
   */
  public long deleteNewerThan(final Long order);

  /** @param change_points The change points to write, may be empty. */
  public void insert(final List<ChangePoint> change_points);

  /**
   * @param order The order to search below.
   * @return The newest change point with an order strictly less than the
   * given order or null if there isn't one.
   */
  public ChangePoint findPrevious(final long order);

  /**
   * Replaces the trailing statistics of a stored change point.
   * @param change_point The stored change point to update.
   * @param next The new trailing statistics, may be null.
   */
  public void updateNextStatistics(final ChangePoint change_point,
                                   final SegmentStatistics next);
}
