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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import net.perfsignal.data.TestIdentifier;
import net.perfsignal.storage.ChangePointStore;
import net.perfsignal.storage.OrderBucket;
import net.perfsignal.storage.PerformanceDataStore;

/**
 * Picks the order after which a series is recomputed so that at least a
 * minimum number of the newest points are included.
 * <p>
 * When the series already has change points the resume point is always one
 * of them: the points are bucketed between consecutive change points and
 * the newest change point whose bucket, together with the newer ones, holds
 * enough points is chosen. Without change points the magnitude of a
 * negative minimum counts back from the newest point. A null result means
 * the whole series is recomputed.
 *
 * @since 1.0
 */
public class ResumePointSelector {
  private static final Logger LOG = LoggerFactory.getLogger(
      ResumePointSelector.class);

  private final PerformanceDataStore data_store;
  private final ChangePointStore change_point_store;

  /**
   * Default ctor.
   * @param data_store A non-null points store.
   * @param change_point_store A non-null change point store.
   */
  public ResumePointSelector(final PerformanceDataStore data_store,
                             final ChangePointStore change_point_store) {
    Preconditions.checkNotNull(data_store, "Data store cannot be null.");
    Preconditions.checkNotNull(change_point_store,
        "Change point store cannot be null.");
    this.data_store = data_store;
    this.change_point_store = change_point_store;
  }

  /**
   * @param id A non-null identifier.
   * @param min_points The minimum number of points to include. Null or 0
   * means the whole series.
   * @return The exclusive order to resume after or null to recompute
   * everything.
   */
  public Long select(final TestIdentifier id, final Integer min_points) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    if (min_points == null || min_points == 0) {
      return null;
    }
    final List<Long> orders = change_point_store.changePointOrders(id);
    final Long order = orders.isEmpty()
        ? withoutChangePoints(id, min_points)
        : withChangePoints(id, min_points, orders);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resume point for " + id + " with min points " + min_points 
          + " is " + order);
    }
    return order;
  }

  private Long withChangePoints(final TestIdentifier id,
                                final int min_points,
                                final List<Long> orders) {
    final List<Long> boundaries = Lists.newArrayListWithCapacity(
        orders.size() + 2);
    boundaries.add(0L);
    for (final Long order : orders) {
      if (order > boundaries.get(boundaries.size() - 1)) {
        boundaries.add(order);
      }
    }
    boundaries.add(Long.MAX_VALUE);

    final long required = Math.abs((long) min_points);
    long total = 0;
    for (final OrderBucket bucket : 
        data_store.countByOrderBuckets(id, boundaries)) {
      total += bucket.count();
      if (total >= required) {
        return orders.contains(bucket.lowerBound()) ? bucket.lowerBound() : null;
      }
    }
    return null;
  }

  private Long withoutChangePoints(final TestIdentifier id,
                                   final int min_points) {
    if (min_points >= 0) {
      return null;
    }
    final long count = data_store.countPoints(id);
    final long required = Math.abs((long) min_points);
    if (count == 0 || required > count) {
      return null;
    }
    return data_store.orderOfNewest(id, (int) (required - 1));
  }
}
