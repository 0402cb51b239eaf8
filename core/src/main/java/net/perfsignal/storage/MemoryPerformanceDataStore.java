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
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.perfsignal.data.PerformanceSeries;
import net.perfsignal.data.TestIdentifier;

/**
 * A points store that keeps whole series in memory. Useful for tests and
 * for running the computation over data loaded from elsewhere.
 *
 * @since 1.0
 */
public class MemoryPerformanceDataStore implements PerformanceDataStore {

  private final Map<TestIdentifier, PerformanceSeries> database = 
      Maps.newConcurrentMap();

  /**
   * Stores or replaces a series. The orders must be ascending.
   * @param series A non-null series.
   */
  public void put(final PerformanceSeries series) {
    Preconditions.checkNotNull(series, "Series cannot be null.");
    for (int i = 1; i < series.size(); i++) {
      Preconditions.checkArgument(series.order(i - 1) < series.order(i),
          "Orders must be ascending at index %s", i);
    }
    database.put(series.id(), series);
  }

  @Override
  public PerformanceSeries fetchSeries(final TestIdentifier id,
                                       final Long min_order) {
    final PerformanceSeries series = database.get(id);
    if (series == null) {
      return empty(id);
    }
    int first = 0;
    if (min_order != null) {
      while (first < series.size() && series.order(first) <= min_order) {
        first++;
      }
    }
    if (first == 0) {
      return series;
    }
    return slice(series, first);
  }

  @Override
  public List<OrderBucket> countByOrderBuckets(final TestIdentifier id,
                                               final List<Long> boundaries) {
    Preconditions.checkArgument(boundaries.size() >= 2,
        "At least two boundaries are required.");
    final PerformanceSeries series = database.get(id);
    final List<OrderBucket> buckets = Lists.newArrayList();
    if (series == null) {
      return buckets;
    }
    for (int b = boundaries.size() - 2; b >= 0; b--) {
      final long lower = boundaries.get(b);
      final long upper = boundaries.get(b + 1);
      long count = 0;
      for (int i = 0; i < series.size(); i++) {
        if (series.order(i) >= lower && series.order(i) < upper) {
          count++;
        }
      }
      if (count > 0) {
        buckets.add(new OrderBucket(lower, count));
      }
    }
    return buckets;
  }

  @Override
  public long countPoints(final TestIdentifier id) {
    final PerformanceSeries series = database.get(id);
    return series == null ? 0 : series.size();
  }

  @Override
  public Long orderOfNewest(final TestIdentifier id, final int offset) {
    final PerformanceSeries series = database.get(id);
    if (series == null || offset < 0 || offset >= series.size()) {
      return null;
    }
    return series.order(series.size() - 1 - offset);
  }

  private static PerformanceSeries empty(final TestIdentifier id) {
    return PerformanceSeries.newBuilder()
        .setId(id)
        .setValues(new double[0])
        .setRevisions(new String[0])
        .setOrders(new long[0])
        .setCreateTimes(new long[0])
        .build();
  }

  private static PerformanceSeries slice(final PerformanceSeries series,
                                         final int first) {
    final int size = series.size() - first;
    final double[] values = new double[size];
    final String[] revisions = new String[size];
    final long[] orders = new long[size];
    final long[] create_times = new long[size];
    final String[] task_ids = new String[size];
    final String[] version_ids = new String[size];
    final boolean[] outlier = new boolean[size];
    final boolean[] rejected = new boolean[size];
    final boolean[] whitelisted = new boolean[size];
    final boolean[] confirmed = new boolean[size];
    final boolean[] user_rejected = new boolean[size];
    for (int i = 0; i < size; i++) {
      final int j = first + i;
      values[i] = series.value(j);
      revisions[i] = series.revision(j);
      orders[i] = series.order(j);
      create_times[i] = series.createTime(j);
      task_ids[i] = series.taskId(j);
      version_ids[i] = series.versionId(j);
      outlier[i] = series.outlier(j);
      rejected[i] = series.rejected(j);
      whitelisted[i] = series.whitelisted(j);
      confirmed[i] = series.userMarkedConfirmed(j);
      user_rejected[i] = series.userMarkedRejected(j);
    }
    return PerformanceSeries.newBuilder()
        .setId(series.id())
        .setValues(values)
        .setRevisions(revisions)
        .setOrders(orders)
        .setCreateTimes(create_times)
        .setTaskIds(task_ids)
        .setVersionIds(version_ids)
        .setOutlier(outlier)
        .setRejected(rejected)
        .setWhitelisted(whitelisted)
        .setUserMarkedConfirmed(confirmed)
        .setUserMarkedRejected(user_rejected)
        .build();
  }
}
