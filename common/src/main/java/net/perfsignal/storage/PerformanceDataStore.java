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

import net.perfsignal.data.PerformanceSeries;
import net.perfsignal.data.TestIdentifier;

/**
 * Read access to the measured points of benchmark series.
 * <p>
 * Implementations throw
 * {@link net.perfsignal.exceptions.TransientStorageException} for failures
 * that may succeed when retried.
 *
 * @since 1.0
 */
public interface PerformanceDataStore {

  /**
   * Fetches the points of a series with the outlier, rejection, whitelist
   * and user marking flags joined in, ordered by ascending order.
   * @param id A non-null identifier.
   * @param min_order An optional exclusive lower bound on the order. When
   * null the entire series is returned.
   * @return A non-null, possibly empty, series.
   * @throws net.perfsignal.exceptions.IllegalDataException if the stored
   * data is malformed.
   */
  public PerformanceSeries fetchSeries(final TestIdentifier id,
                                       final Long min_order);

  /**
   * Counts the points of a series in the buckets defined by the boundaries.
   * Bucket {@code i} covers {@code [boundaries[i], boundaries[i + 1])}.
   * @param id A non-null identifier.
   * @param boundaries At least two ascending boundaries.
   * @return The non-empty buckets ordered newest to oldest.
   */
  public List<OrderBucket> countByOrderBuckets(final TestIdentifier id,
                                               final List<Long> boundaries);

  /**
   * @param id A non-null identifier.
   * @return The number of points in the series.
   */
  public long countPoints(final TestIdentifier id);

  /**
   * @param id A non-null identifier.
   * @param offset How many of the newest points to skip, 0 for the newest.
   * @return The order of the point or null if the series has no such point.
   */
  public Long orderOfNewest(final TestIdentifier id, final int offset);
}
