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

import com.google.common.base.Objects;

/**
 * The number of points of a series whose order falls in
 * {@code [lowerBound, upperBound)} of a bucketed aggregation.
 *
 * @since 1.0
 */
public final class OrderBucket {
  private final long lower_bound;
  private final long count;

  /**
   * Default ctor.
   * @param lower_bound The inclusive lower order of the bucket.
   * @param count The number of points in the bucket.
   */
  public OrderBucket(final long lower_bound, final long count) {
    this.lower_bound = lower_bound;
    this.count = count;
  }

  /** @return The inclusive lower order of the bucket. */
  public long lowerBound() {
    return lower_bound;
  }

  /** @return The number of points in the bucket. */
  public long count() {
    return count;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final OrderBucket other = (OrderBucket) o;
    return lower_bound == other.lower_bound && count == other.count;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(lower_bound, count);
  }

  @Override
  public String toString() {
    return "[" + lower_bound + "]=" + count;
  }
}
