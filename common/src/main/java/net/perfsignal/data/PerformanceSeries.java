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
package net.perfsignal.data;

import java.util.Arrays;

import com.google.common.base.MoreObjects;

import net.perfsignal.exceptions.IllegalDataException;

/**
 * An immutable snapshot of the points of one {@link TestIdentifier},
 * ordered by ascending {@link #order(int)}. All of the parallel arrays have
 * the same length. The flag arrays default to all false and the task and
 * version ids default to nulls when they are not provided.
 *
 * @since 1.0
 */
public final class PerformanceSeries {
  private final TestIdentifier id;
  private final double[] values;
  private final String[] revisions;
  private final long[] orders;
  private final long[] create_times;
  private final String[] task_ids;
  private final String[] version_ids;
  private final boolean[] outlier;
  private final boolean[] rejected;
  private final boolean[] whitelisted;
  private final boolean[] user_marked_confirmed;
  private final boolean[] user_marked_rejected;

  private PerformanceSeries(final Builder builder) {
    if (builder.id == null) {
      throw new IllegalArgumentException("Identifier cannot be null.");
    }
    if (builder.values == null) {
      throw new IllegalDataException("Values cannot be null for " 
          + builder.id);
    }
    id = builder.id;
    final int size = builder.values.length;
    values = builder.values.clone();
    revisions = check("revision", builder.revisions, size).clone();
    orders = check("order", builder.orders, size).clone();
    create_times = builder.create_times == null ? new long[size] 
        : check("create_time", builder.create_times, size).clone();
    task_ids = builder.task_ids == null ? new String[size]
        : check("task_id", builder.task_ids, size).clone();
    version_ids = builder.version_ids == null ? new String[size]
        : check("version_id", builder.version_ids, size).clone();
    outlier = flags("outlier", builder.outlier, size);
    rejected = flags("rejected", builder.rejected, size);
    whitelisted = flags("whitelisted", builder.whitelisted, size);
    user_marked_confirmed = flags("user_marked_confirmed",
        builder.user_marked_confirmed, size);
    user_marked_rejected = flags("user_marked_rejected",
        builder.user_marked_rejected, size);
  }

  /** @return The series identifier. */
  public TestIdentifier id() {
    return id;
  }

  /** @return The number of points in the series. */
  public int size() {
    return values.length;
  }

  /** @return Whether or not the series is empty. */
  public boolean isEmpty() {
    return values.length == 0;
  }

  /** @return A copy of the measured values. */
  public double[] values() {
    return values.clone();
  }

  public double value(final int index) {
    return values[index];
  }

  public String revision(final int index) {
    return revisions[index];
  }

  public long order(final int index) {
    return orders[index];
  }

  /** @return A copy of the orders. */
  public long[] orders() {
    return orders.clone();
  }

  public long createTime(final int index) {
    return create_times[index];
  }

  public String taskId(final int index) {
    return task_ids[index];
  }

  public String versionId(final int index) {
    return version_ids[index];
  }

  public boolean outlier(final int index) {
    return outlier[index];
  }

  public boolean rejected(final int index) {
    return rejected[index];
  }

  public boolean whitelisted(final int index) {
    return whitelisted[index];
  }

  public boolean userMarkedConfirmed(final int index) {
    return user_marked_confirmed[index];
  }

  public boolean userMarkedRejected(final int index) {
    return user_marked_rejected[index];
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("size", values.length)
        .add("first_order", values.length > 0 ? orders[0] : null)
        .add("last_order", values.length > 0 
            ? orders[values.length - 1] : null)
        .toString();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PerformanceSeries other = (PerformanceSeries) o;
    return id.equals(other.id)
        && Arrays.equals(values, other.values)
        && Arrays.equals(revisions, other.revisions)
        && Arrays.equals(orders, other.orders)
        && Arrays.equals(create_times, other.create_times)
        && Arrays.equals(task_ids, other.task_ids)
        && Arrays.equals(version_ids, other.version_ids)
        && Arrays.equals(outlier, other.outlier)
        && Arrays.equals(rejected, other.rejected)
        && Arrays.equals(whitelisted, other.whitelisted)
        && Arrays.equals(user_marked_confirmed, other.user_marked_confirmed)
        && Arrays.equals(user_marked_rejected, other.user_marked_rejected);
  }

  @Override
  public int hashCode() {
    return 31 * id.hashCode() + Arrays.hashCode(orders);
  }

  private <T> T[] check(final String name, final T[] array, final int size) {
    if (array == null) {
      throw new IllegalDataException("Missing " + name + " array for " + id);
    }
    if (array.length != size) {
      throw mismatch(name, array.length, size);
    }
    return array;
  }

  private long[] check(final String name, final long[] array, final int size) {
    if (array == null) {
      throw new IllegalDataException("Missing " + name + " array for " + id);
    }
    if (array.length != size) {
      throw mismatch(name, array.length, size);
    }
    return array;
  }

  private boolean[] flags(final String name,
                          final boolean[] array,
                          final int size) {
    if (array == null) {
      return new boolean[size];
    }
    if (array.length != size) {
      throw mismatch(name, array.length, size);
    }
    return array.clone();
  }

  private IllegalDataException mismatch(final String name,
                                        final int length,
                                        final int size) {
    return new IllegalDataException("Length of " + name + " [" + length
        + "] does not match the number of values [" + size + "] for " + id);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private TestIdentifier id;
    private double[] values;
    private String[] revisions;
    private long[] orders;
    private long[] create_times;
    private String[] task_ids;
    private String[] version_ids;
    private boolean[] outlier;
    private boolean[] rejected;
    private boolean[] whitelisted;
    private boolean[] user_marked_confirmed;
    private boolean[] user_marked_rejected;

    public Builder setId(final TestIdentifier id) {
      this.id = id;
      return this;
    }

    public Builder setValues(final double[] values) {
      this.values = values;
      return this;
    }

    public Builder setRevisions(final String[] revisions) {
      this.revisions = revisions;
      return this;
    }

    public Builder setOrders(final long[] orders) {
      this.orders = orders;
      return this;
    }

    public Builder setCreateTimes(final long[] create_times) {
      this.create_times = create_times;
      return this;
    }

    public Builder setTaskIds(final String[] task_ids) {
      this.task_ids = task_ids;
      return this;
    }

    public Builder setVersionIds(final String[] version_ids) {
      this.version_ids = version_ids;
      return this;
    }

    public Builder setOutlier(final boolean[] outlier) {
      this.outlier = outlier;
      return this;
    }

    public Builder setRejected(final boolean[] rejected) {
      this.rejected = rejected;
      return this;
    }

    public Builder setWhitelisted(final boolean[] whitelisted) {
      this.whitelisted = whitelisted;
      return this;
    }

    public Builder setUserMarkedConfirmed(
        final boolean[] user_marked_confirmed) {
      this.user_marked_confirmed = user_marked_confirmed;
      return this;
    }

    public Builder setUserMarkedRejected(
        final boolean[] user_marked_rejected) {
      this.user_marked_rejected = user_marked_rejected;
      return this;
    }

    /** @return The series.
     * @throws IllegalDataException if the arrays differ in length. */
    public PerformanceSeries build() {
      return new PerformanceSeries(this);
    }
  }
}
