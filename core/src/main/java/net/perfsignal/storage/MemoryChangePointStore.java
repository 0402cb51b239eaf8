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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.SegmentStatistics;
import net.perfsignal.data.TestIdentifier;

/**
 * A change point store backed by a map. Transactions operate on a copy of
 * the series' change points that is only swapped in when the work returns
 * normally, so a failed transaction leaves nothing behind. Transactions are
 * serialized on the store.
 *
 * @since 1.0
 */
public class MemoryChangePointStore implements ChangePointStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryChangePointStore.class);

  private static final Comparator<ChangePoint> BY_ORDER = 
      new Comparator<ChangePoint>() {
    @Override
    public int compare(final ChangePoint a, final ChangePoint b) {
      return Long.compare(a.order(), b.order());
    }
  };

  private final Map<TestIdentifier, List<ChangePoint>> database = 
      Maps.newHashMap();

  /** Incremented for every insert, delete and update that changed rows. */
  private final AtomicLong writes = new AtomicLong();

  @Override
  public synchronized List<Long> changePointOrders(final TestIdentifier id) {
    final List<Long> orders = Lists.newArrayList();
    for (final ChangePoint change_point : rows(id)) {
      orders.add(change_point.order());
    }
    return orders;
  }

  @Override
  public synchronized List<ChangePoint> find(final TestIdentifier id) {
    return ImmutableList.copyOf(rows(id));
  }

  @Override
  public synchronized <T> T inTransaction(final TestIdentifier id,
                                          final TransactionWork<T> work) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    final MemoryTransaction transaction = 
        new MemoryTransaction(Lists.newArrayList(rows(id)));
    final T result = work.execute(transaction);
    if (transaction.writes > 0) {
      database.put(id, transaction.rows);
      writes.addAndGet(transaction.writes);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Committed " + transaction.writes + " writes for " + id);
    }
    return result;
  }

  /** @return The number of row writes committed so far. */
  public long writes() {
    return writes.get();
  }

  private List<ChangePoint> rows(final TestIdentifier id) {
    final List<ChangePoint> rows = database.get(id);
    return rows == null ? Collections.<ChangePoint>emptyList() : rows;
  }

  /** A transaction over a private copy of the rows. */
  private static class MemoryTransaction implements ChangePointTransaction {
    private final List<ChangePoint> rows;
    private long writes;

    MemoryTransaction(final List<ChangePoint> rows) {
      this.rows = rows;
    }

    @Override
    public List<ChangePoint> findNewerThan(final Long order) {
      final List<ChangePoint> newer = Lists.newArrayList();
      for (final ChangePoint change_point : rows) {
        if (order == null || change_point.order() > order) {
          newer.add(change_point);
        }
      }
      return newer;
    }

    @Override
    public long deleteNewerThan(final Long order) {
      final List<ChangePoint> newer = findNewerThan(order);
      rows.removeAll(newer);
      writes += newer.size();
      return newer.size();
    }

    @Override
    public void insert(final List<ChangePoint> change_points) {
      rows.addAll(change_points);
      Collections.sort(rows, BY_ORDER);
      writes += change_points.size();
    }

    @Override
    public ChangePoint findPrevious(final long order) {
      ChangePoint previous = null;
      for (final ChangePoint change_point : rows) {
        if (change_point.order() < order) {
          previous = change_point;
        }
      }
      return previous;
    }

    @Override
    public void updateNextStatistics(final ChangePoint change_point,
                                     final SegmentStatistics next) {
      for (int i = 0; i < rows.size(); i++) {
        if (rows.get(i).order() == change_point.order()) {
          rows.set(i, rows.get(i).withNextStatistics(next));
          writes++;
          return;
        }
      }
    }
  }
}
