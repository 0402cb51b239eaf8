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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;

import net.perfsignal.changepoints.ChangePointAssembler;
import net.perfsignal.changepoints.CompactedSeries;
import net.perfsignal.changepoints.SeriesPreprocessor;
import net.perfsignal.changepoints.qhat.EDivisive;
import net.perfsignal.changepoints.qhat.EDivisiveResult;
import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.PerformanceSeries;
import net.perfsignal.data.SegmentStatistics;
import net.perfsignal.data.TestIdentifier;
import net.perfsignal.storage.ChangePointStore;
import net.perfsignal.storage.ChangePointTransaction;
import net.perfsignal.storage.PerformanceDataStore;

/**
 * Computes and persists the change points of one series at a time.
 * <p>
 * A run picks a resume order with the {@link ResumePointSelector}, fetches
 * the newer points, runs the preprocessing, E-Divisive search and range
 * assembly, then replaces the stored change points newer than the resume
 * order in a single transaction. The change point preceding the replaced
 * block gets its trailing statistics relinked to the new first change point.
 * If the store already holds exactly the computed change points nothing is
 * written.
 * <p>
 * The whole cycle is wrapped in the {@link RetryPolicy} so transient storage
 * failures restart it from the resume point selection.
 *
 * @since 1.0
 */
public class ChangePointComputer {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChangePointComputer.class);

  /** Orders change points ascending by their order. */
  static final Comparator<ChangePoint> BY_ORDER = 
      new Comparator<ChangePoint>() {
    @Override
    public int compare(final ChangePoint a, final ChangePoint b) {
      return Long.compare(a.order(), b.order());
    }
  };

  private final PerformanceDataStore data_store;
  private final ChangePointStore change_point_store;
  private final SeriesPreprocessor preprocessor;
  private final EDivisive e_divisive;
  private final ChangePointAssembler assembler;
  private final ResumePointSelector selector;
  private final RetryPolicy retry;
  private final Integer min_points;

  protected ChangePointComputer(final Builder builder) {
    Preconditions.checkNotNull(builder.data_store, 
        "Data store cannot be null.");
    Preconditions.checkNotNull(builder.change_point_store,
        "Change point store cannot be null.");
    Preconditions.checkNotNull(builder.e_divisive, 
        "EDivisive cannot be null.");
    Preconditions.checkNotNull(builder.assembler, 
        "Assembler cannot be null.");
    data_store = builder.data_store;
    change_point_store = builder.change_point_store;
    preprocessor = builder.preprocessor != null 
        ? builder.preprocessor : new SeriesPreprocessor();
    e_divisive = builder.e_divisive;
    assembler = builder.assembler;
    selector = new ResumePointSelector(data_store, change_point_store);
    retry = builder.retry != null ? builder.retry 
        : new RetryPolicy(RetryPolicy.DEFAULT_ATTEMPTS, 
            RetryPolicy.DEFAULT_DELAY_MS);
    min_points = builder.min_points;
  }

  /**
   * Computes and stores the change points of the series.
   * @param id A non-null identifier.
   * @return The result.
   * @throws net.perfsignal.exceptions.TransientStorageException if the store
   * kept failing after all attempts.
   * @throws net.perfsignal.exceptions.IllegalDataException if the stored
   * points are malformed.
   * @throws net.perfsignal.exceptions.NumericComputationException if the
   * search overflowed.
   */
  public ComputeResult compute(final TestIdentifier id) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    return retry.call("change points of " + id, () -> computeOnce(id));
  }

  /**
   * Runs the pipeline on an already fetched series without touching the
   * change point store.
   * @param series A non-null series.
   * @return The change points ascending by order.
   */
  public List<ChangePoint> detect(final PerformanceSeries series) {
    final CompactedSeries compacted = preprocessor.compact(series);
    final EDivisiveResult result = e_divisive.compute(compacted.values());
    final List<ChangePoint> change_points = 
        Lists.newArrayList(assembler.assemble(compacted, result));
    Collections.sort(change_points, BY_ORDER);
    return change_points;
  }

  ComputeResult computeOnce(final TestIdentifier id) {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final Long resume = selector.select(id, min_points);
    final PerformanceSeries series = data_store.fetchSeries(id, resume);
    final List<ChangePoint> change_points = detect(series);

    final boolean written = change_point_store.inTransaction(id, 
        new ChangePointStore.TransactionWork<Boolean>() {
      @Override
      public Boolean execute(final ChangePointTransaction transaction) {
        return replace(transaction, resume, change_points);
      }
    });

    LOG.info("Computed " + change_points.size() + " change points from " 
        + series.size() + " points for " + id + " after order " + resume 
        + (written ? "" : " (unchanged)") + " in " + stopwatch);
    return new ComputeResult(id, series.size(), change_points.size(), written);
  }

  /**
   * Replaces the change points newer than the resume order.
   * @return True if anything was written.
   */
  static boolean replace(final ChangePointTransaction transaction,
                         final Long resume,
                         final List<ChangePoint> change_points) {
    final SegmentStatistics link = change_points.isEmpty() ? null 
        : change_points.get(0).statistics().previous();

    final List<ChangePoint> existing = transaction.findNewerThan(resume);
    if (existing.equals(change_points)) {
      // nothing stored lies between the resume order and the first change
      // point so the preceding row is the one that gets relinked
      final ChangePoint previous = change_points.isEmpty() ? null 
          : transaction.findPrevious(change_points.get(0).order());
      if (previous == null 
          || Objects.equal(previous.statistics().next(), link)) {
        return false;
      }
    }

    final long deleted = transaction.deleteNewerThan(resume);
    transaction.insert(change_points);
    if (!change_points.isEmpty()) {
      final ChangePoint previous = 
          transaction.findPrevious(change_points.get(0).order());
      if (previous != null) {
        transaction.updateNextStatistics(previous, link);
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Replaced " + deleted + " change points after order " 
          + resume + " with " + change_points.size());
    }
    return true;
  }

  public EDivisive eDivisive() {
    return e_divisive;
  }

  public ChangePointAssembler assembler() {
    return assembler;
  }

  public ResumePointSelector selector() {
    return selector;
  }

  public RetryPolicy retry() {
    return retry;
  }

  public Integer minPoints() {
    return min_points;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private PerformanceDataStore data_store;
    private ChangePointStore change_point_store;
    private SeriesPreprocessor preprocessor;
    private EDivisive e_divisive;
    private ChangePointAssembler assembler;
    private RetryPolicy retry;
    private Integer min_points;

    public Builder setDataStore(final PerformanceDataStore data_store) {
      this.data_store = data_store;
      return this;
    }

    public Builder setChangePointStore(
        final ChangePointStore change_point_store) {
      this.change_point_store = change_point_store;
      return this;
    }

    public Builder setPreprocessor(final SeriesPreprocessor preprocessor) {
      this.preprocessor = preprocessor;
      return this;
    }

    public Builder setEDivisive(final EDivisive e_divisive) {
      this.e_divisive = e_divisive;
      return this;
    }

    public Builder setAssembler(final ChangePointAssembler assembler) {
      this.assembler = assembler;
      return this;
    }

    public Builder setRetry(final RetryPolicy retry) {
      this.retry = retry;
      return this;
    }

    /** @param min_points Null or 0 to always recompute everything. */
    public Builder setMinPoints(final Integer min_points) {
      this.min_points = min_points;
      return this;
    }

    public ChangePointComputer build() {
      return new ChangePointComputer(this);
    }
  }
}
