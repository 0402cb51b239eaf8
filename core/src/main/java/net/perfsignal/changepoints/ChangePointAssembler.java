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
package net.perfsignal.changepoints;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import net.perfsignal.changepoints.qhat.EDivisiveResult;
import net.perfsignal.changepoints.qhat.QHatCandidate;
import net.perfsignal.changepoints.range.ChangePointRange;
import net.perfsignal.changepoints.range.RangeFinder;
import net.perfsignal.data.AlgorithmMetadata;
import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.ChangePointStatistics;
import net.perfsignal.data.PerformanceSeries;
import net.perfsignal.data.RangeFinderMetadata;
import net.perfsignal.exceptions.IllegalDataException;
import net.perfsignal.git.GitHistoryResolver;
import net.perfsignal.git.FallbackGitHistoryResolver;

/**
 * Turns accepted candidates into persistable {@link ChangePoint}s. The
 * candidates are localized by the {@link RangeFinder} in compacted space
 * and mapped back to the original series to pick up the revisions, orders
 * and creation times. Change points are emitted in acceptance order which
 * is also their {@code order_of_change_point}.
 *
 * @since 1.0
 */
public class ChangePointAssembler {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChangePointAssembler.class);

  private final RangeFinder range_finder;
  private final FallbackGitHistoryResolver resolver;

  /**
   * Default ctor.
   * @param range_finder A non-null range finder.
   * @param resolver A non-null resolver. Anything but a
   * {@link FallbackGitHistoryResolver} is wrapped in one.
   */
  public ChangePointAssembler(final RangeFinder range_finder,
                              final GitHistoryResolver resolver) {
    Preconditions.checkNotNull(range_finder, "Range finder cannot be null.");
    Preconditions.checkNotNull(resolver, "Resolver cannot be null.");
    this.range_finder = range_finder;
    this.resolver = resolver instanceof FallbackGitHistoryResolver
        ? (FallbackGitHistoryResolver) resolver 
        : new FallbackGitHistoryResolver(Collections.singletonList(resolver));
  }

  /**
   * @param compacted The compacted series the search ran on.
   * @param result The search result.
   * @return The change points in acceptance order.
   */
  public List<ChangePoint> assemble(final CompactedSeries compacted,
                                    final EDivisiveResult result) {
    final List<QHatCandidate> candidates = result.changePoints();
    if (candidates.isEmpty()) {
      return Collections.emptyList();
    }
    final int[] sorted = result.sortedIndices();
    final List<ChangePointRange> ranges = range_finder.findRanges(sorted,
        compacted.values());

    final PerformanceSeries series = compacted.original();
    final List<ChangePoint> change_points = Lists.newArrayListWithCapacity(
        candidates.size());
    for (int order_of_change_point = 0; 
         order_of_change_point < candidates.size(); 
         order_of_change_point++) {
      final QHatCandidate candidate = candidates.get(order_of_change_point);
      final ChangePointRange range = findRange(ranges, candidate.index());

      final int stable_index = originalIndex(compacted, range.start());
      final int suspect_index = originalIndex(compacted, range.end());
      final String stable_revision = series.revision(stable_index);
      final String suspect_revision = series.revision(suspect_index);

      final List<String> all_suspect_revisions = 
          resolver.resolve(stable_revision, suspect_revision);
      final ChangePointStatistics statistics = range.statistics();
      final Magnitude magnitude = Magnitude.calculate(statistics);

      final AlgorithmMetadata algorithm = AlgorithmMetadata.newBuilder()
          .setName(AlgorithmMetadata.QHAT)
          .setIndex(candidate.index())
          .setValue(candidate.value())
          .setValueToAvg(candidate.valueToAvg())
          .setValueToAvgDiff(candidate.valueToAvgDiff())
          .setAverage(candidate.average())
          .setAverageDiff(candidate.averageDiff())
          .setWindowSize(candidate.windowSize())
          .setProbability(candidate.probability())
          .setRevision(series.revision(
              originalIndex(compacted, candidate.index())))
          .build();

      final ChangePoint change_point = ChangePoint.newBuilder()
          .setIdentifier(series.id())
          .setSuspectRevision(suspect_revision)
          .setAllSuspectRevisions(all_suspect_revisions)
          .setProbability(1.0 - candidate.probability())
          .setOrder(series.order(suspect_index))
          .setCreateTime(series.createTime(suspect_index))
          .setValue(series.value(suspect_index))
          .setOrderOfChangePoint(order_of_change_point)
          .setStatistics(statistics)
          .setAlgorithm(algorithm)
          .setRangeFinder(new RangeFinderMetadata(range_finder.weighting()))
          .setMagnitude(magnitude.magnitude())
          .setCategory(magnitude.category())
          .setTaskId(series.taskId(suspect_index))
          .setVersionId(series.versionId(suspect_index))
          .build();
      change_points.add(change_point);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Assembled " + change_point + " from " + range);
      }
    }
    return change_points;
  }

  /** @return The resolver chain. */
  public FallbackGitHistoryResolver resolver() {
    return resolver;
  }

  public RangeFinder rangeFinder() {
    return range_finder;
  }

  private static ChangePointRange findRange(
      final List<ChangePointRange> ranges, final int index) {
    for (final ChangePointRange range : ranges) {
      if (range.index() == index) {
        return range;
      }
    }
    throw new IllegalStateException("No range for index " + index);
  }

  private static int originalIndex(final CompactedSeries compacted,
                                   final int compacted_index) {
    if (compacted_index < 0 || compacted_index >= compacted.size()) {
      throw new IllegalDataException("Boundary " + compacted_index 
          + " is outside the compacted series of " + compacted.size() 
          + " points for " + compacted.original().id());
    }
    return compacted.originalIndex(compacted_index);
  }
}
