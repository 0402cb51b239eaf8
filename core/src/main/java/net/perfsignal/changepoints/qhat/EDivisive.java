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
package net.perfsignal.changepoints.qhat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;

/**
 * The hierarchical E-Divisive means search. Each pass splits the series at
 * the accepted indices, finds the best candidate of every window and keeps
 * the globally best one if a permutation test says it is significant.
 * <p>
 * The permutation test pools the maxima of all shuffled windows to judge
 * the single best candidate. Shuffles draw from a {@link Random} seeded per
 * call so identical input and seed give identical results.
 * <p>
 * Instances are immutable and thread safe as long as the calculator is.
 *
 * @since 1.0
 */
public class EDivisive {
  private static final Logger LOG = LoggerFactory.getLogger(EDivisive.class);

  public static final double DEFAULT_PVALUE = 0.05;
  public static final int DEFAULT_PERMUTATIONS = 100;
  public static final long DEFAULT_SEED = 1234;

  private final QHatCalculator calculator;
  private final double pvalue;
  private final int permutations;
  private final long seed;

  /**
   * Ctor with the default significance, permutations and seed.
   * @param calculator A non-null calculator.
   */
  public EDivisive(final QHatCalculator calculator) {
    this(calculator, DEFAULT_PVALUE, DEFAULT_PERMUTATIONS, DEFAULT_SEED);
  }

  /**
   * Default ctor.
   * @param calculator A non-null calculator.
   * @param pvalue The significance level, between 0 and 1.
   * @param permutations The number of permutations, greater than 0.
   * @param seed The seed for the shuffles.
   */
  public EDivisive(final QHatCalculator calculator,
                   final double pvalue,
                   final int permutations,
                   final long seed) {
    Preconditions.checkNotNull(calculator, "Calculator cannot be null.");
    Preconditions.checkArgument(pvalue >= 0 && pvalue <= 1,
        "P-value must be between 0 and 1: %s", pvalue);
    Preconditions.checkArgument(permutations > 0,
        "Permutations must be greater than 0: %s", permutations);
    this.calculator = calculator;
    this.pvalue = pvalue;
    this.permutations = permutations;
    this.seed = seed;
  }

  /**
   * Runs the search with a generator seeded from the configured seed.
   * @param series A non-null series.
   * @return The result.
   */
  public EDivisiveResult compute(final double[] series) {
    return compute(series, new Random(seed));
  }

  /**
   * Runs the search drawing the shuffles from the given generator.
   * @param series A non-null series.
   * @param random A non-null generator, owned by this call.
   * @return The result.
   * @throws net.perfsignal.exceptions.IllegalDataException if the series
   * holds non-finite values.
   * @throws net.perfsignal.exceptions.NumericComputationException if the
   * statistic overflowed.
   */
  public EDivisiveResult compute(final double[] series, final Random random) {
    Preconditions.checkNotNull(series, "Series cannot be null.");
    Preconditions.checkNotNull(random, "Random cannot be null.");
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final int pts = series.length;

    final QHatCandidate first = calculator.calculate(series).extract();
    final double max_q = first.value();
    double min_change = max_q;

    final List<QHatCandidate> change_points = Lists.newArrayList();
    List<Integer> windows;
    while (true) {
      windows = windows(change_points, pts);

      QHatCandidate best = null;
      for (int i = 0; i < windows.size() - 1; i++) {
        final int start = windows.get(i);
        final double[] window = Arrays.copyOfRange(series, start,
            windows.get(i + 1));
        final QHatCandidate candidate =
            calculator.calculate(window).extract().offset(start);
        // ties go to the later window
        if (best == null || candidate.value() >= best.value()) {
          best = candidate;
        }
      }
      final double candidate_q = best.value();

      int above = 0;
      for (int p = 0; p < permutations; p++) {
        double permute_q = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < windows.size() - 1; i++) {
          final double[] window = Arrays.copyOfRange(series, windows.get(i),
              windows.get(i + 1));
          Collections.shuffle(Doubles.asList(window), random);
          permute_q = Math.max(permute_q,
              calculator.calculate(window).extract().value());
        }
        if (permute_q >= candidate_q) {
          above++;
        }
      }

      if (candidate_q < min_change) {
        min_change = candidate_q;
      }
      final double probability = above / (double) (permutations + 1);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Candidate " + best + " windows " + windows 
            + " probability " + probability);
      }
      if (probability > pvalue) {
        break;
      }
      if (isAccepted(change_points, best.index())) {
        // nothing left to split
        break;
      }
      change_points.add(best.withProbability(probability));
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Found " + change_points.size() + " change points in " 
          + pts + " points in " + stopwatch);
    }
    return new EDivisiveResult(change_points, windows, max_q, min_change);
  }

  public double pvalue() {
    return pvalue;
  }

  public int permutations() {
    return permutations;
  }

  public long seed() {
    return seed;
  }

  public QHatCalculator calculator() {
    return calculator;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("calculator", calculator.getClass().getSimpleName())
        .add("pvalue", pvalue)
        .add("permutations", permutations)
        .add("seed", seed)
        .toString();
  }

  /**
   * @param change_points The accepted candidates.
   * @param length The length of the series.
   * @return 0, the sorted accepted indices and the length.
   */
  static List<Integer> windows(final List<QHatCandidate> change_points,
                               final int length) {
    final List<Integer> indices = Lists.newArrayListWithCapacity(
        change_points.size() + 2);
    for (final QHatCandidate candidate : change_points) {
      indices.add(candidate.index());
    }
    Collections.sort(indices);
    indices.add(0, 0);
    indices.add(length);
    return indices;
  }

  private static boolean isAccepted(final List<QHatCandidate> change_points,
                                    final int index) {
    for (final QHatCandidate candidate : change_points) {
      if (candidate.index() == index) {
        return true;
      }
    }
    return false;
  }
}
