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

import org.apache.commons.math3.stat.StatUtils;

import net.perfsignal.exceptions.IllegalDataException;
import net.perfsignal.exceptions.NumericComputationException;

/**
 * The incremental QHat scan shared by the calculators. Subclasses only
 * decide how the pairwise absolute differences are obtained.
 * <p>
 * The three terms are seeded for the split at 2 and then updated in O(n)
 * per split by moving point {@code n - 1} from the right block to the left
 * block, giving an O(n^2) scan overall.
 *
 * @since 1.0
 */
public abstract class BaseQHatCalculator implements QHatCalculator {

  /** Series shorter than this produce a zero statistic vector. */
  public static final int MIN_LENGTH = 5;

  /** Access to the pairwise absolute differences of one series. */
  protected interface Differences {
    /** @return |series[i] - series[j]| */
    public double get(final int i, final int j);

    /** @return The mean over the full n x n difference matrix. */
    public double average();
  }

  /**
   * @param series A non-null series of finite values with at least
   * {@link #MIN_LENGTH} entries.
   * @return The differences for the series.
   */
  protected abstract Differences differences(final double[] series);

  @Override
  public QHatValues calculate(final double[] series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    for (int i = 0; i < series.length; i++) {
      if (!Double.isFinite(series[i])) {
        throw new IllegalDataException("Series value at index " + i 
            + " is not finite: " + series[i]);
      }
    }

    final int length = series.length;
    final double[] qhat_values = new double[length];
    if (length < MIN_LENGTH) {
      return new QHatValues(qhat_values, 1, 1);
    }

    final Differences diffs = differences(series);
    final double average = StatUtils.mean(series);
    final double average_diff = diffs.average();
    if (!Double.isFinite(average) || !Double.isFinite(average_diff)) {
      throw new NumericComputationException("Averages overflowed: average=" 
          + average + " average_diff=" + average_diff, -1);
    }

    int n = 2;
    double term1 = 0;
    for (int i = 0; i < n; i++) {
      for (int j = n; j < length; j++) {
        term1 += diffs.get(i, j);
      }
    }
    double term2 = diffs.get(0, 1);
    double term3 = 0;
    for (int i = n; i < length; i++) {
      for (int j = i + 1; j < length; j++) {
        term3 += diffs.get(i, j);
      }
    }
    qhat_values[n] = statistic(term1, term2, term3, length - n, n);

    for (n = 3; n < length - 2; n++) {
      double column_delta = 0;
      for (int i = 0; i < n - 1; i++) {
        column_delta += diffs.get(n - 1, i);
      }
      double row_delta = 0;
      for (int j = n; j < length; j++) {
        row_delta += diffs.get(j, n - 1);
      }
      term1 = term1 - column_delta + row_delta;
      term2 = term2 + column_delta;
      term3 = term3 - row_delta;
      qhat_values[n] = statistic(term1, term2, term3, length - n, n);
    }
    return new QHatValues(qhat_values, average, average_diff);
  }

  /**
   * Combines the terms for the split with {@code n} points on the left and
   * {@code m} on the right. Terms whose denominator is zero contribute zero.
   * @param term1 The sum of the differences across the split.
   * @param term2 The sum of the differences within the left block.
   * @param term3 The sum of the differences within the right block.
   * @param m The size of the right block.
   * @param n The size of the left block.
   * @return The statistic.
   * @throws NumericComputationException if the result is not finite.
   */
  static double statistic(final double term1,
                          final double term2,
                          final double term3,
                          final int m,
                          final int n) {
    final double mn = (double) m * n;
    final double term1_reg = term1 * (2.0 / mn);
    final double term2_reg = n > 1 ? term2 * (2.0 / ((double) n * (n - 1))) : 0;
    final double term3_reg = m > 1 ? term3 * (2.0 / ((double) m * (m - 1))) : 0;
    final double q = (mn / (m + n)) * (term1_reg - term2_reg - term3_reg);
    if (!Double.isFinite(q)) {
      throw new NumericComputationException("QHat statistic was not finite "
          + "at split " + n + ": " + q, n);
    }
    return q;
  }
}
