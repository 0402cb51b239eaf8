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

/**
 * The statistic vector for a series along with the mean of the series and
 * the mean of its pairwise absolute differences.
 *
 * @since 1.0
 */
public final class QHatValues {
  private final double[] values;
  private final double average;
  private final double average_diff;

  /**
   * Default ctor.
   * @param values The statistic per split, not copied.
   * @param average The mean of the series.
   * @param average_diff The mean of the n x n absolute difference matrix.
   */
  public QHatValues(final double[] values,
                    final double average,
                    final double average_diff) {
    this.values = values;
    this.average = average;
    this.average_diff = average_diff;
  }

  /** @return The statistic per split. Do not modify. */
  public double[] values() {
    return values;
  }

  public double average() {
    return average;
  }

  public double averageDiff() {
    return average_diff;
  }

  /** @return The length of the series. */
  public int length() {
    return values.length;
  }

  /**
   * Finds the split with the largest statistic. Ties resolve to the first
   * index. An empty vector yields index 0 with a value of 0.
   * @return The candidate with its normalizations. The value to average
   * ratios are NaN when the corresponding average is 0.
   */
  public QHatCandidate extract() {
    int max_index = 0;
    double max = 0;
    if (values.length > 0) {
      max = values[0];
      for (int i = 1; i < values.length; i++) {
        if (values[i] > max) {
          max = values[i];
          max_index = i;
        }
      }
    }
    return QHatCandidate.newBuilder()
        .setIndex(max_index)
        .setValue(max)
        .setValueToAvg(average != 0 ? max / average : Double.NaN)
        .setValueToAvgDiff(average_diff != 0 ? max / average_diff : Double.NaN)
        .setAverage(average)
        .setAverageDiff(average_diff)
        .setWindowSize(values.length)
        .build();
  }
}
