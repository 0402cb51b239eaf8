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

import com.google.common.base.MoreObjects;

/**
 * The best split of a window: its index, statistic and the normalization
 * constants of the window it came from. Once tested the candidate also
 * carries the probability that it is NOT significant.
 *
 * @since 1.0
 */
public final class QHatCandidate {
  private final int index;
  private final double value;
  private final double value_to_avg;
  private final double value_to_avg_diff;
  private final double average;
  private final double average_diff;
  private final int window_size;
  private final double probability;

  private QHatCandidate(final Builder builder) {
    index = builder.index;
    value = builder.value;
    value_to_avg = builder.value_to_avg;
    value_to_avg_diff = builder.value_to_avg_diff;
    average = builder.average;
    average_diff = builder.average_diff;
    window_size = builder.window_size;
    probability = builder.probability;
  }

  public int index() {
    return index;
  }

  public double value() {
    return value;
  }

  public double valueToAvg() {
    return value_to_avg;
  }

  public double valueToAvgDiff() {
    return value_to_avg_diff;
  }

  public double average() {
    return average;
  }

  public double averageDiff() {
    return average_diff;
  }

  public int windowSize() {
    return window_size;
  }

  /** @return The permutation test result or NaN if not tested. */
  public double probability() {
    return probability;
  }

  /**
   * @param offset The start of the window in the full series.
   * @return A copy with the index shifted into full series coordinates.
   */
  public QHatCandidate offset(final int offset) {
    return newBuilder(this).setIndex(index + offset).build();
  }

  /**
   * @param probability The probability the candidate is not significant.
   * @return A copy carrying the probability.
   */
  public QHatCandidate withProbability(final double probability) {
    return newBuilder(this).setProbability(probability).build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("index", index)
        .add("value", value)
        .add("value_to_avg", value_to_avg)
        .add("value_to_avg_diff", value_to_avg_diff)
        .add("average", average)
        .add("average_diff", average_diff)
        .add("window_size", window_size)
        .add("probability", probability)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(final QHatCandidate candidate) {
    return new Builder()
        .setIndex(candidate.index)
        .setValue(candidate.value)
        .setValueToAvg(candidate.value_to_avg)
        .setValueToAvgDiff(candidate.value_to_avg_diff)
        .setAverage(candidate.average)
        .setAverageDiff(candidate.average_diff)
        .setWindowSize(candidate.window_size)
        .setProbability(candidate.probability);
  }

  public static final class Builder {
    private int index;
    private double value;
    private double value_to_avg;
    private double value_to_avg_diff;
    private double average;
    private double average_diff;
    private int window_size;
    private double probability = Double.NaN;

    public Builder setIndex(final int index) {
      this.index = index;
      return this;
    }

    public Builder setValue(final double value) {
      this.value = value;
      return this;
    }

    public Builder setValueToAvg(final double value_to_avg) {
      this.value_to_avg = value_to_avg;
      return this;
    }

    public Builder setValueToAvgDiff(final double value_to_avg_diff) {
      this.value_to_avg_diff = value_to_avg_diff;
      return this;
    }

    public Builder setAverage(final double average) {
      this.average = average;
      return this;
    }

    public Builder setAverageDiff(final double average_diff) {
      this.average_diff = average_diff;
      return this;
    }

    public Builder setWindowSize(final int window_size) {
      this.window_size = window_size;
      return this;
    }

    public Builder setProbability(final double probability) {
      this.probability = probability;
      return this;
    }

    public QHatCandidate build() {
      return new QHatCandidate(this);
    }
  }
}
