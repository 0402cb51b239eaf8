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
 * Computes each absolute difference when it is needed, keeping memory
 * linear in the length of the series.
 *
 * @since 1.0
 */
public class StreamingQHatCalculator extends BaseQHatCalculator {

  @Override
  protected Differences differences(final double[] series) {
    final int length = series.length;
    double sum = 0;
    for (int i = 0; i < length; i++) {
      for (int j = i + 1; j < length; j++) {
        sum += 2 * Math.abs(series[i] - series[j]);
      }
    }
    final double average = sum / ((double) length * length);
    return new Differences() {
      @Override
      public double get(final int i, final int j) {
        return Math.abs(series[i] - series[j]);
      }

      @Override
      public double average() {
        return average;
      }
    };
  }

  @Override
  public String toString() {
    return QHatImplementation.STREAMING.name();
  }
}
