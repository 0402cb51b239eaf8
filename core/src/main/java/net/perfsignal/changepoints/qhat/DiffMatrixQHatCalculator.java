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
 * Precomputes the full n x n absolute difference matrix. Fastest for the
 * window sizes seen in practice at the cost of O(n^2) memory.
 *
 * @since 1.0
 */
public class DiffMatrixQHatCalculator extends BaseQHatCalculator {

  @Override
  protected Differences differences(final double[] series) {
    final int length = series.length;
    final double[][] matrix = new double[length][length];
    double sum = 0;
    for (int i = 0; i < length; i++) {
      for (int j = i + 1; j < length; j++) {
        final double diff = Math.abs(series[i] - series[j]);
        matrix[i][j] = diff;
        matrix[j][i] = diff;
        sum += 2 * diff;
      }
    }
    final double average = sum / ((double) length * length);
    return new Differences() {
      @Override
      public double get(final int i, final int j) {
        return matrix[i][j];
      }

      @Override
      public double average() {
        return average;
      }
    };
  }

  @Override
  public String toString() {
    return QHatImplementation.DIFF_MATRIX.name();
  }
}
