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
 * Computes the E-Divisive QHat divergence statistic for every split of a
 * series. Implementations must be stateless and return identical values
 * for identical input.
 *
 * @since 1.0
 */
public interface QHatCalculator {

  /**
   * Computes the statistic for each split {@code n} of the series where
   * {@code 2 <= n <= length - 3}. Other positions are zero. Series shorter
   * than {@link BaseQHatCalculator#MIN_LENGTH} yield all zeros with both
   * averages defaulted to 1.
   *
   * @param series A non-null series, may be empty.
   * @return The statistic vector and its normalization constants.
   * @throws net.perfsignal.exceptions.IllegalDataException if the series
   * holds a NaN or infinite value.
   * @throws net.perfsignal.exceptions.NumericComputationException if the
   * computation overflowed.
   */
  public QHatValues calculate(final double[] series);

}
