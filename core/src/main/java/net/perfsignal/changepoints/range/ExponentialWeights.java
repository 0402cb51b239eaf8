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
package net.perfsignal.changepoints.range;

import org.apache.commons.math3.distribution.ExponentialDistribution;

import com.google.common.base.Preconditions;

/**
 * Generates exponentially decaying weights from the density of the standard
 * exponential distribution. Up to 100 points are spaced linearly from 1 to
 * the {@code 1 - weighting} quantile, every tenth density value is kept and
 * the result is normalized so the first weight is 1.
 * <p>
 * A smaller weighting decays faster, e.g. 0.001 gives roughly
 * 1, .55, .30, .17, .09 while 0.1 gives 1, .87, .77, .67, .59.
 *
 * @since 1.0
 */
public final class ExponentialWeights {

  /** The default weighting. */
  public static final double DEFAULT_WEIGHTING = 0.001;

  /** The most points spaced over the quantile range. */
  public static final int MAX_POINTS = 100;

  /** Keep every n'th density value. */
  public static final int STRIDE = 10;

  /** Standard exponential, the density and quantile are stateless. */
  private static final ExponentialDistribution STANDARD =
      new ExponentialDistribution(1.0);

  private ExponentialWeights() {
    // static utility
  }

  /**
   * Computes the decaying weights. Callers flip the result when the decay
   * should run the other way.
   * @param size The number of points the weights are for, at least 1.
   * @param weighting The weighting, between 0 and 1 exclusive.
   * @return {@code ceil(min(size, 100) / 10)} weights starting with 1.
   */
  public static double[] exponential(final int size, final double weighting) {
    Preconditions.checkArgument(size > 0, "Size must be greater than 0: %s", 
        size);
    Preconditions.checkArgument(weighting > 0 && weighting < 1,
        "Weighting must be between 0 and 1: %s", weighting);
    final int points = Math.min(size, MAX_POINTS);
    final double upper = STANDARD.inverseCumulativeProbability(1 - weighting);

    final double[] pdf = new double[points];
    final double step = points > 1 ? (upper - 1.0) / (points - 1) : 0;
    for (int i = 0; i < points; i++) {
      final double x = i == points - 1 && points > 1 ? upper : 1.0 + i * step;
      pdf[i] = STANDARD.density(x);
    }

    final double[] weights = new double[(points + STRIDE - 1) / STRIDE];
    for (int i = 0; i < weights.length; i++) {
      weights[i] = pdf[i * STRIDE] / pdf[0];
    }
    return weights;
  }

  /**
   * @param weights The weights to reverse.
   * @return A new reversed array.
   */
  public static double[] flip(final double[] weights) {
    final double[] flipped = new double[weights.length];
    for (int i = 0; i < weights.length; i++) {
      flipped[i] = weights[weights.length - 1 - i];
    }
    return flipped;
  }
}
