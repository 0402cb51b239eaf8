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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.Test;

import net.perfsignal.exceptions.IllegalDataException;
import net.perfsignal.exceptions.NumericComputationException;

/**
 * Checks shared by every calculator, compared against the direct
 * definition of the statistic.
 */
public abstract class BaseTestQHatCalculator {

  protected abstract QHatCalculator calculator();

  @Test
  public void shortSeriesAreZero() throws Exception {
    for (int length = 0; length < BaseQHatCalculator.MIN_LENGTH; length++) {
      final double[] series = new double[length];
      for (int i = 0; i < length; i++) {
        series[i] = i * 10;
      }
      final QHatValues values = calculator().calculate(series);
      assertEquals(length, values.length());
      for (final double value : values.values()) {
        assertEquals(0, value, 0);
      }
    }
  }

  @Test
  public void constantSeriesIsZero() throws Exception {
    final double[] series = new double[20];
    Arrays.fill(series, 42.5);
    for (final double value : calculator().calculate(series).values()) {
      assertEquals(0, value, 0);
    }
  }

  @Test
  public void stepPeaksAtTheStep() throws Exception {
    final double[] series = new double[30];
    for (int i = 0; i < series.length; i++) {
      series[i] = i < 15 ? 50 : 100;
    }
    final QHatValues values = calculator().calculate(series);
    final QHatCandidate candidate = values.extract();
    assertEquals(15, candidate.index());
    assertEquals(30, candidate.windowSize());
    assertEquals(75, candidate.average(), 0.000001);
    assertTrue(Double.isNaN(candidate.probability()));
    assertEquals(candidate.value() / candidate.average(), 
        candidate.valueToAvg(), 0.000001);
  }

  @Test
  public void matchesDefinition() throws Exception {
    final Random random = new Random(42);
    for (final int length : new int[] { 5, 6, 7, 13, 40 }) {
      final double[] series = new double[length];
      for (int i = 0; i < length; i++) {
        series[i] = random.nextGaussian() * 10 + (i > length / 2 ? 30 : 0);
      }
      final double[] expected = bruteForce(series);
      final double[] actual = calculator().calculate(series).values();
      assertEquals(expected.length, actual.length);
      for (int i = 0; i < expected.length; i++) {
        assertEquals("length " + length + " index " + i, expected[i], 
            actual[i], 0.0000001);
      }
    }
  }

  @Test
  public void boundariesAreZero() throws Exception {
    final double[] series = { 1, 9, 2, 8, 3, 7, 4, 6 };
    final double[] values = calculator().calculate(series).values();
    assertEquals(0, values[0], 0);
    assertEquals(0, values[1], 0);
    assertEquals(0, values[series.length - 2], 0);
    assertEquals(0, values[series.length - 1], 0);
  }

  @Test
  public void averages() throws Exception {
    final double[] series = { 1, 2, 3, 4, 5 };
    final QHatValues values = calculator().calculate(series);
    assertEquals(3, values.average(), 0);
    // sum over the full matrix of |i - j| is 40
    assertEquals(40 / 25.0, values.averageDiff(), 0.0000001);
  }

  @Test
  public void firstMaximumWins() throws Exception {
    final QHatValues values = new QHatValues(
        new double[] { 0, 0, 3, 5, 5, 0 }, 1, 1);
    assertEquals(3, values.extract().index());
    assertEquals(7, values.extract().offset(4).index());
  }

  @Test (expected = IllegalDataException.class)
  public void nanRejected() throws Exception {
    calculator().calculate(new double[] { 1, 2, Double.NaN, 4, 5, 6 });
  }

  @Test (expected = IllegalDataException.class)
  public void infinityRejected() throws Exception {
    calculator().calculate(new double[] { 1, 2, 3, 
        Double.POSITIVE_INFINITY, 5, 6 });
  }

  @Test (expected = NumericComputationException.class)
  public void overflow() throws Exception {
    calculator().calculate(new double[] { 
        Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE, 
        -Double.MAX_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE });
  }

  static double[] bruteForce(final double[] series) {
    final int length = series.length;
    final double[] values = new double[length];
    if (length < BaseQHatCalculator.MIN_LENGTH) {
      return values;
    }
    for (int n = 2; n < length - 2; n++) {
      final int m = length - n;
      double term1 = 0;
      for (int i = 0; i < n; i++) {
        for (int j = n; j < length; j++) {
          term1 += Math.abs(series[i] - series[j]);
        }
      }
      double term2 = 0;
      for (int i = 0; i < n; i++) {
        for (int k = i + 1; k < n; k++) {
          term2 += Math.abs(series[i] - series[k]);
        }
      }
      double term3 = 0;
      for (int j = n; j < length; j++) {
        for (int k = j + 1; k < length; k++) {
          term3 += Math.abs(series[j] - series[k]);
        }
      }
      final double e = (2.0 / (m * n)) * term1 
          - (2.0 / (n * (n - 1))) * term2 
          - (2.0 / (m * (m - 1))) * term3;
      values[n] = ((double) m * n / (m + n)) * e;
    }
    return values;
  }
}
