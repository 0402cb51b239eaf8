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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.perfsignal.exceptions.IllegalDataException;

public class TestEDivisive {

  @Test
  public void ctorDefaults() throws Exception {
    final EDivisive e_divisive = new EDivisive(new DiffMatrixQHatCalculator());
    assertEquals(0.05, e_divisive.pvalue(), 0);
    assertEquals(100, e_divisive.permutations());
    assertEquals(1234, e_divisive.seed());
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorPValueTooLarge() throws Exception {
    new EDivisive(new DiffMatrixQHatCalculator(), 1.5, 100, 1);
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorPValueNegative() throws Exception {
    new EDivisive(new DiffMatrixQHatCalculator(), -0.1, 100, 1);
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorZeroPermutations() throws Exception {
    new EDivisive(new DiffMatrixQHatCalculator(), 0.05, 0, 1);
  }

  @Test (expected = NullPointerException.class)
  public void ctorNullCalculator() throws Exception {
    new EDivisive(null);
  }

  @Test
  public void empty() throws Exception {
    final EDivisiveResult result = new EDivisive(
        new DiffMatrixQHatCalculator()).compute(new double[0]);
    assertTrue(result.changePoints().isEmpty());
    assertEquals(Arrays.asList(0, 0), result.windows());
  }

  @Test
  public void constant() throws Exception {
    final double[] series = new double[30];
    Arrays.fill(series, 50);
    final EDivisiveResult result = new EDivisive(
        new DiffMatrixQHatCalculator()).compute(series);
    assertTrue(result.changePoints().isEmpty());
    assertEquals(0, result.maxQ(), 0);
  }

  @Test
  public void singleStep() throws Exception {
    final double[] series = new double[30];
    for (int i = 0; i < series.length; i++) {
      series[i] = i < 15 ? 50 : 100;
    }
    final EDivisiveResult result = new EDivisive(
        new DiffMatrixQHatCalculator()).compute(series);
    assertEquals(1, result.changePoints().size());
    final QHatCandidate candidate = result.changePoints().get(0);
    assertEquals(15, candidate.index());
    assertEquals(0, candidate.probability(), 0);
    assertEquals(30, candidate.windowSize());
    assertEquals(result.maxQ(), candidate.value(), 0);
    assertEquals(Arrays.asList(0, 15, 30), result.windows());
    // the rejected pass over the constant halves
    assertEquals(0, result.minChange(), 0);
  }

  @Test
  public void twoSteps() throws Exception {
    final double[] series = new double[60];
    for (int i = 0; i < series.length; i++) {
      series[i] = i >= 20 && i < 40 ? 50 : 10;
    }
    for (final QHatImplementation implementation : 
        QHatImplementation.values()) {
      final EDivisiveResult result = new EDivisive(
          implementation.newCalculator()).compute(series);
      assertArrayEquals(new int[] { 20, 40 }, result.sortedIndices());
      for (final QHatCandidate candidate : result.changePoints()) {
        assertEquals(0, candidate.probability(), 0);
      }
    }
  }

  @Test
  public void deterministicForSeed() throws Exception {
    final Random random = new Random(7);
    final double[] series = new double[80];
    for (int i = 0; i < series.length; i++) {
      series[i] = random.nextGaussian() * 5 + (i < 30 ? 100 : i < 60 ? 90 : 110);
    }
    final EDivisive e_divisive = new EDivisive(new DiffMatrixQHatCalculator());
    final EDivisiveResult first = e_divisive.compute(series);
    final EDivisiveResult second = e_divisive.compute(series);
    assertEquals(first.changePoints().size(), second.changePoints().size());
    assertArrayEquals(first.sortedIndices(), second.sortedIndices());
    for (int i = 0; i < first.changePoints().size(); i++) {
      assertEquals(first.changePoints().get(i).probability(), 
          second.changePoints().get(i).probability(), 0);
    }
  }

  @Test
  public void implementationsAgree() throws Exception {
    final Random random = new Random(99);
    final double[] series = new double[50];
    for (int i = 0; i < series.length; i++) {
      series[i] = random.nextDouble() * 10 + (i < 25 ? 0 : 40);
    }
    final EDivisiveResult matrix = new EDivisive(
        new DiffMatrixQHatCalculator()).compute(series);
    final EDivisiveResult streaming = new EDivisive(
        new StreamingQHatCalculator()).compute(series);
    assertArrayEquals(matrix.sortedIndices(), streaming.sortedIndices());
  }

  @Test
  public void probabilitiesWithinSignificance() throws Exception {
    final Random random = new Random(3);
    final double[] series = new double[100];
    for (int i = 0; i < series.length; i++) {
      series[i] = random.nextGaussian() + (i / 25) * 3;
    }
    final EDivisiveResult result = new EDivisive(
        new DiffMatrixQHatCalculator(), 0.01, 50, 1).compute(series);
    assertTrue(result.changePoints().size() > 0);
    for (final QHatCandidate candidate : result.changePoints()) {
      assertTrue(candidate.probability() <= 0.01);
      assertTrue(candidate.index() > 0 && candidate.index() < 100);
    }
  }

  @Test (expected = IllegalDataException.class)
  public void nonFinite() throws Exception {
    new EDivisive(new DiffMatrixQHatCalculator()).compute(
        new double[] { 1, 2, 3, Double.NaN, 5, 6, 7 });
  }

  @Test
  public void windows() throws Exception {
    final List<QHatCandidate> candidates = Lists.newArrayList(
        QHatCandidate.newBuilder().setIndex(10).build(),
        QHatCandidate.newBuilder().setIndex(5).build());
    assertEquals(Arrays.asList(0, 5, 10, 20), 
        EDivisive.windows(candidates, 20));
    assertEquals(Arrays.asList(0, 20), 
        EDivisive.windows(Lists.<QHatCandidate>newArrayList(), 20));
  }
}
