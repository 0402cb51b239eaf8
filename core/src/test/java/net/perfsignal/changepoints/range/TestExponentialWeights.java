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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestExponentialWeights {
  private static final double EPSILON = 0.00001;

  @Test
  public void defaultWeighting() throws Exception {
    assertArrayEquals(new double[] { 1, 0.5506, 0.30316, 0.16692, 0.09191, 
        0.0506, 0.02786, 0.01534, 0.00845, 0.00465 },
        ExponentialWeights.exponential(100, 0.001), EPSILON);
  }

  @Test
  public void smallerWeighting() throws Exception {
    final double[] weights = ExponentialWeights.exponential(100, 0.0001);
    assertEquals(10, weights.length);
    assertEquals(1, weights[0], EPSILON);
    assertEquals(0.43634, weights[1], EPSILON);
    assertEquals(0.19039, weights[2], EPSILON);
    assertEquals(0.08308, weights[3], EPSILON);
  }

  @Test
  public void largerWeighting() throws Exception {
    final double[] weights = ExponentialWeights.exponential(100, 0.1);
    assertEquals(1, weights[0], EPSILON);
    assertEquals(0.87671, weights[1], 0.0001);
    assertEquals(0.76863, weights[2], 0.0001);
    assertEquals(0.67387, weights[3], 0.0001);
  }

  @Test
  public void lengths() throws Exception {
    assertEquals(1, ExponentialWeights.exponential(1, 0.001).length);
    assertEquals(1, ExponentialWeights.exponential(10, 0.001).length);
    assertEquals(2, ExponentialWeights.exponential(11, 0.001).length);
    assertEquals(5, ExponentialWeights.exponential(45, 0.001).length);
    assertEquals(10, ExponentialWeights.exponential(500, 0.001).length);
  }

  @Test
  public void singlePoint() throws Exception {
    assertArrayEquals(new double[] { 1 }, 
        ExponentialWeights.exponential(1, 0.001), 0);
  }

  @Test
  public void decreasing() throws Exception {
    final double[] weights = ExponentialWeights.exponential(73, 0.001);
    for (int i = 1; i < weights.length; i++) {
      assertEquals(true, weights[i] < weights[i - 1]);
    }
  }

  @Test
  public void flip() throws Exception {
    assertArrayEquals(new double[] { 3, 2, 1 }, 
        ExponentialWeights.flip(new double[] { 1, 2, 3 }), 0);
    assertArrayEquals(new double[0], 
        ExponentialWeights.flip(new double[0]), 0);
  }

  @Test (expected = IllegalArgumentException.class)
  public void zeroSize() throws Exception {
    ExponentialWeights.exponential(0, 0.001);
  }

  @Test (expected = IllegalArgumentException.class)
  public void weightingOutOfRange() throws Exception {
    ExponentialWeights.exponential(10, 1.5);
  }
}
