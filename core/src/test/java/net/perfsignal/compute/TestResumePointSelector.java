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
package net.perfsignal.compute;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import net.perfsignal.changepoints.SeriesFixtures;
import net.perfsignal.data.TestIdentifier;
import net.perfsignal.storage.ChangePointStore;
import net.perfsignal.storage.OrderBucket;
import net.perfsignal.storage.PerformanceDataStore;

public class TestResumePointSelector {
  private static final TestIdentifier ID = SeriesFixtures.ID;

  private PerformanceDataStore data_store;
  private ChangePointStore change_point_store;
  private ResumePointSelector selector;

  @Before
  public void before() throws Exception {
    data_store = mock(PerformanceDataStore.class);
    change_point_store = mock(ChangePointStore.class);
    selector = new ResumePointSelector(data_store, change_point_store);
  }

  @Test
  public void noMinimum() throws Exception {
    assertNull(selector.select(ID, null));
    assertNull(selector.select(ID, 0));
    verifyNoInteractions(data_store);
    verifyNoInteractions(change_point_store);
  }

  @Test
  public void withChangePoints() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Arrays.asList(150L, 250L));
    when(data_store.countByOrderBuckets(ID, 
        Arrays.asList(0L, 150L, 250L, Long.MAX_VALUE)))
      .thenReturn(Arrays.asList(
          new OrderBucket(250, 3), 
          new OrderBucket(150, 10), 
          new OrderBucket(0, 5)));

    assertEquals(Long.valueOf(250), selector.select(ID, 2));
    assertEquals(Long.valueOf(250), selector.select(ID, 3));
    assertEquals(Long.valueOf(150), selector.select(ID, 4));
    assertEquals(Long.valueOf(150), selector.select(ID, 13));
    assertEquals(Long.valueOf(150), selector.select(ID, -5));
    // only reached in the bucket before the first change point
    assertNull(selector.select(ID, 15));
    // never reached
    assertNull(selector.select(ID, 100));
    verify(data_store, never()).countPoints(ID);
  }

  @Test
  public void withChangePointsEmptyBuckets() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Arrays.asList(150L));
    when(data_store.countByOrderBuckets(ID, 
        Arrays.asList(0L, 150L, Long.MAX_VALUE)))
      .thenReturn(Collections.<OrderBucket>emptyList());
    assertNull(selector.select(ID, 1));
  }

  @Test
  public void withChangePointAtOrderZero() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Arrays.asList(0L, 10L));
    when(data_store.countByOrderBuckets(ID, 
        Arrays.asList(0L, 10L, Long.MAX_VALUE)))
      .thenReturn(Arrays.asList(
          new OrderBucket(10, 1), 
          new OrderBucket(0, 4)));
    assertEquals(Long.valueOf(0), selector.select(ID, 3));
  }

  @Test
  public void withoutChangePointsPositiveMinimum() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Collections.<Long>emptyList());
    assertNull(selector.select(ID, 5));
    verifyNoInteractions(data_store);
  }

  @Test
  public void withoutChangePointsNegativeMinimum() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Collections.<Long>emptyList());
    when(data_store.countPoints(ID)).thenReturn(10L);
    when(data_store.orderOfNewest(ID, 2)).thenReturn(370L);
    assertEquals(Long.valueOf(370), selector.select(ID, -3));
    assertNull(selector.select(ID, -11));
    verify(data_store, never()).countByOrderBuckets(ID, 
        Collections.<Long>emptyList());
  }

  @Test
  public void withoutChangePointsNoData() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Collections.<Long>emptyList());
    when(data_store.countPoints(ID)).thenReturn(0L);
    assertNull(selector.select(ID, -1));
    verify(data_store, never()).orderOfNewest(ID, 0);
  }

  @Test
  public void withoutChangePointsAllPoints() throws Exception {
    when(change_point_store.changePointOrders(ID))
        .thenReturn(Collections.<Long>emptyList());
    when(data_store.countPoints(ID)).thenReturn(10L);
    when(data_store.orderOfNewest(ID, 9)).thenReturn(100L);
    assertEquals(Long.valueOf(100), selector.select(ID, -10));
  }

  @Test (expected = NullPointerException.class)
  public void nullIdentifier() throws Exception {
    selector.select(null, 5);
  }
}
