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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.perfsignal.data.TestIdentifier;
import net.perfsignal.exceptions.IllegalDataException;
import net.perfsignal.exceptions.TransientStorageException;

public class TestChangePointBatch {
  private static final TestIdentifier ID_A = id("a");
  private static final TestIdentifier ID_B = id("b");
  private static final TestIdentifier ID_C = id("c");

  private ChangePointComputer computer;
  private ChangePointBatch batch;

  @Before
  public void before() throws Exception {
    computer = mock(ChangePointComputer.class);
    batch = new ChangePointBatch(computer, 2);
  }

  @After
  public void after() throws Exception {
    batch.shutdown();
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNoWorkers() throws Exception {
    new ChangePointBatch(computer, 0);
  }

  @Test
  public void allSucceed() throws Exception {
    when(computer.compute(ID_A)).thenReturn(new ComputeResult(ID_A, 10, 1, true));
    when(computer.compute(ID_B)).thenReturn(new ComputeResult(ID_B, 20, 2, false));
    final BatchSummary summary = batch.compute(Arrays.asList(ID_A, ID_B))
        .join(10000);
    assertEquals(2, summary.size());
    assertEquals(2, summary.successes().size());
    assertTrue(summary.failures().isEmpty());
  }

  @Test
  public void failuresAreIsolated() throws Exception {
    final IllegalDataException bad = new IllegalDataException("bad data");
    final TransientStorageException down = 
        new TransientStorageException("down");
    when(computer.compute(ID_A)).thenThrow(bad);
    when(computer.compute(ID_B)).thenReturn(new ComputeResult(ID_B, 20, 2, true));
    when(computer.compute(ID_C)).thenThrow(down);

    final BatchSummary summary = batch.compute(
        Arrays.asList(ID_A, ID_B, ID_C)).join(10000);
    assertEquals(3, summary.size());
    assertEquals(1, summary.successes().size());
    assertEquals(ID_B, summary.successes().get(0).id());
    assertEquals(2, summary.failures().size());
    assertSame(bad, summary.failures().get(ID_A));
    assertSame(down, summary.failures().get(ID_C));
  }

  @Test
  public void errorIsReportedAsAFailure() throws Exception {
    final OutOfMemoryError oom = new OutOfMemoryError("Java heap space");
    when(computer.compute(ID_A)).thenThrow(oom);
    when(computer.compute(ID_B)).thenReturn(new ComputeResult(ID_B, 20, 2, true));

    final BatchSummary summary = batch.compute(Arrays.asList(ID_A, ID_B))
        .join(10000);
    assertEquals(2, summary.size());
    assertEquals(ID_B, summary.successes().get(0).id());
    assertSame(oom, summary.failures().get(ID_A));
  }

  @Test
  public void empty() throws Exception {
    final BatchSummary summary = batch.compute(
        Collections.<TestIdentifier>emptyList()).join(10000);
    assertEquals(0, summary.size());
  }

  private static TestIdentifier id(final String test) {
    return TestIdentifier.newBuilder()
        .setProject("sys-perf")
        .setVariant("linux-standalone")
        .setTask("bestbuy_query")
        .setTest(test)
        .setThreadLevel("max")
        .build();
  }
}
