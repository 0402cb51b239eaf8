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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.perfsignal.git.GitHubHistoryResolver;
import net.perfsignal.git.LocalGitHistoryResolver;
import net.perfsignal.storage.MemoryChangePointStore;
import net.perfsignal.storage.MemoryPerformanceDataStore;
import net.perfsignal.utils.Config;

public class TestChangePointComponents {
  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private Config config;
  private CloseableHttpAsyncClient client;

  @Before
  public void before() throws Exception {
    config = new Config(false);
    client = mock(CloseableHttpAsyncClient.class);
  }

  @Test
  public void defaults() throws Exception {
    final ChangePointComputer computer = components().computer();
    assertEquals(0.05, computer.eDivisive().pvalue(), 0);
    assertEquals(100, computer.eDivisive().permutations());
    assertEquals(1234, computer.eDivisive().seed());
    assertEquals(0.001, computer.assembler().rangeFinder().weighting(), 0);
    assertEquals(1, computer.assembler().rangeFinder().bounds());
    assertEquals(3, computer.retry().attempts());
    assertEquals(5000, computer.retry().delayMs());
    assertNull(computer.minPoints());
    assertEquals(1, computer.assembler().resolver().resolvers().size());
    assertTrue(computer.assembler().resolver().resolvers().get(0) 
        instanceof GitHubHistoryResolver);
    verify(client).start();
  }

  @Test
  public void overrides() throws Exception {
    config.overrideConfig(Config.PVALUE_KEY, "0.01");
    config.overrideConfig(Config.PERMUTATIONS_KEY, "50");
    config.overrideConfig(Config.MIN_POINTS_KEY, "-500");
    config.overrideConfig(Config.RETRY_ATTEMPTS_KEY, "5");
    config.overrideConfig(Config.QHAT_IMPLEMENTATION_KEY, "streaming");
    config.overrideConfig(Config.GIT_REPOSITORY_KEY, 
        folder.getRoot().getPath());
    final ChangePointComputer computer = components().computer();
    assertEquals(0.01, computer.eDivisive().pvalue(), 0);
    assertEquals(50, computer.eDivisive().permutations());
    assertEquals(Integer.valueOf(-500), computer.minPoints());
    assertEquals(5, computer.retry().attempts());
    assertEquals("STREAMING", computer.eDivisive().calculator().toString());
    assertEquals(2, computer.assembler().resolver().resolvers().size());
    assertTrue(computer.assembler().resolver().resolvers().get(0) 
        instanceof LocalGitHistoryResolver);
  }

  @Test
  public void noRemote() throws Exception {
    config.overrideConfig(Config.GITHUB_API_KEY, "");
    final ChangePointComputer computer = components().computer();
    assertTrue(computer.assembler().resolver().resolvers().isEmpty());
    verify(client, never()).start();
  }

  @Test
  public void close() throws Exception {
    final ChangePointComponents components = components();
    components.close();
    verify(client).close();
  }

  @Test (expected = IllegalArgumentException.class)
  public void unknownImplementation() throws Exception {
    config.overrideConfig(Config.QHAT_IMPLEMENTATION_KEY, "fft");
    components();
  }

  @Test
  public void badNumberClosesTheClient() throws Exception {
    config.overrideConfig(Config.PERMUTATIONS_KEY, "many");
    try {
      components();
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }
    verify(client).close();
  }

  @Test
  public void unknownImplementationClosesTheClient() throws Exception {
    config.overrideConfig(Config.QHAT_IMPLEMENTATION_KEY, "fft");
    try {
      components();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    verify(client).close();
  }

  private ChangePointComponents components() {
    return new ChangePointComponents(config, new MemoryPerformanceDataStore(),
        new MemoryChangePointStore(), client);
  }
}
