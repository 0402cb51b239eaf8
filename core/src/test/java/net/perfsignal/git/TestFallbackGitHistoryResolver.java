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
package net.perfsignal.git;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import net.perfsignal.exceptions.GitHashResolutionException;

public class TestFallbackGitHistoryResolver {
  private GitHistoryResolver local;
  private GitHistoryResolver remote;

  @Before
  public void before() throws Exception {
    local = mock(GitHistoryResolver.class);
    remote = mock(GitHistoryResolver.class);
  }

  @Test
  public void firstWins() throws Exception {
    when(local.resolve("a", "b")).thenReturn(Arrays.asList("b", "x"));
    final FallbackGitHistoryResolver resolver = 
        new FallbackGitHistoryResolver(Arrays.asList(local, remote));
    assertEquals(Arrays.asList("b", "x"), resolver.resolve("a", "b"));
    verify(remote, never()).resolve("a", "b");
  }

  @Test
  public void fallsThrough() throws Exception {
    when(local.resolve("a", "b")).thenThrow(
        new GitHashResolutionException("no checkout", "a", "b", null));
    when(remote.resolve("a", "b")).thenReturn(Arrays.asList("b"));
    assertEquals(Arrays.asList("b"), new FallbackGitHistoryResolver(
        Arrays.asList(local, remote)).resolve("a", "b"));
  }

  @Test
  public void unexpectedErrorsFallThrough() throws Exception {
    when(local.resolve("a", "b")).thenThrow(new IllegalStateException("boom"));
    when(remote.resolve("a", "b")).thenReturn(Arrays.asList("b"));
    assertEquals(Arrays.asList("b"), new FallbackGitHistoryResolver(
        Arrays.asList(local, remote)).resolve("a", "b"));
  }

  @Test
  public void allFail() throws Exception {
    when(local.resolve("a", "b")).thenThrow(
        new GitHashResolutionException("no checkout", "a", "b", null));
    when(remote.resolve("a", "b")).thenThrow(
        new GitHashResolutionException("rate limited", "a", "b", null));
    assertTrue(new FallbackGitHistoryResolver(Arrays.asList(local, remote))
        .resolve("a", "b").isEmpty());
  }

  @Test
  public void noResolvers() throws Exception {
    assertTrue(new FallbackGitHistoryResolver(
        Collections.<GitHistoryResolver>emptyList())
        .resolve("a", "b").isEmpty());
  }
}
