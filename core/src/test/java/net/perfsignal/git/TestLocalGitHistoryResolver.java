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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.perfsignal.exceptions.GitHashResolutionException;

public class TestLocalGitHistoryResolver {
  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private Process process;
  private List<String> command;
  private IOException start_exception;

  @Before
  public void before() throws Exception {
    process = mock(Process.class);
    command = null;
    start_exception = null;
  }

  @Test
  public void resolve() throws Exception {
    output("abc\ndef\n\n ghi \n", 0);
    final List<String> hashes = resolver(folder.getRoot().getPath())
        .resolve("older", "newer");
    assertEquals(Arrays.asList("abc", "def", "ghi"), hashes);
    assertEquals(Arrays.asList("git", "rev-list", "older..newer"), command);
  }

  @Test
  public void resolveNothing() throws Exception {
    output("", 0);
    assertTrue(resolver(folder.getRoot().getPath())
        .resolve("older", "newer").isEmpty());
  }

  @Test
  public void nonZeroExit() throws Exception {
    output("fatal: bad revision\n", 128);
    try {
      resolver(folder.getRoot().getPath()).resolve("older", "newer");
      fail("Expected GitHashResolutionException");
    } catch (GitHashResolutionException e) {
      assertEquals("older", e.older());
      assertEquals("newer", e.newer());
    }
  }

  @Test
  public void startFailure() throws Exception {
    start_exception = new IOException("no git");
    try {
      resolver(folder.getRoot().getPath()).resolve("older", "newer");
      fail("Expected GitHashResolutionException");
    } catch (GitHashResolutionException e) {
      assertEquals(start_exception, e.getCause());
    }
  }

  @Test
  public void readFailureDestroysTheProcess() throws Exception {
    final IOException broken = new IOException("Broken pipe");
    when(process.getInputStream()).thenReturn(new InputStream() {
      @Override
      public int read() throws IOException {
        throw broken;
      }
    });
    try {
      resolver(folder.getRoot().getPath()).resolve("older", "newer");
      fail("Expected GitHashResolutionException");
    } catch (GitHashResolutionException e) {
      assertSame(broken, e.getCause());
    }
    verify(process).destroy();
    verify(process, never()).waitFor();
  }

  @Test
  public void interruptDestroysTheProcess() throws Exception {
    when(process.getInputStream()).thenReturn(new ByteArrayInputStream(
        new byte[0]));
    when(process.waitFor()).thenThrow(new InterruptedException());
    try {
      resolver(folder.getRoot().getPath()).resolve("older", "newer");
      fail("Expected GitHashResolutionException");
    } catch (GitHashResolutionException e) {
      assertTrue(e.getCause() instanceof InterruptedException);
    }
    // clears the flag for the following tests
    assertTrue(Thread.interrupted());
    verify(process).destroy();
  }

  @Test
  public void noRepository() throws Exception {
    for (final String path : new String[] { null, "", 
        folder.getRoot().getPath() + "/missing" }) {
      try {
        resolver(path).resolve("older", "newer");
        fail("Expected GitHashResolutionException");
      } catch (GitHashResolutionException e) {
        assertNull(command);
      }
    }
  }

  private void output(final String output, final int exit) throws Exception {
    when(process.getInputStream()).thenReturn(new ByteArrayInputStream(
        output.getBytes(StandardCharsets.UTF_8)));
    when(process.waitFor()).thenReturn(exit);
  }

  private LocalGitHistoryResolver resolver(final String path) {
    return new LocalGitHistoryResolver(path) {
      @Override
      protected Process start(final List<String> cmd) throws IOException {
        command = cmd;
        if (start_exception != null) {
          throw start_exception;
        }
        return process;
      }
    };
  }
}
