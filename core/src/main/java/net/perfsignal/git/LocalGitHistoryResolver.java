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

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.CharStreams;

import net.perfsignal.exceptions.GitHashResolutionException;

/**
 * Runs {@code git rev-list older..newer} in a local checkout.
 *
 * @since 1.0
 */
public class LocalGitHistoryResolver implements GitHistoryResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      LocalGitHistoryResolver.class);

  private final File repository;

  /**
   * Default ctor.
   * @param repository The path to the checkout. If null or empty every
   * resolution fails.
   */
  public LocalGitHistoryResolver(final String repository) {
    this.repository = Strings.isNullOrEmpty(repository) 
        ? null : new File(repository);
  }

  @Override
  public List<String> resolve(final String older, final String newer)
      throws GitHashResolutionException {
    if (repository == null || !repository.isDirectory()) {
      throw new GitHashResolutionException("No local repository at " 
          + repository, older, newer, null);
    }
    final List<String> command = ImmutableList.of(
        "git", "rev-list", older + ".." + newer);
    final String output;
    final int exit;
    final Process process;
    try {
      process = start(command);
    } catch (IOException e) {
      throw new GitHashResolutionException("Failed to run " + command, older,
          newer, e);
    }
    try {
      try (final Reader reader = new InputStreamReader(
          process.getInputStream(), StandardCharsets.UTF_8)) {
        output = CharStreams.toString(reader);
      }
      exit = process.waitFor();
    } catch (IOException e) {
      process.destroy();
      throw new GitHashResolutionException("Failed reading the output of " 
          + command, older, newer, e);
    } catch (InterruptedException e) {
      process.destroy();
      Thread.currentThread().interrupt();
      throw new GitHashResolutionException("Interrupted running " + command,
          older, newer, e);
    }
    if (exit != 0) {
      throw new GitHashResolutionException(command + " exited with " + exit,
          older, newer, null);
    }

    final List<String> hashes = Lists.newArrayList(Splitter.on('\n')
        .trimResults()
        .omitEmptyStrings()
        .split(output));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved " + hashes.size() + " revisions from " + older 
          + " to " + newer + " in " + repository);
    }
    return hashes;
  }

  /**
   * Starts the command in the repository with stderr folded into the
   * discarded stream.
   * @param command The command to run.
   * @return The started process.
   * @throws IOException if the process could not be started.
   */
  @VisibleForTesting
  protected Process start(final List<String> command) throws IOException {
    return new ProcessBuilder(command)
        .directory(repository)
        .redirectError(ProcessBuilder.Redirect.DISCARD)
        .start();
  }

  @Override
  public String toString() {
    return "LocalGitHistoryResolver[" + repository + "]";
  }
}
