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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.perfsignal.exceptions.GitHashResolutionException;

/**
 * Tries each resolver in turn and returns the first answer. When they all
 * fail the failures are logged and an empty list is returned, so a change
 * point is still recorded without its suspect revisions.
 *
 * @since 1.0
 */
public class FallbackGitHistoryResolver implements GitHistoryResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      FallbackGitHistoryResolver.class);

  private final List<GitHistoryResolver> resolvers;

  /**
   * Default ctor.
   * @param resolvers The resolvers in order of preference. May be empty.
   */
  public FallbackGitHistoryResolver(final List<GitHistoryResolver> resolvers) {
    Preconditions.checkNotNull(resolvers, "Resolvers cannot be null.");
    this.resolvers = ImmutableList.copyOf(resolvers);
  }

  /**
   * Never throws.
   */
  @Override
  public List<String> resolve(final String older, final String newer) {
    for (final GitHistoryResolver resolver : resolvers) {
      try {
        return resolver.resolve(older, newer);
      } catch (GitHashResolutionException e) {
        LOG.warn("Failed to resolve revisions from " + older + " to " 
            + newer + " with " + resolver, e);
      } catch (RuntimeException e) {
        LOG.error("Unexpected error resolving revisions from " + older 
            + " to " + newer + " with " + resolver, e);
      }
    }
    LOG.error("Unable to resolve revisions from " + older + " to " + newer 
        + ", recording no suspect revisions.");
    return Collections.emptyList();
  }

  /** @return The resolvers in order of preference. */
  public List<GitHistoryResolver> resolvers() {
    return resolvers;
  }
}
