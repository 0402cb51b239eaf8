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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import net.perfsignal.changepoints.ChangePointAssembler;
import net.perfsignal.changepoints.SeriesPreprocessor;
import net.perfsignal.changepoints.qhat.EDivisive;
import net.perfsignal.changepoints.qhat.QHatImplementation;
import net.perfsignal.changepoints.range.RangeFinder;
import net.perfsignal.git.FallbackGitHistoryResolver;
import net.perfsignal.git.GitHistoryResolver;
import net.perfsignal.git.GitHubHistoryResolver;
import net.perfsignal.git.LocalGitHistoryResolver;
import net.perfsignal.storage.ChangePointStore;
import net.perfsignal.storage.PerformanceDataStore;
import net.perfsignal.utils.Config;

/**
 * Wires the computation pipeline from a {@link Config}. Owns the HTTP
 * client used by the remote history resolver so it must be closed when the
 * computer is no longer needed.
 *
 * @since 1.0
 */
public class ChangePointComponents implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChangePointComponents.class);

  private final Config config;
  private final CloseableHttpAsyncClient client;
  private final ChangePointComputer computer;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param data_store A non-null points store.
   * @param change_point_store A non-null change point store.
   * @throws NumberFormatException if a numeric setting was invalid.
   * @throws IllegalArgumentException if the QHat implementation is unknown.
   */
  public ChangePointComponents(final Config config,
                               final PerformanceDataStore data_store,
                               final ChangePointStore change_point_store) {
    this(config, data_store, change_point_store, 
        HttpAsyncClients.createDefault());
  }

  @VisibleForTesting
  ChangePointComponents(final Config config,
                        final PerformanceDataStore data_store,
                        final ChangePointStore change_point_store,
                        final CloseableHttpAsyncClient client) {
    Preconditions.checkNotNull(config, "Config cannot be null.");
    this.config = config;
    this.client = client;

    try {
      final EDivisive e_divisive = new EDivisive(
          QHatImplementation.fromString(config.getString(
              Config.QHAT_IMPLEMENTATION_KEY)).newCalculator(),
          config.getDouble(Config.PVALUE_KEY),
          config.getInt(Config.PERMUTATIONS_KEY),
          config.getLong(Config.SEED_KEY));
      final RangeFinder range_finder = new RangeFinder(
          config.getDouble(Config.WEIGHTING_KEY),
          config.getInt(Config.BOUNDS_KEY));
      final ChangePointAssembler assembler = 
          new ChangePointAssembler(range_finder, resolver());

      computer = ChangePointComputer.newBuilder()
          .setDataStore(data_store)
          .setChangePointStore(change_point_store)
          .setPreprocessor(new SeriesPreprocessor())
          .setEDivisive(e_divisive)
          .setAssembler(assembler)
          .setRetry(new RetryPolicy(
              config.getInt(Config.RETRY_ATTEMPTS_KEY),
              config.getLong(Config.RETRY_DELAY_KEY)))
          .setMinPoints(config.getNullableInt(Config.MIN_POINTS_KEY))
          .build();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Initialized change point computer with " + e_divisive 
            + " and " + range_finder);
      }
    } catch (RuntimeException e) {
      try {
        client.close();
      } catch (IOException ex) {
        e.addSuppressed(ex);
      }
      throw e;
    }
  }

  /** @return The configured computer. */
  public ChangePointComputer computer() {
    return computer;
  }

  /** @return A new batch sized from the worker setting. */
  public ChangePointBatch newBatch() {
    return new ChangePointBatch(computer, config.getInt(Config.WORKERS_KEY));
  }

  @Override
  public void close() throws IOException {
    client.close();
  }

  /**
   * Builds the resolver chain, a local checkout first when one is configured
   * then the remote API.
   */
  private FallbackGitHistoryResolver resolver() {
    final List<GitHistoryResolver> resolvers = Lists.newArrayList();
    if (config.hasProperty(Config.GIT_REPOSITORY_KEY)) {
      resolvers.add(new LocalGitHistoryResolver(
          config.getString(Config.GIT_REPOSITORY_KEY)));
    }
    if (config.hasProperty(Config.GITHUB_API_KEY)) {
      client.start();
      resolvers.add(new GitHubHistoryResolver(client,
          config.getString(Config.GITHUB_API_KEY),
          config.getString(Config.GITHUB_TOKEN_KEY)));
    }
    if (resolvers.isEmpty()) {
      LOG.warn("No git history resolvers configured, suspect revision "
          + "ranges will be empty");
    }
    return new FallbackGitHistoryResolver(resolvers);
  }
}
