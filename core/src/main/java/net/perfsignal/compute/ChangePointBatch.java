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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.perfsignal.data.TestIdentifier;

/**
 * Runs a {@link ChangePointComputer} over many series on a fixed pool of
 * workers. Series are independent so a failure is recorded against its
 * identifier and the rest of the batch carries on.
 *
 * @since 1.0
 */
public class ChangePointBatch {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChangePointBatch.class);

  private final ChangePointComputer computer;
  private final ExecutorService executor;

  /**
   * Default ctor.
   * @param computer A non-null computer shared by the workers.
   * @param workers The number of worker threads, at least 1.
   */
  public ChangePointBatch(final ChangePointComputer computer,
                          final int workers) {
    Preconditions.checkNotNull(computer, "Computer cannot be null.");
    Preconditions.checkArgument(workers > 0, 
        "Workers must be greater than 0: %s", workers);
    this.computer = computer;
    final ThreadFactory factory = new ThreadFactoryBuilder()
        .setNameFormat("ChangePointWorker-%d")
        .setDaemon(true)
        .build();
    executor = Executors.newFixedThreadPool(workers, factory);
  }

  /**
   * Submits the identifiers to the pool.
   * @param ids The identifiers to compute.
   * @return A deferred resolved with the summary once every identifier has
   * completed or failed.
   */
  public Deferred<BatchSummary> compute(final Collection<TestIdentifier> ids) {
    Preconditions.checkNotNull(ids, "Identifiers cannot be null.");
    final List<Deferred<Object>> deferreds = 
        Lists.newArrayListWithCapacity(ids.size());
    final List<ComputeResult> successes = 
        Lists.newArrayListWithCapacity(ids.size());
    final Map<TestIdentifier, Throwable> failures = Maps.newLinkedHashMap();

    for (final TestIdentifier id : ids) {
      final Deferred<Object> deferred = new Deferred<Object>();
      deferreds.add(deferred);
      try {
        executor.execute(new Runnable() {
          @Override
          public void run() {
            try {
              final ComputeResult result = computer.compute(id);
              synchronized (successes) {
                successes.add(result);
              }
            } catch (Throwable t) {
              LOG.error("Failed to compute change points for " + id, t);
              synchronized (successes) {
                failures.put(id, t);
              }
            } finally {
              deferred.callback(null);
            }
          }
        });
      } catch (RuntimeException e) {
        LOG.error("Failed to submit " + id, e);
        synchronized (successes) {
          failures.put(id, e);
        }
        deferred.callback(null);
      }
    }

    class SummaryCB implements Callback<BatchSummary, ArrayList<Object>> {
      @Override
      public BatchSummary call(final ArrayList<Object> ignored) throws Exception {
        synchronized (successes) {
          final BatchSummary summary = new BatchSummary(successes, failures);
          LOG.info("Completed change point batch: " + summary);
          return summary;
        }
      }
    }

    return Deferred.group(deferreds).addCallback(new SummaryCB());
  }

  /** Stops accepting work. Running computations are left to finish. */
  public void shutdown() {
    executor.shutdown();
  }
}
