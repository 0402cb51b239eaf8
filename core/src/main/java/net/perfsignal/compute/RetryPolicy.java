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

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import net.perfsignal.exceptions.TransientStorageException;

/**
 * Re-runs a unit of work a fixed number of times with a fixed delay when it
 * fails with a {@link TransientStorageException}. Any other exception is
 * passed through on the first failure. Once the attempts are exhausted the
 * last transient exception is rethrown.
 *
 * @since 1.0
 */
public class RetryPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

  public static final int DEFAULT_ATTEMPTS = 3;
  public static final long DEFAULT_DELAY_MS = 5000;

  private final int attempts;
  private final long delay_ms;

  /**
   * Default ctor.
   * @param attempts The total number of attempts, at least 1.
   * @param delay_ms The delay between attempts in milliseconds, 0 or more.
   */
  public RetryPolicy(final int attempts, final long delay_ms) {
    Preconditions.checkArgument(attempts > 0,
        "Attempts must be greater than 0: %s", attempts);
    Preconditions.checkArgument(delay_ms >= 0,
        "Delay cannot be negative: %s", delay_ms);
    this.attempts = attempts;
    this.delay_ms = delay_ms;
  }

  /**
   * Runs the work until it succeeds or the attempts are exhausted.
   * @param description A description for the logs.
   * @param work The work to run.
   * @return The result of the first successful attempt.
   * @throws TransientStorageException if every attempt failed transiently.
   */
  public <T> T call(final String description, final Supplier<T> work) {
    TransientStorageException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return work.get();
      } catch (TransientStorageException e) {
        last = e;
        if (attempt >= attempts) {
          break;
        }
        LOG.warn("Attempt " + attempt + " of " + attempts + " failed for "
            + description + ", retrying in " + delay_ms + "ms", e);
        sleep(delay_ms);
      }
    }
    LOG.error("Giving up on " + description + " after " + attempts 
        + " attempts");
    throw last;
  }

  public int attempts() {
    return attempts;
  }

  public long delayMs() {
    return delay_ms;
  }

  /**
   * Waits between attempts.
   * @param millis How long to wait.
   * @throws TransientStorageException if the thread was interrupted.
   */
  protected void sleep(final long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientStorageException("Interrupted while waiting to retry", 
          e);
    }
  }
}
