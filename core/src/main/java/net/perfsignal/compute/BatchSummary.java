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

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.perfsignal.data.TestIdentifier;

/**
 * The results of a batch. Every submitted identifier appears either in the
 * successes or in the failures.
 *
 * @since 1.0
 */
public final class BatchSummary {
  private final List<ComputeResult> successes;
  private final Map<TestIdentifier, Throwable> failures;

  /**
   * Default ctor.
   * @param successes The results of the identifiers that completed.
   * @param failures The exceptions of the identifiers that failed.
   */
  public BatchSummary(final List<ComputeResult> successes,
                      final Map<TestIdentifier, Throwable> failures) {
    this.successes = ImmutableList.copyOf(successes);
    this.failures = ImmutableMap.copyOf(failures);
  }

  public List<ComputeResult> successes() {
    return successes;
  }

  public Map<TestIdentifier, Throwable> failures() {
    return failures;
  }

  /** @return The number of identifiers in the batch. */
  public int size() {
    return successes.size() + failures.size();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("successes", successes.size())
        .add("failures", failures.keySet())
        .toString();
  }
}
