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
package net.perfsignal.storage;

import java.util.List;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.TestIdentifier;

/**
 * Persistence for the change points of benchmark series. Writes only happen
 * through {@link #inTransaction(TestIdentifier, TransactionWork)} so a
 * failure never leaves a partially replaced set behind.
 * <p>
 * Implementations throw
 * {@link net.perfsignal.exceptions.TransientStorageException} for failures
 * that may succeed when retried.
 *
 * @since 1.0
 */
public interface ChangePointStore {

  /**
   * @param id A non-null identifier.
   * @return The orders of the stored change points, ascending.
   */
  public List<Long> changePointOrders(final TestIdentifier id);

  /**
   * @param id A non-null identifier.
   * @return The stored change points ascending by order.
   */
  public List<ChangePoint> find(final TestIdentifier id);

  /**
   * Runs the work in a transaction scoped to the series. If the work throws,
   * none of its writes are visible.
   * @param id A non-null identifier.
   * @param work The work to run.
   * @return The result of the work.
   */
  public <T> T inTransaction(final TestIdentifier id,
                             final TransactionWork<T> work);

  /**
   * Work executed against a transaction.
   * @param <T> The result type.
   */
  public interface TransactionWork<T> {
    public T execute(final ChangePointTransaction transaction);
  }
}
