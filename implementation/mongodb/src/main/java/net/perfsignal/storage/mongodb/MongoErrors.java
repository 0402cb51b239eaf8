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
package net.perfsignal.storage.mongodb;

import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

import net.perfsignal.exceptions.TransientStorageException;

/**
 * Sorts driver failures into the ones worth retrying and the rest.
 */
final class MongoErrors {

  private MongoErrors() {
    // Statics only.
  }

  /**
   * @param e A non-null driver exception.
   * @return True if the same operation may succeed when run again.
   */
  static boolean isTransient(final MongoException e) {
    return e instanceof MongoSocketException
        || e instanceof MongoTimeoutException
        || e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
        || e.hasErrorLabel(
            MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL);
  }

  /**
   * @param description What was being done, for the message.
   * @param e A non-null driver exception.
   * @return A {@link TransientStorageException} wrapping the failure if it
   * was transient, the original exception otherwise.
   */
  static RuntimeException translate(final String description,
                                    final MongoException e) {
    if (isTransient(e)) {
      return new TransientStorageException("Transient failure while "
          + description + ": " + e.getMessage(), e);
    }
    return e;
  }
}
