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
package net.perfsignal.exceptions;

/**
 * A failure talking to the storage backend that may succeed if the same
 * operation is attempted again, e.g. a network hiccup or a transaction
 * write conflict.
 *
 * @since 1.0
 */
public class TransientStorageException extends RuntimeException {
  private static final long serialVersionUID = 4510672371929034180L;

  /**
   * Ctor with a message.
   * @param msg A non-null message to be given.
   */
  public TransientStorageException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a message and the original exception.
   * @param msg A non-null message to be given.
   * @param e The original exception that caused this to be thrown.
   */
  public TransientStorageException(final String msg, final Throwable e) {
    super(msg, e);
  }

}
