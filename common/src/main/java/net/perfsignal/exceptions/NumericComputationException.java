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
 * Thrown when a statistic overflows or turns invalid (NaN or infinite)
 * during a computation. A wrong statistic would misreport a regression so
 * the result is never coerced.
 * @since 1.0
 */
public final class NumericComputationException extends ArithmeticException {
  private static final long serialVersionUID = -2816304731650263154L;

  /** The split or element index being computed when the failure happened. */
  private final int index;

  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param index The index being computed or -1 if not applicable.
   */
  public NumericComputationException(final String msg, final int index) {
    super(msg);
    this.index = index;
  }

  /** @return The index being computed or -1 if not applicable. */
  public int index() {
    return index;
  }

}
