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
package net.perfsignal.changepoints.qhat;

/**
 * The available {@link QHatCalculator}s. The implementation is picked from
 * configuration when the components are built.
 *
 * @since 1.0
 */
public enum QHatImplementation {
  /** Precomputed difference matrix. */
  DIFF_MATRIX {
    @Override
    public QHatCalculator newCalculator() {
      return new DiffMatrixQHatCalculator();
    }
  },

  /** On the fly differences, linear memory. */
  STREAMING {
    @Override
    public QHatCalculator newCalculator() {
      return new StreamingQHatCalculator();
    }
  };

  /** @return A new calculator instance. */
  public abstract QHatCalculator newCalculator();

  /**
   * Parses the configured name, case insensitive.
   * @param name The name to parse.
   * @return The implementation.
   * @throws IllegalArgumentException if the name was null, empty or unknown.
   */
  public static QHatImplementation fromString(final String name) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException(
          "QHat implementation cannot be null or empty.");
    }
    for (final QHatImplementation implementation : values()) {
      if (implementation.name().equalsIgnoreCase(name.trim())) {
        return implementation;
      }
    }
    throw new IllegalArgumentException("Unknown QHat implementation: " 
        + name);
  }
}
