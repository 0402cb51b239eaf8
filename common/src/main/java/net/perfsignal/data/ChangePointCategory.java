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
package net.perfsignal.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The triage bucket of a change point derived from its magnitude.
 *
 * @since 1.0
 */
public enum ChangePointCategory {
  MAJOR_REGRESSION("Major Regression"),
  MODERATE_REGRESSION("Moderate Regression"),
  MINOR_REGRESSION("Minor Regression"),
  MINOR_IMPROVEMENT("Minor Improvement"),
  MODERATE_IMPROVEMENT("Moderate Improvement"),
  MAJOR_IMPROVEMENT("Major Improvement"),

  /** No statistics were available to compute a magnitude. */
  UNCATEGORIZED("Uncategorized");

  /** The name stored with change points. */
  private final String name;

  ChangePointCategory(final String name) {
    this.name = name;
  }

  /** @return The name stored with change points. */
  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Finds the category for the stored name, case insensitive.
   * @param name The name to find.
   * @return The category.
   * @throws IllegalArgumentException if the name wasn't recognized.
   */
  @JsonCreator
  public static ChangePointCategory fromString(final String name) {
    for (final ChangePointCategory category : values()) {
      if (category.name.equalsIgnoreCase(name)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unrecognized category: " + name);
  }
}
