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
package net.perfsignal.changepoints.range;

/**
 * Which side of a candidate the abrupt jump was found on.
 *
 * @since 1.0
 */
public enum Location {
  /** The jump is at or after the candidate. */
  AHEAD("ahead"),

  /** The jump is at or before the candidate. */
  BEHIND("behind");

  private final String name;

  Location(final String name) {
    this.name = name;
  }

  /** @return The lower case name. */
  public String getName() {
    return name;
  }
}
