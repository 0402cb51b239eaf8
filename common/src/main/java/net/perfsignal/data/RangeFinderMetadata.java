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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * The parameters the range finder used to localize a change point.
 *
 * @since 1.0
 */
public final class RangeFinderMetadata {
  private final double weighting;

  /** @param weighting The exponential decay weighting. */
  @JsonCreator
  public RangeFinderMetadata(@JsonProperty("weighting") final double weighting) {
    this.weighting = weighting;
  }

  @JsonProperty("weighting")
  public double weighting() {
    return weighting;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Objects.equal(weighting, ((RangeFinderMetadata) o).weighting);
  }

  @Override
  public int hashCode() {
    return Double.hashCode(weighting);
  }

  @Override
  public String toString() {
    return "weighting=" + weighting;
  }
}
