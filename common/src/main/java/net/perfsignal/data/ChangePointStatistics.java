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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The statistics of the segments on either side of a change point. Either
 * side is null when its segment is empty.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public final class ChangePointStatistics {
  private final SegmentStatistics previous;
  private final SegmentStatistics next;

  /**
   * Default ctor.
   * @param previous The statistics of the segment before the change point,
   * may be null.
   * @param next The statistics of the segment after the change point, may
   * be null.
   */
  @JsonCreator
  public ChangePointStatistics(
      @JsonProperty("previous") final SegmentStatistics previous,
      @JsonProperty("next") final SegmentStatistics next) {
    this.previous = previous;
    this.next = next;
  }

  @JsonProperty("previous")
  public SegmentStatistics previous() {
    return previous;
  }

  @JsonProperty("next")
  public SegmentStatistics next() {
    return next;
  }

  /**
   * @param next The replacement trailing statistics, may be null.
   * @return A copy with the trailing statistics replaced.
   */
  public ChangePointStatistics withNext(final SegmentStatistics next) {
    return new ChangePointStatistics(previous, next);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ChangePointStatistics other = (ChangePointStatistics) o;
    return Objects.equal(previous, other.previous)
        && Objects.equal(next, other.next);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(previous, next);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("previous", previous)
        .add("next", next)
        .toString();
  }
}
