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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * How a change point was found: the divergence statistic of the winning
 * candidate with its normalizations, the window it was found in and the
 * permutation test probability. The index is in compacted (masked) space.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = AlgorithmMetadata.Builder.class)
public final class AlgorithmMetadata {
  /** The name recorded for the E-Divisive QHat statistic. */
  public static final String QHAT = "qhat";

  private final String name;
  private final int index;
  private final double value;
  private final double value_to_avg;
  private final double value_to_avg_diff;
  private final double average;
  private final double average_diff;
  private final int window_size;
  private final double probability;
  private final String revision;

  private AlgorithmMetadata(final Builder builder) {
    name = builder.name == null ? QHAT : builder.name;
    index = builder.index;
    value = builder.value;
    value_to_avg = builder.value_to_avg;
    value_to_avg_diff = builder.value_to_avg_diff;
    average = builder.average;
    average_diff = builder.average_diff;
    window_size = builder.window_size;
    probability = builder.probability;
    revision = builder.revision;
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  @JsonProperty("index")
  public int index() {
    return index;
  }

  @JsonProperty("value")
  public double value() {
    return value;
  }

  @JsonProperty("value_to_avg")
  public double valueToAvg() {
    return value_to_avg;
  }

  @JsonProperty("value_to_avg_diff")
  public double valueToAvgDiff() {
    return value_to_avg_diff;
  }

  @JsonProperty("average")
  public double average() {
    return average;
  }

  @JsonProperty("average_diff")
  public double averageDiff() {
    return average_diff;
  }

  @JsonProperty("window_size")
  public int windowSize() {
    return window_size;
  }

  /** @return The probability the candidate was NOT significant. */
  @JsonProperty("probability")
  public double probability() {
    return probability;
  }

  /** @return The revision at {@link #index()} in the compacted series. */
  @JsonProperty("revision")
  public String revision() {
    return revision;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final AlgorithmMetadata other = (AlgorithmMetadata) o;
    return Objects.equal(name, other.name)
        && index == other.index
        && Objects.equal(value, other.value)
        && Objects.equal(value_to_avg, other.value_to_avg)
        && Objects.equal(value_to_avg_diff, other.value_to_avg_diff)
        && Objects.equal(average, other.average)
        && Objects.equal(average_diff, other.average_diff)
        && window_size == other.window_size
        && Objects.equal(probability, other.probability)
        && Objects.equal(revision, other.revision);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, index, value, average, average_diff,
        window_size, probability, revision);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("index", index)
        .add("value", value)
        .add("value_to_avg", value_to_avg)
        .add("value_to_avg_diff", value_to_avg_diff)
        .add("average", average)
        .add("average_diff", average_diff)
        .add("window_size", window_size)
        .add("probability", probability)
        .add("revision", revision)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private int index;
    @JsonProperty
    private double value;
    @JsonProperty
    private double value_to_avg;
    @JsonProperty
    private double value_to_avg_diff;
    @JsonProperty
    private double average;
    @JsonProperty
    private double average_diff;
    @JsonProperty
    private int window_size;
    @JsonProperty
    private double probability;
    @JsonProperty
    private String revision;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setIndex(final int index) {
      this.index = index;
      return this;
    }

    public Builder setValue(final double value) {
      this.value = value;
      return this;
    }

    public Builder setValueToAvg(final double value_to_avg) {
      this.value_to_avg = value_to_avg;
      return this;
    }

    public Builder setValueToAvgDiff(final double value_to_avg_diff) {
      this.value_to_avg_diff = value_to_avg_diff;
      return this;
    }

    public Builder setAverage(final double average) {
      this.average = average;
      return this;
    }

    public Builder setAverageDiff(final double average_diff) {
      this.average_diff = average_diff;
      return this;
    }

    public Builder setWindowSize(final int window_size) {
      this.window_size = window_size;
      return this;
    }

    public Builder setProbability(final double probability) {
      this.probability = probability;
      return this;
    }

    public Builder setRevision(final String revision) {
      this.revision = revision;
      return this;
    }

    public AlgorithmMetadata build() {
      return new AlgorithmMetadata(this);
    }
  }
}
