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

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Descriptive statistics of a run of points between two change points.
 * Variance is the sample variance, skewness and kurtosis are the biased
 * estimates with kurtosis reported as excess (Fisher) kurtosis. A single
 * observation has a NaN variance, a skewness of 0 and a kurtosis of -3.
 * <p>
 * Equality treats NaN as equal to NaN so stored and freshly computed
 * statistics can be compared.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = SegmentStatistics.Builder.class)
public final class SegmentStatistics {
  private final long nobs;
  private final double min;
  private final double max;
  private final double mean;
  private final double variance;
  private final double skewness;
  private final double kurtosis;

  private SegmentStatistics(final Builder builder) {
    if (builder.nobs < 1) {
      throw new IllegalArgumentException("Statistics require at least one "
          + "observation, got: " + builder.nobs);
    }
    if (builder.minmax == null || builder.minmax.length != 2) {
      throw new IllegalArgumentException("Minmax must have two entries.");
    }
    nobs = builder.nobs;
    min = builder.minmax[0];
    max = builder.minmax[1];
    mean = builder.mean;
    variance = builder.variance;
    skewness = builder.skewness;
    kurtosis = builder.kurtosis;
  }

  @JsonProperty("nobs")
  public long nobs() {
    return nobs;
  }

  /** @return A new two element array with the min then the max. */
  @JsonProperty("minmax")
  public double[] minmax() {
    return new double[] { min, max };
  }

  @JsonProperty("mean")
  public double mean() {
    return mean;
  }

  @JsonProperty("variance")
  public double variance() {
    return variance;
  }

  @JsonProperty("skewness")
  public double skewness() {
    return skewness;
  }

  @JsonProperty("kurtosis")
  public double kurtosis() {
    return kurtosis;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SegmentStatistics other = (SegmentStatistics) o;
    // boxed so NaN == NaN
    return nobs == other.nobs
        && Arrays.equals(minmax(), other.minmax())
        && Objects.equal(mean, other.mean)
        && Objects.equal(variance, other.variance)
        && Objects.equal(skewness, other.skewness)
        && Objects.equal(kurtosis, other.kurtosis);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(nobs, min, max, mean, variance, skewness,
        kurtosis);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nobs", nobs)
        .add("min", min)
        .add("max", max)
        .add("mean", mean)
        .add("variance", variance)
        .add("skewness", skewness)
        .add("kurtosis", kurtosis)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private long nobs;
    @JsonProperty
    private double[] minmax;
    @JsonProperty
    private double mean;
    @JsonProperty
    private double variance;
    @JsonProperty
    private double skewness;
    @JsonProperty
    private double kurtosis;

    public Builder setNobs(final long nobs) {
      this.nobs = nobs;
      return this;
    }

    public Builder setMinMax(final double min, final double max) {
      minmax = new double[] { min, max };
      return this;
    }

    public Builder setMean(final double mean) {
      this.mean = mean;
      return this;
    }

    public Builder setVariance(final double variance) {
      this.variance = variance;
      return this;
    }

    public Builder setSkewness(final double skewness) {
      this.skewness = skewness;
      return this;
    }

    public Builder setKurtosis(final double kurtosis) {
      this.kurtosis = kurtosis;
      return this;
    }

    public SegmentStatistics build() {
      return new SegmentStatistics(this);
    }
  }
}
