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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A persisted change point: the revision where the distribution of a
 * series shifted along with the statistics that justified it.
 * <p>
 * Change points of one {@link TestIdentifier} are unique by {@link #order()}.
 * The only field that changes after a row is written is the trailing
 * {@link ChangePointStatistics#next()} statistics, see
 * {@link #withNextStatistics(SegmentStatistics)}.
 *
 * @since 1.0
 */
@JsonInclude(Include.ALWAYS)
@JsonDeserialize(builder = ChangePoint.Builder.class)
public final class ChangePoint {
  private final String project;
  private final String variant;
  private final String task;
  private final String test;
  private final String thread_level;
  private final String suspect_revision;
  private final List<String> all_suspect_revisions;
  private final double probability;
  private final long order;
  private final long create_time;
  private final double value;
  private final int order_of_change_point;
  private final ChangePointStatistics statistics;
  private final AlgorithmMetadata algorithm;
  private final RangeFinderMetadata range_finder;
  private final Double magnitude;
  private final ChangePointCategory category;
  private final String task_id;
  private final String version_id;

  private ChangePoint(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.suspect_revision)) {
      throw new IllegalArgumentException(
          "Suspect revision cannot be null or empty.");
    }
    project = builder.project;
    variant = builder.variant;
    task = builder.task;
    test = builder.test;
    thread_level = builder.thread_level;
    suspect_revision = builder.suspect_revision;
    all_suspect_revisions = builder.all_suspect_revisions == null
        ? Collections.<String>emptyList()
        : ImmutableList.copyOf(builder.all_suspect_revisions);
    probability = builder.probability;
    order = builder.order;
    create_time = builder.create_time;
    value = builder.value;
    order_of_change_point = builder.order_of_change_point;
    statistics = builder.statistics == null
        ? new ChangePointStatistics(null, null) : builder.statistics;
    algorithm = builder.algorithm;
    range_finder = builder.range_finder;
    magnitude = builder.magnitude;
    category = builder.category == null
        ? ChangePointCategory.UNCATEGORIZED : builder.category;
    task_id = builder.task_id;
    version_id = builder.version_id;
    // validates the identifier fields
    identifier();
  }

  @JsonProperty("project")
  public String project() {
    return project;
  }

  @JsonProperty("variant")
  public String variant() {
    return variant;
  }

  @JsonProperty("task")
  public String task() {
    return task;
  }

  @JsonProperty("test")
  public String test() {
    return test;
  }

  @JsonProperty("thread_level")
  public String threadLevel() {
    return thread_level;
  }

  /** @return The series this change point belongs to. */
  @JsonIgnore
  public TestIdentifier identifier() {
    return TestIdentifier.newBuilder()
        .setProject(project)
        .setVariant(variant)
        .setTask(task)
        .setTest(test)
        .setThreadLevel(thread_level)
        .build();
  }

  /** @return The newest revision at the boundary. */
  @JsonProperty("suspect_revision")
  public String suspectRevision() {
    return suspect_revision;
  }

  /** @return The revisions between the stable and suspect revisions, newest
   * first. May be empty if they could not be resolved. */
  @JsonProperty("all_suspect_revisions")
  public List<String> allSuspectRevisions() {
    return all_suspect_revisions;
  }

  /** @return The probability that this is a real change point. */
  @JsonProperty("probability")
  public double probability() {
    return probability;
  }

  @JsonProperty("order")
  public long order() {
    return order;
  }

  /** @return The creation time of the suspect point in Unix epoch millis. */
  @JsonProperty("create_time")
  public long createTime() {
    return create_time;
  }

  /** @return The measured value of the suspect point. */
  @JsonProperty("value")
  public double value() {
    return value;
  }

  /**
   * @return The rank in which the change point was accepted, 0 based. 0 is
   * the first accepted and most significant change point of the run, not
   * the newest one.
   */
  @JsonProperty("order_of_change_point")
  public int orderOfChangePoint() {
    return order_of_change_point;
  }

  @JsonProperty("statistics")
  public ChangePointStatistics statistics() {
    return statistics;
  }

  @JsonProperty("algorithm")
  public AlgorithmMetadata algorithm() {
    return algorithm;
  }

  @JsonProperty("range_finder")
  public RangeFinderMetadata rangeFinder() {
    return range_finder;
  }

  /** @return The signed log ratio of the means or null if unknown. */
  @JsonProperty("magnitude")
  public Double magnitude() {
    return magnitude;
  }

  @JsonProperty("category")
  public ChangePointCategory category() {
    return category;
  }

  @JsonProperty("task_id")
  public String taskId() {
    return task_id;
  }

  @JsonProperty("version_id")
  public String versionId() {
    return version_id;
  }

  /**
   * @param next The new trailing statistics, may be null.
   * @return A copy of this change point with the trailing statistics
   * replaced.
   */
  public ChangePoint withNextStatistics(final SegmentStatistics next) {
    return newBuilder(this)
        .setStatistics(statistics.withNext(next))
        .build();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ChangePoint other = (ChangePoint) o;
    return Objects.equal(project, other.project)
        && Objects.equal(variant, other.variant)
        && Objects.equal(task, other.task)
        && Objects.equal(test, other.test)
        && Objects.equal(thread_level, other.thread_level)
        && Objects.equal(suspect_revision, other.suspect_revision)
        && Objects.equal(all_suspect_revisions, other.all_suspect_revisions)
        && Objects.equal(probability, other.probability)
        && order == other.order
        && create_time == other.create_time
        && Objects.equal(value, other.value)
        && order_of_change_point == other.order_of_change_point
        && Objects.equal(statistics, other.statistics)
        && Objects.equal(algorithm, other.algorithm)
        && Objects.equal(range_finder, other.range_finder)
        && Objects.equal(magnitude, other.magnitude)
        && category == other.category
        && Objects.equal(task_id, other.task_id)
        && Objects.equal(version_id, other.version_id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(project, variant, task, test, thread_level,
        suspect_revision, order);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", identifier())
        .add("suspect_revision", suspect_revision)
        .add("order", order)
        .add("probability", probability)
        .add("order_of_change_point", order_of_change_point)
        .add("magnitude", magnitude)
        .add("category", category)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a change point into a new builder.
   * @param change_point A non-null change point to copy.
   * @return A new builder populated with the values of the change point.
   */
  public static Builder newBuilder(final ChangePoint change_point) {
    if (change_point == null) {
      throw new IllegalArgumentException("Change point cannot be null.");
    }
    return new Builder()
        .setProject(change_point.project)
        .setVariant(change_point.variant)
        .setTask(change_point.task)
        .setTest(change_point.test)
        .setThreadLevel(change_point.thread_level)
        .setSuspectRevision(change_point.suspect_revision)
        .setAllSuspectRevisions(change_point.all_suspect_revisions)
        .setProbability(change_point.probability)
        .setOrder(change_point.order)
        .setCreateTime(change_point.create_time)
        .setValue(change_point.value)
        .setOrderOfChangePoint(change_point.order_of_change_point)
        .setStatistics(change_point.statistics)
        .setAlgorithm(change_point.algorithm)
        .setRangeFinder(change_point.range_finder)
        .setMagnitude(change_point.magnitude)
        .setCategory(change_point.category)
        .setTaskId(change_point.task_id)
        .setVersionId(change_point.version_id);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String project;
    @JsonProperty
    private String variant;
    @JsonProperty
    private String task;
    @JsonProperty
    private String test;
    @JsonProperty
    private String thread_level;
    @JsonProperty
    private String suspect_revision;
    @JsonProperty
    private List<String> all_suspect_revisions;
    @JsonProperty
    private double probability;
    @JsonProperty
    private long order;
    @JsonProperty
    private long create_time;
    @JsonProperty
    private double value;
    @JsonProperty
    private int order_of_change_point;
    @JsonProperty
    private ChangePointStatistics statistics;
    @JsonProperty
    private AlgorithmMetadata algorithm;
    @JsonProperty
    private RangeFinderMetadata range_finder;
    @JsonProperty
    private Double magnitude;
    @JsonProperty
    private ChangePointCategory category;
    @JsonProperty
    private String task_id;
    @JsonProperty
    private String version_id;

    public Builder setIdentifier(final TestIdentifier id) {
      project = id.project();
      variant = id.variant();
      task = id.task();
      test = id.test();
      thread_level = id.threadLevel();
      return this;
    }

    public Builder setProject(final String project) {
      this.project = project;
      return this;
    }

    public Builder setVariant(final String variant) {
      this.variant = variant;
      return this;
    }

    public Builder setTask(final String task) {
      this.task = task;
      return this;
    }

    public Builder setTest(final String test) {
      this.test = test;
      return this;
    }

    public Builder setThreadLevel(final String thread_level) {
      this.thread_level = thread_level;
      return this;
    }

    public Builder setSuspectRevision(final String suspect_revision) {
      this.suspect_revision = suspect_revision;
      return this;
    }

    public Builder setAllSuspectRevisions(
        final List<String> all_suspect_revisions) {
      this.all_suspect_revisions = all_suspect_revisions;
      return this;
    }

    public Builder setProbability(final double probability) {
      this.probability = probability;
      return this;
    }

    public Builder setOrder(final long order) {
      this.order = order;
      return this;
    }

    public Builder setCreateTime(final long create_time) {
      this.create_time = create_time;
      return this;
    }

    public Builder setValue(final double value) {
      this.value = value;
      return this;
    }

    public Builder setOrderOfChangePoint(final int order_of_change_point) {
      this.order_of_change_point = order_of_change_point;
      return this;
    }

    public Builder setStatistics(final ChangePointStatistics statistics) {
      this.statistics = statistics;
      return this;
    }

    public Builder setAlgorithm(final AlgorithmMetadata algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public Builder setRangeFinder(final RangeFinderMetadata range_finder) {
      this.range_finder = range_finder;
      return this;
    }

    public Builder setMagnitude(final Double magnitude) {
      this.magnitude = magnitude;
      return this;
    }

    public Builder setCategory(final ChangePointCategory category) {
      this.category = category;
      return this;
    }

    public Builder setTaskId(final String task_id) {
      this.task_id = task_id;
      return this;
    }

    public Builder setVersionId(final String version_id) {
      this.version_id = version_id;
      return this;
    }

    public ChangePoint build() {
      return new ChangePoint(this);
    }
  }
}
