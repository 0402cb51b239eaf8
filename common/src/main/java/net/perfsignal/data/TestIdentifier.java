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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;

/**
 * Identifies one benchmark series: a test run in a task of a build variant
 * of a project, at a given thread level. The thread level {@code "max"}
 * designates the max-throughput series.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = TestIdentifier.Builder.class)
public final class TestIdentifier implements Comparable<TestIdentifier> {

  /** The thread level of the max-throughput series. */
  public static final String MAX_THREAD_LEVEL = "max";

  private final String project;
  private final String variant;
  private final String task;
  private final String test;
  private final String thread_level;

  private TestIdentifier(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.project)) {
      throw new IllegalArgumentException("Project cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.variant)) {
      throw new IllegalArgumentException("Variant cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.task)) {
      throw new IllegalArgumentException("Task cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.test)) {
      throw new IllegalArgumentException("Test cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.thread_level)) {
      throw new IllegalArgumentException(
          "Thread level cannot be null or empty.");
    }
    project = builder.project;
    variant = builder.variant;
    task = builder.task;
    test = builder.test;
    thread_level = builder.thread_level;
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

  /** @return Whether or not this is the max-throughput series. */
  @JsonIgnore
  public boolean isMaxThreadLevel() {
    return MAX_THREAD_LEVEL.equals(thread_level);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TestIdentifier other = (TestIdentifier) o;
    return Objects.equal(project, other.project)
        && Objects.equal(variant, other.variant)
        && Objects.equal(task, other.task)
        && Objects.equal(test, other.test)
        && Objects.equal(thread_level, other.thread_level);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(project, variant, task, test, thread_level);
  }

  @Override
  public int compareTo(final TestIdentifier o) {
    return ComparisonChain.start()
        .compare(project, o.project)
        .compare(variant, o.variant)
        .compare(task, o.task)
        .compare(test, o.test)
        .compare(thread_level, o.thread_level)
        .result();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append(project)
        .append("/")
        .append(variant)
        .append("/")
        .append(task)
        .append("/")
        .append(test)
        .append("/")
        .append(thread_level)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
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

    public TestIdentifier build() {
      return new TestIdentifier(this);
    }
  }
}
