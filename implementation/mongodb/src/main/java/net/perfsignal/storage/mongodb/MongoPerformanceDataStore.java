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
package net.perfsignal.storage.mongodb;

import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.BucketOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Variable;

import net.perfsignal.data.PerformanceSeries;
import net.perfsignal.data.TestIdentifier;
import net.perfsignal.exceptions.IllegalDataException;
import net.perfsignal.storage.OrderBucket;
import net.perfsignal.storage.PerformanceDataStore;

/**
 * Reads benchmark results from the {@code points} collection. A point
 * document carries the identifier fields, the {@code revision},
 * {@code order} and {@code create_time} of the build, the task and version
 * IDs, {@code max_ops_per_sec} with its {@code outlier} and
 * {@code rejected} flags and a {@code results} array with one entry per
 * thread level.
 * <p>
 * Whitelisted tasks are joined from {@code whitelisted_outlier_tasks} and
 * user verdicts from {@code marked_outliers}, where a {@code type} of
 * {@code "confirmed"} or {@code "rejected"} records the verdict.
 *
 * @since 1.0
 */
public class MongoPerformanceDataStore implements PerformanceDataStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      MongoPerformanceDataStore.class);

  public static final String POINTS = "points";
  public static final String WHITELISTED = "whitelisted_outlier_tasks";
  public static final String MARKED = "marked_outliers";

  /** Marked outlier type confirming the point is an outlier. */
  public static final String CONFIRMED = "confirmed";

  /** Marked outlier type rejecting the outlier detection. */
  public static final String REJECTED = "rejected";

  private final MongoCollection<Document> points;

  /**
   * Default ctor.
   * @param database A non-null database holding the collections.
   */
  public MongoPerformanceDataStore(final MongoDatabase database) {
    Preconditions.checkNotNull(database, "Database cannot be null.");
    points = database.getCollection(POINTS);
  }

  @Override
  public PerformanceSeries fetchSeries(final TestIdentifier id,
                                       final Long min_order) {
    final List<Bson> pipeline = pipeline(id, min_order);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetching " + id + " with pipeline " + pipeline);
    }
    final List<Document> documents;
    try {
      documents = points.aggregate(pipeline)
          .into(Lists.<Document>newArrayList());
    } catch (MongoException e) {
      throw MongoErrors.translate("reading points of " + id, e);
    }
    return toSeries(id, documents);
  }

  @Override
  public List<OrderBucket> countByOrderBuckets(final TestIdentifier id,
                                               final List<Long> boundaries) {
    Preconditions.checkArgument(boundaries != null && boundaries.size() > 1,
        "At least two boundaries are required.");
    final List<Document> documents;
    try {
      documents = points.aggregate(Arrays.asList(
          Aggregates.match(pointsFilter(id)),
          Aggregates.bucket("$order", boundaries, new BucketOptions()
              .defaultBucket("Other")
              .output(Accumulators.sum("count", 1)))))
          .into(Lists.<Document>newArrayList());
    } catch (MongoException e) {
      throw MongoErrors.translate("counting points of " + id, e);
    }
    final List<OrderBucket> buckets = 
        Lists.newArrayListWithCapacity(documents.size());
    for (final Document document : documents) {
      final Object lower_bound = document.get("_id");
      if (!(lower_bound instanceof Number)) {
        LOG.warn("Points of " + id + " fell outside the boundaries " 
            + boundaries + ": " + document);
        continue;
      }
      buckets.add(new OrderBucket(((Number) lower_bound).longValue(),
          ((Number) document.get("count")).longValue()));
    }
    Collections.reverse(buckets);
    return buckets;
  }

  @Override
  public long countPoints(final TestIdentifier id) {
    try {
      return points.countDocuments(pointsFilter(id));
    } catch (MongoException e) {
      throw MongoErrors.translate("counting points of " + id, e);
    }
  }

  @Override
  public Long orderOfNewest(final TestIdentifier id, final int offset) {
    Preconditions.checkArgument(offset >= 0, "Offset cannot be negative.");
    final Document newest;
    try {
      newest = points.find(pointsFilter(id))
          .projection(Projections.include("order"))
          .sort(Sorts.descending("order"))
          .skip(offset)
          .limit(1)
          .first();
    } catch (MongoException e) {
      throw MongoErrors.translate("reading points of " + id, e);
    }
    return newest == null ? null : ((Number) newest.get("order")).longValue();
  }

  /**
   * @param id A non-null identifier.
   * @return A filter matching the points of the series. Points of a thread
   * level series must carry a result for that level.
   */
  @VisibleForTesting
  static Document pointsFilter(final TestIdentifier id) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    final Document filter = new Document("project", id.project())
        .append("variant", id.variant())
        .append("task", id.task())
        .append("test", id.test());
    if (!id.isMaxThreadLevel()) {
      filter.append("results.thread_level", id.threadLevel());
    }
    return filter;
  }

  /**
   * Builds the aggregation returning one document per valid point in order
   * with the thread level result, the {@code whitelisted} tasks and the
   * {@code marked} verdicts joined in.
   * @param id A non-null identifier.
   * @param min_order An optional exclusive lower bound on the order.
   * @return The pipeline.
   */
  @VisibleForTesting
  static List<Bson> pipeline(final TestIdentifier id, final Long min_order) {
    final Document match = pointsFilter(id);
    if (min_order != null) {
      match.append("order", new Document("$gt", min_order));
    }
    final List<Bson> pipeline = Lists.newArrayList();
    pipeline.add(Aggregates.match(match));
    pipeline.add(Aggregates.match(new Document("$and", Arrays.asList(
        new Document("revision", new Document("$ne", null)),
        new Document("order", new Document("$ne", null)),
        new Document("create_time", new Document("$ne", null))))));
    pipeline.add(Aggregates.sort(Sorts.ascending("order")));

    final Document projection = new Document("project", 1)
        .append("variant", 1)
        .append("task", 1)
        .append("test", 1)
        .append("revision", 1)
        .append("order", 1)
        .append("create_time", 1)
        .append("task_id", 1)
        .append("version_id", 1);
    if (id.isMaxThreadLevel()) {
      projection.append("max_ops_per_sec", 1)
          .append("outlier", 1)
          .append("rejected", 1);
    } else {
      projection.append("results", new Document("$filter", 
          new Document("input", "$results")
              .append("as", "result")
              .append("cond", new Document("$eq", Arrays.asList(
                  "$$result.thread_level", id.threadLevel())))));
    }
    pipeline.add(Aggregates.project(projection));

    pipeline.add(Aggregates.lookup(WHITELISTED, 
        Arrays.asList(
            new Variable<Object>("project", "$project"),
            new Variable<Object>("variant", "$variant"),
            new Variable<Object>("task", "$task"),
            new Variable<Object>("revision", "$revision"),
            new Variable<Object>("order", "$order")),
        Collections.singletonList(Aggregates.match(matchAll(
            "project", "variant", "task", "revision", "order"))),
        "whitelisted"));
    pipeline.add(Aggregates.lookup(MARKED, 
        Arrays.asList(
            new Variable<Object>("project", "$project"),
            new Variable<Object>("variant", "$variant"),
            new Variable<Object>("task", "$task"),
            new Variable<Object>("test", "$test"),
            new Variable<Object>("thread_level", 
                new Document("$literal", id.threadLevel())),
            new Variable<Object>("revision", "$revision"),
            new Variable<Object>("order", "$order")),
        Collections.singletonList(Aggregates.match(matchAll(
            "project", "variant", "task", "test", "thread_level", 
            "revision", "order"))),
        "marked"));
    return pipeline;
  }

  /**
   * Gathers the aggregation output into a series.
   * @param id A non-null identifier.
   * @param documents The points in ascending order.
   * @return The series.
   * @throws IllegalDataException if a point has no value for the series.
   */
  @VisibleForTesting
  static PerformanceSeries toSeries(final TestIdentifier id,
                                    final List<Document> documents) {
    final int size = documents.size();
    final double[] values = new double[size];
    final String[] revisions = new String[size];
    final long[] orders = new long[size];
    final long[] create_times = new long[size];
    final String[] task_ids = new String[size];
    final String[] version_ids = new String[size];
    final boolean[] outlier = new boolean[size];
    final boolean[] rejected = new boolean[size];
    final boolean[] whitelisted = new boolean[size];
    final boolean[] confirmed = new boolean[size];
    final boolean[] marked_rejected = new boolean[size];

    for (int i = 0; i < size; i++) {
      final Document point = documents.get(i);
      final Document result;
      if (id.isMaxThreadLevel()) {
        result = point;
        values[i] = number(id, point, "max_ops_per_sec");
      } else {
        final List<Document> results = 
            point.getList("results", Document.class);
        if (results == null || results.isEmpty()) {
          throw new IllegalDataException("No result for thread level " 
              + id.threadLevel() + " in point " + point.get("order") 
              + " of " + id);
        }
        result = results.get(0);
        values[i] = number(id, result, "ops_per_sec");
      }
      revisions[i] = point.getString("revision");
      orders[i] = ((Number) point.get("order")).longValue();
      create_times[i] = epochMillis(point.get("create_time"));
      task_ids[i] = point.getString("task_id");
      version_ids[i] = point.getString("version_id");
      outlier[i] = Boolean.TRUE.equals(result.get("outlier"));
      rejected[i] = Boolean.TRUE.equals(result.get("rejected"));

      final List<Document> whitelist = 
          point.getList("whitelisted", Document.class);
      whitelisted[i] = whitelist != null && !whitelist.isEmpty();

      final List<Document> marked = point.getList("marked", Document.class);
      if (marked != null) {
        for (final Document verdict : marked) {
          final String type = verdict.getString("type");
          if (CONFIRMED.equals(type)) {
            confirmed[i] = true;
          } else if (REJECTED.equals(type)) {
            marked_rejected[i] = true;
          }
        }
      }
    }

    return PerformanceSeries.newBuilder()
        .setId(id)
        .setValues(values)
        .setRevisions(revisions)
        .setOrders(orders)
        .setCreateTimes(create_times)
        .setTaskIds(task_ids)
        .setVersionIds(version_ids)
        .setOutlier(outlier)
        .setRejected(rejected)
        .setWhitelisted(whitelisted)
        .setUserMarkedConfirmed(confirmed)
        .setUserMarkedRejected(marked_rejected)
        .build();
  }

  private static Document matchAll(final String... fields) {
    final List<Document> conditions = Lists.newArrayList();
    for (final String field : fields) {
      conditions.add(new Document("$eq", 
          Arrays.asList("$" + field, "$$" + field)));
    }
    return new Document("$expr", new Document("$and", conditions));
  }

  private static double number(final TestIdentifier id,
                               final Document document,
                               final String field) {
    final Object value = document.get(field);
    if (!(value instanceof Number)) {
      throw new IllegalDataException("Missing or invalid " + field + " [" 
          + value + "] in point of " + id);
    }
    return ((Number) value).doubleValue();
  }

  private static long epochMillis(final Object create_time) {
    if (create_time instanceof Date) {
      return ((Date) create_time).getTime();
    }
    if (create_time instanceof Number) {
      return ((Number) create_time).longValue();
    }
    throw new IllegalDataException("Invalid create_time: " + create_time);
  }
}
