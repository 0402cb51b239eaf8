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

import java.util.List;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.TransactionBody;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.SegmentStatistics;
import net.perfsignal.data.TestIdentifier;
import net.perfsignal.storage.ChangePointStore;
import net.perfsignal.storage.ChangePointTransaction;

/**
 * Stores change points in the {@code change_points} collection. Writes run
 * in a multi-document transaction on a client session so a replacement of
 * a series' tail is all or nothing. Requires a replica set or sharded
 * cluster.
 *
 * @since 1.0
 */
public class MongoChangePointStore implements ChangePointStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      MongoChangePointStore.class);

  /** The collection holding the change points. */
  public static final String COLLECTION = "change_points";

  private final MongoClient client;
  private final MongoCollection<Document> collection;

  /**
   * Default ctor.
   * @param client A non-null client used to start sessions.
   * @param database A non-null database holding the collection.
   */
  public MongoChangePointStore(final MongoClient client,
                               final MongoDatabase database) {
    Preconditions.checkNotNull(client, "Client cannot be null.");
    Preconditions.checkNotNull(database, "Database cannot be null.");
    this.client = client;
    collection = database.getCollection(COLLECTION);
  }

  @Override
  public List<Long> changePointOrders(final TestIdentifier id) {
    final List<Long> orders = Lists.newArrayList();
    try {
      final List<Document> documents = collection
          .find(ChangePointDocuments.identifierFilter(id))
          .projection(Projections.include("order"))
          .sort(Sorts.ascending("order"))
          .into(Lists.<Document>newArrayList());
      for (final Document document : documents) {
        orders.add(((Number) document.get("order")).longValue());
      }
    } catch (MongoException e) {
      throw MongoErrors.translate("reading change point orders of " + id, e);
    }
    return orders;
  }

  @Override
  public List<ChangePoint> find(final TestIdentifier id) {
    try {
      return toChangePoints(collection
          .find(ChangePointDocuments.identifierFilter(id))
          .sort(Sorts.ascending("order"))
          .into(Lists.<Document>newArrayList()));
    } catch (MongoException e) {
      throw MongoErrors.translate("reading change points of " + id, e);
    }
  }

  @Override
  public <T> T inTransaction(final TestIdentifier id,
                             final TransactionWork<T> work) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    Preconditions.checkNotNull(work, "Work cannot be null.");
    try (final ClientSession session = client.startSession()) {
      return session.withTransaction(new TransactionBody<T>() {
        @Override
        public T execute() {
          return work.execute(new MongoTransaction(session, id));
        }
      });
    } catch (MongoException e) {
      throw MongoErrors.translate("updating change points of " + id, e);
    }
  }

  static List<ChangePoint> toChangePoints(final List<Document> documents) {
    final List<ChangePoint> change_points =
        Lists.newArrayListWithCapacity(documents.size());
    for (final Document document : documents) {
      change_points.add(ChangePointDocuments.fromDocument(document));
    }
    return change_points;
  }

  /**
   * Operations bound to the session of a running transaction.
   */
  class MongoTransaction implements ChangePointTransaction {
    private final ClientSession session;
    private final TestIdentifier id;

    MongoTransaction(final ClientSession session, final TestIdentifier id) {
      this.session = session;
      this.id = id;
    }

    @Override
    public List<ChangePoint> findNewerThan(final Long order) {
      return toChangePoints(collection
          .find(session, newerThan(order))
          .sort(Sorts.ascending("order"))
          .into(Lists.<Document>newArrayList()));
    }

    @Override
    public long deleteNewerThan(final Long order) {
      final long deleted = collection.deleteMany(session, newerThan(order))
          .getDeletedCount();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Deleted " + deleted + " change points of " + id
            + " newer than " + order);
      }
      return deleted;
    }

    @Override
    public void insert(final List<ChangePoint> change_points) {
      if (change_points.isEmpty()) {
        return;
      }
      final List<Document> documents =
          Lists.newArrayListWithCapacity(change_points.size());
      for (final ChangePoint change_point : change_points) {
        documents.add(ChangePointDocuments.toDocument(change_point));
      }
      collection.insertMany(session, documents);
    }

    @Override
    public ChangePoint findPrevious(final long order) {
      final Document filter = ChangePointDocuments.identifierFilter(id)
          .append("order", new Document("$lt", order));
      final Document previous = collection.find(session, filter)
          .sort(Sorts.descending("order"))
          .limit(1)
          .first();
      return previous == null 
          ? null : ChangePointDocuments.fromDocument(previous);
    }

    @Override
    public void updateNextStatistics(final ChangePoint change_point,
                                     final SegmentStatistics next) {
      final Document filter = ChangePointDocuments.identifierFilter(id)
          .append("order", change_point.order());
      final UpdateResult result = collection.updateOne(session, filter, 
          Updates.set("statistics.next", 
              ChangePointDocuments.toDocument(next)));
      if (result.getMatchedCount() == 0) {
        LOG.warn("No change point of " + id + " at order " 
            + change_point.order() + " to link to");
      }
    }

    private Document newerThan(final Long order) {
      final Document filter = ChangePointDocuments.identifierFilter(id);
      if (order != null) {
        filter.append("order", new Document("$gt", order));
      }
      return filter;
    }
  }
}
