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

import static net.perfsignal.storage.mongodb.TestChangePointDocuments.ID;
import static net.perfsignal.storage.mongodb.TestChangePointDocuments.changePoint;
import static net.perfsignal.storage.mongodb.TestChangePointDocuments.statistics;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collection;
import java.util.List;

import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.ImmutableList;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.ServerAddress;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.TransactionBody;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.exceptions.TransientStorageException;
import net.perfsignal.storage.ChangePointStore.TransactionWork;
import net.perfsignal.storage.ChangePointTransaction;

public class TestMongoChangePointStore {
  private MongoClient client;
  private MongoDatabase database;
  private MongoCollection<Document> collection;
  private ClientSession session;
  private FindIterable<Document> iterable;
  private MongoChangePointStore store;

  @SuppressWarnings("unchecked")
  @Before
  public void before() throws Exception {
    client = mock(MongoClient.class);
    database = mock(MongoDatabase.class);
    collection = mock(MongoCollection.class);
    session = mock(ClientSession.class);
    iterable = mock(FindIterable.class);
    when(database.getCollection(MongoChangePointStore.COLLECTION))
        .thenReturn(collection);
    when(client.startSession()).thenReturn(session);
    when(session.withTransaction(any(TransactionBody.class)))
        .thenAnswer(invocation -> 
          ((TransactionBody<?>) invocation.getArgument(0)).execute());
    when(collection.find(any(Bson.class))).thenReturn(iterable);
    when(collection.find(eq(session), any(Bson.class))).thenReturn(iterable);
    when(iterable.projection(any(Bson.class))).thenReturn(iterable);
    when(iterable.sort(any(Bson.class))).thenReturn(iterable);
    when(iterable.limit(1)).thenReturn(iterable);
    store = new MongoChangePointStore(client, database);
  }

  @Test
  public void changePointOrders() throws Exception {
    returns(new Document("order", 100), new Document("order", 250L));
    assertEquals(ImmutableList.of(100L, 250L), store.changePointOrders(ID));

    final ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection).find(filter.capture());
    assertEquals(ChangePointDocuments.identifierFilter(ID), filter.getValue());
  }

  @Test
  public void find() throws Exception {
    returns(ChangePointDocuments.toDocument(changePoint(100)),
        ChangePointDocuments.toDocument(changePoint(250)));
    final List<ChangePoint> change_points = store.find(ID);
    assertEquals(2, change_points.size());
    assertEquals(changePoint(100), change_points.get(0));
    assertEquals(250, change_points.get(1).order());
  }

  @Test
  public void findTransientFailure() throws Exception {
    when(collection.find(any(Bson.class))).thenThrow(
        new MongoSocketException("Connection reset", new ServerAddress()));
    try {
      store.find(ID);
      fail("Expected TransientStorageException");
    } catch (TransientStorageException e) {
      assertTrue(e.getCause() instanceof MongoSocketException);
    }
  }

  @Test
  public void deleteNewerThan() throws Exception {
    when(collection.deleteMany(eq(session), any(Bson.class)))
        .thenReturn(DeleteResult.acknowledged(3));
    final long deleted = store.inTransaction(ID, new TransactionWork<Long>() {
      @Override
      public Long execute(final ChangePointTransaction transaction) {
        return transaction.deleteNewerThan(200L);
      }
    });
    assertEquals(3, deleted);

    final ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection).deleteMany(eq(session), filter.capture());
    assertEquals(ChangePointDocuments.identifierFilter(ID)
        .append("order", new Document("$gt", 200L)), filter.getValue());
    verify(session).close();
  }

  @Test
  public void deleteAll() throws Exception {
    when(collection.deleteMany(eq(session), any(Bson.class)))
        .thenReturn(DeleteResult.acknowledged(0));
    store.inTransaction(ID, new TransactionWork<Long>() {
      @Override
      public Long execute(final ChangePointTransaction transaction) {
        return transaction.deleteNewerThan(null);
      }
    });
    final ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection).deleteMany(eq(session), filter.capture());
    assertFalse(((Document) filter.getValue()).containsKey("order"));
  }

  @Test
  public void findNewerThan() throws Exception {
    returns(ChangePointDocuments.toDocument(changePoint(250)));
    final List<ChangePoint> newer = store.inTransaction(ID, 
        new TransactionWork<List<ChangePoint>>() {
      @Override
      public List<ChangePoint> execute(
          final ChangePointTransaction transaction) {
        return transaction.findNewerThan(200L);
      }
    });
    assertEquals(ImmutableList.of(changePoint(250)), newer);
    verify(collection).find(eq(session), any(Bson.class));
  }

  @SuppressWarnings("unchecked")
  @Test
  public void insert() throws Exception {
    store.inTransaction(ID, new TransactionWork<Void>() {
      @Override
      public Void execute(final ChangePointTransaction transaction) {
        transaction.insert(ImmutableList.of(changePoint(100), 
            changePoint(250)));
        return null;
      }
    });
    final ArgumentCaptor<List<Document>> documents = 
        ArgumentCaptor.forClass(List.class);
    verify(collection).insertMany(eq(session), documents.capture());
    assertEquals(2, documents.getValue().size());
    assertEquals("rev250", 
        documents.getValue().get(1).get("suspect_revision"));
  }

  @Test
  public void insertNothing() throws Exception {
    store.inTransaction(ID, new TransactionWork<Void>() {
      @Override
      public Void execute(final ChangePointTransaction transaction) {
        transaction.insert(ImmutableList.<ChangePoint>of());
        return null;
      }
    });
    verify(collection, never()).insertMany(any(ClientSession.class), 
        anyList());
  }

  @Test
  public void findPrevious() throws Exception {
    when(iterable.first())
        .thenReturn(ChangePointDocuments.toDocument(changePoint(100)))
        .thenReturn(null);
    final TransactionWork<ChangePoint> work = 
        new TransactionWork<ChangePoint>() {
      @Override
      public ChangePoint execute(final ChangePointTransaction transaction) {
        return transaction.findPrevious(250);
      }
    };
    assertEquals(changePoint(100), store.inTransaction(ID, work));
    assertNull(store.inTransaction(ID, work));

    final ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(collection, times(2))
        .find(eq(session), filter.capture());
    assertEquals(new Document("$lt", 250L), 
        ((Document) filter.getValue()).get("order"));
  }

  @Test
  public void updateNextStatistics() throws Exception {
    when(collection.updateOne(eq(session), any(Bson.class), any(Bson.class)))
        .thenReturn(UpdateResult.acknowledged(1, 1L, null));
    store.inTransaction(ID, new TransactionWork<Void>() {
      @Override
      public Void execute(final ChangePointTransaction transaction) {
        transaction.updateNextStatistics(changePoint(100), 
            statistics(30, 1100));
        return null;
      }
    });
    final ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    final ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
    verify(collection).updateOne(eq(session), filter.capture(), 
        update.capture());
    assertEquals(100L, ((Document) filter.getValue()).get("order"));
    final BsonDocument set = update.getValue().toBsonDocument()
        .getDocument("$set");
    assertEquals(30, set.getDocument("statistics.next")
        .getNumber("nobs").intValue());
  }

  @Test
  public void transientTransactionFailure() throws Exception {
    final MongoException conflict = new MongoException("Write conflict");
    conflict.addLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);
    when(session.withTransaction(any(TransactionBody.class)))
        .thenThrow(conflict);
    try {
      store.inTransaction(ID, new TransactionWork<Void>() {
        @Override
        public Void execute(final ChangePointTransaction transaction) {
          return null;
        }
      });
      fail("Expected TransientStorageException");
    } catch (TransientStorageException e) {
      assertSame(conflict, e.getCause());
    }
    verify(session).close();
  }

  @Test
  public void permanentFailure() throws Exception {
    final MongoException failure = new MongoException("Unauthorized");
    when(session.withTransaction(any(TransactionBody.class)))
        .thenThrow(failure);
    try {
      store.inTransaction(ID, new TransactionWork<Void>() {
        @Override
        public Void execute(final ChangePointTransaction transaction) {
          return null;
        }
      });
      fail("Expected MongoException");
    } catch (MongoException e) {
      assertSame(failure, e);
    }
  }

  @SuppressWarnings("unchecked")
  private void returns(final Document... documents) {
    when(iterable.into(any(Collection.class))).thenAnswer(invocation -> {
      final Collection<Document> target = invocation.getArgument(0);
      for (final Document document : documents) {
        target.add(document);
      }
      return target;
    });
  }
}
