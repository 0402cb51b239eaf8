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

import java.io.Closeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;

import net.perfsignal.utils.Config;

/**
 * Opens the Mongo client named by {@link Config#MONGO_URI_KEY} and exposes
 * the stores backed by the {@link Config#MONGO_DATABASE_KEY} database.
 * Close it to release the connection pool.
 *
 * @since 1.0
 */
public class MongoStorage implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      MongoStorage.class);

  private final MongoClient client;
  private final MongoPerformanceDataStore data_store;
  private final MongoChangePointStore change_point_store;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @throws IllegalArgumentException if the URI was malformed.
   */
  public MongoStorage(final Config config) {
    this(config, MongoClients.create(
        Preconditions.checkNotNull(config, "Config cannot be null.")
            .getString(Config.MONGO_URI_KEY)));
  }

  @VisibleForTesting
  MongoStorage(final Config config, final MongoClient client) {
    Preconditions.checkNotNull(client, "Client cannot be null.");
    this.client = client;
    final String name = config.getString(Config.MONGO_DATABASE_KEY);
    final MongoDatabase database = client.getDatabase(name);
    data_store = new MongoPerformanceDataStore(database);
    change_point_store = new MongoChangePointStore(client, database);
    LOG.info("Using Mongo database " + name);
  }

  /** @return The points store. */
  public MongoPerformanceDataStore dataStore() {
    return data_store;
  }

  /** @return The change point store. */
  public MongoChangePointStore changePointStore() {
    return change_point_store;
  }

  @Override
  public void close() {
    client.close();
  }
}
