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

import static org.junit.Assert.assertNotNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.Test;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import net.perfsignal.utils.Config;

public class TestMongoStorage {

  @Test
  public void ctorAndClose() throws Exception {
    final Config config = new Config(false);
    config.overrideConfig(Config.MONGO_DATABASE_KEY, "perf_test");
    final MongoClient client = mock(MongoClient.class);
    final MongoDatabase database = mock(MongoDatabase.class);
    when(client.getDatabase(anyString())).thenReturn(database);

    final MongoStorage storage = new MongoStorage(config, client);
    assertNotNull(storage.dataStore());
    assertNotNull(storage.changePointStore());
    verify(client).getDatabase("perf_test");
    verify(database).getCollection(MongoPerformanceDataStore.POINTS);
    verify(database).getCollection(MongoChangePointStore.COLLECTION);

    storage.close();
    verify(client).close();
  }

  @Test(expected = NullPointerException.class)
  public void nullClient() throws Exception {
    new MongoStorage(new Config(false), null);
  }
}
