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

import java.util.Map;

import org.bson.Document;

import com.google.common.base.Preconditions;

import net.perfsignal.data.ChangePoint;
import net.perfsignal.data.SegmentStatistics;
import net.perfsignal.data.TestIdentifier;
import net.perfsignal.utils.JSON;

/**
 * Maps change points to and from the snake_case documents of the
 * {@code change_points} collection through the Jackson bindings of the
 * data classes.
 *
 * @since 1.0
 */
public final class ChangePointDocuments {

  /** The key of the primary key field Mongo adds on insert. */
  public static final String ID_KEY = "_id";

  private ChangePointDocuments() {
    // Statics only.
  }

  /**
   * @param change_point A non-null change point.
   * @return A new document holding the change point.
   */
  public static Document toDocument(final ChangePoint change_point) {
    Preconditions.checkNotNull(change_point, "Change point cannot be null.");
    return new Document(JSON.convertToMap(change_point));
  }

  /**
   * @param statistics The statistics to convert, may be null.
   * @return A document holding the statistics or null.
   */
  public static Document toDocument(final SegmentStatistics statistics) {
    if (statistics == null) {
      return null;
    }
    return new Document(JSON.convertToMap(statistics));
  }

  /**
   * @param document A non-null stored document. The {@code _id} is ignored.
   * @return The change point.
   * @throws IllegalArgumentException if the document could not be mapped.
   */
  public static ChangePoint fromDocument(final Document document) {
    Preconditions.checkNotNull(document, "Document cannot be null.");
    final Map<String, Object> copy = new Document(document);
    copy.remove(ID_KEY);
    return JSON.convertFromMap(copy, ChangePoint.class);
  }

  /**
   * @param id A non-null identifier.
   * @return A filter matching the change points of the series.
   */
  public static Document identifierFilter(final TestIdentifier id) {
    Preconditions.checkNotNull(id, "Identifier cannot be null.");
    return new Document("project", id.project())
        .append("variant", id.variant())
        .append("task", id.task())
        .append("test", id.test())
        .append("thread_level", id.threadLevel());
  }
}
