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
package net.perfsignal.utils;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This class simplifies working with Jackson by providing a single, static
 * mapper and helpers that convert the myriad of Jackson exceptions into
 * {@link IllegalArgumentException}s for bad input or {@link JSONException}s
 * for everything else.
 * <p>
 * Non-numeric numbers are allowed since segment statistics legitimately
 * carry NaN values.
 * @since 1.0
 */
public final class JSON {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }

  /**
   * Deserializes a JSON formatted string to a specific class type
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws JSONException if the data could not be parsed
   */
  public static final <T> T parseToObject(final String json,
      final Class<T> pojo) {
    if (json == null || json.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");

    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Parses a string into a tree.
   * @param json The string to parse.
   * @return A non-null root node.
   * @throws IllegalArgumentException if the string was null, empty or could
   * not be parsed
   * @throws JSONException if the content could not be read
   */
  public static final JsonNode parseToTree(final String json) {
    if (json == null || json.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    try {
      return jsonMapper.readTree(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string
   * @param object The object to serialize
   * @return A JSON formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null)
      throw new IllegalArgumentException("Object was null");
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Converts the object into a tree of maps, lists and scalars following its
   * Jackson annotations.
   * @param object The object to convert.
   * @return A map keyed on the serialized property names.
   * @throws IllegalArgumentException if the object was null or did not map
   * to a JSON object.
   */
  public static final Map<String, Object> convertToMap(final Object object) {
    if (object == null)
      throw new IllegalArgumentException("Object was null");
    return jsonMapper.convertValue(object,
        new TypeReference<Map<String, Object>>() { });
  }

  /**
   * Converts a map of properties back into the given type.
   * @param map The map to convert.
   * @param pojo The type to build.
   * @return The object.
   * @throws IllegalArgumentException if the map was null or conversion
   * failed.
   */
  public static final <T> T convertFromMap(final Map<String, ?> map,
                                           final Class<T> pojo) {
    if (map == null)
      throw new IllegalArgumentException("Map was null");
    return jsonMapper.convertValue(map, pojo);
  }

  /** @return The shared mapper. Do not re-configure it. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }
}
