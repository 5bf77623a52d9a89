/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.warden.policy.common;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import org.apache.warden.core.common.exception.StatementValidationException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Normalizes the single-or-many values statements are declared with.
 */
final class StatementValues {

  private StatementValues() {
  }

  static ImmutableList<String> toList(Object value, String key) {
    if (value instanceof String) {
      return ImmutableList.of((String) value);
    }
    if (value instanceof Collection) {
      ImmutableList.Builder<String> values = ImmutableList.builder();
      for (Object element : (Collection<?>) value) {
        if (!(element instanceof String)) {
          throw new StatementValidationException("Statement \"" + key
              + "\" values must be strings (not " + typeName(element) + ")");
        }
        values.add((String) element);
      }
      return values.build();
    }
    throw new StatementValidationException("Statement \"" + key
        + "\" must be a string or a collection of strings (not " + typeName(value) + ")");
  }

  /**
   * Conditions declared as a single empty string mean no conditions.
   */
  static ImmutableList<String> toOptionalList(Object value, String key) {
    if (value == null || "".equals(value)) {
      return ImmutableList.of();
    }
    return toList(value, key);
  }

  static Object require(Map<String, ?> map, String key, String statementKind) {
    if (!map.containsKey(key)) {
      throw new StatementValidationException(statementKind + " must specify \"" + key + "\" value.");
    }
    return map.get(key);
  }

  static void rejectUnknownKeys(Map<String, ?> map, Set<String> known, String statementKind) {
    Set<String> unknown = Sets.difference(map.keySet(), known);
    if (!unknown.isEmpty()) {
      throw new StatementValidationException(statementKind + " got unexpected keys "
          + ImmutableSet.copyOf(unknown));
    }
  }

  static String effectValue(Object value) {
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new StatementValidationException(
        "Statement effect must be either \"allow\" or \"deny\" (not \"" + value + "\")");
  }

  static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
