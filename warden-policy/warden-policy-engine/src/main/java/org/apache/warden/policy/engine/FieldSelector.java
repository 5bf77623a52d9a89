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
package org.apache.warden.policy.engine;

import static org.apache.warden.core.common.utils.WardenConstants.WILDCARD;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.warden.policy.common.Effect;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.common.FieldStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Selects the fields a field permission applies to for one request.
 */
public final class FieldSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(FieldSelector.class);

  private FieldSelector() {
  }

  /**
   * Only the principal of each field statement is matched. Denied fields are
   * always selected; default fields are selected unless allowed. A denied
   * {@code *} selects every field and an allowed {@code *} cancels the default
   * fields.
   *
   * @param fieldNames every field known to the caller, in the caller's order
   * @return the selected subset of {@code fieldNames}
   */
  public static ImmutableSet<String> selectFields(AccessPolicy policy, String key,
      EvaluationContext context, Set<String> fieldNames) {
    Preconditions.checkNotNull(policy, "Policy cannot be null");
    Preconditions.checkNotNull(key, "Field permission key cannot be null");
    EvaluationContext principalOnly = context.withAction("");

    Map<Effect, Set<String>> grouped = new EnumMap<Effect, Set<String>>(Effect.class);
    for (Effect effect : Effect.values()) {
      grouped.put(effect, new HashSet<String>());
    }
    for (FieldStatement statement : StatementFlattener.flattenFieldStatements(policy, key)) {
      if (statement.matchPrincipal(policy, principalOnly)) {
        grouped.get(statement.getEffect()).addAll(statement.getFields());
      }
    }

    if (grouped.get(Effect.DENY).contains(WILDCARD)) {
      return ImmutableSet.copyOf(fieldNames);
    }
    if (grouped.get(Effect.ALLOW).contains(WILDCARD)) {
      grouped.put(Effect.DEFAULT, new HashSet<String>());
    }
    if (grouped.get(Effect.DEFAULT).contains(WILDCARD)) {
      grouped.put(Effect.DEFAULT, new HashSet<String>(fieldNames));
    }

    Set<String> matched = Sets.union(grouped.get(Effect.DENY),
        Sets.difference(grouped.get(Effect.DEFAULT), grouped.get(Effect.ALLOW)));
    ImmutableSet.Builder<String> selected = ImmutableSet.builder();
    for (String name : fieldNames) {
      if (matched.contains(name)) {
        selected.add(name);
      }
    }
    ImmutableSet<String> result = selected.build();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Field permission " + key + " of " + policy + " selects " + result
          + " for " + context);
    }
    return result;
  }
}
