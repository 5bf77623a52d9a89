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

import java.util.List;

import org.apache.warden.policy.common.Effect;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.common.Policy;
import org.apache.warden.policy.common.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * Combines statement outcomes into an access decision. An explicit deny wins,
 * then any allow; statements without an effect must all match, and only count
 * when there is at least one. A policy without statements denies.
 */
public final class PolicyEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PolicyEvaluator.class);

  private PolicyEvaluator() {
  }

  /**
   * Decides the request against the flattened statements of the policy.
   */
  public static boolean evaluate(AccessPolicy policy, EvaluationContext context) {
    Preconditions.checkNotNull(policy, "Policy cannot be null");
    Preconditions.checkNotNull(context, "Evaluation context cannot be null");
    return evaluate(policy, StatementFlattener.flattenStatements(policy, context), context);
  }

  /**
   * Decides the request against already flattened statements. Conditions are
   * resolved against {@code policy} whichever policy a statement came from.
   */
  public static boolean evaluate(Policy policy, List<Statement> statements,
      EvaluationContext context) {
    ListMultimap<Effect, Statement> grouped = ArrayListMultimap.create();
    for (Statement statement : statements) {
      grouped.put(statement.getEffect(), statement);
    }

    if (grouped.isEmpty()) {
      LOGGER.debug("No statements in policy {}, denying", policy);
      return false;
    }

    for (Statement statement : grouped.get(Effect.DENY)) {
      if (statement.evaluate(policy, context)) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Denied " + context + " by " + statement);
        }
        return false;
      }
    }

    for (Statement statement : grouped.get(Effect.ALLOW)) {
      if (statement.evaluate(policy, context)) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Allowed " + context + " by " + statement);
        }
        return true;
      }
    }

    List<Statement> defaults = grouped.get(Effect.DEFAULT);
    if (defaults.isEmpty()) {
      LOGGER.debug("No allow or default statement matched {}", context);
      return false;
    }
    for (Statement statement : defaults) {
      if (!statement.evaluate(policy, context)) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Default statement " + statement + " did not match " + context);
        }
        return false;
      }
    }
    return true;
  }
}
