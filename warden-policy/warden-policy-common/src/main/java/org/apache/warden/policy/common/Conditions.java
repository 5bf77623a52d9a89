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

import java.util.List;
import java.util.Optional;

import org.apache.warden.core.common.exception.ConditionNotFoundException;
import org.apache.warden.core.common.exception.ConditionReturnTypeException;
import org.apache.warden.core.common.utils.WardenConstants;
import org.apache.warden.policy.common.expression.ConditionExpression;

public final class Conditions {

  private Conditions() {
  }

  /**
   * Searches the policy object first, then the {@link ConditionRegistry}.
   *
   * @throws ConditionNotFoundException if no condition of that name exists
   */
  public static Condition resolve(Object policy, String name) {
    Optional<Condition> local = ConditionMethods.onInstance(policy, name);
    if (local.isPresent()) {
      return local.get();
    }
    return ConditionRegistry.getInstance().lookup(name)
        .orElseThrow(() -> new ConditionNotFoundException(name));
  }

  /**
   * Evaluates a condition reference of the form {@code name} or
   * {@code name:argument}. Only the first ':' separates the argument.
   *
   * @throws ConditionReturnTypeException if the condition does not return a boolean
   */
  public static boolean check(Policy policy, String condition, EvaluationContext context) {
    List<String> parts = WardenConstants.CONDITION_SPLITTER.splitToList(condition);
    String name = parts.get(0);
    String argument = parts.size() == 2 ? parts.get(1) : null;

    Object result = policy.resolveCondition(name).evaluate(context, argument);
    if (result instanceof Boolean) {
      return (Boolean) result;
    }
    throw new ConditionReturnTypeException(condition, result);
  }

  /**
   * Evaluates a boolean expression over condition references, checking each
   * atom only when its value is needed.
   */
  public static boolean checkExpression(Policy policy, String expression,
      EvaluationContext context) {
    return ConditionExpression.compile(expression)
        .evaluate(atom -> check(policy, atom, context));
  }
}
