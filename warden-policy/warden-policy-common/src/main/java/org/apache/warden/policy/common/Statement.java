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

import static org.apache.warden.core.common.utils.WardenConstants.KEY_ACTION;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_CONDITION;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_CONDITION_EXPRESSION;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_EFFECT;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_PRINCIPAL;

import java.util.Arrays;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Access statement: who ({@code principal}) may or may not ({@code effect})
 * perform what ({@code action}), and under which conditions. Immutable.
 */
public final class Statement extends BaseStatement {

  private static final String KIND = "Access Policy Statement";
  private static final ImmutableSet<String> KEYS = ImmutableSet.of(KEY_PRINCIPAL, KEY_ACTION,
      KEY_EFFECT, KEY_CONDITION, KEY_CONDITION_EXPRESSION);

  private final ImmutableSet<String> actions;
  private final ImmutableList<String> conditions;
  private final ImmutableList<String> conditionExpressions;

  private Statement(Builder builder) {
    super(builder.principals, builder.effect);
    this.actions = ImmutableSet.copyOf(builder.actions);
    this.conditions = builder.conditions;
    this.conditionExpressions = builder.conditionExpressions;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a statement from its declared form. {@code principal} and
   * {@code action} are required; each value is a string or a collection of
   * strings, except {@code effect}.
   *
   * @throws org.apache.warden.core.common.exception.StatementValidationException
   *         on a missing or unknown key, or an invalid value
   */
  public static Statement fromMap(Map<String, ?> statement) {
    Object principal = StatementValues.require(statement, KEY_PRINCIPAL, KIND);
    Object action = StatementValues.require(statement, KEY_ACTION, KIND);
    StatementValues.rejectUnknownKeys(statement, KEYS, KIND);
    Builder builder = new Builder();
    builder.principals = StatementValues.toList(principal, KEY_PRINCIPAL);
    builder.actions = StatementValues.toList(action, KEY_ACTION);
    builder.effect = Effect.fromValue(StatementValues.effectValue(statement.get(KEY_EFFECT)));
    builder.conditions = StatementValues.toOptionalList(statement.get(KEY_CONDITION), KEY_CONDITION);
    builder.conditionExpressions = StatementValues.toOptionalList(
        statement.get(KEY_CONDITION_EXPRESSION), KEY_CONDITION_EXPRESSION);
    return builder.build();
  }

  public ImmutableSet<String> getActions() {
    return actions;
  }

  public ImmutableList<String> getConditions() {
    return conditions;
  }

  public ImmutableList<String> getConditionExpressions() {
    return conditionExpressions;
  }

  public boolean matchAction(Policy policy, EvaluationContext context) {
    return ActionMatcher.matches(actions, context.getRequestMethod(), context.getAction());
  }

  public boolean matchCondition(Policy policy, EvaluationContext context) {
    for (String condition : conditions) {
      if (!Conditions.check(policy, condition, context)) {
        return false;
      }
    }
    return true;
  }

  public boolean matchConditionExpression(Policy policy, EvaluationContext context) {
    for (String expression : conditionExpressions) {
      if (!Conditions.checkExpression(policy, expression, context)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Principal, action, conditions, then condition expressions; stops at the
   * first one that does not match.
   */
  public boolean evaluate(Policy policy, EvaluationContext context) {
    return matchPrincipal(policy, context)
        && matchAction(policy, context)
        && matchCondition(policy, context)
        && matchConditionExpression(policy, context);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Statement)) {
      return false;
    }
    Statement other = (Statement) o;
    return getPrincipals().equals(other.getPrincipals()) && getEffect() == other.getEffect()
        && actions.equals(other.actions) && conditions.equals(other.conditions)
        && conditionExpressions.equals(other.conditionExpressions);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(getPrincipals(), getEffect(), actions, conditions,
        conditionExpressions);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("principal", getPrincipals())
        .add("action", actions)
        .add("effect", getEffect().getValue())
        .add("condition", conditions)
        .add("conditionExpression", conditionExpressions)
        .toString();
  }

  public static class Builder {
    private ImmutableList<String> principals = ImmutableList.of();
    private ImmutableList<String> actions = ImmutableList.of();
    private Effect effect = Effect.DEFAULT;
    private ImmutableList<String> conditions = ImmutableList.of();
    private ImmutableList<String> conditionExpressions = ImmutableList.of();

    private Builder() {
    }

    public Builder principal(String... values) {
      principals = ImmutableList.copyOf(values);
      return this;
    }

    public Builder action(String... values) {
      actions = ImmutableList.copyOf(values);
      return this;
    }

    public Builder effect(Effect value) {
      effect = value == null ? Effect.DEFAULT : value;
      return this;
    }

    /**
     * @throws org.apache.warden.core.common.exception.StatementValidationException
     *         unless the value is "allow", "deny" or null
     */
    public Builder effect(String value) {
      effect = Effect.fromValue(value);
      return this;
    }

    public Builder condition(String... values) {
      conditions = StatementValues.toOptionalList(values.length == 1 ? values[0]
          : Arrays.asList(values), KEY_CONDITION);
      return this;
    }

    public Builder conditionExpression(String... values) {
      conditionExpressions = StatementValues.toOptionalList(values.length == 1 ? values[0]
          : Arrays.asList(values), KEY_CONDITION_EXPRESSION);
      return this;
    }

    public Statement build() {
      return new Statement(this);
    }
  }
}
