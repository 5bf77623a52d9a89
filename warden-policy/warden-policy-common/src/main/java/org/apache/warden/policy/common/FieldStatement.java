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

import static org.apache.warden.core.common.utils.WardenConstants.KEY_EFFECT;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_FIELDS;
import static org.apache.warden.core.common.utils.WardenConstants.KEY_PRINCIPAL;
import static org.apache.warden.core.common.utils.WardenConstants.WILDCARD;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Field statement: the fields ({@code *} for all) a field permission applies
 * to for the matching principals. Immutable.
 */
public final class FieldStatement extends BaseStatement {

  private static final String KIND = "Access Policy Serializer Statement";
  private static final ImmutableSet<String> KEYS = ImmutableSet.of(KEY_PRINCIPAL, KEY_FIELDS,
      KEY_EFFECT);

  private final ImmutableSet<String> fields;

  public FieldStatement(Iterable<String> principals, Iterable<String> fields, Effect effect) {
    super(principals, effect);
    this.fields = ImmutableSet.copyOf(fields);
  }

  public FieldStatement(String principal, String fields, Effect effect) {
    this(ImmutableList.of(principal), ImmutableList.of(fields), effect);
  }

  public FieldStatement(String principal, String fields) {
    this(principal, fields, Effect.DEFAULT);
  }

  /**
   * Builds a field statement from its declared form; {@code principal} and
   * {@code fields} are required.
   */
  public static FieldStatement fromMap(Map<String, ?> statement) {
    Object principal = StatementValues.require(statement, KEY_PRINCIPAL, KIND);
    Object fields = StatementValues.require(statement, KEY_FIELDS, KIND);
    StatementValues.rejectUnknownKeys(statement, KEYS, KIND);
    return new FieldStatement(StatementValues.toList(principal, KEY_PRINCIPAL),
        StatementValues.toList(fields, KEY_FIELDS),
        Effect.fromValue(StatementValues.effectValue(statement.get(KEY_EFFECT))));
  }

  public ImmutableSet<String> getFields() {
    return fields;
  }

  public boolean matchField(String fieldName) {
    return fields.contains(WILDCARD) || fields.contains(fieldName);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FieldStatement)) {
      return false;
    }
    FieldStatement other = (FieldStatement) o;
    return getPrincipals().equals(other.getPrincipals()) && getEffect() == other.getEffect()
        && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(getPrincipals(), getEffect(), fields);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("principal", getPrincipals())
        .add("fields", fields)
        .add("effect", getEffect().getValue())
        .toString();
  }
}
