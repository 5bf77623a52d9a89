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

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.apache.warden.core.common.exception.PolicyCompositionException;
import org.apache.warden.policy.common.BaseStatement;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.common.FieldStatement;
import org.apache.warden.policy.common.Statement;

import com.google.common.collect.ImmutableList;

/**
 * Turns a policy's statement sources into a flat list of statements. Nested
 * policies are expanded where they appear, so document order is kept across
 * nesting. Source policies are only read.
 */
public final class StatementFlattener {

  private StatementFlattener() {
  }

  public static ImmutableList<Statement> flattenStatements(AccessPolicy policy,
      EvaluationContext context) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    new Walk<Statement>(Statement.class, Statement::fromMap,
        nested -> nested.getPolicyStatements(context), null)
        .expand(policy, statements);
    return statements.build();
  }

  public static ImmutableList<FieldStatement> flattenFieldStatements(AccessPolicy policy,
      String key) {
    ImmutableList.Builder<FieldStatement> statements = ImmutableList.builder();
    new Walk<FieldStatement>(FieldStatement.class, FieldStatement::fromMap,
        nested -> nested.getFieldStatements(key), key)
        .expand(policy, statements);
    return statements.build();
  }

  static AccessPolicy instantiate(Class<? extends AccessPolicy> type) {
    try {
      Constructor<? extends AccessPolicy> constructor = type.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (ReflectiveOperationException e) {
      throw new PolicyCompositionException("Unable to instantiate policy " + type.getName()
          + " with a no-argument constructor", e);
    }
  }

  private static final class Walk<S extends BaseStatement> {
    private final Class<S> statementType;
    private final Function<Map<String, ?>, S> fromMap;
    private final Function<AccessPolicy, List<?>> sources;
    private final String fieldKey;
    // policies being expanded, to stop a policy from containing itself
    private final Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());

    private Walk(Class<S> statementType, Function<Map<String, ?>, S> fromMap,
        Function<AccessPolicy, List<?>> sources, String fieldKey) {
      this.statementType = statementType;
      this.fromMap = fromMap;
      this.sources = sources;
      this.fieldKey = fieldKey;
    }

    void expand(AccessPolicy policy, ImmutableList.Builder<S> out) {
      if (!path.add(policy)) {
        throw new PolicyCompositionException("Policy " + policy + " contains itself");
      }
      List<?> entries = new ArrayList<Object>(sources.apply(policy));
      for (int index = 0; index < entries.size(); index++) {
        Object entry = entries.get(index);
        Optional<StatementSource> source = StatementSource.classify(entry);
        if (!source.isPresent()) {
          throw invalid(policy, entry, index);
        }
        switch (source.get().getKind()) {
          case LITERAL:
            BaseStatement statement = ((StatementSource.Literal) source.get()).getStatement();
            if (!statementType.isInstance(statement)) {
              throw invalid(policy, statement, index);
            }
            out.add(statementType.cast(statement));
            break;
          case MAPPING:
            out.add(fromMap.apply(((StatementSource.Mapping) source.get()).getStatement()));
            break;
          case POLICY:
            expand(((StatementSource.PolicyInstance) source.get()).getPolicy(), out);
            break;
          case POLICY_TYPE:
            Class<? extends AccessPolicy> type = ((StatementSource.PolicyType) source.get()).getType();
            if (!path.add(type)) {
              throw new PolicyCompositionException("Policy " + type.getName() + " contains itself");
            }
            expand(instantiate(type), out);
            path.remove(type);
            break;
          default:
            throw new AssertionError("Unknown statement source " + source.get().getKind());
        }
      }
      path.remove(policy);
    }

    private PolicyCompositionException invalid(AccessPolicy policy, Object entry, int index) {
      String type = entry == null ? "null" : entry.getClass().getName();
      if (fieldKey == null) {
        return new PolicyCompositionException("Invalid statement object type \"" + type
            + "\", in policy " + policy + " at index " + index);
      }
      return new PolicyCompositionException("Invalid field permissions statement object type \""
          + type + "\", in policy " + policy + " for \"" + fieldKey + "\" at index " + index);
    }
  }
}
