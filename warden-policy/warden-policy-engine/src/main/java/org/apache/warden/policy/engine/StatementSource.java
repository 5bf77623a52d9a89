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

import java.util.Map;
import java.util.Optional;

import org.apache.warden.policy.common.BaseStatement;

import com.google.common.base.Preconditions;

/**
 * One entry of a policy's statement list. Raw entries are classified with
 * {@link #classify(Object)}; the union is closed, so whatever does not
 * classify is not a statement source.
 */
public abstract class StatementSource {

  public enum Kind {
    LITERAL, MAPPING, POLICY, POLICY_TYPE
  }

  private StatementSource() {
  }

  public abstract Kind getKind();

  public static StatementSource literal(BaseStatement statement) {
    return new Literal(Preconditions.checkNotNull(statement));
  }

  public static StatementSource mapping(Map<String, ?> statement) {
    return new Mapping(Preconditions.checkNotNull(statement));
  }

  public static StatementSource policy(AccessPolicy policy) {
    return new PolicyInstance(Preconditions.checkNotNull(policy));
  }

  public static StatementSource policyType(Class<? extends AccessPolicy> type) {
    return new PolicyType(Preconditions.checkNotNull(type));
  }

  /**
   * @return the source the raw entry stands for, or empty for anything that is
   *         neither a statement, a map, a policy nor a policy class
   */
  @SuppressWarnings("unchecked")
  public static Optional<StatementSource> classify(Object raw) {
    if (raw instanceof StatementSource) {
      return Optional.of((StatementSource) raw);
    } else if (raw instanceof BaseStatement) {
      return Optional.of(literal((BaseStatement) raw));
    } else if (raw instanceof Map) {
      return Optional.of(mapping((Map<String, ?>) raw));
    } else if (raw instanceof AccessPolicy) {
      return Optional.of(policy((AccessPolicy) raw));
    } else if (raw instanceof Class && AccessPolicy.class.isAssignableFrom((Class<?>) raw)) {
      return Optional.of(policyType((Class<? extends AccessPolicy>) raw));
    }
    return Optional.empty();
  }

  static final class Literal extends StatementSource {
    private final BaseStatement statement;

    private Literal(BaseStatement statement) {
      this.statement = statement;
    }

    BaseStatement getStatement() {
      return statement;
    }

    @Override
    public Kind getKind() {
      return Kind.LITERAL;
    }
  }

  static final class Mapping extends StatementSource {
    private final Map<String, ?> statement;

    private Mapping(Map<String, ?> statement) {
      this.statement = statement;
    }

    Map<String, ?> getStatement() {
      return statement;
    }

    @Override
    public Kind getKind() {
      return Kind.MAPPING;
    }
  }

  static final class PolicyInstance extends StatementSource {
    private final AccessPolicy policy;

    private PolicyInstance(AccessPolicy policy) {
      this.policy = policy;
    }

    AccessPolicy getPolicy() {
      return policy;
    }

    @Override
    public Kind getKind() {
      return Kind.POLICY;
    }
  }

  static final class PolicyType extends StatementSource {
    private final Class<? extends AccessPolicy> type;

    private PolicyType(Class<? extends AccessPolicy> type) {
      this.type = type;
    }

    Class<? extends AccessPolicy> getType() {
      return type;
    }

    @Override
    public Kind getKind() {
      return Kind.POLICY_TYPE;
    }
  }
}
