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

import org.apache.warden.core.common.GroupResolver;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * What access and field statements share: the principals they apply to and
 * the effect they carry.
 */
public abstract class BaseStatement {

  private final ImmutableSet<String> principals;
  private final Effect effect;

  protected BaseStatement(Iterable<String> principals, Effect effect) {
    this.principals = ImmutableSet.copyOf(principals);
    this.effect = Preconditions.checkNotNull(effect, "Effect cannot be null");
  }

  public ImmutableSet<String> getPrincipals() {
    return principals;
  }

  public Effect getEffect() {
    return effect;
  }

  public List<String> getGroupNamesFromPrincipals(String groupPrefix) {
    return PrincipalMatcher.groupNames(principals, groupPrefix);
  }

  /**
   * A resolver carried by the context takes precedence over the policy's own.
   */
  public boolean matchPrincipal(Policy policy, EvaluationContext context) {
    GroupResolver resolver = context.getGroupResolver() != null
        ? context.getGroupResolver() : policy.getGroupResolver();
    return PrincipalMatcher.matches(principals, context.getActor(), resolver,
        policy::isMemberInGroup, policy.getGroupPrefix(), policy.getIdPrefix());
  }
}
