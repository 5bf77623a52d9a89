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
package org.apache.warden.provider.common;

import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.conf.AccessPolicyConf;
import org.apache.warden.core.common.conf.AccessPolicyConf.AuthzConfVars;
import org.apache.warden.policy.common.ConditionRegistry;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.engine.AccessPolicy;
import org.apache.warden.policy.engine.FieldSelector;
import org.apache.warden.policy.engine.PolicyEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Entry point for adapters: decides requests against one access policy and
 * remembers, per thread, the enforcement of the last decision.
 */
@ThreadSafe
public class AccessPolicyAuthorizationProvider {

  private static final Logger LOGGER = LoggerFactory
      .getLogger(AccessPolicyAuthorizationProvider.class);

  private static final ThreadLocal<AccessEnforcement> lastEnforcement =
      new ThreadLocal<AccessEnforcement>();

  private final AccessPolicy policy;
  private final String defaultMethod;

  /**
   * Condition classes listed in the configuration replace the sources of the
   * process wide {@link ConditionRegistry}; without any, the registry is left
   * as it is.
   */
  public AccessPolicyAuthorizationProvider(AccessPolicyConf conf, AccessPolicy policy) {
    this.policy = Preconditions.checkNotNull(policy, "Policy cannot be null");
    this.defaultMethod = conf.get(AuthzConfVars.AUTHZ_DEFAULT_METHOD);
    if (!conf.get(AuthzConfVars.AUTHZ_CONDITION_CLASSES).trim().isEmpty()) {
      ConditionRegistry.getInstance().configure(conf);
    }
  }

  /***
   * @param context the actor, action and request the decision is made for
   * @return True if the actor may perform the action
   */
  public boolean hasAccess(EvaluationContext context) {
    Preconditions.checkNotNull(context, "Evaluation context cannot be null");
    lastEnforcement.remove();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Authorization request for " + context + " against " + policy);
    }
    boolean allowed = PolicyEvaluator.evaluate(policy, context);
    lastEnforcement.set(new AccessEnforcement(context.getAction(), allowed));
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Action {} for {}: {}", new Object[] {context.getAction(),
          context.getActor(), allowed ? "allowed" : "denied"});
    }
    return allowed;
  }

  /**
   * Decides a request made with the configured default request method.
   */
  public boolean hasAccess(Actor actor, String action, @Nullable Object requestContext) {
    return hasAccess(EvaluationContext.builder()
        .actor(actor)
        .action(action)
        .requestMethod(defaultMethod)
        .context(requestContext)
        .build());
  }

  /**
   * @return the fields of {@code fieldNames} the field permission restricts
   */
  public ImmutableSet<String> getRestrictedFields(String key, EvaluationContext context,
      Set<String> fieldNames) {
    return FieldSelector.selectFields(policy, key, context, fieldNames);
  }

  /**
   * @return the enforcement of the last decision made on this thread, or null
   */
  @Nullable
  public AccessEnforcement getLastAccessEnforcement() {
    return lastEnforcement.get();
  }

  public AccessPolicy getPolicy() {
    return policy;
  }
}
