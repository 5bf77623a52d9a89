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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.SimpleActor;
import org.apache.warden.core.common.conf.AccessPolicyConf;
import org.apache.warden.core.common.conf.AccessPolicyConf.AuthzConfVars;
import org.apache.warden.policy.common.ConditionRegistry;
import org.apache.warden.policy.common.Effect;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.common.FieldStatement;
import org.apache.warden.policy.common.Statement;
import org.apache.warden.policy.engine.AccessPolicy;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public class TestAccessPolicyAuthorizationProvider {

  private static final Actor USER = SimpleActor.builder("3").build();

  private AccessPolicyConf conf;
  private AccessPolicy policy;

  @Before
  public void setUp() {
    conf = new AccessPolicyConf();
    policy = new AccessPolicy("articles", ImmutableList.of(
        Statement.builder().principal("*").action("list", "retrieve").effect("allow").build(),
        Statement.builder().principal("authenticated").action("<safe_methods>")
            .effect("allow").build(),
        Statement.builder().principal("authenticated").action("publish").effect("allow")
            .condition("isWeekday").build()),
        ImmutableMap.of("read_only", ImmutableList.of(
            new FieldStatement("*", "*"),
            new FieldStatement("admin", "*", Effect.ALLOW))));
  }

  @After
  public void tearDown() {
    ConditionRegistry.getInstance().reset();
  }

  @Test
  public void testHasAccess() {
    AccessPolicyAuthorizationProvider provider =
        new AccessPolicyAuthorizationProvider(conf, policy);
    assertTrue(provider.hasAccess(EvaluationContext.builder().action("list").build()));
    assertEquals(new AccessEnforcement("list", true), provider.getLastAccessEnforcement());

    assertFalse(provider.hasAccess(EvaluationContext.builder().action("create")
        .requestMethod("POST").build()));
    assertEquals(new AccessEnforcement("create", false), provider.getLastAccessEnforcement());
  }

  @Test
  public void testDefaultMethod() {
    AccessPolicyAuthorizationProvider provider =
        new AccessPolicyAuthorizationProvider(conf, policy);
    assertTrue(provider.hasAccess(USER, "export", null));

    conf.set(AuthzConfVars.AUTHZ_DEFAULT_METHOD, "POST");
    provider = new AccessPolicyAuthorizationProvider(conf, policy);
    assertFalse(provider.hasAccess(USER, "export", null));
  }

  @Test
  public void testConditionClassesFromConfiguration() {
    conf.set(AuthzConfVars.AUTHZ_CONDITION_CLASSES, ReusableConditions.class.getName());
    AccessPolicyAuthorizationProvider provider =
        new AccessPolicyAuthorizationProvider(conf, policy);
    assertEquals(ImmutableList.of(ReusableConditions.class),
        ConditionRegistry.getInstance().getSources());
    assertTrue(provider.hasAccess(EvaluationContext.builder().actor(USER).action("publish")
        .requestMethod("POST").context("weekday").build()));
    assertFalse(provider.hasAccess(EvaluationContext.builder().actor(USER).action("publish")
        .requestMethod("POST").context("sunday").build()));
  }

  @Test
  public void testEmptyConditionClassesKeepRegistry() {
    ConditionRegistry.getInstance().configure(ImmutableList.of(ReusableConditions.class));
    new AccessPolicyAuthorizationProvider(conf, policy);
    assertEquals(ImmutableList.of(ReusableConditions.class),
        ConditionRegistry.getInstance().getSources());
  }

  @Test
  public void testLastEnforcementIsPerThread() throws Exception {
    AccessPolicyAuthorizationProvider provider =
        new AccessPolicyAuthorizationProvider(conf, policy);
    provider.hasAccess(EvaluationContext.builder().action("list").build());

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<AccessEnforcement> other = executor.submit(provider::getLastAccessEnforcement);
      assertNull(other.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
    assertEquals(new AccessEnforcement("list", true), provider.getLastAccessEnforcement());
  }

  @Test
  public void testRestrictedFields() {
    AccessPolicyAuthorizationProvider provider =
        new AccessPolicyAuthorizationProvider(conf, policy);
    List<String> fields = ImmutableList.of("title", "body");
    assertEquals(ImmutableSet.copyOf(fields), provider.getRestrictedFields("read_only",
        EvaluationContext.builder().actor(USER).build(), ImmutableSet.copyOf(fields)));
    assertEquals(ImmutableSet.of(), provider.getRestrictedFields("read_only",
        EvaluationContext.builder().actor(SimpleActor.builder("1").superuser(true).build())
            .build(), ImmutableSet.copyOf(fields)));
  }

  @Test(expected = NullPointerException.class)
  public void testNullContext() {
    new AccessPolicyAuthorizationProvider(conf, policy).hasAccess(null);
  }

  @Test(expected = NullPointerException.class)
  public void testNullPolicy() {
    new AccessPolicyAuthorizationProvider(conf, null);
  }
}
