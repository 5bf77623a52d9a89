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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.conf.Configuration;
import org.apache.warden.core.common.SimpleActor;
import org.apache.warden.core.common.conf.AccessPolicyConf.AuthzConfVars;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestConditionRegistry {

  private ConditionRegistry registry;
  private EvaluationContext context;

  @Before
  public void setUp() {
    registry = new ConditionRegistry();
    context = EvaluationContext.builder().actor(SimpleActor.anonymous()).build();
  }

  @After
  public void tearDown() {
    ConditionRegistry.getInstance().reset();
  }

  @Test
  public void testGetCondition() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    Optional<Condition> condition = registry.lookup("isAFunc");
    assertTrue(condition.isPresent());
    assertEquals(Boolean.TRUE, condition.get().evaluate(context, null));
  }

  @Test
  public void testNotConfigured() {
    assertFalse(registry.lookup("isAFunc").isPresent());
  }

  @Test
  public void testFieldIsNotACondition() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    assertFalse(registry.lookup("notAFunc").isPresent());
  }

  @Test
  public void testClassSourceOnlyContributesStaticMethods() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    assertFalse(registry.lookup("instanceOnly").isPresent());
  }

  @Test
  public void testInstanceSource() {
    registry.configure(ImmutableList.of(new ConditionsForTest()));
    assertTrue(registry.lookup("instanceOnly").isPresent());
    assertTrue(registry.lookup("isAFunc").isPresent());
  }

  @Test
  public void testFirstSourceWins() {
    PolicyForTest first = new PolicyForTest();
    registry.configure(ImmutableList.of(first, ConditionsForTest.class));
    ConditionsForTest.SIMPLE_CALLS.set(0);
    registry.lookup("simpleCondition").get().evaluate(context, null);
    assertEquals(0, ConditionsForTest.SIMPLE_CALLS.get());
  }

  @Test
  public void testLookupIsMemoized() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    assertSame(registry.lookup("isAFunc").get(), registry.lookup("isAFunc").get());
  }

  @Test
  public void testReconfigureDropsMemoizedLookups() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    assertTrue(registry.lookup("isAFunc").isPresent());
    registry.configure(ImmutableList.of());
    assertFalse(registry.lookup("isAFunc").isPresent());
  }

  @Test
  public void testReconfigureWhileLookingUp() throws Exception {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> lookups = new ArrayList<Future<?>>();
      for (int i = 0; i < 4; i++) {
        lookups.add(executor.submit(() -> {
          for (int j = 0; j < 1000; j++) {
            registry.lookup("isAFunc");
          }
        }));
      }
      for (int i = 0; i < 100; i++) {
        registry.configure(ImmutableList.of(ConditionsForTest.class));
      }
      registry.configure(ImmutableList.of());
      for (Future<?> lookup : lookups) {
        lookup.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertTrue(registry.getSources().isEmpty());
    assertFalse(registry.lookup("isAFunc").isPresent());
  }

  @Test
  public void testReset() {
    registry.configure(ImmutableList.of(ConditionsForTest.class));
    registry.reset();
    assertTrue(registry.getSources().isEmpty());
    assertFalse(registry.lookup("isAFunc").isPresent());
  }

  @Test
  public void testConfigureFromConfiguration() {
    Configuration conf = new Configuration(false);
    conf.set(AuthzConfVars.AUTHZ_CONDITION_CLASSES.getVar(), ConditionsForTest.class.getName());
    registry.configure(conf);
    assertEquals(ImmutableList.of(ConditionsForTest.class), registry.getSources());
    assertTrue(registry.lookup("isACat").isPresent());
  }

  @Test
  public void testConfigureFromEmptyConfiguration() {
    registry.configure(new Configuration(false));
    assertTrue(registry.getSources().isEmpty());
  }

  @Test(expected = RuntimeException.class)
  public void testConfigureUnknownClass() {
    Configuration conf = new Configuration(false);
    conf.set(AuthzConfVars.AUTHZ_CONDITION_CLASSES.getVar(), "org.apache.warden.DoesNotExist");
    registry.configure(conf);
  }
}
