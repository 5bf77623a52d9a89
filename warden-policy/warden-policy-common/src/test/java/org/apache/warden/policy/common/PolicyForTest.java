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
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupResolver;
import org.apache.warden.core.common.utils.WardenConstants;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

public class PolicyForTest implements Policy {

  public final AtomicInteger cloudyCalls = new AtomicInteger();
  public final AtomicInteger withArgCalls = new AtomicInteger();
  public volatile String lastArg;
  public final String notACondition = "";

  private final GroupResolver groupResolver;

  public PolicyForTest() {
    this(null);
  }

  public PolicyForTest(GroupResolver groupResolver) {
    this.groupResolver = groupResolver;
  }

  public boolean simpleCondition(EvaluationContext context) {
    return true;
  }

  public boolean falseCondition(EvaluationContext context) {
    return false;
  }

  public Object nonBoolean(EvaluationContext context) {
    return "Hi mom";
  }

  public boolean withArg(EvaluationContext context, String arg) {
    withArgCalls.incrementAndGet();
    lastArg = arg;
    return true;
  }

  public boolean withError(EvaluationContext context) {
    throw new IllegalStateException("Condition Error");
  }

  public boolean withCheckedError(EvaluationContext context) throws Exception {
    throw new Exception("Checked Condition Error");
  }

  public boolean isTrue(EvaluationContext context) {
    return true;
  }

  public boolean isFalse(EvaluationContext context) {
    return false;
  }

  public String describe(EvaluationContext context) {
    return "policy for " + context.getAction();
  }

  public boolean isCloudy(EvaluationContext context) {
    cloudyCalls.incrementAndGet();
    return true;
  }

  @Override
  public String getGroupPrefix() {
    return WardenConstants.DEFAULT_GROUP_PREFIX;
  }

  @Override
  public String getIdPrefix() {
    return WardenConstants.DEFAULT_ID_PREFIX;
  }

  @Override
  public GroupResolver getGroupResolver() {
    return groupResolver;
  }

  @Override
  public boolean isMemberInGroup(Actor actor, List<String> groups) {
    return !Sets.intersection(actor.getGroups(), ImmutableSet.copyOf(groups)).isEmpty();
  }

  @Override
  public Condition resolveCondition(String name) {
    return Conditions.resolve(this, name);
  }
}
