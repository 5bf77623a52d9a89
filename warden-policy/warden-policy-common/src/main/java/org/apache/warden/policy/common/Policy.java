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

import javax.annotation.Nullable;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupResolver;

/**
 * The view of a policy that statements evaluate against: its principal
 * prefixes, its group capabilities and its conditions.
 */
public interface Policy {

  String getGroupPrefix();

  String getIdPrefix();

  /**
   * @return the resolver listing an actor's group values, or null to fall back
   *         to {@link #isMemberInGroup(Actor, List)}
   */
  @Nullable
  GroupResolver getGroupResolver();

  /**
   * Whether the actor is a member of one of the groups. Only consulted when no
   * group resolver is available.
   */
  boolean isMemberInGroup(Actor actor, List<String> groups);

  /**
   * Resolves a named condition.
   *
   * @throws org.apache.warden.core.common.exception.ConditionNotFoundException
   *         if neither the policy nor the condition registry provides it
   */
  Condition resolveCondition(String name);
}
