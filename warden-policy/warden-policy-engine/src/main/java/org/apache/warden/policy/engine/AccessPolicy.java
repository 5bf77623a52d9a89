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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupMembership;
import org.apache.warden.core.common.GroupResolver;
import org.apache.warden.core.common.utils.WardenConstants;
import org.apache.warden.policy.common.Condition;
import org.apache.warden.policy.common.Conditions;
import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.common.Policy;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * An ordered collection of statement sources plus named field permissions.
 * <p>
 * A statement source is a {@link org.apache.warden.policy.common.Statement}
 * (or {@link org.apache.warden.policy.common.FieldStatement} for field
 * permissions), a map holding the declared form of one, another policy, or a
 * policy class with a no-argument constructor. Nested policies contribute their
 * own statements in place, see {@link StatementFlattener}.
 * <p>
 * Subclasses customise a policy by passing statements to a constructor,
 * overriding the accessors, and declaring public condition methods taking an
 * {@link EvaluationContext} and optionally a String argument.
 */
public class AccessPolicy implements Policy {

  private final String policyId;
  private final List<Object> statements;
  private final Map<String, List<Object>> fieldPermissions;
  private final GroupMembership groupMembership;

  public AccessPolicy() {
    this(null, Collections.emptyList(), Collections.<String, List<?>>emptyMap());
  }

  public AccessPolicy(List<?> statements) {
    this(null, statements, Collections.<String, List<?>>emptyMap());
  }

  public AccessPolicy(@Nullable String policyId, List<?> statements) {
    this(policyId, statements, Collections.<String, List<?>>emptyMap());
  }

  public AccessPolicy(@Nullable String policyId, List<?> statements,
      Map<String, ? extends List<?>> fieldPermissions) {
    this(policyId, statements, fieldPermissions, null);
  }

  /**
   * @param groupMembership answers group principals when there is no group
   *        resolver; null to use the actor's own groups
   */
  public AccessPolicy(@Nullable String policyId, List<?> statements,
      Map<String, ? extends List<?>> fieldPermissions,
      @Nullable GroupMembership groupMembership) {
    this.policyId = policyId;
    // copies tolerate null entries so that flattening can report them by index
    this.statements = Collections.unmodifiableList(new ArrayList<Object>(statements));
    Map<String, List<Object>> permissions = new LinkedHashMap<String, List<Object>>();
    for (Map.Entry<String, ? extends List<?>> entry : fieldPermissions.entrySet()) {
      permissions.put(entry.getKey(),
          Collections.unmodifiableList(new ArrayList<Object>(entry.getValue())));
    }
    this.fieldPermissions = Collections.unmodifiableMap(permissions);
    this.groupMembership = groupMembership;
  }

  @Nullable
  public String getPolicyId() {
    return policyId;
  }

  /**
   * @return the statement sources of this policy for the given request
   */
  public List<?> getPolicyStatements(EvaluationContext context) {
    return statements;
  }

  /**
   * @return the field statement sources of one field permission
   * @throws IllegalArgumentException if the policy has no such field permission
   */
  public List<?> getFieldStatements(String key) {
    List<Object> sources = fieldPermissions.get(key);
    if (sources == null) {
      throw new IllegalArgumentException("No field permissions \"" + key + "\" in policy " + this);
    }
    return sources;
  }

  public Set<String> getFieldPermissionKeys() {
    return ImmutableSet.copyOf(fieldPermissions.keySet());
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
  @Nullable
  public GroupResolver getGroupResolver() {
    return null;
  }

  @Override
  public boolean isMemberInGroup(Actor actor, List<String> groups) {
    if (groupMembership != null) {
      return groupMembership.isMemberOfAnyGroup(actor, groups);
    }
    return !Sets.intersection(actor.getGroups(), ImmutableSet.copyOf(groups)).isEmpty();
  }

  @Override
  public Condition resolveCondition(String name) {
    return Conditions.resolve(this, name);
  }

  @Override
  public String toString() {
    String name = getClass().getSimpleName().isEmpty()
        ? getClass().getName() : getClass().getSimpleName();
    return policyId == null ? name : name + " (id=" + policyId + ")";
  }
}
