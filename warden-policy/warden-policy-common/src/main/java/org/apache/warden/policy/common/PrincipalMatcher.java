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

import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_ACTIVE;
import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_ADMIN;
import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_ANONYMOUS;
import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_AUTHENTICATED;
import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_DISABLED;
import static org.apache.warden.core.common.utils.WardenConstants.PRINCIPAL_STAFF;
import static org.apache.warden.core.common.utils.WardenConstants.WILDCARD;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupMembership;
import org.apache.warden.core.common.GroupResolver;

import com.google.common.collect.ImmutableList;

/**
 * Decides whether an actor is one of the principals of a statement.
 */
public final class PrincipalMatcher {

  private PrincipalMatcher() {
  }

  /**
   * Group principals are checked through the resolver when there is one,
   * otherwise through the membership check, never both.
   */
  public static boolean matches(Set<String> principals, Actor actor,
      @Nullable GroupResolver groupResolver, GroupMembership membership,
      String groupPrefix, String idPrefix) {
    if (principals.contains(WILDCARD)
        || (principals.contains(PRINCIPAL_ADMIN) && actor.isSuperuser())
        || (principals.contains(PRINCIPAL_STAFF) && actor.isStaff())
        || (principals.contains(PRINCIPAL_AUTHENTICATED) && !actor.isAnonymous())
        || (principals.contains(PRINCIPAL_ANONYMOUS) && actor.isAnonymous())
        || (principals.contains(PRINCIPAL_ACTIVE) && actor.isActive())
        || (principals.contains(PRINCIPAL_DISABLED) && !actor.isActive() && !actor.isAnonymous())
        || (actor.getId() != null && principals.contains(idPrefix + actor.getId()))) {
      return true;
    }

    if (groupResolver != null) {
      for (String group : groupResolver.getGroupValues(actor)) {
        if (principals.contains(groupPrefix + group)) {
          return true;
        }
      }
      return false;
    }
    return membership.isMemberOfAnyGroup(actor, groupNames(principals, groupPrefix));
  }

  /**
   * @return the principals carrying the group prefix, with the prefix removed
   */
  public static List<String> groupNames(Iterable<String> principals, String groupPrefix) {
    ImmutableList.Builder<String> groups = ImmutableList.builder();
    for (String principal : principals) {
      if (principal.length() > groupPrefix.length() && principal.startsWith(groupPrefix)) {
        groups.add(principal.substring(groupPrefix.length()));
      }
    }
    return groups.build();
  }
}
