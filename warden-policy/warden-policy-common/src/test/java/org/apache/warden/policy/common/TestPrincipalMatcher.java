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
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupMembership;
import org.apache.warden.core.common.GroupResolver;
import org.apache.warden.core.common.SimpleActor;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class TestPrincipalMatcher {

  private static final String[] TITLES = {"Super", "Staff", "Regular", "Disabled", "Anonymous"};

  private Actor superuser;
  private Actor staff;
  private Actor user;
  private Actor disabled;
  private Actor anonymous;
  private PolicyForTest policy;

  @Before
  public void setUp() {
    superuser = SimpleActor.builder("1").superuser(true).group("test_group").group("test_group2").build();
    staff = SimpleActor.builder("2").staff(true).build();
    user = SimpleActor.builder("3").group("test_group").group("test_group2").build();
    disabled = SimpleActor.builder("4").active(false).build();
    anonymous = SimpleActor.anonymous();
    policy = new PolicyForTest();
  }

  private void assertMatchPrincipals(Statement statement, boolean... expected) {
    Actor[] actors = {superuser, staff, user, disabled, anonymous};
    for (int i = 0; i < actors.length; i++) {
      EvaluationContext context = EvaluationContext.builder().actor(actors[i]).action("create").build();
      assertEquals(TITLES[i] + " user for principal " + statement.getPrincipals(),
          expected[i], statement.matchPrincipal(policy, context));
    }
  }

  private static Statement principal(String... principals) {
    return Statement.builder().principal(principals).action("*").build();
  }

  @Test
  public void testMatchPrincipalAll() {
    assertMatchPrincipals(principal("*"), true, true, true, true, true);
  }

  @Test
  public void testMatchPrincipalAdmin() {
    assertMatchPrincipals(principal("admin"), true, false, false, false, false);
  }

  @Test
  public void testMatchPrincipalStaff() {
    assertMatchPrincipals(principal("staff"), false, true, false, false, false);
  }

  @Test
  public void testMatchPrincipalAnonymous() {
    assertMatchPrincipals(principal("anonymous"), false, false, false, false, true);
  }

  @Test
  public void testMatchPrincipalAuthenticated() {
    assertMatchPrincipals(principal("authenticated"), true, true, true, true, false);
  }

  @Test
  public void testMatchPrincipalActive() {
    assertMatchPrincipals(principal("active"), true, true, true, false, false);
  }

  @Test
  public void testMatchPrincipalDisabled() {
    assertMatchPrincipals(principal("disabled"), false, false, false, true, false);
  }

  @Test
  public void testMatchPrincipalId() {
    assertMatchPrincipals(principal("id:3"), false, false, true, false, false);
  }

  @Test
  public void testAnonymousNeverMatchesId() {
    assertMatchPrincipals(principal("id:null"), false, false, false, false, false);
  }

  @Test
  public void testMatchPrincipalGroup() {
    assertMatchPrincipals(principal("group:test_group"), true, false, true, false, false);
    assertMatchPrincipals(principal("group:does_not_exist"), false, false, false, false, false);
    assertMatchPrincipals(principal("group:does_not_exist", "group:test_group2"),
        true, false, true, false, false);
  }

  @Test
  public void testMembershipReceivesStrippedGroupNames() {
    GroupMembership membership = mock(GroupMembership.class);
    when(membership.isMemberOfAnyGroup(any(Actor.class), anyList())).thenReturn(true);

    assertTrue(PrincipalMatcher.matches(ImmutableSet.of("group:admin", "staff"), user, null,
        membership, "group:", "id:"));
    verify(membership).isMemberOfAnyGroup(user, ImmutableList.of("admin"));
  }

  @Test
  public void testResolverTakesPrecedenceOverMembership() {
    GroupMembership membership = mock(GroupMembership.class);
    GroupResolver resolver = mock(GroupResolver.class);
    when(resolver.getGroupValues(user)).thenReturn(ImmutableList.of("editors"));

    assertTrue(PrincipalMatcher.matches(ImmutableSet.of("role:editors"), user, resolver,
        membership, "role:", "id:"));
    assertFalse(PrincipalMatcher.matches(ImmutableSet.of("role:admins"), user, resolver,
        membership, "role:", "id:"));
    verify(membership, never()).isMemberOfAnyGroup(any(Actor.class), anyList());
  }

  @Test
  public void testContextResolverOverridesPolicyResolver() {
    GroupResolver policyResolver = mock(GroupResolver.class);
    GroupResolver contextResolver = mock(GroupResolver.class);
    when(contextResolver.getGroupValues(user)).thenReturn(ImmutableList.of("auditors"));
    PolicyForTest resolvingPolicy = new PolicyForTest(policyResolver);

    EvaluationContext context = EvaluationContext.builder().actor(user)
        .groupResolver(contextResolver).build();
    assertTrue(principal("group:auditors").matchPrincipal(resolvingPolicy, context));
    verify(policyResolver, never()).getGroupValues(any(Actor.class));
  }

  @Test
  public void testWildcardShortCircuitsGroupChecks() {
    GroupMembership membership = mock(GroupMembership.class);
    assertTrue(PrincipalMatcher.matches(ImmutableSet.of("*", "group:x"), user, null,
        membership, "group:", "id:"));
    verify(membership, never()).isMemberOfAnyGroup(any(Actor.class), anyList());
  }

  @Test
  public void testGroupNames() {
    List<String> names = PrincipalMatcher.groupNames(
        ImmutableList.of("group:a", "group:", "groupb", "id:1", "group:c"), "group:");
    assertEquals(ImmutableList.of("a", "c"), names);
  }
}
