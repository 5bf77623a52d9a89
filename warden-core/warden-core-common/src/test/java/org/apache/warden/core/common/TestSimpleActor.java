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
package org.apache.warden.core.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class TestSimpleActor {

  @Test
  public void testAnonymous() {
    Actor actor = SimpleActor.anonymous();
    assertNull(actor.getId());
    assertTrue(actor.isAnonymous());
    assertFalse(actor.isActive());
    assertFalse(actor.isSuperuser());
    assertFalse(actor.isStaff());
    assertTrue(actor.getGroups().isEmpty());
  }

  @Test
  public void testBuilderDefaults() {
    Actor actor = SimpleActor.builder("3").build();
    assertEquals("3", actor.getId());
    assertTrue(actor.isActive());
    assertFalse(actor.isAnonymous());
    assertFalse(actor.isSuperuser());
    assertFalse(actor.isStaff());
  }

  @Test
  public void testGroups() {
    Actor actor = SimpleActor.builder("1")
        .group("admin")
        .groups(ImmutableList.of("dev", "admin"))
        .build();
    assertEquals(ImmutableSet.of("admin", "dev"), actor.getGroups());
  }

  @Test
  public void testEquality() {
    assertEquals(SimpleActor.builder("1").staff(true).build(),
        SimpleActor.builder("1").staff(true).build());
    assertFalse(SimpleActor.builder("1").build().equals(
        SimpleActor.builder("1").active(false).build()));
  }

  @Test(expected = NullPointerException.class)
  public void testNullId() {
    SimpleActor.builder(null);
  }
}
