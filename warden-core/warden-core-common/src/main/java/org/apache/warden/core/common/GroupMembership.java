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

import java.util.List;

/**
 * Answers group membership questions against a group store the engine knows
 * nothing about. Consulted for principals carrying the group prefix when no
 * {@link GroupResolver} is available.
 */
public interface GroupMembership {

  /**
   * @param actor the actor being checked
   * @param groups group names with the group prefix already removed, possibly empty
   * @return true if the actor is a member of at least one of the groups
   */
  boolean isMemberOfAnyGroup(Actor actor, List<String> groups);
}
