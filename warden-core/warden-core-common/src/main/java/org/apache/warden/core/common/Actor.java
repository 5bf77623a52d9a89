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

import java.util.Set;

import javax.annotation.Nullable;

/**
 * The party whose access is being decided. Implementations are expected to
 * report stable attributes for the duration of an evaluation.
 */
public interface Actor {

  /**
   * @return the unique id of the actor, or null for an anonymous actor
   */
  @Nullable
  String getId();

  /**
   * @return names of the groups the actor belongs to, never null
   */
  Set<String> getGroups();

  boolean isSuperuser();

  boolean isStaff();

  boolean isActive();

  boolean isAnonymous();
}
