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
package org.apache.warden.core.common.utils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

public class WardenConstants {

  public static final String WILDCARD = "*";

  // principal tokens
  public static final String PRINCIPAL_ADMIN = "admin";
  public static final String PRINCIPAL_STAFF = "staff";
  public static final String PRINCIPAL_AUTHENTICATED = "authenticated";
  public static final String PRINCIPAL_ANONYMOUS = "anonymous";
  public static final String PRINCIPAL_ACTIVE = "active";
  public static final String PRINCIPAL_DISABLED = "disabled";

  public static final String DEFAULT_GROUP_PREFIX = "group:";
  public static final String DEFAULT_ID_PREFIX = "id:";

  // action tokens
  public static final String ACTION_METHOD_PREFIX = "<method:";
  public static final String ACTION_METHOD_SUFFIX = ">";
  public static final String ACTION_SAFE_METHODS = "<safe_methods>";
  public static final ImmutableSet<String> SAFE_METHODS = ImmutableSet.of("GET", "HEAD", "OPTIONS");

  // statement mapping keys
  public static final String KEY_PRINCIPAL = "principal";
  public static final String KEY_ACTION = "action";
  public static final String KEY_EFFECT = "effect";
  public static final String KEY_CONDITION = "condition";
  public static final String KEY_CONDITION_EXPRESSION = "condition_expression";
  public static final String KEY_FIELDS = "fields";

  public static final String CONDITION_ARG_SEPARATOR = ":";
  public static final Splitter CONDITION_SPLITTER = Splitter.on(CONDITION_ARG_SEPARATOR).limit(2);

  private WardenConstants() {
    // Make constructor private to avoid instantiation
  }
}
