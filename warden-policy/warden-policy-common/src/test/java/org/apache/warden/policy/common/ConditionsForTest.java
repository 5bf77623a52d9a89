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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reusable conditions registered with the {@link ConditionRegistry} in tests.
 */
public class ConditionsForTest {

  public static final AtomicInteger SIMPLE_CALLS = new AtomicInteger();

  public static final boolean notAFunc = true;

  public static boolean isAFunc(EvaluationContext context) {
    return true;
  }

  public static boolean simpleCondition(EvaluationContext context) {
    SIMPLE_CALLS.incrementAndGet();
    return true;
  }

  public static boolean isACat(EvaluationContext context, String name) {
    return "Garfield".equals(name);
  }

  public static boolean describe(EvaluationContext context) {
    return true;
  }

  public boolean instanceOnly(EvaluationContext context) {
    return true;
  }
}
