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

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Optional;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableListMultimap;

/**
 * Discovers condition methods by name. A condition method is public, named
 * after the condition, takes either {@code (EvaluationContext)} or
 * {@code (EvaluationContext, String)} and is declared to return a boolean or a
 * supertype of {@link Boolean}.
 */
final class ConditionMethods {

  private static final LoadingCache<Class<?>, ImmutableListMultimap<String, Method>> METHODS =
      CacheBuilder.newBuilder().build(new CacheLoader<Class<?>, ImmutableListMultimap<String, Method>>() {
        @Override
        public ImmutableListMultimap<String, Method> load(Class<?> type) {
          return scan(type);
        }
      });

  private ConditionMethods() {
  }

  /**
   * Finds a condition on an object, considering instance and static methods.
   */
  static Optional<Condition> onInstance(Object target, String name) {
    return find(target.getClass(), target, name, false);
  }

  /**
   * Finds a condition among the static methods of a class.
   */
  static Optional<Condition> onClass(Class<?> type, String name) {
    return find(type, null, name, true);
  }

  private static Optional<Condition> find(Class<?> type, Object target, String name,
      boolean staticOnly) {
    Method withoutArgument = null;
    Method withArgument = null;
    for (Method method : METHODS.getUnchecked(type).get(name)) {
      if (staticOnly && !Modifier.isStatic(method.getModifiers())) {
        continue;
      }
      if (method.getParameterCount() == 1) {
        withoutArgument = withoutArgument == null ? method : withoutArgument;
      } else {
        withArgument = withArgument == null ? method : withArgument;
      }
    }
    if (withoutArgument == null && withArgument == null) {
      return Optional.empty();
    }
    return Optional.<Condition>of(new MethodCondition(name, target, withoutArgument, withArgument));
  }

  private static ImmutableListMultimap<String, Method> scan(Class<?> type) {
    ImmutableListMultimap.Builder<String, Method> methods = ImmutableListMultimap.builder();
    for (Method method : type.getMethods()) {
      if (isConditionSignature(method)) {
        // public methods of non-public classes still need this to be invoked
        method.setAccessible(true);
        methods.put(method.getName(), method);
      }
    }
    return methods.build();
  }

  private static boolean isConditionSignature(Method method) {
    if (method.isBridge() || method.isSynthetic()) {
      return false;
    }
    // a declared return type that cannot hold a Boolean rules out accessors
    // such as getPolicyStatements(EvaluationContext)
    Class<?> returnType = method.getReturnType();
    if (returnType != boolean.class && !returnType.isAssignableFrom(Boolean.class)) {
      return false;
    }
    Class<?>[] params = method.getParameterTypes();
    if (params.length == 1) {
      return params[0] == EvaluationContext.class;
    }
    return params.length == 2 && Arrays.asList(params).equals(
        Arrays.<Class<?>>asList(EvaluationContext.class, String.class));
  }
}
