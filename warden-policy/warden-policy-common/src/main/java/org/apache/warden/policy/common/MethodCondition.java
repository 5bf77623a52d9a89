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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import javax.annotation.Nullable;

import org.apache.warden.core.common.exception.AccessPolicyException;
import org.apache.warden.core.common.exception.ConditionInvocationException;

import com.google.common.base.Throwables;

/**
 * A condition backed by a public method taking an {@link EvaluationContext}
 * and, for conditions that accept an argument, a trailing String.
 */
class MethodCondition implements Condition {

  private final String name;
  private final Object target;
  private final Method withoutArgument;
  private final Method withArgument;

  MethodCondition(String name, @Nullable Object target, @Nullable Method withoutArgument,
      @Nullable Method withArgument) {
    this.name = name;
    this.target = target;
    this.withoutArgument = withoutArgument;
    this.withArgument = withArgument;
  }

  @Override
  public Object evaluate(EvaluationContext context, @Nullable String argument) {
    if (argument == null) {
      if (withoutArgument == null) {
        throw new IllegalArgumentException(name + "() missing required argument");
      }
      return invoke(withoutArgument, context);
    }
    if (withArgument == null) {
      throw new IllegalArgumentException(name + "() takes no argument but \"" + argument
          + "\" was given");
    }
    return invoke(withArgument, context, argument);
  }

  private Object invoke(Method method, Object... args) {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new ConditionInvocationException(name, cause);
    } catch (IllegalAccessException e) {
      throw new AccessPolicyException("Condition method " + method + " is not accessible", e);
    }
  }

  @Override
  public String toString() {
    return name + (target == null ? "" : " on " + target);
  }
}
