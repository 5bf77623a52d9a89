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
package org.apache.warden.provider.common;

import java.util.function.BiPredicate;

import org.apache.warden.core.common.exception.AccessPolicyException;
import org.apache.warden.policy.common.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

/**
 * Helper for conditions about the object a request targets. The object is
 * located first; when that fails the default object is used instead, unless
 * the condition was built to propagate the failure.
 * <pre>
 *   public boolean isOwner(EvaluationContext context) {
 *     return OWNED.test(context, (ctx, article) -&gt;
 *         article == null || article.getOwner().equals(ctx.getActor().getId()));
 *   }
 * </pre>
 */
public final class ObjectLevelCondition<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectLevelCondition.class);

  private final ObjectLocator<T> locator;
  private final T defaultObject;
  private final boolean raiseException;

  private ObjectLevelCondition(ObjectLocator<T> locator, T defaultObject,
      boolean raiseException) {
    this.locator = Preconditions.checkNotNull(locator, "Object locator cannot be null");
    this.defaultObject = defaultObject;
    this.raiseException = raiseException;
  }

  public static <T> ObjectLevelCondition<T> of(ObjectLocator<T> locator) {
    return new ObjectLevelCondition<T>(locator, null, false);
  }

  public ObjectLevelCondition<T> withDefault(T object) {
    return new ObjectLevelCondition<T>(locator, object, raiseException);
  }

  public ObjectLevelCondition<T> raiseException() {
    return new ObjectLevelCondition<T>(locator, defaultObject, true);
  }

  public boolean test(EvaluationContext context, BiPredicate<EvaluationContext, T> predicate) {
    return predicate.test(context, locate(context));
  }

  private T locate(EvaluationContext context) {
    try {
      return locator.locate(context);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (raiseException) {
        Throwables.throwIfUnchecked(e);
        throw new AccessPolicyException("Unable to locate object for " + context, e);
      }
      LOGGER.debug("Unable to locate object, using default", e);
      return defaultObject;
    }
  }
}
