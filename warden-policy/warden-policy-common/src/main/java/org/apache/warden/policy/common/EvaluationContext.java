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

import javax.annotation.Nullable;

import org.apache.warden.core.common.Actor;
import org.apache.warden.core.common.GroupResolver;
import org.apache.warden.core.common.SimpleActor;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Everything a policy needs to know about one access request. The context
 * object is opaque to the engine and handed to conditions as is.
 */
public final class EvaluationContext {

  private final Actor actor;
  private final String action;
  private final String requestMethod;
  private final GroupResolver groupResolver;
  private final Object context;

  private EvaluationContext(Builder builder) {
    this.actor = builder.actor;
    this.action = builder.action;
    this.requestMethod = builder.requestMethod;
    this.groupResolver = builder.groupResolver;
    this.context = builder.context;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Actor getActor() {
    return actor;
  }

  public String getAction() {
    return action;
  }

  public String getRequestMethod() {
    return requestMethod;
  }

  @Nullable
  public GroupResolver getGroupResolver() {
    return groupResolver;
  }

  @Nullable
  public Object getContext() {
    return context;
  }

  /**
   * @return a copy of this context bound to another action
   */
  public EvaluationContext withAction(String newAction) {
    return new Builder().actor(actor).action(newAction).requestMethod(requestMethod)
        .groupResolver(groupResolver).context(context).build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("actor", actor)
        .add("action", action)
        .add("requestMethod", requestMethod)
        .toString();
  }

  public static class Builder {
    private Actor actor = SimpleActor.anonymous();
    private String action = "";
    private String requestMethod = "GET";
    private GroupResolver groupResolver;
    private Object context;

    public Builder actor(Actor actor) {
      this.actor = Preconditions.checkNotNull(actor, "Actor cannot be null");
      return this;
    }

    public Builder action(String action) {
      this.action = Preconditions.checkNotNull(action, "Action cannot be null");
      return this;
    }

    public Builder requestMethod(String requestMethod) {
      this.requestMethod = Preconditions.checkNotNull(requestMethod, "Request method cannot be null");
      return this;
    }

    public Builder groupResolver(@Nullable GroupResolver groupResolver) {
      this.groupResolver = groupResolver;
      return this;
    }

    public Builder context(@Nullable Object context) {
      this.context = context;
      return this;
    }

    public EvaluationContext build() {
      return new EvaluationContext(this);
    }
  }
}
