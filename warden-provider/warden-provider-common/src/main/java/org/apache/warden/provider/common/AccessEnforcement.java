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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The outcome of one access check, kept for the caller after the decision.
 */
public final class AccessEnforcement {

  private final String action;
  private final boolean allowed;

  public AccessEnforcement(String action, boolean allowed) {
    this.action = action;
    this.allowed = allowed;
  }

  public String getAction() {
    return action;
  }

  public boolean isAllowed() {
    return allowed;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AccessEnforcement)) {
      return false;
    }
    AccessEnforcement other = (AccessEnforcement) o;
    return allowed == other.allowed && Objects.equal(action, other.action);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(action, allowed);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("action", action)
        .add("allowed", allowed)
        .toString();
  }
}
