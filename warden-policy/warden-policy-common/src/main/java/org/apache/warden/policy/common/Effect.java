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

import org.apache.warden.core.common.exception.StatementValidationException;

/**
 * Outcome class of a statement. A statement declared without an effect is
 * {@link #DEFAULT}.
 */
public enum Effect {
  ALLOW("allow"),
  DENY("deny"),
  DEFAULT(null);

  private final String value;

  Effect(String value) {
    this.value = value;
  }

  /**
   * @return the declared form of the effect, null for {@link #DEFAULT}
   */
  @Nullable
  public String getValue() {
    return value;
  }

  /**
   * Parses a declared effect. Null maps to {@link #DEFAULT}; anything other
   * than "allow" or "deny" is rejected.
   */
  public static Effect fromValue(@Nullable String value) {
    if (value == null) {
      return DEFAULT;
    }
    if (ALLOW.value.equals(value)) {
      return ALLOW;
    }
    if (DENY.value.equals(value)) {
      return DENY;
    }
    throw new StatementValidationException(
        "Statement effect must be either \"allow\" or \"deny\" (not \"" + value + "\")");
  }
}
