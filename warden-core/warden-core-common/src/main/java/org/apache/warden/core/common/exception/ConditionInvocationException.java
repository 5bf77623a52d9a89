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
package org.apache.warden.core.common.exception;

/**
 * Carries a checked exception thrown from inside a condition. Unchecked
 * exceptions are never wrapped and reach the caller as thrown.
 */
public class ConditionInvocationException extends AccessPolicyException {
  private static final long serialVersionUID = -6088471907336716120L;

  public ConditionInvocationException(String condition, Throwable cause) {
    super("Condition \"" + condition + "\" failed: " + cause.getMessage(), cause);
  }
}
