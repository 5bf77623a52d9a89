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

public class ConditionNotFoundException extends AccessPolicyException {
  private static final long serialVersionUID = -1870255208226733109L;

  private final String conditionName;

  public ConditionNotFoundException(String conditionName) {
    super("Unable to find condition method \"" + conditionName + "\". Condition must be a "
        + "method on the access policy or a method of a class listed in the reusable "
        + "conditions configuration.");
    this.conditionName = conditionName;
  }

  public String getConditionName() {
    return conditionName;
  }
}
