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
 * Root of all failures raised while building or evaluating access policies.
 * Every subclass is fatal to the evaluation in progress; no decision is
 * produced once one has been thrown.
 */
public class AccessPolicyException extends RuntimeException {
  private static final long serialVersionUID = 4217764381392812406L;

  public AccessPolicyException() {
    super();
  }

  public AccessPolicyException(String message) {
    super(message);
  }

  public AccessPolicyException(Throwable cause) {
    super(cause);
  }

  public AccessPolicyException(String message, Throwable cause) {
    super(message, cause);
  }
}
