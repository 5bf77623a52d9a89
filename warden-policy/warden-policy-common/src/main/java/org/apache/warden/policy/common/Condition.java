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

/**
 * A named predicate over an evaluation context. The result is untyped so that
 * a condition returning anything but a boolean can be reported.
 */
public interface Condition {

  /**
   * @param context the request under evaluation
   * @param argument the text after the first ':' of the condition reference,
   *        or null when the reference has none
   */
  Object evaluate(EvaluationContext context, @Nullable String argument);
}
