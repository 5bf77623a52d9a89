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

import static org.apache.warden.core.common.utils.WardenConstants.ACTION_METHOD_PREFIX;
import static org.apache.warden.core.common.utils.WardenConstants.ACTION_METHOD_SUFFIX;
import static org.apache.warden.core.common.utils.WardenConstants.ACTION_SAFE_METHODS;
import static org.apache.warden.core.common.utils.WardenConstants.SAFE_METHODS;
import static org.apache.warden.core.common.utils.WardenConstants.WILDCARD;

import java.util.Locale;
import java.util.Set;

public final class ActionMatcher {

  private ActionMatcher() {
  }

  public static boolean matches(Set<String> actions, String requestMethod, String action) {
    return actions.contains(WILDCARD)
        || actions.contains(action)
        || actions.contains(ACTION_METHOD_PREFIX + requestMethod.toLowerCase(Locale.ROOT)
            + ACTION_METHOD_SUFFIX)
        || (actions.contains(ACTION_SAFE_METHODS) && SAFE_METHODS.contains(requestMethod));
  }
}
