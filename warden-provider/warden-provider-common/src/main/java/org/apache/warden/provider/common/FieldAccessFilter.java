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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.warden.policy.common.EvaluationContext;
import org.apache.warden.policy.engine.AccessPolicy;
import org.apache.warden.policy.engine.FieldSelector;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Applies the field permissions of a policy to a schema's named fields. The
 * field permission keys usually name the flag to set on the selected fields,
 * e.g. "read_only".
 *
 * @param <F> the schema's field type
 */
public class FieldAccessFilter<F> {

  private final AccessPolicy policy;

  public FieldAccessFilter(AccessPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Must set access policy for FieldAccessFilter");
    }
    this.policy = policy;
  }

  /**
   * @return the fields selected by one field permission, in schema order
   */
  public Set<F> getRestrictedFields(String key, EvaluationContext context,
      Map<String, F> fields) {
    checkContext(context);
    ImmutableSet.Builder<F> restricted = ImmutableSet.builder();
    for (String name : FieldSelector.selectFields(policy, key, context, fields.keySet())) {
      restricted.add(fields.get(name));
    }
    return restricted.build();
  }

  /**
   * @return for every field permission of the policy, the fields it selects
   */
  public Map<String, Set<F>> getRestrictedFields(EvaluationContext context,
      Map<String, F> fields) {
    checkContext(context);
    Map<String, Set<F>> restricted = new LinkedHashMap<String, Set<F>>();
    for (String key : policy.getFieldPermissionKeys()) {
      restricted.put(key, getRestrictedFields(key, context, fields));
    }
    return ImmutableMap.copyOf(restricted);
  }

  public AccessPolicy getPolicy() {
    return policy;
  }

  private void checkContext(EvaluationContext context) {
    if (context == null) {
      throw new IllegalStateException("Unable to find evaluation context on "
          + getClass().getSimpleName() + " (required to apply field permissions)");
    }
  }
}
