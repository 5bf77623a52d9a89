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
package org.apache.warden.policy.engine;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.hadoop.conf.Configuration;
import org.apache.warden.core.common.GroupMembership;
import org.apache.warden.core.common.conf.AccessPolicyConf.AuthzConfVars;

/**
 * An access policy whose principal prefixes come from configuration.
 */
public class ConfiguredAccessPolicy extends AccessPolicy {

  private final String groupPrefix;
  private final String idPrefix;

  public ConfiguredAccessPolicy(Configuration conf, @Nullable String policyId,
      List<?> statements, Map<String, ? extends List<?>> fieldPermissions,
      @Nullable GroupMembership groupMembership) {
    super(policyId, statements, fieldPermissions, groupMembership);
    this.groupPrefix = conf.get(AuthzConfVars.AUTHZ_GROUP_PREFIX.getVar(),
        AuthzConfVars.AUTHZ_GROUP_PREFIX.getDefault());
    this.idPrefix = conf.get(AuthzConfVars.AUTHZ_ID_PREFIX.getVar(),
        AuthzConfVars.AUTHZ_ID_PREFIX.getDefault());
  }

  @Override
  public String getGroupPrefix() {
    return groupPrefix;
  }

  @Override
  public String getIdPrefix() {
    return idPrefix;
  }
}
