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
package org.apache.warden.core.common.conf;

import java.net.URL;

import org.apache.hadoop.conf.Configuration;

public class AccessPolicyConf extends Configuration {

  public static final String AUTHZ_SITE_FILE = "warden-site.xml";

  /**
   * Config setting definitions
   */
  public static enum AuthzConfVars {
    AUTHZ_GROUP_PREFIX("warden.policy.group.prefix", "group:"),
    AUTHZ_ID_PREFIX("warden.policy.id.prefix", "id:"),
    AUTHZ_CONDITION_CLASSES("warden.policy.conditions.classes", ""),
    AUTHZ_DEFAULT_METHOD("warden.policy.default.method", "GET");

    private final String varName;
    private final String defaultVal;

    AuthzConfVars(String varName, String defaultVal) {
      this.varName = varName;
      this.defaultVal = defaultVal;
    }

    public String getVar() {
      return varName;
    }

    public String getDefault() {
      return defaultVal;
    }

    public static String getDefault(String varName) {
      for (AuthzConfVars oneVar : AuthzConfVars.values()) {
        if (oneVar.getVar().equalsIgnoreCase(varName)) {
          return oneVar.getDefault();
        }
      }
      return null;
    }
  }

  public AccessPolicyConf() {
    super(false);
  }

  public AccessPolicyConf(URL authzSiteURL) {
    super(false);
    addResource(authzSiteURL);
  }

  @Override
  public String get(String varName) {
    return get(varName, AuthzConfVars.getDefault(varName));
  }

  public String get(AuthzConfVars var) {
    return get(var.getVar(), var.getDefault());
  }

  public void set(AuthzConfVars var, String value) {
    set(var.getVar(), value);
  }
}
