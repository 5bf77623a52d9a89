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
package org.apache.warden.core.common;

import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Immutable {@link Actor} for callers that do not carry their own user type.
 */
public final class SimpleActor implements Actor {

  private static final SimpleActor ANONYMOUS =
      new SimpleActor(null, ImmutableSet.<String>of(), false, false, false, true);

  private final String id;
  private final ImmutableSet<String> groups;
  private final boolean superuser;
  private final boolean staff;
  private final boolean active;
  private final boolean anonymous;

  private SimpleActor(String id, ImmutableSet<String> groups, boolean superuser,
      boolean staff, boolean active, boolean anonymous) {
    this.id = id;
    this.groups = groups;
    this.superuser = superuser;
    this.staff = staff;
    this.active = active;
    this.anonymous = anonymous;
  }

  public static SimpleActor anonymous() {
    return ANONYMOUS;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public Set<String> getGroups() {
    return groups;
  }

  @Override
  public boolean isSuperuser() {
    return superuser;
  }

  @Override
  public boolean isStaff() {
    return staff;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public boolean isAnonymous() {
    return anonymous;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SimpleActor)) {
      return false;
    }
    SimpleActor other = (SimpleActor) o;
    return Objects.equal(id, other.id) && groups.equals(other.groups)
        && superuser == other.superuser && staff == other.staff
        && active == other.active && anonymous == other.anonymous;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, groups, superuser, staff, active, anonymous);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("groups", groups)
        .add("superuser", superuser)
        .add("staff", staff)
        .add("active", active)
        .add("anonymous", anonymous)
        .toString();
  }

  /**
   * Builds an authenticated actor. Actors start out active and without any
   * elevated flags.
   */
  public static class Builder {
    private final String id;
    private final ImmutableSet.Builder<String> groups = ImmutableSet.builder();
    private boolean superuser;
    private boolean staff;
    private boolean active = true;

    private Builder(String id) {
      this.id = Preconditions.checkNotNull(id, "Actor id cannot be null");
    }

    public Builder group(String group) {
      groups.add(group);
      return this;
    }

    public Builder groups(Iterable<String> names) {
      groups.addAll(names);
      return this;
    }

    public Builder superuser(boolean superuser) {
      this.superuser = superuser;
      return this;
    }

    public Builder staff(boolean staff) {
      this.staff = staff;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public SimpleActor build() {
      return new SimpleActor(id, groups.build(), superuser, staff, active, false);
    }
  }
}
