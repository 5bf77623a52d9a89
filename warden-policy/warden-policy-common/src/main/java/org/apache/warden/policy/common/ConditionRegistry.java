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

import java.util.Optional;

import javax.annotation.concurrent.ThreadSafe;

import org.apache.hadoop.conf.Configuration;
import org.apache.warden.core.common.conf.AccessPolicyConf.AuthzConfVars;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;

/**
 * Process wide fallback for conditions that a policy does not define itself.
 * <p>
 * The registry is populated once at startup from the configured condition
 * sources. A source is either a class, contributing its public static
 * condition methods, or an object, contributing its public condition methods.
 * Sources are searched in order and the first one defining a condition wins.
 * Lookups are memoized by name: a name is resolved at most once until the
 * registry is reconfigured or {@link #reset()}.
 */
@ThreadSafe
public final class ConditionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConditionRegistry.class);

  private static final ConditionRegistry INSTANCE = new ConditionRegistry();

  // sources and the lookups memoized against them are replaced as one unit
  private volatile Sources current = new Sources(ImmutableList.of());

  @VisibleForTesting
  ConditionRegistry() {
  }

  public static ConditionRegistry getInstance() {
    return INSTANCE;
  }

  /**
   * Replaces the condition sources.
   *
   * @param conditionSources classes or objects providing condition methods
   */
  public synchronized void configure(Iterable<?> conditionSources) {
    Preconditions.checkNotNull(conditionSources, "Condition sources cannot be null");
    ImmutableList<Object> newSources = ImmutableList.copyOf(conditionSources);
    for (Object source : newSources) {
      Preconditions.checkNotNull(source, "Condition source cannot be null");
    }
    current = new Sources(newSources);
    LOGGER.info("Configured reusable condition sources {}", newSources);
  }

  /**
   * Reads the reusable condition classes from configuration.
   *
   * @throws RuntimeException if a configured class cannot be loaded
   */
  public void configure(Configuration conf) {
    Class<?>[] classes = conf.getClasses(AuthzConfVars.AUTHZ_CONDITION_CLASSES.getVar());
    configure(ImmutableList.copyOf(classes));
  }

  /**
   * @return the condition registered under the name, if any source defines it
   */
  public Optional<Condition> lookup(String name) {
    return current.conditions.getUnchecked(name);
  }

  public ImmutableList<Object> getSources() {
    return current.sources;
  }

  /**
   * Drops all sources and memoized lookups.
   */
  @VisibleForTesting
  public synchronized void reset() {
    current = new Sources(ImmutableList.of());
  }

  private static Optional<Condition> scan(ImmutableList<Object> sources, String name) {
    for (Object source : sources) {
      Optional<Condition> condition = source instanceof Class
          ? ConditionMethods.onClass((Class<?>) source, name)
          : ConditionMethods.onInstance(source, name);
      if (condition.isPresent()) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Resolved reusable condition " + name + " from " + source);
        }
        return condition;
      }
    }
    LOGGER.debug("No reusable condition named {}", name);
    return Optional.empty();
  }

  private static final class Sources {
    private final ImmutableList<Object> sources;
    private final LoadingCache<String, Optional<Condition>> conditions;

    private Sources(final ImmutableList<Object> sources) {
      this.sources = sources;
      this.conditions = CacheBuilder.newBuilder()
          .build(new CacheLoader<String, Optional<Condition>>() {
            @Override
            public Optional<Condition> load(String name) {
              return scan(sources, name);
            }
          });
    }
  }
}
