/*
 * Copyright Terracotta, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.deepclone.impl.clone;

import org.deepclone.DeepCloner;
import org.deepclone.IdentityMap;
import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.spi.cache.TieredCacheAdministration;
import org.deepclone.spi.clone.CloneContext;
import org.deepclone.spi.clone.ClonePlan;
import org.deepclone.spi.clone.UnsupportedTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DeepCloner} backed by compiled per-type clone plans.
 */
public class DefaultDeepCloner implements DeepCloner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultDeepCloner.class);

  private final TypeClassifier classifier;
  private final ClonePlanCache planCache;

  public DefaultDeepCloner(ClonePlanCacheConfiguration configuration) {
    this.classifier = new TypeClassifier(configuration.getImmutableTypes());
    this.planCache = new ClonePlanCache(new ClonePlanCompiler(classifier), configuration);
    LOGGER.debug("Deep cloner created with limited cache size {}, use limited cache {}, eviction {}",
      configuration.getLimitedCacheSize(), configuration.isUseLimitedCache(), configuration.getEvictionPolicy());
  }

  @Override
  public <T> T deepClone(T source) {
    return deepClone(source, null, true);
  }

  @Override
  public <T> T deepClone(T source, IdentityMap identityMap) {
    return deepClone(source, identityMap, true);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T deepClone(T source, IdentityMap identityMap, boolean useCache) {
    if (source == null) {
      return null;
    }
    Class<?> type = source.getClass();
    switch (classifier.classify(type)) {
      case VALUE:
      case IMMUTABLE:
        return source;
      case DELEGATE:
        throw new UnsupportedTypeException(type);
      default:
        break;
    }
    IdentityMap identities = identityMap == null ? new IdentityMap() : identityMap;
    Object existing = identities.get(source);
    if (existing != null) {
      return (T) existing;
    }
    Invocation invocation = new Invocation(identities, useCache);
    try {
      return (T) invocation.planFor(type).cloneInstance(source, invocation);
    } catch (RuntimeException | Error e) {
      invocation.rollback();
      throw e;
    }
  }

  @Override
  public TieredCacheAdministration<Class<?>, ClonePlan> planCache() {
    return planCache.administration();
  }

  /**
   * Compiles a plan for {@code type} without inserting it in the plan cache.
   *
   * @param type the type to compile a plan for
   * @return a new plan
   */
  public ClonePlan compilePlan(Class<?> type) {
    return planCache.compileUncached(type);
  }

  TypeClassifier classifier() {
    return classifier;
  }

  /**
   * State of one top-level clone call.
   */
  private final class Invocation implements CloneContext {

    private final IdentityMap identities;
    private final Map<Class<?>, ClonePlan> callPlans;
    private final List<Object> registered = new ArrayList<>();

    Invocation(IdentityMap identities, boolean useCache) {
      this.identities = identities;
      this.callPlans = useCache ? null : new HashMap<>();
    }

    @Override
    public IdentityMap identities() {
      return identities;
    }

    @Override
    public void register(Object source, Object clone) {
      if (identities.put(source, clone) == null) {
        registered.add(source);
      }
    }

    @Override
    public Object registerIfAbsent(Object source, Object clone) {
      Object existing = identities.get(source);
      if (existing != null) {
        return existing;
      }
      register(source, clone);
      return clone;
    }

    /**
     * Withdraws every registration this invocation made, leaving the identity map as the caller passed it.
     */
    void rollback() {
      for (Object source : registered) {
        identities.remove(source);
      }
      LOGGER.debug("Clone failed, withdrew {} partial registrations", registered.size());
      registered.clear();
    }

    @Override
    public Object cloneMember(Object value) {
      if (value == null) {
        return null;
      }
      Class<?> type = value.getClass();
      switch (classifier.classify(type)) {
        case VALUE:
        case IMMUTABLE:
          return value;
        case DELEGATE:
          return null;
        default:
          break;
      }
      Object existing = identities.get(value);
      if (existing != null) {
        return existing;
      }
      return planFor(type).cloneInstance(value, this);
    }

    ClonePlan planFor(Class<?> type) {
      if (callPlans == null) {
        return planCache.resolve(type);
      }
      ClonePlan plan = callPlans.get(type);
      if (plan == null) {
        plan = planCache.compileUncached(type);
        callPlans.put(type, plan);
      }
      return plan;
    }
  }
}
