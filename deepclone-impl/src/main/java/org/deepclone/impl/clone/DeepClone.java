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
import org.deepclone.impl.config.ClonePlanCacheProperties;
import org.deepclone.spi.cache.TieredCacheAdministration;
import org.deepclone.spi.clone.ClonePlan;

/**
 * Process-wide deep cloning entry point.
 * <p>
 * Backed by a single {@link DefaultDeepCloner} configured from the {@code org.deepclone.cache.*} system properties
 * when this class is initialized.
 *
 * @see ClonePlanCacheProperties
 */
public final class DeepClone {

  private static final DefaultDeepCloner CLONER = new DefaultDeepCloner(ClonePlanCacheProperties.fromSystemProperties());

  private DeepClone() {
    throw new UnsupportedOperationException("Thou shalt not instantiate me!");
  }

  /**
   * @see DeepCloner#deepClone(Object)
   */
  public static <T> T deepClone(T source) {
    return CLONER.deepClone(source);
  }

  /**
   * @see DeepCloner#deepClone(Object, IdentityMap)
   */
  public static <T> T deepClone(T source, IdentityMap identityMap) {
    return CLONER.deepClone(source, identityMap);
  }

  /**
   * @see DeepCloner#deepClone(Object, IdentityMap, boolean)
   */
  public static <T> T deepClone(T source, IdentityMap identityMap, boolean useCache) {
    return CLONER.deepClone(source, identityMap, useCache);
  }

  /**
   * The administration surface of the process-wide plan cache.
   *
   * @return the plan cache administration
   */
  public static TieredCacheAdministration<Class<?>, ClonePlan> cacheManager() {
    return CLONER.planCache();
  }

  /**
   * Compiles a plan for {@code type} without caching it, typically to pre-warm a tier through
   * {@link TieredCacheAdministration#tryAddCache(Object, Object)}.
   *
   * @param type the type to compile a plan for
   * @return a new plan
   */
  public static ClonePlan compilePlan(Class<?> type) {
    return CLONER.compilePlan(type);
  }

  public static DeepCloner cloner() {
    return CLONER;
  }
}
