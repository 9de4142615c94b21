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

import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.core.cache.TieredCache;
import org.deepclone.spi.cache.TieredCacheAdministration;
import org.deepclone.spi.clone.ClonePlan;

/**
 * Memoizes compiled clone plans per type in a two-tier cache.
 * <p>
 * Concurrent misses on the same type may compile more than once; only the first plan inserted is ever returned.
 */
public class ClonePlanCache {

  private final TieredCache<Class<?>, ClonePlan> plans;
  private final ClonePlanCompiler compiler;

  public ClonePlanCache(ClonePlanCompiler compiler, ClonePlanCacheConfiguration configuration) {
    this.compiler = compiler;
    this.plans = new TieredCache<>("clone-plans", configuration.getLimitedCacheSize(),
      configuration.isUseLimitedCache(), configuration.getEvictionPolicy());
  }

  /**
   * Returns the plan of {@code type} from the active tier, compiling and inserting it on a miss.
   *
   * @param type a concrete runtime type
   * @return its clone plan
   */
  public ClonePlan resolve(Class<?> type) {
    return plans.getOrAdd(type, compiler::compile);
  }

  /**
   * Compiles a plan for {@code type} without touching any tier.
   *
   * @param type a concrete runtime type
   * @return a new plan
   */
  public ClonePlan compileUncached(Class<?> type) {
    return compiler.compile(type);
  }

  public TieredCacheAdministration<Class<?>, ClonePlan> administration() {
    return plans;
  }

  @Override
  public String toString() {
    return "ClonePlanCache{" + plans + "}";
  }
}
