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

package org.deepclone.impl.config;

import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.config.EvictionPolicy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default implementation of {@link ClonePlanCacheConfiguration}.
 */
public class DefaultClonePlanCacheConfiguration implements ClonePlanCacheConfiguration {

  private final int limitedCacheSize;
  private final boolean useLimitedCache;
  private final EvictionPolicy evictionPolicy;
  private final Set<Class<?>> immutableTypes;

  public DefaultClonePlanCacheConfiguration(int limitedCacheSize, boolean useLimitedCache, EvictionPolicy evictionPolicy, Set<Class<?>> immutableTypes) {
    this.limitedCacheSize = limitedCacheSize;
    this.useLimitedCache = useLimitedCache;
    this.evictionPolicy = evictionPolicy;
    this.immutableTypes = Collections.unmodifiableSet(new LinkedHashSet<>(immutableTypes));
  }

  @Override
  public int getLimitedCacheSize() {
    return limitedCacheSize;
  }

  @Override
  public boolean isUseLimitedCache() {
    return useLimitedCache;
  }

  @Override
  public EvictionPolicy getEvictionPolicy() {
    return evictionPolicy;
  }

  @Override
  public Set<Class<?>> getImmutableTypes() {
    return immutableTypes;
  }

  @Override
  public String toString() {
    return "DefaultClonePlanCacheConfiguration{" +
        "limitedCacheSize=" + limitedCacheSize +
        ", useLimitedCache=" + useLimitedCache +
        ", evictionPolicy=" + evictionPolicy +
        ", immutableTypes=" + immutableTypes +
        '}';
  }
}
