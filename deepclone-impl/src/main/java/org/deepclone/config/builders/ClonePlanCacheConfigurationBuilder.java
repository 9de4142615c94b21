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

package org.deepclone.config.builders;

import org.deepclone.config.Builder;
import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.config.EvictionPolicy;
import org.deepclone.impl.config.DefaultClonePlanCacheConfiguration;

import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The {@code ClonePlanCacheConfigurationBuilder} enables building {@link ClonePlanCacheConfiguration}s using a fluent
 * style.
 * <p>
 * All instances are immutable and calling any method on the builder will return a new instance without modifying the
 * one on which the method was called.
 */
public final class ClonePlanCacheConfigurationBuilder implements Builder<ClonePlanCacheConfiguration> {

  static final int DEFAULT_LIMITED_CACHE_SIZE = 100;

  private int limitedCacheSize = DEFAULT_LIMITED_CACHE_SIZE;
  private boolean useLimitedCache = true;
  private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
  private final Set<Class<?>> immutableTypes = new LinkedHashSet<>();

  private ClonePlanCacheConfigurationBuilder() {
  }

  private ClonePlanCacheConfigurationBuilder(ClonePlanCacheConfigurationBuilder other) {
    limitedCacheSize = other.limitedCacheSize;
    useLimitedCache = other.useLimitedCache;
    evictionPolicy = other.evictionPolicy;
    immutableTypes.addAll(other.immutableTypes);
  }

  /**
   * Creates a new builder seeded with the defaults: a limited tier of capacity 100 in use, evicting by LRU.
   *
   * @return a new builder
   */
  public static ClonePlanCacheConfigurationBuilder newClonePlanCacheConfigurationBuilder() {
    return new ClonePlanCacheConfigurationBuilder();
  }

  /**
   * Sets the limited tier capacity on the returned builder.
   * <p>
   * A positive size also activates the limited tier, zero deactivates it.
   *
   * @param size the limited tier capacity
   * @return a new builder with the updated capacity
   *
   * @throws IllegalArgumentException if {@code size} is negative
   */
  public ClonePlanCacheConfigurationBuilder limitedCacheSize(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("Limited cache size must not be negative, was: " + size);
    }
    ClonePlanCacheConfigurationBuilder otherBuilder = new ClonePlanCacheConfigurationBuilder(this);
    otherBuilder.limitedCacheSize = size;
    otherBuilder.useLimitedCache = size > 0;
    return otherBuilder;
  }

  /**
   * Routes lookups to the unbounded tier on the returned builder, keeping the limited tier capacity.
   *
   * @return a new builder using the unbounded tier
   */
  public ClonePlanCacheConfigurationBuilder unlimitedCache() {
    ClonePlanCacheConfigurationBuilder otherBuilder = new ClonePlanCacheConfigurationBuilder(this);
    otherBuilder.useLimitedCache = false;
    return otherBuilder;
  }

  /**
   * Sets the eviction policy of the limited tier on the returned builder.
   *
   * @param evictionPolicy the eviction policy
   * @return a new builder with the updated eviction policy
   */
  public ClonePlanCacheConfigurationBuilder evictionPolicy(EvictionPolicy evictionPolicy) {
    ClonePlanCacheConfigurationBuilder otherBuilder = new ClonePlanCacheConfigurationBuilder(this);
    otherBuilder.evictionPolicy = requireNonNull(evictionPolicy, "Null eviction policy");
    return otherBuilder;
  }

  /**
   * Adds a type whose instances are never cloned on the returned builder.
   * <p>
   * Instances of subclasses and implementations of {@code type} are shared as well.
   *
   * @param type an immutable type
   * @return a new builder with the added immutable type
   */
  public ClonePlanCacheConfigurationBuilder withImmutableType(Class<?> type) {
    ClonePlanCacheConfigurationBuilder otherBuilder = new ClonePlanCacheConfigurationBuilder(this);
    otherBuilder.immutableTypes.add(requireNonNull(type, "Null immutable type"));
    return otherBuilder;
  }

  @Override
  public ClonePlanCacheConfiguration build() {
    return new DefaultClonePlanCacheConfiguration(limitedCacheSize, useLimitedCache, evictionPolicy, immutableTypes);
  }
}
