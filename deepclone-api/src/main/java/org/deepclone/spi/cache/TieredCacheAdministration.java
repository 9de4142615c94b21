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

package org.deepclone.spi.cache;

import org.deepclone.config.EvictionPolicy;

import java.util.Map;
import java.util.function.Function;

/**
 * Administration surface of a two-tier memoization cache.
 * <p>
 * A tiered cache holds an unbounded <em>full</em> tier and a capacity-bounded <em>limited</em> tier. Exactly one of them
 * is active for automatic lookups: the limited tier when it is enabled and its capacity is greater than zero, the full
 * tier otherwise. Both tiers can be inspected, filled and cleared independently of which one is active.
 * <p>
 * Configuration changes only affect future lookups, they never drop entries already cached.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface TieredCacheAdministration<K, V> {

  /**
   * Clears both tiers.
   */
  void clearAllCaches();

  /**
   * Clears the full tier.
   */
  void clearCache();

  /**
   * Clears the limited tier.
   */
  void clearLimitedCache();

  /**
   * Sets the capacity of the limited tier.
   * <p>
   * A size greater than zero also makes the limited tier the active one, a size lower than one deactivates it.
   * Existing mappings are not evicted here; the new bound applies from the next insertion into the tier.
   *
   * @param size the new capacity
   */
  void setLimitedCacheSize(int size);

  /**
   * Enables or disables the limited tier, keeping its capacity.
   *
   * @param useLimitedCache {@code true} to route automatic lookups to the limited tier
   */
  void setUseLimitedCache(boolean useLimitedCache);

  /**
   * Returns the capacity of the limited tier.
   *
   * @return the limited tier capacity
   */
  int getLimitedCacheSize();

  /**
   * Indicates whether automatic lookups currently go to the limited tier.
   *
   * @return {@code true} if the limited tier is active
   */
  boolean isUsingLimitedCache();

  /**
   * Returns the policy selecting eviction victims in the limited tier.
   *
   * @return the eviction policy
   */
  EvictionPolicy getEvictionPolicy();

  /**
   * Returns a read-only snapshot of the full tier.
   *
   * @return the full tier contents
   */
  Map<K, V> getCache();

  /**
   * Returns a read-only snapshot of the limited tier.
   *
   * @return the limited tier contents
   */
  Map<K, V> getLimitedCache();

  /**
   * Returns the value mapped to {@code key} in the full tier, computing and inserting it on a miss.
   *
   * @param key the key
   * @param mappingFunction computes the value on a miss
   * @return the cached value
   */
  V getOrAddCache(K key, Function<? super K, ? extends V> mappingFunction);

  /**
   * Returns the value mapped to {@code key} in the limited tier, computing and inserting it on a miss.
   *
   * @param key the key
   * @param mappingFunction computes the value on a miss
   * @return the cached value
   */
  V getOrAddLimitedCache(K key, Function<? super K, ? extends V> mappingFunction);

  /**
   * Inserts a mapping in the full tier unless one exists.
   *
   * @param key the key
   * @param value the value
   * @return {@code true} if the mapping was inserted
   */
  boolean tryAddCache(K key, V value);

  /**
   * Inserts a mapping in the limited tier unless one exists.
   * <p>
   * The insertion happens whether or not the limited tier is active. An inactive tier has a capacity of zero,
   * which evicts nothing: mappings forced into it are all retained until the tier is cleared, or until a
   * positive size is set and a later insertion trims the tier down to it.
   *
   * @param key the key
   * @param value the value
   * @return {@code true} if the mapping was inserted
   */
  boolean tryAddLimitedCache(K key, V value);
}
