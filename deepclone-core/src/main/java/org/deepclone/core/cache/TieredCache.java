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

package org.deepclone.core.cache;

import org.deepclone.config.EvictionPolicy;
import org.deepclone.spi.cache.TieredCacheAdministration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Two-tier memoization cache: an unbounded full tier and a capacity-bounded limited tier.
 * <p>
 * Both tiers are backed by concurrent maps so that racing get-or-add sequences never corrupt them. A miss computes the
 * value outside of any lock and then publishes it with {@code putIfAbsent}: two threads missing on the same key may
 * both compute, but they all end up returning the mapping that won.
 * <p>
 * Configuration fields are volatile and not otherwise coordinated with lookups. Callers needing a strict ordering
 * between reconfiguration and lookups running on other threads have to synchronize externally.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class TieredCache<K, V> implements TieredCacheAdministration<K, V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(TieredCache.class);

  private final String alias;
  private final ConcurrentHashMap<K, V> cache = new ConcurrentHashMap<>();
  private final EvictingTier<K, V> limitedCache;
  private volatile boolean useLimitedCache;

  /**
   * Creates a new tiered cache.
   *
   * @param alias name used in log messages
   * @param limitedCacheSize the limited tier capacity, lower than one to leave the limited tier inactive
   * @param useLimitedCache whether the limited tier is enabled
   * @param evictionPolicy the limited tier eviction policy
   */
  public TieredCache(String alias, int limitedCacheSize, boolean useLimitedCache, EvictionPolicy evictionPolicy) {
    if (alias == null) {
      throw new NullPointerException("Alias cannot be null");
    }
    this.alias = alias;
    this.limitedCache = new EvictingTier<>(Math.max(0, limitedCacheSize), evictionPolicy);
    this.useLimitedCache = useLimitedCache;
  }

  /**
   * Looks up {@code key} in the active tier, computing and inserting the value in that tier on a miss.
   *
   * @param key the key
   * @param mappingFunction computes the value on a miss
   * @return the cached value
   */
  public V getOrAdd(K key, Function<? super K, ? extends V> mappingFunction) {
    if (isUsingLimitedCache()) {
      return getOrAddLimitedCache(key, mappingFunction);
    } else {
      return getOrAddCache(key, mappingFunction);
    }
  }

  @Override
  public void clearAllCaches() {
    clearCache();
    clearLimitedCache();
  }

  @Override
  public void clearCache() {
    cache.clear();
    LOGGER.debug("Cleared full tier of {} cache", alias);
  }

  @Override
  public void clearLimitedCache() {
    limitedCache.clear();
    LOGGER.debug("Cleared limited tier of {} cache", alias);
  }

  @Override
  public void setLimitedCacheSize(int size) {
    if (size < 1) {
      limitedCache.setCapacity(0);
      useLimitedCache = false;
    } else {
      limitedCache.setCapacity(size);
      useLimitedCache = true;
    }
    LOGGER.debug("Limited tier of {} cache resized to {}, active: {}", alias, limitedCache.capacity(), isUsingLimitedCache());
  }

  @Override
  public void setUseLimitedCache(boolean useLimitedCache) {
    this.useLimitedCache = useLimitedCache;
    LOGGER.debug("Limited tier of {} cache enabled: {}, active: {}", alias, useLimitedCache, isUsingLimitedCache());
  }

  @Override
  public int getLimitedCacheSize() {
    return limitedCache.capacity();
  }

  @Override
  public boolean isUsingLimitedCache() {
    return useLimitedCache && limitedCache.capacity() > 0;
  }

  @Override
  public EvictionPolicy getEvictionPolicy() {
    return limitedCache.evictionPolicy();
  }

  @Override
  public Map<K, V> getCache() {
    return Collections.unmodifiableMap(new HashMap<>(cache));
  }

  @Override
  public Map<K, V> getLimitedCache() {
    return limitedCache.snapshot();
  }

  @Override
  public V getOrAddCache(K key, Function<? super K, ? extends V> mappingFunction) {
    V value = cache.get(key);
    if (value != null) {
      return value;
    }
    V computed = mappingFunction.apply(key);
    if (computed == null) {
      throw new NullPointerException("Mapping function returned null for " + key);
    }
    V existing = cache.putIfAbsent(key, computed);
    return existing == null ? computed : existing;
  }

  @Override
  public V getOrAddLimitedCache(K key, Function<? super K, ? extends V> mappingFunction) {
    return limitedCache.getOrAdd(key, mappingFunction);
  }

  @Override
  public boolean tryAddCache(K key, V value) {
    return cache.putIfAbsent(key, value) == null;
  }

  @Override
  public boolean tryAddLimitedCache(K key, V value) {
    return limitedCache.tryAdd(key, value);
  }

  @Override
  public String toString() {
    return "TieredCache{alias=" + alias + ", full=" + cache.size() + ", limited=" + limitedCache.mappingCount()
           + "/" + limitedCache.capacity() + ", usingLimited=" + isUsingLimitedCache() + "}";
  }
}
