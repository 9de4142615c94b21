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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Capacity-bounded tier of a {@link TieredCache}.
 * <p>
 * Entries are kept in a {@link ConcurrentHashMap}. Once an insertion pushes the mapping count over the capacity,
 * entries are evicted until the tier is back at capacity. Victims are selected by the {@link EvictionPolicy}
 * prioritizer over logical ticks, so that two accesses never compare as simultaneous.
 * <p>
 * A capacity lower than one disables the bound.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
class EvictingTier<K, V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(EvictingTier.class);

  /**
   * Comparator for eviction candidates:
   * The highest priority is the entry having the smallest lastAccessTime.
   */
  private static final Comparator<TierEntry<?>> LRU_PRIORITIZER = Comparator.comparingLong(TierEntry::lastAccessTime);

  /**
   * Comparator for eviction candidates:
   * The highest priority is the entry having the smallest creationTime.
   */
  private static final Comparator<TierEntry<?>> FIFO_PRIORITIZER = Comparator.comparingLong(TierEntry::creationTime);

  private final ConcurrentHashMap<K, TierEntry<V>> map = new ConcurrentHashMap<>();
  private final AtomicLong clock = new AtomicLong();
  private final EvictionPolicy evictionPolicy;
  private final Comparator<TierEntry<?>> prioritizer;
  private volatile int capacity;

  EvictingTier(int capacity, EvictionPolicy evictionPolicy) {
    if (evictionPolicy == null) {
      throw new NullPointerException("Eviction policy cannot be null");
    }
    this.capacity = capacity;
    this.evictionPolicy = evictionPolicy;
    switch (evictionPolicy) {
      case LRU:
        this.prioritizer = LRU_PRIORITIZER;
        break;
      case FIFO:
        this.prioritizer = FIFO_PRIORITIZER;
        break;
      default:
        throw new AssertionError("Unknown eviction policy " + evictionPolicy);
    }
  }

  int capacity() {
    return capacity;
  }

  void setCapacity(int capacity) {
    this.capacity = capacity;
  }

  EvictionPolicy evictionPolicy() {
    return evictionPolicy;
  }

  long mappingCount() {
    return map.mappingCount();
  }

  V get(K key) {
    TierEntry<V> entry = map.get(key);
    if (entry == null) {
      return null;
    }
    entry.setLastAccessTime(clock.incrementAndGet());
    return entry.value();
  }

  V getOrAdd(K key, Function<? super K, ? extends V> mappingFunction) {
    V value = get(key);
    if (value != null) {
      return value;
    }
    V computed = mappingFunction.apply(key);
    if (computed == null) {
      throw new NullPointerException("Mapping function returned null for " + key);
    }
    TierEntry<V> existing = map.putIfAbsent(key, new TierEntry<>(computed, clock.incrementAndGet()));
    if (existing != null) {
      existing.setLastAccessTime(clock.incrementAndGet());
      return existing.value();
    }
    enforceCapacity();
    return computed;
  }

  boolean tryAdd(K key, V value) {
    if (map.putIfAbsent(key, new TierEntry<>(value, clock.incrementAndGet())) == null) {
      enforceCapacity();
      return true;
    } else {
      return false;
    }
  }

  void clear() {
    map.clear();
  }

  Map<K, V> snapshot() {
    Map<K, V> copy = new HashMap<>();
    map.forEach((key, entry) -> copy.put(key, entry.value()));
    return Collections.unmodifiableMap(copy);
  }

  void enforceCapacity() {
    int bound = capacity;
    while (bound > 0 && map.mappingCount() > bound && evict()) {
      bound = capacity;
    }
  }

  /**
   * Try to evict a mapping.
   * @return true if a mapping was evicted, false otherwise.
   */
  boolean evict() {
    Map.Entry<K, TierEntry<V>> candidate = getEvictionCandidate();
    if (candidate == null) {
      return false;
    }
    boolean removed = map.remove(candidate.getKey(), candidate.getValue());
    if (removed) {
      LOGGER.debug("Evicted {} from limited tier ({} policy, capacity {})", candidate.getKey(), evictionPolicy, capacity);
    }
    return removed;
  }

  private Map.Entry<K, TierEntry<V>> getEvictionCandidate() {
    Map.Entry<K, TierEntry<V>> candidate = null;
    for (Map.Entry<K, TierEntry<V>> entry : map.entrySet()) {
      if (candidate == null || prioritizer.compare(entry.getValue(), candidate.getValue()) < 0) {
        candidate = entry;
      }
    }
    return candidate;
  }
}
