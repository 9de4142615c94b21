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

package org.deepclone.config;

import java.util.Set;

/**
 * Represents the configuration of the compiled clone plan cache.
 * <p>
 * <em>Implementations are expected to be read-only.</em>
 */
public interface ClonePlanCacheConfiguration {

  /**
   * The capacity of the limited tier.
   * <p>
   * A value lower than one means the limited tier is never active.
   *
   * @return the limited tier capacity
   */
  int getLimitedCacheSize();

  /**
   * Whether automatic lookups go to the limited tier.
   * <p>
   * Only effective if {@link #getLimitedCacheSize()} is greater than zero.
   *
   * @return {@code true} if the limited tier is enabled
   */
  boolean isUseLimitedCache();

  /**
   * The policy used to select entries to evict from the limited tier.
   *
   * @return the eviction policy
   */
  EvictionPolicy getEvictionPolicy();

  /**
   * Types whose instances are returned as-is instead of being cloned, in addition to the built-in ones.
   * <p>
   * The set must not be {@code null} but can be empty. It must be unmodifiable.
   *
   * @return additional immutable types
   */
  Set<Class<?>> getImmutableTypes();
}
