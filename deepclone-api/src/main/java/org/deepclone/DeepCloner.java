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

package org.deepclone;

import org.deepclone.spi.cache.TieredCacheAdministration;
import org.deepclone.spi.clone.ClonePlan;

/**
 * Produces structurally independent copies of arbitrary object graphs.
 * <p>
 * A copy shares no mutable node with its source, keeps nodes that are shared in the source shared in the copy and
 * terminates on cycles. Instances are thread-safe: concurrent calls only share the compiled plan caches.
 */
public interface DeepCloner {

  /**
   * Deep clones {@code source} in a fresh identity space, using the plan cache.
   *
   * @param source the value to clone, may be {@code null}
   * @param <T> the nominal type of the value
   * @return the clone, or {@code null} if {@code source} is {@code null}
   *
   * @throws org.deepclone.spi.clone.UnsupportedTypeException if {@code source} is a lambda or method handle
   * @throws DeepCloneException if any member cannot be duplicated
   */
  <T> T deepClone(T source);

  /**
   * Deep clones {@code source} registering every reference node in {@code identityMap}, using the plan cache.
   *
   * @param source the value to clone, may be {@code null}
   * @param identityMap the identity space to use, {@code null} for a fresh one
   * @param <T> the nominal type of the value
   * @return the clone, or {@code null} if {@code source} is {@code null}
   *
   * @see #deepClone(Object, IdentityMap, boolean)
   */
  <T> T deepClone(T source, IdentityMap identityMap);

  /**
   * Deep clones {@code source}.
   * <p>
   * When {@code useCache} is {@code false} clone plans are compiled for this call only and never inserted in any cache
   * tier.
   *
   * @param source the value to clone, may be {@code null}
   * @param identityMap the identity space to use, {@code null} for a fresh one
   * @param useCache whether compiled plans are looked up in, and added to, the plan cache
   * @param <T> the nominal type of the value
   * @return the clone, or {@code null} if {@code source} is {@code null}
   *
   * @throws org.deepclone.spi.clone.UnsupportedTypeException if {@code source} is a lambda or method handle
   * @throws DeepCloneException if any member cannot be duplicated
   */
  <T> T deepClone(T source, IdentityMap identityMap, boolean useCache);

  /**
   * Exposes the administration surface of the compiled plan cache used by this cloner.
   *
   * @return the plan cache administration
   */
  TieredCacheAdministration<Class<?>, ClonePlan> planCache();
}
