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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Table from original objects to their already created clones.
 * <p>
 * Keys are compared by reference identity only, a type's own {@code equals}/{@code hashCode} are never consulted. A
 * map normally lives for a single top-level clone call; passing the same instance to several sequential calls merges
 * them into one identity space, so objects shared between the cloned roots stay shared between the clones.
 * <p>
 * <em>Instances are not thread-safe.</em> Reuse across threads must be serialized by the caller.
 */
public final class IdentityMap {

  private final Map<Object, Object> clones;

  /**
   * Creates an empty identity map.
   */
  public IdentityMap() {
    this.clones = new IdentityHashMap<>();
  }

  /**
   * Creates an empty identity map sized for the expected number of nodes.
   *
   * @param expectedNodes the expected number of distinct nodes
   */
  public IdentityMap(int expectedNodes) {
    this.clones = new IdentityHashMap<>(expectedNodes);
  }

  /**
   * Returns the clone registered for {@code original}.
   *
   * @param original the original object
   * @return the registered clone, or {@code null} if none
   */
  public Object get(Object original) {
    return clones.get(original);
  }

  /**
   * Indicates whether a clone was registered for this exact instance.
   *
   * @param original the original object
   * @return {@code true} if {@code original} is a key of this map
   */
  public boolean containsKey(Object original) {
    return clones.containsKey(original);
  }

  /**
   * Registers {@code clone} as the copy of {@code original}.
   *
   * @param original the original object
   * @param clone its copy
   * @return the clone previously registered for {@code original}, or {@code null}
   *
   * @throws NullPointerException if either argument is {@code null}
   */
  public Object put(Object original, Object clone) {
    if (original == null) {
      throw new NullPointerException("Original object cannot be null");
    }
    if (clone == null) {
      throw new NullPointerException("Clone cannot be null");
    }
    return clones.put(original, clone);
  }

  /**
   * Registers {@code clone} as the copy of {@code original} unless a copy is already registered.
   *
   * @param original the original object
   * @param clone its candidate copy
   * @return the copy now registered for {@code original}
   */
  public Object putIfAbsent(Object original, Object clone) {
    Object existing = clones.get(original);
    if (existing == null) {
      put(original, clone);
      return clone;
    }
    return existing;
  }

  /**
   * Removes the registration of {@code original}.
   *
   * @param original the original object
   * @return the clone that was registered, or {@code null} if none
   */
  public Object remove(Object original) {
    return clones.remove(original);
  }

  /**
   * Returns the number of registered originals.
   *
   * @return the number of entries
   */
  public int size() {
    return clones.size();
  }

  /**
   * Indicates whether nothing was registered yet.
   *
   * @return {@code true} if empty
   */
  public boolean isEmpty() {
    return clones.isEmpty();
  }

  /**
   * Removes all registrations.
   */
  public void clear() {
    clones.clear();
  }

  /**
   * Returns a read-only, identity based view of the registrations.
   *
   * @return an unmodifiable view of this map
   */
  public Map<Object, Object> asMap() {
    return Collections.unmodifiableMap(clones);
  }

  @Override
  public String toString() {
    return "IdentityMap{size=" + clones.size() + "}";
  }
}
