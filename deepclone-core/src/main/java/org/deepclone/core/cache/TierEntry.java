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

/**
 * Holder of a value stored in an {@link EvictingTier}, tracking the ticks used to prioritize eviction.
 *
 * @param <V> the value type
 */
final class TierEntry<V> {

  private final V value;
  private final long creationTime;
  private volatile long lastAccessTime;

  TierEntry(V value, long creationTime) {
    if (value == null) {
      throw new NullPointerException("Cached value cannot be null");
    }
    this.value = value;
    this.creationTime = creationTime;
    this.lastAccessTime = creationTime;
  }

  V value() {
    return value;
  }

  long creationTime() {
    return creationTime;
  }

  long lastAccessTime() {
    return lastAccessTime;
  }

  void setLastAccessTime(long lastAccessTime) {
    this.lastAccessTime = lastAccessTime;
  }

  @Override
  public String toString() {
    return "TierEntry{value=" + value + ", creationTime=" + creationTime + ", lastAccessTime=" + lastAccessTime + "}";
  }
}
