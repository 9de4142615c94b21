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

/**
 * Selects which entry of a capacity-bounded cache tier is dropped once the tier is over capacity.
 */
public enum EvictionPolicy {

  /**
   * Evicts the entry that was read or written the longest time ago.
   */
  LRU,

  /**
   * Evicts the entry that was inserted first, regardless of later reads.
   */
  FIFO
}
