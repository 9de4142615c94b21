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

package org.deepclone.spi.clone;

import org.deepclone.IdentityMap;

/**
 * State of a single clone invocation as seen by the {@link ClonePlan}s it executes.
 * <p>
 * <em>Contexts are confined to the thread running the clone invocation.</em>
 */
public interface CloneContext {

  /**
   * The identity space of this invocation.
   *
   * @return the identity map
   */
  IdentityMap identities();

  /**
   * Registers {@code clone} as the copy of {@code source} in this invocation's identity space.
   * <p>
   * Registrations made by a failed invocation are withdrawn before the failure reaches the caller.
   *
   * @param source the node being cloned
   * @param clone its copy
   */
  void register(Object source, Object clone);

  /**
   * Registers {@code clone} as the copy of {@code source} unless a copy was registered meanwhile.
   *
   * @param source the node being cloned
   * @param clone its candidate copy
   * @return the copy now registered for {@code source}
   */
  Object registerIfAbsent(Object source, Object clone);

  /**
   * Clones the current value of a member of a node being cloned.
   * <p>
   * The value is classified by its runtime type. Unlike a root value, a lambda or method handle yields {@code null}.
   *
   * @param value the member value, may be {@code null}
   * @return the value to store in the clone
   */
  Object cloneMember(Object value);
}
