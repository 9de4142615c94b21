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

/**
 * A compiled function cloning instances of exactly one runtime type.
 * <p>
 * Plans are built once per type and are stateless, so a single plan can be executed concurrently by any number of
 * clone invocations.
 */
@FunctionalInterface
public interface ClonePlan {

  /**
   * Clones {@code source}.
   * <p>
   * Implementations for reference types register the new instance through {@link CloneContext#register(Object, Object)} before
   * populating any member.
   *
   * @param source the instance to clone, its runtime type is the type of this plan
   * @param context the invocation state
   * @return the clone, assignable to the type of this plan
   *
   * @throws MemberAccessException if a member cannot be read or written
   */
  Object cloneInstance(Object source, CloneContext context);
}
