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

package org.deepclone.impl.copy;

import org.deepclone.DeepCloner;
import org.deepclone.impl.clone.DeepClone;
import org.deepclone.spi.copy.Copier;

/**
 * {@link Copier} producing deep clones through a {@link DeepCloner}.
 */
public final class DeepCloningCopier<T> implements Copier<T> {

  private final DeepCloner cloner;

  /**
   * Creates a copier using the process-wide cloner.
   */
  public DeepCloningCopier() {
    this(DeepClone.cloner());
  }

  /**
   * Creates a copier using the provided {@link DeepCloner}.
   *
   * @param cloner the cloner to use
   */
  public DeepCloningCopier(DeepCloner cloner) {
    if (cloner == null) {
      throw new NullPointerException("A " + DeepCloningCopier.class.getName() + " instance requires a "
                                     + DeepCloner.class.getName() + " instance to copy!");
    }
    this.cloner = cloner;
  }

  @Override
  public T copy(final T obj) {
    return cloner.deepClone(obj);
  }

  public DeepCloner getCloner() {
    return cloner;
  }
}
