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

package org.deepclone.impl.clone;

import org.deepclone.spi.clone.CloneContext;
import org.deepclone.spi.clone.ClonePlan;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Plan for arrays of references.
 * <p>
 * Nested arrays are plain elements here, so arrays of any rank are cloned one dimension at a time.
 */
public final class ReferenceArrayClonePlan implements ClonePlan {

  private final Class<?> arrayType;
  private final boolean shallowElements;

  ReferenceArrayClonePlan(Class<?> arrayType, boolean shallowElements) {
    this.arrayType = arrayType;
    this.shallowElements = shallowElements;
  }

  @Override
  public Object cloneInstance(Object source, CloneContext context) {
    Object[] array = (Object[]) source;
    if (shallowElements) {
      Object[] target = Arrays.copyOf(array, array.length);
      context.register(source, target);
      return target;
    }
    Object[] target = (Object[]) Array.newInstance(arrayType.getComponentType(), array.length);
    context.register(source, target);
    for (int i = 0; i < array.length; i++) {
      target[i] = context.cloneMember(array[i]);
    }
    return target;
  }

  boolean isShallow() {
    return shallowElements;
  }

  @Override
  public String toString() {
    return "ReferenceArrayClonePlan{" + arrayType.getComponentType().getName() + "[]" + (shallowElements ? " shallow" : " deep") + "}";
  }
}
