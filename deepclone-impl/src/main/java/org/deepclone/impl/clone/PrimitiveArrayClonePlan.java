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

/**
 * Plan for arrays of primitives, copied in bulk.
 */
public final class PrimitiveArrayClonePlan implements ClonePlan {

  private final Class<?> arrayType;

  PrimitiveArrayClonePlan(Class<?> arrayType) {
    this.arrayType = arrayType;
  }

  @Override
  public Object cloneInstance(Object source, CloneContext context) {
    int length = Array.getLength(source);
    Object target = Array.newInstance(arrayType.getComponentType(), length);
    System.arraycopy(source, 0, target, 0, length);
    context.register(source, target);
    return target;
  }

  @Override
  public String toString() {
    return "PrimitiveArrayClonePlan{" + arrayType.getComponentType().getName() + "[]}";
  }
}
