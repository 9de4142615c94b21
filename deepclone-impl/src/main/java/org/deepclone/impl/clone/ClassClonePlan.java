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

import org.deepclone.core.reflect.UnsafeAccess;
import org.deepclone.spi.clone.CloneContext;
import org.deepclone.spi.clone.ClonePlan;
import org.deepclone.spi.clone.MemberAccessException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Plan for ordinary classes.
 * <p>
 * The clone is allocated without running any constructor and registered in the identity map before its fields are
 * populated.
 */
public final class ClassClonePlan implements ClonePlan {

  private static final UnsafeAccess UNSAFE = UnsafeAccess.getUnsafeAccess();

  private final Class<?> type;
  private final FieldCopier[] steps;

  ClassClonePlan(Class<?> type, FieldCopier[] steps) {
    this.type = type;
    this.steps = steps;
  }

  @Override
  public Object cloneInstance(Object source, CloneContext context) {
    Object target;
    try {
      target = UNSAFE.allocateInstance(type);
    } catch (InstantiationException e) {
      throw new MemberAccessException("Unable to allocate an instance of " + type.getName(), e);
    }
    context.register(source, target);
    for (FieldCopier step : steps) {
      step.copy(source, target, context);
    }
    return target;
  }

  List<FieldCopier> steps() {
    return Collections.unmodifiableList(Arrays.asList(steps));
  }

  @Override
  public String toString() {
    return "ClassClonePlan{" + type.getName() + " " + Arrays.toString(steps) + "}";
  }
}
