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
import org.deepclone.spi.clone.MemberAccessException;

import java.lang.invoke.MethodHandle;
import java.util.Arrays;

/**
 * Plan for records holding components that need cloning.
 * <p>
 * Components are read through their fields, cloned and handed to the canonical constructor. The clone is registered
 * once constructed; if a clone of the same source was registered while its components were cloned, that one is kept.
 */
public final class RecordClonePlan implements ClonePlan {

  private final Class<?> type;
  private final String[] names;
  private final MethodHandle[] getters;
  private final boolean[] passThrough;
  private final MethodHandle constructor;

  /**
   * @param getters component accessors typed {@code (Object)Object}
   * @param constructor canonical constructor typed {@code (Object[])Object}
   */
  RecordClonePlan(Class<?> type, String[] names, MethodHandle[] getters, boolean[] passThrough, MethodHandle constructor) {
    this.type = type;
    this.names = names;
    this.getters = getters;
    this.passThrough = passThrough;
    this.constructor = constructor;
  }

  @Override
  public Object cloneInstance(Object source, CloneContext context) {
    Object[] components = new Object[getters.length];
    for (int i = 0; i < getters.length; i++) {
      Object value = readComponent(i, source);
      components[i] = passThrough[i] ? value : context.cloneMember(value);
    }
    Object clone;
    try {
      clone = (Object) constructor.invokeExact(components);
    } catch (Error e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MemberAccessException("Canonical constructor of " + type.getName() + " rejected the cloned components", e);
    } catch (Throwable t) {
      throw new MemberAccessException("Canonical constructor of " + type.getName() + " failed", t);
    }
    return context.registerIfAbsent(source, clone);
  }

  private Object readComponent(int index, Object source) {
    try {
      return (Object) getters[index].invokeExact(source);
    } catch (Throwable t) {
      throw new MemberAccessException("Unable to read component " + names[index] + " of " + type.getName(), t);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RecordClonePlan{").append(type.getName()).append(" [");
    for (int i = 0; i < names.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(names[i]).append(':').append(passThrough[i] ? "reference" : "deep");
    }
    return sb.append("]}").toString();
  }

  int componentCount() {
    return names.length;
  }

  String[] componentNames() {
    return Arrays.copyOf(names, names.length);
  }
}
