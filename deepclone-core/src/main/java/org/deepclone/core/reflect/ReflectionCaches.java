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

package org.deepclone.core.reflect;

import org.deepclone.config.EvictionPolicy;
import org.deepclone.core.cache.TieredCache;
import org.deepclone.spi.cache.TieredCacheAdministration;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Memoized reflection scans of type members.
 */
public final class ReflectionCaches {

  private static final TieredCache<Class<?>, List<Field>> FIELD_CACHE = new TieredCache<>("reflection", 100, true, EvictionPolicy.LRU);

  private ReflectionCaches() {
    throw new UnsupportedOperationException("Thou shalt not instantiate me!");
  }

  /**
   * Exposes the administration surface of the field cache.
   *
   * @return the field cache administration
   */
  public static TieredCacheAdministration<Class<?>, List<Field>> cacheManager() {
    return FIELD_CACHE;
  }

  /**
   * Returns every instance field of {@code type} and of its superclasses, whatever their visibility.
   * <p>
   * Fields of the topmost superclass come first, then declaration order within each class. Static fields are skipped.
   * The scan result is cached in the active tier of the field cache.
   *
   * @param type the type to scan
   * @return an unmodifiable, stable ordered list of instance fields
   */
  public static List<Field> getOrAddFieldsFromReflectionCache(Class<?> type) {
    return FIELD_CACHE.getOrAdd(type, ReflectionCaches::scanInstanceFields);
  }

  static List<Field> scanInstanceFields(Class<?> type) {
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> current = type; current != null; current = current.getSuperclass()) {
      hierarchy.push(current);
    }
    List<Field> fields = new ArrayList<>();
    for (Class<?> declaringClass : hierarchy) {
      for (Field field : declaringClass.getDeclaredFields()) {
        if (!Modifier.isStatic(field.getModifiers())) {
          fields.add(field);
        }
      }
    }
    return Collections.unmodifiableList(fields);
  }
}
