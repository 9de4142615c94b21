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

import org.deepclone.core.reflect.ReflectionCaches;
import org.deepclone.core.reflect.UnsafeAccess;
import org.deepclone.spi.clone.ClonePlan;
import org.deepclone.spi.clone.MemberAccessException;
import org.deepclone.spi.clone.UnsupportedTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Builds the {@link ClonePlan} of a concrete type.
 * <p>
 * All the reflective work happens here, once per type: executing a plan only goes through precomputed field offsets
 * and method handles.
 */
public class ClonePlanCompiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClonePlanCompiler.class);
  private static final UnsafeAccess UNSAFE = UnsafeAccess.getUnsafeAccess();

  private final TypeClassifier classifier;

  public ClonePlanCompiler(TypeClassifier classifier) {
    this.classifier = classifier;
  }

  /**
   * Compiles the clone plan of {@code type}.
   *
   * @param type the runtime type to compile a plan for
   * @return a new plan
   *
   * @throws UnsupportedTypeException if {@code type} is a delegate type
   * @throws IllegalArgumentException if {@code type} is an interface or an abstract class
   * @throws MemberAccessException if a field or constructor of {@code type} cannot be reached
   */
  public ClonePlan compile(Class<?> type) {
    ClonePlan plan;
    switch (classifier.classify(type)) {
      case DELEGATE:
        throw new UnsupportedTypeException(type);
      case VALUE:
      case IMMUTABLE:
        plan = new PassThroughClonePlan(type);
        break;
      case ARRAY:
        plan = compileArray(type);
        break;
      case STRUCT:
        plan = compileRecord(type);
        break;
      case CLASS:
        plan = compileClass(type);
        break;
      default:
        throw new AssertionError("Unknown category for " + type);
    }
    LOGGER.debug("Compiled {}", plan);
    return plan;
  }

  private ClonePlan compileArray(Class<?> type) {
    Class<?> componentType = type.getComponentType();
    if (componentType.isPrimitive()) {
      return new PrimitiveArrayClonePlan(type);
    }
    return new ReferenceArrayClonePlan(type, classifier.isPassThrough(componentType));
  }

  private ClonePlan compileClass(Class<?> type) {
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new IllegalArgumentException(type.getName() + " cannot have direct instances");
    }
    List<Field> fields = ReflectionCaches.getOrAddFieldsFromReflectionCache(type);
    FieldCopier[] steps = new FieldCopier[fields.size()];
    for (int i = 0; i < steps.length; i++) {
      Field field = fields.get(i);
      long offset;
      try {
        offset = UNSAFE.objectFieldOffset(field);
      } catch (UnsupportedOperationException e) {
        throw new MemberAccessException("Unable to locate field " + field.getName() + " of " + field.getDeclaringClass().getName(), e);
      }
      steps[i] = FieldCopier.forField(field, offset, classifier.isPassThrough(field.getType()));
    }
    return new ClassClonePlan(type, steps);
  }

  private ClonePlan compileRecord(Class<?> type) {
    RecordComponent[] components = type.getRecordComponents();
    int count = components.length;
    String[] names = new String[count];
    Class<?>[] types = new Class<?>[count];
    MethodHandle[] getters = new MethodHandle[count];
    boolean[] passThrough = new boolean[count];
    MethodHandles.Lookup lookup = MethodHandles.lookup();
    try {
      for (int i = 0; i < count; i++) {
        names[i] = components[i].getName();
        types[i] = components[i].getType();
        passThrough[i] = classifier.isPassThrough(types[i]);
        Field field = type.getDeclaredField(names[i]);
        field.setAccessible(true);
        MethodHandle getter = lookup.unreflectGetter(field);
        getters[i] = getter.asType(getter.type().generic());
      }
      Constructor<?> canonical = type.getDeclaredConstructor(types);
      canonical.setAccessible(true);
      MethodHandle constructor = lookup.unreflectConstructor(canonical);
      constructor = constructor.asType(constructor.type().generic()).asSpreader(Object[].class, count);
      return new RecordClonePlan(type, names, getters, passThrough, constructor);
    } catch (NoSuchFieldException | NoSuchMethodException | IllegalAccessException | InaccessibleObjectException | SecurityException e) {
      throw new MemberAccessException("Unable to access the components of record " + type.getName(), e);
    }
  }
}
