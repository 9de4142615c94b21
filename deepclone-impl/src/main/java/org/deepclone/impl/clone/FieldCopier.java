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

import java.lang.reflect.Field;

/**
 * A single precomputed step of a {@link ClassClonePlan}: copies one instance field from a source to its clone through
 * the field's raw offset.
 */
abstract class FieldCopier {

  private static final UnsafeAccess UNSAFE = UnsafeAccess.getUnsafeAccess();

  private final Field field;
  private final String strategy;
  final long offset;

  FieldCopier(Field field, long offset, String strategy) {
    this.field = field;
    this.offset = offset;
    this.strategy = strategy;
  }

  abstract void copy(Object source, Object target, CloneContext context);

  Field field() {
    return field;
  }

  String strategy() {
    return strategy;
  }

  @Override
  public String toString() {
    return field.getDeclaringClass().getSimpleName() + "." + field.getName() + ":" + strategy;
  }

  /**
   * Selects the copy strategy of {@code field} from its declared type.
   *
   * @param field the instance field
   * @param offset the field offset
   * @param passThrough whether every value the declared type admits is its own clone
   * @return the field step
   */
  static FieldCopier forField(Field field, long offset, boolean passThrough) {
    Class<?> type = field.getType();
    if (type.isPrimitive()) {
      return primitiveCopier(field, offset, type);
    } else if (passThrough) {
      return new FieldCopier(field, offset, "reference") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putObject(target, offset, UNSAFE.getObject(source, offset));
        }
      };
    } else {
      return new FieldCopier(field, offset, "deep") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putObject(target, offset, context.cloneMember(UNSAFE.getObject(source, offset)));
        }
      };
    }
  }

  private static FieldCopier primitiveCopier(Field field, long offset, Class<?> type) {
    if (type == int.class) {
      return new FieldCopier(field, offset, "int") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putInt(target, offset, UNSAFE.getInt(source, offset));
        }
      };
    } else if (type == long.class) {
      return new FieldCopier(field, offset, "long") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putLong(target, offset, UNSAFE.getLong(source, offset));
        }
      };
    } else if (type == boolean.class) {
      return new FieldCopier(field, offset, "boolean") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putBoolean(target, offset, UNSAFE.getBoolean(source, offset));
        }
      };
    } else if (type == double.class) {
      return new FieldCopier(field, offset, "double") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putDouble(target, offset, UNSAFE.getDouble(source, offset));
        }
      };
    } else if (type == float.class) {
      return new FieldCopier(field, offset, "float") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putFloat(target, offset, UNSAFE.getFloat(source, offset));
        }
      };
    } else if (type == char.class) {
      return new FieldCopier(field, offset, "char") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putChar(target, offset, UNSAFE.getChar(source, offset));
        }
      };
    } else if (type == short.class) {
      return new FieldCopier(field, offset, "short") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putShort(target, offset, UNSAFE.getShort(source, offset));
        }
      };
    } else if (type == byte.class) {
      return new FieldCopier(field, offset, "byte") {
        @Override
        void copy(Object source, Object target, CloneContext context) {
          UNSAFE.putByte(target, offset, UNSAFE.getByte(source, offset));
        }
      };
    } else {
      throw new AssertionError("Unexpected primitive type " + type);
    }
  }
}
