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

import java.lang.reflect.Field;
import java.security.PrivilegedExceptionAction;

/**
 * Field-offset level access to object storage, and allocation without construction.
 * <p>
 * This bypasses access control, {@code final} modifiers and module encapsulation. It is intentionally unsafe and must
 * stay behind the clone engine boundary: callers are responsible for pairing each offset with accessors of the field's
 * exact primitive kind.
 */
public final class UnsafeAccess {

  private static final sun.misc.Unsafe SMU;
  private static final UnsafeAccess U;

  private static sun.misc.Unsafe getSMU() {
    try {
      return sun.misc.Unsafe.getUnsafe();
    } catch (SecurityException tryReflectionInstead) {
      // ignore
    }
    try {
      return java.security.AccessController.doPrivileged
        ((PrivilegedExceptionAction<sun.misc.Unsafe>) () -> {
          Class<sun.misc.Unsafe> k = sun.misc.Unsafe.class;
          for (Field f : k.getDeclaredFields()) {
            f.setAccessible(true);
            Object x = f.get(null);
            if (k.isInstance(x)) {
              return k.cast(x);
            }
          }
          throw new NoSuchFieldError("the Unsafe");
        });
    } catch (java.security.PrivilegedActionException e) {
      throw new RuntimeException("Could not initialize field access", e.getCause());
    }
  }

  static {
    try {
      SMU = getSMU();
      U = new UnsafeAccess();
    } catch (Exception e) {
      throw new Error(e);
    }
  }

  private UnsafeAccess() {
  }

  public static UnsafeAccess getUnsafeAccess() {
    return U;
  }

  /**
   * Returns the storage offset of an instance field.
   *
   * @param field the instance field
   * @return its offset
   * @throws UnsupportedOperationException if the declaring class is a record or a hidden class
   */
  public long objectFieldOffset(Field field) {
    return SMU.objectFieldOffset(field);
  }

  /**
   * Allocates an instance of {@code type} without running any constructor.
   *
   * @param type a concrete, non array class
   * @return a zeroed instance
   * @throws InstantiationException if {@code type} is abstract, an interface or an array type
   */
  public Object allocateInstance(Class<?> type) throws InstantiationException {
    return SMU.allocateInstance(type);
  }

  public Object  getObject(Object o, long offset)            { return SMU.getObject(o, offset); }
  public void    putObject(Object o, long offset, Object x)  { SMU.putObject(o, offset, x); }
  public boolean getBoolean(Object o, long offset)           { return SMU.getBoolean(o, offset); }
  public void    putBoolean(Object o, long offset, boolean x) { SMU.putBoolean(o, offset, x); }
  public byte    getByte(Object o, long offset)              { return SMU.getByte(o, offset); }
  public void    putByte(Object o, long offset, byte x)      { SMU.putByte(o, offset, x); }
  public short   getShort(Object o, long offset)             { return SMU.getShort(o, offset); }
  public void    putShort(Object o, long offset, short x)    { SMU.putShort(o, offset, x); }
  public char    getChar(Object o, long offset)              { return SMU.getChar(o, offset); }
  public void    putChar(Object o, long offset, char x)      { SMU.putChar(o, offset, x); }
  public int     getInt(Object o, long offset)               { return SMU.getInt(o, offset); }
  public void    putInt(Object o, long offset, int x)        { SMU.putInt(o, offset, x); }
  public long    getLong(Object o, long offset)              { return SMU.getLong(o, offset); }
  public void    putLong(Object o, long offset, long x)      { SMU.putLong(o, offset, x); }
  public float   getFloat(Object o, long offset)             { return SMU.getFloat(o, offset); }
  public void    putFloat(Object o, long offset, float x)    { SMU.putFloat(o, offset, x); }
  public double  getDouble(Object o, long offset)            { return SMU.getDouble(o, offset); }
  public void    putDouble(Object o, long offset, double x)  { SMU.putDouble(o, offset, x); }
}
