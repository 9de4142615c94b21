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

import org.junit.Test;

import java.lang.reflect.Field;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

public class UnsafeAccessTest {

  private final UnsafeAccess unsafe = UnsafeAccess.getUnsafeAccess();

  @Test
  public void testAllocateInstanceSkipsConstructor() throws Exception {
    Object instance = unsafe.allocateInstance(Guarded.class);

    assertThat(instance, instanceOf(Guarded.class));
    assertThat(((Guarded) instance).value, is(0));
    assertThat(((Guarded) instance).name, nullValue());
  }

  @Test
  public void testFinalFieldsCanBeWritten() throws Exception {
    Guarded guarded = (Guarded) unsafe.allocateInstance(Guarded.class);
    Field value = Guarded.class.getDeclaredField("value");
    Field name = Guarded.class.getDeclaredField("name");

    unsafe.putInt(guarded, unsafe.objectFieldOffset(value), 42);
    unsafe.putObject(guarded, unsafe.objectFieldOffset(name), "written");

    assertThat(guarded.value, is(42));
    assertThat(guarded.name, is("written"));
  }

  @Test
  public void testRecordFieldsHaveNoOffset() throws Exception {
    Field field = Pair.class.getDeclaredField("left");
    assertThrows(UnsupportedOperationException.class, () -> unsafe.objectFieldOffset(field));
  }

  @Test(expected = InstantiationException.class)
  public void testAbstractTypesCannotBeAllocated() throws Exception {
    unsafe.allocateInstance(Number.class);
  }

  static final class Guarded {
    private final int value;
    private final String name;

    Guarded() {
      throw new IllegalStateException("never called");
    }
  }

  record Pair(String left, String right) {}
}
