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
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DeepCloningCopierTest {

  @Test
  public void testDelegatesToCloner() {
    DeepCloner cloner = mock(DeepCloner.class);
    List<String> original = new ArrayList<>();
    List<String> copy = new ArrayList<>();
    when(cloner.deepClone(original)).thenReturn(copy);

    DeepCloningCopier<List<String>> copier = new DeepCloningCopier<>(cloner);

    assertThat(copier.copy(original), sameInstance(copy));
    verify(cloner).deepClone(original);
  }

  @Test
  public void testDefaultUsesProcessWideCloner() {
    DeepCloningCopier<List<StringBuilder>> copier = new DeepCloningCopier<>();
    List<StringBuilder> original = new ArrayList<>();
    original.add(new StringBuilder("mutable"));

    List<StringBuilder> copy = copier.copy(original);

    assertThat(copier.getCloner(), sameInstance(DeepClone.cloner()));
    assertThat(copy, not(sameInstance(original)));
    assertThat(copy.get(0), not(sameInstance(original.get(0))));
    assertThat(copy.get(0).toString(), is("mutable"));
  }

  @Test
  public void testCopiesAreIndependent() {
    DeepCloningCopier<List<String>> copier = new DeepCloningCopier<>();
    List<String> original = new ArrayList<>();
    original.add("a");

    List<String> copy = copier.copy(original);
    copy.add("b");

    assertThat(original, contains("a"));
  }

  @Test(expected = NullPointerException.class)
  public void testThrowsNPEWhenNoClonerPassedToConstructor() {
    new DeepCloningCopier<>(null);
  }
}
