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

import org.deepclone.spi.clone.ClonePlan;
import org.junit.Before;
import org.junit.Test;

import static org.deepclone.config.builders.ClonePlanCacheConfigurationBuilder.newClonePlanCacheConfigurationBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ClonePlanCacheTest {

  private ClonePlanCompiler compiler;
  private ClonePlan plan;

  @Before
  public void setUp() {
    compiler = mock(ClonePlanCompiler.class);
    plan = mock(ClonePlan.class);
    when(compiler.compile(StringBuilder.class)).thenReturn(plan);
  }

  @Test
  public void testResolveCompilesOnceInLimitedTier() {
    ClonePlanCache cache = new ClonePlanCache(compiler, newClonePlanCacheConfigurationBuilder().build());

    assertThat(cache.resolve(StringBuilder.class), sameInstance(plan));
    assertThat(cache.resolve(StringBuilder.class), sameInstance(plan));

    verify(compiler, times(1)).compile(StringBuilder.class);
    assertThat(cache.administration().getLimitedCache().containsKey(StringBuilder.class), is(true));
    assertThat(cache.administration().getCache().isEmpty(), is(true));
  }

  @Test
  public void testResolveUsesFullTierWhenUnlimited() {
    ClonePlanCache cache = new ClonePlanCache(compiler, newClonePlanCacheConfigurationBuilder().unlimitedCache().build());

    cache.resolve(StringBuilder.class);

    assertThat(cache.administration().getCache().containsKey(StringBuilder.class), is(true));
    assertThat(cache.administration().getLimitedCache().isEmpty(), is(true));
  }

  @Test
  public void testClearingForcesRecompilation() {
    ClonePlanCache cache = new ClonePlanCache(compiler, newClonePlanCacheConfigurationBuilder().limitedCacheSize(0).build());

    cache.resolve(StringBuilder.class);
    cache.administration().clearAllCaches();
    cache.resolve(StringBuilder.class);

    verify(compiler, times(2)).compile(StringBuilder.class);
  }

  @Test
  public void testUncachedCompileIsNotInserted() {
    ClonePlanCache cache = new ClonePlanCache(compiler, newClonePlanCacheConfigurationBuilder().build());

    assertThat(cache.compileUncached(StringBuilder.class), sameInstance(plan));

    assertThat(cache.administration().getCache().isEmpty(), is(true));
    assertThat(cache.administration().getLimitedCache().isEmpty(), is(true));
  }

  @Test
  public void testPrewarmedPlanSkipsCompiler() {
    ClonePlanCache cache = new ClonePlanCache(compiler, newClonePlanCacheConfigurationBuilder().build());
    ClonePlan prewarmed = mock(ClonePlan.class);

    assertThat(cache.administration().tryAddLimitedCache(StringBuilder.class, prewarmed), is(true));
    assertThat(cache.resolve(StringBuilder.class), sameInstance(prewarmed));

    verify(compiler, times(0)).compile(StringBuilder.class);
  }
}
