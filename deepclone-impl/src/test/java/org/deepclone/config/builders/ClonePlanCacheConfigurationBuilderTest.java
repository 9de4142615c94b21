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

package org.deepclone.config.builders;

import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.config.EvictionPolicy;
import org.junit.Test;

import java.net.InetAddress;

import static org.deepclone.config.builders.ClonePlanCacheConfigurationBuilder.newClonePlanCacheConfigurationBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class ClonePlanCacheConfigurationBuilderTest {

  @Test
  public void testDefaults() {
    ClonePlanCacheConfiguration configuration = newClonePlanCacheConfigurationBuilder().build();

    assertThat(configuration.getLimitedCacheSize(), is(100));
    assertThat(configuration.isUseLimitedCache(), is(true));
    assertThat(configuration.getEvictionPolicy(), is(EvictionPolicy.LRU));
    assertThat(configuration.getImmutableTypes().isEmpty(), is(true));
  }

  @Test
  public void testZeroSizeDeactivatesLimitedTier() {
    ClonePlanCacheConfiguration configuration = newClonePlanCacheConfigurationBuilder().limitedCacheSize(0).build();

    assertThat(configuration.getLimitedCacheSize(), is(0));
    assertThat(configuration.isUseLimitedCache(), is(false));
  }

  @Test
  public void testUnlimitedKeepsSize() {
    ClonePlanCacheConfiguration configuration = newClonePlanCacheConfigurationBuilder()
      .limitedCacheSize(20)
      .unlimitedCache()
      .evictionPolicy(EvictionPolicy.FIFO)
      .build();

    assertThat(configuration.getLimitedCacheSize(), is(20));
    assertThat(configuration.isUseLimitedCache(), is(false));
    assertThat(configuration.getEvictionPolicy(), is(EvictionPolicy.FIFO));
  }

  @Test
  public void testNegativeSizeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> newClonePlanCacheConfigurationBuilder().limitedCacheSize(-1));
  }

  @Test
  public void testNullArgumentsAreRejected() {
    assertThrows(NullPointerException.class, () -> newClonePlanCacheConfigurationBuilder().evictionPolicy(null));
    assertThrows(NullPointerException.class, () -> newClonePlanCacheConfigurationBuilder().withImmutableType(null));
  }

  @Test
  public void testBuildersAreImmutable() {
    ClonePlanCacheConfigurationBuilder base = newClonePlanCacheConfigurationBuilder();
    ClonePlanCacheConfigurationBuilder derived = base.withImmutableType(InetAddress.class).limitedCacheSize(5);

    assertThat(base.build().getImmutableTypes().isEmpty(), is(true));
    assertThat(base.build().getLimitedCacheSize(), is(100));
    assertThat(derived.build().getImmutableTypes(), hasItem(InetAddress.class));
    assertThat(derived.build().getImmutableTypes().size(), is(1));
    assertThat(derived.build().getLimitedCacheSize(), is(5));
  }

  @Test
  public void testImmutableTypesAreReadOnly() {
    ClonePlanCacheConfiguration configuration = newClonePlanCacheConfigurationBuilder().withImmutableType(InetAddress.class).build();
    assertThrows(UnsupportedOperationException.class, () -> configuration.getImmutableTypes().add(Object.class));
  }
}
