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

package org.deepclone.impl.config;

import org.deepclone.config.ClonePlanCacheConfiguration;
import org.deepclone.config.EvictionPolicy;
import org.junit.After;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class ClonePlanCachePropertiesTest {

  @After
  public void tearDown() {
    System.clearProperty(ClonePlanCacheProperties.PATH_PREFIX + ClonePlanCacheProperties.LIMITED_CACHE_SIZE_PROPERTY);
    System.clearProperty(ClonePlanCacheProperties.PATH_PREFIX + ClonePlanCacheProperties.USE_LIMITED_CACHE_PROPERTY);
    System.clearProperty(ClonePlanCacheProperties.PATH_PREFIX + ClonePlanCacheProperties.EVICTION_POLICY_PROPERTY);
  }

  @Test
  public void testDefaults() {
    ClonePlanCacheConfiguration configuration = ClonePlanCacheProperties.fromSystemProperties();

    assertThat(configuration.getLimitedCacheSize(), is(100));
    assertThat(configuration.isUseLimitedCache(), is(true));
    assertThat(configuration.getEvictionPolicy(), is(EvictionPolicy.LRU));
  }

  @Test
  public void testOverrides() {
    System.setProperty("org.deepclone.cache.limitedCacheSize", "25");
    System.setProperty("org.deepclone.cache.useLimitedCache", "false");
    System.setProperty("org.deepclone.cache.evictionPolicy", "fifo");

    ClonePlanCacheConfiguration configuration = ClonePlanCacheProperties.fromSystemProperties();

    assertThat(configuration.getLimitedCacheSize(), is(25));
    assertThat(configuration.isUseLimitedCache(), is(false));
    assertThat(configuration.getEvictionPolicy(), is(EvictionPolicy.FIFO));
  }

  @Test
  public void testZeroSizeDeactivatesLimitedTier() {
    System.setProperty("org.deepclone.cache.limitedCacheSize", "0");

    assertThat(ClonePlanCacheProperties.fromSystemProperties().isUseLimitedCache(), is(false));
  }

  @Test
  public void testInvalidValuesAreRejected() {
    System.setProperty("org.deepclone.cache.limitedCacheSize", "many");
    assertThrows(IllegalArgumentException.class, ClonePlanCacheProperties::fromSystemProperties);

    System.setProperty("org.deepclone.cache.limitedCacheSize", "-2");
    assertThrows(IllegalArgumentException.class, ClonePlanCacheProperties::fromSystemProperties);

    System.clearProperty("org.deepclone.cache.limitedCacheSize");
    System.setProperty("org.deepclone.cache.evictionPolicy", "random");
    assertThrows(IllegalArgumentException.class, ClonePlanCacheProperties::fromSystemProperties);
  }
}
