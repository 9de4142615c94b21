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
import org.deepclone.config.builders.ClonePlanCacheConfigurationBuilder;

import java.util.Locale;

import static org.deepclone.config.builders.ClonePlanCacheConfigurationBuilder.newClonePlanCacheConfigurationBuilder;

/**
 * Reads the process-wide clone plan cache configuration from system properties.
 */
public final class ClonePlanCacheProperties {

  static final String PATH_PREFIX = "org.deepclone.cache.";

  static final String LIMITED_CACHE_SIZE_PROPERTY = "limitedCacheSize";
  private static final int LIMITED_CACHE_SIZE = 100;
  static final String USE_LIMITED_CACHE_PROPERTY = "useLimitedCache";
  private static final boolean USE_LIMITED_CACHE = true;
  static final String EVICTION_POLICY_PROPERTY = "evictionPolicy";
  private static final EvictionPolicy EVICTION_POLICY = EvictionPolicy.LRU;

  private ClonePlanCacheProperties() {}

  /**
   * Builds a configuration from the {@code org.deepclone.cache.*} system properties.
   *
   * @return the configuration
   *
   * @throws IllegalArgumentException if a property holds an invalid value
   */
  public static ClonePlanCacheConfiguration fromSystemProperties() {
    ClonePlanCacheConfigurationBuilder builder = newClonePlanCacheConfigurationBuilder()
      .limitedCacheSize(getIntConfigProperty(LIMITED_CACHE_SIZE_PROPERTY, LIMITED_CACHE_SIZE))
      .evictionPolicy(getEvictionPolicyConfigProperty(EVICTION_POLICY_PROPERTY, EVICTION_POLICY));
    if (!getBooleanConfigProperty(USE_LIMITED_CACHE_PROPERTY, USE_LIMITED_CACHE)) {
      builder = builder.unlimitedCache();
    }
    return builder.build();
  }

  public static int getIntConfigProperty(String property, int defaultValue) {
    String globalPropertyKey = PATH_PREFIX + property;
    String value = System.getProperty(globalPropertyKey, Integer.toString(defaultValue));
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + globalPropertyKey + ": " + value, e);
    }
  }

  public static boolean getBooleanConfigProperty(String property, boolean defaultValue) {
    String globalPropertyKey = PATH_PREFIX + property;
    return Boolean.parseBoolean(System.getProperty(globalPropertyKey, Boolean.toString(defaultValue)));
  }

  public static EvictionPolicy getEvictionPolicyConfigProperty(String property, EvictionPolicy defaultValue) {
    String globalPropertyKey = PATH_PREFIX + property;
    String value = System.getProperty(globalPropertyKey, defaultValue.name());
    try {
      return EvictionPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value for " + globalPropertyKey + ": " + value, e);
    }
  }
}
