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

import java.lang.invoke.MethodHandle;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Selects the {@link TypeCategory} of runtime types.
 * <p>
 * Results are memoized per type in a concurrent map.
 */
public class TypeClassifier {

  private static final Set<Class<?>> VALUE_TYPES = Set.of(
    Boolean.class, Byte.class, Short.class, Character.class, Integer.class, Long.class, Float.class, Double.class,
    Void.class, BigDecimal.class, BigInteger.class, UUID.class,
    Instant.class, LocalDate.class, LocalTime.class, LocalDateTime.class, OffsetTime.class, OffsetDateTime.class,
    ZonedDateTime.class, Duration.class, Period.class, Year.class, YearMonth.class, MonthDay.class
  );

  private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
    String.class, Class.class, Locale.class, URI.class, Pattern.class
  );

  private final Set<Class<?>> additionalImmutableTypes;
  private final ConcurrentMap<Class<?>, TypeCategory> categories = new ConcurrentHashMap<>();

  public TypeClassifier() {
    this(Collections.emptySet());
  }

  /**
   * Creates a classifier treating {@code additionalImmutableTypes} as immutable, in addition to the built-in ones.
   * <p>
   * A configured type covers its subclasses and, for an interface, its implementations.
   *
   * @param additionalImmutableTypes types whose instances are never cloned
   */
  public TypeClassifier(Set<Class<?>> additionalImmutableTypes) {
    this.additionalImmutableTypes = Set.copyOf(additionalImmutableTypes);
  }

  /**
   * Returns the cloning strategy for values whose runtime type is {@code type}.
   *
   * @param type a runtime type
   * @return its category
   */
  public TypeCategory classify(Class<?> type) {
    TypeCategory category = categories.get(type);
    if (category == null) {
      category = computeCategory(type, new HashSet<>());
      TypeCategory existing = categories.putIfAbsent(type, category);
      if (existing != null) {
        category = existing;
      }
    }
    return category;
  }

  /**
   * Indicates whether every value that a storage location declared as {@code declaredType} can hold is its own clone.
   *
   * @param declaredType the declared type of a field, record component or array component
   * @return {@code true} if values can be copied by reference
   */
  public boolean isPassThrough(Class<?> declaredType) {
    if (declaredType.isPrimitive()) {
      return true;
    }
    TypeCategory category = classify(declaredType);
    return category == TypeCategory.VALUE || category == TypeCategory.IMMUTABLE;
  }

  private boolean isConfiguredImmutable(Class<?> type) {
    for (Class<?> immutable : additionalImmutableTypes) {
      if (immutable.isAssignableFrom(type)) {
        return true;
      }
    }
    return false;
  }

  private TypeCategory computeCategory(Class<?> type, Set<Class<?>> inProgress) {
    if (type.isPrimitive() || VALUE_TYPES.contains(type) || Enum.class.isAssignableFrom(type) || ZoneId.class.isAssignableFrom(type)) {
      return TypeCategory.VALUE;
    } else if (IMMUTABLE_TYPES.contains(type) || isConfiguredImmutable(type)) {
      return TypeCategory.IMMUTABLE;
    } else if (type.isHidden() || MethodHandle.class.isAssignableFrom(type)) {
      return TypeCategory.DELEGATE;
    } else if (type.isArray()) {
      return TypeCategory.ARRAY;
    } else if (type.isRecord()) {
      return hasOnlyValueComponents(type, inProgress) ? TypeCategory.VALUE : TypeCategory.STRUCT;
    } else {
      return TypeCategory.CLASS;
    }
  }

  private boolean hasOnlyValueComponents(Class<?> recordType, Set<Class<?>> inProgress) {
    if (!inProgress.add(recordType)) {
      return true;
    }
    for (RecordComponent component : recordType.getRecordComponents()) {
      Class<?> componentType = component.getType();
      if (componentType.isPrimitive() || inProgress.contains(componentType)) {
        continue;
      }
      TypeCategory category = categories.get(componentType);
      if (category == null) {
        category = computeCategory(componentType, inProgress);
      }
      if (category != TypeCategory.VALUE && category != TypeCategory.IMMUTABLE) {
        return false;
      }
    }
    return true;
  }
}
