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

/**
 * Cloning strategy selected for a runtime type.
 */
public enum TypeCategory {

  /**
   * Primitive-like values: primitives and their wrappers, enums, numbers, date/time values and records made only of
   * such values. The value itself is its clone.
   */
  VALUE,

  /**
   * Immutable reference types such as {@code String}: the same instance is returned.
   */
  IMMUTABLE,

  /**
   * Executable state: lambdas, method references and method handles. Fails as a root, nulled as a member.
   */
  DELEGATE,

  /**
   * Arrays of any component type.
   */
  ARRAY,

  /**
   * Records holding at least one component that needs cloning, rebuilt through their canonical constructor.
   */
  STRUCT,

  /**
   * Any other concrete type, allocated without construction and filled field by field.
   */
  CLASS
}
