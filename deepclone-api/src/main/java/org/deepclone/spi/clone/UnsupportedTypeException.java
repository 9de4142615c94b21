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

package org.deepclone.spi.clone;

import org.deepclone.DeepCloneException;

/**
 * Thrown when the value handed to a clone operation, or the type handed to the plan compiler, carries behavior rather
 * than state: lambdas, method references and method handles.
 * <p>
 * Such values found as members of a larger graph never raise this exception, the corresponding member of the clone
 * is set to {@code null} instead.
 */
public class UnsupportedTypeException extends DeepCloneException {

  private static final long serialVersionUID = 4521659617291359368L;

  private final Class<?> type;

  /**
   * Constructs a new exception for the given type.
   *
   * @param type the unsupported type
   */
  public UnsupportedTypeException(Class<?> type) {
    super("Type " + type.getName() + " is a lambda or method handle type which is unsupported");
    this.type = type;
  }

  /**
   * Returns the type that could not be cloned.
   *
   * @return the unsupported type
   */
  public Class<?> getType() {
    return type;
  }
}
