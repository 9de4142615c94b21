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
 * Thrown when a storage location of a type cannot be read or written, or when an instance cannot be allocated, even
 * through the low-level access the engine relies on.
 */
public class MemberAccessException extends DeepCloneException {

  private static final long serialVersionUID = -2468123508853912870L;

  /**
   * Creates a {@code MemberAccessException} with the provided message and cause.
   *
   * @param message information about the exception
   * @param cause the cause of this exception
   */
  public MemberAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
