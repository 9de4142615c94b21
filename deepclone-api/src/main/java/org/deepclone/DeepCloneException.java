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

package org.deepclone;

/**
 * Base type of the failures raised while duplicating an object graph.
 * <p>
 * A clone operation either returns a fully populated copy or throws: no partially populated copy is ever handed back
 * to the caller.
 */
public class DeepCloneException extends RuntimeException {

  private static final long serialVersionUID = 3182706493312867451L;

  /**
   * Creates a {@code DeepCloneException} with the provided message.
   *
   * @param message information about the exception
   */
  public DeepCloneException(String message) {
    super(message);
  }

  /**
   * Creates a {@code DeepCloneException} with the provided message and cause.
   *
   * @param message information about the exception
   * @param cause the cause of this exception
   */
  public DeepCloneException(String message, Throwable cause) {
    super(message, cause);
  }
}
