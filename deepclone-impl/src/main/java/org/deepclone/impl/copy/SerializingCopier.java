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

import org.deepclone.impl.serialization.PlainJavaSerializer;
import org.deepclone.spi.copy.Copier;
import org.deepclone.spi.serialization.Serializer;
import org.deepclone.spi.serialization.SerializerException;

import java.nio.ByteBuffer;

/**
 * {@link Copier} producing deep clones by writing the instance out and reading it back.
 * <p>
 * Unlike the reflective cloner, this path honours the serialization contract of the copied graph:
 * {@code transient} fields come back at their default values and {@code readObject}/{@code readResolve}
 * hooks run. Every node of the graph must be serializable by the configured {@link Serializer}.
 * <p>
 * {@code null} copies to {@code null} without involving the serializer.
 */
public final class SerializingCopier<T> implements Copier<T> {

  private final Serializer<T> serializer;

  /**
   * Creates a copier using plain Java serialization, resolving classes through the loader of {@code type}.
   *
   * @param type the type of the instances to copy
   * @param <T> the type of the instances to copy
   * @return a new copier
   */
  public static <T> SerializingCopier<T> javaSerialization(Class<T> type) {
    ClassLoader loader = type.getClassLoader();
    return new SerializingCopier<>(loader == null ? new PlainJavaSerializer<>() : new PlainJavaSerializer<>(loader));
  }

  /**
   * Creates a copier that round trips instances through {@code serializer}.
   *
   * @param serializer the serializer to use
   */
  public SerializingCopier(Serializer<T> serializer) {
    if (serializer == null) {
      throw new NullPointerException("Serializer cannot be null");
    }
    this.serializer = serializer;
  }

  /**
   * Returns a deep copy of {@code obj}.
   *
   * @throws SerializerException if the instance cannot be written, or reading it back fails or yields nothing
   */
  @Override
  public T copy(final T obj) {
    if (obj == null) {
      return null;
    }
    ByteBuffer written = serializer.serialize(obj);
    T copy;
    try {
      copy = serializer.read(written);
    } catch (ClassNotFoundException e) {
      throw new SerializerException("Unable to resolve class of cloned " + obj.getClass().getName(), e);
    }
    if (copy == null) {
      throw new SerializerException("Unable to deserialize cloned " + obj.getClass().getName());
    }
    return copy;
  }

  public Serializer<T> getSerializer() {
    return serializer;
  }
}
