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

package org.deepclone.impl.serialization;

import org.deepclone.spi.serialization.Serializer;
import org.deepclone.spi.serialization.SerializerException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link Serializer} based on Java serialization, resolving classes through a given class loader.
 */
public class PlainJavaSerializer<T> implements Serializer<T> {

  private final ClassLoader classLoader;

  public PlainJavaSerializer() {
    this(PlainJavaSerializer.class.getClassLoader());
  }

  public PlainJavaSerializer(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  @Override
  public ByteBuffer serialize(T object) {
    ByteArrayOutputStream bout = new ByteArrayOutputStream();
    try (ObjectOutputStream oout = new ObjectOutputStream(bout)) {
      oout.writeObject(object);
    } catch (IOException e) {
      throw new SerializerException(e);
    }
    return ByteBuffer.wrap(bout.toByteArray());
  }

  @SuppressWarnings("unchecked")
  @Override
  public T read(ByteBuffer entry) throws SerializerException, ClassNotFoundException {
    byte[] bytes = new byte[entry.remaining()];
    entry.duplicate().get(bytes);
    try (OIS ois = new OIS(new ByteArrayInputStream(bytes), classLoader)) {
      return (T) ois.readObject();
    } catch (IOException e) {
      throw new SerializerException(e);
    }
  }

  private static class OIS extends ObjectInputStream {

    private static final Map<String, Class<?>> PRIMITIVE_CLASSES = new HashMap<>();
    static {
      PRIMITIVE_CLASSES.put("boolean", boolean.class);
      PRIMITIVE_CLASSES.put("byte", byte.class);
      PRIMITIVE_CLASSES.put("char", char.class);
      PRIMITIVE_CLASSES.put("double", double.class);
      PRIMITIVE_CLASSES.put("float", float.class);
      PRIMITIVE_CLASSES.put("int", int.class);
      PRIMITIVE_CLASSES.put("long", long.class);
      PRIMITIVE_CLASSES.put("short", short.class);
      PRIMITIVE_CLASSES.put("void", void.class);
    }

    private final ClassLoader classLoader;

    OIS(InputStream in, ClassLoader classLoader) throws IOException {
      super(in);
      this.classLoader = classLoader;
    }

    @Override
    protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
      try {
        return Class.forName(desc.getName(), false, classLoader);
      } catch (ClassNotFoundException cnfe) {
        Class<?> primitive = PRIMITIVE_CLASSES.get(desc.getName());
        if (primitive != null) {
          return primitive;
        }
        throw cnfe;
      }
    }
  }
}
