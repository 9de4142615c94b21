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

import org.deepclone.spi.serialization.Serializer;
import org.deepclone.spi.serialization.SerializerException;
import org.junit.Test;

import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class SerializingCopierTest {

  @Test
  public void testNullCopiesToNullWithoutSerializing() {
    @SuppressWarnings("unchecked")
    Serializer<String> serializer = mock(Serializer.class);

    assertThat(new SerializingCopier<>(serializer).copy(null), nullValue());
    verifyNoInteractions(serializer);
  }

  @Test
  public void testEmptyReadIsAFailure() throws Exception {
    @SuppressWarnings("unchecked")
    Serializer<String> serializer = mock(Serializer.class);
    ByteBuffer buff = ByteBuffer.wrap(new byte[] {1, 2, 3});
    when(serializer.serialize("foo")).thenReturn(buff);
    when(serializer.read(buff)).thenReturn(null);

    SerializerException e = assertThrows(SerializerException.class, () -> new SerializingCopier<>(serializer).copy("foo"));
    assertThat(e.getMessage(), containsString("Unable to deserialize"));
  }

  @Test
  public void testMissingClassSurfacesAsSerializerException() throws Exception {
    @SuppressWarnings("unchecked")
    Serializer<String> serializer = mock(Serializer.class);
    ByteBuffer buff = ByteBuffer.allocate(0);
    when(serializer.serialize("foo")).thenReturn(buff);
    when(serializer.read(buff)).thenThrow(new ClassNotFoundException("gone"));

    SerializerException e = assertThrows(SerializerException.class, () -> new SerializingCopier<>(serializer).copy("foo"));
    assertThat(e.getCause(), instanceOf(ClassNotFoundException.class));
  }

  @Test
  public void testJavaSerializationCopiesTheGraph() {
    Account account = new Account("savings");
    account.history.add("opened");
    account.session = "cached";
    account.self = account;

    Account copy = SerializingCopier.javaSerialization(Account.class).copy(account);

    assertThat(copy, not(sameInstance(account)));
    assertThat(copy.name, is("savings"));
    assertThat(copy.history, is(account.history));
    assertThat(copy.history, not(sameInstance(account.history)));
    assertThat(copy.self, sameInstance(copy));
    assertThat(copy.session, nullValue());
  }

  @Test
  public void testUnserializableNodeFails() {
    Account account = new Account("checking");
    account.attachment = new Object();

    assertThrows(SerializerException.class, () -> SerializingCopier.javaSerialization(Account.class).copy(account));
  }

  @Test(expected = NullPointerException.class)
  public void testSerializerIsRequired() {
    new SerializingCopier<>(null);
  }

  static class Account implements Serializable {
    private static final long serialVersionUID = 1L;

    final String name;
    final List<String> history = new ArrayList<>();
    Account self;
    Object attachment;
    transient String session;

    Account(String name) {
      this.name = name;
    }
  }
}
