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

import org.deepclone.spi.clone.ClonePlan;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.deepclone.config.builders.ClonePlanCacheConfigurationBuilder.newClonePlanCacheConfigurationBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

public class ConcurrentDeepCloneTest {

  @Test
  public void testConcurrentClonesShareOnePlanPerType() throws Exception {
    DefaultDeepCloner cloner = new DefaultDeepCloner(newClonePlanCacheConfigurationBuilder().limitedCacheSize(0).build());
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Cell>> results = new ArrayList<>();
      List<Cell> sources = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Cell source = new Cell(i);
        source.next = new Cell(i + 100);
        source.next.next = source;
        sources.add(source);
        results.add(executor.submit((Callable<Cell>) () -> {
          start.await();
          return cloner.deepClone(source);
        }));
      }
      start.countDown();

      for (int i = 0; i < threads; i++) {
        Cell clone = results.get(i).get(10, TimeUnit.SECONDS);
        assertThat(clone, not(sameInstance(sources.get(i))));
        assertThat(clone.value, is(i));
        assertThat(clone.next.value, is(i + 100));
        assertThat(clone.next.next, sameInstance(clone));
      }
    } finally {
      executor.shutdownNow();
    }

    ClonePlan plan = cloner.planCache().getCache().get(Cell.class);
    assertThat(cloner.planCache().getCache().size(), is(1));
    assertThat(cloner.deepClone(new Cell(0)) != null, is(true));
    assertThat(cloner.planCache().getCache().get(Cell.class), sameInstance(plan));
  }

  static class Cell {
    final int value;
    Cell next;

    Cell(int value) {
      this.value = value;
    }
  }
}
