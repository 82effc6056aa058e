/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.stratadb.engine.commit;

import com.stratadb.exception.CommitInterruptedException;
import com.stratadb.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitAdmissionGateTest {

  @Test
  void singlePermit() throws Exception {
    assertThat(maxConcurrency(CommitAdmissionGate.create(1), 8)).isEqualTo(1);
  }

  @Test
  void threePermits() throws Exception {
    final int max = maxConcurrency(CommitAdmissionGate.create(3), 12);
    assertThat(max).isBetween(1, 3);
  }

  @Test
  void threePermitsAdmitThreeAtOnceAndHoldTheFourth() throws Exception {
    final CommitAdmissionGate gate = CommitAdmissionGate.create(3);
    final CyclicBarrier allInside = new CyclicBarrier(4);
    final CountDownLatch release = new CountDownLatch(1);

    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<?>> holders = new ArrayList<>();
      for (int i = 0; i < 3; i++)
        holders.add(executor.submit(() -> {
          try (final CommitAdmissionGate.Permit permit = gate.enter()) {
            allInside.await(10, TimeUnit.SECONDS);
            release.await(10, TimeUnit.SECONDS);
          }
          return null;
        }));

      // THE THREE HOLDERS ARE INSIDE AT THE SAME TIME
      allInside.await(10, TimeUnit.SECONDS);

      final Future<?> fourth = executor.submit(() -> {
        gate.enter().close();
        return null;
      });
      assertThatThrownBy(() -> fourth.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

      release.countDown();
      for (Future<?> f : holders)
        f.get(10, TimeUnit.SECONDS);
      fourth.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void unboundedAdmitsEveryone() throws Exception {
    final CommitAdmissionGate gate = CommitAdmissionGate.create(null);
    assertThat(gate.getMaxPermits()).isEqualTo(CommitAdmissionGate.UNBOUNDED);

    final int threads = 8;
    // EVERY THREAD WAITS FOR THE OTHERS WHILE HOLDING ITS PERMIT: ONLY POSSIBLE WITHOUT A LIMIT
    final CyclicBarrier barrier = new CyclicBarrier(threads);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++)
        futures.add(executor.submit(() -> {
          try (final CommitAdmissionGate.Permit permit = gate.enter()) {
            barrier.await(10, TimeUnit.SECONDS);
          }
          return null;
        }));
      for (Future<?> f : futures)
        f.get(20, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void permitsLowerThanOne() {
    assertThatThrownBy(() -> CommitAdmissionGate.create(0)).isInstanceOf(ConfigurationException.class)
        .hasMessage("Property [stratadb.commitPermits] is less than 1. 0");
    assertThatThrownBy(() -> CommitAdmissionGate.create(-5)).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void interruptedWhileWaiting() throws Exception {
    final CommitAdmissionGate gate = CommitAdmissionGate.create(1);
    final CommitAdmissionGate.Permit held = gate.enter();

    final AtomicReference<Throwable> error = new AtomicReference<>();
    final AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
    final Thread waiter = new Thread(() -> {
      try {
        gate.enter().close();
      } catch (Throwable e) {
        error.set(e);
        interruptFlag.set(Thread.currentThread().isInterrupted());
      }
    });
    waiter.start();

    while (waiter.getState() != Thread.State.WAITING)
      Thread.sleep(5);

    waiter.interrupt();
    waiter.join(10_000);

    assertThat(error.get()).isInstanceOf(CommitInterruptedException.class);
    assertThat(interruptFlag.get()).isTrue();

    held.close();

    // THE INTERRUPTED WAITER DID NOT KEEP A PERMIT
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      executor.submit(() -> gate.enter().close()).get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void permitIsReleasedOnce() throws Exception {
    final CommitAdmissionGate gate = CommitAdmissionGate.create(1);
    final CommitAdmissionGate.Permit permit = gate.enter();
    permit.close();
    permit.close();

    // A DOUBLE RELEASE WOULD LET TWO HOLDERS IN
    assertThat(maxConcurrency(gate, 6)).isEqualTo(1);
  }

  private static int maxConcurrency(final CommitAdmissionGate gate, final int threads) throws Exception {
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger max = new AtomicInteger();

    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++)
        futures.add(executor.submit(() -> {
          for (int k = 0; k < 5; k++)
            try (final CommitAdmissionGate.Permit permit = gate.enter()) {
              max.accumulateAndGet(running.incrementAndGet(), Math::max);
              Thread.sleep(2);
              running.decrementAndGet();
            }
          return null;
        }));
      for (Future<?> f : futures)
        f.get(60, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
    return max.get();
  }
}
