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

import com.stratadb.GlobalConfiguration;
import com.stratadb.exception.CommitInterruptedException;
import com.stratadb.exception.ConfigurationException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds the number of segment commits running at the same time. Created once per process by the {@link
 * com.stratadb.engine.StoreContext} and handed to the components that commit.
 * <p>
 * Usage:
 * <pre>
 * try (CommitAdmissionGate.Permit permit = gate.enter()) {
 *   // commit
 * }
 * </pre>
 */
public abstract class CommitAdmissionGate {
  public static final int UNBOUNDED = -1;

  /**
   * Creates the gate.
   *
   * @param permits maximum number of concurrent commits, null for no limit
   *
   * @throws ConfigurationException if permits is lower than 1
   */
  public static CommitAdmissionGate create(final Integer permits) {
    if (permits == null)
      return new Unbounded();

    if (permits < 1)
      throw new ConfigurationException("Property [" + GlobalConfiguration.COMMIT_PERMITS.getKey() + "] is less than 1. " + permits);

    return new Bounded(permits);
  }

  /**
   * Waits for a permit.
   *
   * @throws CommitInterruptedException if the thread is interrupted while waiting. No permit is held in that case and the
   *                                    interrupt flag of the thread is set again
   */
  public abstract void acquire();

  /**
   * Returns a permit taken with {@link #acquire()}.
   */
  public abstract void release();

  /**
   * Returns the maximum number of concurrent commits, {@link #UNBOUNDED} if there is no limit.
   */
  public abstract int getMaxPermits();

  /**
   * Acquires a permit that is released when the returned handle is closed.
   */
  public Permit enter() {
    acquire();
    return new Permit(this);
  }

  /**
   * A permit held by the caller. Closing it more than once releases the permit once.
   */
  public static final class Permit implements AutoCloseable {
    private final CommitAdmissionGate gate;
    private final AtomicBoolean       released = new AtomicBoolean(false);

    private Permit(final CommitAdmissionGate gate) {
      this.gate = gate;
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true))
        gate.release();
    }
  }

  private static final class Unbounded extends CommitAdmissionGate {
    @Override
    public void acquire() {
      // ALWAYS ADMITTED
    }

    @Override
    public void release() {
      // NO PERMITS TO RETURN
    }

    @Override
    public int getMaxPermits() {
      return UNBOUNDED;
    }

    @Override
    public String toString() {
      return "CommitAdmissionGate{unbounded}";
    }
  }

  private static final class Bounded extends CommitAdmissionGate {
    private final Semaphore semaphore;
    private final int       maxPermits;

    private Bounded(final int permits) {
      this.maxPermits = permits;
      this.semaphore = new Semaphore(permits);
    }

    @Override
    public void acquire() {
      try {
        semaphore.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CommitInterruptedException("Interrupted while waiting for a commit permit", e);
      }
    }

    @Override
    public void release() {
      semaphore.release();
    }

    @Override
    public int getMaxPermits() {
      return maxPermits;
    }

    @Override
    public String toString() {
      return "CommitAdmissionGate{permits=" + maxPermits + ", available=" + semaphore.availablePermits() + "}";
    }
  }
}
