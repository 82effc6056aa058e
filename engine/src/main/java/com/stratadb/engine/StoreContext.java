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
package com.stratadb.engine;

import com.stratadb.StoreConfiguration;
import com.stratadb.engine.commit.CommitAdmissionGate;
import com.stratadb.log.LogManager;

import java.util.logging.Level;

/**
 * Process level state of the load path, owned by the application: the configuration and the commit admission gate. The gate is
 * created on first use, exactly once even when several threads ask for it at the same time.
 */
public class StoreContext {
  private final    StoreConfiguration  configuration;
  private final    Object              lock = new Object();
  private volatile CommitAdmissionGate commitGate;

  public StoreContext(final StoreConfiguration configuration) {
    this.configuration = configuration;
  }

  public StoreConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Returns the commit gate, creating it on first call.
   *
   * @throws com.stratadb.exception.ConfigurationException if the configured number of permits is invalid. The next call tries
   *                                                       again
   */
  public CommitAdmissionGate getCommitGate() {
    CommitAdmissionGate gate = commitGate;
    if (gate == null) {
      synchronized (lock) {
        gate = commitGate;
        if (gate == null) {
          gate = createCommitGate();
          commitGate = gate;
          LogManager.instance().log(this, Level.INFO, "Created %s", null, gate);
        }
      }
    }
    return gate;
  }

  protected CommitAdmissionGate createCommitGate() {
    return CommitAdmissionGate.create(configuration.getCommitPermits());
  }
}
