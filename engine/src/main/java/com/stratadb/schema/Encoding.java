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
package com.stratadb.schema;

/**
 * Encoding flags of a column. A column carries an ordered set of them.
 */
public enum Encoding {
  /**
   * Values are replaced by surrogate keys of a persisted, append-only dictionary.
   */
  DICTIONARY,
  /**
   * Surrogate keys are computed from the calendar value itself. Requires {@link #DICTIONARY} and a calendar type.
   */
  DIRECT_DICTIONARY,
  INVERTED_INDEX
}
