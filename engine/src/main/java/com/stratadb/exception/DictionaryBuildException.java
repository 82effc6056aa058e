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
package com.stratadb.exception;

/**
 * Exception thrown when appending entries to a column dictionary or persisting its sort index fails.
 * <p>
 * The enclosing load must be aborted: the column dictionary has to be considered corrupt until it is re-read from its last
 * committed state, so callers never retry silently.
 * <p>
 * Example usage:
 * <pre>{@code
 * throw new DictionaryBuildException("Cannot append dictionary entries", e)
 *     .addContext("columnId", columnId);
 * }</pre>
 */
public class DictionaryBuildException extends StrataException {

  public DictionaryBuildException(final String message) {
    super(ErrorCode.DICTIONARY_BUILD_ERROR, message);
  }

  public DictionaryBuildException(final String message, final Throwable cause) {
    super(ErrorCode.DICTIONARY_BUILD_ERROR, message, cause);
  }

  public DictionaryBuildException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public DictionaryBuildException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }
}
