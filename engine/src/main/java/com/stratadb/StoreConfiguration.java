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
package com.stratadb;

import com.stratadb.exception.ConfigurationException;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Objects;

/**
 * Immutable settings of the load path, resolved once from a {@link ContextConfiguration} and handed to the components that
 * need them.
 */
public final class StoreConfiguration {
  private final Integer commitPermits;
  private final String  memberDefaultValue;
  private final String  nullFormat;
  private final Charset charset;

  public StoreConfiguration(final Integer commitPermits, final String memberDefaultValue, final String nullFormat,
      final Charset charset) {
    this.commitPermits = commitPermits;
    this.memberDefaultValue = Objects.requireNonNull(memberDefaultValue, "memberDefaultValue");
    this.nullFormat = Objects.requireNonNull(nullFormat, "nullFormat");
    this.charset = Objects.requireNonNull(charset, "charset");
  }

  /**
   * Resolves the settings from the global configuration only.
   */
  public static StoreConfiguration fromGlobal() {
    return from(new ContextConfiguration());
  }

  /**
   * Resolves the settings from the context, falling back to the global values.
   *
   * @throws ConfigurationException if a value cannot be parsed
   */
  public static StoreConfiguration from(final ContextConfiguration context) {
    final Integer permits = parsePermits(context.getValue(GlobalConfiguration.COMMIT_PERMITS));

    final String charsetName = context.getValueAsString(GlobalConfiguration.DICTIONARY_CHARSET);
    final Charset charset;
    try {
      charset = Charset.forName(charsetName);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new ConfigurationException("Property [" + GlobalConfiguration.DICTIONARY_CHARSET.getKey() + "] is not a supported charset: " + charsetName, e);
    }

    return new StoreConfiguration(permits, context.getValueAsString(GlobalConfiguration.MEMBER_DEFAULT_VALUE),
        context.getValueAsString(GlobalConfiguration.SERIALIZATION_NULL_FORMAT), charset);
  }

  private static Integer parsePermits(final Object value) {
    if (value == null)
      return null;
    if (value instanceof Number)
      return ((Number) value).intValue();

    final String text = value.toString().trim();
    if (text.isEmpty())
      return null;

    try {
      return Integer.valueOf(text);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Property [" + GlobalConfiguration.COMMIT_PERMITS.getKey() + "] format error. " + text, e);
    }
  }

  /**
   * Returns the configured number of commit permits, or null if commits are not bounded.
   */
  public Integer getCommitPermits() {
    return commitPermits;
  }

  public String getMemberDefaultValue() {
    return memberDefaultValue;
  }

  public String getNullFormat() {
    return nullFormat;
  }

  public Charset getCharset() {
    return charset;
  }

  public StoreConfiguration withCommitPermits(final Integer permits) {
    return new StoreConfiguration(permits, memberDefaultValue, nullFormat, charset);
  }

  @Override
  public String toString() {
    return "StoreConfiguration{commitPermits=" + commitPermits + ", memberDefaultValue='" + memberDefaultValue + "', nullFormat='"
        + nullFormat + "', charset=" + charset + '}';
  }
}
