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
package com.stratadb.engine.status;

/**
 * Status of a segment in the table status. The label is the form stored in the file.
 */
public enum SegmentStatus {
  SUCCESS("Success"),
  FAILURE("Failure"),
  PARTIAL_SUCCESS("Partial Success"),
  IN_PROGRESS("In Progress"),
  MARKED_FOR_DELETE("Marked for Delete"),
  COMPACTED("Compacted");

  private final String label;

  SegmentStatus(final String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Returns the status by its label or its name, case insensitive.
   */
  public static SegmentStatus fromLabel(final String label) {
    for (SegmentStatus s : values())
      if (s.label.equalsIgnoreCase(label) || s.name().equalsIgnoreCase(label))
        return s;
    throw new IllegalArgumentException("Unknown segment status '" + label + "'");
  }

  @Override
  public String toString() {
    return label;
  }
}
