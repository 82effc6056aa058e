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

import com.stratadb.serializer.json.JSONObject;

import java.util.Objects;

/**
 * One entry of the table status: a load, the segment it produced and the outcome. Created when the load starts, then updated with
 * the final status and end time when it completes.
 */
public final class SegmentRecord {
  public static final long NOT_ENDED = -1L;

  private final String        loadId;
  private final long          startTime;
  private       long          endTime;
  private       SegmentStatus status;

  public SegmentRecord(final String loadId, final long startTime, final long endTime, final SegmentStatus status) {
    if (loadId == null || loadId.isBlank())
      throw new IllegalArgumentException("Load id is empty");
    this.loadId = loadId;
    this.startTime = startTime;
    this.endTime = endTime;
    this.status = Objects.requireNonNull(status, "status");
  }

  public static SegmentRecord inProgress(final String loadId, final long startTime) {
    return new SegmentRecord(loadId, startTime, NOT_ENDED, SegmentStatus.IN_PROGRESS);
  }

  public String getLoadId() {
    return loadId;
  }

  public long getStartTime() {
    return startTime;
  }

  public long getEndTime() {
    return endTime;
  }

  public SegmentStatus getStatus() {
    return status;
  }

  public void complete(final SegmentStatus status, final long endTime) {
    this.status = Objects.requireNonNull(status, "status");
    this.endTime = endTime;
  }

  /**
   * True if the segment data can be read by queries.
   */
  public boolean isVisible() {
    return status == SegmentStatus.SUCCESS || status == SegmentStatus.PARTIAL_SUCCESS;
  }

  public SegmentRecord copy() {
    return new SegmentRecord(loadId, startTime, endTime, status);
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    json.put("loadId", loadId);
    json.put("startTime", startTime);
    json.put("endTime", endTime);
    json.put("status", status.getLabel());
    return json;
  }

  public static SegmentRecord fromJSON(final JSONObject json) {
    return new SegmentRecord(json.getString("loadId"), json.getLong("startTime"),
        json.isNull("endTime") ? NOT_ENDED : json.getLong("endTime"), SegmentStatus.fromLabel(json.getString("status")));
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof SegmentRecord))
      return false;
    final SegmentRecord that = (SegmentRecord) o;
    return startTime == that.startTime && endTime == that.endTime && loadId.equals(that.loadId) && status == that.status;
  }

  @Override
  public int hashCode() {
    return Objects.hash(loadId, startTime, endTime, status);
  }

  @Override
  public String toString() {
    return "Segment_" + loadId + "(" + status + ")";
  }
}
