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

import com.stratadb.exception.DataLoadingException;
import com.stratadb.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableStatusManifestTest {

  @Test
  void serializeAndParse() {
    final SegmentRecord done = new SegmentRecord("0", 1000L, 2000L, SegmentStatus.SUCCESS);
    final SegmentRecord running = SegmentRecord.inProgress("1", 3000L);

    final TableStatusManifest manifest = new TableStatusManifest(List.of(done, running));
    final String json = new String(manifest.serialize(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

    assertThat(json).contains("\"status\":\"Success\"").contains("\"status\":\"In Progress\"");

    final TableStatusManifest parsed = TableStatusManifest.parse(json);
    assertThat(parsed.getRecords()).containsExactly(done, running);
    assertThat(parsed.getRecord("1").getEndTime()).isEqualTo(SegmentRecord.NOT_ENDED);
    assertThat(parsed.getRecord("7")).isNull();
  }

  @Test
  void recordsAreCopies() {
    final SegmentRecord running = SegmentRecord.inProgress("0", 1L);
    final TableStatusManifest manifest = new TableStatusManifest(List.of(running));

    running.complete(SegmentStatus.FAILURE, 2L);
    manifest.getRecords().get(0).complete(SegmentStatus.SUCCESS, 3L);

    assertThat(manifest.getRecord("0").getStatus()).isEqualTo(SegmentStatus.IN_PROGRESS);
  }

  @Test
  void nextLoadId() {
    assertThat(new TableStatusManifest(List.of()).getNextLoadId()).isEqualTo("0");

    final TableStatusManifest manifest = new TableStatusManifest(List.of(//
        new SegmentRecord("0", 1L, 2L, SegmentStatus.SUCCESS),//
        new SegmentRecord("4", 1L, 2L, SegmentStatus.FAILURE),//
        new SegmentRecord("2.1", 1L, 2L, SegmentStatus.COMPACTED),//
        new SegmentRecord("2", 1L, 2L, SegmentStatus.MARKED_FOR_DELETE)));

    assertThat(manifest.getNextLoadId()).isEqualTo("5");
  }

  @Test
  void visibility() {
    assertThat(new SegmentRecord("0", 1L, 2L, SegmentStatus.SUCCESS).isVisible()).isTrue();
    assertThat(new SegmentRecord("0", 1L, 2L, SegmentStatus.PARTIAL_SUCCESS).isVisible()).isTrue();
    assertThat(SegmentRecord.inProgress("0", 1L).isVisible()).isFalse();
    assertThat(new SegmentRecord("0", 1L, 2L, SegmentStatus.FAILURE).isVisible()).isFalse();
  }

  @Test
  void malformedContent() {
    assertThat(TableStatusManifest.parse("  ").size()).isZero();

    assertThatThrownBy(() -> TableStatusManifest.parse("[{\"loadId\":\"0\",\"startTime\":1,\"endTime\":2,\"status\":\"Unknown\"}]"))
        .isInstanceOf(DataLoadingException.class)
        .extracting(e -> ((DataLoadingException) e).getErrorCode()).isEqualTo(ErrorCode.SERIALIZATION_ERROR);
    assertThatThrownBy(() -> TableStatusManifest.parse("[{\"loadId\":\"0\"")).isInstanceOf(DataLoadingException.class);
    assertThatThrownBy(() -> TableStatusManifest.parse("{\"loadId\":\"0\"}")).isInstanceOf(DataLoadingException.class);
  }
}
