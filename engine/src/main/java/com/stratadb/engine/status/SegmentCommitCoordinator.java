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

import com.stratadb.engine.AtomicFileOperation;
import com.stratadb.engine.StoreContext;
import com.stratadb.engine.commit.CommitAdmissionGate;
import com.stratadb.exception.DataLoadingException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.exception.StrataException;
import com.stratadb.log.LogManager;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * Publishes the table status. Every commit writes the complete list of segment records to a temporary file and renames it over the
 * table status file, so readers see either the previous list or the new one. Commits run under the {@link CommitAdmissionGate}.
 * <p>
 * Commits of the same table status file are serialized across all the coordinators of the JVM: the permit is taken first, then
 * the lock of the file. The {@link #beginSegment(Path)} and {@link #completeSegment(Path, String, SegmentStatus)} read-modify-write
 * cycles hold both for the whole cycle.
 */
public class SegmentCommitCoordinator {
  private static final ConcurrentHashMap<Path, Object> MANIFEST_LOCKS = new ConcurrentHashMap<>();

  private final CommitAdmissionGate gate;
  private final Charset             charset;

  public SegmentCommitCoordinator(final StoreContext context) {
    this(context.getCommitGate(), context.getConfiguration().getCharset());
  }

  public SegmentCommitCoordinator(final CommitAdmissionGate gate, final Charset charset) {
    this.gate = gate;
    this.charset = charset;
  }

  /**
   * Replaces the table status with the given records, which must be the whole history: the existing records, updated, plus the
   * new ones.
   *
   * @throws DataLoadingException                                 if the content cannot be serialized or written, or if the list
   *                                                              drops a segment committed as {@link SegmentStatus#SUCCESS}. The
   *                                                              previous table status is left untouched
   * @throws com.stratadb.exception.CommitInterruptedException if interrupted while waiting for a permit
   */
  public void commitSegment(final Path manifestFile, final List<SegmentRecord> records) {
    try (final CommitAdmissionGate.Permit permit = gate.enter()) {
      synchronized (lockFor(manifestFile)) {
        writeTableStatus(manifestFile, records);
      }
    }
  }

  /**
   * Returns the records of the table status, empty if the table has none yet.
   */
  public List<SegmentRecord> readTableStatus(final Path manifestFile) {
    try {
      return TableStatusManifest.read(manifestFile, charset).getRecords();
    } catch (IOException e) {
      throw new DataLoadingException(ErrorCode.IO_ERROR, "Error on reading the table status '" + manifestFile + "'", e);
    }
  }

  /**
   * Appends an {@link SegmentStatus#IN_PROGRESS} record with the next load id and commits it.
   *
   * @return the new record
   */
  public SegmentRecord beginSegment(final Path manifestFile) {
    final SegmentRecord record;
    try (final CommitAdmissionGate.Permit permit = gate.enter()) {
      synchronized (lockFor(manifestFile)) {
        final List<SegmentRecord> records = readTableStatus(manifestFile);
        final String loadId = new TableStatusManifest(records).getNextLoadId();

        record = SegmentRecord.inProgress(loadId, System.currentTimeMillis());
        records.add(record);
        writeTableStatus(manifestFile, records);
      }
    }

    LogManager.instance().log(this, Level.INFO, "Started segment %s", null, record.getLoadId());
    return record.copy();
  }

  /**
   * Sets the final status and end time of a record and commits the table status.
   *
   * @return the updated record
   */
  public SegmentRecord completeSegment(final Path manifestFile, final String loadId, final SegmentStatus status) {
    SegmentRecord record = null;
    try (final CommitAdmissionGate.Permit permit = gate.enter()) {
      synchronized (lockFor(manifestFile)) {
        final List<SegmentRecord> records = readTableStatus(manifestFile);

        for (SegmentRecord r : records)
          if (r.getLoadId().equals(loadId)) {
            record = r;
            break;
          }

        if (record == null)
          throw new DataLoadingException("Segment " + loadId + " not found in table status '" + manifestFile + "'");

        record.complete(status, System.currentTimeMillis());
        writeTableStatus(manifestFile, records);
      }
    }

    LogManager.instance().log(this, Level.INFO, "Segment %s completed with status '%s'", null, loadId, status);
    return record.copy();
  }

  public CommitAdmissionGate getGate() {
    return gate;
  }

  /**
   * Writes the serialized table status to the temporary file.
   */
  protected void writeManifest(final OutputStream out, final byte[] content) throws IOException {
    out.write(content);
  }

  /**
   * Checks the new records against the current table status and replaces it. The caller holds the permit and the file lock.
   */
  private void writeTableStatus(final Path manifestFile, final List<SegmentRecord> records) {
    try {
      final TableStatusManifest previous = TableStatusManifest.read(manifestFile, charset);
      checkNoCommittedSegmentIsDropped(previous, records);

      final byte[] content = new TableStatusManifest(records).serialize(charset);

      try (final AtomicFileOperation operation = new AtomicFileOperation(manifestFile)) {
        writeManifest(operation.openForWrite(), content);
        operation.commit();
      }

      LogManager.instance().log(this, Level.FINE, "Committed table status '%s' with %d segments", null, manifestFile, records.size());

    } catch (IOException e) {
      final DataLoadingException exception = new DataLoadingException("Error on writing the table status", e);
      exception.addContext("file", manifestFile);
      throw exception;
    } catch (StrataException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DataLoadingException(ErrorCode.SERIALIZATION_ERROR, "Error on serializing the table status", e);
    }
  }

  private static Object lockFor(final Path manifestFile) {
    return MANIFEST_LOCKS.computeIfAbsent(manifestFile.toAbsolutePath().normalize(), k -> new Object());
  }

  private static void checkNoCommittedSegmentIsDropped(final TableStatusManifest previous, final List<SegmentRecord> records) {
    final Set<String> loadIds = new HashSet<>();
    for (SegmentRecord r : records)
      loadIds.add(r.getLoadId());

    for (SegmentRecord r : previous.getRecords())
      if (r.getStatus() == SegmentStatus.SUCCESS && !loadIds.contains(r.getLoadId()))
        throw new DataLoadingException(ErrorCode.COMMIT_REJECTED,
            "The new table status drops the committed segment " + r.getLoadId());
  }
}
