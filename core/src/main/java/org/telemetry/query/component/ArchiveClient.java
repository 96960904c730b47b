/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import org.telemetry.query.data.Batch;

/**
 * Receives materialized rows from the archive: a series of batches followed by exactly one done
 * signal per lookup.
 */
public interface ArchiveClient {

  void onBatch(Batch batch);

  /** Signals that the lookup completed successfully. */
  default void onDone() {
    onDone(null);
  }

  /**
   * Signals that the lookup completed.
   *
   * @param error the failure of the lookup, or null on success
   */
  void onDone(Throwable error);
}
