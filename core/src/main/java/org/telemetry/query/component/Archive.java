/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import org.telemetry.query.data.Selection;

/** Bulk storage that materializes the rows behind a set of hits. */
public interface Archive extends Monitorable {

  /** Announces a client that wants materialized rows pushed to it. */
  void register(ArchiveClient client);

  /**
   * Materializes the rows with the given ids. The archive answers with zero or more batches and a
   * done signal to {@code replyTo}.
   *
   * @param hits global row ids
   * @param replyTo receiver of the batches and the done signal
   */
  void lookup(Selection hits, ArchiveClient replyTo);
}
